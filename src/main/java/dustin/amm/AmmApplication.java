package dustin.amm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AmmApplication {

	public static void main(String[] args) {
		SpringApplication.run(AmmApplication.class, args);
	}

}
