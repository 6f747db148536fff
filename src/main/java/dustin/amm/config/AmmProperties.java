package dustin.amm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import lombok.Data;

/**
 * AMM 코어 설정
 * AMM Core Configuration
 *
 * 설정 방법:
 * - application.properties의 amm.* 키
 * - 환경변수로 오버라이드 가능 (예: AMM_OWNER)
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "amm")
public class AmmProperties {

    /**
     * 코어가 토큰을 보관하는 계정
     * Core custody account
     */
    private String coreAccount = "core";

    /**
     * 프로토콜 수수료 인출 권한자
     * Protocol owner
     */
    private String owner = "owner";

    /**
     * 기본 skipAhead (비트맵 검색 시 추가로 넘어갈 빈 워드 수)
     * Default skip-ahead for swaps
     */
    private int defaultSkipAhead = 0;

    @PostConstruct
    public void validate() {
        if (coreAccount == null || coreAccount.isBlank()) {
            throw new IllegalStateException("amm.core-account must not be blank");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalStateException("amm.owner must not be blank");
        }
        if (defaultSkipAhead < 0) {
            throw new IllegalStateException(
                    String.format("amm.default-skip-ahead must be non-negative: %d", defaultSkipAhead));
        }
    }
}
