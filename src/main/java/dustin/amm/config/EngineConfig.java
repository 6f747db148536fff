package dustin.amm.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dustin.amm.domains.engine.runtime.AmmCore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 엔진 설정
 * Engine Configuration
 *
 * 엔진 클래스는 Spring에 의존하지 않으므로 여기서 직접 생성합니다.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class EngineConfig {

    private final AmmProperties properties;

    /**
     * AMM 코어 (싱글톤, 싱글 스레드 사용)
     */
    @Bean
    public AmmCore ammCore() {
        log.info("[EngineConfig] AmmCore 생성: coreAccount={}, owner={}",
                properties.getCoreAccount(), properties.getOwner());
        return new AmmCore(properties.getCoreAccount(), properties.getOwner(), properties.getDefaultSkipAhead());
    }
}
