package dustin.amm.domains.engine.swap;

import dustin.amm.domains.engine.math.TokenAmounts;
import dustin.amm.domains.engine.pool.PoolState;
import lombok.Builder;
import lombok.Value;

/**
 * 스왑 결과
 * Swap Result
 */
@Value
@Builder
public class SwapResult {

    /**
     * 풀 관점 델타 (양수 = 풀이 받음, 음수 = 풀이 지급)
     */
    TokenAmounts delta;

    PoolState stateAfter;

    /**
     * 건넌 초기화된 틱 수
     */
    int ticksCrossed;
}
