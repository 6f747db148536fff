package dustin.amm.domains.engine.pool;

import java.math.BigInteger;

import dustin.amm.domains.engine.math.SqrtRatio;
import lombok.Value;

/**
 * 풀 상태 (불변)
 * Pool price / tick / active liquidity
 *
 * 불변식:
 * - toSqrtRatio(tick) <= sqrtRatio < toSqrtRatio(tick + 1)
 * - liquidity = lower <= tick < upper 인 포지션 유동성의 합
 */
@Value
public class PoolState {

    SqrtRatio sqrtRatio;

    int tick;

    /**
     * 현재 활성 유동성 (u128)
     */
    BigInteger liquidity;

    public PoolState withLiquidity(BigInteger newLiquidity) {
        return new PoolState(sqrtRatio, tick, newLiquidity);
    }
}
