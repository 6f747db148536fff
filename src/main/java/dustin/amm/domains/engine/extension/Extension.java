package dustin.amm.domains.engine.extension;

import dustin.amm.domains.engine.liquidity.Bounds;
import dustin.amm.domains.engine.liquidity.UpdatePositionParameters;
import dustin.amm.domains.engine.math.SqrtRatio;
import dustin.amm.domains.engine.math.TokenAmounts;
import dustin.amm.domains.engine.pool.PoolKey;
import dustin.amm.domains.engine.pool.PoolState;
import dustin.amm.domains.engine.swap.SwapParameters;

/**
 * 풀 익스텐션
 * Pool extension hooks
 *
 * 등록 시 CallPoints로 고른 훅만 호출됩니다.
 * 구현하지 않은 훅은 아무 것도 하지 않습니다.
 * 훅이 예외를 던지면 감싸고 있는 작업 전체가 취소됩니다.
 *
 * caller: 훅을 일으킨 locker 주소 (initializePool은 lock 밖이면 null)
 */
public interface Extension {

    /**
     * 익스텐션 주소 (PoolKey.extension과 같은 값)
     */
    String getAddress();

    default void beforeInitializePool(String caller, PoolKey poolKey, int tick) {
    }

    default void afterInitializePool(String caller, PoolKey poolKey, int tick, SqrtRatio sqrtRatio) {
    }

    default void beforeSwap(String caller, PoolKey poolKey, SwapParameters params) {
    }

    default void afterSwap(String caller, PoolKey poolKey, SwapParameters params, TokenAmounts delta, PoolState stateAfter) {
    }

    default void beforeUpdatePosition(String caller, PoolKey poolKey, UpdatePositionParameters params) {
    }

    default void afterUpdatePosition(String caller, PoolKey poolKey, UpdatePositionParameters params,
                                     TokenAmounts delta, PoolState stateAfter) {
    }

    default void beforeCollectFees(String caller, PoolKey poolKey, long salt, Bounds bounds) {
    }

    default void afterCollectFees(String caller, PoolKey poolKey, long salt, Bounds bounds, TokenAmounts fees) {
    }
}
