// =====================================================
// PoolRegistry - 풀 저장소
// =====================================================
// 역할: PoolId → PoolState 매핑 관리
//
// 핵심 설계:
// 1. 풀은 initialize()로 한 번만 생성 (삭제 없음)
// 2. 값(PoolState)은 불변 → 변경 시 새 객체로 교체
// 3. JournaledMap 사용 → 실패한 작업은 자동으로 되돌려짐
// =====================================================

package dustin.amm.domains.engine.pool;

import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ValidationException;
import dustin.amm.domains.engine.math.SqrtRatio;
import dustin.amm.domains.engine.math.TickMath;
import dustin.amm.domains.engine.state.JournaledMap;
import dustin.amm.domains.engine.state.StateJournal;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * 풀 저장소
 * Pool registry
 */
@Slf4j
public class PoolRegistry {

    private final JournaledMap<PoolId, PoolState> pools;

    public PoolRegistry(StateJournal journal) {
        this.pools = new JournaledMap<>(journal);
    }

    /**
     * 풀 초기화
     *
     * @param poolId 풀 ID
     * @param tick 시작 틱
     * @return 시작 가격 (toSqrtRatio(tick))
     * @throws ValidationException 이미 초기화된 풀(POOL_ALREADY_INITIALIZED) 또는 범위 밖 틱(INVALID_TICK)
     */
    public SqrtRatio initialize(PoolId poolId, int tick) {
        if (pools.containsKey(poolId)) {
            throw new ValidationException(ErrorCode.POOL_ALREADY_INITIALIZED,
                    String.format("Pool already initialized: %s", poolId));
        }
        SqrtRatio sqrtRatio = TickMath.toSqrtRatio(tick);
        pools.put(poolId, new PoolState(sqrtRatio, tick, BigInteger.ZERO));
        log.info("[PoolRegistry] 풀 초기화: poolId={}, tick={}", poolId, tick);
        return sqrtRatio;
    }

    /**
     * 풀 상태 조회 (없으면 null)
     */
    public PoolState find(PoolId poolId) {
        return pools.get(poolId);
    }

    /**
     * 풀 상태 조회 (없으면 예외)
     *
     * @throws ValidationException POOL_NOT_INITIALIZED
     */
    public PoolState require(PoolId poolId) {
        PoolState state = pools.get(poolId);
        if (state == null) {
            throw new ValidationException(ErrorCode.POOL_NOT_INITIALIZED,
                    String.format("Pool not initialized: %s", poolId));
        }
        return state;
    }

    public void update(PoolId poolId, PoolState state) {
        pools.put(poolId, state);
    }

    public boolean isInitialized(PoolId poolId) {
        return pools.containsKey(poolId);
    }

    public int size() {
        return pools.size();
    }
}
