// =====================================================
// TickStore - 틱 엔트리 저장소
// =====================================================
// 역할: (풀, 틱)별 유동성 변화량과 바깥쪽 수수료 스냅샷 관리
//
// 포지션 [lower, upper)에 유동성 L을 추가하면:
// - lower: liquidityDelta += L, liquidityNet += L
// - upper: liquidityDelta -= L, liquidityNet += L
// 따라서 한 풀의 liquidityDelta 합은 항상 0 입니다.
//
// 바깥쪽 수수료 초기값 (엔트리가 새로 생길 때):
// - tick <= 현재 틱: 지금까지의 전역 수수료 전부 (모두 아래에서 발생했다고 가정)
// - tick > 현재 틱: 0
//
// liquidityNet이 0 ↔ 양수로 바뀔 때 TickBitmap 비트를 뒤집습니다.
// =====================================================

package dustin.amm.domains.engine.tick;

import java.math.BigInteger;
import java.util.Objects;

import dustin.amm.domains.engine.exception.ArithmeticOverflowException;
import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.liquidity.FeesPerLiquidity;
import dustin.amm.domains.engine.math.LiquidityMath;
import dustin.amm.domains.engine.pool.PoolId;
import dustin.amm.domains.engine.state.JournaledMap;
import dustin.amm.domains.engine.state.StateJournal;

/**
 * 틱 키
 * (poolId, tick) 튜플
 */
class TickKey {
    private final PoolId poolId;
    private final int tick;

    TickKey(PoolId poolId, int tick) {
        this.poolId = poolId;
        this.tick = tick;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TickKey that = (TickKey) o;
        return tick == that.tick && Objects.equals(poolId, that.poolId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(poolId, tick);
    }
}

/**
 * 틱 엔트리 저장소
 * Tick entries plus the bitmap that indexes them
 */
public class TickStore {

    private final JournaledMap<TickKey, TickInfo> ticks;
    private final TickBitmap bitmap;

    public TickStore(StateJournal journal) {
        this.ticks = new JournaledMap<>(journal);
        this.bitmap = new TickBitmap(journal);
    }

    /**
     * 틱 엔트리 조회 (없으면 null)
     */
    public TickInfo get(PoolId poolId, int tick) {
        return ticks.get(new TickKey(poolId, tick));
    }

    public TickBitmap getBitmap() {
        return bitmap;
    }

    /**
     * 포지션 경계 틱 갱신
     *
     * @param liquidityDelta 포지션 유동성 변화량 (부호 있음)
     * @param isUpper 상한 경계 여부 (상한이면 delta를 빼서 기록)
     * @param feesOutsideIfCreated 엔트리가 새로 생길 때 쓸 바깥쪽 수수료
     * @throws ArithmeticOverflowException 틱당 최대 유동성 초과 (MAX_LIQUIDITY_PER_TICK_EXCEEDED)
     */
    public void update(PoolId poolId, int tick, int tickSpacing, BigInteger liquidityDelta, boolean isUpper,
                       FeesPerLiquidity feesOutsideIfCreated) {
        TickKey key = new TickKey(poolId, tick);
        TickInfo current = ticks.get(key);

        BigInteger netBefore = current == null ? BigInteger.ZERO : current.getLiquidityNet();
        BigInteger netAfter = LiquidityMath.addDelta(netBefore, liquidityDelta);
        BigInteger maxPerTick = LiquidityMath.maxLiquidityPerTick(tickSpacing);
        if (netAfter.compareTo(maxPerTick) > 0) {
            throw new ArithmeticOverflowException(ErrorCode.MAX_LIQUIDITY_PER_TICK_EXCEEDED,
                    String.format("Tick liquidity exceeds cap: tick=%d, liquidity=%s, max=%s", tick, netAfter, maxPerTick));
        }

        BigInteger deltaBefore = current == null ? BigInteger.ZERO : current.getLiquidityDelta();
        BigInteger deltaAfter = isUpper ? deltaBefore.subtract(liquidityDelta) : deltaBefore.add(liquidityDelta);

        if ((netBefore.signum() == 0) != (netAfter.signum() == 0)) {
            bitmap.flip(poolId, tick, tickSpacing);
        }

        if (netAfter.signum() == 0) {
            ticks.remove(key);
        } else {
            FeesPerLiquidity outside = current == null ? feesOutsideIfCreated : current.getFeesOutside();
            ticks.put(key, new TickInfo(deltaAfter, netAfter, outside));
        }
    }

    /**
     * 스왑 중 틱 건너기: 바깥쪽 수수료를 뒤집음 (outside = global - outside)
     *
     * @return 위쪽으로 건널 때 적용할 유동성 변화량 (엔트리 없으면 0)
     */
    public BigInteger cross(PoolId poolId, int tick, FeesPerLiquidity globalFees) {
        TickKey key = new TickKey(poolId, tick);
        TickInfo current = ticks.get(key);
        if (current == null) {
            return BigInteger.ZERO;
        }
        ticks.put(key, new TickInfo(current.getLiquidityDelta(), current.getLiquidityNet(),
                globalFees.subtract(current.getFeesOutside())));
        return current.getLiquidityDelta();
    }
}
