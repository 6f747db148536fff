// =====================================================
// LiquidityLedger - 포지션 / 수수료 장부
// =====================================================
// 역할: 포지션 유동성, 틱 엔트리, 풀 전역 수수료 누적값 관리
//
// updatePosition 처리 흐름:
// 1. 구간 검증 (순서, 범위, 틱 간격 배수)
// 2. 유동성 변화량 → 토큰 델타 (예치 올림 / 인출 내림)
// 3. 인출이면 각 반환 금액에 풀 수수료 부과 → 프로토콜 수수료로 적립
// 4. 경계 틱 갱신 (틱당 최대 유동성 검사, 비트맵 갱신)
// 5. 포지션 수수료 체크포인트 갱신
//    - 쌓인 수수료 = (inside - last) * L >> 128
//    - 수수료는 포지션에 남겨 둠 (체크포인트를 fees << 128 / newL 만큼 당김)
//    - 유동성을 0으로 만들면서 수수료가 남아 있으면 거부
// 6. 현재 틱이 구간 안이면 풀 활성 유동성 갱신
//
// 구간 내부 수수료 (Uniswap 방식, 래핑 없는 정수):
// - 현재 < lower:         inside = outside(lower) - outside(upper)
// - lower <= 현재 < upper: inside = global - outside(lower) - outside(upper)
// - 현재 >= upper:        inside = outside(upper) - outside(lower)
// =====================================================

package dustin.amm.domains.engine.liquidity;

import java.math.BigInteger;

import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.InvariantViolationException;
import dustin.amm.domains.engine.math.FeeMath;
import dustin.amm.domains.engine.math.FeeRate;
import dustin.amm.domains.engine.math.LiquidityMath;
import dustin.amm.domains.engine.math.TokenAmounts;
import dustin.amm.domains.engine.pool.PoolId;
import dustin.amm.domains.engine.pool.PoolKey;
import dustin.amm.domains.engine.pool.PoolRegistry;
import dustin.amm.domains.engine.pool.PoolState;
import dustin.amm.domains.engine.state.JournaledMap;
import dustin.amm.domains.engine.state.StateJournal;
import dustin.amm.domains.engine.tick.TickInfo;
import dustin.amm.domains.engine.tick.TickStore;
import lombok.extern.slf4j.Slf4j;

/**
 * 포지션 / 수수료 장부
 * Liquidity ledger
 */
@Slf4j
public class LiquidityLedger {

    private final PoolRegistry pools;
    private final TickStore ticks;
    private final JournaledMap<PositionKey, Position> positions;

    /**
     * 풀 전역 누적 수수료 (유동성 단위당)
     */
    private final JournaledMap<PoolId, FeesPerLiquidity> poolFees;

    public LiquidityLedger(StateJournal journal, PoolRegistry pools, TickStore ticks) {
        this.pools = pools;
        this.ticks = ticks;
        this.positions = new JournaledMap<>(journal);
        this.poolFees = new JournaledMap<>(journal);
    }

    /**
     * 포지션 유동성 변경
     *
     * @param owner 포지션 소유자 (현재 locker)
     * @param poolKey 풀 키
     * @param params 구간, salt, 유동성 변화량
     * @return 토큰 델타 / 프로토콜 수수료 / 쌓인 수수료
     */
    public UpdatePositionResult updatePosition(String owner, PoolKey poolKey, UpdatePositionParameters params) {
        PoolId poolId = poolKey.toId();
        PoolState pool = pools.require(poolId);
        Bounds bounds = params.getBounds();
        bounds.validate(poolKey.getTickSpacing());

        BigInteger liquidityDelta = params.getLiquidityDelta();
        if (liquidityDelta.signum() == 0) {
            return UpdatePositionResult.builder()
                    .delta(TokenAmounts.ZERO)
                    .protocolFees(TokenAmounts.ZERO)
                    .feesAccrued(TokenAmounts.ZERO)
                    .build();
        }

        TokenAmounts delta = LiquidityMath.liquidityDeltaToAmountDelta(pool.getSqrtRatio(), liquidityDelta,
                bounds.lowerSqrtRatio(), bounds.upperSqrtRatio());

        TokenAmounts protocolFees = TokenAmounts.ZERO;
        if (liquidityDelta.signum() < 0 && !poolKey.getFee().isZero()) {
            protocolFees = withdrawalFees(delta, poolKey.getFee());
            // 수령액(음수)에서 수수료만큼 덜 받음
            delta = delta.add(protocolFees);
        }

        PositionKey positionKey = new PositionKey(poolId, owner, params.getSalt(), bounds);
        Position position = positions.getOrDefault(positionKey, Position.EMPTY);
        BigInteger newLiquidity = LiquidityMath.addDelta(position.getLiquidity(), liquidityDelta);

        FeesPerLiquidity inside;
        if (liquidityDelta.signum() < 0) {
            inside = feesPerLiquidityInside(poolId, pool.getTick(), bounds);
            updateTicks(poolId, poolKey.getTickSpacing(), pool.getTick(), bounds, liquidityDelta);
        } else {
            updateTicks(poolId, poolKey.getTickSpacing(), pool.getTick(), bounds, liquidityDelta);
            inside = feesPerLiquidityInside(poolId, pool.getTick(), bounds);
        }

        TokenAmounts feesAccrued = position.feesAccrued(inside);
        if (newLiquidity.signum() == 0) {
            if (!feesAccrued.isZero()) {
                throw new InvariantViolationException(ErrorCode.MUST_COLLECT_FEES_BEFORE_WITHDRAWING_ALL_LIQUIDITY,
                        String.format("Collect fees %s before withdrawing all liquidity: owner=%s", feesAccrued, owner));
            }
            positions.remove(positionKey);
        } else {
            // 쌓인 수수료를 새 유동성 기준으로 보존
            FeesPerLiquidity kept = FeesPerLiquidity.fromAmounts(
                    feesAccrued.getAmount0(), feesAccrued.getAmount1(), newLiquidity);
            positions.put(positionKey, new Position(newLiquidity, inside.subtract(kept)));
        }

        if (bounds.contains(pool.getTick())) {
            pools.update(poolId, pool.withLiquidity(LiquidityMath.addDelta(pool.getLiquidity(), liquidityDelta)));
        }

        log.debug("[LiquidityLedger] 포지션 변경: owner={}, pool={}, bounds=[{}, {}), liquidityDelta={}, delta={}",
                owner, poolId, bounds.getLower(), bounds.getUpper(), liquidityDelta, delta);

        return UpdatePositionResult.builder()
                .delta(delta)
                .protocolFees(protocolFees)
                .feesAccrued(feesAccrued)
                .build();
    }

    /**
     * 포지션 수수료 정산
     *
     * @return 지급할 수수료 (0 이상), 포지션이 없으면 (0, 0)
     */
    public TokenAmounts collectFees(String owner, PoolKey poolKey, long salt, Bounds bounds) {
        PoolId poolId = poolKey.toId();
        PoolState pool = pools.require(poolId);
        PositionKey positionKey = new PositionKey(poolId, owner, salt, bounds);
        Position position = positions.get(positionKey);
        if (position == null) {
            return TokenAmounts.ZERO;
        }

        FeesPerLiquidity inside = feesPerLiquidityInside(poolId, pool.getTick(), bounds);
        TokenAmounts fees = position.feesAccrued(inside);
        positions.put(positionKey, new Position(position.getLiquidity(), inside));

        log.debug("[LiquidityLedger] 수수료 정산: owner={}, pool={}, fees={}", owner, poolId, fees);
        return fees;
    }

    /**
     * 구간 내부 누적 수수료
     */
    public FeesPerLiquidity feesPerLiquidityInside(PoolId poolId, int currentTick, Bounds bounds) {
        FeesPerLiquidity global = getPoolFeesPerLiquidity(poolId);
        FeesPerLiquidity lowerOutside = outside(poolId, bounds.getLower());
        FeesPerLiquidity upperOutside = outside(poolId, bounds.getUpper());

        if (currentTick < bounds.getLower()) {
            return lowerOutside.subtract(upperOutside);
        }
        if (currentTick < bounds.getUpper()) {
            return global.subtract(lowerOutside).subtract(upperOutside);
        }
        return upperOutside.subtract(lowerOutside);
    }

    /**
     * 풀 전역 누적 수수료 (없으면 0)
     */
    public FeesPerLiquidity getPoolFeesPerLiquidity(PoolId poolId) {
        return poolFees.getOrDefault(poolId, FeesPerLiquidity.ZERO);
    }

    /**
     * 활성 유동성에 수수료 분배 (스왑 수수료, accumulateAsFees)
     */
    public void accumulateFees(PoolId poolId, FeesPerLiquidity growth) {
        poolFees.put(poolId, getPoolFeesPerLiquidity(poolId).add(growth));
    }

    /**
     * 포지션 조회 (없으면 null)
     */
    public Position getPosition(PositionKey key) {
        return positions.get(key);
    }

    public TickStore getTicks() {
        return ticks;
    }

    private void updateTicks(PoolId poolId, int tickSpacing, int currentTick, Bounds bounds, BigInteger liquidityDelta) {
        FeesPerLiquidity global = getPoolFeesPerLiquidity(poolId);
        ticks.update(poolId, bounds.getLower(), tickSpacing, liquidityDelta, false,
                bounds.getLower() <= currentTick ? global : FeesPerLiquidity.ZERO);
        ticks.update(poolId, bounds.getUpper(), tickSpacing, liquidityDelta, true,
                bounds.getUpper() <= currentTick ? global : FeesPerLiquidity.ZERO);
    }

    private FeesPerLiquidity outside(PoolId poolId, int tick) {
        TickInfo info = ticks.get(poolId, tick);
        return info == null ? FeesPerLiquidity.ZERO : info.getFeesOutside();
    }

    private static TokenAmounts withdrawalFees(TokenAmounts delta, FeeRate fee) {
        return new TokenAmounts(
                FeeMath.computeFee(delta.getAmount0().negate(), fee),
                FeeMath.computeFee(delta.getAmount1().negate(), fee));
    }
}
