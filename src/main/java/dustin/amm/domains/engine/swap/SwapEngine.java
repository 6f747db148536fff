// =====================================================
// SwapEngine - 스왑 실행
// =====================================================
// 역할: 가격 한도까지 틱을 하나씩 건너며 스왑을 실행
//
// 처리 흐름:
// 1. 입력 검증 (금액 i128, 한도 가격 범위, 한도 방향)
// 2. 남은 금액 != 0 && 가격 != 한도 인 동안 반복:
//    a. 비트맵에서 다음 틱 검색
//    b. 목표 가격 = min/max(다음 틱 가격, 한도)
//    c. SwapStep으로 한 구간 계산
//    d. 수수료 누적 (입력 토큰 기준, fee << 128 / L)
//    e. 틱 경계에 도달하면 건너기 (유동성 변화, 바깥쪽 수수료 뒤집기)
// 3. 풀 상태 저장, 풀 관점 델타 반환
//
// 경계 규칙:
// - 위로 건너기는 항상 적용 (tick = 다음 틱)
// - 아래로 건너기는 스왑이 계속될 때만 적용 (tick = 다음 틱 - 1)
// - 아래로 건넌 직후 멈춰서 가격이 경계에 남아 있으면 가격을 1 낮춤
//   → toSqrtRatio(tick) <= sqrtRatio < toSqrtRatio(tick + 1) 유지
// =====================================================

package dustin.amm.domains.engine.swap;

import java.math.BigInteger;

import dustin.amm.domains.engine.exception.ArithmeticOverflowException;
import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ValidationException;
import dustin.amm.domains.engine.liquidity.FeesPerLiquidity;
import dustin.amm.domains.engine.liquidity.LiquidityLedger;
import dustin.amm.domains.engine.math.FixedPointMath;
import dustin.amm.domains.engine.math.LiquidityMath;
import dustin.amm.domains.engine.math.SqrtRatio;
import dustin.amm.domains.engine.math.SwapStep;
import dustin.amm.domains.engine.math.TickMath;
import dustin.amm.domains.engine.math.TokenAmounts;
import dustin.amm.domains.engine.pool.PoolId;
import dustin.amm.domains.engine.pool.PoolKey;
import dustin.amm.domains.engine.pool.PoolRegistry;
import dustin.amm.domains.engine.pool.PoolState;
import dustin.amm.domains.engine.tick.TickSearchResult;
import dustin.amm.domains.engine.tick.TickStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 스왑 엔진
 * Swap engine
 */
@Slf4j
@RequiredArgsConstructor
public class SwapEngine {

    private final PoolRegistry pools;
    private final LiquidityLedger ledger;

    /**
     * 스왑 실행
     *
     * @param poolKey 풀 키
     * @param params 금액, 방향, 한도, skipAhead
     * @return 풀 관점 델타와 스왑 후 상태
     * @throws ValidationException 한도 가격 오류 (INVALID_SQRT_RATIO_LIMIT, SQRT_RATIO_LIMIT_WRONG_DIRECTION)
     * @throws ArithmeticOverflowException 금액 / 델타 범위 초과
     */
    public SwapResult swap(PoolKey poolKey, SwapParameters params) {
        PoolId poolId = poolKey.toId();
        PoolState state = pools.require(poolId);

        BigInteger amount = FixedPointMath.requireI128(params.getAmount(), ErrorCode.AMOUNT_OUT_OF_RANGE, "amount");
        SqrtRatio limit = params.getSqrtRatioLimit();
        if (!TickMath.isValid(limit)) {
            throw new ValidationException(ErrorCode.INVALID_SQRT_RATIO_LIMIT,
                    String.format("Sqrt ratio limit out of range: %s", limit == null ? null : limit.getFixed()));
        }

        if (amount.signum() == 0 || limit.equals(state.getSqrtRatio())) {
            return SwapResult.builder().delta(TokenAmounts.ZERO).stateAfter(state).ticksCrossed(0).build();
        }

        boolean isToken1 = params.isToken1();
        boolean increasing = SwapStep.isPriceIncreasing(amount, isToken1);
        if (increasing ? limit.isLessThan(state.getSqrtRatio()) : limit.isGreaterThan(state.getSqrtRatio())) {
            throw new ValidationException(ErrorCode.SQRT_RATIO_LIMIT_WRONG_DIRECTION,
                    String.format("Sqrt ratio limit on wrong side: price=%s, limit=%s, increasing=%s",
                            state.getSqrtRatio().getFixed(), limit.getFixed(), increasing));
        }

        TickStore ticks = ledger.getTicks();
        SqrtRatio sqrtRatio = state.getSqrtRatio();
        int tick = state.getTick();
        BigInteger liquidity = state.getLiquidity();
        BigInteger remaining = amount;
        BigInteger calculated = BigInteger.ZERO;
        int ticksCrossed = 0;

        while (remaining.signum() != 0 && !sqrtRatio.equals(limit)) {
            TickSearchResult next = ticks.getBitmap().nextInitializedTick(
                    poolId, tick, poolKey.getTickSpacing(), increasing, params.getSkipAhead());
            SqrtRatio nextTickSqrtRatio = TickMath.toSqrtRatio(next.getTick());
            SqrtRatio target = increasing
                    ? SqrtRatio.min(nextTickSqrtRatio, limit)
                    : SqrtRatio.max(nextTickSqrtRatio, limit);

            SwapStep step = SwapStep.compute(sqrtRatio, liquidity, target, remaining, isToken1, poolKey.getFee());
            remaining = remaining.subtract(step.getConsumedAmount());
            calculated = calculated.add(step.getCalculatedAmount());

            if (step.getFeeAmount().signum() > 0 && liquidity.signum() > 0) {
                BigInteger growth = step.getFeeAmount().shiftLeft(128).divide(liquidity);
                ledger.accumulateFees(poolId, increasing
                        ? new FeesPerLiquidity(BigInteger.ZERO, growth)
                        : new FeesPerLiquidity(growth, BigInteger.ZERO));
            }

            if (step.getSqrtRatioNext().equals(nextTickSqrtRatio)) {
                if (increasing) {
                    if (next.isInitialized()) {
                        BigInteger delta = ticks.cross(poolId, next.getTick(), ledger.getPoolFeesPerLiquidity(poolId));
                        liquidity = LiquidityMath.addDelta(liquidity, delta);
                        ticksCrossed++;
                    }
                    tick = next.getTick();
                } else {
                    boolean continues = remaining.signum() != 0 && !nextTickSqrtRatio.equals(limit);
                    if (continues) {
                        if (next.isInitialized()) {
                            BigInteger delta = ticks.cross(poolId, next.getTick(), ledger.getPoolFeesPerLiquidity(poolId));
                            liquidity = LiquidityMath.addDelta(liquidity, delta.negate());
                            ticksCrossed++;
                        }
                        tick = next.getTick() - 1;
                    } else {
                        tick = next.getTick();
                    }
                }
            } else if (!step.getSqrtRatioNext().equals(sqrtRatio)) {
                tick = TickMath.toTick(step.getSqrtRatioNext());
            }
            sqrtRatio = step.getSqrtRatioNext();
        }

        // 아래로 건넌 경계에서 멈춘 경우 가격을 경계 바로 아래로
        if (!increasing && tick < TickMath.MAX_TICK && sqrtRatio.equals(TickMath.toSqrtRatio(tick + 1))) {
            sqrtRatio = SqrtRatio.of(sqrtRatio.getFixed().subtract(BigInteger.ONE));
        }

        BigInteger specifiedDelta = amount.subtract(remaining);
        BigInteger calculatedDelta = amount.signum() > 0 ? calculated.negate() : calculated;
        FixedPointMath.requireI128(calculatedDelta, ErrorCode.SWAP_DELTA_OVERFLOW, "calculated delta");

        TokenAmounts delta = isToken1
                ? new TokenAmounts(calculatedDelta, specifiedDelta)
                : new TokenAmounts(specifiedDelta, calculatedDelta);

        PoolState stateAfter = new PoolState(sqrtRatio, tick, liquidity);
        pools.update(poolId, stateAfter);

        log.debug("[SwapEngine] 스왑 완료: pool={}, amount={}, isToken1={}, delta={}, tick={} -> {}, crossed={}",
                poolId, amount, isToken1, delta, state.getTick(), tick, ticksCrossed);

        return SwapResult.builder().delta(delta).stateAfter(stateAfter).ticksCrossed(ticksCrossed).build();
    }
}
