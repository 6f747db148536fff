package dustin.amm.domains.engine.swap;

import static dustin.amm.support.PoolFixture.ETH;
import static dustin.amm.support.PoolFixture.USDC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.amm.domains.engine.exception.ArithmeticOverflowException;
import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ValidationException;
import dustin.amm.domains.engine.liquidity.Bounds;
import dustin.amm.domains.engine.math.FeeRate;
import dustin.amm.domains.engine.math.FixedPointMath;
import dustin.amm.domains.engine.math.SqrtRatio;
import dustin.amm.domains.engine.math.TickMath;
import dustin.amm.domains.engine.math.TokenAmounts;
import dustin.amm.domains.engine.pool.PoolKey;
import dustin.amm.domains.engine.pool.PoolState;
import dustin.amm.domains.engine.runtime.AmmCore;
import dustin.amm.domains.engine.tick.TickInfo;
import dustin.amm.support.PoolFixture;

/**
 * 스왑 엔진 테스트
 *
 * 목적:
 * - 입력 검증과 no-op
 * - 수수료 / 정확한 출력 금액
 * - 틱 건너기, 경계 규칙, 가격-틱 일관성
 * - skipAhead와 무관한 결과
 */
class SwapEngineTest {

    private AmmCore core;

    @BeforeEach
    void setUp() {
        core = PoolFixture.newCore();
        PoolFixture.fund(core, "alice", BigInteger.TEN.pow(16));
        PoolFixture.fund(core, "bob", BigInteger.TEN.pow(16));
    }

    private PoolKey initialized(AmmCore target, FeeRate fee, int tickSpacing) {
        PoolKey key = PoolFixture.poolKey(fee, tickSpacing);
        target.initializePool(key, 0);
        return key;
    }

    private static void assertPriceMatchesTick(PoolState state) {
        assertThat(state.getSqrtRatio()).isGreaterThanOrEqualTo(TickMath.toSqrtRatio(state.getTick()));
        if (state.getTick() < TickMath.MAX_TICK) {
            assertThat(state.getSqrtRatio()).isLessThan(TickMath.toSqrtRatio(state.getTick() + 1));
        }
    }

    // =====================================================
    // 검증 / no-op
    // =====================================================

    @Test
    @DisplayName("금액 0 또는 한도 == 현재가이면 상태 변화 없음")
    void noOps() {
        PoolKey key = initialized(core, FeeRate.ZERO, 10);
        PoolFixture.updatePosition(core, "alice", key, new Bounds(-100, 100), BigInteger.valueOf(1_000_000L));
        PoolState before = core.getPoolState(key);

        SwapResult zeroAmount = PoolFixture.swap(core, "bob", key, BigInteger.ZERO, false, TickMath.MIN_SQRT_RATIO);
        SwapResult atLimit = PoolFixture.swap(core, "bob", key, BigInteger.valueOf(100), false, before.getSqrtRatio());

        assertThat(zeroAmount.getDelta()).isEqualTo(TokenAmounts.ZERO);
        assertThat(atLimit.getDelta()).isEqualTo(TokenAmounts.ZERO);
        assertThat(core.getPoolState(key)).isEqualTo(before);
    }

    @Test
    @DisplayName("한도가 이동 방향 반대쪽이면 SQRT_RATIO_LIMIT_WRONG_DIRECTION")
    void wrongDirection() {
        PoolKey key = initialized(core, FeeRate.ZERO, 10);
        PoolFixture.updatePosition(core, "alice", key, new Bounds(-100, 100), BigInteger.valueOf(1_000_000L));
        PoolState before = core.getPoolState(key);

        // token0 입력은 가격 하락
        assertThatThrownBy(() -> PoolFixture.swap(core, "bob", key, BigInteger.valueOf(100), false,
                TickMath.toSqrtRatio(50)))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo(ErrorCode.SQRT_RATIO_LIMIT_WRONG_DIRECTION);
        // token0 출력은 가격 상승
        assertThatThrownBy(() -> PoolFixture.swap(core, "bob", key, BigInteger.valueOf(-100), false,
                TickMath.toSqrtRatio(-50)))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo(ErrorCode.SQRT_RATIO_LIMIT_WRONG_DIRECTION);

        assertThat(core.getPoolState(key)).isEqualTo(before);
    }

    @Test
    @DisplayName("범위 밖 한도 / i128 밖 금액 거부")
    void invalidInputs() {
        PoolKey key = initialized(core, FeeRate.ZERO, 10);
        SqrtRatio aboveMax = SqrtRatio.of(TickMath.MAX_SQRT_RATIO.getFixed().add(BigInteger.ONE));

        assertThatThrownBy(() -> PoolFixture.swap(core, "bob", key, BigInteger.valueOf(100), true, aboveMax))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_SQRT_RATIO_LIMIT);
        assertThatThrownBy(() -> PoolFixture.swap(core, "bob", key, BigInteger.ONE.shiftLeft(127), true,
                TickMath.MAX_SQRT_RATIO))
                .isInstanceOf(ArithmeticOverflowException.class)
                .extracting("code").isEqualTo(ErrorCode.AMOUNT_OUT_OF_RANGE);
        assertThat(core.getPoolState(key).getSqrtRatio()).isEqualTo(SqrtRatio.ONE);
    }

    @Test
    @DisplayName("유동성이 없으면 교환 없이 한도까지 가격만 이동")
    void zeroLiquidityMovesToLimit() {
        PoolKey key = initialized(core, FeeRate.ZERO, 10);
        SqrtRatio limit = TickMath.toSqrtRatio(-500);

        SwapResult result = PoolFixture.swap(core, "bob", key, BigInteger.valueOf(100), false, limit);

        assertThat(result.getDelta()).isEqualTo(TokenAmounts.ZERO);
        assertThat(result.getStateAfter().getSqrtRatio()).isEqualTo(limit);
        assertThat(result.getStateAfter().getTick()).isEqualTo(-500);
    }

    // =====================================================
    // 금액
    // =====================================================

    @Test
    @DisplayName("5% 수수료 풀에서 token0 100 입력 → token1 94 출력")
    void exactInputWithFee() {
        PoolKey key = initialized(core, FeeRate.fromFraction(5, 100), 100);
        Bounds fullRange = Bounds.fullRange(100);
        assertThat(PoolFixture.updatePosition(core, "alice", key, fullRange, BigInteger.valueOf(10_000)).getDelta())
                .isEqualTo(TokenAmounts.of(10_000, 10_000));

        SwapResult result = PoolFixture.swap(core, "bob", key, BigInteger.valueOf(100), false, TickMath.MIN_SQRT_RATIO);

        assertThat(result.getDelta()).isEqualTo(TokenAmounts.of(100, -94));
        assertThat(core.getTokenLedger().getBalance("bob", USDC))
                .isEqualTo(BigInteger.TEN.pow(16).add(BigInteger.valueOf(94)));
        assertPriceMatchesTick(result.getStateAfter());
    }

    @Test
    @DisplayName("수수료 없는 풀에서 token1 50 정확한 출력 → token0 51 입력")
    void exactOutput() {
        PoolKey key = initialized(core, FeeRate.ZERO, 100);
        PoolFixture.updatePosition(core, "alice", key, Bounds.fullRange(100), BigInteger.valueOf(10_000));

        SwapResult result = PoolFixture.swap(core, "bob", key, BigInteger.valueOf(-50), true, TickMath.MIN_SQRT_RATIO);

        assertThat(result.getDelta()).isEqualTo(TokenAmounts.of(51, -50));
        assertPriceMatchesTick(result.getStateAfter());
    }

    // =====================================================
    // 틱 건너기
    // =====================================================

    @Test
    @DisplayName("아래로 틱을 건너면 구간 유동성이 빠지고, 다시 올라오면 복구")
    void crossesTicksBothWays() {
        PoolKey key = initialized(core, FeeRate.fromFraction(3, 1000), 10);
        BigInteger wide = BigInteger.valueOf(1_000_000L);
        BigInteger narrow = BigInteger.valueOf(10_000_000L);
        PoolFixture.updatePosition(core, "alice", key, Bounds.fullRange(10), wide);
        PoolFixture.updatePosition(core, "alice", key, new Bounds(-100, 100), 1L, narrow);
        assertThat(core.getPoolState(key).getLiquidity()).isEqualTo(wide.add(narrow));

        SwapResult down = PoolFixture.swap(core, "bob", key, BigInteger.valueOf(10_000), false, TickMath.MIN_SQRT_RATIO);
        assertThat(down.getTicksCrossed()).isEqualTo(1);
        assertThat(down.getStateAfter().getTick()).isLessThan(-100);
        assertThat(down.getStateAfter().getLiquidity()).isEqualTo(wide);
        assertPriceMatchesTick(down.getStateAfter());

        SwapResult up = PoolFixture.swap(core, "bob", key, BigInteger.valueOf(50_000), true, TickMath.toSqrtRatio(0));
        assertThat(up.getTicksCrossed()).isEqualTo(1);
        assertThat(up.getStateAfter().getSqrtRatio()).isEqualTo(SqrtRatio.ONE);
        assertThat(up.getStateAfter().getTick()).isZero();
        assertThat(up.getStateAfter().getLiquidity()).isEqualTo(wide.add(narrow));
    }

    @Test
    @DisplayName("아래로 이동하다 초기화된 틱 경계에서 멈추면 건너지 않고, 다음 스왑에서 건넘")
    void downwardStopAtInitializedTick() {
        PoolKey key = initialized(core, FeeRate.ZERO, 10);
        BigInteger wide = BigInteger.valueOf(1_000_000L);
        BigInteger narrow = BigInteger.valueOf(10_000_000L);
        PoolFixture.updatePosition(core, "alice", key, Bounds.fullRange(10), wide);
        PoolFixture.updatePosition(core, "alice", key, new Bounds(-100, 100), 1L, narrow);

        SwapResult stop = PoolFixture.swap(core, "bob", key, BigInteger.valueOf(1_000_000L), false,
                TickMath.toSqrtRatio(-100));
        assertThat(stop.getStateAfter().getSqrtRatio()).isEqualTo(TickMath.toSqrtRatio(-100));
        assertThat(stop.getStateAfter().getTick()).isEqualTo(-100);
        assertThat(stop.getStateAfter().getLiquidity()).isEqualTo(wide.add(narrow));
        assertThat(stop.getTicksCrossed()).isZero();

        SwapResult next = PoolFixture.swap(core, "bob", key, BigInteger.valueOf(100), false, TickMath.MIN_SQRT_RATIO);
        assertThat(next.getTicksCrossed()).isEqualTo(1);
        assertThat(next.getStateAfter().getLiquidity()).isEqualTo(wide);
        assertThat(next.getStateAfter().getTick()).isLessThan(-100);
        assertPriceMatchesTick(next.getStateAfter());
    }

    @Test
    @DisplayName("위로 틱 경계에 정확히 도달하면 건넘")
    void upwardArrivalCrosses() {
        PoolKey key = initialized(core, FeeRate.ZERO, 10);
        BigInteger wide = BigInteger.valueOf(1_000_000L);
        BigInteger narrow = BigInteger.valueOf(10_000_000L);
        PoolFixture.updatePosition(core, "alice", key, Bounds.fullRange(10), wide);
        PoolFixture.updatePosition(core, "alice", key, new Bounds(-100, 100), 1L, narrow);

        SwapResult result = PoolFixture.swap(core, "bob", key, BigInteger.valueOf(1_000_000L), true,
                TickMath.toSqrtRatio(100));

        assertThat(result.getStateAfter().getTick()).isEqualTo(100);
        assertThat(result.getStateAfter().getLiquidity()).isEqualTo(wide);
        assertThat(result.getTicksCrossed()).isEqualTo(1);
    }

    @Test
    @DisplayName("skipAhead 값과 무관하게 같은 결과")
    void skipAheadDoesNotChangeResult() {
        AmmCore eager = new AmmCore(PoolFixture.CORE, PoolFixture.OWNER, 0);
        AmmCore skipping = new AmmCore(PoolFixture.CORE, PoolFixture.OWNER, 5);
        List<SwapResult> eagerResults = runScenario(eager);
        List<SwapResult> skippingResults = runScenario(skipping);

        for (int i = 0; i < eagerResults.size(); i++) {
            assertThat(skippingResults.get(i).getDelta()).isEqualTo(eagerResults.get(i).getDelta());
            assertThat(skippingResults.get(i).getStateAfter()).isEqualTo(eagerResults.get(i).getStateAfter());
        }
    }

    private List<SwapResult> runScenario(AmmCore target) {
        PoolFixture.fund(target, "alice", BigInteger.TEN.pow(16));
        PoolFixture.fund(target, "bob", BigInteger.TEN.pow(16));
        PoolKey key = initialized(target, FeeRate.fromFraction(1, 1000), 1);
        PoolFixture.updatePosition(target, "alice", key, Bounds.fullRange(1), BigInteger.valueOf(1_000_000L));
        PoolFixture.updatePosition(target, "alice", key, new Bounds(-3000, -2000), 1L, BigInteger.valueOf(5_000_000L));
        PoolFixture.updatePosition(target, "alice", key, new Bounds(1500, 4000), 2L, BigInteger.valueOf(5_000_000L));

        List<SwapResult> results = new ArrayList<>();
        results.add(PoolFixture.swap(target, "bob", key, BigInteger.valueOf(300_000), false, TickMath.MIN_SQRT_RATIO));
        results.add(PoolFixture.swap(target, "bob", key, BigInteger.valueOf(700_000), true, TickMath.MAX_SQRT_RATIO));
        results.add(PoolFixture.swap(target, "bob", key, BigInteger.valueOf(-100_000), true, TickMath.MIN_SQRT_RATIO));
        return results;
    }

    // =====================================================
    // 무작위 스왑 불변식
    // =====================================================

    @Test
    @DisplayName("무작위 스왑 / 부분 인출 후에도 가격-틱 일관성, 활성 유동성, 틱 보존, 잔고 보존 유지")
    void randomSwapsKeepInvariants() {
        PoolKey key = initialized(core, FeeRate.fromFraction(3, 1000), 100);
        List<Bounds> ranges = List.of(Bounds.fullRange(100), new Bounds(-1000, 1000),
                new Bounds(200, 3000), new Bounds(-5000, -100));
        List<BigInteger> liquidities = new ArrayList<>(List.of(BigInteger.valueOf(10_000_000L),
                BigInteger.valueOf(50_000_000L), BigInteger.valueOf(20_000_000L), BigInteger.valueOf(30_000_000L)));

        BigInteger expected0 = BigInteger.ZERO;
        BigInteger expected1 = BigInteger.ZERO;
        for (int i = 0; i < ranges.size(); i++) {
            TokenAmounts delta = PoolFixture.updatePosition(core, "alice", key, ranges.get(i), i, liquidities.get(i))
                    .getDelta();
            expected0 = expected0.add(delta.getAmount0());
            expected1 = expected1.add(delta.getAmount1());
        }
        assertTicksConserved(key, ranges, liquidities);

        Random random = new Random(20240611L);
        for (int i = 0; i < 60; i++) {
            boolean isToken1 = random.nextBoolean();
            BigInteger amount = BigInteger.valueOf(1_000 + random.nextInt(200_000));
            if (random.nextInt(4) == 0) {
                amount = amount.negate();
            }
            SqrtRatio limit = isToken1 == (amount.signum() > 0) ? TickMath.MAX_SQRT_RATIO : TickMath.MIN_SQRT_RATIO;

            TokenAmounts delta = PoolFixture.swap(core, "bob", key, amount, isToken1, limit).getDelta();
            expected0 = expected0.add(delta.getAmount0());
            expected1 = expected1.add(delta.getAmount1());

            // 20번마다 한 포지션의 절반 인출
            if (i % 20 == 19) {
                int index = 1 + random.nextInt(ranges.size() - 1);
                BigInteger half = liquidities.get(index).divide(BigInteger.TWO);
                TokenAmounts withdrawn = PoolFixture.updatePosition(core, "alice", key, ranges.get(index), index,
                        half.negate()).getDelta();
                liquidities.set(index, liquidities.get(index).subtract(half));
                expected0 = expected0.add(withdrawn.getAmount0());
                expected1 = expected1.add(withdrawn.getAmount1());
                assertTicksConserved(key, ranges, liquidities);
            }

            PoolState state = core.getPoolState(key);
            assertPriceMatchesTick(state);
            assertThat(state.getLiquidity()).isEqualTo(activeLiquidity(state.getTick(), ranges, liquidities));
        }

        // 전체 구간 포지션: 수수료 정산 후 전액 인출
        TokenAmounts fees = PoolFixture.collectFees(core, "alice", key, ranges.get(0));
        expected0 = expected0.subtract(fees.getAmount0());
        expected1 = expected1.subtract(fees.getAmount1());
        TokenAmounts closed = PoolFixture.updatePosition(core, "alice", key, ranges.get(0), 0L,
                liquidities.get(0).negate()).getDelta();
        liquidities.set(0, BigInteger.ZERO);
        expected0 = expected0.add(closed.getAmount0());
        expected1 = expected1.add(closed.getAmount1());

        assertTicksConserved(key, ranges, liquidities);
        assertThat(core.getTick(key, ranges.get(0).getLower())).isNull();
        assertThat(core.getTick(key, ranges.get(0).getUpper())).isNull();
        PoolState finalState = core.getPoolState(key);
        assertThat(finalState.getLiquidity()).isEqualTo(activeLiquidity(finalState.getTick(), ranges, liquidities));

        assertThat(core.getTokenLedger().getBalance(PoolFixture.CORE, ETH)).isEqualTo(expected0);
        assertThat(core.getTokenLedger().getBalance(PoolFixture.CORE, USDC)).isEqualTo(expected1);
        assertThat(expected0).isLessThanOrEqualTo(FixedPointMath.U128_MAX);
    }

    /**
     * 모든 경계 틱의 liquidityDelta 합 = 0, liquidityNet = 그 틱을 참조하는 유동성 합
     */
    private void assertTicksConserved(PoolKey key, List<Bounds> ranges, List<BigInteger> liquidities) {
        Set<Integer> boundaries = new TreeSet<>();
        for (Bounds bounds : ranges) {
            boundaries.add(bounds.getLower());
            boundaries.add(bounds.getUpper());
        }

        BigInteger deltaSum = BigInteger.ZERO;
        for (int tick : boundaries) {
            BigInteger referencing = BigInteger.ZERO;
            for (int i = 0; i < ranges.size(); i++) {
                if (ranges.get(i).getLower() == tick || ranges.get(i).getUpper() == tick) {
                    referencing = referencing.add(liquidities.get(i));
                }
            }

            TickInfo info = core.getTick(key, tick);
            if (referencing.signum() == 0) {
                assertThat(info).isNull();
                continue;
            }
            assertThat(info.getLiquidityNet()).isEqualTo(referencing);
            deltaSum = deltaSum.add(info.getLiquidityDelta());
        }
        assertThat(deltaSum).isZero();
    }

    private static BigInteger activeLiquidity(int tick, List<Bounds> ranges, List<BigInteger> liquidities) {
        BigInteger total = BigInteger.ZERO;
        for (int i = 0; i < ranges.size(); i++) {
            if (ranges.get(i).contains(tick)) {
                total = total.add(liquidities.get(i));
            }
        }
        return total;
    }
}
