package dustin.amm.domains.engine.math;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SwapStepTest {

    private static final BigInteger L = BigInteger.valueOf(10_000);
    private static final FeeRate FIVE_PERCENT = FeeRate.fromFraction(1, 20);

    @Test
    @DisplayName("금액 0이면 아무 변화 없음")
    void zeroAmount() {
        SwapStep step = SwapStep.compute(SqrtRatio.ONE, L, TickMath.MIN_SQRT_RATIO, BigInteger.ZERO, false, FIVE_PERCENT);
        assertThat(step.getConsumedAmount()).isZero();
        assertThat(step.getSqrtRatioNext()).isEqualTo(SqrtRatio.ONE);
    }

    @Test
    @DisplayName("유동성 0이면 목표 가격으로 바로 이동")
    void zeroLiquidity() {
        SqrtRatio target = TickMath.toSqrtRatio(500);
        SwapStep step = SwapStep.compute(SqrtRatio.ONE, BigInteger.ZERO, target, BigInteger.valueOf(100), true, FIVE_PERCENT);
        assertThat(step.getConsumedAmount()).isZero();
        assertThat(step.getCalculatedAmount()).isZero();
        assertThat(step.getSqrtRatioNext()).isEqualTo(target);
    }

    @Test
    @DisplayName("5% 수수료로 token0 100 판매 → 수수료 5, token1 94 수령")
    void exactInputWithFee() {
        SwapStep step = SwapStep.compute(SqrtRatio.ONE, L, TickMath.MIN_SQRT_RATIO, BigInteger.valueOf(100), false, FIVE_PERCENT);
        assertThat(step.getConsumedAmount()).isEqualTo(BigInteger.valueOf(100));
        assertThat(step.getFeeAmount()).isEqualTo(BigInteger.valueOf(5));
        assertThat(step.getCalculatedAmount()).isEqualTo(BigInteger.valueOf(94));
        assertThat(step.getSqrtRatioNext()).isLessThan(SqrtRatio.ONE);
    }

    @Test
    @DisplayName("가격을 움직이지 못하는 금액은 전부 수수료")
    void dustBecomesFee() {
        SwapStep step = SwapStep.compute(SqrtRatio.ONE, L, TickMath.MIN_SQRT_RATIO, BigInteger.ONE, false, FIVE_PERCENT);
        assertThat(step.getConsumedAmount()).isEqualTo(BigInteger.ONE);
        assertThat(step.getCalculatedAmount()).isZero();
        assertThat(step.getFeeAmount()).isEqualTo(BigInteger.ONE);
        assertThat(step.getSqrtRatioNext()).isEqualTo(SqrtRatio.ONE);
    }

    @Test
    @DisplayName("목표 가격에 닿으면 일부만 소진")
    void stopsAtLimit() {
        SqrtRatio limit = TickMath.toSqrtRatio(1000);
        SwapStep step = SwapStep.compute(SqrtRatio.ONE, L, limit, BigInteger.valueOf(1_000_000), true, FeeRate.ZERO);
        assertThat(step.getSqrtRatioNext()).isEqualTo(limit);
        assertThat(step.getConsumedAmount()).isLessThan(BigInteger.valueOf(1_000_000)).isPositive();
        assertThat(step.getCalculatedAmount()).isPositive();
    }

    @Test
    @DisplayName("정확한 출력: 수수료 없는 풀에서 token1 50 받으려면 token0 51")
    void exactOutput() {
        SwapStep step = SwapStep.compute(SqrtRatio.ONE, L, TickMath.MIN_SQRT_RATIO, BigInteger.valueOf(-50), true, FeeRate.ZERO);
        assertThat(step.getConsumedAmount()).isEqualTo(BigInteger.valueOf(-50));
        assertThat(step.getCalculatedAmount()).isEqualTo(BigInteger.valueOf(51));
        assertThat(step.getSqrtRatioNext()).isLessThan(SqrtRatio.ONE);
    }

    @Test
    @DisplayName("정확한 출력에 수수료가 있으면 입력이 더 커짐")
    void exactOutputWithFee() {
        SwapStep step = SwapStep.compute(SqrtRatio.ONE, L, TickMath.MIN_SQRT_RATIO, BigInteger.valueOf(-50), true, FIVE_PERCENT);
        assertThat(step.getCalculatedAmount()).isGreaterThan(BigInteger.valueOf(51));
        assertThat(step.getFeeAmount()).isEqualTo(step.getCalculatedAmount().subtract(BigInteger.valueOf(51)));
    }
}
