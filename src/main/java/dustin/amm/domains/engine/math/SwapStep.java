// =====================================================
// SwapStep - 단일 구간 스왑 계산
// =====================================================
// 역할: 유동성이 일정한 한 가격 구간 안에서 스왑 결과를 계산
//       (SwapEngine이 틱마다 반복 호출)
//
// 입력:
// - sqrtRatio: 현재 가격
// - liquidity: 현재 활성 유동성
// - sqrtRatioLimit: 이번 단계의 목표 가격 (다음 틱 또는 사용자 한도 중 가까운 쪽)
// - amount: 남은 지정 금액 (양수 = 정확한 입력, 음수 = 정확한 출력)
// - isToken1: 지정 금액이 token1 기준인지
// - fee: 수수료율
//
// 처리 흐름:
// 1. 정확한 입력이면 수수료를 먼저 떼고 남은 금액으로 가격 이동 계산
// 2. 목표 가격을 넘어가면 목표 가격에서 멈추고 그 지점까지의 금액을 역산
// 3. 넘어가지 않으면 지정 금액 전부 소진, 반대쪽 금액 계산
// 4. 정확한 출력이면 계산된 입력 금액에 수수료를 가산 (amountBeforeFee)
//
// 결과:
// - consumedAmount: 지정 금액 중 소진된 양 (amount와 같은 부호)
// - calculatedAmount: 반대쪽 토큰 양 (크기)
// - sqrtRatioNext: 단계 종료 후 가격
// - feeAmount: 입력 토큰으로 받은 수수료
// =====================================================

package dustin.amm.domains.engine.math;

import java.math.BigInteger;

/**
 * 단일 구간 스왑 결과
 * Result of swapping within one constant-liquidity price segment
 */
public final class SwapStep {

    private final BigInteger consumedAmount;
    private final BigInteger calculatedAmount;
    private final SqrtRatio sqrtRatioNext;
    private final BigInteger feeAmount;

    private SwapStep(BigInteger consumedAmount, BigInteger calculatedAmount, SqrtRatio sqrtRatioNext, BigInteger feeAmount) {
        this.consumedAmount = consumedAmount;
        this.calculatedAmount = calculatedAmount;
        this.sqrtRatioNext = sqrtRatioNext;
        this.feeAmount = feeAmount;
    }

    /**
     * 가격 상승 여부
     * token1을 넣거나(정확한 입력) token0을 빼면(정확한 출력) 가격이 오릅니다.
     */
    public static boolean isPriceIncreasing(BigInteger amount, boolean isToken1) {
        boolean isExactOut = amount.signum() < 0;
        return isToken1 != isExactOut;
    }

    /**
     * 단일 구간 스왑 계산
     *
     * @param sqrtRatioLimit 이동 방향 쪽에 있어야 함 (호출자가 보장)
     */
    public static SwapStep compute(SqrtRatio sqrtRatio, BigInteger liquidity, SqrtRatio sqrtRatioLimit,
                                   BigInteger amount, boolean isToken1, FeeRate fee) {
        if (amount.signum() == 0 || sqrtRatio.equals(sqrtRatioLimit)) {
            return new SwapStep(BigInteger.ZERO, BigInteger.ZERO, sqrtRatio, BigInteger.ZERO);
        }

        boolean increasing = isPriceIncreasing(amount, isToken1);

        // 유동성이 없으면 교환 없이 목표 가격으로 이동
        if (liquidity.signum() == 0) {
            return new SwapStep(BigInteger.ZERO, BigInteger.ZERO, sqrtRatioLimit, BigInteger.ZERO);
        }

        boolean isExactOut = amount.signum() < 0;
        BigInteger priceImpactAmount = isExactOut ? amount : amount.subtract(FeeMath.computeFee(amount, fee));

        SqrtRatio sqrtRatioNext = isToken1
                ? AmountMath.nextSqrtRatioFromAmount1(sqrtRatio, liquidity, priceImpactAmount)
                : AmountMath.nextSqrtRatioFromAmount0(sqrtRatio, liquidity, priceImpactAmount);

        boolean hitsLimit = sqrtRatioNext == null
                || (increasing ? sqrtRatioNext.isGreaterThan(sqrtRatioLimit) : sqrtRatioNext.isLessThan(sqrtRatioLimit));

        if (hitsLimit) {
            return limitedStep(sqrtRatio, liquidity, sqrtRatioLimit, isToken1, isExactOut, fee);
        }

        // 금액이 너무 작아 가격이 움직이지 않음 → 전부 수수료
        if (sqrtRatioNext.equals(sqrtRatio)) {
            return new SwapStep(amount, BigInteger.ZERO, sqrtRatio, amount.abs());
        }

        BigInteger calculatedWithoutFee = isToken1
                ? AmountMath.amount0Delta(sqrtRatioNext, sqrtRatio, liquidity, isExactOut)
                : AmountMath.amount1Delta(sqrtRatioNext, sqrtRatio, liquidity, isExactOut);

        if (isExactOut) {
            BigInteger includingFee = FeeMath.amountBeforeFee(calculatedWithoutFee, fee);
            return new SwapStep(amount, includingFee, sqrtRatioNext, includingFee.subtract(calculatedWithoutFee));
        }
        return new SwapStep(amount, calculatedWithoutFee, sqrtRatioNext, FeeMath.computeFee(amount, fee));
    }

    /**
     * 목표 가격까지만 이동하는 경우
     */
    private static SwapStep limitedStep(SqrtRatio sqrtRatio, BigInteger liquidity, SqrtRatio sqrtRatioLimit,
                                        boolean isToken1, boolean isExactOut, FeeRate fee) {
        if (isExactOut) {
            // 지정(출력) 금액은 내림, 계산(입력) 금액은 올림 후 수수료 가산
            BigInteger specified = isToken1
                    ? AmountMath.amount1Delta(sqrtRatioLimit, sqrtRatio, liquidity, false)
                    : AmountMath.amount0Delta(sqrtRatioLimit, sqrtRatio, liquidity, false);
            BigInteger calculatedWithoutFee = isToken1
                    ? AmountMath.amount0Delta(sqrtRatioLimit, sqrtRatio, liquidity, true)
                    : AmountMath.amount1Delta(sqrtRatioLimit, sqrtRatio, liquidity, true);
            BigInteger calculated = FeeMath.amountBeforeFee(calculatedWithoutFee, fee);
            return new SwapStep(specified.negate(), calculated, sqrtRatioLimit, calculated.subtract(calculatedWithoutFee));
        }

        // 지정(입력) 금액은 올림 후 수수료 가산, 계산(출력) 금액은 내림
        BigInteger specifiedWithoutFee = isToken1
                ? AmountMath.amount1Delta(sqrtRatioLimit, sqrtRatio, liquidity, true)
                : AmountMath.amount0Delta(sqrtRatioLimit, sqrtRatio, liquidity, true);
        BigInteger specified = FeeMath.amountBeforeFee(specifiedWithoutFee, fee);
        BigInteger calculated = isToken1
                ? AmountMath.amount0Delta(sqrtRatioLimit, sqrtRatio, liquidity, false)
                : AmountMath.amount1Delta(sqrtRatioLimit, sqrtRatio, liquidity, false);
        return new SwapStep(specified, calculated, sqrtRatioLimit, specified.subtract(specifiedWithoutFee));
    }

    public BigInteger getConsumedAmount() {
        return consumedAmount;
    }

    public BigInteger getCalculatedAmount() {
        return calculatedAmount;
    }

    public SqrtRatio getSqrtRatioNext() {
        return sqrtRatioNext;
    }

    public BigInteger getFeeAmount() {
        return feeAmount;
    }
}
