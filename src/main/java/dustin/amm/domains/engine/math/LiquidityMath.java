package dustin.amm.domains.engine.math;

import java.math.BigInteger;

import dustin.amm.domains.engine.exception.ArithmeticOverflowException;
import dustin.amm.domains.engine.exception.ErrorCode;

/**
 * 유동성 ⇄ 토큰 금액 변환
 * Liquidity math
 *
 * 포지션 구간과 현재 가격의 관계에 따라 세 가지 경우로 나뉩니다:
 * <pre>
 * 1. 현재가 <= 하한: 구간 전체가 위쪽 → token0만 필요
 * 2. 하한 < 현재가 < 상한: 걸쳐 있음 → token0 + token1
 * 3. 현재가 >= 상한: 구간 전체가 아래쪽 → token1만 필요
 * </pre>
 */
public final class LiquidityMath {

    private LiquidityMath() {
    }

    /**
     * 유동성 변화량 → 토큰 델타 (풀 관점)
     *
     * 예치(양수)는 올림 → 양수 델타 (호출자가 지불)
     * 인출(음수)은 내림 → 음수 델타 (호출자가 수령)
     *
     * @param sqrtRatio 현재 가격
     * @param liquidityDelta 유동성 변화량 (i128)
     * @param sqrtRatioLower 구간 하한 가격
     * @param sqrtRatioUpper 구간 상한 가격
     * @throws ArithmeticOverflowException 델타가 i128을 넘으면
     */
    public static TokenAmounts liquidityDeltaToAmountDelta(SqrtRatio sqrtRatio, BigInteger liquidityDelta,
                                                           SqrtRatio sqrtRatioLower, SqrtRatio sqrtRatioUpper) {
        if (liquidityDelta.signum() == 0) {
            return TokenAmounts.ZERO;
        }

        boolean isPositive = liquidityDelta.signum() > 0;
        BigInteger magnitude = liquidityDelta.abs();
        BigInteger amount0 = BigInteger.ZERO;
        BigInteger amount1 = BigInteger.ZERO;

        if (sqrtRatio.compareTo(sqrtRatioLower) <= 0) {
            amount0 = AmountMath.amount0Delta(sqrtRatioLower, sqrtRatioUpper, magnitude, isPositive);
        } else if (sqrtRatio.compareTo(sqrtRatioUpper) < 0) {
            amount0 = AmountMath.amount0Delta(sqrtRatio, sqrtRatioUpper, magnitude, isPositive);
            amount1 = AmountMath.amount1Delta(sqrtRatioLower, sqrtRatio, magnitude, isPositive);
        } else {
            amount1 = AmountMath.amount1Delta(sqrtRatioLower, sqrtRatioUpper, magnitude, isPositive);
        }

        BigInteger delta0 = isPositive ? amount0 : amount0.negate();
        BigInteger delta1 = isPositive ? amount1 : amount1.negate();
        FixedPointMath.requireI128(delta0, ErrorCode.POSITION_DELTA_OVERFLOW, "delta0");
        FixedPointMath.requireI128(delta1, ErrorCode.POSITION_DELTA_OVERFLOW, "delta1");
        return new TokenAmounts(delta0, delta1);
    }

    /**
     * 주어진 토큰 양으로 만들 수 있는 최대 유동성
     *
     * 예치 금액은 올림되므로 결과 유동성을 예치하면
     * amount0/amount1을 넘지 않습니다.
     */
    public static BigInteger maxLiquidity(SqrtRatio sqrtRatio, SqrtRatio sqrtRatioLower, SqrtRatio sqrtRatioUpper,
                                          BigInteger amount0, BigInteger amount1) {
        BigInteger result;
        if (sqrtRatio.compareTo(sqrtRatioLower) <= 0) {
            result = maxLiquidityForToken0(sqrtRatioLower, sqrtRatioUpper, amount0);
        } else if (sqrtRatio.compareTo(sqrtRatioUpper) < 0) {
            result = maxLiquidityForToken0(sqrtRatio, sqrtRatioUpper, amount0)
                    .min(maxLiquidityForToken1(sqrtRatioLower, sqrtRatio, amount1));
        } else {
            result = maxLiquidityForToken1(sqrtRatioLower, sqrtRatioUpper, amount1);
        }
        return result.min(FixedPointMath.U128_MAX);
    }

    static BigInteger maxLiquidityForToken0(SqrtRatio lower, SqrtRatio upper, BigInteger amount) {
        if (amount.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger l = lower.getFixed();
        BigInteger u = upper.getFixed();
        BigInteger product = FixedPointMath.mulDiv(l, u, FixedPointMath.TWO_POW_128, false);
        return FixedPointMath.mulDiv(amount, product, u.subtract(l), false);
    }

    static BigInteger maxLiquidityForToken1(SqrtRatio lower, SqrtRatio upper, BigInteger amount) {
        if (amount.signum() == 0) {
            return BigInteger.ZERO;
        }
        return amount.shiftLeft(128).divide(upper.getFixed().subtract(lower.getFixed()));
    }

    /**
     * 틱 하나가 참조할 수 있는 최대 총 유동성
     *
     * floor(U128_MAX / (1 + floor(2 * MAX_TICK_MAGNITUDE / tickSpacing)))
     * 전체 구간 전용(tickSpacing = 0)이면 U128_MAX
     *
     * 간격이 좁을수록 초기화될 수 있는 틱이 많아지므로 상한이 낮아집니다.
     * 모든 틱의 유동성 합이 u128 안에 머물도록 하기 위함입니다.
     */
    public static BigInteger maxLiquidityPerTick(int tickSpacing) {
        if (tickSpacing == TickMath.FULL_RANGE_ONLY_TICK_SPACING) {
            return FixedPointMath.U128_MAX;
        }
        long tickCount = 1L + (2L * TickMath.MAX_TICK_MAGNITUDE) / tickSpacing;
        return FixedPointMath.U128_MAX.divide(BigInteger.valueOf(tickCount));
    }

    /**
     * 유동성에 부호 있는 변화량 적용 (u128 범위 검사)
     *
     * @throws ArithmeticOverflowException 결과가 음수(LIQUIDITY_UNDERFLOW) 또는 u128 초과(LIQUIDITY_OVERFLOW)
     */
    public static BigInteger addDelta(BigInteger liquidity, BigInteger delta) {
        BigInteger result = liquidity.add(delta);
        if (result.signum() < 0) {
            throw new ArithmeticOverflowException(ErrorCode.LIQUIDITY_UNDERFLOW,
                    String.format("Liquidity underflow: liquidity=%s, delta=%s", liquidity, delta));
        }
        if (result.compareTo(FixedPointMath.U128_MAX) > 0) {
            throw new ArithmeticOverflowException(ErrorCode.LIQUIDITY_OVERFLOW,
                    String.format("Liquidity overflow: liquidity=%s, delta=%s", liquidity, delta));
        }
        return result;
    }
}
