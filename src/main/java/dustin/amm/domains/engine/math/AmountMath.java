// =====================================================
// AmountMath - 가격 구간 ⇄ 토큰 금액
// =====================================================
// 역할: 유동성 L이 두 가격 사이에서 움직일 때 필요한 토큰 양과,
//       토큰 양이 주어졌을 때 다음 가격을 닫힌 식으로 계산
//
// 공식 (sa < sb, 모두 실수 sqrt 가격):
// - amount0 = L * (sb - sa) / (sa * sb)
// - amount1 = L * (sb - sa)
// - token0 추가 시: s' = L * s / (L + amount * s)
// - token1 추가 시: s' = s + amount / L
//
// 반올림 원칙:
// - 풀이 받는 금액은 올림, 풀이 주는 금액은 내림
// - 다음 가격은 풀이 손해 보지 않는 방향으로 반올림
// =====================================================

package dustin.amm.domains.engine.math;

import java.math.BigInteger;

import dustin.amm.domains.engine.exception.ArithmeticOverflowException;
import dustin.amm.domains.engine.exception.ErrorCode;

/**
 * 가격 구간과 토큰 금액 사이의 변환
 * Amount / price-movement math
 */
public final class AmountMath {

    private AmountMath() {
    }

    /**
     * 두 가격 사이에서 유동성이 요구하는 token0 양
     *
     * @param a 가격 A (순서 무관)
     * @param b 가격 B (순서 무관)
     * @param liquidity 유동성 (u128)
     * @param roundUp 올림 여부
     * @return token0 양 (u128)
     * @throws ArithmeticOverflowException u128 초과
     */
    public static BigInteger amount0Delta(SqrtRatio a, SqrtRatio b, BigInteger liquidity, boolean roundUp) {
        BigInteger lower = SqrtRatio.min(a, b).getFixed();
        BigInteger upper = SqrtRatio.max(a, b).getFixed();
        if (liquidity.signum() == 0 || lower.equals(upper)) {
            return BigInteger.ZERO;
        }

        BigInteger step = FixedPointMath.mulDiv(liquidity.shiftLeft(128), upper.subtract(lower), upper, roundUp);
        BigInteger result = FixedPointMath.div(step, lower, roundUp);
        if (!FixedPointMath.isU128(result)) {
            throw new ArithmeticOverflowException(ErrorCode.AMOUNT0_DELTA_OVERFLOW,
                    String.format("amount0 delta overflows u128: liquidity=%s", liquidity));
        }
        return result;
    }

    /**
     * 두 가격 사이에서 유동성이 요구하는 token1 양
     *
     * @throws ArithmeticOverflowException u128 초과
     */
    public static BigInteger amount1Delta(SqrtRatio a, SqrtRatio b, BigInteger liquidity, boolean roundUp) {
        BigInteger lower = SqrtRatio.min(a, b).getFixed();
        BigInteger upper = SqrtRatio.max(a, b).getFixed();
        if (liquidity.signum() == 0 || lower.equals(upper)) {
            return BigInteger.ZERO;
        }

        BigInteger result = FixedPointMath.mulDiv(liquidity, upper.subtract(lower), FixedPointMath.TWO_POW_128, roundUp);
        if (!FixedPointMath.isU128(result)) {
            throw new ArithmeticOverflowException(ErrorCode.AMOUNT1_DELTA_OVERFLOW,
                    String.format("amount1 delta overflows u128: liquidity=%s", liquidity));
        }
        return result;
    }

    /**
     * token0 양만큼 움직인 뒤의 가격
     *
     * amount > 0: 풀에 token0 추가 → 가격 하락
     * amount < 0: 풀에서 token0 인출 → 가격 상승
     *
     * @param liquidity 0보다 커야 함
     * @return 다음 가격 (올림), 유효한 가격이 없으면 null
     */
    public static SqrtRatio nextSqrtRatioFromAmount0(SqrtRatio sqrtRatio, BigInteger liquidity, BigInteger amount) {
        if (amount.signum() == 0) {
            return sqrtRatio;
        }

        BigInteger s = sqrtRatio.getFixed();
        BigInteger numerator = liquidity.shiftLeft(128);
        BigInteger product = amount.abs().multiply(s);

        BigInteger denominator;
        if (amount.signum() > 0) {
            denominator = numerator.add(product);
        } else {
            // 유동성이 가진 token0보다 많이 빼려는 경우
            if (product.compareTo(numerator) >= 0) {
                return null;
            }
            denominator = numerator.subtract(product);
        }

        BigInteger result = FixedPointMath.mulDiv(numerator, s, denominator, true);
        if (result.compareTo(FixedPointMath.U256_MAX) > 0) {
            return null;
        }
        return SqrtRatio.of(result);
    }

    /**
     * token1 양만큼 움직인 뒤의 가격
     *
     * amount > 0: 풀에 token1 추가 → 가격 상승 (내림)
     * amount < 0: 풀에서 token1 인출 → 가격 하락 (올림한 이동량만큼)
     *
     * @return 다음 가격, 유효한 가격이 없으면 null
     */
    public static SqrtRatio nextSqrtRatioFromAmount1(SqrtRatio sqrtRatio, BigInteger liquidity, BigInteger amount) {
        if (amount.signum() == 0) {
            return sqrtRatio;
        }

        BigInteger s = sqrtRatio.getFixed();
        boolean adding = amount.signum() > 0;
        BigInteger quotient = FixedPointMath.div(amount.abs().shiftLeft(128), liquidity, !adding);

        if (adding) {
            BigInteger result = s.add(quotient);
            return result.compareTo(FixedPointMath.U256_MAX) > 0 ? null : SqrtRatio.of(result);
        }
        if (quotient.compareTo(s) >= 0) {
            return null;
        }
        return SqrtRatio.of(s.subtract(quotient));
    }
}
