// =====================================================
// FixedPointMath - 고정소수점 공통 연산
// =====================================================
// 역할: 엔진 전체에서 쓰는 정수 범위 상수와 반올림 나눗셈
//
// 핵심 설계:
// 1. 모든 금액/유동성/가격은 BigInteger로 표현 (wraparound 없음)
// 2. 표현 범위(u128, i128)는 명시적으로 검사
// 3. 반올림 방향은 호출자가 지정 (풀에 유리한 방향)
//
// 스케일:
// - sqrtRatio: 2^128 (128.128 고정소수점)
// - fee: 2^64 (0.64 고정소수점)
// - feesPerLiquidity: 2^128
// =====================================================

package dustin.amm.domains.engine.math;

import java.math.BigInteger;

import dustin.amm.domains.engine.exception.ArithmeticOverflowException;
import dustin.amm.domains.engine.exception.ErrorCode;

/**
 * 고정소수점 공통 연산
 * Fixed-point helpers
 */
public final class FixedPointMath {

    public static final BigInteger TWO_POW_64 = BigInteger.ONE.shiftLeft(64);
    public static final BigInteger TWO_POW_128 = BigInteger.ONE.shiftLeft(128);

    /**
     * u128 최댓값 (2^128 - 1)
     */
    public static final BigInteger U128_MAX = TWO_POW_128.subtract(BigInteger.ONE);

    /**
     * i128 범위 [-2^127, 2^127 - 1]
     */
    public static final BigInteger I128_MAX = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    public static final BigInteger I128_MIN = BigInteger.ONE.shiftLeft(127).negate();

    /**
     * u256 최댓값 - sqrtRatio 중간 계산 상한
     */
    public static final BigInteger U256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private FixedPointMath() {
    }

    /**
     * a / b (음수가 아닌 값 전용)
     *
     * @param roundUp true면 올림, false면 내림
     */
    public static BigInteger div(BigInteger a, BigInteger b, boolean roundUp) {
        BigInteger[] qr = a.divideAndRemainder(b);
        if (roundUp && qr[1].signum() != 0) {
            return qr[0].add(BigInteger.ONE);
        }
        return qr[0];
    }

    /**
     * a * b / denominator (음수가 아닌 값 전용)
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator, boolean roundUp) {
        return div(a.multiply(b), denominator, roundUp);
    }

    public static boolean isU128(BigInteger value) {
        return value.signum() >= 0 && value.compareTo(U128_MAX) <= 0;
    }

    public static boolean isI128(BigInteger value) {
        return value.compareTo(I128_MIN) >= 0 && value.compareTo(I128_MAX) <= 0;
    }

    /**
     * u128 범위 확인
     *
     * @throws ArithmeticOverflowException 범위를 벗어나면
     */
    public static BigInteger requireU128(BigInteger value, ErrorCode code, String what) {
        if (!isU128(value)) {
            throw new ArithmeticOverflowException(code,
                    String.format("%s out of u128 range: %s", what, value));
        }
        return value;
    }

    /**
     * i128 범위 확인
     *
     * @throws ArithmeticOverflowException 범위를 벗어나면
     */
    public static BigInteger requireI128(BigInteger value, ErrorCode code, String what) {
        if (!isI128(value)) {
            throw new ArithmeticOverflowException(code,
                    String.format("%s out of i128 range: %s", what, value));
        }
        return value;
    }
}
