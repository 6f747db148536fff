package dustin.amm.domains.engine.math;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ValidationException;

/**
 * 수수료율 (0.64 고정소수점)
 * Fee rate as a fraction of 2^64
 *
 * 예시:
 * <pre>
 * FeeRate.fromFraction(1, 20);   // 5%  = floor(2^64 / 20)
 * FeeRate.fromFraction(1, 2);    // 50% = 2^63
 * FeeRate.ZERO;                  // 수수료 없음
 * </pre>
 */
public final class FeeRate {

    public static final FeeRate ZERO = new FeeRate(BigInteger.ZERO);

    private final BigInteger value;

    private FeeRate(BigInteger value) {
        this.value = value;
    }

    /**
     * 원시값으로 생성
     *
     * @param value 0 이상 2^64 미만
     * @throws ValidationException 범위를 벗어나면
     */
    public static FeeRate of(BigInteger value) {
        if (value == null || value.signum() < 0 || value.compareTo(FixedPointMath.TWO_POW_64) >= 0) {
            throw new ValidationException(ErrorCode.INVALID_FEE,
                    String.format("Fee must be in [0, 2^64): %s", value));
        }
        return new FeeRate(value);
    }

    /**
     * 분수로 생성: floor(2^64 * numerator / denominator)
     */
    public static FeeRate fromFraction(long numerator, long denominator) {
        if (denominator <= 0 || numerator < 0) {
            throw new ValidationException(ErrorCode.INVALID_FEE,
                    String.format("Invalid fee fraction: %d/%d", numerator, denominator));
        }
        return of(FixedPointMath.TWO_POW_64.multiply(BigInteger.valueOf(numerator))
                .divide(BigInteger.valueOf(denominator)));
    }

    public BigInteger getValue() {
        return value;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((FeeRate) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        BigDecimal percent = new BigDecimal(value).multiply(BigDecimal.valueOf(100))
                .divide(new BigDecimal(FixedPointMath.TWO_POW_64), MathContext.DECIMAL64);
        return percent.stripTrailingZeros().toPlainString() + "%";
    }
}
