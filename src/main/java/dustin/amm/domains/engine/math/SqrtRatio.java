package dustin.amm.domains.engine.math;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * 제곱근 가격 (128.128 고정소수점)
 * Square-root price, unsigned 128.128 fixed point
 *
 * 실제 값 = fixed / 2^128
 * 가격(token1/token0) = (fixed / 2^128)^2
 *
 * 예시:
 * <pre>
 * SqrtRatio.ONE  // 가격 1.0 (tick 0)
 * TickMath.toSqrtRatio(100)  // 1.0000005^100 * 2^128
 * </pre>
 *
 * 유효 범위 검사는 {@link TickMath#requireValid(SqrtRatio)}가 담당합니다.
 * 이 타입 자체는 중간 계산 결과(범위 밖일 수 있음)도 담을 수 있습니다.
 */
public final class SqrtRatio implements Comparable<SqrtRatio> {

    public static final SqrtRatio ONE = new SqrtRatio(FixedPointMath.TWO_POW_128);

    private final BigInteger fixed;

    private SqrtRatio(BigInteger fixed) {
        this.fixed = fixed;
    }

    /**
     * 고정소수점 원시값으로 생성
     *
     * @param fixed 0 이상 2^256 미만
     */
    public static SqrtRatio of(BigInteger fixed) {
        if (fixed == null || fixed.signum() < 0 || fixed.compareTo(FixedPointMath.U256_MAX) > 0) {
            throw new IllegalArgumentException("sqrt ratio must fit in u256: " + fixed);
        }
        return new SqrtRatio(fixed);
    }

    /**
     * 고정소수점 원시값 (스케일 2^128)
     */
    public BigInteger getFixed() {
        return fixed;
    }

    public boolean isGreaterThan(SqrtRatio other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(SqrtRatio other) {
        return compareTo(other) < 0;
    }

    public static SqrtRatio min(SqrtRatio a, SqrtRatio b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static SqrtRatio max(SqrtRatio a, SqrtRatio b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * 사람이 읽을 수 있는 가격 (로그용, 근사값)
     */
    public BigDecimal toPrice() {
        BigDecimal sqrt = new BigDecimal(fixed).divide(new BigDecimal(FixedPointMath.TWO_POW_128), MathContext.DECIMAL64);
        return sqrt.multiply(sqrt, MathContext.DECIMAL64);
    }

    @Override
    public int compareTo(SqrtRatio other) {
        return fixed.compareTo(other.fixed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fixed.equals(((SqrtRatio) o).fixed);
    }

    @Override
    public int hashCode() {
        return fixed.hashCode();
    }

    @Override
    public String toString() {
        return fixed + " (price~" + toPrice().toPlainString() + ")";
    }
}
