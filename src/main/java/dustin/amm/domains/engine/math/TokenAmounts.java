package dustin.amm.domains.engine.math;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 토큰 쌍 금액 (token0, token1)
 * Pair of token amounts
 *
 * 부호 규칙은 사용처를 따릅니다:
 * - 풀 델타: 양수 = 풀이 받음 (호출자 부채 증가), 음수 = 풀이 지급
 * - 수수료/보관 잔고: 항상 0 이상
 */
public final class TokenAmounts {

    public static final TokenAmounts ZERO = new TokenAmounts(BigInteger.ZERO, BigInteger.ZERO);

    private final BigInteger amount0;
    private final BigInteger amount1;

    public TokenAmounts(BigInteger amount0, BigInteger amount1) {
        this.amount0 = Objects.requireNonNull(amount0, "amount0");
        this.amount1 = Objects.requireNonNull(amount1, "amount1");
    }

    public static TokenAmounts of(long amount0, long amount1) {
        return new TokenAmounts(BigInteger.valueOf(amount0), BigInteger.valueOf(amount1));
    }

    public BigInteger getAmount0() {
        return amount0;
    }

    public BigInteger getAmount1() {
        return amount1;
    }

    public boolean isZero() {
        return amount0.signum() == 0 && amount1.signum() == 0;
    }

    public TokenAmounts add(TokenAmounts other) {
        return new TokenAmounts(amount0.add(other.amount0), amount1.add(other.amount1));
    }

    public TokenAmounts negate() {
        return new TokenAmounts(amount0.negate(), amount1.negate());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenAmounts that = (TokenAmounts) o;
        return amount0.equals(that.amount0) && amount1.equals(that.amount1);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount0, amount1);
    }

    @Override
    public String toString() {
        return "(" + amount0 + ", " + amount1 + ")";
    }
}
