package dustin.amm.domains.engine.liquidity;

import java.math.BigInteger;

import lombok.Value;

/**
 * 유동성 단위당 누적 수수료 (token0, token1)
 * Fee growth per unit of liquidity, scaled by 2^128
 *
 * 정수 연산 그대로 누적하며 래핑(wraparound)하지 않습니다.
 * 그래서 구간 내부 값 계산 중간에 음수가 나올 수 있지만,
 * 체크포인트와의 차이는 항상 0 이상입니다.
 */
@Value
public class FeesPerLiquidity {

    public static final FeesPerLiquidity ZERO = new FeesPerLiquidity(BigInteger.ZERO, BigInteger.ZERO);

    BigInteger value0;

    BigInteger value1;

    public FeesPerLiquidity add(FeesPerLiquidity other) {
        return new FeesPerLiquidity(value0.add(other.value0), value1.add(other.value1));
    }

    public FeesPerLiquidity subtract(FeesPerLiquidity other) {
        return new FeesPerLiquidity(value0.subtract(other.value0), value1.subtract(other.value1));
    }

    /**
     * 수수료 금액 → 유동성 단위당 값: (amount << 128) / liquidity
     */
    public static FeesPerLiquidity fromAmounts(BigInteger amount0, BigInteger amount1, BigInteger liquidity) {
        if (liquidity.signum() == 0) {
            return ZERO;
        }
        return new FeesPerLiquidity(amount0.shiftLeft(128).divide(liquidity), amount1.shiftLeft(128).divide(liquidity));
    }
}
