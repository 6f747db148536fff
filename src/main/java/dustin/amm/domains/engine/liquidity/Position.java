package dustin.amm.domains.engine.liquidity;

import java.math.BigInteger;

import dustin.amm.domains.engine.math.TokenAmounts;
import lombok.Value;

/**
 * 포지션 (불변)
 * Liquidity plus the fee-growth-inside checkpoint
 */
@Value
public class Position {

    public static final Position EMPTY = new Position(BigInteger.ZERO, FeesPerLiquidity.ZERO);

    BigInteger liquidity;

    /**
     * 마지막으로 정산한 시점의 구간 내부 누적 수수료
     */
    FeesPerLiquidity feesPerLiquidityInsideLast;

    /**
     * 체크포인트 이후 쌓인 수수료: (inside - last) * liquidity >> 128
     */
    public TokenAmounts feesAccrued(FeesPerLiquidity feesPerLiquidityInside) {
        if (liquidity.signum() == 0) {
            return TokenAmounts.ZERO;
        }
        FeesPerLiquidity diff = feesPerLiquidityInside.subtract(feesPerLiquidityInsideLast);
        return new TokenAmounts(scale(diff.getValue0()), scale(diff.getValue1()));
    }

    private BigInteger scale(BigInteger growth) {
        if (growth.signum() <= 0) {
            return BigInteger.ZERO;
        }
        return growth.multiply(liquidity).shiftRight(128);
    }
}
