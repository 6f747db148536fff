package dustin.amm.domains.engine.math;

import java.math.BigInteger;

import dustin.amm.domains.engine.exception.ArithmeticOverflowException;
import dustin.amm.domains.engine.exception.ErrorCode;

/**
 * 수수료 계산
 * Fee math
 *
 * 두 함수 모두 풀에 유리하게 올림합니다.
 */
public final class FeeMath {

    private FeeMath() {
    }

    /**
     * 금액에 부과되는 수수료: ceil(amount * fee / 2^64)
     *
     * @param amount 0 이상
     */
    public static BigInteger computeFee(BigInteger amount, FeeRate fee) {
        return FixedPointMath.mulDiv(amount, fee.getValue(), FixedPointMath.TWO_POW_64, true);
    }

    /**
     * 수수료 차감 후 금액이 afterFee가 되도록 하는 수수료 포함 금액
     * ceil(afterFee * 2^64 / (2^64 - fee))
     *
     * @throws ArithmeticOverflowException 결과가 u128을 넘으면
     */
    public static BigInteger amountBeforeFee(BigInteger afterFee, FeeRate fee) {
        BigInteger result = FixedPointMath.mulDiv(afterFee, FixedPointMath.TWO_POW_64,
                FixedPointMath.TWO_POW_64.subtract(fee.getValue()), true);
        if (!FixedPointMath.isU128(result)) {
            throw new ArithmeticOverflowException(ErrorCode.AMOUNT_BEFORE_FEE_OVERFLOW,
                    String.format("Amount before fee overflows u128: afterFee=%s, fee=%s", afterFee, fee));
        }
        return result;
    }
}
