package dustin.amm.domains.engine.exception;

/**
 * 표현 범위 초과
 * Arithmetic overflow
 */
public class ArithmeticOverflowException extends AmmException {

    public ArithmeticOverflowException(ErrorCode code, String message) {
        super(code, message);
    }
}
