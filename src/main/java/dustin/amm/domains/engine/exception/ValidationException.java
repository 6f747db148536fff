package dustin.amm.domains.engine.exception;

/**
 * 검증 실패
 * Validation failure
 */
public class ValidationException extends AmmException {

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
