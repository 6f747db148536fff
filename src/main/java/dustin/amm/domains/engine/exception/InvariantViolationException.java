package dustin.amm.domains.engine.exception;

/**
 * 불변식 위반
 * Invariant violation
 */
public class InvariantViolationException extends AmmException {

    public InvariantViolationException(ErrorCode code, String message) {
        super(code, message);
    }
}
