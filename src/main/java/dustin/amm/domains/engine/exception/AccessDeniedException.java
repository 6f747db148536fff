package dustin.amm.domains.engine.exception;

/**
 * 권한 없음
 * Access denied
 */
public class AccessDeniedException extends AmmException {

    public AccessDeniedException(ErrorCode code, String message) {
        super(code, message);
    }
}
