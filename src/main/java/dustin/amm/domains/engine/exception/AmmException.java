package dustin.amm.domains.engine.exception;

/**
 * 엔진 예외의 공통 부모
 * Base exception for all engine failures
 *
 * 어떤 예외든 발생하면 현재 작업 전체가 중단되고,
 * 그 작업 안에서 일어난 모든 상태 변경이 되돌려집니다.
 */
public class AmmException extends RuntimeException {

    private final ErrorCode code;

    public AmmException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AmmException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
