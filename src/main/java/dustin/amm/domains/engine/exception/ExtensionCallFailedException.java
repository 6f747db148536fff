package dustin.amm.domains.engine.exception;

/**
 * 익스텐션 훅 실패
 * Extension hook failure
 * 
 * 엔진 예외가 아닌 예외를 훅이 던졌을 때 원인을 담아 감쌉니다.
 */
public class ExtensionCallFailedException extends AmmException {

    public ExtensionCallFailedException(String message, Throwable cause) {
        super(ErrorCode.EXTENSION_CALL_FAILED, message, cause);
    }
}
