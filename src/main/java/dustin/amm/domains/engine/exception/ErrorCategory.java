package dustin.amm.domains.engine.exception;

/**
 * 에러 분류
 * Error Category
 */
public enum ErrorCategory {
    /** 잘못된 입력 (틱 범위, 가격 한도, 풀 상태 등) */
    VALIDATION,
    /** 표현 범위 초과 (금액, 유동성, 수수료 계산) */
    ARITHMETIC,
    /** 불변식 위반 (미정산 부채, 미수령 수수료, 보관 잔고) */
    INVARIANT,
    /** 권한 없음 */
    ACCESS,
    /** 익스텐션 훅 실패 */
    EXTENSION
}
