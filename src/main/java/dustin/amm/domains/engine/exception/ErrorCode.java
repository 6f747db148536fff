package dustin.amm.domains.engine.exception;

/**
 * 엔진 에러 코드
 * Engine Error Code
 *
 * 모든 실패는 구체적인 코드로 식별됩니다.
 * 호출자는 메시지 문자열이 아닌 코드로 분기해야 합니다.
 */
public enum ErrorCode {
    // 검증 (Validation)
    INVALID_TICK(ErrorCategory.VALIDATION),
    INVALID_SQRT_RATIO(ErrorCategory.VALIDATION),
    INVALID_SQRT_RATIO_LIMIT(ErrorCategory.VALIDATION),
    SQRT_RATIO_LIMIT_WRONG_DIRECTION(ErrorCategory.VALIDATION),
    POOL_NOT_INITIALIZED(ErrorCategory.VALIDATION),
    POOL_ALREADY_INITIALIZED(ErrorCategory.VALIDATION),
    INVALID_TOKENS(ErrorCategory.VALIDATION),
    INVALID_FEE(ErrorCategory.VALIDATION),
    INVALID_TICK_SPACING(ErrorCategory.VALIDATION),
    INVALID_BOUNDS(ErrorCategory.VALIDATION),
    BOUNDS_TICK_SPACING(ErrorCategory.VALIDATION),
    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    EXTENSION_NOT_REGISTERED(ErrorCategory.VALIDATION),
    EXTENSION_ALREADY_REGISTERED(ErrorCategory.VALIDATION),
    INVALID_CALL_POINTS(ErrorCategory.VALIDATION),
    NOT_LOCKED(ErrorCategory.VALIDATION),

    // 산술 안전성 (Arithmetic safety)
    AMOUNT_OUT_OF_RANGE(ErrorCategory.ARITHMETIC),
    AMOUNT0_DELTA_OVERFLOW(ErrorCategory.ARITHMETIC),
    AMOUNT1_DELTA_OVERFLOW(ErrorCategory.ARITHMETIC),
    AMOUNT_BEFORE_FEE_OVERFLOW(ErrorCategory.ARITHMETIC),
    SWAP_DELTA_OVERFLOW(ErrorCategory.ARITHMETIC),
    POSITION_DELTA_OVERFLOW(ErrorCategory.ARITHMETIC),
    LIQUIDITY_OVERFLOW(ErrorCategory.ARITHMETIC),
    LIQUIDITY_UNDERFLOW(ErrorCategory.ARITHMETIC),
    MAX_LIQUIDITY_PER_TICK_EXCEEDED(ErrorCategory.ARITHMETIC),

    // 불변식 위반 (Invariant violation)
    DEBTS_NOT_ZEROED(ErrorCategory.INVARIANT),
    MUST_COLLECT_FEES_BEFORE_WITHDRAWING_ALL_LIQUIDITY(ErrorCategory.INVARIANT),
    SAVED_BALANCE_OVERFLOW(ErrorCategory.INVARIANT),
    INSUFFICIENT_BALANCE(ErrorCategory.INVARIANT),
    INSUFFICIENT_PROTOCOL_FEES(ErrorCategory.INVARIANT),

    // 권한 (Access)
    NOT_POOL_EXTENSION(ErrorCategory.ACCESS),
    NOT_OWNER(ErrorCategory.ACCESS),
    INSUFFICIENT_ALLOWANCE(ErrorCategory.ACCESS),

    // 익스텐션 (Extension)
    EXTENSION_CALL_FAILED(ErrorCategory.EXTENSION);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
