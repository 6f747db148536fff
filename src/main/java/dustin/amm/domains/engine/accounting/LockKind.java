package dustin.amm.domains.engine.accounting;

/**
 * 컨텍스트 종류
 */
public enum LockKind {
    LOCK,
    FORWARD
}
