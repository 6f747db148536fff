package dustin.amm.domains.engine.accounting;

/**
 * forward 대상
 * Target that runs a child context under its own identity
 *
 * 자식 컨텍스트의 부채는 성공 시 부모 컨텍스트로 합쳐집니다.
 */
public interface Forwardee<T, R> {

    String getAddress();

    /**
     * @param lockId 자식 컨텍스트 ID
     * @param originalLocker forward를 호출한 부모 locker 주소
     */
    R forwarded(long lockId, String originalLocker, T data);

    @FunctionalInterface
    interface Handler<T, R> {
        R handle(long lockId, String originalLocker, T data);
    }

    static <T, R> Forwardee<T, R> of(String address, Handler<T, R> handler) {
        return new Forwardee<>() {
            @Override
            public String getAddress() {
                return address;
            }

            @Override
            public R forwarded(long lockId, String originalLocker, T data) {
                return handler.handle(lockId, originalLocker, data);
            }
        };
    }
}
