package dustin.amm.domains.engine.accounting;

import java.util.function.BiFunction;

/**
 * lock 호출자
 * Callback run inside a lock context
 *
 * @param <T> 전달 데이터 타입
 * @param <R> 결과 타입
 */
public interface Locker<T, R> {

    /**
     * 이 locker의 계정 주소 (토큰 지급 / 부채 주체)
     */
    String getAddress();

    /**
     * lock 컨텍스트 안에서 실행
     *
     * @param lockId 컨텍스트 ID
     * @param data lock 호출 시 넘긴 데이터
     */
    R locked(long lockId, T data);

    /**
     * 람다로 locker 생성
     */
    static <T, R> Locker<T, R> of(String address, BiFunction<Long, T, R> handler) {
        return new Locker<>() {
            @Override
            public String getAddress() {
                return address;
            }

            @Override
            public R locked(long lockId, T data) {
                return handler.apply(lockId, data);
            }
        };
    }
}
