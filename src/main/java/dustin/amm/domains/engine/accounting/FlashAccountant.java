// =====================================================
// FlashAccountant - 플래시 정산 (lock / forward)
// =====================================================
// 역할: 여러 토큰 이동(스왑, 예치, 인출, 차입, 지불)을 하나의
//       "전부 성공 또는 전부 취소" 작업으로 묶고, 끝날 때 부채 0을 강제
//
// 처리 흐름 (lock):
// 1. 새 컨텍스트 생성 (순차 ID, 부모 ID, locker 주소)
// 2. 저널 세이브포인트 설정
// 3. locker.locked() 실행 → 그 안에서 swap / updatePosition / withdraw / pay ...
// 4. 컨텍스트의 모든 토큰 부채가 0인지 확인 (아니면 DEBTS_NOT_ZEROED)
// 5. 실패 시 세이브포인트 이후 모든 변경 롤백
//
// forward:
// - 현재 컨텍스트 아래에 대상(target) 명의의 자식 컨텍스트 생성
// - 자식이 성공하면 자식 부채를 부모에 합침 (부모가 최종 정산 책임)
// - 자식이 실패하면 자식 변경만 롤백되고 예외는 부모로 전파
//
// 컨텍스트 스택:
// - ArrayDeque<LockContext> (맨 위 = 현재 컨텍스트)
// - 재진입은 호출 스택 재귀로만 발생 (싱글 스레드)
// =====================================================

package dustin.amm.domains.engine.accounting;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;

import dustin.amm.domains.engine.balance.TokenLedger;
import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ValidationException;
import dustin.amm.domains.engine.state.StateJournal;
import lombok.extern.slf4j.Slf4j;

/**
 * 플래시 정산기
 * Flash accountant
 */
@Slf4j
public class FlashAccountant {

    private final StateJournal journal;
    private final TokenLedger tokens;

    /**
     * 코어가 토큰을 보관하는 계정
     */
    private final String coreAccount;

    private final Deque<LockContext> contexts = new ArrayDeque<>();

    private long nextLockId;

    public FlashAccountant(StateJournal journal, TokenLedger tokens, String coreAccount) {
        this.journal = journal;
        this.tokens = tokens;
        this.coreAccount = coreAccount;
    }

    /**
     * lock 컨텍스트 열기
     *
     * @param locker 실행할 locker
     * @param data locker에 넘길 데이터
     * @return locker 결과
     * @throws dustin.amm.domains.engine.exception.InvariantViolationException 부채가 남은 경우 (DEBTS_NOT_ZEROED)
     */
    public <T, R> R lock(Locker<T, R> locker, T data) {
        return journal.atomically(() -> {
            LockContext context = open(locker.getAddress(), LockKind.LOCK);
            log.debug("[FlashAccountant] lock 시작: lockId={}, locker={}", context.getId(), context.getLocker());
            try {
                R result = locker.locked(context.getId(), data);
                context.requireZeroDebts();
                log.debug("[FlashAccountant] lock 완료: lockId={}", context.getId());
                return result;
            } catch (RuntimeException e) {
                log.warn("[FlashAccountant] lock 중단: lockId={}, locker={}, error={}",
                        context.getId(), context.getLocker(), e.getMessage());
                throw e;
            } finally {
                contexts.pop();
            }
        });
    }

    /**
     * 현재 컨텍스트에서 대상에게 자식 컨텍스트 위임
     *
     * @throws ValidationException 열린 컨텍스트가 없으면 (NOT_LOCKED)
     */
    public <T, R> R forward(Forwardee<T, R> target, T data) {
        LockContext parent = current();
        return journal.atomically(() -> {
            LockContext child = open(target.getAddress(), LockKind.FORWARD);
            try {
                R result = target.forwarded(child.getId(), parent.getLocker(), data);
                parent.absorb(child);
                return result;
            } finally {
                contexts.pop();
            }
        });
    }

    /**
     * 현재 컨텍스트 부채 가감 (엔진 내부용)
     */
    public void accountDebt(String token, BigInteger delta) {
        current().addDebt(token, delta);
    }

    /**
     * 코어 잔고에서 수령자에게 토큰 지급 → 부채 증가
     */
    public void withdraw(String token, String recipient, BigInteger amount) {
        LockContext context = current();
        tokens.transfer(coreAccount, recipient, token, amount);
        context.addDebt(token, amount);
    }

    /**
     * locker 잔고에서 코어로 지불 → 부채 감소
     */
    public void pay(String token, BigInteger amount) {
        LockContext context = current();
        tokens.transfer(context.getLocker(), coreAccount, token, amount);
        context.addDebt(token, amount.negate());
    }

    /**
     * 다른 계정(from)이 현재 locker에게 준 허용량으로 지불 → 부채 감소
     * from이 코어에 준 허용량은 쓰지 않습니다.
     *
     * @throws dustin.amm.domains.engine.exception.AccessDeniedException 허용량 부족 (INSUFFICIENT_ALLOWANCE)
     */
    public void payFrom(String from, String token, BigInteger amount) {
        LockContext context = current();
        tokens.transferFrom(context.getLocker(), from, coreAccount, token, amount);
        context.addDebt(token, amount.negate());
    }

    /**
     * 현재 컨텍스트 (없으면 NOT_LOCKED)
     */
    public LockContext current() {
        LockContext context = contexts.peek();
        if (context == null) {
            throw new ValidationException(ErrorCode.NOT_LOCKED, "No active lock context");
        }
        return context;
    }

    /**
     * 현재 locker 주소 (컨텍스트 밖이면 null)
     */
    public String currentLocker() {
        LockContext context = contexts.peek();
        return context == null ? null : context.getLocker();
    }

    public boolean isLocked() {
        return !contexts.isEmpty();
    }

    public String getCoreAccount() {
        return coreAccount;
    }

    private LockContext open(String locker, LockKind kind) {
        LockContext parent = contexts.peek();
        LockContext context = new LockContext(journal, nextLockId++, parent == null ? null : parent.getId(), locker, kind);
        contexts.push(context);
        return context;
    }
}
