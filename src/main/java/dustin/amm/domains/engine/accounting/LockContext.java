package dustin.amm.domains.engine.accounting;

import java.math.BigInteger;
import java.util.Map;

import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.InvariantViolationException;
import dustin.amm.domains.engine.state.JournaledMap;
import dustin.amm.domains.engine.state.StateJournal;
import lombok.Getter;

/**
 * lock / forward 컨텍스트
 * Lock context with per-token signed debt
 *
 * 부채 부호: 양수 = locker가 코어에 갚아야 함, 음수 = 코어가 locker에 줘야 함
 * 0이 된 토큰은 맵에서 제거하므로 맵이 비어 있으면 정산 완료입니다.
 */
@Getter
public class LockContext {

    private final long id;

    /**
     * 부모 컨텍스트 ID (최상위면 null)
     */
    private final Long parentId;

    private final String locker;

    private final LockKind kind;

    private final JournaledMap<String, BigInteger> debts;

    LockContext(StateJournal journal, long id, Long parentId, String locker, LockKind kind) {
        this.id = id;
        this.parentId = parentId;
        this.locker = locker;
        this.kind = kind;
        this.debts = new JournaledMap<>(journal);
    }

    /**
     * 토큰 부채 조회 (없으면 0)
     */
    public BigInteger getDebt(String token) {
        return debts.getOrDefault(token, BigInteger.ZERO);
    }

    public Map<String, BigInteger> getDebtsView() {
        return debts.asMap();
    }

    void addDebt(String token, BigInteger delta) {
        if (delta.signum() == 0) {
            return;
        }
        debts.merge(token, delta, (current, added) -> {
            BigInteger next = current.add(added);
            return next.signum() == 0 ? null : next;
        });
    }

    /**
     * 자식 컨텍스트 부채를 이 컨텍스트로 합침
     */
    void absorb(LockContext child) {
        child.debts.asMap().forEach(this::addDebt);
    }

    /**
     * 모든 토큰 부채가 0인지 확인
     *
     * @throws InvariantViolationException DEBTS_NOT_ZEROED
     */
    void requireZeroDebts() {
        if (!debts.isEmpty()) {
            throw new InvariantViolationException(ErrorCode.DEBTS_NOT_ZEROED,
                    String.format("Debts not zeroed: lockId=%d, locker=%s, debts=%s", id, locker, debts.asMap()));
        }
    }
}
