package dustin.amm.domains.engine.accounting;

import java.math.BigInteger;

import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.InvariantViolationException;
import dustin.amm.domains.engine.state.JournaledMap;
import dustin.amm.domains.engine.state.StateJournal;

/**
 * 프로토콜 수수료 적립금
 * Protocol fees collected from position withdrawals, per token
 */
public class ProtocolFees {

    private final JournaledMap<String, BigInteger> collected;

    public ProtocolFees(StateJournal journal) {
        this.collected = new JournaledMap<>(journal);
    }

    public BigInteger get(String token) {
        return collected.getOrDefault(token, BigInteger.ZERO);
    }

    public void credit(String token, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        collected.put(token, get(token).add(amount));
    }

    /**
     * 적립금 차감
     *
     * @throws InvariantViolationException 적립금 부족 (INSUFFICIENT_PROTOCOL_FEES)
     */
    public void debit(String token, BigInteger amount) {
        BigInteger available = get(token);
        if (available.compareTo(amount) < 0) {
            throw new InvariantViolationException(ErrorCode.INSUFFICIENT_PROTOCOL_FEES,
                    String.format("Insufficient protocol fees: token=%s, required=%s, available=%s",
                            token, amount, available));
        }
        BigInteger remaining = available.subtract(amount);
        if (remaining.signum() == 0) {
            collected.remove(token);
        } else {
            collected.put(token, remaining);
        }
    }
}
