package dustin.amm.domains.engine.accounting;

import java.math.BigInteger;

import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.InvariantViolationException;
import dustin.amm.domains.engine.exception.ValidationException;
import dustin.amm.domains.engine.math.FixedPointMath;
import dustin.amm.domains.engine.math.TokenAmounts;
import dustin.amm.domains.engine.state.JournaledMap;
import dustin.amm.domains.engine.state.StateJournal;
import lombok.Value;

/**
 * 보관 잔고 (지연 정산)
 * Saved balances keyed by (owner, token0, token1, salt)
 *
 * 토큰을 밖으로 내보내지 않고 코어 안에 맡겨 두었다가
 * 다음 lock에서 꺼내 쓸 때 사용합니다.
 * 각 값은 [0, U128_MAX] 범위를 유지해야 합니다.
 */
public class SavedBalances {

    @Value
    public static class Key {
        String owner;
        String token0;
        String token1;
        long salt;
    }

    private final JournaledMap<Key, TokenAmounts> balances;

    public SavedBalances(StateJournal journal) {
        this.balances = new JournaledMap<>(journal);
    }

    /**
     * 보관 잔고 조회 (없으면 (0, 0))
     */
    public TokenAmounts get(String owner, String token0, String token1, long salt) {
        return balances.getOrDefault(new Key(owner, token0, token1, salt), TokenAmounts.ZERO);
    }

    /**
     * 보관 잔고 가감
     *
     * @return 변경 후 잔고
     * @throws InvariantViolationException 결과가 [0, U128_MAX]를 벗어나면 (SAVED_BALANCE_OVERFLOW)
     */
    public TokenAmounts update(String owner, String token0, String token1, long salt,
                               BigInteger delta0, BigInteger delta1) {
        if (token0 == null || token1 == null || token0.compareTo(token1) >= 0) {
            throw new ValidationException(ErrorCode.INVALID_TOKENS,
                    String.format("token0 must sort before token1: token0=%s, token1=%s", token0, token1));
        }
        Key key = new Key(owner, token0, token1, salt);
        TokenAmounts current = balances.getOrDefault(key, TokenAmounts.ZERO);
        TokenAmounts next = new TokenAmounts(current.getAmount0().add(delta0), current.getAmount1().add(delta1));
        requireInRange(next.getAmount0(), key);
        requireInRange(next.getAmount1(), key);

        if (next.isZero()) {
            balances.remove(key);
        } else {
            balances.put(key, next);
        }
        return next;
    }

    private static void requireInRange(BigInteger value, Key key) {
        if (!FixedPointMath.isU128(value)) {
            throw new InvariantViolationException(ErrorCode.SAVED_BALANCE_OVERFLOW,
                    String.format("Saved balance out of range: key=%s, value=%s", key, value));
        }
    }
}
