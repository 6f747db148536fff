// =====================================================
// TokenLedger - 메모리 기반 토큰 잔고 관리
// =====================================================
// 역할: 계정별 토큰 잔고와 출금 허용량(allowance)을 메모리에 보관
//       FlashAccountant가 withdraw / pay / payFrom 할 때 실제 토큰 이동
//
// 핵심 설계:
// 1. HashMap으로 O(1) 조회/업데이트 (JournaledMap → 실패 시 롤백)
// 2. 금액은 BigInteger 정수 (u128 범위, 소수점 없음)
// 3. 코어 계정(coreAccount)도 일반 계정처럼 잔고를 가짐
//
// 잔고 상태 변화:
// 1. withdraw → 코어 잔고 차감, 수령자 잔고 증가
// 2. pay      → locker 잔고 차감, 코어 잔고 증가
// 3. payFrom  → allowance 차감, from 잔고 차감, 코어 잔고 증가
//
// 자료구조:
// 1. HashMap<BalanceKey, BigInteger>
//    - BalanceKey: (account, token) 튜플
// 2. HashMap<AllowanceKey, BigInteger>
//    - AllowanceKey: (owner, spender, token) 튜플
// =====================================================

package dustin.amm.domains.engine.balance;

import java.math.BigInteger;
import java.util.Objects;

import dustin.amm.domains.engine.exception.AccessDeniedException;
import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.InvariantViolationException;
import dustin.amm.domains.engine.exception.ValidationException;
import dustin.amm.domains.engine.state.JournaledMap;
import dustin.amm.domains.engine.state.StateJournal;

/**
 * 잔고 키
 * (account, token) 튜플
 */
class BalanceKey {
    private final String account;
    private final String token;

    BalanceKey(String account, String token) {
        this.account = account;
        this.token = token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BalanceKey that = (BalanceKey) o;
        return Objects.equals(account, that.account) && Objects.equals(token, that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(account, token);
    }
}

/**
 * 허용량 키
 * (owner, spender, token) 튜플
 */
class AllowanceKey {
    private final String owner;
    private final String spender;
    private final String token;

    AllowanceKey(String owner, String spender, String token) {
        this.owner = owner;
        this.spender = spender;
        this.token = token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AllowanceKey that = (AllowanceKey) o;
        return Objects.equals(owner, that.owner)
                && Objects.equals(spender, that.spender)
                && Objects.equals(token, that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, spender, token);
    }
}

/**
 * 메모리 기반 토큰 장부
 *
 * 예시:
 * ("alice", "ETH")  -> 1000
 * ("core", "ETH")   -> 250
 */
public class TokenLedger {

    private final JournaledMap<BalanceKey, BigInteger> balances;
    private final JournaledMap<AllowanceKey, BigInteger> allowances;

    public TokenLedger(StateJournal journal) {
        this.balances = new JournaledMap<>(journal);
        this.allowances = new JournaledMap<>(journal);
    }

    /**
     * 잔고 조회 (없으면 0)
     */
    public BigInteger getBalance(String account, String token) {
        return balances.getOrDefault(new BalanceKey(account, token), BigInteger.ZERO);
    }

    /**
     * 잔고 충분 여부
     */
    public boolean checkSufficientBalance(String account, String token, BigInteger requiredAmount) {
        return getBalance(account, token).compareTo(requiredAmount) >= 0;
    }

    /**
     * 입금 (외부에서 토큰이 들어옴)
     *
     * @throws ValidationException 음수 금액
     */
    public void mint(String account, String token, BigInteger amount) {
        requireNonNegative(amount);
        setBalance(account, token, getBalance(account, token).add(amount));
    }

    /**
     * 잔고 이체
     *
     * @throws InvariantViolationException 잔고 부족 시 (INSUFFICIENT_BALANCE)
     */
    public void transfer(String from, String to, String token, BigInteger amount) {
        requireNonNegative(amount);
        if (amount.signum() == 0) {
            return;
        }
        BigInteger available = getBalance(from, token);
        if (available.compareTo(amount) < 0) {
            throw new InvariantViolationException(ErrorCode.INSUFFICIENT_BALANCE,
                    String.format("Insufficient balance: account=%s, token=%s, required=%s, available=%s",
                            from, token, amount, available));
        }
        setBalance(from, token, available.subtract(amount));
        setBalance(to, token, getBalance(to, token).add(amount));
    }

    /**
     * 출금 허용량 설정 (덮어쓰기)
     */
    public void approve(String owner, String spender, String token, BigInteger amount) {
        requireNonNegative(amount);
        AllowanceKey key = new AllowanceKey(owner, spender, token);
        if (amount.signum() == 0) {
            allowances.remove(key);
        } else {
            allowances.put(key, amount);
        }
    }

    /**
     * 출금 허용량 조회 (없으면 0)
     */
    public BigInteger getAllowance(String owner, String spender, String token) {
        return allowances.getOrDefault(new AllowanceKey(owner, spender, token), BigInteger.ZERO);
    }

    /**
     * 허용량을 소비하며 이체
     *
     * @throws AccessDeniedException 허용량 부족 (INSUFFICIENT_ALLOWANCE)
     * @throws InvariantViolationException 잔고 부족 (INSUFFICIENT_BALANCE)
     */
    public void transferFrom(String spender, String from, String to, String token, BigInteger amount) {
        BigInteger allowance = getAllowance(from, spender, token);
        if (allowance.compareTo(amount) < 0) {
            throw new AccessDeniedException(ErrorCode.INSUFFICIENT_ALLOWANCE,
                    String.format("Insufficient allowance: owner=%s, spender=%s, token=%s, required=%s, allowance=%s",
                            from, spender, token, amount, allowance));
        }
        approve(from, spender, token, allowance.subtract(amount));
        transfer(from, to, token, amount);
    }

    private void setBalance(String account, String token, BigInteger amount) {
        BalanceKey key = new BalanceKey(account, token);
        if (amount.signum() == 0) {
            balances.remove(key);
        } else {
            balances.put(key, amount);
        }
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT,
                    String.format("Amount must be non-negative: %s", amount));
        }
    }
}
