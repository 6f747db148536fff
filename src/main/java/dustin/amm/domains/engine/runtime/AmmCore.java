// =====================================================
// AmmCore - 집중 유동성 AMM 코어
// =====================================================
// 역할: 모든 풀 / 포지션 / 스왑 / 정산 작업을 담당하는 단일 서비스 객체
//
// 핵심 설계:
// 1. 싱글 스레드 엔진 - 모든 호출을 순차 처리 (호출자가 직렬화)
// 2. 메모리 기반 처리 - 모든 상태는 저널 기반 저장소에 보관
// 3. 모든 작업은 StateJournal.atomically()로 감싸짐
//    → 어느 단계에서 실패해도 그 작업의 변경은 전부 취소
//
// 구성 요소:
// 1. PoolRegistry        - PoolId → PoolState
// 2. TickStore/TickBitmap - 틱 엔트리, 초기화된 틱 인덱스
// 3. LiquidityLedger     - 포지션, 수수료 체크포인트
// 4. SwapEngine          - 틱 단위 스왑 루프
// 5. FlashAccountant     - lock / forward 컨텍스트, 토큰별 부채
// 6. SavedBalances       - 지연 정산 잔고
// 7. ProtocolFees        - 인출 수수료 적립금
// 8. ExtensionDispatcher - 익스텐션 훅
// 9. TokenLedger         - 계정별 토큰 잔고 / 허용량
//
// 처리 흐름 (예: 스왑):
// 1. lock(locker) → locker.locked() 안에서 swap() 호출
// 2. beforeSwap 훅 → SwapEngine.swap() → 부채 기록 → afterSwap 훅
// 3. locker가 pay() / withdraw()로 부채 정산
// 4. lock 종료 시 모든 토큰 부채가 0인지 확인
// =====================================================

package dustin.amm.domains.engine.runtime;

import java.math.BigInteger;

import dustin.amm.domains.engine.accounting.FlashAccountant;
import dustin.amm.domains.engine.accounting.Forwardee;
import dustin.amm.domains.engine.accounting.Locker;
import dustin.amm.domains.engine.accounting.ProtocolFees;
import dustin.amm.domains.engine.accounting.SavedBalances;
import dustin.amm.domains.engine.balance.TokenLedger;
import dustin.amm.domains.engine.exception.AccessDeniedException;
import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ValidationException;
import dustin.amm.domains.engine.extension.CallPoints;
import dustin.amm.domains.engine.extension.Extension;
import dustin.amm.domains.engine.extension.ExtensionDispatcher;
import dustin.amm.domains.engine.liquidity.Bounds;
import dustin.amm.domains.engine.liquidity.FeesPerLiquidity;
import dustin.amm.domains.engine.liquidity.LiquidityLedger;
import dustin.amm.domains.engine.liquidity.Position;
import dustin.amm.domains.engine.liquidity.PositionKey;
import dustin.amm.domains.engine.liquidity.UpdatePositionParameters;
import dustin.amm.domains.engine.liquidity.UpdatePositionResult;
import dustin.amm.domains.engine.math.FixedPointMath;
import dustin.amm.domains.engine.math.SqrtRatio;
import dustin.amm.domains.engine.math.TokenAmounts;
import dustin.amm.domains.engine.pool.PoolId;
import dustin.amm.domains.engine.pool.PoolKey;
import dustin.amm.domains.engine.pool.PoolRegistry;
import dustin.amm.domains.engine.pool.PoolState;
import dustin.amm.domains.engine.state.StateJournal;
import dustin.amm.domains.engine.swap.SwapEngine;
import dustin.amm.domains.engine.swap.SwapParameters;
import dustin.amm.domains.engine.swap.SwapResult;
import dustin.amm.domains.engine.tick.TickInfo;
import dustin.amm.domains.engine.tick.TickStore;
import lombok.extern.slf4j.Slf4j;

/**
 * AMM 코어
 * Concentrated-liquidity AMM core with flash accounting
 *
 * 싱글 스레드 전용입니다. 여러 스레드에서 쓰려면 호출자가 직렬화해야 합니다.
 */
@Slf4j
public class AmmCore {

    private final StateJournal journal;
    private final TokenLedger tokens;
    private final PoolRegistry pools;
    private final LiquidityLedger ledger;
    private final SwapEngine swapEngine;
    private final FlashAccountant accountant;
    private final SavedBalances savedBalances;
    private final ProtocolFees protocolFees;
    private final ExtensionDispatcher extensions;

    /**
     * 프로토콜 수수료 인출 권한자
     */
    private final String owner;

    /**
     * swap 편의 메서드가 쓰는 skipAhead
     */
    private final int defaultSkipAhead;

    /**
     * 새 코어 생성
     *
     * @param coreAccount 코어가 토큰을 보관하는 계정
     * @param owner 프로토콜 수수료 인출 권한자
     * @param defaultSkipAhead 기본 skipAhead
     */
    public AmmCore(String coreAccount, String owner, int defaultSkipAhead) {
        this.journal = new StateJournal();
        this.tokens = new TokenLedger(journal);
        this.pools = new PoolRegistry(journal);
        this.ledger = new LiquidityLedger(journal, pools, new TickStore(journal));
        this.swapEngine = new SwapEngine(pools, ledger);
        this.accountant = new FlashAccountant(journal, tokens, coreAccount);
        this.savedBalances = new SavedBalances(journal);
        this.protocolFees = new ProtocolFees(journal);
        this.extensions = new ExtensionDispatcher();
        this.owner = owner;
        this.defaultSkipAhead = defaultSkipAhead;
        log.info("[AmmCore] 코어 생성: coreAccount={}, owner={}, defaultSkipAhead={}",
                coreAccount, owner, defaultSkipAhead);
    }

    // =====================================================
    // 익스텐션 / 풀
    // =====================================================

    /**
     * 익스텐션 등록
     */
    public void registerExtension(Extension extension, CallPoints callPoints) {
        extensions.register(extension, callPoints);
    }

    /**
     * 풀 초기화
     *
     * lock 안에서 호출하면 현재 locker가 훅의 caller가 되고,
     * lock 밖이면 caller는 null 입니다.
     *
     * @return 시작 가격
     * @throws ValidationException 미등록 익스텐션, 중복 초기화, 범위 밖 틱
     */
    public SqrtRatio initializePool(PoolKey poolKey, int tick) {
        return journal.atomically(() -> {
            String caller = accountant.currentLocker();
            extensions.requireRegistered(poolKey);
            extensions.dispatch(caller, poolKey, CallPoints::isBeforeInitializePool, "beforeInitializePool",
                    ext -> ext.beforeInitializePool(caller, poolKey, tick));

            SqrtRatio sqrtRatio = pools.initialize(poolKey.toId(), tick);

            extensions.dispatch(caller, poolKey, CallPoints::isAfterInitializePool, "afterInitializePool",
                    ext -> ext.afterInitializePool(caller, poolKey, tick, sqrtRatio));
            log.info("[AmmCore] 풀 생성: key={}, tick={}", poolKey, tick);
            return sqrtRatio;
        });
    }

    // =====================================================
    // 플래시 정산
    // =====================================================

    public <T, R> R lock(Locker<T, R> locker, T data) {
        return accountant.lock(locker, data);
    }

    public <T, R> R forward(Forwardee<T, R> target, T data) {
        return accountant.forward(target, data);
    }

    /**
     * 코어 잔고에서 토큰 지급 (부채 증가)
     */
    public void withdraw(String token, String recipient, BigInteger amount) {
        requireAmount(amount);
        journal.atomically(() -> accountant.withdraw(token, recipient, amount));
    }

    /**
     * locker 잔고에서 코어로 지불 (부채 감소)
     */
    public void pay(String token, BigInteger amount) {
        requireAmount(amount);
        journal.atomically(() -> accountant.pay(token, amount));
    }

    /**
     * from 계정이 현재 locker에게 준 허용량으로 지불 (부채 감소)
     */
    public void payFrom(String from, String token, BigInteger amount) {
        requireAmount(amount);
        journal.atomically(() -> accountant.payFrom(from, token, amount));
    }

    /**
     * 보관 잔고 가감
     * 양수 델타 = 보관 (부채 증가), 음수 델타 = 꺼냄 (부채 감소)
     *
     * @return 변경 후 보관 잔고
     */
    public TokenAmounts updateSavedBalances(String token0, String token1, long salt,
                                            BigInteger delta0, BigInteger delta1) {
        return journal.atomically(() -> {
            String locker = accountant.current().getLocker();
            TokenAmounts balance = savedBalances.update(locker, token0, token1, salt, delta0, delta1);
            accountant.accountDebt(token0, delta0);
            accountant.accountDebt(token1, delta1);
            return balance;
        });
    }

    // =====================================================
    // 스왑 / 포지션
    // =====================================================

    /**
     * 스왑 (lock 안에서만)
     */
    public SwapResult swap(PoolKey poolKey, SwapParameters params) {
        return journal.atomically(() -> {
            String locker = accountant.current().getLocker();
            extensions.dispatch(locker, poolKey, CallPoints::isBeforeSwap, "beforeSwap",
                    ext -> ext.beforeSwap(locker, poolKey, params));

            SwapResult result = swapEngine.swap(poolKey, params);
            accountant.accountDebt(poolKey.getToken0(), result.getDelta().getAmount0());
            accountant.accountDebt(poolKey.getToken1(), result.getDelta().getAmount1());

            extensions.dispatch(locker, poolKey, CallPoints::isAfterSwap, "afterSwap",
                    ext -> ext.afterSwap(locker, poolKey, params, result.getDelta(), result.getStateAfter()));
            return result;
        });
    }

    /**
     * 스왑 (기본 skipAhead)
     */
    public SwapResult swap(PoolKey poolKey, BigInteger amount, boolean isToken1, SqrtRatio sqrtRatioLimit) {
        return swap(poolKey, SwapParameters.builder()
                .amount(amount)
                .isToken1(isToken1)
                .sqrtRatioLimit(sqrtRatioLimit)
                .skipAhead(defaultSkipAhead)
                .build());
    }

    /**
     * 포지션 유동성 변경 (lock 안에서만, 소유자 = 현재 locker)
     */
    public UpdatePositionResult updatePosition(PoolKey poolKey, UpdatePositionParameters params) {
        return journal.atomically(() -> {
            String locker = accountant.current().getLocker();
            extensions.dispatch(locker, poolKey, CallPoints::isBeforeUpdatePosition, "beforeUpdatePosition",
                    ext -> ext.beforeUpdatePosition(locker, poolKey, params));

            UpdatePositionResult result = ledger.updatePosition(locker, poolKey, params);
            protocolFees.credit(poolKey.getToken0(), result.getProtocolFees().getAmount0());
            protocolFees.credit(poolKey.getToken1(), result.getProtocolFees().getAmount1());
            accountant.accountDebt(poolKey.getToken0(), result.getDelta().getAmount0());
            accountant.accountDebt(poolKey.getToken1(), result.getDelta().getAmount1());

            PoolState stateAfter = pools.require(poolKey.toId());
            extensions.dispatch(locker, poolKey, CallPoints::isAfterUpdatePosition, "afterUpdatePosition",
                    ext -> ext.afterUpdatePosition(locker, poolKey, params, result.getDelta(), stateAfter));
            return result;
        });
    }

    /**
     * 포지션 수수료 수령 (부채 감소)
     *
     * @return 수령한 수수료
     */
    public TokenAmounts collectFees(PoolKey poolKey, long salt, Bounds bounds) {
        return journal.atomically(() -> {
            String locker = accountant.current().getLocker();
            extensions.dispatch(locker, poolKey, CallPoints::isBeforeCollectFees, "beforeCollectFees",
                    ext -> ext.beforeCollectFees(locker, poolKey, salt, bounds));

            TokenAmounts fees = ledger.collectFees(locker, poolKey, salt, bounds);
            accountant.accountDebt(poolKey.getToken0(), fees.getAmount0().negate());
            accountant.accountDebt(poolKey.getToken1(), fees.getAmount1().negate());

            extensions.dispatch(locker, poolKey, CallPoints::isAfterCollectFees, "afterCollectFees",
                    ext -> ext.afterCollectFees(locker, poolKey, salt, bounds, fees));
            return fees;
        });
    }

    /**
     * 풀 익스텐션이 활성 유동성에 수수료를 기부 (부채 증가)
     *
     * @throws AccessDeniedException locker가 풀 익스텐션이 아니면 (NOT_POOL_EXTENSION)
     */
    public void accumulateAsFees(PoolKey poolKey, BigInteger amount0, BigInteger amount1) {
        requireAmount(amount0);
        requireAmount(amount1);
        journal.atomically(() -> {
            String locker = accountant.current().getLocker();
            if (!poolKey.hasExtension() || !poolKey.getExtension().equals(locker)) {
                throw new AccessDeniedException(ErrorCode.NOT_POOL_EXTENSION,
                        String.format("Only the pool extension may accumulate fees: locker=%s, extension=%s",
                                locker, poolKey.getExtension()));
            }
            PoolId poolId = poolKey.toId();
            PoolState state = pools.require(poolId);
            ledger.accumulateFees(poolId, FeesPerLiquidity.fromAmounts(amount0, amount1, state.getLiquidity()));
            accountant.accountDebt(poolKey.getToken0(), amount0);
            accountant.accountDebt(poolKey.getToken1(), amount1);
        });
    }

    /**
     * 프로토콜 수수료 인출 (lock 불필요)
     *
     * @throws AccessDeniedException caller가 owner가 아니면 (NOT_OWNER)
     */
    public void withdrawProtocolFees(String caller, String token, String recipient, BigInteger amount) {
        requireAmount(amount);
        journal.atomically(() -> {
            if (!owner.equals(caller)) {
                throw new AccessDeniedException(ErrorCode.NOT_OWNER,
                        String.format("Only the owner may withdraw protocol fees: caller=%s", caller));
            }
            protocolFees.debit(token, amount);
            tokens.transfer(accountant.getCoreAccount(), recipient, token, amount);
            log.info("[AmmCore] 프로토콜 수수료 인출: token={}, recipient={}, amount={}", token, recipient, amount);
        });
    }

    // =====================================================
    // 조회
    // =====================================================

    /**
     * 풀 상태 (초기화 전이면 null)
     */
    public PoolState getPoolState(PoolKey poolKey) {
        return pools.find(poolKey.toId());
    }

    /**
     * 틱 엔트리 (없으면 null)
     */
    public TickInfo getTick(PoolKey poolKey, int tick) {
        return ledger.getTicks().get(poolKey.toId(), tick);
    }

    /**
     * 포지션 (없으면 null)
     */
    public Position getPosition(PoolKey poolKey, String positionOwner, long salt, Bounds bounds) {
        return ledger.getPosition(new PositionKey(poolKey.toId(), positionOwner, salt, bounds));
    }

    public TokenAmounts getSavedBalances(String balanceOwner, String token0, String token1, long salt) {
        return savedBalances.get(balanceOwner, token0, token1, salt);
    }

    public BigInteger getProtocolFeesCollected(String token) {
        return protocolFees.get(token);
    }

    public FeesPerLiquidity getPoolFeesPerLiquidity(PoolKey poolKey) {
        return ledger.getPoolFeesPerLiquidity(poolKey.toId());
    }

    public FeesPerLiquidity getFeesPerLiquidityInside(PoolKey poolKey, Bounds bounds) {
        PoolId poolId = poolKey.toId();
        return ledger.feesPerLiquidityInside(poolId, pools.require(poolId).getTick(), bounds);
    }

    public TokenLedger getTokenLedger() {
        return tokens;
    }

    public String getCoreAccount() {
        return accountant.getCoreAccount();
    }

    public String getOwner() {
        return owner;
    }

    public int getDefaultSkipAhead() {
        return defaultSkipAhead;
    }

    private static void requireAmount(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT,
                    String.format("Amount must be non-negative: %s", amount));
        }
        FixedPointMath.requireU128(amount, ErrorCode.AMOUNT_OUT_OF_RANGE, "amount");
    }
}
