package dustin.amm.support;

import java.math.BigInteger;

import dustin.amm.domains.engine.accounting.Locker;
import dustin.amm.domains.engine.liquidity.Bounds;
import dustin.amm.domains.engine.liquidity.UpdatePositionParameters;
import dustin.amm.domains.engine.liquidity.UpdatePositionResult;
import dustin.amm.domains.engine.math.FeeRate;
import dustin.amm.domains.engine.math.SqrtRatio;
import dustin.amm.domains.engine.math.TokenAmounts;
import dustin.amm.domains.engine.pool.PoolKey;
import dustin.amm.domains.engine.runtime.AmmCore;
import dustin.amm.domains.engine.swap.SwapResult;

/**
 * 테스트용 풀 / 정산 헬퍼
 * Test fixture that runs engine operations inside a settling lock
 *
 * 각 헬퍼는 lock을 열고 작업 후 델타만큼 pay / withdraw 하여 부채를 0으로 맞춥니다.
 */
public final class PoolFixture {

    public static final String CORE = "core";
    public static final String OWNER = "owner";
    public static final String ETH = "ETH";
    public static final String USDC = "USDC";

    private PoolFixture() {
    }

    public static AmmCore newCore() {
        return new AmmCore(CORE, OWNER, 0);
    }

    public static PoolKey poolKey(FeeRate fee, int tickSpacing) {
        return new PoolKey(ETH, USDC, fee, tickSpacing, null);
    }

    /**
     * 계정에 두 토큰 입금
     */
    public static void fund(AmmCore core, String account, long amount) {
        core.getTokenLedger().mint(account, ETH, BigInteger.valueOf(amount));
        core.getTokenLedger().mint(account, USDC, BigInteger.valueOf(amount));
    }

    public static void fund(AmmCore core, String account, BigInteger amount) {
        core.getTokenLedger().mint(account, ETH, amount);
        core.getTokenLedger().mint(account, USDC, amount);
    }

    public static UpdatePositionResult updatePosition(AmmCore core, String owner, PoolKey key, Bounds bounds,
                                                      BigInteger liquidityDelta) {
        return updatePosition(core, owner, key, bounds, 0L, liquidityDelta);
    }

    public static UpdatePositionResult updatePosition(AmmCore core, String owner, PoolKey key, Bounds bounds,
                                                      long salt, BigInteger liquidityDelta) {
        UpdatePositionParameters params = UpdatePositionParameters.builder()
                .salt(salt)
                .bounds(bounds)
                .liquidityDelta(liquidityDelta)
                .build();
        return core.lock(Locker.<UpdatePositionParameters, UpdatePositionResult>of(owner, (lockId, data) -> {
            UpdatePositionResult result = core.updatePosition(key, data);
            settle(core, owner, key, result.getDelta());
            return result;
        }), params);
    }

    public static SwapResult swap(AmmCore core, String trader, PoolKey key, BigInteger amount, boolean isToken1,
                                  SqrtRatio limit) {
        return core.lock(Locker.<Void, SwapResult>of(trader, (lockId, data) -> {
            SwapResult result = core.swap(key, amount, isToken1, limit);
            settle(core, trader, key, result.getDelta());
            return result;
        }), null);
    }

    public static TokenAmounts collectFees(AmmCore core, String owner, PoolKey key, Bounds bounds) {
        return core.lock(Locker.<Void, TokenAmounts>of(owner, (lockId, data) -> {
            TokenAmounts fees = core.collectFees(key, 0L, bounds);
            settle(core, owner, key, fees.negate());
            return fees;
        }), null);
    }

    /**
     * 풀 관점 델타 정산: 양수면 지불, 음수면 수령
     */
    public static void settle(AmmCore core, String account, PoolKey key, TokenAmounts delta) {
        settleToken(core, account, key.getToken0(), delta.getAmount0());
        settleToken(core, account, key.getToken1(), delta.getAmount1());
    }

    private static void settleToken(AmmCore core, String account, String token, BigInteger amount) {
        if (amount.signum() > 0) {
            core.pay(token, amount);
        } else if (amount.signum() < 0) {
            core.withdraw(token, account, amount.negate());
        }
    }
}
