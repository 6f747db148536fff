package dustin.amm.domains.engine.tick;

import java.math.BigInteger;

import dustin.amm.domains.engine.liquidity.FeesPerLiquidity;
import lombok.Value;

/**
 * 틱 엔트리 (불변)
 * Per-tick liquidity bookkeeping
 */
@Value
public class TickInfo {

    /**
     * 위쪽으로 건널 때 풀 유동성에 더해지는 값 (부호 있음)
     * 하한 경계로 쓰이면 +, 상한 경계로 쓰이면 -
     */
    BigInteger liquidityDelta;

    /**
     * 이 틱을 경계로 참조하는 유동성 총합 (gross)
     * 0이 되면 엔트리 삭제
     */
    BigInteger liquidityNet;

    /**
     * 틱 바깥쪽 누적 수수료 스냅샷
     */
    FeesPerLiquidity feesOutside;
}
