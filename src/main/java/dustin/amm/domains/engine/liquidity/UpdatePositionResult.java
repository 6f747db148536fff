package dustin.amm.domains.engine.liquidity;

import dustin.amm.domains.engine.math.TokenAmounts;
import lombok.Builder;
import lombok.Value;

/**
 * 포지션 변경 결과
 * Update Position Result
 */
@Value
@Builder
public class UpdatePositionResult {

    /**
     * 풀 관점 토큰 델타 (양수 = 호출자가 지불, 음수 = 호출자가 수령)
     * 인출 수수료 차감 후 값
     */
    TokenAmounts delta;

    /**
     * 인출 수수료로 프로토콜에 적립된 금액
     */
    TokenAmounts protocolFees;

    /**
     * 변경 시점까지 포지션에 쌓인 수수료 (포지션에 그대로 남음)
     */
    TokenAmounts feesAccrued;
}
