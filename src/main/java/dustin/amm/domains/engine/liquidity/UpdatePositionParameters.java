package dustin.amm.domains.engine.liquidity;

import java.math.BigInteger;

import lombok.Builder;
import lombok.Value;

/**
 * 포지션 변경 요청
 * Update Position Parameters
 *
 * 불변 객체입니다. 익스텐션 훅에 그대로 넘겨도 요청이 바뀌지 않습니다.
 */
@Value
@Builder
public class UpdatePositionParameters {

    /**
     * 같은 소유자가 같은 구간에 여러 포지션을 둘 때 구분값
     */
    long salt;

    Bounds bounds;

    /**
     * 유동성 변화량 (양수 = 예치, 음수 = 인출, i128)
     */
    BigInteger liquidityDelta;
}
