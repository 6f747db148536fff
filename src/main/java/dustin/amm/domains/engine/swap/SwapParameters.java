package dustin.amm.domains.engine.swap;

import java.math.BigInteger;

import dustin.amm.domains.engine.math.SqrtRatio;
import lombok.Builder;
import lombok.Value;

/**
 * 스왑 요청
 * Swap Parameters
 *
 * 불변 객체입니다. 익스텐션 훅에 그대로 넘겨도 요청이 바뀌지 않습니다.
 */
@Value
@Builder
public class SwapParameters {

    /**
     * 지정 금액 (양수 = 정확한 입력, 음수 = 정확한 출력)
     */
    BigInteger amount;

    /**
     * 지정 금액이 token1 기준인지
     */
    boolean isToken1;

    /**
     * 가격 한도 (이 가격을 넘어서 움직이지 않음)
     */
    SqrtRatio sqrtRatioLimit;

    /**
     * 비트맵 검색 시 추가로 넘어갈 수 있는 빈 워드 수
     */
    int skipAhead;
}
