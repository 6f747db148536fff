package dustin.amm.domains.engine.tick;

import lombok.Value;

/**
 * 다음 틱 검색 결과
 * initialized == false 이면 워드 경계 또는 전역 경계 (건너도 유동성 변화 없음)
 */
@Value
public class TickSearchResult {

    int tick;

    boolean initialized;
}
