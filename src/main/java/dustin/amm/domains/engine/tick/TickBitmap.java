// =====================================================
// TickBitmap - 초기화된 틱 인덱스
// =====================================================
// 역할: 풀별로 "유동성이 참조하는 틱"을 비트로 표시하고
//       스왑 중 다음 초기화된 틱을 빠르게 찾음
//
// 자료구조:
// 1. HashMap<PoolId, HashMap<Integer, BitSet>>
//    - 틱을 floorDiv(tick, tickSpacing)로 압축
//    - 압축된 값을 256비트 워드 단위로 나눔 (word = floorDiv(c, 256), bit = floorMod(c, 256))
//    * 조회: O(1) average
//    * 워드 내 검색: BitSet.nextSetBit / previousSetBit
//    * 장점: 빈 워드는 저장하지 않음 (희소)
//
// 검색 규칙:
// - 위로 검색: fromTick 보다 큰 틱만 (strictly above)
// - 아래로 검색: fromTick 이하 틱 (at or below)
// - skipAhead 개의 빈 워드를 넘어가면 워드 경계를 "초기화 안 됨"으로 반환
// - 전역 경계(MIN_TICK / MAX_TICK)에 닿으면 경계를 반환
// - tickSpacing == 0 (전체 구간 전용) 풀은 항상 전역 경계 반환
//
// skipAhead는 한 번 호출의 작업량만 제한합니다.
// 스왑 루프는 경계 틱에서 유동성 변화 없이 계속 진행하므로 결과는 같습니다.
// =====================================================

package dustin.amm.domains.engine.tick;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;

import dustin.amm.domains.engine.math.TickMath;
import dustin.amm.domains.engine.pool.PoolId;
import dustin.amm.domains.engine.state.StateJournal;

/**
 * 틱 비트맵
 * Sparse index of initialized ticks
 */
public class TickBitmap {

    private static final int WORD_SIZE = 256;

    private final StateJournal journal;

    private final Map<PoolId, Map<Integer, BitSet>> words = new HashMap<>();

    public TickBitmap(StateJournal journal) {
        this.journal = journal;
    }

    /**
     * 틱 비트 뒤집기 (초기화 ↔ 해제)
     */
    public void flip(PoolId poolId, int tick, int tickSpacing) {
        doFlip(poolId, tick, tickSpacing);
        journal.record(() -> doFlip(poolId, tick, tickSpacing));
    }

    public boolean isInitialized(PoolId poolId, int tick, int tickSpacing) {
        int compressed = compress(tick, tickSpacing);
        Map<Integer, BitSet> poolWords = words.get(poolId);
        if (poolWords == null) {
            return false;
        }
        BitSet bits = poolWords.get(Math.floorDiv(compressed, WORD_SIZE));
        return bits != null && bits.get(Math.floorMod(compressed, WORD_SIZE));
    }

    /**
     * 다음 초기화된 틱 검색
     *
     * @param fromTick 검색 시작 틱
     * @param tickSpacing 풀의 틱 간격
     * @param increasing true면 위로 (fromTick 초과), false면 아래로 (fromTick 이하)
     * @param skipAhead 추가로 넘어갈 수 있는 빈 워드 수
     */
    public TickSearchResult nextInitializedTick(PoolId poolId, int fromTick, int tickSpacing,
                                                boolean increasing, int skipAhead) {
        if (tickSpacing == TickMath.FULL_RANGE_ONLY_TICK_SPACING) {
            int bound = increasing ? TickMath.MAX_TICK : TickMath.MIN_TICK;
            return new TickSearchResult(bound, isInitialized(poolId, bound, tickSpacing));
        }
        Map<Integer, BitSet> poolWords = words.getOrDefault(poolId, Map.of());
        return increasing
                ? searchUp(poolWords, fromTick, tickSpacing, skipAhead)
                : searchDown(poolWords, fromTick, tickSpacing, skipAhead);
    }

    private TickSearchResult searchUp(Map<Integer, BitSet> poolWords, int fromTick, int tickSpacing, int skipAhead) {
        long compressed = Math.floorDiv(fromTick, tickSpacing) + 1L;
        int searched = 0;
        while (true) {
            int word = (int) Math.floorDiv(compressed, WORD_SIZE);
            BitSet bits = poolWords.get(word);
            int next = bits == null ? -1 : bits.nextSetBit((int) Math.floorMod(compressed, WORD_SIZE));
            if (next >= 0) {
                long tick = ((long) word * WORD_SIZE + next) * tickSpacing;
                return new TickSearchResult((int) Math.min(tick, TickMath.MAX_TICK), tick <= TickMath.MAX_TICK);
            }

            long wordEnd = ((long) word * WORD_SIZE + WORD_SIZE - 1) * tickSpacing;
            if (wordEnd >= TickMath.MAX_TICK) {
                return new TickSearchResult(TickMath.MAX_TICK, false);
            }
            if (searched >= skipAhead) {
                return new TickSearchResult((int) wordEnd, false);
            }
            searched++;
            compressed = (long) (word + 1) * WORD_SIZE;
        }
    }

    private TickSearchResult searchDown(Map<Integer, BitSet> poolWords, int fromTick, int tickSpacing, int skipAhead) {
        long compressed = Math.floorDiv(fromTick, tickSpacing);
        int searched = 0;
        while (true) {
            int word = (int) Math.floorDiv(compressed, WORD_SIZE);
            BitSet bits = poolWords.get(word);
            int previous = bits == null ? -1 : bits.previousSetBit((int) Math.floorMod(compressed, WORD_SIZE));
            if (previous >= 0) {
                long tick = ((long) word * WORD_SIZE + previous) * tickSpacing;
                return new TickSearchResult((int) Math.max(tick, TickMath.MIN_TICK), tick >= TickMath.MIN_TICK);
            }

            long wordStart = (long) word * WORD_SIZE * tickSpacing;
            if (wordStart <= TickMath.MIN_TICK) {
                return new TickSearchResult(TickMath.MIN_TICK, false);
            }
            if (searched >= skipAhead) {
                return new TickSearchResult((int) wordStart, false);
            }
            searched++;
            compressed = (long) word * WORD_SIZE - 1;
        }
    }

    private void doFlip(PoolId poolId, int tick, int tickSpacing) {
        int compressed = compress(tick, tickSpacing);
        int word = Math.floorDiv(compressed, WORD_SIZE);
        Map<Integer, BitSet> poolWords = words.computeIfAbsent(poolId, id -> new HashMap<>());
        BitSet bits = poolWords.computeIfAbsent(word, w -> new BitSet(WORD_SIZE));
        bits.flip(Math.floorMod(compressed, WORD_SIZE));
        if (bits.isEmpty()) {
            poolWords.remove(word);
        }
    }

    private static int compress(int tick, int tickSpacing) {
        // 전체 구간 전용 풀은 경계 틱 두 개만 쓰므로 간격 1로 압축
        return Math.floorDiv(tick, Math.max(tickSpacing, 1));
    }
}
