package dustin.amm.domains.engine.tick;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.amm.domains.engine.math.FeeRate;
import dustin.amm.domains.engine.math.TickMath;
import dustin.amm.domains.engine.pool.PoolId;
import dustin.amm.domains.engine.pool.PoolKey;
import dustin.amm.domains.engine.state.StateJournal;

/**
 * 틱 비트맵 검색 테스트
 */
class TickBitmapTest {

    private StateJournal journal;
    private TickBitmap bitmap;
    private PoolId poolId;

    @BeforeEach
    void setUp() {
        journal = new StateJournal();
        bitmap = new TickBitmap(journal);
        poolId = new PoolKey("ETH", "USDC", FeeRate.ZERO, 1, null).toId();
    }

    @Test
    @DisplayName("빈 비트맵: 워드 경계를 초기화 안 됨으로 반환")
    void emptyReturnsWordBoundary() {
        assertThat(bitmap.nextInitializedTick(poolId, 0, 1, true, 0)).isEqualTo(new TickSearchResult(255, false));
        assertThat(bitmap.nextInitializedTick(poolId, 0, 1, false, 0)).isEqualTo(new TickSearchResult(0, false));
        assertThat(bitmap.nextInitializedTick(poolId, -1, 1, false, 0)).isEqualTo(new TickSearchResult(-256, false));
    }

    @Test
    @DisplayName("위로 검색은 fromTick 초과, 아래로 검색은 fromTick 이하")
    void searchDirections() {
        bitmap.flip(poolId, 500, 10);

        assertThat(bitmap.nextInitializedTick(poolId, 0, 10, true, 0)).isEqualTo(new TickSearchResult(500, true));
        assertThat(bitmap.nextInitializedTick(poolId, 500, 10, true, 0).isInitialized()).isFalse();
        assertThat(bitmap.nextInitializedTick(poolId, 500, 10, false, 0)).isEqualTo(new TickSearchResult(500, true));
        assertThat(bitmap.nextInitializedTick(poolId, 509, 10, false, 0)).isEqualTo(new TickSearchResult(500, true));
    }

    @Test
    @DisplayName("skipAhead만큼 빈 워드를 넘어감")
    void skipAhead() {
        bitmap.flip(poolId, 5000, 1);

        assertThat(bitmap.nextInitializedTick(poolId, 0, 1, true, 0)).isEqualTo(new TickSearchResult(255, false));
        assertThat(bitmap.nextInitializedTick(poolId, 0, 1, true, 100)).isEqualTo(new TickSearchResult(5000, true));

        bitmap.flip(poolId, -300, 1);
        assertThat(bitmap.nextInitializedTick(poolId, 0, 1, false, 0)).isEqualTo(new TickSearchResult(0, false));
        assertThat(bitmap.nextInitializedTick(poolId, 0, 1, false, 5)).isEqualTo(new TickSearchResult(-300, true));
    }

    @Test
    @DisplayName("음수 틱은 floorDiv로 압축")
    void negativeTicks() {
        bitmap.flip(poolId, -20, 10);

        assertThat(bitmap.isInitialized(poolId, -20, 10)).isTrue();
        assertThat(bitmap.nextInitializedTick(poolId, -15, 10, false, 0)).isEqualTo(new TickSearchResult(-20, true));
        assertThat(bitmap.nextInitializedTick(poolId, -25, 10, true, 0)).isEqualTo(new TickSearchResult(-20, true));
    }

    @Test
    @DisplayName("전역 경계에서 멈춤")
    void clampsToGlobalBounds() {
        assertThat(bitmap.nextInitializedTick(poolId, TickMath.MAX_TICK - 10, 1, true, 1000))
                .isEqualTo(new TickSearchResult(TickMath.MAX_TICK, false));
        assertThat(bitmap.nextInitializedTick(poolId, TickMath.MIN_TICK + 10, 1, false, 1000))
                .isEqualTo(new TickSearchResult(TickMath.MIN_TICK, false));
    }

    @Test
    @DisplayName("전체 구간 전용 풀은 항상 전역 경계")
    void fullRangeOnly() {
        assertThat(bitmap.nextInitializedTick(poolId, 0, 0, true, 0).getTick()).isEqualTo(TickMath.MAX_TICK);
        assertThat(bitmap.nextInitializedTick(poolId, 0, 0, false, 0).getTick()).isEqualTo(TickMath.MIN_TICK);

        bitmap.flip(poolId, TickMath.MAX_TICK, 0);
        assertThat(bitmap.nextInitializedTick(poolId, 0, 0, true, 0).isInitialized()).isTrue();
    }

    @Test
    @DisplayName("두 번 뒤집으면 해제, 실패한 작업의 뒤집기는 롤백")
    void flipAndRollback() {
        bitmap.flip(poolId, 100, 1);
        bitmap.flip(poolId, 100, 1);
        assertThat(bitmap.isInitialized(poolId, 100, 1)).isFalse();

        assertThatThrownBy(() -> journal.atomically(() -> {
            bitmap.flip(poolId, 100, 1);
            throw new IllegalStateException("abort");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(bitmap.isInitialized(poolId, 100, 1)).isFalse();
    }
}
