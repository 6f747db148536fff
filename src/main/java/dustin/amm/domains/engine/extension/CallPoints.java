package dustin.amm.domains.engine.extension;

import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

/**
 * 익스텐션이 받을 훅 목록 (8비트 마스크)
 * Call points an extension subscribes to
 *
 * 비트 순서:
 * <pre>
 * 0: beforeInitializePool   4: beforeUpdatePosition
 * 1: afterInitializePool    5: afterUpdatePosition
 * 2: beforeSwap             6: beforeCollectFees
 * 3: afterSwap              7: afterCollectFees
 * </pre>
 */
@Value
@Builder
public class CallPoints {

    boolean beforeInitializePool;
    boolean afterInitializePool;
    boolean beforeSwap;
    boolean afterSwap;
    boolean beforeUpdatePosition;
    boolean afterUpdatePosition;
    boolean beforeCollectFees;
    boolean afterCollectFees;

    public static CallPoints all() {
        return fromMask(0xff);
    }

    public int toMask() {
        int mask = 0;
        if (beforeInitializePool) mask |= 1;
        if (afterInitializePool) mask |= 1 << 1;
        if (beforeSwap) mask |= 1 << 2;
        if (afterSwap) mask |= 1 << 3;
        if (beforeUpdatePosition) mask |= 1 << 4;
        if (afterUpdatePosition) mask |= 1 << 5;
        if (beforeCollectFees) mask |= 1 << 6;
        if (afterCollectFees) mask |= 1 << 7;
        return mask;
    }

    /**
     * 마스크 → 훅 목록
     *
     * @throws ValidationException 0 또는 8비트 밖 마스크 (INVALID_CALL_POINTS)
     */
    public static CallPoints fromMask(int mask) {
        if (mask <= 0 || mask > 0xff) {
            throw new ValidationException(ErrorCode.INVALID_CALL_POINTS,
                    String.format("Call points mask must be in [1, 255]: %d", mask));
        }
        return CallPoints.builder()
                .beforeInitializePool((mask & 1) != 0)
                .afterInitializePool((mask & (1 << 1)) != 0)
                .beforeSwap((mask & (1 << 2)) != 0)
                .afterSwap((mask & (1 << 3)) != 0)
                .beforeUpdatePosition((mask & (1 << 4)) != 0)
                .afterUpdatePosition((mask & (1 << 5)) != 0)
                .beforeCollectFees((mask & (1 << 6)) != 0)
                .afterCollectFees((mask & (1 << 7)) != 0)
                .build();
    }

    public boolean isEmpty() {
        return toMask() == 0;
    }
}
