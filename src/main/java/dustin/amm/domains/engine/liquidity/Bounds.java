package dustin.amm.domains.engine.liquidity;

import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ValidationException;
import dustin.amm.domains.engine.math.SqrtRatio;
import dustin.amm.domains.engine.math.TickMath;
import lombok.Value;

/**
 * 포지션 가격 구간 [lower, upper)
 * Position tick bounds
 */
@Value
public class Bounds {

    int lower;

    int upper;

    /**
     * 틱 간격에 맞는 가장 넓은 구간
     * 간격 0 (전체 구간 전용)이면 [MIN_TICK, MAX_TICK]
     */
    public static Bounds fullRange(int tickSpacing) {
        if (tickSpacing == TickMath.FULL_RANGE_ONLY_TICK_SPACING) {
            return new Bounds(TickMath.MIN_TICK, TickMath.MAX_TICK);
        }
        int magnitude = (TickMath.MAX_TICK / tickSpacing) * tickSpacing;
        return new Bounds(-magnitude, magnitude);
    }

    /**
     * 구간 검증
     *
     * @throws ValidationException INVALID_BOUNDS (순서/범위), BOUNDS_TICK_SPACING (간격 배수 아님)
     */
    public void validate(int tickSpacing) {
        if (lower >= upper || lower < TickMath.MIN_TICK || upper > TickMath.MAX_TICK) {
            throw new ValidationException(ErrorCode.INVALID_BOUNDS,
                    String.format("Invalid bounds: [%d, %d)", lower, upper));
        }
        if (tickSpacing == TickMath.FULL_RANGE_ONLY_TICK_SPACING) {
            if (lower != TickMath.MIN_TICK || upper != TickMath.MAX_TICK) {
                throw new ValidationException(ErrorCode.BOUNDS_TICK_SPACING,
                        String.format("Full-range-only pool accepts [%d, %d] only: [%d, %d)",
                                TickMath.MIN_TICK, TickMath.MAX_TICK, lower, upper));
            }
            return;
        }
        if (lower % tickSpacing != 0 || upper % tickSpacing != 0) {
            throw new ValidationException(ErrorCode.BOUNDS_TICK_SPACING,
                    String.format("Bounds must be multiples of tick spacing %d: [%d, %d)", tickSpacing, lower, upper));
        }
    }

    public SqrtRatio lowerSqrtRatio() {
        return TickMath.toSqrtRatio(lower);
    }

    public SqrtRatio upperSqrtRatio() {
        return TickMath.toSqrtRatio(upper);
    }

    /**
     * 현재 틱이 구간 안에 있는지 (lower <= tick < upper)
     */
    public boolean contains(int tick) {
        return lower <= tick && tick < upper;
    }
}
