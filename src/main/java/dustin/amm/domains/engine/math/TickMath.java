// =====================================================
// TickMath - 틱 ⇄ 제곱근 가격 변환
// =====================================================
// 역할: 이산 틱 인덱스와 128.128 고정소수점 sqrtRatio 사이의 변환
//
// 정의:
// - price(tick) = 1.000001^tick
// - sqrtRatio(tick) = floor(sqrt(1.000001)^tick * 2^128)
// - 틱 범위: [-88722835, 88722835]
//
// 계산 방식:
// 1. sqrt(1.000001)^(2^i) (i = 0..26)를 클래스 로딩 시 120자리 정밀도로 미리 계산
// 2. |tick|의 비트마다 해당 거듭제곱을 곱함 (최대 27회 곱셈)
// 3. 음수 틱은 역수
// 4. 2^128을 곱한 뒤 내림
//
// 역변환 (sqrtRatio → tick):
// - double 로그로 추정한 뒤 정확한 비교로 ±1씩 보정
// - 결과: tickToSqrtRatio(t) <= sqrtRatio 를 만족하는 가장 큰 t
//
// 정밀도:
// - 120자리 십진 정밀도 → 최대 약 2^192 크기 값의 내림이 정확
// - 인접 틱 간 간격은 최소 ~9e12 (MIN_TICK 부근)이므로 단조 증가가 보장됨
// =====================================================

package dustin.amm.domains.engine.math;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ValidationException;

/**
 * 틱 ⇄ 제곱근 가격 변환
 * Tick to sqrt-ratio conversions
 */
public final class TickMath {

    /**
     * 틱 절댓값 최대치
     * 1.000001^88722835 ≈ 2^128 (가격 기준)
     */
    public static final int MAX_TICK_MAGNITUDE = 88722835;
    public static final int MIN_TICK = -MAX_TICK_MAGNITUDE;
    public static final int MAX_TICK = MAX_TICK_MAGNITUDE;

    /**
     * 풀이 가질 수 있는 최대 틱 간격
     */
    public static final int MAX_TICK_SPACING = 698605;

    /**
     * 전체 구간(full range) 전용 풀을 뜻하는 틱 간격
     */
    public static final int FULL_RANGE_ONLY_TICK_SPACING = 0;

    private static final MathContext PRECISION = new MathContext(120, RoundingMode.HALF_EVEN);
    private static final BigDecimal TWO_POW_128 = new BigDecimal(FixedPointMath.TWO_POW_128);
    private static final double LN_TICK_BASE = Math.log(1.000001d);
    private static final double LN_2 = Math.log(2d);

    /**
     * sqrt(1.000001)^(2^i)
     */
    private static final BigDecimal[] POWERS = new BigDecimal[27];

    static {
        POWERS[0] = new BigDecimal("1.000001").sqrt(PRECISION);
        for (int i = 1; i < POWERS.length; i++) {
            POWERS[i] = POWERS[i - 1].multiply(POWERS[i - 1], PRECISION);
        }
    }

    public static final SqrtRatio MIN_SQRT_RATIO = toSqrtRatio(MIN_TICK);
    public static final SqrtRatio MAX_SQRT_RATIO = toSqrtRatio(MAX_TICK);

    private TickMath() {
    }

    /**
     * 틱 → 제곱근 가격
     *
     * @param tick [MIN_TICK, MAX_TICK]
     * @return floor(sqrt(1.000001)^tick * 2^128)
     * @throws ValidationException 범위 밖의 틱
     */
    public static SqrtRatio toSqrtRatio(int tick) {
        requireValidTick(tick);

        int magnitude = Math.abs(tick);
        BigDecimal ratio = BigDecimal.ONE;
        for (int i = 0; i < POWERS.length; i++) {
            if ((magnitude & (1 << i)) != 0) {
                ratio = ratio.multiply(POWERS[i], PRECISION);
            }
        }
        if (tick < 0) {
            ratio = BigDecimal.ONE.divide(ratio, PRECISION);
        }

        BigInteger fixed = ratio.multiply(TWO_POW_128, PRECISION)
                .setScale(0, RoundingMode.FLOOR)
                .toBigIntegerExact();
        return SqrtRatio.of(fixed);
    }

    /**
     * 제곱근 가격 → 틱
     *
     * @param sqrtRatio [MIN_SQRT_RATIO, MAX_SQRT_RATIO]
     * @return toSqrtRatio(t) <= sqrtRatio 인 가장 큰 t
     * @throws ValidationException 범위 밖의 가격
     */
    public static int toTick(SqrtRatio sqrtRatio) {
        requireValid(sqrtRatio);

        int tick = estimateTick(sqrtRatio.getFixed());
        // 추정값 보정 (보통 0~1회)
        while (tick < MAX_TICK && toSqrtRatio(tick + 1).compareTo(sqrtRatio) <= 0) {
            tick++;
        }
        while (toSqrtRatio(tick).compareTo(sqrtRatio) > 0) {
            tick--;
        }
        return tick;
    }

    private static int estimateTick(BigInteger fixed) {
        int shift = Math.max(0, fixed.bitLength() - 62);
        double top = fixed.shiftRight(shift).doubleValue();
        double lnSqrtRatio = Math.log(top) + (shift - 128) * LN_2;
        double estimate = Math.floor(2 * lnSqrtRatio / LN_TICK_BASE);
        return (int) Math.max(MIN_TICK, Math.min(MAX_TICK, estimate));
    }

    public static boolean isValidTick(int tick) {
        return tick >= MIN_TICK && tick <= MAX_TICK;
    }

    public static void requireValidTick(int tick) {
        if (!isValidTick(tick)) {
            throw new ValidationException(ErrorCode.INVALID_TICK,
                    String.format("Tick out of range: tick=%d, range=[%d, %d]", tick, MIN_TICK, MAX_TICK));
        }
    }

    public static boolean isValid(SqrtRatio sqrtRatio) {
        return sqrtRatio != null
                && sqrtRatio.compareTo(MIN_SQRT_RATIO) >= 0
                && sqrtRatio.compareTo(MAX_SQRT_RATIO) <= 0;
    }

    public static void requireValid(SqrtRatio sqrtRatio) {
        if (!isValid(sqrtRatio)) {
            throw new ValidationException(ErrorCode.INVALID_SQRT_RATIO,
                    String.format("Sqrt ratio out of range: %s", sqrtRatio == null ? null : sqrtRatio.getFixed()));
        }
    }
}
