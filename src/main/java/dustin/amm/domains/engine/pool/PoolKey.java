// =====================================================
// PoolKey - 풀 식별 정보
// =====================================================
// 역할: 하나의 유동성 풀을 정의하는 불변 키
//
// 필드:
// - token0, token1: 두 토큰 식별자 (token0 < token1, 사전순)
// - fee: 스왑 수수료율 (0.64 고정소수점)
// - tickSpacing: 포지션 경계가 놓일 수 있는 틱 간격 (0 = 전체 구간 전용)
// - extension: 훅을 받을 익스텐션 주소 (없으면 null)
//
// 같은 토큰 쌍이라도 fee / tickSpacing / extension 이 다르면 다른 풀입니다.
// =====================================================

package dustin.amm.domains.engine.pool;

import java.util.Objects;

import dustin.amm.domains.engine.exception.ErrorCode;
import dustin.amm.domains.engine.exception.ValidationException;
import dustin.amm.domains.engine.math.FeeRate;
import dustin.amm.domains.engine.math.TickMath;

/**
 * 풀 키
 * Pool Key
 *
 * 예시:
 * <pre>
 * PoolKey key = new PoolKey("ETH", "USDC", FeeRate.fromFraction(3, 1000), 100, null);
 * // ETH/USDC, 0.3% 수수료, 틱 간격 100, 익스텐션 없음
 * </pre>
 */
public final class PoolKey {

    private final String token0;
    private final String token1;
    private final FeeRate fee;
    private final int tickSpacing;
    private final String extension;

    /**
     * 새 풀 키 생성
     *
     * @throws ValidationException 토큰 순서(INVALID_TOKENS) 또는 틱 간격(INVALID_TICK_SPACING)이 잘못된 경우
     */
    public PoolKey(String token0, String token1, FeeRate fee, int tickSpacing, String extension) {
        if (token0 == null || token1 == null || token0.compareTo(token1) >= 0) {
            throw new ValidationException(ErrorCode.INVALID_TOKENS,
                    String.format("token0 must sort before token1: token0=%s, token1=%s", token0, token1));
        }
        if (tickSpacing < 0 || tickSpacing > TickMath.MAX_TICK_SPACING) {
            throw new ValidationException(ErrorCode.INVALID_TICK_SPACING,
                    String.format("Tick spacing out of range: %d, range=[0, %d]", tickSpacing, TickMath.MAX_TICK_SPACING));
        }
        this.token0 = token0;
        this.token1 = token1;
        this.fee = Objects.requireNonNull(fee, "fee");
        this.tickSpacing = tickSpacing;
        this.extension = extension;
    }

    public String getToken0() {
        return token0;
    }

    public String getToken1() {
        return token1;
    }

    public FeeRate getFee() {
        return fee;
    }

    public int getTickSpacing() {
        return tickSpacing;
    }

    /**
     * 익스텐션 주소 (없으면 null)
     */
    public String getExtension() {
        return extension;
    }

    public boolean hasExtension() {
        return extension != null;
    }

    public boolean isFullRangeOnly() {
        return tickSpacing == TickMath.FULL_RANGE_ONLY_TICK_SPACING;
    }

    /**
     * 풀 ID (SHA-256)
     */
    public PoolId toId() {
        return PoolId.of(this);
    }

    /**
     * 해시 입력용 정규 문자열
     */
    String canonical() {
        return token0 + "|" + token1 + "|" + fee.getValue() + "|" + tickSpacing + "|" + (extension == null ? "" : extension);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PoolKey that = (PoolKey) o;
        return tickSpacing == that.tickSpacing
                && token0.equals(that.token0)
                && token1.equals(that.token1)
                && fee.equals(that.fee)
                && Objects.equals(extension, that.extension);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token0, token1, fee, tickSpacing, extension);
    }

    @Override
    public String toString() {
        return token0 + "/" + token1 + " fee=" + fee + " spacing=" + tickSpacing
                + (extension == null ? "" : " ext=" + extension);
    }
}
