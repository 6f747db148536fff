package dustin.amm.domains.engine.liquidity;

import dustin.amm.domains.engine.pool.PoolId;
import lombok.Value;

/**
 * 포지션 키
 * (poolId, owner, salt, bounds) 튜플
 */
@Value
public class PositionKey {

    PoolId poolId;

    String owner;

    long salt;

    Bounds bounds;
}
