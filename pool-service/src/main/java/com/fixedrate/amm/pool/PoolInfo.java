package com.fixedrate.amm.pool;

import java.math.BigInteger;

/**
 * Read-only snapshot of a pool's reserves and outstanding positions.
 */
public record PoolInfo(
    BigInteger shareReserves,
    BigInteger bondReserves,
    BigInteger lpTotalSupply,
    BigInteger longsOutstanding,
    BigInteger shortsOutstanding,
    BigInteger withdrawalSharesOutstanding,
    BigInteger withdrawalSharesReadyToWithdraw,
    BigInteger withdrawalSharesProceeds,
    BigInteger governanceFeesAccrued,
    boolean initialized
) {
}
