package com.fixedrate.amm.pool.port;

import java.math.BigInteger;

/**
 * @param shares vault shares credited to the pool
 * @param refund base returned to the payer unspent
 */
public record DepositResult(BigInteger shares, BigInteger refund) {
}
