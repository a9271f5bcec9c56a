package com.fixedrate.amm.pool;

import java.math.BigInteger;

/**
 * @param proceeds         base or shares paid out immediately
 * @param withdrawalShares withdrawal shares minted for the part still backing open positions
 */
public record LiquidityRemoval(BigInteger proceeds, BigInteger withdrawalShares) {
}
