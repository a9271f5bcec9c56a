package com.fixedrate.amm.pool;

import java.math.BigInteger;

/**
 * Prices recorded for one checkpoint bucket. A zero vault share price means the checkpoint has not
 * been applied yet.
 *
 * @param vaultSharePrice vault share price frozen when the checkpoint was applied
 * @param longSharePrice  bond-weighted average vault share price paid by longs opened in the bucket
 */
public record Checkpoint(BigInteger vaultSharePrice, BigInteger longSharePrice) {

  public static final Checkpoint EMPTY = new Checkpoint(BigInteger.ZERO, BigInteger.ZERO);

  public boolean isApplied() {
    return vaultSharePrice.signum() > 0;
  }

  public Checkpoint withLongSharePrice(BigInteger price) {
    return new Checkpoint(vaultSharePrice, price);
  }
}
