package com.fixedrate.amm.pool.port;

import java.math.BigInteger;

import static com.fixedrate.amm.math.FixedPointMath.ONE;

/**
 * Adapter over the external yield-bearing vault that holds the pool's collateral.
 * Share and base amounts are 18-decimal fixed point.
 */
public interface YieldSource {

  DepositResult depositBase(String payer, BigInteger amount);

  /**
   * Moves vault shares from {@code payer} to the pool. Returns the shares received.
   */
  BigInteger depositShares(String payer, BigInteger shares);

  /**
   * Redeems pool-held shares and sends the base to {@code destination}. Returns the base sent.
   */
  BigInteger withdrawBase(BigInteger shares, String destination);

  BigInteger withdrawShares(BigInteger shares, String destination);

  BigInteger convertToBase(BigInteger shares);

  BigInteger convertToShares(BigInteger base);

  /**
   * Shares currently held by the pool.
   */
  BigInteger totalShares();

  default BigInteger vaultSharePrice() {
    return convertToBase(ONE);
  }
}
