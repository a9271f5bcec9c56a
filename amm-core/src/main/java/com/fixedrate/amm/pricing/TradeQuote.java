package com.fixedrate.amm.pricing;

import java.math.BigInteger;

/**
 * A trade priced against a pool snapshot, with the reserves it would leave behind.
 *
 * @param shares        shares the trader pays in: the long's payment or the short's deposit
 * @param bonds         bonds the trader receives (long) or sells (short)
 * @param curveFee      curve fee, in bonds for longs and in shares for shorts
 * @param governanceFee governance cut of the curve fee, in shares
 * @param shareReserves share reserves after the trade
 * @param bondReserves  bond reserves after the trade
 * @param spotPrice     spot price after the trade
 * @param solvency      share reserves left over the long exposure after the trade; negative when insolvent
 */
public record TradeQuote(
    BigInteger shares,
    BigInteger bonds,
    BigInteger curveFee,
    BigInteger governanceFee,
    BigInteger shareReserves,
    BigInteger bondReserves,
    BigInteger spotPrice,
    BigInteger solvency
) {

  public boolean isSolvent() {
    return solvency.signum() >= 0;
  }
}
