package com.fixedrate.amm.matching;

import java.math.BigInteger;

/**
 * Outcome of one settled match.
 *
 * @param surplus funds left over after both traders were settled, paid to the surplus recipient
 */
public record MatchResult(
    String order1Hash,
    String order2Hash,
    Settlement settlement,
    long maturityTime,
    BigInteger bondAmount,
    BigInteger order1Funds,
    BigInteger order2Funds,
    BigInteger surplus
) {

  public enum Settlement {
    /** New long and short pair minted from both traders' funds. */
    MINT,
    /** Existing long and short pair burned back into funds. */
    BURN,
    /** Position handed from a closing trader to an opening one. */
    TRANSFER
  }
}
