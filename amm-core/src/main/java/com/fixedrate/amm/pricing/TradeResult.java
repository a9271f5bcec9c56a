package com.fixedrate.amm.pricing;

import java.math.BigInteger;

/**
 * A priced trade split into its legs.
 *
 * @param flatShares        shares settled one-to-one against the vault share price
 * @param curveShares       shares moved along the curve
 * @param curveBonds        bonds moved along the curve
 * @param amount            flat plus curve amount owed to (out) or by (in) the trader
 */
public record TradeResult(
    BigInteger flatShares,
    BigInteger curveShares,
    BigInteger curveBonds,
    BigInteger amount
) {
}
