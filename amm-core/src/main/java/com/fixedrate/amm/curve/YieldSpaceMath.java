package com.fixedrate.amm.curve;

import com.fixedrate.amm.error.InvalidCurveStateException;
import lombok.NonNull;

import java.math.BigInteger;

import static com.fixedrate.amm.math.FixedPointMath.ONE;
import static com.fixedrate.amm.math.FixedPointMath.add;
import static com.fixedrate.amm.math.FixedPointMath.divDown;
import static com.fixedrate.amm.math.FixedPointMath.divUp;
import static com.fixedrate.amm.math.FixedPointMath.max;
import static com.fixedrate.amm.math.FixedPointMath.mulDivDown;
import static com.fixedrate.amm.math.FixedPointMath.mulDivUp;
import static com.fixedrate.amm.math.FixedPointMath.mulDown;
import static com.fixedrate.amm.math.FixedPointMath.mulUp;
import static com.fixedrate.amm.math.FixedPointMath.pow;
import static com.fixedrate.amm.math.FixedPointMath.sub;

/**
 * Solver for the YieldSpace invariant
 * <pre>
 *   k = (c / mu) * (mu * z)^(1 - s*t) + (y + adj)^(1 - s*t)
 * </pre>
 * where {@code z} is share reserves, {@code y} bond reserves, {@code adj} the bond reserve adjustment,
 * {@code c} the vault share price, {@code mu} the initial vault share price, {@code s} the time stretch
 * and {@code t} the normalized time remaining.
 * <p>
 * Outputs round down and inputs round up. When {@code 1 - s*t} is zero the invariant degenerates to its
 * limit {@code (mu * z)^(c / mu) * (y + adj) = K}, which is solved in closed form.
 */
public final class YieldSpaceMath {

  /** Relative overshoot of a solved reserve still put down to rounding, 1e-9. */
  static final BigInteger ROUNDING_TOLERANCE = BigInteger.valueOf(1_000_000_000L);
  static final BigInteger MIN_ROUNDING_DUST = BigInteger.valueOf(1_000_000L);

  private YieldSpaceMath() {
  }

  /**
   * Amount leaving the pool for {@code amountIn} entering it. With {@code isBondOut} the input is shares
   * and the output bonds, otherwise the input is bonds and the output shares.
   */
  public static BigInteger calculateOutGivenIn(
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger bondReserves,
      @NonNull BigInteger bondReserveAdjustment,
      @NonNull BigInteger amountIn,
      @NonNull BigInteger timeRemaining,
      @NonNull BigInteger timeStretch,
      @NonNull BigInteger vaultSharePrice,
      @NonNull BigInteger initialVaultSharePrice,
      boolean isBondOut
  ) {
    BigInteger a = exponent(timeRemaining, timeStretch);
    BigInteger adjustedBonds = add(bondReserves, bondReserveAdjustment);
    if (isBondOut) {
      return bondsOutGivenSharesIn(shareReserves, adjustedBonds, amountIn, a, vaultSharePrice, initialVaultSharePrice);
    }
    return sharesOutGivenBondsIn(shareReserves, adjustedBonds, amountIn, a, vaultSharePrice, initialVaultSharePrice);
  }

  /**
   * Shares a trader must add to take {@code bondsOut} bonds from the pool, rounded up.
   */
  public static BigInteger calculateSharesInGivenBondsOut(
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger bondReserves,
      @NonNull BigInteger bondReserveAdjustment,
      @NonNull BigInteger bondsOut,
      @NonNull BigInteger timeRemaining,
      @NonNull BigInteger timeStretch,
      @NonNull BigInteger vaultSharePrice,
      @NonNull BigInteger initialVaultSharePrice
  ) {
    BigInteger a = exponent(timeRemaining, timeStretch);
    BigInteger adjustedBonds = add(bondReserves, bondReserveAdjustment);
    if (bondsOut.compareTo(adjustedBonds) >= 0) {
      throw new InvalidCurveStateException("bonds out " + bondsOut + " exhaust bond reserves " + adjustedBonds);
    }
    BigInteger c = vaultSharePrice;
    BigInteger mu = initialVaultSharePrice;
    BigInteger newBonds = adjustedBonds.subtract(bondsOut);

    if (a.signum() == 0) {
      // z' = z * ((y + adj) / (y + adj - dy))^(mu / c)
      BigInteger ratio = divUp(adjustedBonds, newBonds);
      BigInteger newShares = mulUp(shareReserves, pow(ratio, divUp(mu, c)));
      return positiveDifference(newShares, shareReserves);
    }

    BigInteger k = kUp(shareReserves, adjustedBonds, a, c, mu);
    BigInteger bondTerm = pow(newBonds, a);
    if (k.compareTo(bondTerm) < 0) {
      throw new InvalidCurveStateException("invariant " + k + " below bond term " + bondTerm);
    }
    BigInteger newShares = mulDivUp(k.subtract(bondTerm), mu, c);
    newShares = pow(newShares, inverseExponent(newShares, a));
    newShares = divUp(newShares, mu);
    return positiveDifference(newShares, shareReserves);
  }

  /**
   * Shares that buy bonds until the spot price reaches one. A spot price of one means
   * {@code mu * z = y + adj}, so the invariant gives {@code z' = (k / (c / mu + 1))^(1 / a) / mu}.
   *
   * @throws InvalidCurveStateException when the spot price is already at or above one
   */
  public static BigInteger calculateMaxBuySharesIn(
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger bondReserves,
      @NonNull BigInteger bondReserveAdjustment,
      @NonNull BigInteger timeRemaining,
      @NonNull BigInteger timeStretch,
      @NonNull BigInteger vaultSharePrice,
      @NonNull BigInteger initialVaultSharePrice
  ) {
    BigInteger a = exponent(timeRemaining, timeStretch);
    BigInteger mu = initialVaultSharePrice;
    BigInteger k = kDown(shareReserves, add(bondReserves, bondReserveAdjustment), a, vaultSharePrice, mu);
    BigInteger optimalShares = divDown(k, add(divUp(vaultSharePrice, mu), ONE));
    optimalShares = divDown(pow(optimalShares, divDown(ONE, a)), mu);
    if (optimalShares.compareTo(shareReserves) < 0) {
      throw new InvalidCurveStateException("share reserves " + shareReserves + " already past the max buy " + optimalShares);
    }
    return optimalShares.subtract(shareReserves);
  }

  /**
   * Bonds bought by {@link #calculateMaxBuySharesIn}, rounded so the purchase is underestimated.
   */
  public static BigInteger calculateMaxBuyBondsOut(
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger bondReserves,
      @NonNull BigInteger bondReserveAdjustment,
      @NonNull BigInteger timeRemaining,
      @NonNull BigInteger timeStretch,
      @NonNull BigInteger vaultSharePrice,
      @NonNull BigInteger initialVaultSharePrice
  ) {
    BigInteger a = exponent(timeRemaining, timeStretch);
    BigInteger adjustedBonds = add(bondReserves, bondReserveAdjustment);
    BigInteger k = kUp(shareReserves, adjustedBonds, a, vaultSharePrice, initialVaultSharePrice);
    BigInteger optimalBonds = divUp(k, add(divDown(vaultSharePrice, initialVaultSharePrice), ONE));
    optimalBonds = pow(optimalBonds, optimalBonds.compareTo(ONE) >= 0 ? divUp(ONE, a) : divDown(ONE, a));
    if (adjustedBonds.compareTo(optimalBonds) < 0) {
      throw new InvalidCurveStateException("bond reserves " + adjustedBonds + " already below the max buy " + optimalBonds);
    }
    return adjustedBonds.subtract(optimalBonds);
  }

  /**
   * Bonds that can be sold to the pool before share reserves fall to {@code minShareReserves}:
   * {@code y' = (k - (c / mu) * (mu * zMin)^a)^(1 / a)}. Rounded so the sale is underestimated.
   *
   * @throws InvalidCurveStateException when share reserves are already at or below the floor
   */
  public static BigInteger calculateMaxSellBondsIn(
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger bondReserves,
      @NonNull BigInteger bondReserveAdjustment,
      @NonNull BigInteger minShareReserves,
      @NonNull BigInteger timeRemaining,
      @NonNull BigInteger timeStretch,
      @NonNull BigInteger vaultSharePrice,
      @NonNull BigInteger initialVaultSharePrice
  ) {
    BigInteger a = exponent(timeRemaining, timeStretch);
    BigInteger mu = initialVaultSharePrice;
    BigInteger adjustedBonds = add(bondReserves, bondReserveAdjustment);
    BigInteger k = kDown(shareReserves, adjustedBonds, a, vaultSharePrice, mu);
    BigInteger floorTerm = mulDivUp(vaultSharePrice, pow(mulUp(mu, minShareReserves), a), mu);
    if (k.compareTo(floorTerm) < 0) {
      throw new InvalidCurveStateException("invariant " + k + " below floor term " + floorTerm);
    }
    BigInteger optimalBonds = k.subtract(floorTerm);
    optimalBonds = pow(optimalBonds, optimalBonds.compareTo(ONE) >= 0 ? divDown(ONE, a) : divUp(ONE, a));
    if (optimalBonds.compareTo(adjustedBonds) < 0) {
      throw new InvalidCurveStateException("share reserves " + shareReserves + " already at or below " + minShareReserves);
    }
    return optimalBonds.subtract(adjustedBonds);
  }

  /**
   * Lowest spot price the curve reaches while share reserves stay at {@code minShareReserves} or above.
   * Zero when there is no floor.
   */
  public static BigInteger calculateMinSpotPrice(
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger bondReserves,
      @NonNull BigInteger bondReserveAdjustment,
      @NonNull BigInteger minShareReserves,
      @NonNull BigInteger timeStretch,
      @NonNull BigInteger vaultSharePrice,
      @NonNull BigInteger initialVaultSharePrice
  ) {
    if (minShareReserves.signum() == 0) {
      return BigInteger.ZERO;
    }
    BigInteger a = exponent(ONE, timeStretch);
    BigInteger mu = initialVaultSharePrice;
    BigInteger k = kUp(shareReserves, add(bondReserves, bondReserveAdjustment), a, vaultSharePrice, mu);
    BigInteger floorTerm = mulDown(divDown(vaultSharePrice, mu), pow(mulDown(mu, minShareReserves), a));
    BigInteger maxBonds = pow(sub(k, floorTerm), divUp(ONE, a));
    return pow(divDown(mulDown(mu, minShareReserves), maxBonds), timeStretch);
  }

  public static BigInteger kUp(BigInteger shareReserves, BigInteger adjustedBonds, BigInteger a,
                               BigInteger vaultSharePrice, BigInteger initialVaultSharePrice) {
    BigInteger shareTerm = mulDivUp(vaultSharePrice, pow(mulUp(initialVaultSharePrice, shareReserves), a), initialVaultSharePrice);
    return add(shareTerm, pow(adjustedBonds, a));
  }

  public static BigInteger kDown(BigInteger shareReserves, BigInteger adjustedBonds, BigInteger a,
                                 BigInteger vaultSharePrice, BigInteger initialVaultSharePrice) {
    BigInteger shareTerm = mulDivDown(vaultSharePrice, pow(mulDown(initialVaultSharePrice, shareReserves), a), initialVaultSharePrice);
    return add(shareTerm, pow(adjustedBonds, a));
  }

  /**
   * {@code 1 - s*t}, rounded up.
   */
  public static BigInteger exponent(BigInteger timeRemaining, BigInteger timeStretch) {
    return sub(ONE, mulDown(timeStretch, timeRemaining));
  }

  private static BigInteger bondsOutGivenSharesIn(BigInteger z, BigInteger adjustedBonds, BigInteger dz,
                                                  BigInteger a, BigInteger c, BigInteger mu) {
    BigInteger newShares = add(z, dz);
    if (a.signum() == 0) {
      // y' = (y + adj) * (z / (z + dz))^(c / mu)
      BigInteger ratio = divUp(z, newShares);
      BigInteger newBonds = mulUp(adjustedBonds, pow(ratio, divDown(c, mu)));
      return positiveDifference(adjustedBonds, newBonds);
    }

    BigInteger k = kUp(z, adjustedBonds, a, c, mu);
    BigInteger shareTerm = mulDivDown(c, pow(mulDown(mu, newShares), a), mu);
    if (k.compareTo(shareTerm) < 0) {
      throw new InvalidCurveStateException("invariant " + k + " below share term " + shareTerm);
    }
    BigInteger remainder = k.subtract(shareTerm);
    BigInteger newBonds = pow(remainder, inverseExponent(remainder, a));
    return positiveDifference(adjustedBonds, newBonds);
  }

  private static BigInteger sharesOutGivenBondsIn(BigInteger z, BigInteger adjustedBonds, BigInteger dy,
                                                  BigInteger a, BigInteger c, BigInteger mu) {
    BigInteger newBonds = add(adjustedBonds, dy);
    if (a.signum() == 0) {
      // z' = z * ((y + adj) / (y + adj + dy))^(mu / c)
      BigInteger ratio = divUp(adjustedBonds, newBonds);
      BigInteger newShares = mulUp(z, pow(ratio, divDown(mu, c)));
      return positiveDifference(z, newShares);
    }

    BigInteger k = kUp(z, adjustedBonds, a, c, mu);
    BigInteger bondTerm = pow(newBonds, a);
    if (k.compareTo(bondTerm) < 0) {
      throw new InvalidCurveStateException("invariant " + k + " below bond term " + bondTerm);
    }
    BigInteger newShares = mulDivUp(k.subtract(bondTerm), mu, c);
    newShares = pow(newShares, inverseExponent(newShares, a));
    newShares = divUp(newShares, mu);
    return positiveDifference(z, newShares);
  }

  // a base at or above one grows with the exponent, so the exponent rounds with the result
  private static BigInteger inverseExponent(BigInteger base, BigInteger a) {
    return base.compareTo(ONE) >= 0 ? divUp(ONE, a) : divDown(ONE, a);
  }

  /**
   * {@code larger - smaller}. Rounding can push the solved reserve a little past the current one and
   * that trade is worth nothing; a gap beyond {@link #ROUNDING_TOLERANCE} of the reserve means the
   * curve state is broken.
   */
  static BigInteger positiveDifference(BigInteger larger, BigInteger smaller) {
    if (larger.compareTo(smaller) >= 0) {
      return larger.subtract(smaller);
    }
    BigInteger excess = smaller.subtract(larger);
    BigInteger tolerance = max(MIN_ROUNDING_DUST, mulUp(larger, ROUNDING_TOLERANCE));
    if (excess.compareTo(tolerance) > 0) {
      throw new InvalidCurveStateException("solved reserve " + smaller + " overshoots " + larger + " by " + excess);
    }
    return BigInteger.ZERO;
  }
}
