package com.fixedrate.amm.pricing;

import com.fixedrate.amm.curve.YieldSpaceMath;
import com.fixedrate.amm.error.ValidationException;
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
 * Trade pricing, rate conversion, LP share math and fees on top of {@link YieldSpaceMath}.
 * <p>
 * A trade with normalized time remaining {@code t} is split in two legs. The flat leg, {@code (1 - t)}
 * of the bonds, is settled one-to-one at the vault share price. The curve leg, {@code t} of the bonds,
 * is priced on the curve as if fully unmatured. The flat leg is applied to local copies of the reserves
 * with the liquidity update rule before the curve leg is priced.
 */
public final class PricingMath {

  public static final BigInteger SECONDS_PER_YEAR = BigInteger.valueOf(365L * 24 * 60 * 60);

  private static final BigInteger TIME_STRETCH_NUMERATOR = new BigInteger("5245920000000000000");
  private static final BigInteger TIME_STRETCH_RATE_FACTOR = new BigInteger("46650000000000000");

  private PricingMath() {
  }

  /**
   * Prices a trade of {@code amountIn}. For {@code isBondOut} the input is shares and only a fully
   * unmatured trade is supported; otherwise the input is bonds and the output shares.
   */
  public static TradeResult calculateOutGivenIn(
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
    requireTimeRemaining(timeRemaining);
    if (isBondOut) {
      if (timeRemaining.compareTo(ONE) < 0) {
        throw new ValidationException(ValidationException.Reason.UNSUPPORTED_TRADE,
            "bonds out requires a fully unmatured trade, t=" + timeRemaining);
      }
      BigInteger bondsOut = YieldSpaceMath.calculateOutGivenIn(shareReserves, bondReserves, bondReserveAdjustment,
          amountIn, ONE, timeStretch, vaultSharePrice, initialVaultSharePrice, true);
      return new TradeResult(BigInteger.ZERO, amountIn, bondsOut, bondsOut);
    }

    BigInteger curveBonds = mulDown(amountIn, timeRemaining);
    BigInteger flatShares = divDown(sub(amountIn, curveBonds), vaultSharePrice);
    if (curveBonds.signum() == 0) {
      return new TradeResult(flatShares, BigInteger.ZERO, BigInteger.ZERO, flatShares);
    }

    BigInteger localShares = sub(shareReserves, flatShares);
    BigInteger localBonds = rescaleBonds(shareReserves, bondReserves, localShares);
    BigInteger curveShares = YieldSpaceMath.calculateOutGivenIn(localShares, localBonds, bondReserveAdjustment,
        curveBonds, ONE, timeStretch, vaultSharePrice, initialVaultSharePrice, false);
    return new TradeResult(flatShares, curveShares, curveBonds, add(flatShares, curveShares));
  }

  /**
   * Prices taking {@code bondsOut} bonds from the pool, rounding the required shares up. Used to close
   * shorts at any time remaining.
   */
  public static TradeResult calculateInGivenOut(
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger bondReserves,
      @NonNull BigInteger bondReserveAdjustment,
      @NonNull BigInteger bondsOut,
      @NonNull BigInteger timeRemaining,
      @NonNull BigInteger timeStretch,
      @NonNull BigInteger vaultSharePrice,
      @NonNull BigInteger initialVaultSharePrice
  ) {
    requireTimeRemaining(timeRemaining);
    BigInteger curveBonds = mulDown(bondsOut, timeRemaining);
    BigInteger flatShares = divUp(sub(bondsOut, curveBonds), vaultSharePrice);
    if (curveBonds.signum() == 0) {
      return new TradeResult(flatShares, BigInteger.ZERO, BigInteger.ZERO, flatShares);
    }

    BigInteger localShares = add(shareReserves, flatShares);
    BigInteger localBonds = rescaleBonds(shareReserves, bondReserves, localShares);
    BigInteger curveShares = YieldSpaceMath.calculateSharesInGivenBondsOut(localShares, localBonds,
        bondReserveAdjustment, curveBonds, ONE, timeStretch, vaultSharePrice, initialVaultSharePrice);
    return new TradeResult(flatShares, curveShares, curveBonds, add(flatShares, curveShares));
  }

  /**
   * Liquidity update rule: bond reserves follow share reserves so the marginal rate is unchanged.
   */
  public static BigInteger rescaleBonds(@NonNull BigInteger shareReserves, @NonNull BigInteger bondReserves,
                                        @NonNull BigInteger newShareReserves) {
    if (shareReserves.signum() == 0) {
      return bondReserves;
    }
    return mulDivDown(bondReserves, newShareReserves, shareReserves);
  }

  /**
   * {@code p = (mu * z / (y + l))^s}.
   */
  public static BigInteger calculateSpotPrice(@NonNull BigInteger shareReserves, @NonNull BigInteger bondReserves,
                                              @NonNull BigInteger bondReserveAdjustment,
                                              @NonNull BigInteger initialVaultSharePrice,
                                              @NonNull BigInteger timeStretch) {
    BigInteger adjustedBonds = add(bondReserves, bondReserveAdjustment);
    return pow(divDown(mulDown(initialVaultSharePrice, shareReserves), adjustedBonds), timeStretch);
  }

  /**
   * Annualized rate implied by a bond price: {@code (1 - p) / (p * T)}.
   */
  public static BigInteger calculateRateFromPrice(@NonNull BigInteger price, long positionDuration) {
    BigInteger years = annualize(positionDuration);
    return divDown(sub(ONE, price), mulDown(price, years));
  }

  public static BigInteger calculateAprFromReserves(
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger bondReserves,
      @NonNull BigInteger bondReserveAdjustment,
      @NonNull BigInteger initialVaultSharePrice,
      long positionDuration,
      @NonNull BigInteger timeStretch
  ) {
    BigInteger price = calculateSpotPrice(shareReserves, bondReserves, bondReserveAdjustment,
        initialVaultSharePrice, timeStretch);
    return calculateRateFromPrice(price, positionDuration);
  }

  /**
   * Bond reserves that price the pool at {@code apr}: {@code mu * z * (1 + apr * T)^(1 / s) - l}.
   */
  public static BigInteger calculateBondReserves(
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger bondReserveAdjustment,
      @NonNull BigInteger initialVaultSharePrice,
      @NonNull BigInteger apr,
      long positionDuration,
      @NonNull BigInteger timeStretch
  ) {
    BigInteger interestFactor = add(ONE, mulDown(apr, annualize(positionDuration)));
    BigInteger scaled = mulDown(mulDown(initialVaultSharePrice, shareReserves), pow(interestFactor, divDown(ONE, timeStretch)));
    if (scaled.compareTo(bondReserveAdjustment) < 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_APR,
          "apr " + apr + " leaves negative bond reserves");
    }
    return scaled.subtract(bondReserveAdjustment);
  }

  /**
   * Time stretch for a target rate: {@code 1 / (5.24592 / (0.04665 * apr * 100))}.
   */
  public static BigInteger calculateTimeStretch(@NonNull BigInteger apr) {
    if (apr.signum() <= 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_APR, "time stretch needs a positive apr");
    }
    BigInteger stretch = divDown(TIME_STRETCH_NUMERATOR, mulDown(TIME_STRETCH_RATE_FACTOR, apr.multiply(BigInteger.valueOf(100))));
    return divDown(ONE, stretch);
  }

  /**
   * {@code seconds} as a fixed-point number of years.
   */
  public static BigInteger annualize(long seconds) {
    return mulDivDown(BigInteger.valueOf(seconds), ONE, SECONDS_PER_YEAR);
  }

  public static BigInteger calculateNormalizedTimeRemaining(long maturityTime, long latestCheckpoint, long positionDuration) {
    if (maturityTime <= latestCheckpoint) {
      return BigInteger.ZERO;
    }
    return mulDivDown(BigInteger.valueOf(maturityTime - latestCheckpoint), ONE, BigInteger.valueOf(positionDuration));
  }

  /**
   * LP shares minted for {@code shares} contributed, against present value {@code z + shorts/c - longs/c}
   * rounded up so the minted amount rounds down.
   */
  public static BigInteger calculateLpSharesOutForSharesIn(
      @NonNull BigInteger shares,
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger lpTotalSupply,
      @NonNull BigInteger longsOutstanding,
      @NonNull BigInteger shortsOutstanding,
      @NonNull BigInteger vaultSharePrice
  ) {
    BigInteger presentValue = sub(add(shareReserves, divUp(shortsOutstanding, vaultSharePrice)),
        divDown(longsOutstanding, vaultSharePrice));
    requirePresentValue(presentValue);
    return mulDivDown(shares, lpTotalSupply, presentValue);
  }

  /**
   * Shares owed for {@code lpShares} redeemed, against present value rounded down.
   */
  public static BigInteger calculateSharesOutForLpSharesIn(
      @NonNull BigInteger lpShares,
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger lpTotalSupply,
      @NonNull BigInteger longsOutstanding,
      @NonNull BigInteger shortsOutstanding,
      @NonNull BigInteger vaultSharePrice
  ) {
    BigInteger presentValue = calculatePresentValue(shareReserves, longsOutstanding, shortsOutstanding, vaultSharePrice);
    requirePresentValue(presentValue);
    return mulDivDown(presentValue, lpShares, lpTotalSupply);
  }

  public static BigInteger calculatePresentValue(
      @NonNull BigInteger shareReserves,
      @NonNull BigInteger longsOutstanding,
      @NonNull BigInteger shortsOutstanding,
      @NonNull BigInteger vaultSharePrice
  ) {
    return sub(add(shareReserves, divDown(shortsOutstanding, vaultSharePrice)), divUp(longsOutstanding, vaultSharePrice));
  }

  /**
   * Curve fee on opening a long, in bonds: {@code phi_c * (1/p - 1) * c * dz}.
   */
  public static BigInteger calculateOpenLongCurveFee(BigInteger shares, BigInteger spotPrice,
                                                     BigInteger vaultSharePrice, BigInteger curveFee) {
    BigInteger premium = sub(divUp(ONE, spotPrice), ONE);
    return mulUp(mulUp(curveFee, premium), mulUp(shares, vaultSharePrice));
  }

  /**
   * Governance cut of the open-long curve fee, converted to shares: {@code phi_g * p * fee / c}.
   */
  public static BigInteger calculateOpenLongGovernanceFee(BigInteger curveFeeBonds, BigInteger spotPrice,
                                                          BigInteger vaultSharePrice, BigInteger governanceFee) {
    return divDown(mulDown(mulDown(curveFeeBonds, spotPrice), governanceFee), vaultSharePrice);
  }

  /**
   * Curve fee on opening a short, in shares: {@code phi_c * (1 - p) * dy / c}.
   */
  public static BigInteger calculateOpenShortCurveFee(BigInteger bonds, BigInteger spotPrice,
                                                      BigInteger vaultSharePrice, BigInteger curveFee) {
    return divUp(mulUp(mulUp(curveFee, sub(ONE, spotPrice)), bonds), vaultSharePrice);
  }

  /**
   * Curve fee on closing either side, in shares: {@code phi_c * (1 - p) * dy * t / c}.
   */
  public static BigInteger calculateCloseCurveFee(BigInteger bonds, BigInteger spotPrice, BigInteger timeRemaining,
                                                  BigInteger vaultSharePrice, BigInteger curveFee) {
    return mulUp(mulUp(curveFee, sub(ONE, spotPrice)), mulDivUp(bonds, timeRemaining, vaultSharePrice));
  }

  /**
   * Flat fee on closing either side, in shares: {@code phi_f * dy * (1 - t) / c}.
   */
  public static BigInteger calculateCloseFlatFee(BigInteger bonds, BigInteger timeRemaining,
                                                 BigInteger vaultSharePrice, BigInteger flatFee) {
    return mulUp(mulDivUp(bonds, sub(ONE, timeRemaining), vaultSharePrice), flatFee);
  }

  public static BigInteger calculateGovernanceFee(BigInteger fee, BigInteger governanceFee) {
    return mulDown(fee, governanceFee);
  }

  /**
   * Shares owed to a short: {@code max(0, dy * c1 / (c0 * c) - sharePayment)}.
   */
  public static BigInteger calculateShortProceeds(
      @NonNull BigInteger bondAmount,
      @NonNull BigInteger sharePayment,
      @NonNull BigInteger openVaultSharePrice,
      @NonNull BigInteger closeVaultSharePrice,
      @NonNull BigInteger vaultSharePrice
  ) {
    BigInteger bondFactor = mulDivDown(bondAmount, closeVaultSharePrice, mulDown(openVaultSharePrice, vaultSharePrice));
    return bondFactor.compareTo(sharePayment) > 0 ? bondFactor.subtract(sharePayment) : BigInteger.ZERO;
  }

  /**
   * Scales proceeds down when the vault lost value between open and close.
   */
  public static BigInteger applyNegativeInterest(@NonNull BigInteger proceeds,
                                                 @NonNull BigInteger openVaultSharePrice,
                                                 @NonNull BigInteger closeVaultSharePrice) {
    if (openVaultSharePrice.signum() == 0 || closeVaultSharePrice.compareTo(openVaultSharePrice) >= 0) {
      return proceeds;
    }
    return mulDivDown(proceeds, closeVaultSharePrice, openVaultSharePrice);
  }

  /**
   * Base needed to mint {@code bondAmount} matching longs and shorts: the bonds' backing at the higher of
   * the current and checkpoint share price, the flat fee, and twice the governance cut of the flat fee.
   */
  public static BigInteger calculateMintCost(
      @NonNull BigInteger bondAmount,
      @NonNull BigInteger vaultSharePrice,
      @NonNull BigInteger openVaultSharePrice,
      @NonNull BigInteger flatFee,
      @NonNull BigInteger governanceFee
  ) {
    BigInteger flat = mulUp(bondAmount, flatFee);
    BigInteger governance = mulDown(flat, governanceFee).shiftLeft(1);
    BigInteger backing = mulDivUp(bondAmount, max(vaultSharePrice, openVaultSharePrice), openVaultSharePrice);
    return add(add(backing, flat), governance);
  }

  private static void requireTimeRemaining(BigInteger timeRemaining) {
    if (timeRemaining.signum() < 0 || timeRemaining.compareTo(ONE) > 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_TIMESTAMP,
          "normalized time remaining outside [0, 1]: " + timeRemaining);
    }
  }

  private static void requirePresentValue(BigInteger presentValue) {
    if (presentValue.signum() == 0) {
      throw new ValidationException(ValidationException.Reason.INSUFFICIENT_LIQUIDITY, "pool present value is zero");
    }
  }
}
