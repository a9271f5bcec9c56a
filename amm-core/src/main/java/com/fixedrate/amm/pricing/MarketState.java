package com.fixedrate.amm.pricing;

import com.fixedrate.amm.config.PoolConfig;
import com.fixedrate.amm.curve.YieldSpaceMath;
import com.fixedrate.amm.error.FixedPointMathException;
import com.fixedrate.amm.error.InvalidCurveStateException;
import com.fixedrate.amm.error.ValidationException;
import lombok.NonNull;

import java.math.BigInteger;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static com.fixedrate.amm.math.FixedPointMath.ONE;
import static com.fixedrate.amm.math.FixedPointMath.UINT128_MAX;
import static com.fixedrate.amm.math.FixedPointMath.add;
import static com.fixedrate.amm.math.FixedPointMath.divDown;
import static com.fixedrate.amm.math.FixedPointMath.divUp;
import static com.fixedrate.amm.math.FixedPointMath.mulUp;
import static com.fixedrate.amm.math.FixedPointMath.sub;
import static com.fixedrate.amm.math.FixedPointMath.toUint128;

/**
 * Snapshot of a pool for pricing trades before they are placed. Opening a long or a short uses these
 * quotes, so a quoted trade placed against an unchanged pool settles at exactly the quoted amounts.
 * <p>
 * The trade limits search over those quotes. A long is allowed while the pool stays solvent and the
 * spot price stays at or below {@link #maxSpotPrice()}; a short while the pool stays solvent and the
 * deposit fits the budget.
 *
 * @param openVaultSharePrice vault share price of the checkpoint new positions open in
 * @param longExposure        bonds owed to longs net of same-maturity shorts, summed over pending maturities
 * @param checkpointExposure  longs minus shorts at the maturity new positions open into; may be negative
 */
public record MarketState(
    @NonNull BigInteger shareReserves,
    @NonNull BigInteger bondReserves,
    @NonNull BigInteger bondReserveAdjustment,
    @NonNull BigInteger vaultSharePrice,
    @NonNull BigInteger openVaultSharePrice,
    @NonNull BigInteger longExposure,
    @NonNull BigInteger checkpointExposure,
    @NonNull PoolConfig config
) {

  public MarketState {
    if (vaultSharePrice.signum() <= 0 || openVaultSharePrice.signum() <= 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_CONFIGURATION, "vault share prices must be positive");
    }
    if (longExposure.signum() < 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_CONFIGURATION, "negative long exposure: " + longExposure);
    }
  }

  public BigInteger spotPrice() {
    return PricingMath.calculateSpotPrice(shareReserves, bondReserves, bondReserveAdjustment,
        config.initialVaultSharePrice(), config.timeStretch());
  }

  public BigInteger spotRate() {
    return PricingMath.calculateRateFromPrice(spotPrice(), config.positionDuration());
  }

  /**
   * Share reserves left over once the long exposure is covered. Negative when the pool is insolvent.
   */
  public BigInteger solvency() {
    return shareReserves.subtract(exposureShares(longExposure));
  }

  /**
   * Highest spot price a long may push the pool to, so that after fees no bond is bought above one:
   * {@code (1 - phi_f) / (1 + phi_c * (1 / p - 1) * (1 - phi_f))}.
   */
  public BigInteger maxSpotPrice() {
    BigInteger flat = sub(ONE, config.fees().flat());
    BigInteger premium = sub(divUp(ONE, spotPrice()), ONE);
    return divDown(flat, add(ONE, mulUp(mulUp(config.fees().curve(), premium), flat)));
  }

  /**
   * Lowest spot price shorts can push the pool to while share reserves still cover the long exposure.
   */
  public BigInteger minSpotPrice() {
    return YieldSpaceMath.calculateMinSpotPrice(shareReserves, bondReserves, bondReserveAdjustment,
        exposureShares(longExposure), config.timeStretch(), vaultSharePrice, config.initialVaultSharePrice());
  }

  /**
   * Prices a long paying {@code shares}.
   */
  public TradeQuote openLong(@NonNull BigInteger shares) {
    BigInteger spotPrice = spotPrice();
    TradeResult trade = PricingMath.calculateOutGivenIn(shareReserves, bondReserves, bondReserveAdjustment, shares,
        ONE, config.timeStretch(), vaultSharePrice, config.initialVaultSharePrice(), true);
    BigInteger curveFee = PricingMath.calculateOpenLongCurveFee(shares, spotPrice, vaultSharePrice, config.fees().curve());
    BigInteger governanceFee = PricingMath.calculateOpenLongGovernanceFee(curveFee, spotPrice, vaultSharePrice,
        config.fees().governance());
    BigInteger bonds = sub(trade.curveBonds(), curveFee);
    BigInteger shareReservesAfter = toUint128(add(shareReserves, sub(shares, governanceFee)));
    BigInteger bondReservesAfter = toUint128(sub(bondReserves, bonds));
    return quote(shares, bonds, curveFee, governanceFee, shareReservesAfter, bondReservesAfter,
        checkpointExposure.add(bonds));
  }

  /**
   * Prices a short of {@code bonds}. The quote's shares are the trader's deposit: the bonds' face value
   * at the opening share price less the curve proceeds.
   */
  public TradeQuote openShort(@NonNull BigInteger bonds) {
    BigInteger spotPrice = spotPrice();
    TradeResult trade = PricingMath.calculateOutGivenIn(shareReserves, bondReserves, bondReserveAdjustment, bonds,
        ONE, config.timeStretch(), vaultSharePrice, config.initialVaultSharePrice(), false);
    BigInteger curveFee = PricingMath.calculateOpenShortCurveFee(bonds, spotPrice, vaultSharePrice, config.fees().curve());
    BigInteger governanceFee = PricingMath.calculateGovernanceFee(curveFee, config.fees().governance());
    BigInteger shareReservesDelta = sub(trade.curveShares(), curveFee);
    BigInteger deposit = sub(divUp(bonds, openVaultSharePrice), shareReservesDelta);
    BigInteger shareReservesAfter = sub(shareReserves, add(shareReservesDelta, governanceFee));
    BigInteger bondReservesAfter = toUint128(add(bondReserves, trade.curveBonds()));
    return quote(deposit, bonds, curveFee, governanceFee, shareReservesAfter, bondReservesAfter,
        checkpointExposure.subtract(bonds));
  }

  /**
   * Deposit a short of {@code bonds} requires, in base when {@code asBase}.
   */
  public BigInteger shortDeposit(@NonNull BigInteger bonds, boolean asBase) {
    return toDeposit(openShort(bonds).shares(), asBase);
  }

  /**
   * Largest long, in shares, that fits {@code budget}.
   */
  public BigInteger maxLong(@NonNull BigInteger budget) {
    BigInteger maxSpotPrice = maxSpotPrice();
    if (budget.signum() == 0 || spotPrice().compareTo(maxSpotPrice) >= 0) {
      return BigInteger.ZERO;
    }
    BigInteger start = YieldSpaceMath.calculateMaxBuySharesIn(shareReserves, bondReserves, bondReserveAdjustment, ONE,
        config.timeStretch(), vaultSharePrice, config.initialVaultSharePrice());
    return largestAccepted(shares -> shares.compareTo(budget) <= 0 && allowedLong(shares, maxSpotPrice).isPresent(), start);
  }

  /**
   * Largest short, in bonds, whose deposit fits {@code budget}, read as base when {@code asBase}.
   */
  public BigInteger maxShort(@NonNull BigInteger budget, boolean asBase) {
    if (budget.signum() == 0) {
      return BigInteger.ZERO;
    }
    // a short into the current maturity first nets against its longs
    BigInteger floor = exposureShares(longExposure.subtract(checkpointExposure.max(BigInteger.ZERO)));
    BigInteger start = shareReserves.compareTo(floor) > 0
        ? YieldSpaceMath.calculateMaxSellBondsIn(shareReserves, bondReserves, bondReserveAdjustment, floor, ONE,
            config.timeStretch(), vaultSharePrice, config.initialVaultSharePrice())
        : BigInteger.ONE;
    return largestAccepted(bonds -> quoted(() -> openShort(bonds))
        .filter(TradeQuote::isSolvent)
        .filter(quote -> toDeposit(quote.shares(), asBase).compareTo(budget) <= 0)
        .isPresent(), start);
  }

  /**
   * Smallest long, in shares, that brings the spot rate down to {@code targetRate}, capped at
   * {@code budget}.
   *
   * @throws ValidationException when the target is above the current rate, or lower than any allowed
   *                             long can reach
   */
  public BigInteger targetedLong(@NonNull BigInteger targetRate, @NonNull BigInteger budget) {
    BigInteger currentRate = spotRate();
    if (targetRate.compareTo(currentRate) > 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_APR,
          "target rate " + targetRate + " is above the current rate " + currentRate);
    }
    if (targetRate.equals(currentRate) || budget.signum() == 0) {
      return BigInteger.ZERO;
    }
    BigInteger maxSpotPrice = maxSpotPrice();
    BigInteger start = YieldSpaceMath.calculateMaxBuySharesIn(shareReserves, bondReserves, bondReserveAdjustment, ONE,
        config.timeStretch(), vaultSharePrice, config.initialVaultSharePrice());
    BigInteger shortOfTarget = largestAccepted(shares -> allowedLong(shares, maxSpotPrice)
        .filter(quote -> rateAt(quote.spotPrice()).compareTo(targetRate) > 0)
        .isPresent(), start);
    BigInteger amount = shortOfTarget.add(BigInteger.ONE);
    if (allowedLong(amount, maxSpotPrice).isEmpty()) {
      throw new ValidationException(ValidationException.Reason.INSUFFICIENT_LIQUIDITY,
          "target rate " + targetRate + " needs a long larger than the pool allows");
    }
    return amount.min(budget);
  }

  private Optional<TradeQuote> allowedLong(BigInteger shares, BigInteger maxSpotPrice) {
    return quoted(() -> openLong(shares))
        .filter(TradeQuote::isSolvent)
        .filter(quote -> quote.spotPrice().compareTo(maxSpotPrice) <= 0);
  }

  private TradeQuote quote(BigInteger shares, BigInteger bonds, BigInteger curveFee, BigInteger governanceFee,
                           BigInteger shareReservesAfter, BigInteger bondReservesAfter,
                           BigInteger checkpointExposureAfter) {
    BigInteger exposure = longExposure
        .subtract(checkpointExposure.max(BigInteger.ZERO))
        .add(checkpointExposureAfter.max(BigInteger.ZERO));
    BigInteger spotPriceAfter = PricingMath.calculateSpotPrice(shareReservesAfter, bondReservesAfter,
        bondReserveAdjustment, config.initialVaultSharePrice(), config.timeStretch());
    return new TradeQuote(shares, bonds, curveFee, governanceFee, shareReservesAfter, bondReservesAfter,
        spotPriceAfter, shareReservesAfter.subtract(exposureShares(exposure)));
  }

  private BigInteger rateAt(BigInteger spotPrice) {
    return PricingMath.calculateRateFromPrice(spotPrice, config.positionDuration());
  }

  private BigInteger toDeposit(BigInteger shares, boolean asBase) {
    return asBase ? mulUp(shares, vaultSharePrice) : shares;
  }

  private BigInteger exposureShares(BigInteger bonds) {
    return bonds.signum() > 0 ? divUp(bonds, vaultSharePrice) : BigInteger.ZERO;
  }

  private static Optional<TradeQuote> quoted(Supplier<TradeQuote> pricing) {
    try {
      return Optional.of(pricing.get());
    } catch (FixedPointMathException | InvalidCurveStateException e) {
      // the curve cannot absorb a trade of this size
      return Optional.empty();
    }
  }

  /**
   * Largest amount {@code accepted} takes, for a test that accepts every amount up to some bound and none
   * past it. Doubles from {@code start} until rejected, then bisects.
   */
  private static BigInteger largestAccepted(Predicate<BigInteger> accepted, BigInteger start) {
    BigInteger low = BigInteger.ZERO;
    BigInteger high = start.max(BigInteger.ONE);
    while (accepted.test(high)) {
      if (high.compareTo(UINT128_MAX) >= 0) {
        return UINT128_MAX;
      }
      low = high;
      high = high.shiftLeft(1).min(UINT128_MAX);
    }
    while (high.subtract(low).compareTo(BigInteger.ONE) > 0) {
      BigInteger middle = low.add(high).shiftRight(1);
      if (accepted.test(middle)) {
        low = middle;
      } else {
        high = middle;
      }
    }
    return low;
  }
}
