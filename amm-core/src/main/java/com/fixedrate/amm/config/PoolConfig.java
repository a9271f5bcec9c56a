package com.fixedrate.amm.config;

import com.fixedrate.amm.error.ValidationException;
import com.fixedrate.amm.pricing.PricingMath;
import lombok.NonNull;

import java.math.BigInteger;

import static com.fixedrate.amm.math.FixedPointMath.ONE;
import static com.fixedrate.amm.math.FixedPointMath.fromDecimal;

/**
 * Immutable pool parameters in 18-decimal fixed point.
 */
public record PoolConfig(
    @NonNull String poolAddress,
    @NonNull BigInteger initialVaultSharePrice,
    long positionDuration,
    long checkpointDuration,
    @NonNull BigInteger timeStretch,
    @NonNull BigInteger minimumTransactionAmount,
    @NonNull Fees fees,
    @NonNull String feeCollector
) {

  public PoolConfig {
    if (checkpointDuration <= 0 || positionDuration < checkpointDuration || positionDuration % checkpointDuration != 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_CONFIGURATION,
          "position duration " + positionDuration + " must be a positive multiple of checkpoint duration " + checkpointDuration);
    }
    if (initialVaultSharePrice.signum() <= 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_CONFIGURATION, "initial vault share price must be positive");
    }
    if (timeStretch.signum() <= 0 || timeStretch.compareTo(ONE) >= 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_CONFIGURATION, "time stretch outside (0, 1): " + timeStretch);
    }
  }

  public static PoolConfig from(AmmProperties.Pool pool) {
    BigInteger timeStretch = pool.timeStretch() != null
        ? fromDecimal(pool.timeStretch())
        : PricingMath.calculateTimeStretch(fromDecimal(pool.initialApr()));
    return new PoolConfig(
        pool.address(),
        fromDecimal(pool.initialVaultSharePrice()),
        pool.positionDurationSeconds(),
        pool.checkpointDurationSeconds(),
        timeStretch,
        fromDecimal(pool.minimumTransactionAmount()),
        Fees.from(pool.fees()),
        pool.feeCollector()
    );
  }

  /**
   * Checkpoint bucket that {@code time} falls into.
   */
  public long toCheckpoint(long time) {
    return time - Math.floorMod(time, checkpointDuration);
  }

  public record Fees(
      @NonNull BigInteger curve,
      @NonNull BigInteger flat,
      @NonNull BigInteger governance
  ) {
    public Fees {
      if (curve.compareTo(ONE) > 0 || flat.compareTo(ONE) > 0 || governance.compareTo(ONE) > 0) {
        throw new ValidationException(ValidationException.Reason.INVALID_CONFIGURATION, "fees must not exceed one");
      }
    }

    public static Fees from(AmmProperties.Fees fees) {
      return new Fees(fromDecimal(fees.curve()), fromDecimal(fees.flat()), fromDecimal(fees.governance()));
    }

    public static Fees none() {
      return new Fees(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
    }
  }
}
