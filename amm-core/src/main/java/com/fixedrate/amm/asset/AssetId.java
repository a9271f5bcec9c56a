package com.fixedrate.amm.asset;

import com.fixedrate.amm.error.ValidationException;
import lombok.NonNull;

import java.math.BigInteger;

/**
 * Position identifier packed as {@code (tag << 248) | maturityTime}.
 */
public record AssetId(@NonNull AssetKind kind, long maturityTime) {

  static final int TAG_SHIFT = 248;
  private static final BigInteger TIMESTAMP_MASK = BigInteger.ONE.shiftLeft(TAG_SHIFT).subtract(BigInteger.ONE);
  private static final BigInteger ID_LIMIT = BigInteger.ONE.shiftLeft(256);

  public static final AssetId LP = new AssetId(AssetKind.LP, 0L);
  public static final AssetId WITHDRAWAL_SHARE = new AssetId(AssetKind.WITHDRAWAL_SHARE, 0L);

  public AssetId {
    if (maturityTime < 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_TIMESTAMP, "negative maturity " + maturityTime);
    }
    if (!kind.hasMaturity() && maturityTime != 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_ASSET_ID,
          kind + " ids carry no maturity, got " + maturityTime);
    }
  }

  public static AssetId longs(long maturityTime) {
    return new AssetId(AssetKind.LONG, maturityTime);
  }

  public static AssetId shorts(long maturityTime) {
    return new AssetId(AssetKind.SHORT, maturityTime);
  }

  public BigInteger encode() {
    return BigInteger.valueOf(kind.tag()).shiftLeft(TAG_SHIFT).or(BigInteger.valueOf(maturityTime));
  }

  public static AssetId decode(@NonNull BigInteger id) {
    if (id.signum() < 0 || id.compareTo(ID_LIMIT) >= 0) {
      throw new ValidationException(ValidationException.Reason.INVALID_ASSET_ID, "id outside uint256: " + id);
    }
    AssetKind kind = AssetKind.fromTag(id.shiftRight(TAG_SHIFT).intValue());
    BigInteger timestamp = id.and(TIMESTAMP_MASK);
    if (timestamp.bitLength() > 63) {
      throw new ValidationException(ValidationException.Reason.INVALID_TIMESTAMP, "maturity does not fit a timestamp: " + timestamp);
    }
    return new AssetId(kind, timestamp.longValue());
  }

  @Override
  public String toString() {
    return kind.hasMaturity() ? kind + "@" + maturityTime : kind.name();
  }
}
