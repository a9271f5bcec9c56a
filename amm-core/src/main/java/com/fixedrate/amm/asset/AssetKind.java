package com.fixedrate.amm.asset;

import com.fixedrate.amm.error.ValidationException;

public enum AssetKind {
  LP(0),
  LONG(1),
  SHORT(2),
  WITHDRAWAL_SHARE(3);

  private final int tag;

  AssetKind(int tag) {
    this.tag = tag;
  }

  public int tag() {
    return tag;
  }

  /**
   * LP and withdrawal shares are pool-wide; longs and shorts are bucketed by maturity.
   */
  public boolean hasMaturity() {
    return this == LONG || this == SHORT;
  }

  public static AssetKind fromTag(int tag) {
    for (AssetKind kind : values()) {
      if (kind.tag == tag) {
        return kind;
      }
    }
    throw new ValidationException(ValidationException.Reason.INVALID_ASSET_ID, "unknown asset tag " + tag);
  }
}
