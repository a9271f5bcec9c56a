package com.fixedrate.amm.error;

import lombok.Getter;

import java.math.BigInteger;

/**
 * A computed amount fell outside the limit the caller supplied.
 */
@Getter
public class SlippageException extends AmmException {

  private final BigInteger actual;
  private final BigInteger limit;

  public SlippageException(String message, BigInteger actual, BigInteger limit) {
    super(ErrorCategory.SLIPPAGE, message + " (actual=" + actual + ", limit=" + limit + ")");
    this.actual = actual;
    this.limit = limit;
  }
}
