package com.fixedrate.amm.error;

/**
 * The invariant solve would need a negative real quantity at the current reserves.
 */
public class InvalidCurveStateException extends AmmException {

  public InvalidCurveStateException(String message) {
    super(ErrorCategory.CURVE, message);
  }
}
