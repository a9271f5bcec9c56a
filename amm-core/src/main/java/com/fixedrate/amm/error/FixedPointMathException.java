package com.fixedrate.amm.error;

public class FixedPointMathException extends AmmException {

  public FixedPointMathException(String message) {
    super(ErrorCategory.ARITHMETIC, message);
  }
}
