package com.fixedrate.amm.error;

public enum ErrorCategory {
  ARITHMETIC,
  CURVE,
  VALIDATION,
  AUTHORIZATION,
  SLIPPAGE,
}
