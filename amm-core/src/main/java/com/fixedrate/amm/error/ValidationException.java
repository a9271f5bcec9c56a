package com.fixedrate.amm.error;

import lombok.Getter;

@Getter
public class ValidationException extends AmmException {

  private final Reason reason;

  public ValidationException(Reason reason, String message) {
    super(ErrorCategory.VALIDATION, reason + ": " + message);
    this.reason = reason;
  }

  public enum Reason {
    INVALID_ASSET_ID,
    INVALID_TIMESTAMP,
    ZERO_AMOUNT,
    MINIMUM_TRANSACTION_AMOUNT,
    INVALID_MATURITY_TIME,
    COUNTERPARTY_MISMATCH,
    SETTLEMENT_ASSET_MISMATCH,
    POOL_MISMATCH,
    INVALID_DESTINATION,
    INVALID_ORDER_COMBINATION,
    NOT_INITIALIZED,
    ALREADY_INITIALIZED,
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_LIQUIDITY,
    REENTRANT_CALL,
    UNSUPPORTED_TRADE,
    INVALID_APR,
    INVALID_CONFIGURATION,
  }
}
