package com.fixedrate.amm.error;

import lombok.Getter;

@Getter
public class AuthorizationException extends AmmException {

  private final Reason reason;

  public AuthorizationException(Reason reason, String message) {
    super(ErrorCategory.AUTHORIZATION, reason + ": " + message);
    this.reason = reason;
  }

  public enum Reason {
    INVALID_SIGNATURE,
    EXPIRED,
    CANCELLED,
    ALREADY_FULLY_EXECUTED,
    INSUFFICIENT_FUNDING,
    UNAUTHORIZED_CALLER,
  }
}
