package com.fixedrate.amm.error;

import lombok.Getter;

/**
 * Base type for every failure raised by the pool, the pricing math and the matching engine.
 * A thrown {@code AmmException} always means the requested operation had no effect.
 */
@Getter
public abstract class AmmException extends RuntimeException {

  private final ErrorCategory category;

  protected AmmException(ErrorCategory category, String message) {
    super(message);
    this.category = category;
  }

  protected AmmException(ErrorCategory category, String message, Throwable cause) {
    super(message, cause);
    this.category = category;
  }
}
