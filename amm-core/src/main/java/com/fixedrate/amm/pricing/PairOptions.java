package com.fixedrate.amm.pricing;

import com.fixedrate.amm.error.ValidationException;
import lombok.NonNull;

public record PairOptions(@NonNull String longDestination, @NonNull String shortDestination, boolean asBase) {

  public PairOptions {
    if (isZero(longDestination) || isZero(shortDestination)) {
      throw new ValidationException(ValidationException.Reason.INVALID_DESTINATION, "pair destinations must be set");
    }
  }

  private static boolean isZero(String address) {
    return address.isBlank() || Options.ZERO_ADDRESS.equalsIgnoreCase(address);
  }
}
