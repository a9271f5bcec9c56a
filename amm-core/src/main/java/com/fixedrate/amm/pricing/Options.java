package com.fixedrate.amm.pricing;

import com.fixedrate.amm.error.ValidationException;
import lombok.NonNull;

/**
 * Settlement options: where proceeds go and whether they settle in base or in vault shares.
 */
public record Options(@NonNull String destination, boolean asBase) {

  public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

  public Options {
    if (destination.isBlank() || ZERO_ADDRESS.equalsIgnoreCase(destination)) {
      throw new ValidationException(ValidationException.Reason.INVALID_DESTINATION, "destination must be set");
    }
  }
}
