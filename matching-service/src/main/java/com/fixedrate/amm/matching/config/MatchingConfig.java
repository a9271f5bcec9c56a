package com.fixedrate.amm.matching.config;

import com.fixedrate.amm.config.AmmProperties;
import lombok.NonNull;

/**
 * Resolved matching engine settings.
 *
 * @param address        verifying contract bound into every order hash
 * @param engineAccount  account that holds funds and positions while a match settles
 */
public record MatchingConfig(
    @NonNull String address,
    @NonNull String engineAccount,
    @NonNull String domainName,
    @NonNull String domainVersion,
    long chainId
) {

  public static MatchingConfig from(@NonNull AmmProperties.Matching properties) {
    return new MatchingConfig(
        properties.address(),
        properties.engineAccount(),
        properties.domainName(),
        properties.domainVersion(),
        properties.chainId()
    );
  }
}
