package com.fixedrate.amm.matching;

import com.fixedrate.amm.pricing.Options;
import lombok.Builder;
import lombok.NonNull;

import java.math.BigInteger;

/**
 * A signed, off-book instruction to trade against a counterparty order.
 * <p>
 * For opens {@code fundAmount} is the most the trader pays for {@code bondAmount} bonds; for closes it
 * is the least the trader accepts for them. Close orders name one maturity, so their minimum and
 * maximum maturity times are equal. A zero {@code counterparty} matches anyone.
 *
 * @param signature hex encoded {@code r || s || v}, or whatever the trader's contract account accepts
 */
@Builder(toBuilder = true)
public record OrderIntent(
    @NonNull String trader,
    @NonNull String counterparty,
    @NonNull String pool,
    @NonNull BigInteger fundAmount,
    @NonNull BigInteger bondAmount,
    @NonNull BigInteger minVaultSharePrice,
    @NonNull Options options,
    @NonNull OrderType orderType,
    long minMaturityTime,
    long maxMaturityTime,
    long expiry,
    @NonNull BigInteger salt,
    String signature
) {

  public boolean acceptsCounterparty(@NonNull String account) {
    return Options.ZERO_ADDRESS.equalsIgnoreCase(counterparty) || counterparty.equalsIgnoreCase(account);
  }

  public OrderIntent withSignature(String signature) {
    return toBuilder().signature(signature).build();
  }
}
