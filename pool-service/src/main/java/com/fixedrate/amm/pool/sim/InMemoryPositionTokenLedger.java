package com.fixedrate.amm.pool.sim;

import com.fixedrate.amm.asset.AssetId;
import com.fixedrate.amm.error.ValidationException;
import com.fixedrate.amm.pool.port.PositionTokenLedger;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static com.fixedrate.amm.math.FixedPointMath.add;
import static com.fixedrate.amm.math.FixedPointMath.sub;

/**
 * Position balances held in memory, one balance table per {@link AssetId}.
 */
@Slf4j
public class InMemoryPositionTokenLedger implements PositionTokenLedger {

  private final Map<AssetId, Map<String, BigInteger>> balances = new HashMap<>();
  private final Map<AssetId, BigInteger> totalSupply = new HashMap<>();

  @Override
  public synchronized BigInteger balanceOf(@NonNull AssetId id, @NonNull String account) {
    return balances.getOrDefault(id, Map.of()).getOrDefault(key(account), BigInteger.ZERO);
  }

  @Override
  public synchronized BigInteger totalSupply(@NonNull AssetId id) {
    return totalSupply.getOrDefault(id, BigInteger.ZERO);
  }

  @Override
  public synchronized void mint(@NonNull AssetId id, @NonNull String account, @NonNull BigInteger amount) {
    credit(id, account, amount);
    totalSupply.merge(id, amount, (a, b) -> add(a, b));
    log.debug("minted {} {} to {}", amount, id, account);
  }

  @Override
  public synchronized void burn(@NonNull AssetId id, @NonNull String account, @NonNull BigInteger amount) {
    debit(id, account, amount);
    totalSupply.put(id, sub(totalSupply(id), amount));
    log.debug("burned {} {} from {}", amount, id, account);
  }

  @Override
  public synchronized void transfer(@NonNull AssetId id, @NonNull String from, @NonNull String to,
                                    @NonNull BigInteger amount) {
    debit(id, from, amount);
    credit(id, to, amount);
  }

  private void credit(AssetId id, String account, BigInteger amount) {
    balances.computeIfAbsent(id, ignored -> new HashMap<>()).merge(key(account), amount, (a, b) -> add(a, b));
  }

  private void debit(AssetId id, String account, BigInteger amount) {
    BigInteger balance = balanceOf(id, account);
    if (balance.compareTo(amount) < 0) {
      throw new ValidationException(ValidationException.Reason.INSUFFICIENT_BALANCE,
          id + " balance of " + account + " is " + balance + ", needs " + amount);
    }
    balances.computeIfAbsent(id, ignored -> new HashMap<>()).put(key(account), balance.subtract(amount));
  }

  private static String key(String account) {
    return account.toLowerCase(Locale.ROOT);
  }
}
