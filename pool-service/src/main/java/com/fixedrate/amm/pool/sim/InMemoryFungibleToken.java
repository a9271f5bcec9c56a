package com.fixedrate.amm.pool.sim;

import com.fixedrate.amm.error.ValidationException;
import com.fixedrate.amm.pool.port.FungibleToken;
import lombok.NonNull;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.fixedrate.amm.math.FixedPointMath.add;
import static com.fixedrate.amm.math.FixedPointMath.sub;

/**
 * Process-local token balances keyed by lower-cased account address.
 */
public class InMemoryFungibleToken implements FungibleToken {

  private final String symbol;
  private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
  private BigInteger totalSupply = BigInteger.ZERO;

  public InMemoryFungibleToken(@NonNull String symbol) {
    this.symbol = symbol;
  }

  @Override
  public String symbol() {
    return symbol;
  }

  @Override
  public BigInteger balanceOf(@NonNull String account) {
    return balances.getOrDefault(key(account), BigInteger.ZERO);
  }

  public synchronized BigInteger totalSupply() {
    return totalSupply;
  }

  public synchronized void mint(@NonNull String account, @NonNull BigInteger amount) {
    balances.merge(key(account), amount, (a, b) -> add(a, b));
    totalSupply = add(totalSupply, amount);
  }

  public synchronized void burn(@NonNull String account, @NonNull BigInteger amount) {
    debit(account, amount);
    totalSupply = sub(totalSupply, amount);
  }

  @Override
  public synchronized void transfer(@NonNull String from, @NonNull String to, @NonNull BigInteger amount) {
    if (amount.signum() == 0) {
      return;
    }
    debit(from, amount);
    balances.merge(key(to), amount, (a, b) -> add(a, b));
  }

  private void debit(String account, BigInteger amount) {
    BigInteger balance = balanceOf(account);
    if (balance.compareTo(amount) < 0) {
      throw new ValidationException(ValidationException.Reason.INSUFFICIENT_BALANCE,
          symbol + " balance of " + account + " is " + balance + ", needs " + amount);
    }
    balances.put(key(account), balance.subtract(amount));
  }

  private static String key(String account) {
    return account.toLowerCase(Locale.ROOT);
  }
}
