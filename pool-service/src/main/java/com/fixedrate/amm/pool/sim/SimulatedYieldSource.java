package com.fixedrate.amm.pool.sim;

import com.fixedrate.amm.pool.port.DepositResult;
import com.fixedrate.amm.pool.port.YieldSource;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

import static com.fixedrate.amm.math.FixedPointMath.RAY;
import static com.fixedrate.amm.math.FixedPointMath.mulDivDown;
import static com.fixedrate.amm.math.FixedPointMath.rayToWad;
import static com.fixedrate.amm.math.FixedPointMath.sub;

/**
 * Vault whose share price is a 27-decimal index that only moves when told to. Base backing the
 * outstanding shares sits in {@link #VAULT_ACCOUNT} and is topped up or trimmed whenever the index
 * changes.
 */
@Slf4j
public class SimulatedYieldSource implements YieldSource {

  public static final String VAULT_ACCOUNT = "0x000000000000000000000000000000000000ba5e";

  private final String poolAccount;
  @Getter
  private final InMemoryFungibleToken baseToken;
  @Getter
  private final InMemoryFungibleToken vaultShares;
  private volatile BigInteger index;

  public SimulatedYieldSource(@NonNull String poolAccount, @NonNull InMemoryFungibleToken baseToken,
                              @NonNull InMemoryFungibleToken vaultShares, @NonNull BigInteger initialIndex) {
    if (initialIndex.signum() <= 0) {
      throw new IllegalArgumentException("index must be positive: " + initialIndex);
    }
    this.poolAccount = poolAccount;
    this.baseToken = baseToken;
    this.vaultShares = vaultShares;
    this.index = initialIndex;
  }

  public static SimulatedYieldSource create(String poolAccount) {
    return new SimulatedYieldSource(poolAccount, new InMemoryFungibleToken("BASE"), new InMemoryFungibleToken("SHARES"), RAY);
  }

  public BigInteger index() {
    return index;
  }

  /**
   * Moves the share price and rebalances the vault's base so every outstanding share stays redeemable.
   */
  public synchronized void setIndex(@NonNull BigInteger newIndex) {
    if (newIndex.signum() <= 0) {
      throw new IllegalArgumentException("index must be positive: " + newIndex);
    }
    index = newIndex;
    BigInteger required = convertToBase(vaultShares.totalSupply());
    BigInteger held = baseToken.balanceOf(VAULT_ACCOUNT);
    if (required.compareTo(held) > 0) {
      baseToken.mint(VAULT_ACCOUNT, required.subtract(held));
    } else if (required.compareTo(held) < 0) {
      baseToken.burn(VAULT_ACCOUNT, held.subtract(required));
    }
    log.debug("vault index set to {} (share price {})", newIndex, vaultSharePrice());
  }

  @Override
  public synchronized DepositResult depositBase(@NonNull String payer, @NonNull BigInteger amount) {
    BigInteger shares = convertToShares(amount);
    baseToken.transfer(payer, VAULT_ACCOUNT, amount);
    vaultShares.mint(poolAccount, shares);
    return new DepositResult(shares, BigInteger.ZERO);
  }

  @Override
  public synchronized BigInteger depositShares(@NonNull String payer, @NonNull BigInteger shares) {
    vaultShares.transfer(payer, poolAccount, shares);
    return shares;
  }

  @Override
  public synchronized BigInteger withdrawBase(@NonNull BigInteger shares, @NonNull String destination) {
    BigInteger base = convertToBase(shares);
    vaultShares.burn(poolAccount, shares);
    baseToken.transfer(VAULT_ACCOUNT, destination, base);
    return base;
  }

  @Override
  public synchronized BigInteger withdrawShares(@NonNull BigInteger shares, @NonNull String destination) {
    vaultShares.transfer(poolAccount, destination, shares);
    return shares;
  }

  @Override
  public BigInteger convertToBase(@NonNull BigInteger shares) {
    return mulDivDown(shares, index, RAY);
  }

  @Override
  public BigInteger convertToShares(@NonNull BigInteger base) {
    return mulDivDown(base, RAY, index);
  }

  @Override
  public BigInteger totalShares() {
    return vaultShares.balanceOf(poolAccount);
  }

  @Override
  public BigInteger vaultSharePrice() {
    return rayToWad(index);
  }

  /**
   * Base the vault holds beyond what its shares are worth.
   */
  public BigInteger surplusBase() {
    return sub(baseToken.balanceOf(VAULT_ACCOUNT), convertToBase(vaultShares.totalSupply()));
  }
}
