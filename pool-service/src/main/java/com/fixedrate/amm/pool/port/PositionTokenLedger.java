package com.fixedrate.amm.pool.port;

import com.fixedrate.amm.asset.AssetId;

import java.math.BigInteger;

/**
 * Balances of LP, long, short and withdrawal-share positions, keyed by {@link AssetId}.
 * {@link #burn} and {@link #transfer} fail with an insufficient-balance validation error rather
 * than going negative.
 */
public interface PositionTokenLedger {

  BigInteger balanceOf(AssetId id, String account);

  BigInteger totalSupply(AssetId id);

  void mint(AssetId id, String account, BigInteger amount);

  void burn(AssetId id, String account, BigInteger amount);

  void transfer(AssetId id, String from, String to, BigInteger amount);
}
