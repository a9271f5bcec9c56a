package com.fixedrate.amm.pool;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.fixedrate.amm.math.FixedPointMath.add;
import static com.fixedrate.amm.math.FixedPointMath.sub;
import static com.fixedrate.amm.math.FixedPointMath.toUint128;

/**
 * Mutable pool bookkeeping. Every stored amount is kept within uint128; a write outside that range
 * fails before the field changes. Not thread-safe, callers hold the pool's transaction lock.
 */
@Getter
public final class PoolState {

  private BigInteger shareReserves = BigInteger.ZERO;
  private BigInteger bondReserves = BigInteger.ZERO;
  private BigInteger lpTotalSupply = BigInteger.ZERO;
  private BigInteger longsOutstanding = BigInteger.ZERO;
  private BigInteger shortsOutstanding = BigInteger.ZERO;
  private BigInteger withdrawalSharesOutstanding = BigInteger.ZERO;
  private BigInteger withdrawalSharesReadyToWithdraw = BigInteger.ZERO;
  private BigInteger withdrawalSharesProceeds = BigInteger.ZERO;
  private BigInteger governanceFeesAccrued = BigInteger.ZERO;
  private boolean initialized;
  @Getter(AccessLevel.NONE)
  private final TreeMap<Long, Checkpoint> checkpoints = new TreeMap<>();

  public void setShareReserves(@NonNull BigInteger value) {
    shareReserves = toUint128(value);
  }

  public void setBondReserves(@NonNull BigInteger value) {
    bondReserves = toUint128(value);
  }

  public void setLpTotalSupply(@NonNull BigInteger value) {
    lpTotalSupply = toUint128(value);
  }

  public void setLongsOutstanding(@NonNull BigInteger value) {
    longsOutstanding = toUint128(value);
  }

  public void setShortsOutstanding(@NonNull BigInteger value) {
    shortsOutstanding = toUint128(value);
  }

  public void setWithdrawalSharesOutstanding(@NonNull BigInteger value) {
    withdrawalSharesOutstanding = toUint128(value);
  }

  public void setWithdrawalSharesReadyToWithdraw(@NonNull BigInteger value) {
    withdrawalSharesReadyToWithdraw = toUint128(value);
  }

  public void setWithdrawalSharesProceeds(@NonNull BigInteger value) {
    withdrawalSharesProceeds = toUint128(value);
  }

  public void setGovernanceFeesAccrued(@NonNull BigInteger value) {
    governanceFeesAccrued = toUint128(value);
  }

  public void markInitialized() {
    initialized = true;
  }

  /**
   * LP shares that still share in the pool's value: LP supply plus withdrawal shares not yet paid out.
   */
  public BigInteger effectiveLpSupply() {
    return sub(add(lpTotalSupply, withdrawalSharesOutstanding), withdrawalSharesReadyToWithdraw);
  }

  /**
   * The curve prices bonds against {@code y + l}, where {@code l} is the effective LP supply.
   */
  public BigInteger bondReserveAdjustment() {
    return effectiveLpSupply();
  }

  public Checkpoint checkpoint(long time) {
    return checkpoints.getOrDefault(time, Checkpoint.EMPTY);
  }

  public void putCheckpoint(long time, @NonNull Checkpoint checkpoint) {
    toUint128(checkpoint.vaultSharePrice());
    toUint128(checkpoint.longSharePrice());
    checkpoints.put(time, checkpoint);
  }

  public Set<Long> checkpointTimes() {
    return Set.copyOf(checkpoints.keySet());
  }

  public Map<Long, Checkpoint> checkpoints() {
    return Map.copyOf(checkpoints);
  }

  public PoolState copy() {
    PoolState copy = new PoolState();
    copy.restore(this);
    return copy;
  }

  public void restore(@NonNull PoolState other) {
    shareReserves = other.shareReserves;
    bondReserves = other.bondReserves;
    lpTotalSupply = other.lpTotalSupply;
    longsOutstanding = other.longsOutstanding;
    shortsOutstanding = other.shortsOutstanding;
    withdrawalSharesOutstanding = other.withdrawalSharesOutstanding;
    withdrawalSharesReadyToWithdraw = other.withdrawalSharesReadyToWithdraw;
    withdrawalSharesProceeds = other.withdrawalSharesProceeds;
    governanceFeesAccrued = other.governanceFeesAccrued;
    initialized = other.initialized;
    checkpoints.clear();
    checkpoints.putAll(other.checkpoints);
  }

  public PoolInfo toInfo() {
    return new PoolInfo(shareReserves, bondReserves, lpTotalSupply, longsOutstanding, shortsOutstanding,
        withdrawalSharesOutstanding, withdrawalSharesReadyToWithdraw, withdrawalSharesProceeds,
        governanceFeesAccrued, initialized);
  }
}
