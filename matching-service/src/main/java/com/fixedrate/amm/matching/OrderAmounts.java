package com.fixedrate.amm.matching;

import lombok.NonNull;

import java.math.BigInteger;

import static com.fixedrate.amm.math.FixedPointMath.add;
import static com.fixedrate.amm.math.FixedPointMath.toUint128;

/**
 * Bonds and funds already filled against one order.
 */
public record OrderAmounts(@NonNull BigInteger bondAmount, @NonNull BigInteger fundAmount) {

  public static final OrderAmounts NONE = new OrderAmounts(BigInteger.ZERO, BigInteger.ZERO);

  public OrderAmounts plus(@NonNull BigInteger bonds, @NonNull BigInteger funds) {
    return new OrderAmounts(toUint128(add(bondAmount, bonds)), toUint128(add(fundAmount, funds)));
  }
}
