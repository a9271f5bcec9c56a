package com.fixedrate.amm.matching;

/**
 * What an order asks for. The ordinal is the {@code uint8} signed into the order hash.
 */
public enum OrderType {
  OPEN_LONG,
  OPEN_SHORT,
  CLOSE_LONG,
  CLOSE_SHORT;

  public boolean isOpen() {
    return this == OPEN_LONG || this == OPEN_SHORT;
  }

  public boolean isLong() {
    return this == OPEN_LONG || this == CLOSE_LONG;
  }

  public int code() {
    return ordinal();
  }
}
