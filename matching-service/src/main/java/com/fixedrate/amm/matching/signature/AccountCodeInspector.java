package com.fixedrate.amm.matching.signature;

@FunctionalInterface
public interface AccountCodeInspector {

  /**
   * True when {@code account} has code deployed, i.e. signs through a contract rather than a key.
   */
  boolean isContract(String account);

  static AccountCodeInspector externallyOwnedOnly() {
    return account -> false;
  }
}
