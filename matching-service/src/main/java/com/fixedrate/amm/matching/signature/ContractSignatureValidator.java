package com.fixedrate.amm.matching.signature;

/**
 * Asks a contract account whether it accepts a signature, the way ERC-1271 {@code isValidSignature} does.
 */
public interface ContractSignatureValidator {

  boolean isValidSignature(String account, byte[] digest, byte[] signature);
}
