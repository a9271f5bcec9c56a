package com.fixedrate.amm.matching.signature;

/**
 * Decides whether {@code signature} over {@code digest} was produced by {@code signer}.
 */
public interface SignatureVerifier {

  boolean verify(byte[] digest, String signature, String signer);
}
