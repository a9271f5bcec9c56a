package com.fixedrate.amm.matching.signature;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Routes contract accounts to the contract check and everyone else to ECDSA recovery.
 */
@RequiredArgsConstructor
public class CompositeSignatureVerifier implements SignatureVerifier {

  private final @NonNull AccountCodeInspector accounts;
  private final @NonNull SignatureVerifier externallyOwned;
  private final @NonNull SignatureVerifier contract;

  @Override
  public boolean verify(byte[] digest, String signature, String signer) {
    if (signer == null) {
      return false;
    }
    return accounts.isContract(signer)
        ? contract.verify(digest, signature, signer)
        : externallyOwned.verify(digest, signature, signer);
  }
}
