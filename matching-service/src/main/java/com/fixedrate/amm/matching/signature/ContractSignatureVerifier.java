package com.fixedrate.amm.matching.signature;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.utils.Numeric;

@Slf4j
@RequiredArgsConstructor
public class ContractSignatureVerifier implements SignatureVerifier {

  private final @NonNull ContractSignatureValidator validator;

  @Override
  public boolean verify(byte[] digest, String signature, String signer) {
    if (digest == null || signature == null || signer == null) {
      return false;
    }
    byte[] raw;
    try {
      raw = Numeric.hexStringToByteArray(signature);
    } catch (RuntimeException e) {
      log.debug("signature is not hex: {}", e.toString());
      return false;
    }
    return validator.isValidSignature(signer, digest, raw);
  }
}
