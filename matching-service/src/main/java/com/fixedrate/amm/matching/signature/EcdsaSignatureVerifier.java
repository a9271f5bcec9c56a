package com.fixedrate.amm.matching.signature;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * Recovers the signing address from a 65 byte {@code r || s || v} secp256k1 signature over the raw
 * digest. Both {@code v = 27/28} and {@code v = 0/1} are accepted.
 */
@Slf4j
public class EcdsaSignatureVerifier implements SignatureVerifier {

  private static final int SIGNATURE_LENGTH = 65;

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
    if (raw.length != SIGNATURE_LENGTH) {
      return false;
    }
    String recovered = recover(digest, raw);
    return recovered != null && recovered.equalsIgnoreCase(signer);
  }

  static String recover(@NonNull byte[] digest, @NonNull byte[] raw) {
    byte v = raw[64];
    if (v < 27) {
      v += 27;
    }
    if (v != 27 && v != 28) {
      return null;
    }
    Sign.SignatureData data = new Sign.SignatureData(v, Arrays.copyOfRange(raw, 0, 32), Arrays.copyOfRange(raw, 32, 64));
    try {
      BigInteger publicKey = Sign.signedMessageHashToKey(digest, data);
      return Numeric.prependHexPrefix(Keys.getAddress(publicKey));
    } catch (SignatureException | IllegalArgumentException e) {
      log.debug("signature recovery failed: {}", e.toString());
      return null;
    }
  }
}
