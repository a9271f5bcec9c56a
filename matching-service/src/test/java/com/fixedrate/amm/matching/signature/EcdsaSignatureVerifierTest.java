package com.fixedrate.amm.matching.signature;

import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class EcdsaSignatureVerifierTest {

  private static final ECKeyPair KEY = ECKeyPair.create(new BigInteger("a11ce", 16));
  private static final ECKeyPair OTHER_KEY = ECKeyPair.create(new BigInteger("b0b", 16));
  private static final byte[] DIGEST = Hash.sha3("order".getBytes(StandardCharsets.UTF_8));

  private final EcdsaSignatureVerifier verifier = new EcdsaSignatureVerifier();

  static String sign(byte[] digest, ECKeyPair key) {
    Sign.SignatureData data = Sign.signMessage(digest, key, false);
    byte[] raw = new byte[65];
    System.arraycopy(data.getR(), 0, raw, 0, 32);
    System.arraycopy(data.getS(), 0, raw, 32, 32);
    raw[64] = data.getV()[0];
    return Numeric.toHexString(raw);
  }

  @Test
  void shouldAcceptSignatureFromSigner() {
    String signer = Credentials.create(KEY).getAddress();

    assertThat(verifier.verify(DIGEST, sign(DIGEST, KEY), signer)).isTrue();
    assertThat(verifier.verify(DIGEST, sign(DIGEST, KEY), "0x" + signer.substring(2).toUpperCase(Locale.ROOT))).isTrue();
  }

  @Test
  void shouldAcceptZeroBasedRecoveryId() {
    byte[] raw = Numeric.hexStringToByteArray(sign(DIGEST, KEY));
    raw[64] -= 27;

    assertThat(verifier.verify(DIGEST, Numeric.toHexString(raw), Credentials.create(KEY).getAddress())).isTrue();
  }

  @Test
  void shouldRejectSignatureFromAnotherKey() {
    assertThat(verifier.verify(DIGEST, sign(DIGEST, OTHER_KEY), Credentials.create(KEY).getAddress())).isFalse();
  }

  @Test
  void shouldRejectSignatureOverAnotherDigest() {
    byte[] otherDigest = Hash.sha3("other order".getBytes(StandardCharsets.UTF_8));

    assertThat(verifier.verify(otherDigest, sign(DIGEST, KEY), Credentials.create(KEY).getAddress())).isFalse();
  }

  @Test
  void shouldRejectMalformedSignatures() {
    String signer = Credentials.create(KEY).getAddress();
    byte[] badRecoveryId = Numeric.hexStringToByteArray(sign(DIGEST, KEY));
    badRecoveryId[64] = 30;

    assertThat(verifier.verify(DIGEST, null, signer)).isFalse();
    assertThat(verifier.verify(DIGEST, "0x1234", signer)).isFalse();
    assertThat(verifier.verify(DIGEST, Numeric.toHexString(badRecoveryId), signer)).isFalse();
  }
}
