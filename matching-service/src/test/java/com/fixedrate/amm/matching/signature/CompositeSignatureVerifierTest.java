package com.fixedrate.amm.matching.signature;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompositeSignatureVerifierTest {

  private static final String WALLET = "0x000000000000000000000000000000000000c0de";
  private static final byte[] DIGEST = new byte[32];

  @Mock
  private AccountCodeInspector accounts;
  @Mock
  private ContractSignatureValidator validator;

  @Test
  void shouldAskContractAccountsToValidate() {
    // Given
    when(accounts.isContract(WALLET)).thenReturn(true);
    when(validator.isValidSignature(eq(WALLET), eq(DIGEST), any())).thenReturn(true);
    CompositeSignatureVerifier verifier = new CompositeSignatureVerifier(accounts, new EcdsaSignatureVerifier(),
        new ContractSignatureVerifier(validator));

    // When
    boolean valid = verifier.verify(DIGEST, "0xdeadbeef", WALLET);

    // Then
    assertThat(valid).isTrue();
  }

  @Test
  void shouldRecoverKeysForExternallyOwnedAccounts() {
    // Given
    when(accounts.isContract(WALLET)).thenReturn(false);
    CompositeSignatureVerifier verifier = new CompositeSignatureVerifier(accounts, new EcdsaSignatureVerifier(),
        new ContractSignatureVerifier(validator));

    // When
    boolean valid = verifier.verify(DIGEST, "0xdeadbeef", WALLET);

    // Then
    assertThat(valid).isFalse();
    verify(validator, never()).isValidSignature(any(), any(), any());
  }

  @Test
  void shouldTreatEveryoneAsKeyHolderWithoutNode() {
    assertThat(AccountCodeInspector.externallyOwnedOnly().isContract(WALLET)).isFalse();
  }
}
