package com.codeheadsystems.vault.exceptions;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VaultExceptionTest {

  @Test
  void carriesKindMessageAndCause() {
    IllegalStateException cause = new IllegalStateException("boom");
    VaultException e = new VaultException(ErrorKind.DECRYPTION_FAILURE, "tag mismatch", cause);

    assertThat(e.kind()).isEqualTo(ErrorKind.DECRYPTION_FAILURE);
    assertThat(e).hasMessage("tag mismatch").hasCause(cause);
    assertThat(e).hasToString("VaultException[DECRYPTION_FAILURE]: tag mismatch");
  }

  @Test
  void validationExceptionIsAVaultException() {
    VaultException e = new VaultValidationException(ErrorKind.INVALID_PRIVATE_KEY, "short key");

    assertThat(e).isInstanceOf(VaultValidationException.class);
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_PRIVATE_KEY);
    assertThat(e.getCause()).isNull();
    assertThat(e.toString()).startsWith("VaultValidationException[INVALID_PRIVATE_KEY]");
  }
}
