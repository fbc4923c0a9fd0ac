package com.codeheadsystems.vault.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultException;
import com.codeheadsystems.vault.exceptions.VaultValidationException;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class Aes256GcmTest {

  private static final byte[] ZERO_KEY = new byte[32];
  private static final byte[] ZERO_NONCE = new byte[12];

  // ─── McGrew-Viega GCM test cases 13 and 14 ────────────────────────────────

  @Test
  void encrypt_emptyPlaintext() {
    Aes256Gcm.Sealed sealed = Aes256Gcm.encrypt(ZERO_KEY, ZERO_NONCE, new byte[0], new byte[0]);

    assertThat(sealed.ciphertext()).isEmpty();
    assertThat(Hex.toHexString(sealed.tag())).isEqualTo("530f8afbc74536b9a963b4f1c4cb738b");
  }

  @Test
  void encrypt_singleZeroBlock() {
    Aes256Gcm.Sealed sealed = Aes256Gcm.encrypt(ZERO_KEY, ZERO_NONCE, new byte[0], new byte[16]);

    assertThat(Hex.toHexString(sealed.ciphertext())).isEqualTo("cea7403d4d606b6e074ec5d3baf39d18");
    assertThat(Hex.toHexString(sealed.tag())).isEqualTo("d0d1c8a799996bf0265b98b5d48ab919");
    assertThat(Aes256Gcm.decrypt(ZERO_KEY, ZERO_NONCE, new byte[0], sealed.ciphertext(), sealed.tag()))
        .isEqualTo(new byte[16]);
  }

  // ─── Authentication ───────────────────────────────────────────────────────

  @Test
  void decrypt_returnsExactPlaintextLength() {
    byte[] plaintext = "seventeen bytes!!".getBytes(StandardCharsets.UTF_8);
    byte[] ad = "ad".getBytes(StandardCharsets.UTF_8);
    Aes256Gcm.Sealed sealed = Aes256Gcm.encrypt(ZERO_KEY, ZERO_NONCE, ad, plaintext);

    assertThat(sealed.ciphertext()).hasSameSizeAs(plaintext);
    assertThat(Aes256Gcm.decrypt(ZERO_KEY, ZERO_NONCE, ad, sealed.ciphertext(), sealed.tag()))
        .isEqualTo(plaintext);
  }

  @Test
  void decrypt_tamperedCiphertextFails() {
    Aes256Gcm.Sealed sealed = Aes256Gcm.encrypt(ZERO_KEY, ZERO_NONCE, new byte[0], new byte[16]);
    byte[] tampered = sealed.ciphertext().clone();
    tampered[0] ^= 1;

    assertThatThrownBy(() -> Aes256Gcm.decrypt(ZERO_KEY, ZERO_NONCE, new byte[0], tampered, sealed.tag()))
        .isInstanceOfSatisfying(VaultException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.DECRYPTION_FAILURE));
  }

  @Test
  void decrypt_wrongAssociatedDataFails() {
    Aes256Gcm.Sealed sealed = Aes256Gcm.encrypt(ZERO_KEY, ZERO_NONCE, new byte[]{1}, new byte[16]);

    assertThatThrownBy(() -> Aes256Gcm.decrypt(ZERO_KEY, ZERO_NONCE, new byte[]{2}, sealed.ciphertext(),
        sealed.tag()))
        .isInstanceOf(VaultException.class);
  }

  // ─── Validation ───────────────────────────────────────────────────────────

  @Test
  void badLengthsAreValidationFailures() {
    assertThatThrownBy(() -> Aes256Gcm.encrypt(new byte[16], ZERO_NONCE, new byte[0], new byte[0]))
        .isInstanceOfSatisfying(VaultValidationException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.ENCRYPTION_FAILURE));
    assertThatThrownBy(() -> Aes256Gcm.decrypt(ZERO_KEY, new byte[8], new byte[0], new byte[0], new byte[16]))
        .isInstanceOfSatisfying(VaultValidationException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.DECRYPTION_FAILURE));
    assertThatThrownBy(() -> Aes256Gcm.decrypt(ZERO_KEY, ZERO_NONCE, new byte[0], new byte[0], new byte[15]))
        .isInstanceOf(VaultValidationException.class);
  }
}
