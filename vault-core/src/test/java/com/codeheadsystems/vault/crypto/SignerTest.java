package com.codeheadsystems.vault.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.vault.common.RandomProvider;
import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultException;
import com.codeheadsystems.vault.model.KeyPair;
import com.codeheadsystems.vault.model.KeyType;
import com.codeheadsystems.vault.model.PublicKey;
import com.codeheadsystems.vault.model.Signature;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class SignerTest {

  private static final String SECRET = "4ccd089b28ff96da9db6c346ec114e0f5b8a319f35aba624da8cf6ed4fb8a6fb";
  private static final String SIGNATURE = "92a009a9f0d4cab8720e820b5f642540a2b27b5416503f8fb3762223ebdb69da"
      + "085ac1e43e15996e458f3613d0f11d8c387b2eaeb4302aeeb00d291612bb0c00";
  private static final byte[] MESSAGE = {0x72};

  @Test
  void sign_rfc8032Test2() {
    KeyPair pair = KeyPairs.fromPrivateKey(KeyType.ED25519, Hex.decode(SECRET));
    Signature signature = Signer.sign(pair, MESSAGE);

    assertThat(Hex.toHexString(signature.bytes())).isEqualTo(SIGNATURE);
    assertThat(Signer.verify(pair.publicKey(), MESSAGE, signature)).isTrue();
  }

  @Test
  void verify_rejectsOtherMessageAndBadKeys() {
    KeyPair pair = KeyPairs.fromPrivateKey(KeyType.ED25519, Hex.decode(SECRET));
    Signature signature = Signature.of(Hex.decode(SIGNATURE));

    assertThat(Signer.verify(pair.publicKey(), new byte[]{0x73}, signature)).isFalse();
    assertThat(Signer.verify(PublicKey.of(new byte[5]), MESSAGE, signature)).isFalse();
  }

  @Test
  void sign_agreementKeyIsUnsupported() {
    KeyPair pair = KeyPairs.generate(KeyType.X25519, new RandomProvider());

    assertThatThrownBy(() -> Signer.sign(pair, MESSAGE))
        .isInstanceOfSatisfying(VaultException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.UNSUPPORTED_OPERATION));
  }
}
