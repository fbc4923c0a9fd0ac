package com.codeheadsystems.vault.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.vault.common.ByteUtils;
import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class VaultDidTest {

  private static final byte[] PUBLIC_KEY =
      Hex.decode("3d4017c3e843895a92b70aa74d1b7ebc9c982ccf2ec4968cc0cd55f12af4660c");

  private static String expectedTag() {
    Blake2bDigest digest = new Blake2bDigest(256);
    digest.update(PUBLIC_KEY, 0, PUBLIC_KEY.length);
    byte[] hash = new byte[32];
    digest.doFinal(hash, 0);
    return ByteUtils.base58(hash);
  }

  @Test
  void derive_mainnetOmitsNetworkSegment() {
    VaultDid did = VaultDid.derive(DidType.IOTA_DID, PUBLIC_KEY, NetworkName.MAINNET);

    assertThat(did.value()).isEqualTo("did:iota:" + expectedTag());
    assertThat(did.network()).isEqualTo(NetworkName.MAINNET);
    assertThat(did.tag()).isEqualTo(expectedTag());
  }

  @Test
  void derive_otherNetworksKeepSegment() {
    VaultDid did = VaultDid.derive(DidType.IOTA_DID, PUBLIC_KEY, NetworkName.DEVNET);

    assertThat(did.value()).isEqualTo("did:iota:dev:" + expectedTag());
    assertThat(did.network()).isEqualTo(NetworkName.DEVNET);
    assertThat(did).hasToString(did.value());
  }

  @Test
  void derive_isDeterministicPerKey() {
    byte[] other = PUBLIC_KEY.clone();
    other[31] ^= 1;

    assertThat(VaultDid.derive(DidType.IOTA_DID, PUBLIC_KEY, NetworkName.DEVNET))
        .isEqualTo(VaultDid.derive(DidType.IOTA_DID, PUBLIC_KEY.clone(), NetworkName.DEVNET))
        .isNotEqualTo(VaultDid.derive(DidType.IOTA_DID, other, NetworkName.DEVNET));
  }

  @Test
  void derive_emptyKeyIsInvalidPublicKey() {
    assertThatThrownBy(() -> VaultDid.derive(DidType.IOTA_DID, new byte[0], NetworkName.MAINNET))
        .isInstanceOfSatisfying(VaultValidationException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_PUBLIC_KEY));
  }

  @Test
  void parse_acceptsDerivedForms() {
    VaultDid did = VaultDid.derive(DidType.IOTA_DID, PUBLIC_KEY, NetworkName.of("test"));
    assertThat(VaultDid.parse(did.value())).isEqualTo(did);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "did:web:abc", "did:iota:", "did:iota:a:b:c", "did:iota:dev:0OIl",
      "did:iota:TOOLONGNET:abc"})
  void parse_rejectsMalformed(String value) {
    assertThatThrownBy(() -> VaultDid.parse(value)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void json_isThePlainString() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    VaultDid did = VaultDid.derive(DidType.IOTA_DID, PUBLIC_KEY, NetworkName.DEVNET);
    String json = mapper.writeValueAsString(did);

    assertThat(json).isEqualTo("\"" + did.value() + "\"");
    assertThat(mapper.readValue(json, VaultDid.class)).isEqualTo(did);
  }
}
