package com.codeheadsystems.vault.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class KeyLocationTest {

  private static final byte[] PUBLIC_KEY =
      Hex.decode("3d4017c3e843895a92b70aa74d1b7ebc9c982ccf2ec4968cc0cd55f12af4660c");

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void of_isDeterministic() {
    KeyLocation a = KeyLocation.of(KeyType.ED25519, "sign-0", PUBLIC_KEY);
    KeyLocation b = KeyLocation.of(KeyType.ED25519, "sign-0", PUBLIC_KEY.clone());

    assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    assertThat(a.keyHash()).hasSize(16).matches("[0-9a-f]{16}");
    assertThat(a.canonical()).isEqualTo("sign-0:" + a.keyHash());
    assertThat(a).hasToString("(sign-0:" + a.keyHash() + ":ED25519)");
  }

  @Test
  void of_distinguishesTypeFragmentAndKey() {
    KeyLocation base = KeyLocation.of(KeyType.ED25519, "key", PUBLIC_KEY);
    byte[] otherKey = PUBLIC_KEY.clone();
    otherKey[0] ^= 1;

    assertThat(KeyLocation.of(KeyType.X25519, "key", PUBLIC_KEY)).isNotEqualTo(base);
    assertThat(KeyLocation.of(KeyType.ED25519, "other", PUBLIC_KEY)).isNotEqualTo(base);
    assertThat(KeyLocation.of(KeyType.ED25519, "key", otherKey).keyHash()).isNotEqualTo(base.keyHash());
  }

  @Test
  void of_rejectsMissingInput() {
    assertThatThrownBy(() -> KeyLocation.of(KeyType.ED25519, "key", new byte[0]))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> KeyLocation.of(KeyType.ED25519, " ", PUBLIC_KEY))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> KeyLocation.of(null, "key", PUBLIC_KEY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void requireFragment_blankIsTypedValidationFailure() {
    assertThat(KeyLocation.requireFragment("kex-0")).isEqualTo("kex-0");
    for (String fragment : new String[]{null, "", " \t"}) {
      assertThatThrownBy(() -> KeyLocation.requireFragment(fragment))
          .isInstanceOfSatisfying(VaultValidationException.class,
              e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_KEY_LOCATION));
    }
  }

  @Test
  void json_roundTrip() throws Exception {
    KeyLocation location = KeyLocation.of(KeyType.X25519, "kex-0", PUBLIC_KEY);
    String json = mapper.writeValueAsString(location);

    assertThat(json).contains("\"keyType\":\"X25519\"", "\"fragment\":\"kex-0\"",
        "\"keyHash\":\"" + location.keyHash() + "\"");
    assertThat(mapper.readValue(json, KeyLocation.class)).isEqualTo(location);
  }

  @Test
  void json_rejectsMalformedHash() {
    String json = "{\"keyType\":\"ED25519\",\"fragment\":\"k\",\"keyHash\":\"XYZ\"}";
    assertThatThrownBy(() -> mapper.readValue(json, KeyLocation.class))
        .hasRootCauseInstanceOf(IllegalArgumentException.class);
  }
}
