package com.codeheadsystems.vault.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How the content-encryption key (CEK) of an {@link EncryptedData} envelope is established.
 * Both cases run an X25519 agreement between a fresh ephemeral key and the recipient's static
 * key, then feed the shared secret through Concat-KDF with the case's {@link AgreementInfo}.
 * The algorithm name is the KDF's algorithm identifier.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "alg")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CekAlgorithm.EcdhEs.class, name = CekAlgorithm.ECDH_ES),
    @JsonSubTypes.Type(value = CekAlgorithm.EcdhEsA256Kw.class, name = CekAlgorithm.ECDH_ES_A256KW)
})
public sealed interface CekAlgorithm permits CekAlgorithm.EcdhEs, CekAlgorithm.EcdhEsA256Kw {

  String ECDH_ES = "ECDH-ES";
  String ECDH_ES_A256KW = "ECDH-ES+A256KW";

  @JsonIgnore
  String name();

  /**
   * Which of the two key establishment schemes this is.
   *
   * @return the mode
   */
  @JsonIgnore
  Mode mode();

  AgreementInfo agreement();

  /**
   * Direct agreement: the derived secret is the CEK.
   *
   * @param agreement the KDF context
   */
  record EcdhEs(@JsonProperty("agreement") AgreementInfo agreement) implements CekAlgorithm {

    @Override
    public String name() {
      return ECDH_ES;
    }

    @Override
    public Mode mode() {
      return Mode.DIRECT;
    }
  }

  /**
   * Agreement plus AES-256 key wrap: a random CEK is wrapped under the derived secret.
   *
   * @param agreement the KDF context
   */
  record EcdhEsA256Kw(@JsonProperty("agreement") AgreementInfo agreement) implements CekAlgorithm {

    @Override
    public String name() {
      return ECDH_ES_A256KW;
    }

    @Override
    public Mode mode() {
      return Mode.KEY_WRAP;
    }
  }

  /**
   * Key establishment schemes.
   */
  enum Mode {
    /**
     * The Concat-KDF output is the CEK.
     */
    DIRECT,
    /**
     * The Concat-KDF output wraps a random CEK.
     */
    KEY_WRAP
  }
}
