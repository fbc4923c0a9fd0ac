package com.codeheadsystems.vault.model;

import com.codeheadsystems.vault.common.ByteUtils;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;

/**
 * Result of one encryption. Self-contained: decryption needs only this envelope, the
 * algorithm identifiers and the recipient's static private key.
 *
 * @param nonce              the AEAD nonce
 * @param associatedData     the authenticated, unencrypted associated data
 * @param tag                the AEAD authentication tag
 * @param ciphertext         the ciphertext
 * @param encryptedCek       the wrapped content-encryption key; empty for direct agreement
 * @param ephemeralPublicKey the sender's ephemeral X25519 public key
 */
public record EncryptedData(
    @JsonProperty("nonce") byte[] nonce,
    @JsonProperty("associatedData") byte[] associatedData,
    @JsonProperty("tag") byte[] tag,
    @JsonProperty("ciphertext") byte[] ciphertext,
    @JsonProperty("encryptedCek") byte[] encryptedCek,
    @JsonProperty("ephemeralPublicKey") byte[] ephemeralPublicKey) {

  public EncryptedData {
    nonce = ByteUtils.copyOrEmpty(nonce);
    associatedData = ByteUtils.copyOrEmpty(associatedData);
    tag = ByteUtils.copyOrEmpty(tag);
    ciphertext = ByteUtils.copyOrEmpty(ciphertext);
    encryptedCek = ByteUtils.copyOrEmpty(encryptedCek);
    ephemeralPublicKey = ByteUtils.copyOrEmpty(ephemeralPublicKey);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EncryptedData other
        && Arrays.equals(nonce, other.nonce)
        && Arrays.equals(associatedData, other.associatedData)
        && Arrays.equals(tag, other.tag)
        && Arrays.equals(ciphertext, other.ciphertext)
        && Arrays.equals(encryptedCek, other.encryptedCek)
        && Arrays.equals(ephemeralPublicKey, other.ephemeralPublicKey);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(nonce);
    result = 31 * result + Arrays.hashCode(associatedData);
    result = 31 * result + Arrays.hashCode(tag);
    result = 31 * result + Arrays.hashCode(ciphertext);
    result = 31 * result + Arrays.hashCode(encryptedCek);
    return 31 * result + Arrays.hashCode(ephemeralPublicKey);
  }

  @Override
  public String toString() {
    return "EncryptedData[nonce=" + nonce.length + "B, associatedData=" + associatedData.length
        + "B, tag=" + tag.length + "B, ciphertext=" + ciphertext.length + "B, encryptedCek="
        + encryptedCek.length + "B, ephemeralPublicKey=" + ephemeralPublicKey.length + "B]";
  }
}
