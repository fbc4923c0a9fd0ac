package com.codeheadsystems.vault.model;

import com.codeheadsystems.vault.common.ByteUtils;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;

/**
 * Context bytes bound into the Concat-KDF output so that a shared secret derived for one
 * pair of parties and purpose cannot be reused for another. Null components become empty.
 *
 * @param apu      sender ("party U") information, length-prefixed in the KDF input
 * @param apv      receiver ("party V") information, length-prefixed in the KDF input
 * @param pubInfo  supplemental public information, appended unprefixed
 * @param privInfo supplemental private information, appended unprefixed
 */
public record AgreementInfo(
    @JsonProperty("apu") byte[] apu,
    @JsonProperty("apv") byte[] apv,
    @JsonProperty("pubInfo") byte[] pubInfo,
    @JsonProperty("privInfo") byte[] privInfo) {

  public AgreementInfo {
    apu = ByteUtils.copyOrEmpty(apu);
    apv = ByteUtils.copyOrEmpty(apv);
    pubInfo = ByteUtils.copyOrEmpty(pubInfo);
    privInfo = ByteUtils.copyOrEmpty(privInfo);
  }

  /**
   * Sender and receiver information with no supplemental information.
   *
   * @param apu the sender information
   * @param apv the receiver information
   * @return the agreement info
   */
  public static AgreementInfo of(byte[] apu, byte[] apv) {
    return new AgreementInfo(apu, apv, null, null);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AgreementInfo other
        && Arrays.equals(apu, other.apu)
        && Arrays.equals(apv, other.apv)
        && Arrays.equals(pubInfo, other.pubInfo)
        && Arrays.equals(privInfo, other.privInfo);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(apu);
    result = 31 * result + Arrays.hashCode(apv);
    result = 31 * result + Arrays.hashCode(pubInfo);
    return 31 * result + Arrays.hashCode(privInfo);
  }

  @Override
  public String toString() {
    return "AgreementInfo[apu=" + apu.length + "B, apv=" + apv.length + "B, pubInfo="
        + pubInfo.length + "B, privInfo=" + privInfo.length + "B]";
  }
}
