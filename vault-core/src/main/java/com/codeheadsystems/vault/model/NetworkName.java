package com.codeheadsystems.vault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.regex.Pattern;

/**
 * Network tag scoping an identity identifier: one to six lowercase alphanumeric characters.
 *
 * @param name the network name
 */
public record NetworkName(@JsonValue String name) {

  private static final Pattern VALID = Pattern.compile("[a-z0-9]{1,6}");

  /**
   * The main network. Identifiers on it omit the network segment.
   */
  public static final NetworkName MAINNET = new NetworkName("main");
  /**
   * The development network.
   */
  public static final NetworkName DEVNET = new NetworkName("dev");

  public NetworkName {
    if (name == null || !VALID.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid network name: " + name);
    }
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static NetworkName of(String name) {
    return new NetworkName(name);
  }

  public boolean isMainnet() {
    return MAINNET.equals(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
