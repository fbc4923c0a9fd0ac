package com.codeheadsystems.vault.storage;

import com.codeheadsystems.vault.model.KeyLocation;
import com.codeheadsystems.vault.model.VaultDid;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of {@link Storage#didCreate}.
 *
 * @param did      the new identity
 * @param location the location of its initial Ed25519 key
 */
public record CreatedIdentity(@JsonProperty("did") VaultDid did,
                              @JsonProperty("location") KeyLocation location) {
}
