package com.secretai.sdk.registry;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Read-only access to a CosmWasm contract on Secret Network. Implementations encrypt the
 * query for the contract, send it to the LCD node and return the decrypted answer; they
 * raise their native failures, which {@link SecretRegistry} translates.
 */
public interface RegistryClient extends AutoCloseable {

    JsonNode contractQuery(String contractAddress, JsonNode query);

    @Override
    default void close() {
    }
}
