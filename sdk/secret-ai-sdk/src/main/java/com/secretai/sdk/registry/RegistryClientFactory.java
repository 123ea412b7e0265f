package com.secretai.sdk.registry;

/**
 * Creates the chain client once per registry.
 */
@FunctionalInterface
public interface RegistryClientFactory {

    RegistryClient create(String chainId, String nodeUrl);
}
