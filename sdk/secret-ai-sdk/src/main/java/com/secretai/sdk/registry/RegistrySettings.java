package com.secretai.sdk.registry;

import com.secretai.sdk.config.ConfigSource;
import com.secretai.sdk.config.SdkEnvironment;
import com.secretai.sdk.error.ConfigException;

import java.util.Objects;

/**
 * Where the worker registry contract lives.
 *
 * @param chainId         Secret Network chain id, e.g. {@code pulsar-3}
 * @param nodeUrl         LCD endpoint of a node on that chain
 * @param contractAddress bech32 address of the worker registry contract
 */
public record RegistrySettings(String chainId, String nodeUrl, String contractAddress) {

    public RegistrySettings {
        chainId = require(chainId, SdkEnvironment.CHAIN_ID);
        nodeUrl = require(nodeUrl, SdkEnvironment.NODE_URL);
        contractAddress = require(contractAddress, SdkEnvironment.WORKER_SMART_CONTRACT);
    }

    public static RegistrySettings defaults() {
        return new RegistrySettings(SdkEnvironment.CHAIN_ID_DEFAULT, SdkEnvironment.NODE_URL_DEFAULT,
                SdkEnvironment.WORKER_SMART_CONTRACT_DEFAULT);
    }

    public static RegistrySettings load(ConfigSource source) {
        return load(null, null, source);
    }

    /**
     * Explicit chain id and node URL win over the environment, which wins over the testnet defaults.
     * The contract address comes from the environment or its default.
     */
    public static RegistrySettings load(String chainId, String nodeUrl, ConfigSource source) {
        Objects.requireNonNull(source, "source");
        return new RegistrySettings(
                isBlank(chainId)
                        ? source.get(SdkEnvironment.CHAIN_ID).orElse(SdkEnvironment.CHAIN_ID_DEFAULT)
                        : chainId,
                isBlank(nodeUrl)
                        ? source.get(SdkEnvironment.NODE_URL).orElse(SdkEnvironment.NODE_URL_DEFAULT)
                        : nodeUrl,
                source.get(SdkEnvironment.WORKER_SMART_CONTRACT).orElse(SdkEnvironment.WORKER_SMART_CONTRACT_DEFAULT));
    }

    private static String require(String value, String variable) {
        if (isBlank(value)) {
            throw ConfigException.missingValue(variable);
        }
        return value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
