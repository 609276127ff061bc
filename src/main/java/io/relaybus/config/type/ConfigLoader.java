package io.relaybus.config.type;

import io.relaybus.config.impl.BusConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads bus configuration from a YAML file by delegating to {@link BusConfig#load(String)}.
     *
     * @param path the path to the bus YAML configuration file
     * @return a populated {@link BusConfig}, defaults filled in for missing keys
     * @throws IOException        if the file cannot be read
     * @throws ClassCastException if the YAML structure does not match the expected format
     */
    public static BusConfig load(final String path) throws IOException {
        return BusConfig.load(path);
    }
}
