package com.passage.proxy.config;

import com.passage.proxy.core.exceptions.ConfigException;
import java.util.function.Function;

/**
 * Applies environment variable overrides on top of the YAML configuration.
 * <p>
 * A variable counts as set when it is defined and non-blank after trimming.
 * Recognised variables:
 * <ul>
 * <li>{@code PORT}: inbound listen port</li>
 * <li>{@code SILENT_PROXY_LOGS}: any value silences per-request logging</li>
 * </ul>
 */
public final class EnvironmentOverrides {

    public static final String PORT = "PORT";
    public static final String SILENT_PROXY_LOGS = "SILENT_PROXY_LOGS";

    private EnvironmentOverrides() {
        // Utility class
    }

    /**
     * Overlays values from the supplied lookup onto the given properties.
     *
     * @param properties The loaded configuration.
     * @param envLookup  Maps variable names to values (null when undefined).
     * @throws ConfigException if {@code PORT} is not a number.
     */
    public static void apply(PassageProperties properties, Function<String, String> envLookup) {
        if (isSet(envLookup, PORT)) {
            String raw = envLookup.apply(PORT).trim();
            try {
                properties.getServer().setPort(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigException("PORT is not a number: " + raw, e);
            }
        }
        if (isSet(envLookup, SILENT_PROXY_LOGS)) {
            properties.getLogging().setSilent(true);
        }
    }

    private static boolean isSet(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(name);
        return value != null && !value.trim().isEmpty();
    }
}
