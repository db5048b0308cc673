package com.mockhttp.core.config;

/**
 * Configuration properties and utilities for MockHttp.
 */
public final class MockHttpConfig {

    public static final String PORT_PROPERTY = "mockhttp.port";
    public static final String HOST_PROPERTY = "mockhttp.host";
    public static final String VERBOSE_PROPERTY = "mockhttp.verbose";

    public static final int DYNAMIC_PORT = 0;

    private MockHttpConfig() {
        // utility class
    }

    /**
     * @return the configured port, or {@link #DYNAMIC_PORT} to let the listener pick one
     */
    public static int getPort() {
        String value = System.getProperty(PORT_PROPERTY);
        if (value == null || value.isBlank()) {
            return DYNAMIC_PORT;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PORT_PROPERTY + ": " + value, e);
        }
    }

    public static String getHost() {
        return System.getProperty(HOST_PROPERTY, Constants.LOCALHOST);
    }

    public static boolean isVerbose() {
        return Boolean.parseBoolean(System.getProperty(VERBOSE_PROPERTY, "false"));
    }
}
