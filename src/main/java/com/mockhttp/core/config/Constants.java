package com.mockhttp.core.config;

/**
 * Constants used throughout MockHttp.
 */
public final class Constants {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String APPLICATION_JSON = "application/json";

    public static final String DISPATCHER_NAME = "mockhttp-dispatcher";
    public static final String ENDPOINT_PARAMETER = "endpoint";

    public static final int ENDPOINT_PRIORITY = 1;
    public static final int FALLBACK_PRIORITY = 100;

    public static final String LOCALHOST = "localhost";

    private Constants() {
        // utility class
    }
}
