package com.mockhttp.core.server;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.common.ConsoleNotifier;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.mockhttp.core.config.Constants;
import com.mockhttp.core.config.MockHttpConfig;
import com.mockhttp.core.endpoint.Endpoint;
import com.mockhttp.core.endpoint.EndpointKey;
import com.mockhttp.core.reporting.FailureReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Manages the WireMock listener that fronts a mock server: one stub per endpoint routed to the
 * {@link EndpointDispatcher}, plus a lowest-priority catch-all for unmatched routes.
 */
public final class WireMockServerManager {

    private static final Logger logger = LoggerFactory.getLogger(WireMockServerManager.class);

    private WireMockServerManager() {
        // utility class
    }

    /**
     * Binds the listener and registers every endpoint. The endpoints must already be serving.
     *
     * @param port      TCP port, or {@link MockHttpConfig#DYNAMIC_PORT} for any free port
     * @param endpoints endpoints to bind
     * @param failures  channel for unmatched routes and matcher failures
     * @return the started server
     * @throws IllegalStateException if the listener cannot be started
     */
    public static WireMockServer start(int port, List<Endpoint> endpoints, FailureReporter failures) {
        WireMockConfiguration config = WireMockConfiguration.wireMockConfig()
                .bindAddress(MockHttpConfig.getHost())
                .notifier(new ConsoleNotifier(MockHttpConfig.isVerbose()))
                .disableRequestJournal()
                .extensions(new EndpointDispatcher(endpoints, failures));
        if (port == MockHttpConfig.DYNAMIC_PORT) {
            config.dynamicPort();
        } else {
            config.port(port);
        }

        WireMockServer server = new WireMockServer(config);
        try {
            server.start();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to start mock server on port " + port, e);
        }

        for (Endpoint endpoint : endpoints) {
            EndpointKey key = endpoint.key();
            server.stubFor(
                    WireMock.request(key.method().name(), WireMock.urlPathTemplate(key.path()))
                            .atPriority(Constants.ENDPOINT_PRIORITY)
                            .willReturn(WireMock.aResponse()
                                    .withTransformers(Constants.DISPATCHER_NAME)
                                    .withTransformerParameter(Constants.ENDPOINT_PARAMETER, key.toString())));
        }
        server.stubFor(
                WireMock.any(WireMock.anyUrl())
                        .atPriority(Constants.FALLBACK_PRIORITY)
                        .willReturn(WireMock.aResponse().withTransformers(Constants.DISPATCHER_NAME)));

        logger.info("Mock server listening on port {} with {} endpoint(s)", server.port(), endpoints.size());
        return server;
    }

    public static void stop(WireMockServer server) {
        if (server != null && server.isRunning()) {
            int port = server.port();
            server.stop();
            logger.info("Mock server on port {} stopped", port);
        }
    }
}
