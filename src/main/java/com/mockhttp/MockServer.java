package com.mockhttp;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.mockhttp.core.config.MockHttpConfig;
import com.mockhttp.core.endpoint.Endpoint;
import com.mockhttp.core.endpoint.EndpointKey;
import com.mockhttp.core.endpoint.EndpointRegistry;
import com.mockhttp.core.endpoint.HttpMethod;
import com.mockhttp.core.endpoint.Scenario;
import com.mockhttp.core.matching.Matcher;
import com.mockhttp.core.reporting.FailureCollector;
import com.mockhttp.core.reporting.FailureReporter;
import com.mockhttp.core.server.WireMockServerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP test server for mocking REST APIs.
 * <p>
 * Declare every endpoint before {@link #start()}; each registration returns a {@link Scenario}
 * to configure with {@code times(n)} and {@code respond(...)}. Registering the same method and
 * path again adds another scenario to that endpoint, served after the previous ones.
 * <pre>{@code
 * MockServer server = new MockServer();
 * server.get("/isbn").times(2).respond(statusCode(403));
 * server.get("/isbn").respond(statusCode(200));
 * server.start();
 * ...
 * server.close(); // stops the listener, verifies call counts, fails on any violation
 * }</pre>
 */
public class MockServer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MockServer.class);

    private final int configuredPort;
    private final EndpointRegistry registry = new EndpointRegistry();
    private final FailureCollector collector = new FailureCollector();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile FailureReporter failures = collector;
    private volatile WireMockServer server;

    public MockServer() {
        this(MockHttpConfig.getPort());
    }

    /**
     * @param port static TCP port to listen on, or 0 for any free port
     */
    public MockServer(int port) {
        if (port < 0) {
            throw new IllegalArgumentException("port must be >= 0, got " + port);
        }
        this.configuredPort = port;
    }

    public Scenario get(String path, Matcher... matchers) {
        return register(HttpMethod.GET, path, matchers);
    }

    public Scenario post(String path, Matcher... matchers) {
        return register(HttpMethod.POST, path, matchers);
    }

    public Scenario put(String path, Matcher... matchers) {
        return register(HttpMethod.PUT, path, matchers);
    }

    public Scenario patch(String path, Matcher... matchers) {
        return register(HttpMethod.PATCH, path, matchers);
    }

    public Scenario delete(String path, Matcher... matchers) {
        return register(HttpMethod.DELETE, path, matchers);
    }

    public Scenario head(String path, Matcher... matchers) {
        return register(HttpMethod.HEAD, path, matchers);
    }

    public Scenario options(String path, Matcher... matchers) {
        return register(HttpMethod.OPTIONS, path, matchers);
    }

    public Scenario register(HttpMethod method, String path, Matcher... matchers) {
        return registry.register(new EndpointKey(method, path), new Scenario(List.of(matchers)));
    }

    /**
     * Starts the listener, reporting failures to this server's own {@link #failures()} collector.
     */
    public void start() {
        start(collector);
    }

    /**
     * Starts the listener. All endpoints must be declared before this call.
     *
     * @param failures channel for matcher failures, unmatched routes and verification results
     * @throws IllegalStateException if the server was already started or the port cannot be bound
     */
    public synchronized void start(FailureReporter failures) {
        if (server != null || stopped.get()) {
            throw new IllegalStateException("Mock server has already been started");
        }
        this.failures = failures;
        registry.start();
        server = WireMockServerManager.start(configuredPort, registry.endpoints(), failures);
    }

    public boolean isRunning() {
        WireMockServer current = server;
        return current != null && current.isRunning();
    }

    public int port() {
        if (configuredPort > 0) {
            return configuredPort;
        }
        WireMockServer current = server;
        return current == null ? 0 : current.port();
    }

    public String url() {
        return "http://" + MockHttpConfig.getHost() + ":" + port();
    }

    /**
     * Exposes the underlying WireMock server for configuration the helpers do not cover.
     */
    public WireMockServer wireMock() {
        return server;
    }

    public FailureCollector failures() {
        return collector;
    }

    /**
     * Stops the listener. Calling it more than once has no effect.
     */
    public void teardown() {
        if (stopped.compareAndSet(false, true)) {
            WireMockServerManager.stop(server);
        }
    }

    /**
     * Stops accepting requests, then reports every scenario whose call count differs from
     * its expected count.
     */
    public void assertExpectations() {
        teardown();
        registry.verify(failures);
    }

    public void assertNotCalled(HttpMethod method, String path) {
        EndpointKey key = new EndpointKey(method, path);
        Optional<Endpoint> endpoint = registry.find(key);
        if (endpoint.isEmpty()) {
            failures.report("unknown endpoint: %s", key);
            return;
        }
        long called = endpoint.get().timesCalled();
        if (called > 0) {
            failures.report("endpoint was called when not expected: %s (%d times)", key, called);
        }
    }

    public long timesCalled(HttpMethod method, String path) {
        return registry.find(new EndpointKey(method, path))
                .map(Endpoint::timesCalled)
                .orElse(0L);
    }

    /**
     * Verifies call counts, stops the listener and fails with every violation collected by
     * {@link #failures()}.
     */
    @Override
    public void close() {
        assertExpectations();
        if (collector.failed()) {
            logger.info("Mock server on port {} finished with {} failure(s)", port(), collector.failures().size());
        }
        collector.assertNoFailures();
    }

    @Override
    public String toString() {
        return "MockServer{" +
                "port=" + port() +
                ", endpoints=" + registry.endpoints().size() +
                '}';
    }
}
