package com.mockhttp.core.endpoint;

import com.mockhttp.core.reporting.FailureReporter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Endpoints of one mock server, keyed by method and path in registration order.
 * Registering a method + path that already exists adds the scenario to the existing endpoint.
 */
public class EndpointRegistry {

    private final Map<EndpointKey, Endpoint> endpoints = new LinkedHashMap<>();
    private boolean frozen;

    public synchronized Scenario register(EndpointKey key, Scenario scenario) {
        if (frozen) {
            throw new IllegalStateException("Cannot register " + key + ": the mock server has already started");
        }
        return endpoints.computeIfAbsent(key, Endpoint::new).addScenario(scenario);
    }

    public synchronized Optional<Endpoint> find(EndpointKey key) {
        return Optional.ofNullable(endpoints.get(key));
    }

    public synchronized List<Endpoint> endpoints() {
        return new ArrayList<>(endpoints.values());
    }

    /**
     * Stops registration and moves every endpoint to serving.
     */
    public synchronized void start() {
        if (frozen) {
            throw new IllegalStateException("Endpoints have already been started");
        }
        frozen = true;
        for (Endpoint endpoint : endpoints.values()) {
            endpoint.start();
        }
    }

    public synchronized boolean isStarted() {
        return frozen;
    }

    public void verify(FailureReporter failures) {
        for (Endpoint endpoint : endpoints()) {
            endpoint.verify(failures);
        }
    }
}
