package com.mockhttp.core.endpoint;

import com.mockhttp.core.reporting.FailureCollector;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EndpointRegistryTest {

    @Test
    void register_sameMethodAndPath_mergesScenarios() {
        EndpointRegistry registry = new EndpointRegistry();
        EndpointKey key = new EndpointKey(HttpMethod.GET, "/isbn");

        Scenario first = registry.register(key, new Scenario(List.of()));
        Scenario second = registry.register(key, new Scenario(List.of()));

        assertEquals(1, registry.endpoints().size());
        assertEquals(List.of(first, second), registry.find(key).orElseThrow().scenarios());
    }

    @Test
    void register_differentMethod_separateEndpoints() {
        EndpointRegistry registry = new EndpointRegistry();

        registry.register(new EndpointKey(HttpMethod.GET, "/item"), new Scenario(List.of()));
        registry.register(new EndpointKey(HttpMethod.POST, "/item"), new Scenario(List.of()));

        assertEquals(2, registry.endpoints().size());
    }

    @Test
    void register_afterStart_throws() {
        EndpointRegistry registry = new EndpointRegistry();
        registry.register(new EndpointKey(HttpMethod.GET, "/item"), new Scenario(List.of()));
        registry.start();

        assertThrows(IllegalStateException.class,
                () -> registry.register(new EndpointKey(HttpMethod.GET, "/other"), new Scenario(List.of())));
        assertTrue(registry.isStarted());
    }

    @Test
    void start_twice_throws() {
        EndpointRegistry registry = new EndpointRegistry();
        registry.start();

        assertThrows(IllegalStateException.class, registry::start);
    }

    @Test
    void verify_reportsEveryEndpoint() {
        EndpointRegistry registry = new EndpointRegistry();
        registry.register(new EndpointKey(HttpMethod.GET, "/a"), new Scenario(List.of()));
        registry.register(new EndpointKey(HttpMethod.DELETE, "/b"), new Scenario(List.of()));
        registry.start();
        FailureCollector failures = new FailureCollector();

        registry.verify(failures);

        assertEquals(List.of(
                "expected endpoint was not called: GET /a",
                "expected endpoint was not called: DELETE /b"), failures.failures());
    }

    @Test
    void endpointKey_invalidPath_throws() {
        assertThrows(IllegalArgumentException.class, () -> new EndpointKey(HttpMethod.GET, "no-slash"));
    }
}
