package com.mockhttp.core.endpoint;

import com.mockhttp.core.matching.Matcher;
import com.mockhttp.core.matching.MockRequest;
import com.mockhttp.core.reporting.FailureCollector;
import com.mockhttp.core.response.ResponseRecorder;
import com.mockhttp.core.response.Responders;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioTest {

    private static final MockRequest REQUEST = MockRequest.of("GET", "/get", Map.of(), null);

    @Test
    void times_defaultsToOne() {
        assertEquals(1, new Scenario(List.of()).times());
    }

    @Test
    void times_lessThanOne_throws() {
        Scenario scenario = new Scenario(List.of());

        assertThrows(IllegalArgumentException.class, () -> scenario.times(0));
        assertThrows(IllegalArgumentException.class, () -> scenario.times(-3));
    }

    @Test
    void match_runsMatchersInOrderAndCounts() {
        List<String> order = new ArrayList<>();
        Matcher first = (failures, request) -> order.add("first");
        Matcher second = (failures, request) -> order.add("second");
        Scenario scenario = new Scenario(List.of(first, second));

        scenario.match(new FailureCollector(), REQUEST);

        assertEquals(List.of("first", "second"), order);
        assertEquals(1, scenario.timesCalled());
    }

    @Test
    void match_failingMatcher_stillCountedAndRendered() {
        Matcher failing = (failures, request) -> failures.report("mismatch");
        Scenario scenario = new Scenario(List.of(failing)).respond(Responders.statusCode(201));
        FailureCollector failures = new FailureCollector();
        ResponseRecorder recorder = new ResponseRecorder();

        scenario.match(failures, REQUEST);
        scenario.writeTo(recorder);

        assertEquals(List.of("mismatch"), failures.failures());
        assertEquals(1, scenario.timesCalled());
        assertEquals(201, recorder.statusCode());
    }

    @Test
    void writeTo_bodyDeclaredBeforeStatus_keepsStatus() {
        Scenario scenario = new Scenario(List.of())
                .respond(Responders.jsonBody("{\"result\": true}"), Responders.statusCode(201));
        ResponseRecorder target = new ResponseRecorder();

        scenario.writeTo(target);

        assertEquals(201, target.statusCode());
        assertEquals("{\"result\": true}", new String(target.body(), StandardCharsets.UTF_8));
    }

    @Test
    void frozen_setupCallsThrow() {
        Scenario scenario = new Scenario(List.of());
        scenario.freeze();

        assertThrows(IllegalStateException.class, () -> scenario.times(2));
        assertThrows(IllegalStateException.class, () -> scenario.respond(Responders.statusCode(200)));
    }

    @Test
    void match_concurrentCalls_noLostUpdates() throws Exception {
        Scenario scenario = new Scenario(List.of());
        int threads = 8;
        int callsPerThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        scenario.match(new FailureCollector(), REQUEST);
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(threads * callsPerThread, scenario.timesCalled());
    }
}
