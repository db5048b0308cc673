package com.mockhttp.core.matching;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory methods for the common {@link Matcher}s.
 */
public final class Matchers {

    private Matchers() {
        // utility class
    }

    /**
     * The decoded query string must equal {@code expected} exactly: same keys, same values, same order per key.
     */
    public static Matcher queryParams(Map<String, List<String>> expected) {
        Map<String, List<String>> copy = new LinkedHashMap<>(expected);
        return (failures, request) -> {
            Map<String, List<String>> actual = request.getQueryParameters();
            if (!copy.equals(actual)) {
                failures.report("query parameters mismatch for %s %s: expected <%s> but was <%s>",
                        request.getMethod(), request.getPath(), copy, actual);
            }
        };
    }

    /**
     * Every expected header must be present with exactly the expected values.
     * Headers the request carries beyond these are ignored.
     */
    public static Matcher headers(Map<String, List<String>> expected) {
        Map<String, List<String>> copy = new LinkedHashMap<>(expected);
        return (failures, request) -> {
            for (Map.Entry<String, List<String>> entry : copy.entrySet()) {
                List<String> actual = request.getHeader(entry.getKey());
                if (!entry.getValue().equals(actual)) {
                    failures.report("header %s mismatch for %s %s: expected <%s> but was <%s>",
                            entry.getKey(), request.getMethod(), request.getPath(), entry.getValue(), actual);
                }
            }
        };
    }

    public static Matcher header(String name, String... values) {
        return headers(Map.of(name, List.of(values)));
    }

    /**
     * The request body must be JSON equal to {@code expectedJson}; key order and whitespace are ignored.
     */
    public static Matcher jsonBody(String expectedJson) {
        JsonNode expected = JsonBodyParser.parseJson(expectedJson);
        return (failures, request) -> {
            if (expected == null) {
                failures.report("expected value is not valid JSON: %s", expectedJson);
                return;
            }
            String body = request.getBodyAsString();
            JsonNode actual = JsonBodyParser.parseJson(body);
            if (actual == null) {
                failures.report("request body for %s %s is not valid JSON: <%s>",
                        request.getMethod(), request.getPath(), body);
                return;
            }
            if (!expected.equals(actual)) {
                failures.report("json body mismatch for %s %s: expected <%s> but was <%s>",
                        request.getMethod(), request.getPath(), expected, actual);
            }
        };
    }
}
