package com.mockhttp.core.matching;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of a live request handed to {@link Matcher}s.
 * Header names are case-insensitive; query parameters are decoded.
 */
public class MockRequest {

    private final String method;
    private final String path;
    private final Map<String, List<String>> queryParameters;
    private final Map<String, List<String>> headers;
    private final byte[] body;

    public MockRequest(String method,
                       String path,
                       Map<String, List<String>> queryParameters,
                       Map<String, List<String>> headers,
                       byte[] body) {
        this.method = method;
        this.path = path;
        this.queryParameters = Collections.unmodifiableMap(new LinkedHashMap<>(queryParameters));
        Map<String, List<String>> headerCopy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headerCopy.putAll(headers);
        this.headers = Collections.unmodifiableMap(headerCopy);
        this.body = body == null ? new byte[0] : body.clone();
    }

    /**
     * Builds a request from a URL as it appears on the request line, e.g. {@code /get?foo=bar}.
     */
    public static MockRequest of(String method, String url, Map<String, List<String>> headers, byte[] body) {
        int queryStart = url.indexOf('?');
        String path = queryStart < 0 ? url : url.substring(0, queryStart);
        String rawQuery = queryStart < 0 ? null : url.substring(queryStart + 1);
        return new MockRequest(method, path, parseQuery(rawQuery), headers, body);
    }

    static Map<String, List<String>> parseQuery(String rawQuery) {
        Map<String, List<String>> parameters = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return parameters;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            parameters.computeIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8), k -> new ArrayList<>())
                    .add(URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return parameters;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public Map<String, List<String>> getQueryParameters() {
        return queryParameters;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public List<String> getHeader(String name) {
        return headers.getOrDefault(name, List.of());
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "MockRequest{" +
                "method='" + method + '\'' +
                ", path='" + path + '\'' +
                ", query=" + queryParameters +
                ", bodyLength=" + body.length +
                '}';
    }
}
