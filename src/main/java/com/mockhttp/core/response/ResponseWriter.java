package com.mockhttp.core.response;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sink for one HTTP response: a mutable multi-valued header map, a status code and a body.
 */
public interface ResponseWriter {

    /**
     * @return the mutable header map; names are case-insensitive
     */
    Map<String, List<String>> headers();

    void write(byte[] body);

    void writeHeader(int statusCode);

    default void addHeader(String name, String value) {
        headers().computeIfAbsent(name, key -> new ArrayList<>()).add(value);
    }
}
