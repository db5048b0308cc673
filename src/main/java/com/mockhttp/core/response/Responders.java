package com.mockhttp.core.response;

import com.mockhttp.core.config.Constants;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Factory methods for the common {@link Responder}s.
 */
public final class Responders {

    private Responders() {
        // utility class
    }

    public static Responder statusCode(int code) {
        return writer -> writer.writeHeader(code);
    }

    public static Responder headers(Map<String, List<String>> headers) {
        Map<String, List<String>> copy = Map.copyOf(headers);
        return writer -> {
            for (Map.Entry<String, List<String>> entry : copy.entrySet()) {
                for (String value : entry.getValue()) {
                    writer.addHeader(entry.getKey(), value);
                }
            }
        };
    }

    public static Responder header(String name, String... values) {
        return headers(Map.of(name, List.of(values)));
    }

    public static Responder jsonBody(String json) {
        byte[] content = json.getBytes(StandardCharsets.UTF_8);
        return writer -> {
            writer.addHeader(Constants.CONTENT_TYPE, Constants.APPLICATION_JSON);
            writer.write(content);
        };
    }

    /**
     * Reads the JSON file when the responder is declared, so a missing fixture fails
     * the test during setup instead of on the first request.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public static Responder jsonFileBody(Path file) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read json file: " + file, e);
        }
        return writer -> {
            writer.addHeader(Constants.CONTENT_TYPE, Constants.APPLICATION_JSON);
            writer.write(content);
        };
    }

    public static Responder stringBody(String body) {
        byte[] content = body.getBytes(StandardCharsets.UTF_8);
        return writer -> writer.write(content);
    }
}
