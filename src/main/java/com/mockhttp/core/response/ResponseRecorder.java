package com.mockhttp.core.response;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory {@link ResponseWriter} that accumulates the mutations of a scenario's
 * responders so that the order they were declared in does not matter.
 * <p>
 * A live writer fixes the status at 200 on the first body write and ignores any
 * later status. The recorder keeps headers cumulative, keeps the last status and
 * the last body, and only touches the real writer in {@link #flushTo(ResponseWriter)}:
 * headers first, then the status if one was set, then the body if it is non-empty.
 * <p>
 * One instance per request; not thread-safe.
 */
public class ResponseRecorder implements ResponseWriter {

    private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private byte[] body = new byte[0];
    private int statusCode;

    @Override
    public Map<String, List<String>> headers() {
        return headers;
    }

    /**
     * Replaces the recorded body; successive writes do not append.
     */
    @Override
    public void write(byte[] body) {
        this.body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public void writeHeader(int statusCode) {
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public byte[] body() {
        return body.clone();
    }

    public void flushTo(ResponseWriter target) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            for (String value : entry.getValue()) {
                target.addHeader(entry.getKey(), value);
            }
        }

        if (statusCode > 0) {
            target.writeHeader(statusCode);
        }

        if (body.length > 0) {
            target.write(body);
        }
    }
}
