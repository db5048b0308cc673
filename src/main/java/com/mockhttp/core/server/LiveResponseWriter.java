package com.mockhttp.core.server;

import com.github.tomakehurst.wiremock.http.HttpHeader;
import com.github.tomakehurst.wiremock.http.HttpHeaders;
import com.github.tomakehurst.wiremock.http.ResponseDefinition;
import com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder;
import com.mockhttp.core.response.ResponseWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link ResponseWriter} with the one-shot semantics of a real HTTP response: the first
 * body write commits the status (200 unless one was set), and status or header changes
 * after the commit are ignored. Renders into a WireMock {@link ResponseDefinition}.
 */
public class LiveResponseWriter implements ResponseWriter {

    private static final Logger logger = LoggerFactory.getLogger(LiveResponseWriter.class);

    private static final int DEFAULT_STATUS = 200;

    private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private Map<String, List<String>> committedHeaders;
    private int status;

    @Override
    public Map<String, List<String>> headers() {
        return committed() ? Collections.unmodifiableMap(committedHeaders) : headers;
    }

    @Override
    public void addHeader(String name, String value) {
        if (committed()) {
            logger.warn("Ignoring header {} added after the response was committed", name);
            return;
        }
        ResponseWriter.super.addHeader(name, value);
    }

    @Override
    public void write(byte[] bytes) {
        if (!committed()) {
            commit(DEFAULT_STATUS);
        }
        body.writeBytes(bytes);
    }

    @Override
    public void writeHeader(int statusCode) {
        if (committed()) {
            logger.warn("Ignoring superfluous status {} (response already committed with {})", statusCode, status);
            return;
        }
        commit(statusCode);
    }

    public int status() {
        return committed() ? status : DEFAULT_STATUS;
    }

    public byte[] body() {
        return body.toByteArray();
    }

    public ResponseDefinition toResponseDefinition() {
        Map<String, List<String>> finalHeaders = committed() ? committedHeaders : headers;
        List<HttpHeader> httpHeaders = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : finalHeaders.entrySet()) {
            httpHeaders.add(new HttpHeader(entry.getKey(), entry.getValue()));
        }

        ResponseDefinitionBuilder builder = ResponseDefinitionBuilder.responseDefinition()
                .withStatus(status())
                .withHeaders(new HttpHeaders(httpHeaders));
        if (body.size() > 0) {
            builder.withBody(body.toByteArray());
        }
        return builder.build();
    }

    private boolean committed() {
        return committedHeaders != null;
    }

    private void commit(int statusCode) {
        status = statusCode;
        committedHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            committedHeaders.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
    }
}
