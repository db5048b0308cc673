package com.mockhttp.core.server;

import com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.extension.Parameters;
import com.github.tomakehurst.wiremock.extension.ResponseDefinitionTransformerV2;
import com.github.tomakehurst.wiremock.http.HttpHeader;
import com.github.tomakehurst.wiremock.http.Request;
import com.github.tomakehurst.wiremock.http.ResponseDefinition;
import com.github.tomakehurst.wiremock.matching.UrlPattern;
import com.github.tomakehurst.wiremock.stubbing.ServeEvent;
import com.mockhttp.core.config.Constants;
import com.mockhttp.core.endpoint.Endpoint;
import com.mockhttp.core.matching.MockRequest;
import com.mockhttp.core.reporting.FailureReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * WireMock response transformer that hands every served request to its {@link Endpoint}.
 * <p>
 * Endpoint stubs carry the endpoint key as a transformer parameter. The catch-all stub
 * carries none: such requests are reported as unmatched routes and answered with 405 when
 * the path is registered under another method, 404 otherwise.
 */
public class EndpointDispatcher implements ResponseDefinitionTransformerV2 {

    private static final Logger logger = LoggerFactory.getLogger(EndpointDispatcher.class);

    private static final int NOT_FOUND = 404;
    private static final int METHOD_NOT_ALLOWED = 405;
    private static final int INTERNAL_ERROR = 500;

    private final Map<String, Endpoint> endpoints = new LinkedHashMap<>();
    private final Map<String, UrlPattern> pathPatterns = new LinkedHashMap<>();
    private final FailureReporter failures;

    public EndpointDispatcher(List<Endpoint> endpoints, FailureReporter failures) {
        for (Endpoint endpoint : endpoints) {
            String name = endpoint.key().toString();
            this.endpoints.put(name, endpoint);
            this.pathPatterns.put(name, WireMock.urlPathTemplate(endpoint.key().path()));
        }
        this.failures = failures;
    }

    @Override
    public String getName() {
        return Constants.DISPATCHER_NAME;
    }

    @Override
    public boolean applyGlobally() {
        return false;
    }

    @Override
    public ResponseDefinition transform(ServeEvent serveEvent) {
        Request request = serveEvent.getRequest();
        Parameters parameters = serveEvent.getResponseDefinition().getTransformerParameters();
        Object endpointName = parameters == null ? null : parameters.get(Constants.ENDPOINT_PARAMETER);
        Endpoint endpoint = endpointName == null ? null : endpoints.get(endpointName.toString());

        if (endpoint == null) {
            return unmatched(request);
        }

        LiveResponseWriter writer = new LiveResponseWriter();
        try {
            endpoint.handle(toMockRequest(request), writer, failures);
        } catch (RuntimeException | AssertionError e) {
            logger.error("Failed to serve {} {}", request.getMethod().getName(), request.getUrl(), e);
            failures.report("failed to serve %s %s: %s", request.getMethod().getName(), request.getUrl(), e);
            return ResponseDefinitionBuilder.responseDefinition().withStatus(INTERNAL_ERROR).build();
        }
        return writer.toResponseDefinition();
    }

    private ResponseDefinition unmatched(Request request) {
        String method = request.getMethod().getName();
        String path = MockRequest.of(method, request.getUrl(), Map.of(), null).getPath();
        failures.report("no matching route found for %s %s", method, path);

        boolean pathKnown = pathPatterns.values().stream()
                .anyMatch(pattern -> pattern.match(request.getUrl()).isExactMatch());
        int status = pathKnown ? METHOD_NOT_ALLOWED : NOT_FOUND;
        logger.debug("Unmatched route {} {} answered with {}", method, path, status);
        return ResponseDefinitionBuilder.responseDefinition().withStatus(status).build();
    }

    static MockRequest toMockRequest(Request request) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (HttpHeader header : request.getHeaders().all()) {
            headers.put(header.key(), header.values());
        }
        return MockRequest.of(request.getMethod().getName(), request.getUrl(), headers, request.getBody());
    }
}
