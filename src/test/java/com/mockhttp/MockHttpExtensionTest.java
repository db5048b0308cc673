package com.mockhttp;

import com.mockhttp.core.endpoint.HttpMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static com.mockhttp.core.response.Responders.jsonBody;
import static com.mockhttp.core.response.Responders.statusCode;
import static org.junit.jupiter.api.Assertions.*;

@MockHttp
class MockHttpExtensionTest {

    private static final HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private MockServer fromBeforeEach;

    @BeforeEach
    void declareSharedEndpoint(MockServer server) {
        fromBeforeEach = server;
        server.get("/health").respond(statusCode(204));
    }

    @Test
    void injectsSameServerIntoSetupAndTest(MockServer server) throws Exception {
        server.start();

        assertSame(fromBeforeEach, server);
        assertEquals(204, send(server, "/health").statusCode());
    }

    @Test
    void servesScenariosDeclaredInTest(MockServer server) throws Exception {
        server.get("/books/1").respond(jsonBody("{\"id\": 1}"), statusCode(200));
        server.start();

        HttpResponse<String> health = send(server, "/health");
        HttpResponse<String> book = send(server, "/books/1");

        assertEquals(204, health.statusCode());
        assertEquals("{\"id\": 1}", book.body());
        assertEquals(1, server.timesCalled(HttpMethod.GET, "/books/1"));
    }

    @Nested
    class NestedTests {

        @Test
        void nestedTestGetsItsOwnServer(MockServer server) throws Exception {
            assertNotNull(server);
            server.start();

            assertEquals(204, send(server, "/health").statusCode());
        }
    }

    private static HttpResponse<String> send(MockServer server, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(server.url() + path)).GET().build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
