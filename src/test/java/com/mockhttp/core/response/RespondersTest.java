package com.mockhttp.core.response;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RespondersTest {

    @TempDir
    Path tempDir;

    @Test
    void statusCode_setsStatus() {
        ResponseRecorder recorder = new ResponseRecorder();

        Responders.statusCode(204).respond(recorder);

        assertEquals(204, recorder.statusCode());
    }

    @Test
    void headers_multipleValues_allAdded() {
        ResponseRecorder recorder = new ResponseRecorder();

        Responders.headers(Map.of("X-Foo", List.of("a", "b"))).respond(recorder);

        assertEquals(List.of("a", "b"), recorder.headers().get("X-Foo"));
    }

    @Test
    void jsonBody_setsContentTypeAndBody() {
        ResponseRecorder recorder = new ResponseRecorder();

        Responders.jsonBody("{\"ok\":true}").respond(recorder);

        assertEquals(List.of("application/json"), recorder.headers().get("content-type"));
        assertEquals("{\"ok\":true}", new String(recorder.body(), StandardCharsets.UTF_8));
        assertEquals(0, recorder.statusCode());
    }

    @Test
    void jsonFileBody_existingFile_usesFileContent() throws Exception {
        Path file = tempDir.resolve("response.json");
        Files.writeString(file, "{\"id\":42}");
        ResponseRecorder recorder = new ResponseRecorder();

        Responders.jsonFileBody(file).respond(recorder);

        assertEquals("{\"id\":42}", new String(recorder.body(), StandardCharsets.UTF_8));
        assertEquals(List.of("application/json"), recorder.headers().get("Content-Type"));
    }

    @Test
    void jsonFileBody_missingFile_failsAtDeclaration() {
        Path missing = tempDir.resolve("missing.json");

        UncheckedIOException thrown = assertThrows(UncheckedIOException.class,
                () -> Responders.jsonFileBody(missing));

        assertTrue(thrown.getMessage().contains("missing.json"),
                "Message should name the file: " + thrown.getMessage());
    }

    @Test
    void stringBody_noContentType() {
        ResponseRecorder recorder = new ResponseRecorder();

        Responders.stringBody("plain").respond(recorder);

        assertEquals("plain", new String(recorder.body(), StandardCharsets.UTF_8));
        assertFalse(recorder.headers().containsKey("Content-Type"));
    }
}
