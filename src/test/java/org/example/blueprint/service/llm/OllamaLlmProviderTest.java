package org.example.blueprint.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OllamaLlmProviderTest {

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> responseBody = new AtomicReference<>();
    private final AtomicReference<String> requestBody = new AtomicReference<>();

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/generate", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = responseBody.get().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status.get(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/api/tags", exchange -> {
            byte[] body = "{\"models\":[]}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private OllamaLlmProvider provider() {
        return new OllamaLlmProvider("http://127.0.0.1:" + server.getAddress().getPort(), "llama3.1:latest", 5);
    }

    @Test
    void generate_sendsSystemPromptAndReturnsResponse() throws Exception {
        responseBody.set("{\"model\":\"llama3.1:latest\",\"response\":\"# Mara\",\"done\":true}");

        String output = provider().generate("You compile characters.", "SEED: a smuggler",
                new LlmOptions(0.4, 256, null));

        assertEquals("# Mara", output);
        JsonNode request = new ObjectMapper().readTree(requestBody.get());
        assertEquals("llama3.1:latest", request.get("model").asText());
        assertEquals("You compile characters.", request.get("system").asText());
        assertFalse(request.get("stream").asBoolean());
        assertEquals(256, request.get("options").get("num_predict").asInt());
    }

    @Test
    void generate_serverErrorCarriesStatusCode() {
        status.set(503);
        responseBody.set("{\"error\":\"model is loading\"}");

        LlmProviderException failure = assertThrows(LlmProviderException.class,
                () -> provider().generate(null, "SEED: x", LlmOptions.withTemperature(0.7)));

        assertEquals(503, failure.getStatusCode());
    }

    @Test
    void isAvailable_probesTagsEndpoint() {
        assertTrue(provider().isAvailable());
        assertFalse(new OllamaLlmProvider("http://127.0.0.1:1", "llama3.1:latest", 5).isAvailable());
    }
}
