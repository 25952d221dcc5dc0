package com.panelforge.refinement.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelforge.refinement.Automatic1111Payload;
import com.panelforge.refinement.RefinementBackend;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class Automatic1111RefinementDispatcherTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private volatile String responseBody = "{\"images\":[\"cmVmaW5lZA==\"],\"info\":\"{\\\"seed\\\": 803419}\"}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/sdapi/v1/img2img", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void submitRefinement_postsPayloadAndReturnsFirstImage() throws Exception {
        Automatic1111RefinementDispatcher dispatcher = new Automatic1111RefinementDispatcher(baseUrl());

        RefinementHandle handle = dispatcher.submitRefinement(payload());

        assertEquals(RefinementBackend.AUTOMATIC1111, handle.backend());
        assertNull(handle.jobId());
        assertEquals("cmVmaW5lZA==", handle.imageBase64());
        JsonNode sent = MAPPER.readTree(requestBody.get());
        assertEquals("aW1n", sent.get("init_images").get(0).asText());
        assertEquals(0.35, sent.get("denoising_strength").asDouble(), 0.0);
        assertEquals(803419, sent.get("seed").asLong());
    }

    @Test
    void submitRefinement_emptyImagesThrows() {
        responseBody = "{\"images\":[]}";

        assertThrows(RuntimeException.class, () -> new Automatic1111RefinementDispatcher(baseUrl()).submitRefinement(payload()));
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private static Automatic1111Payload payload() {
        return new Automatic1111Payload(List.of("aW1n"), "hero, highly detailed, 8k", "blurry", 0.35, 803419, 7.5, 30,
                "Euler a", 600, 338, false, false);
    }
}
