package com.panelforge.refinement.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelforge.refinement.Automatic1111Payload;
import com.panelforge.refinement.RefinementBackend;
import com.panelforge.refinement.RefinementPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Dispatcher for Stable Diffusion WebUI (Automatic1111). Posts the payload unchanged to
 * /sdapi/v1/img2img and returns the first image of the response. Default base URL http://localhost:7860.
 */
public final class Automatic1111RefinementDispatcher implements RefinementDispatcher {

    private static final Logger log = LoggerFactory.getLogger(Automatic1111RefinementDispatcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_BASE_URL = "http://localhost:7860";

    private final String baseUrl;
    private final HttpClient httpClient;

    public Automatic1111RefinementDispatcher(String baseUrl) {
        this.baseUrl = ComfyUiRefinementDispatcher.trimTrailingSlash(
                baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public Automatic1111RefinementDispatcher() {
        this(DEFAULT_BASE_URL);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public RefinementBackend backend() {
        return RefinementBackend.AUTOMATIC1111;
    }

    @Override
    public RefinementHandle submitRefinement(RefinementPayload payload) throws Exception {
        if (!(payload instanceof Automatic1111Payload)) {
            throw new IllegalArgumentException("Automatic1111 dispatcher cannot send " + payload.backend().getId() + " payloads");
        }
        String json = MAPPER.writeValueAsString(payload);
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/sdapi/v1/img2img"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(300))
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() != 200) {
            throw new RuntimeException("Stable Diffusion API error: " + response.statusCode() + " " + response.body());
        }

        JsonNode images = MAPPER.readTree(response.body()).path("images");
        if (!images.isArray() || images.size() == 0) {
            throw new RuntimeException("Stable Diffusion API returned no images");
        }
        log.info("Automatic1111 refinement completed | baseUrl={} | seed={} | images={}", baseUrl, payload.seed(), images.size());
        return new RefinementHandle(RefinementBackend.AUTOMATIC1111, null, images.get(0).asText(""));
    }
}
