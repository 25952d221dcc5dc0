package com.panelforge.refinement.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelforge.refinement.ComfyUiPayload;
import com.panelforge.refinement.RefinementBackend;
import com.panelforge.refinement.RefinementPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Dispatcher for ComfyUI. Uploads the promoted image via POST /upload/image, then queues an img2img
 * workflow via POST /prompt. The handle carries the returned {@code prompt_id}; the engine does not
 * wait for the job. Default base URL http://localhost:8188.
 */
public final class ComfyUiRefinementDispatcher implements RefinementDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ComfyUiRefinementDispatcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_BASE_URL = "http://localhost:8188";

    private final String baseUrl;
    private final HttpClient httpClient;

    public ComfyUiRefinementDispatcher(String baseUrl) {
        this.baseUrl = trimTrailingSlash(baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public ComfyUiRefinementDispatcher() {
        this(DEFAULT_BASE_URL);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public RefinementBackend backend() {
        return RefinementBackend.COMFYUI;
    }

    @Override
    public RefinementHandle submitRefinement(RefinementPayload payload) throws Exception {
        if (!(payload instanceof ComfyUiPayload comfy)) {
            throw new IllegalArgumentException("ComfyUI dispatcher cannot send " + payload.backend().getId() + " payloads");
        }
        String uploadedName = uploadImage(Path.of(comfy.inputImage()));
        Map<String, Object> workflow = buildWorkflow(comfy, uploadedName);
        String promptId = submitPrompt(workflow);
        log.info("ComfyUI refinement queued | baseUrl={} | image={} | seed={} | promptId={}",
                baseUrl, uploadedName, comfy.seed(), promptId);
        return new RefinementHandle(RefinementBackend.COMFYUI, promptId, null);
    }

    /**
     * img2img graph: load the uploaded image, VAE-encode it, and sample with the payload's denoise
     * so the panel composition is kept.
     */
    static Map<String, Object> buildWorkflow(ComfyUiPayload payload, String imageName) {
        Map<String, Object> workflow = new LinkedHashMap<>();
        workflow.put("3", Map.of(
                "class_type", "KSampler",
                "inputs", Map.of(
                        "cfg", payload.cfgScale(),
                        "denoise", payload.denoisingStrength(),
                        "latent_image", List.of("11", 0),
                        "model", List.of("4", 0),
                        "negative", List.of("7", 0),
                        "positive", List.of("6", 0),
                        "sampler_name", payload.samplerName(),
                        "scheduler", payload.scheduler(),
                        "seed", payload.seed(),
                        "steps", payload.steps()
                )
        ));
        workflow.put("4", Map.of(
                "class_type", "CheckpointLoaderSimple",
                "inputs", Map.of("ckpt_name", payload.model())
        ));
        workflow.put("6", Map.of(
                "class_type", "CLIPTextEncode",
                "inputs", Map.of("clip", List.of("4", 1), "text", payload.prompt())
        ));
        workflow.put("7", Map.of(
                "class_type", "CLIPTextEncode",
                "inputs", Map.of("clip", List.of("4", 1), "text", payload.negativePrompt())
        ));
        workflow.put("8", Map.of(
                "class_type", "VAEDecode",
                "inputs", Map.of("samples", List.of("3", 0), "vae", List.of("4", 2))
        ));
        workflow.put("9", Map.of(
                "class_type", "SaveImage",
                "inputs", Map.of("filename_prefix", "panelforge", "images", List.of("8", 0))
        ));
        workflow.put("10", Map.of(
                "class_type", "LoadImage",
                "inputs", Map.of("image", imageName)
        ));
        workflow.put("11", Map.of(
                "class_type", "VAEEncode",
                "inputs", Map.of("pixels", List.of("10", 0), "vae", List.of("4", 2))
        ));
        return workflow;
    }

    private String uploadImage(Path image) throws Exception {
        String boundary = "panelforge-" + UUID.randomUUID();
        String fileName = image.getFileName().toString();
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.write(("--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"image\"; filename=\"" + fileName + "\"\r\n"
                + "Content-Type: image/png\r\n\r\n").getBytes(StandardCharsets.UTF_8));
        body.write(Files.readAllBytes(image));
        body.write(("\r\n--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"overwrite\"\r\n\r\n"
                + "true\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));

        HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + "/upload/image"))
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .timeout(Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body.toByteArray()))
                .build();
        HttpResponse<String> res = httpClient.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (res.statusCode() != 200) {
            throw new RuntimeException("ComfyUI upload failed: " + res.statusCode() + " " + res.body());
        }
        JsonNode root = MAPPER.readTree(res.body());
        String name = root.path("name").asText("");
        if (name.isEmpty()) {
            throw new RuntimeException("ComfyUI upload did not return a name: " + res.body());
        }
        String subfolder = root.path("subfolder").asText("");
        return subfolder.isEmpty() ? name : subfolder + "/" + name;
    }

    private String submitPrompt(Map<String, Object> workflow) throws Exception {
        String json = MAPPER.writeValueAsString(Map.of("prompt", workflow));
        HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + "/prompt"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> res = httpClient.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (res.statusCode() != 200) {
            throw new RuntimeException("ComfyUI submit failed: " + res.statusCode() + " " + res.body());
        }
        JsonNode promptIdNode = MAPPER.readTree(res.body()).path("prompt_id");
        if (promptIdNode.isMissingNode()) {
            throw new RuntimeException("ComfyUI did not return prompt_id: " + res.body());
        }
        return promptIdNode.asText();
    }

    static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
