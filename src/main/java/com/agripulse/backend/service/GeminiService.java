package com.agripulse.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Base64;

/**
 * Thin client for the Gemini {@code generateContent} REST endpoint. Errors are
 * propagated; callers decide on their own fallback.
 */
@Slf4j
@Service
public class GeminiService {

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public GeminiService(@Qualifier("geminiClient") WebClient webClient,
                         @Value("${gemini.api-key:}") String apiKey,
                         @Value("${gemini.model:gemini-2.5-flash}") String model,
                         @Value("${gemini.timeout:30s}") Duration timeout) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
    }

    /**
     * Sends a single-turn text prompt and emits the trimmed text of the first
     * candidate.
     */
    public Mono<String> generate(String prompt) {
        return send(requestBody(prompt, null, null));
    }

    /**
     * Same as {@link #generate(String)} with an image attached as base64
     * {@code inline_data} after the prompt.
     */
    public Mono<String> generate(String prompt, String mimeType, byte[] image) {
        return send(requestBody(prompt, mimeType, image));
    }

    static ObjectNode requestBody(String prompt, String mimeType, byte[] image) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        ObjectNode content = body.putArray("contents").addObject();
        content.put("role", "user");
        ArrayNode parts = content.putArray("parts");
        parts.addObject().put("text", prompt);
        if (image != null) {
            parts.addObject().putObject("inline_data")
                    .put("mime_type", mimeType)
                    .put("data", Base64.getEncoder().encodeToString(image));
        }
        return body;
    }

    private Mono<String> send(ObjectNode body) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new UpstreamException("gemini", "api key not configured"));
        }
        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/models/{model}:generateContent")
                        .queryParam("key", apiKey)
                        .build(model))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError,
                        resp -> Mono.error(new UpstreamException("gemini", "HTTP " + resp.statusCode().value())))
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .map(GeminiService::firstText);
    }

    static String firstText(JsonNode response) {
        JsonNode text = response.path("candidates").path(0)
                .path("content").path("parts").path(0).path("text");
        if (!text.isTextual() || text.asText().isBlank()) {
            throw new UpstreamException("gemini", "empty response");
        }
        return text.asText().trim();
    }

    /**
     * Strips a surrounding markdown code fence (```json ... ```) if the model
     * added one.
     */
    public static String stripCodeFence(String text) {
        String t = text.trim();
        if (!t.startsWith("```")) {
            return t;
        }
        int firstNewline = t.indexOf('\n');
        int closing = t.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return t;
        }
        return t.substring(firstNewline + 1, closing).trim();
    }
}
