package com.agripulse.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeminiServiceTest {

    @Test
    void returnsFirstCandidateText() {
        List<ClientRequest> seen = new ArrayList<>();
        GeminiService gemini = new GeminiService(Stubs.json(Stubs.geminiAnswer("  Sow early.  "), seen),
                "g-key", "gemini-2.5-flash", Duration.ofSeconds(5));

        StepVerifier.create(gemini.generate("When to sow wheat?"))
                .expectNext("Sow early.")
                .verifyComplete();

        ClientRequest req = seen.get(0);
        assertEquals(HttpMethod.POST, req.method());
        assertTrue(req.url().getPath().endsWith("/models/gemini-2.5-flash:generateContent"));
        assertTrue(req.url().getQuery().contains("key=g-key"));
    }

    @Test
    void missingKeyFailsWithoutCallingUpstream() {
        List<ClientRequest> seen = new ArrayList<>();
        GeminiService gemini = new GeminiService(Stubs.json("{}", seen), "", "m", Duration.ofSeconds(5));

        StepVerifier.create(gemini.generate("hi"))
                .expectError(UpstreamException.class)
                .verify();
        assertTrue(seen.isEmpty());
    }

    @Test
    void emptyCandidatesIsAnError() {
        GeminiService gemini = new GeminiService(Stubs.json("{\"candidates\":[]}"), "k", "m", Duration.ofSeconds(5));

        StepVerifier.create(gemini.generate("hi"))
                .expectError(UpstreamException.class)
                .verify();
    }

    @Test
    void httpErrorIsAnError() {
        GeminiService gemini = new GeminiService(Stubs.status(HttpStatus.TOO_MANY_REQUESTS), "k", "m", Duration.ofSeconds(5));

        StepVerifier.create(gemini.generate("hi"))
                .expectErrorSatisfies(e -> assertEquals("gemini", ((UpstreamException) e).source()))
                .verify();
    }

    @Test
    void imageIsSentAsInlineDataAfterPrompt() {
        ObjectNode body = GeminiService.requestBody("Diagnose this leaf", "image/png", new byte[]{1, 2, 3});

        JsonNode parts = body.path("contents").path(0).path("parts");
        assertEquals("user", body.path("contents").path(0).path("role").asText());
        assertEquals("Diagnose this leaf", parts.path(0).path("text").asText());
        assertEquals("image/png", parts.path(1).path("inline_data").path("mime_type").asText());
        assertEquals("AQID", parts.path(1).path("inline_data").path("data").asText());
        assertEquals(1, GeminiService.requestBody("hi", null, null).path("contents").path(0).path("parts").size());
    }

    @Test
    void imagePromptReturnsCandidateText() {
        List<ClientRequest> seen = new ArrayList<>();
        GeminiService gemini = new GeminiService(Stubs.json(Stubs.geminiAnswer("{\"detected_disease\":\"Healthy\"}"), seen),
                "g-key", "gemini-2.5-flash", Duration.ofSeconds(5));

        StepVerifier.create(gemini.generate("Diagnose", "image/jpeg", new byte[]{9}))
                .expectNext("{\"detected_disease\":\"Healthy\"}")
                .verifyComplete();
        assertEquals(1, seen.size());
    }

    @Test
    void stripsCodeFence() {
        assertEquals("[1,2]", GeminiService.stripCodeFence("```json\n[1,2]\n```"));
        assertEquals("{\"a\":1}", GeminiService.stripCodeFence(" {\"a\":1} "));
        assertEquals("```", GeminiService.stripCodeFence("```"));
    }
}
