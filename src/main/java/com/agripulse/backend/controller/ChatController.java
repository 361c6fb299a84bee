package com.agripulse.backend.controller;

import com.agripulse.backend.service.InsightService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Farmer Q&amp;A backed by Gemini. Not cached.
 */
@Slf4j
@RestController
@RequestMapping("/chat")
@RequiredArgsConstructor
public class ChatController {

    private final InsightService insightService;

    @PostMapping({"", "/"})
    public Mono<Map<String, String>> chat(@RequestBody JsonNode body) {
        String message = body.path("message").asText("").trim();
        if (message.isEmpty()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Message is required"));
        }
        return insightService.answer(message)
                .map(text -> Map.of("response", text))
                .onErrorMap(ex -> !(ex instanceof ResponseStatusException), ex -> {
                    log.error("❌ Gemini chat error", ex);
                    return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR,
                            "AI response failed. Please try again later.");
                });
    }

    @GetMapping({"", "/"})
    public Map<String, String> health() {
        return Map.of("message", "Chat endpoint active. Use POST /chat/ with JSON body to talk to AgriPulse AI.");
    }
}
