package com.agripulse.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * AI-written parts of the snapshots. Each method falls back to
 * {@link FallbackDataProvider} output when Gemini fails or answers with
 * something unusable, so none of them errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InsightService {

    private final GeminiService gemini;
    private final FallbackDataProvider fallback;
    private final ObjectMapper mapper;

    public Mono<String> dashboardSummary(String location, JsonNode weather, JsonNode market, JsonNode news) {
        String prompt = """
                You are AgriPulse AI, India's agriculture advisor.
                Analyze real data and summarize for farmers in %s:

                Weather: %s
                Market: %s
                News: %s

                Give:
                1. Weather Outlook
                2. Market Trends
                3. Weekly Advisory

                Keep it factual, under 100 words, friendly tone.
                """.formatted(location, weather, head(market, 5), head(news, 3));
        return gemini.generate(prompt)
                .onErrorResume(ex -> {
                    log.warn("⚠️ Gemini summary fallback: {}", ex.toString());
                    return Mono.just(fallback.aiSummary());
                });
    }

    public Mono<ArrayNode> cropInsights(String location, JsonNode weather, JsonNode market) {
        String prompt = """
                You are AgriPulse AI, a data-driven crop advisor for farmers in %s.
                Analyze:
                - Weather: %s
                - Mandi: %s

                Output top 3 crops to *plant or sell* this week, strictly in JSON:
                [{"crop":"Wheat","recommendation_type":"sell","confidence":85,"reason":["Good MSP","Stable yield"]},...]
                """.formatted(location, weather, head(market, 5));
        return gemini.generate(prompt)
                .map(text -> {
                    JsonNode parsed = parse(text);
                    if (parsed instanceof ArrayNode crops) {
                        return crops;
                    }
                    log.warn("⚠️ Gemini crop insights were not a JSON array, using defaults");
                    return fallback.cropInsightsUnparseable();
                })
                .onErrorResume(ex -> {
                    log.warn("⚠️ Gemini crop fallback: {}", ex.toString());
                    return Mono.just(fallback.cropInsightsUnavailable());
                });
    }

    /**
     * Structured trading advice for the market terminal. A model answer is only
     * accepted when it is an object carrying a {@code recommendation}; missing
     * sections are filled from the fallback insight.
     */
    public Mono<ObjectNode> terminalInsight(String commodity, JsonNode marketData, JsonNode summary,
                                            JsonNode forecast, int harvestDays, JsonNode weather) {
        String prompt = """
                You are AgriPulse AI, a commodity market analyst for Indian farmers.
                Commodity: %s (harvest in %d days)
                Price summary: %s
                Mandi data: %s
                7-day price forecast: %s
                Weather: %s

                Respond strictly as one JSON object with keys:
                recommendation {action: BUY|SELL|HOLD, confidence: 0-100, reason},
                yield_outlook {change_percent, factors[]}, price_forecast_comment,
                market_sentiment {overall, keywords[]}, optimal_market {sell_high[], buy_low[]},
                ai_summary, reason.
                """.formatted(commodity, harvestDays, summary, head(marketData, 5), forecast, weather);
        return gemini.generate(prompt)
                .map(text -> {
                    JsonNode parsed = parse(text);
                    if (parsed instanceof ObjectNode obj && obj.path("recommendation").isObject()) {
                        ObjectNode merged = fallback.structuredInsight();
                        merged.setAll(obj);
                        return merged;
                    }
                    log.warn("⚠️ Gemini terminal insight unusable, using defaults");
                    return fallback.structuredInsight();
                })
                .onErrorResume(ex -> {
                    log.warn("⚠️ Gemini terminal insight fallback: {}", ex.toString());
                    return Mono.just(fallback.structuredInsight());
                });
    }

    /**
     * Free-form farmer question. Errors propagate to the caller.
     */
    public Mono<String> answer(String question) {
        String prompt = """
                You are AgriPulse AI, an agriculture expert designed to assist Indian farmers.
                Your goal is to give practical, location-aware, and concise answers.
                Use simple language and short paragraphs.

                Guidelines:
                - Base advice on weather, soil type, and current season (India).
                - When asked about crop choices, include 2-3 options with reasoning.
                - When asked about diseases, suggest natural and chemical control options.
                - When asked about prices, mention market trends and storage tips.
                - When asked about government schemes or subsidies, summarize simply.

                Farmer's question:
                %s
                """.formatted(question);
        return gemini.generate(prompt);
    }

    /**
     * Leaf disease diagnosis from a photo. A JSON object answer is returned as
     * is; anything else comes back as {@code {"raw_response": text}}. Errors
     * propagate to the caller.
     */
    public Mono<ObjectNode> diagnoseLeaf(String mimeType, byte[] image) {
        String prompt = """
                You are an agricultural plant pathology expert AI.
                Analyze the uploaded leaf image and identify any visible disease.
                For your output, return a JSON object with these fields:
                {
                    "detected_disease": "name of disease or 'Healthy'",
                    "confidence": "estimated confidence percentage",
                    "severity": "low | medium | high",
                    "recommended_treatment": "practical treatment steps or note if no issue"
                }
                Keep the JSON clean and concise, no markdown or explanations.
                """;
        return gemini.generate(prompt, mimeType, image)
                .map(text -> {
                    if (parse(text) instanceof ObjectNode diagnosis) {
                        return diagnosis;
                    }
                    log.warn("⚠️ Gemini diagnosis was not a JSON object, returning raw text");
                    ObjectNode raw = mapper.createObjectNode();
                    raw.put("raw_response", text);
                    return raw;
                });
    }

    private JsonNode parse(String text) {
        try {
            return mapper.readTree(GeminiService.stripCodeFence(text));
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static JsonNode head(JsonNode array, int n) {
        if (array == null || !array.isArray() || array.size() <= n) {
            return array;
        }
        ArrayNode out = ((ArrayNode) array).arrayNode();
        for (int i = 0; i < n; i++) {
            out.add(array.get(i));
        }
        return out;
    }
}
