package com.agripulse.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Mandi (wholesale market) prices from the data.gov.in open data API.
 */
@Slf4j
@Service
public class MandiService {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final WebClient webClient;
    private final FallbackDataProvider fallback;
    private final String apiKey;
    private final Duration timeout;

    public MandiService(@Qualifier("mandiClient") WebClient webClient,
                        FallbackDataProvider fallback,
                        @Value("${mandi.api-key:}") String apiKey,
                        @Value("${mandi.timeout:10s}") Duration timeout) {
        this.webClient = webClient;
        this.fallback = fallback;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    /**
     * Up to ten price rows for one market, or the fallback list.
     */
    public Mono<ArrayNode> dashboardPrices(String location) {
        return records("filters[market]", location, 10)
                .map(records -> {
                    ArrayNode out = NODES.arrayNode();
                    for (JsonNode r : records) {
                        ObjectNode row = out.addObject();
                        row.put("commodity", r.path("commodity").asText("Unknown"));
                        row.put("market", r.path("market").asText(location));
                        row.put("modal_price", price(r, "modal_price"));
                        row.put("max_price", price(r, "max_price"));
                        row.put("min_price", price(r, "min_price"));
                        row.put("arrival_date", r.path("arrival_date").asText(""));
                    }
                    return out;
                })
                .onErrorResume(ex -> {
                    log.warn("⚠️ Mandi fallback for {}: {}", location, ex.toString());
                    return Mono.just(fallback.dashboardMarket(location));
                });
    }

    /**
     * Raw records for one commodity across markets, or the fallback records.
     * Feed the result to {@link #normalize(JsonNode, String)}.
     */
    public Mono<ArrayNode> terminalRecords(String commodity) {
        return records("filters[commodity]", Names.capitalize(commodity), 200)
                .onErrorResume(ex -> {
                    log.warn("⚠️ Mandi fallback for {}: {}", commodity, ex.toString());
                    return Mono.just(fallback.terminalMandiRecords(commodity));
                });
    }

    private Mono<ArrayNode> records(String filter, String value, int limit) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .queryParam("api-key", apiKey)
                        .queryParam("format", "json")
                        .queryParam("limit", limit)
                        .queryParam(filter, value)
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError,
                        resp -> Mono.error(new UpstreamException("mandi", "HTTP " + resp.statusCode().value())))
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .map(body -> {
                    JsonNode records = body.path("records");
                    if (!records.isArray() || records.isEmpty()) {
                        throw new UpstreamException("mandi", "No mandi records returned");
                    }
                    return (ArrayNode) records;
                });
    }

    /**
     * Normalizes raw records into terminal rows. Rows that are not objects are
     * skipped; prices that do not parse become null.
     */
    public static ArrayNode normalize(JsonNode records, String commodity) {
        ArrayNode out = NODES.arrayNode();
        String name = Names.capitalize(commodity);
        for (JsonNode r : records) {
            if (!r.isObject()) {
                continue;
            }
            ObjectNode row = out.addObject();
            row.put("state", firstNonBlank(r, "state", "state_name"));
            row.put("district", r.path("district").asText(""));
            row.put("market", firstNonBlank(r, "market", "market_name"));
            row.put("commodity", name);
            row.put("variety", r.path("variety").asText(""));
            row.put("arrival_date", r.path("arrival_date").asText(""));
            row.put("min_price", floatOrNull(r.get("min_price")));
            row.put("max_price", floatOrNull(r.get("max_price")));
            row.put("modal_price", floatOrNull(r.get("modal_price")));
            row.put("unit", r.path("price_unit").asText("Rs/Quintal"));
        }
        return out;
    }

    static Double floatOrNull(JsonNode v) {
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isNumber()) {
            return v.doubleValue();
        }
        try {
            return Double.parseDouble(v.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double price(JsonNode r, String field) {
        JsonNode v = r.get(field);
        if (v == null || v.isNull()) {
            return 0;
        }
        Double d = floatOrNull(v);
        if (d == null) {
            throw new UpstreamException("mandi", "bad " + field + ": " + v.asText());
        }
        return d;
    }

    private static String firstNonBlank(JsonNode r, String field, String alt) {
        String v = r.path(field).asText("");
        return v.isBlank() ? r.path(alt).asText("") : v;
    }
}
