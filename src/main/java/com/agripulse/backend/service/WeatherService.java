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
 * Retrieves 7-day forecasts from WeatherAPI. Any API error, timeout or
 * unexpected body is replaced by the matching {@link FallbackDataProvider}
 * weather, so the returned mono never errors.
 */
@Slf4j
@Service
public class WeatherService {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final WebClient webClient;
    private final FallbackDataProvider fallback;
    private final String apiKey;
    private final Duration timeout;

    public WeatherService(@Qualifier("weatherClient") WebClient webClient,
                          FallbackDataProvider fallback,
                          @Value("${weather.api-key:}") String apiKey,
                          @Value("${weather.timeout:10s}") Duration timeout) {
        this.webClient = webClient;
        this.fallback = fallback;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    /**
     * Current conditions, sunrise/sunset and a forecast with icons, as shown on
     * the dashboard.
     */
    public Mono<ObjectNode> dashboardWeather(String location) {
        return forecast(location)
                .map(data -> toDashboardWeather(data, location))
                .onErrorResume(ex -> {
                    log.warn("⚠️ WeatherAPI fallback for {}: {}", location, ex.toString());
                    return Mono.just(fallback.dashboardWeather(location));
                });
    }

    /**
     * Slimmer shape used by the market terminal.
     */
    public Mono<ObjectNode> terminalWeather(String location) {
        return forecast(location)
                .map(data -> toTerminalWeather(data, location))
                .onErrorResume(ex -> {
                    log.warn("⚠️ Weather fallback for {}: {}", location, ex.toString());
                    return Mono.just(fallback.terminalWeather(location));
                });
    }

    private Mono<JsonNode> forecast(String location) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/forecast.json")
                        .queryParam("key", apiKey)
                        .queryParam("q", location)
                        .queryParam("days", 7)
                        .queryParam("aqi", "no")
                        .queryParam("alerts", "no")
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError,
                        resp -> Mono.error(new UpstreamException("weather", "HTTP " + resp.statusCode().value())))
                .bodyToMono(JsonNode.class)
                .timeout(timeout);
    }

    static ObjectNode toDashboardWeather(JsonNode data, String location) {
        JsonNode current = data.path("current");
        JsonNode days = data.path("forecast").path("forecastday");
        if (!days.isArray() || days.isEmpty()) {
            throw new UpstreamException("weather", "forecast missing");
        }

        ObjectNode w = header(data, location);
        ObjectNode cur = w.putObject("current");
        cur.set("temp_c", current.get("temp_c"));
        cur.put("condition", current.path("condition").path("text").asText(null));
        cur.put("icon", current.path("condition").path("icon").asText(null));
        cur.set("humidity", current.get("humidity"));
        cur.set("wind_kph", current.get("wind_kph"));
        cur.set("precip_mm", current.get("precip_mm"));

        JsonNode astro = days.get(0).path("astro");
        ObjectNode a = w.putObject("astro");
        a.put("sunrise", astro.path("sunrise").asText(""));
        a.put("sunset", astro.path("sunset").asText(""));

        ArrayNode forecast = w.putArray("forecast");
        for (JsonNode d : days) {
            JsonNode day = d.path("day");
            ObjectNode f = forecast.addObject();
            f.put("date", d.path("date").asText(null));
            f.set("avgtemp_c", day.get("avgtemp_c"));
            f.set("totalprecip_mm", day.get("totalprecip_mm"));
            f.set("avghumidity", day.get("avghumidity"));
            f.put("condition", day.path("condition").path("text").asText(null));
            f.put("icon", day.path("condition").path("icon").asText(null));
            f.set("daily_chance_of_rain", day.get("daily_chance_of_rain"));
        }
        return w;
    }

    static ObjectNode toTerminalWeather(JsonNode data, String location) {
        JsonNode current = data.path("current");
        ObjectNode w = header(data, location);
        ObjectNode cur = w.putObject("current");
        cur.set("temp_c", current.get("temp_c"));
        cur.set("humidity", current.get("humidity"));
        cur.set("precip_mm", current.get("precip_mm"));
        cur.put("condition", current.path("condition").path("text").asText(null));

        ArrayNode forecast = w.putArray("forecast");
        for (JsonNode d : data.path("forecast").path("forecastday")) {
            JsonNode day = d.path("day");
            ObjectNode f = forecast.addObject();
            f.put("date", d.path("date").asText(null));
            f.set("avgtemp_c", day.get("avgtemp_c"));
            f.set("totalprecip_mm", day.get("totalprecip_mm"));
            f.set("avghumidity", day.get("avghumidity"));
            f.put("condition", day.path("condition").path("text").asText(null));
        }
        return w;
    }

    private static ObjectNode header(JsonNode data, String location) {
        if (!data.isObject()) {
            throw new UpstreamException("weather", "unexpected body");
        }
        ObjectNode w = NODES.objectNode();
        w.put("location", data.path("location").path("name").asText(location));
        w.put("country", data.path("location").path("country").asText("India"));
        return w;
    }
}
