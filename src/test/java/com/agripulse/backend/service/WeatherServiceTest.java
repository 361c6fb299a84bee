package com.agripulse.backend.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link WeatherService}'s mapping and fallback behaviour.
 */
class WeatherServiceTest {

    private final FallbackDataProvider fallback =
            new FallbackDataProvider(Clock.fixed(Instant.parse("2025-06-01T06:00:00Z"), ZoneOffset.UTC));

    private WeatherService service(WebClient client) {
        return new WeatherService(client, fallback, "test-key", Duration.ofSeconds(5));
    }

    @Test
    void returnsFallbackWhenApiFails() {
        ObjectNode w = service(Stubs.failing()).dashboardWeather("Indore").block();

        assertEquals("Indore", w.get("location").asText());
        assertEquals(30, w.path("current").path("temp_c").asInt());
        assertEquals("06:30 AM", w.path("astro").path("sunrise").asText());
        assertEquals(0, w.path("forecast").size());
    }

    @Test
    void returnsFallbackOnErrorStatus() {
        ObjectNode w = service(Stubs.status(HttpStatus.UNAUTHORIZED)).terminalWeather("Nagpur").block();

        assertEquals("Nagpur", w.get("location").asText());
        assertEquals(28, w.path("current").path("temp_c").asInt());
    }

    @Test
    void mapsDashboardForecast() {
        List<ClientRequest> seen = new ArrayList<>();
        ObjectNode w = service(Stubs.json(Stubs.WEATHER_JSON, seen)).dashboardWeather("Indore").block();

        assertEquals(31.2, w.path("current").path("temp_c").asDouble());
        assertEquals("Sunny", w.path("current").path("condition").asText());
        assertEquals("05:34 AM", w.path("astro").path("sunrise").asText());
        assertEquals(2, w.path("forecast").size());
        assertEquals(64, w.path("forecast").get(1).path("daily_chance_of_rain").asInt());
        assertEquals("//cdn/rain.png", w.path("forecast").get(1).path("icon").asText());

        String query = seen.get(0).url().getQuery();
        assertTrue(seen.get(0).url().getPath().endsWith("/forecast.json"));
        assertTrue(query.contains("key=test-key"));
        assertTrue(query.contains("q=Indore"));
        assertTrue(query.contains("days=7"));
    }

    @Test
    void mapsTerminalForecastWithoutAstro() {
        ObjectNode w = service(Stubs.json(Stubs.WEATHER_JSON)).terminalWeather("Indore").block();

        assertFalse(w.has("astro"));
        assertEquals(48, w.path("current").path("humidity").asInt());
        assertEquals(2.4, w.path("forecast").get(1).path("totalprecip_mm").asDouble());
    }

    @Test
    void dashboardFallsBackWhenForecastMissing() {
        String body = "{\"location\":{\"name\":\"Indore\"},\"current\":{\"temp_c\":20},\"forecast\":{\"forecastday\":[]}}";

        ObjectNode dashboard = service(Stubs.json(body)).dashboardWeather("Indore").block();
        ObjectNode terminal = service(Stubs.json(body)).terminalWeather("Indore").block();

        assertEquals(30, dashboard.path("current").path("temp_c").asInt());
        assertEquals(20, terminal.path("current").path("temp_c").asInt());
    }
}
