package com.agripulse.backend.service;

import com.agripulse.backend.cache.SnapshotProducer;
import com.agripulse.backend.cache.TopicKey;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Dashboard for one location: weather and mandi prices fetched together, then the
 * AI summary and crop insights generated together from them.
 */
@Component
@RequiredArgsConstructor
public class DashboardSnapshotProducer implements SnapshotProducer {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);

    private final WeatherService weatherService;
    private final MandiService mandiService;
    private final InsightService insightService;
    private final FallbackDataProvider fallback;
    private final Clock clock;

    public static TopicKey topic(String location) {
        return TopicKey.of(CacheDomains.DASHBOARD, location);
    }

    @Override
    public Mono<ObjectNode> produce(TopicKey topic) {
        return snapshot(Names.titleCase(topic.param()));
    }

    public Mono<ObjectNode> snapshot(String location) {
        ArrayNode news = fallback.headlines();
        return Mono.zip(weatherService.dashboardWeather(location), mandiService.dashboardPrices(location))
                .flatMap(data -> {
                    ObjectNode weather = data.getT1();
                    ArrayNode market = data.getT2();
                    return Mono.zip(
                                    insightService.dashboardSummary(location, weather, market, news),
                                    insightService.cropInsights(location, weather, market))
                            .map(ai -> {
                                ObjectNode out = JsonNodeFactory.instance.objectNode();
                                out.put("date", LocalDate.now(clock).format(DATE));
                                out.put("location", location);
                                out.set("weather", weather);
                                out.set("market_data", market);
                                out.set("news", news);
                                out.put("ai_summary", ai.getT1());
                                out.set("ai_crop_insights", ai.getT2());
                                return out;
                            });
                });
    }
}
