package com.agripulse.backend.service;

import com.agripulse.backend.cache.SnapshotProducer;
import com.agripulse.backend.cache.TopicKey;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Market terminal for one commodity: mandi records and weather fetched together,
 * then price summary, a 7-day forecast and the AI insight.
 */
@Slf4j
@Component
public class TerminalSnapshotProducer implements SnapshotProducer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("dd MMM yyyy, hh:mm a", Locale.ENGLISH);
    private static final double BASELINE_PRICE = 2300;
    private static final int FORECAST_DAYS = 7;

    private final MandiService mandiService;
    private final WeatherService weatherService;
    private final InsightService insightService;
    private final FallbackDataProvider fallback;
    private final Clock clock;
    private final String defaultLocation;
    private final int defaultHarvestDays;
    private final Random random = new Random();

    public TerminalSnapshotProducer(MandiService mandiService,
                                    WeatherService weatherService,
                                    InsightService insightService,
                                    FallbackDataProvider fallback,
                                    Clock clock,
                                    @Value("${cache.terminal.location:Indore}") String defaultLocation,
                                    @Value("${cache.terminal.harvest-days:53}") int defaultHarvestDays) {
        this.mandiService = mandiService;
        this.weatherService = weatherService;
        this.insightService = insightService;
        this.fallback = fallback;
        this.clock = clock;
        this.defaultLocation = defaultLocation;
        this.defaultHarvestDays = defaultHarvestDays;
    }

    public static TopicKey topic(String commodity) {
        return TopicKey.of(CacheDomains.TERMINAL, commodity);
    }

    public String defaultLocation() {
        return defaultLocation;
    }

    public int defaultHarvestDays() {
        return defaultHarvestDays;
    }

    /**
     * True when a request asks for exactly what the cached entry holds.
     */
    public boolean isDefault(String location, int harvestDays) {
        return harvestDays == defaultHarvestDays && defaultLocation.equalsIgnoreCase(location.trim());
    }

    @Override
    public Mono<ObjectNode> produce(TopicKey topic) {
        return assemble(topic.param(), defaultHarvestDays, defaultLocation);
    }

    public Mono<ObjectNode> assemble(String commodity, int harvestDays, String location) {
        String name = Names.capitalize(commodity);
        return Mono.zip(mandiService.terminalRecords(commodity), weatherService.terminalWeather(location))
                .flatMap(data -> {
                    ArrayNode marketData = MandiService.normalize(data.getT1(), commodity);
                    if (marketData.isEmpty()) {
                        marketData.add(fallback.demoMarketRow(commodity));
                    }
                    ObjectNode weather = data.getT2();
                    List<Double> prices = modalPrices(marketData);
                    ObjectNode summary = summary(name, prices);
                    ArrayNode forecast = priceForecast(prices, LocalDate.now(clock), FORECAST_DAYS, random);

                    return insightService.terminalInsight(name, marketData, summary, forecast, harvestDays, weather)
                            .map(insight -> {
                                ObjectNode out = NODES.objectNode();
                                out.put("timestamp", LocalDateTime.now(clock).format(STAMP));
                                out.put("commodity", name);
                                out.put("location", location);
                                out.put("harvest_days", harvestDays);
                                out.set("summary", summary);
                                out.set("market_data", marketData);
                                out.set("price_forecast", forecast);
                                out.set("recommendation", insight.get("recommendation"));
                                out.set("yield_outlook", insight.get("yield_outlook"));
                                out.set("price_forecast_comment", insight.get("price_forecast_comment"));
                                out.set("market_sentiment", insight.get("market_sentiment"));
                                out.set("optimal_market", insight.get("optimal_market"));
                                out.set("ai_summary", insight.get("ai_summary"));
                                out.set("ai_reason", insight.get("reason"));
                                log.info("✅ Built {} terminal ({} markets)", name, marketData.size());
                                return out;
                            });
                });
    }

    static List<Double> modalPrices(JsonNode marketData) {
        List<Double> prices = new ArrayList<>();
        for (JsonNode row : marketData) {
            JsonNode modal = row.get("modal_price");
            if (modal != null && modal.isNumber() && modal.doubleValue() != 0) {
                prices.add(modal.doubleValue());
            }
        }
        return prices;
    }

    static ObjectNode summary(String commodity, List<Double> prices) {
        ObjectNode s = NODES.objectNode();
        s.put("commodity", commodity);
        if (prices.isEmpty()) {
            s.put("average_price", BASELINE_PRICE);
            s.put("highest_price", 0.0);
            s.put("lowest_price", 0.0);
            return s;
        }
        double mean = prices.stream().mapToDouble(Double::doubleValue).average().orElse(BASELINE_PRICE);
        s.put("average_price", round2(mean));
        s.put("highest_price", Collections.max(prices));
        s.put("lowest_price", Collections.min(prices));
        return s;
    }

    /**
     * Flat forecast around the median modal price with +/-50 jitter per day.
     */
    static ArrayNode priceForecast(List<Double> prices, LocalDate today, int days, Random random) {
        double baseline = prices.isEmpty() ? BASELINE_PRICE : median(prices);
        ArrayNode out = NODES.arrayNode();
        for (int i = 1; i <= days; i++) {
            ObjectNode day = out.addObject();
            day.put("date", today.plusDays(i).toString());
            day.put("forecast_price", round2(baseline + (random.nextDouble() * 100 - 50)));
        }
        return out;
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();
        return n % 2 == 1 ? sorted.get(n / 2) : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
