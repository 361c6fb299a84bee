package com.agripulse.backend.service;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Synthetic stand-ins used whenever a live provider fails. Every method builds a
 * fresh node, so callers may modify what they get back. Output depends only on
 * the arguments and today's date.
 */
@Component
@RequiredArgsConstructor
public class FallbackDataProvider {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static final List<String> DEFAULT_COMMODITIES = List.of("Wheat", "Rice", "Maize", "Soybean");
    public static final List<String> DEFAULT_PORTS = List.of("Mumbai Port", "Kandla", "Chennai", "Novorossiysk");

    private final Clock clock;

    /* ---------- weather ---------- */

    public ObjectNode dashboardWeather(String location) {
        ObjectNode w = NODES.objectNode();
        w.put("location", location);
        w.put("country", "India");
        ObjectNode current = w.putObject("current");
        current.put("temp_c", 30);
        current.put("condition", "Clear");
        current.put("humidity", 60);
        ObjectNode astro = w.putObject("astro");
        astro.put("sunrise", "06:30 AM");
        astro.put("sunset", "05:45 PM");
        w.putArray("forecast");
        return w;
    }

    public ObjectNode terminalWeather(String location) {
        ObjectNode w = NODES.objectNode();
        w.put("location", location);
        w.put("country", "India");
        ObjectNode current = w.putObject("current");
        current.put("temp_c", 28);
        current.put("humidity", 55);
        current.put("precip_mm", 0);
        current.put("condition", "Clear");
        w.putArray("forecast");
        return w;
    }

    /* ---------- market ---------- */

    public ArrayNode dashboardMarket(String location) {
        ArrayNode rows = NODES.arrayNode();
        rows.add(marketRow("Wheat", location, 2300));
        rows.add(marketRow("Soybean", location, 5200));
        rows.add(marketRow("Maize", location, 1850));
        return rows;
    }

    /**
     * Raw records in the upstream's own shape (prices as strings), so they go
     * through the same normalization as live data.
     */
    public ArrayNode terminalMandiRecords(String commodity) {
        String name = Names.capitalize(commodity);
        String today = LocalDate.now(clock).toString();
        ArrayNode rows = NODES.arrayNode();
        rows.add(mandiRecord("Madhya Pradesh", "Indore", name, today, "2200", "2450", "2350"));
        rows.add(mandiRecord("Maharashtra", "Nagpur", name, today, "2250", "2480", "2380"));
        return rows;
    }

    /**
     * Single normalized row used when no upstream record survives normalization.
     */
    public ObjectNode demoMarketRow(String commodity) {
        ObjectNode r = NODES.objectNode();
        r.put("state", "DemoState");
        r.put("district", "DemoDistrict");
        r.put("market", "Indore");
        r.put("commodity", Names.capitalize(commodity));
        r.put("variety", "Common");
        r.put("arrival_date", LocalDate.now(clock).toString());
        r.put("min_price", 2200.0);
        r.put("max_price", 2500.0);
        r.put("modal_price", 2350.0);
        r.put("unit", "Rs/Quintal");
        return r;
    }

    /* ---------- AI ---------- */

    public String aiSummary() {
        return "Stable weather and moderate market trends this week. Monitor rainfall and wheat prices.";
    }

    /**
     * Used when the model answered but the answer was not a JSON array.
     */
    public ArrayNode cropInsightsUnparseable() {
        ArrayNode a = NODES.arrayNode();
        a.add(cropInsight("Soybean", 90, "High demand & good rainfall"));
        a.add(cropInsight("Wheat", 85, "Rising MSP & steady market"));
        a.add(cropInsight("Maize", 78, "Stable yield & export demand"));
        return a;
    }

    /**
     * Used when the model could not be reached at all.
     */
    public ArrayNode cropInsightsUnavailable() {
        ArrayNode a = NODES.arrayNode();
        a.add(cropInsight("Wheat", 80, "Favorable conditions"));
        a.add(cropInsight("Maize", 75, "Moderate temperatures"));
        a.add(cropInsight("Soybean", 70, "Stable market rates"));
        return a;
    }

    public ObjectNode structuredInsight() {
        ObjectNode i = NODES.objectNode();
        ObjectNode rec = i.putObject("recommendation");
        rec.put("action", "HOLD");
        rec.put("confidence", 75);
        rec.put("reason", "Market stable, minor price movement expected.");
        ObjectNode yield = i.putObject("yield_outlook");
        yield.put("change_percent", "+0.0%");
        yield.putArray("factors").add("stable weather");
        i.put("price_forecast_comment", "Prices likely steady for next week.");
        ObjectNode sentiment = i.putObject("market_sentiment");
        sentiment.put("overall", "neutral");
        sentiment.putArray("keywords").add("steady").add("stable");
        ObjectNode optimal = i.putObject("optimal_market");
        optimal.putArray("sell_high");
        optimal.putArray("buy_low");
        i.put("ai_summary", "Market remains stable with no major risk detected.");
        i.put("reason", "Stable prices and normal conditions.");
        return i;
    }

    /* ---------- misc ---------- */

    public ObjectNode internationalOptions() {
        ObjectNode o = NODES.objectNode();
        DEFAULT_COMMODITIES.forEach(o.putArray("commodities")::add);
        DEFAULT_PORTS.forEach(o.putArray("ports")::add);
        return o;
    }

    public ArrayNode headlines() {
        ArrayNode news = NODES.arrayNode();
        news.add(headline("Govt raises MSP for wheat by ₹150/quintal",
                "Government increases wheat MSP to boost Rabi season earnings.", "positive"));
        news.add(headline("Rainfall expected in Northern India this weekend",
                "IMD predicts moderate rain, farmers advised to delay sowing by 2 days.", "neutral"));
        news.add(headline("Soybean exports rise 8% amid global demand",
                "Soybean prices surge as exports grow globally.", "positive"));
        return news;
    }

    private static ObjectNode marketRow(String commodity, String market, double modal) {
        ObjectNode r = NODES.objectNode();
        r.put("commodity", commodity);
        r.put("market", market);
        r.put("modal_price", modal);
        return r;
    }

    private static ObjectNode mandiRecord(String state, String market, String commodity, String date,
                                          String min, String max, String modal) {
        ObjectNode r = NODES.objectNode();
        r.put("state", state);
        r.put("district", market);
        r.put("market", market);
        r.put("commodity", commodity);
        r.put("variety", "Common");
        r.put("arrival_date", date);
        r.put("min_price", min);
        r.put("max_price", max);
        r.put("modal_price", modal);
        r.put("price_unit", "Rs/Quintal");
        return r;
    }

    private static ObjectNode cropInsight(String crop, int confidence, String reason) {
        ObjectNode c = NODES.objectNode();
        c.put("crop", crop);
        c.put("confidence", confidence);
        c.put("reason", reason);
        return c;
    }

    private static ObjectNode headline(String title, String summary, String sentiment) {
        ObjectNode h = NODES.objectNode();
        h.put("headline", title);
        h.put("summary", summary);
        h.put("sentiment", sentiment);
        return h;
    }
}
