package com.agripulse.backend.service;

import com.agripulse.backend.cache.SnapshotProducer;
import com.agripulse.backend.cache.TopicKey;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.TreeSet;

/**
 * Commodity and port choices for international trade, read from the first two
 * columns of a price CSV. The file is optional; without it the default lists
 * are served.
 */
@Slf4j
@Component
public class InternationalOptionsProducer implements SnapshotProducer {

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private final Path csvPath;
    private final FallbackDataProvider fallback;

    public InternationalOptionsProducer(@Value("${cache.international.csv-path:data/international_prices_synthetic_expanded_inr.csv}") String csvPath,
                                        FallbackDataProvider fallback) {
        this.csvPath = Paths.get(csvPath);
        this.fallback = fallback;
    }

    public static TopicKey topic() {
        return TopicKey.of(CacheDomains.INTERNATIONAL, CacheDomains.INTERNATIONAL_OPTIONS);
    }

    @Override
    public Mono<ObjectNode> produce(TopicKey topic) {
        return Mono.fromCallable(this::fromCsv)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(ex -> {
                    log.warn("⚠️ International CSV not available, using fallback: {}", ex.toString());
                    return Mono.just(fallback.internationalOptions());
                });
    }

    private ObjectNode fromCsv() throws IOException {
        TreeSet<String> commodities = new TreeSet<>();
        TreeSet<String> ports = new TreeSet<>();
        CsvSchema schema = CsvSchema.emptySchema().withSkipFirstDataRow(true);
        try (MappingIterator<String[]> rows = CSV.readerFor(String[].class).with(schema).readValues(csvPath.toFile())) {
            while (rows.hasNext()) {
                String[] cols = rows.next();
                if (cols.length < 2) {
                    continue;
                }
                String commodity = cols[0].trim();
                String port = cols[1].trim();
                if (!commodity.isEmpty()) commodities.add(commodity);
                if (!port.isEmpty()) ports.add(port);
            }
        }
        if (commodities.isEmpty() || ports.isEmpty()) {
            throw new IOException("no rows in " + csvPath);
        }
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        ArrayNode c = out.putArray("commodities");
        commodities.forEach(c::add);
        ArrayNode p = out.putArray("ports");
        ports.forEach(p::add);
        return out;
    }
}
