package com.example.triage.llm;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Per-million-token rates read from a pricing table. Models the table does not list are
 * billed at the fallback rates so that cost is over-reported rather than dropped.
 */
public class Pricing {

    private static final Logger log = LoggerFactory.getLogger(Pricing.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final Rate FALLBACK_RATE = new Rate("unknown", 3.0, 15.0);
    private static final double PER_MILLION = 1_000_000.0;

    private final String version;
    private final Map<String, Rate> rates;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PricingTable(String version, Map<String, Rate> models) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Rate(String provider, double input, double output) {}

    public Pricing(Resource table) {
        PricingTable parsed = read(table);
        this.version = parsed.version();
        this.rates = parsed.models() != null ? Map.copyOf(parsed.models()) : Map.of();
    }

    private static PricingTable read(Resource table) {
        if (!table.exists()) {
            log.warn("Pricing table {} not found, every model is billed at fallback rates", table.getDescription());
            return new PricingTable(null, Map.of());
        }
        try (InputStream in = table.getInputStream()) {
            PricingTable parsed = MAPPER.readValue(in, PricingTable.class);
            log.info("Loaded pricing v{} with {} models from {}", parsed.version(),
                parsed.models() != null ? parsed.models().size() : 0, table.getDescription());
            return parsed;
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable pricing table " + table.getDescription(), e);
        }
    }

    public String version() {
        return version;
    }

    public Rate rate(String model) {
        Rate rate = rates.get(model);
        if (rate == null) {
            log.debug("No price for model {}, using fallback rates", model);
            return FALLBACK_RATE;
        }
        return rate;
    }

    /** USD cost of one call. */
    public double calculateCost(String model, int inputTokens, int outputTokens) {
        Rate rate = rate(model);
        return (inputTokens * rate.input() + outputTokens * rate.output()) / PER_MILLION;
    }
}
