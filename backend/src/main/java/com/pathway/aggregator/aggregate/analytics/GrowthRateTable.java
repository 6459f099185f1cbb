package com.pathway.aggregator.aggregate.analytics;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class GrowthRateTable {
    public static final String DEFAULT_RESOURCE = "analytics/growth-rates.csv";
    public static final double DEFAULT_GROWTH_RATE_PERCENT = 10.0;
    private static final Logger log = LoggerFactory.getLogger(GrowthRateTable.class);

    private final Map<String, Double> ratesBySkill;
    private final double defaultRate;

    public GrowthRateTable(Map<String, Double> ratesBySkill, double defaultRate) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        ratesBySkill.forEach((skill, rate) -> normalized.put(normalize(skill), rate));
        this.ratesBySkill = Collections.unmodifiableMap(normalized);
        this.defaultRate = defaultRate;
    }

    public static GrowthRateTable fromClasspath(String resource) {
        ClassLoader loader = GrowthRateTable.class.getClassLoader();
        try (InputStream stream = loader.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new IllegalStateException("Growth rate table not found on classpath: " + resource);
            }
            return fromCsv(new InputStreamReader(stream, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read growth rate table " + resource, e);
        }
    }

    static GrowthRateTable fromCsv(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setCommentMarker('#')
            .build();
        Map<String, Double> rates = new LinkedHashMap<>();
        try (CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                String skill = record.get("skill");
                String rate = record.get("growth_rate_percent");
                if (skill == null || skill.isBlank() || rate == null || rate.isBlank()) {
                    continue;
                }
                try {
                    rates.put(skill, Double.parseDouble(rate));
                } catch (NumberFormatException e) {
                    log.warn("Skipping growth rate row {}: '{}' is not a number", record.getRecordNumber(), rate);
                }
            }
        }
        return new GrowthRateTable(rates, DEFAULT_GROWTH_RATE_PERCENT);
    }

    public double rateFor(String skill) {
        return ratesBySkill.getOrDefault(normalize(skill), defaultRate);
    }

    public int size() {
        return ratesBySkill.size();
    }

    private static String normalize(String skill) {
        return skill == null ? "" : skill.trim().toLowerCase(Locale.ROOT);
    }
}
