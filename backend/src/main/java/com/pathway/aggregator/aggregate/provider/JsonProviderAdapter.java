package com.pathway.aggregator.aggregate.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathway.aggregator.aggregate.http.ProviderHttpClient;
import com.pathway.aggregator.aggregate.model.HttpFetchResult;
import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RecordKind;
import com.pathway.aggregator.aggregate.util.ProviderFailureReasons;
import com.pathway.aggregator.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public abstract class JsonProviderAdapter implements ProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(JsonProviderAdapter.class);
    protected static final int MAX_PAGE_SIZE = 50;

    protected final String name;
    protected final AggregatorProperties.Provider config;
    private final ProviderHttpClient httpClient;
    private final ObjectMapper objectMapper;

    protected JsonProviderAdapter(
        String name,
        AggregatorProperties.Provider config,
        ProviderHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        this.name = name;
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RecordKind kind() {
        return config.getKind();
    }

    @Override
    public boolean isSynthetic() {
        return false;
    }

    @Override
    public List<RawRecord> search(Query query, int limit) {
        int pageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
        HttpFetchResult fetch = httpClient.getJson(requestUrl(query), queryParams(query, pageSize), headers());
        if (!fetch.isSuccessful() || fetch.body() == null || fetch.body().isBlank()) {
            String reason = ProviderFailureReasons.fromFetch(fetch);
            throw new ProviderException(name, reason, describe(fetch));
        }
        JsonNode items;
        try {
            items = objectMapper.readTree(fetch.body()).path(itemsField());
        } catch (JsonProcessingException e) {
            throw new ProviderException(name, ProviderFailureReasons.MALFORMED_PAYLOAD, e.getOriginalMessage(), e);
        }
        if (!items.isArray()) {
            throw new ProviderException(name, ProviderFailureReasons.MALFORMED_PAYLOAD, "missing '" + itemsField() + "' array");
        }
        List<RawRecord> records = new ArrayList<>();
        for (JsonNode item : items) {
            if (records.size() >= limit) {
                break;
            }
            RawRecord record = toRawRecord(item, query);
            if (record != null) {
                records.add(record);
            }
        }
        log.debug("{} returned {} listings for '{}' in {} ms", name, records.size(), query.text(), fetch.duration().toMillis());
        return records;
    }

    protected abstract String requestUrl(Query query);

    protected abstract Map<String, String> queryParams(Query query, int pageSize);

    protected abstract Map<String, String> headers();

    protected abstract String itemsField();

    protected abstract RawRecord toRawRecord(JsonNode item, Query query);

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    protected static Object number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isTextual() && !value.asText().isBlank()) {
            return value.asText().trim();
        }
        return null;
    }

    protected static List<String> textList(JsonNode node, String field) {
        JsonNode values = node.path(field);
        if (!values.isArray()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (JsonNode value : values) {
            String text = value.isObject() ? text(value, "name") : value.asText(null);
            if (text != null && !text.isBlank()) {
                out.add(text.trim());
            }
        }
        return out;
    }

    protected static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String value = url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static String describe(HttpFetchResult fetch) {
        if (fetch.errorMessage() != null) {
            return fetch.errorMessage();
        }
        return "status=" + fetch.statusCode() + " url=" + fetch.requestedUrl();
    }
}
