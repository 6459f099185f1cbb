package com.pathway.aggregator.aggregate.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathway.aggregator.aggregate.http.ProviderHttpClient;
import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RawRecord.Field;
import com.pathway.aggregator.config.AggregatorProperties;

import java.util.LinkedHashMap;
import java.util.Map;

public class EdxAdapter extends JsonProviderAdapter {
    static final String DEFAULT_BASE_URL = "https://api.edx.org/courses/v1";

    public EdxAdapter(
        String name,
        AggregatorProperties.Provider config,
        ProviderHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        super(name, config, httpClient, objectMapper);
    }

    static boolean hasCredentials(AggregatorProperties.Provider config) {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    protected String requestUrl(Query query) {
        String base = config.getBaseUrl() == null || config.getBaseUrl().isBlank() ? DEFAULT_BASE_URL : config.getBaseUrl();
        return trimTrailingSlash(base) + "/courses/";
    }

    @Override
    protected Map<String, String> queryParams(Query query, int pageSize) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("search", query.text());
        params.put("page_size", Integer.toString(pageSize));
        return params;
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of("Authorization", "Bearer " + config.getApiKey());
    }

    @Override
    protected String itemsField() {
        return "results";
    }

    @Override
    protected RawRecord toRawRecord(JsonNode item, Query query) {
        String id = text(item, "uuid");
        if (id == null) {
            id = text(item, "key");
        }
        if (id == null) {
            return null;
        }
        JsonNode owners = item.path("owners");
        String owner = owners.isArray() && owners.size() > 0 ? text(owners.get(0), "name") : null;
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Field.TITLE, text(item, "title"));
        fields.put(Field.DESCRIPTION, text(item, "short_description"));
        fields.put(Field.INSTRUCTOR, owner == null ? "edX" : owner);
        fields.put(Field.LEVEL, text(item, "level_type"));
        fields.put(Field.URL, text(item, "marketing_url"));
        return new RawRecord(name, id, kind(), fields, false);
    }
}
