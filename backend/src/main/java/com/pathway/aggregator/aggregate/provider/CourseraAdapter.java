package com.pathway.aggregator.aggregate.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathway.aggregator.aggregate.http.ProviderHttpClient;
import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RawRecord.Field;
import com.pathway.aggregator.config.AggregatorProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CourseraAdapter extends JsonProviderAdapter {
    static final String DEFAULT_BASE_URL = "https://api.coursera.org/api/courses.v1";

    public CourseraAdapter(
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
        return trimTrailingSlash(base);
    }

    @Override
    protected Map<String, String> queryParams(Query query, int pageSize) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", "search");
        params.put("query", query.text());
        params.put("limit", Integer.toString(pageSize));
        return params;
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of("X-Coursera-API-Key", config.getApiKey());
    }

    @Override
    protected String itemsField() {
        return "elements";
    }

    @Override
    protected RawRecord toRawRecord(JsonNode item, Query query) {
        String id = text(item, "id");
        if (id == null) {
            return null;
        }
        String slug = text(item, "slug");
        List<String> partners = textList(item, "partnerIds");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Field.TITLE, text(item, "name"));
        fields.put(Field.DESCRIPTION, text(item, "description"));
        fields.put(Field.INSTRUCTOR, partners.isEmpty() ? "Coursera" : partners.get(0));
        fields.put(Field.LEVEL, text(item, "level"));
        fields.put(Field.RATING, number(item, "rating"));
        fields.put(Field.ENROLLMENTS, number(item, "enrollments"));
        fields.put(Field.PRICE, number(item, "price"));
        List<String> languages = textList(item, "primaryLanguages");
        fields.put(Field.LANGUAGE, languages.isEmpty() ? null : languages.get(0));
        fields.put(Field.SKILLS, textList(item, "skills"));
        fields.put(Field.URL, "https://www.coursera.org/learn/" + (slug == null ? id : slug));
        return new RawRecord(name, id, kind(), fields, false);
    }
}
