package com.pathway.aggregator.aggregate.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathway.aggregator.aggregate.http.ProviderHttpClient;
import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RawRecord.Field;
import com.pathway.aggregator.config.AggregatorProperties;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

public class UdemyAdapter extends JsonProviderAdapter {
    static final String DEFAULT_BASE_URL = "https://www.udemy.com/api-2.0";
    private static final String SITE_URL = "https://www.udemy.com";

    public UdemyAdapter(
        String name,
        AggregatorProperties.Provider config,
        ProviderHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        super(name, config, httpClient, objectMapper);
    }

    static boolean hasCredentials(AggregatorProperties.Provider config) {
        return config.getClientId() != null && !config.getClientId().isBlank()
            && config.getClientSecret() != null && !config.getClientSecret().isBlank();
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
        String level = query.filters().level();
        if (level != null && !"all".equalsIgnoreCase(level)) {
            params.put("instructional_level", level);
        }
        params.put("language", query.filters().language());
        return params;
    }

    @Override
    protected Map<String, String> headers() {
        String credentials = config.getClientId() + ":" + config.getClientSecret();
        String encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        return Map.of("Authorization", "Basic " + encoded);
    }

    @Override
    protected String itemsField() {
        return "results";
    }

    @Override
    protected RawRecord toRawRecord(JsonNode item, Query query) {
        String id = text(item, "id");
        if (id == null) {
            return null;
        }
        JsonNode instructors = item.path("visible_instructors");
        String instructor = instructors.isArray() && instructors.size() > 0
            ? text(instructors.get(0), "title")
            : null;
        Object rating = number(item, "rating");
        if (rating == null) {
            rating = number(item, "avg_rating_recent");
        }
        String path = text(item, "url");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Field.TITLE, text(item, "title"));
        fields.put(Field.DESCRIPTION, text(item, "headline"));
        fields.put(Field.INSTRUCTOR, instructor == null ? "Udemy Instructor" : instructor);
        fields.put(Field.LEVEL, text(item, "instructional_level_simple"));
        fields.put(Field.RATING, rating);
        fields.put(Field.ENROLLMENTS, number(item, "num_subscribers"));
        fields.put(Field.PRICE, number(item.path("price_detail"), "amount"));
        fields.put(Field.URL, path == null ? null : (path.startsWith("http") ? path : SITE_URL + path));
        return new RawRecord(name, id, kind(), fields, false);
    }
}
