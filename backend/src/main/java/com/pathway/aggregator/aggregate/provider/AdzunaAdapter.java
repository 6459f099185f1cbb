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

public class AdzunaAdapter extends JsonProviderAdapter {
    static final String DEFAULT_BASE_URL = "https://api.adzuna.com/v1/api/jobs";
    private static final int SEARCH_RADIUS_KM = 25;

    public AdzunaAdapter(
        String name,
        AggregatorProperties.Provider config,
        ProviderHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        super(name, config, httpClient, objectMapper);
    }

    static boolean hasCredentials(AggregatorProperties.Provider config) {
        return config.getAppId() != null && !config.getAppId().isBlank()
            && config.getAppKey() != null && !config.getAppKey().isBlank();
    }

    @Override
    protected String requestUrl(Query query) {
        String base = config.getBaseUrl() == null || config.getBaseUrl().isBlank() ? DEFAULT_BASE_URL : config.getBaseUrl();
        return trimTrailingSlash(base) + "/" + config.getCountry() + "/search/1";
    }

    @Override
    protected Map<String, String> queryParams(Query query, int pageSize) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("app_id", config.getAppId());
        params.put("app_key", config.getAppKey());
        params.put("what", query.text());
        params.put("where", query.filters().location());
        params.put("results_per_page", Integer.toString(pageSize));
        params.put("content-type", "application/json");
        params.put("distance", Integer.toString(SEARCH_RADIUS_KM));
        return params;
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of();
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
        JsonNode location = item.path("location");
        String locationText = text(location, "display_name");
        if (locationText == null) {
            List<String> area = textList(location, "area");
            locationText = area.isEmpty() ? null : String.join(", ", area);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Field.TITLE, text(item, "title"));
        fields.put(Field.DESCRIPTION, text(item, "description"));
        fields.put(Field.COMPANY, text(item.path("company"), "display_name"));
        fields.put(Field.LOCATION, locationText);
        fields.put(Field.REMOTE, query.filters().remote());
        fields.put(Field.SALARY_MIN, number(item, "salary_min"));
        fields.put(Field.SALARY_MAX, number(item, "salary_max"));
        fields.put(Field.SALARY_CURRENCY, text(item, "salary_currency"));
        fields.put(Field.SALARY_PREDICTED, "1".equals(text(item, "salary_is_predicted")));
        fields.put(Field.POSTED, text(item, "created"));
        fields.put(Field.URL, text(item, "redirect_url"));
        return new RawRecord(name, id, kind(), fields, false);
    }
}
