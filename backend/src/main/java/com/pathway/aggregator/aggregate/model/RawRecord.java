package com.pathway.aggregator.aggregate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RawRecord(
    String provider,
    String externalId,
    RecordKind kind,
    Map<String, Object> fields,
    boolean synthetic
) {
    public RawRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public static final class Field {
        public static final String TITLE = "title";
        public static final String DESCRIPTION = "description";
        public static final String URL = "url";
        public static final String RATING = "rating";
        public static final String ENROLLMENTS = "enrollments";
        public static final String PRICE = "price";
        public static final String LEVEL = "level";
        public static final String LANGUAGE = "language";
        public static final String INSTRUCTOR = "instructor";
        public static final String SKILLS = "skills";
        public static final String COMPANY = "company";
        public static final String LOCATION = "location";
        public static final String REMOTE = "remote";
        public static final String SALARY_MIN = "salaryMin";
        public static final String SALARY_MAX = "salaryMax";
        public static final String SALARY_CURRENCY = "salaryCurrency";
        public static final String SALARY_PREDICTED = "salaryPredicted";
        public static final String POSTED = "posted";

        private Field() {
        }
    }
}
