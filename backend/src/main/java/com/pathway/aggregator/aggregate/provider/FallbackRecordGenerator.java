package com.pathway.aggregator.aggregate.provider;

import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RawRecord.Field;
import com.pathway.aggregator.aggregate.model.RecordKind;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FallbackRecordGenerator {
    public static final String PROVIDER = "fallback";

    private final Clock clock;

    public FallbackRecordGenerator(Clock clock) {
        this.clock = clock;
    }

    public List<RawRecord> generate(Query query) {
        return List.of(query.kind() == RecordKind.JOB ? job(query) : course(query));
    }

    private RawRecord course(Query query) {
        String q = query.text();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Field.TITLE, "Learn " + q + " - Free Resources");
        fields.put(Field.DESCRIPTION, "Collection of free resources to learn " + q);
        fields.put(Field.INSTRUCTOR, "Community");
        fields.put(Field.LEVEL, "beginner");
        fields.put(Field.RATING, 4.0);
        fields.put(Field.PRICE, 0.0);
        fields.put(Field.SKILLS, List.of(q));
        fields.put(Field.URL, "https://freecodecamp.org/learn/" + encode(q));
        return new RawRecord(PROVIDER, "1", RecordKind.COURSE, fields, true);
    }

    private RawRecord job(Query query) {
        String q = query.text();
        String location = query.filters().location();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Field.TITLE, q + " Opportunities");
        fields.put(Field.DESCRIPTION, "Browse current openings that ask for " + q + " experience");
        fields.put(Field.LOCATION, location == null || location.isBlank() ? "Remote" : location);
        fields.put(Field.REMOTE, location == null || location.isBlank());
        fields.put(Field.SKILLS, List.of(q));
        fields.put(Field.POSTED, Instant.now(clock).toString());
        fields.put(Field.URL, "https://example.com/jobs?q=" + encode(q));
        return new RawRecord(PROVIDER, "1", RecordKind.JOB, fields, true);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
