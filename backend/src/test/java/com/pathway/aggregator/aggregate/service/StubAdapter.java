package com.pathway.aggregator.aggregate.service;

import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RawRecord.Field;
import com.pathway.aggregator.aggregate.model.RecordKind;
import com.pathway.aggregator.aggregate.provider.ProviderAdapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

class StubAdapter implements ProviderAdapter {
    private final String name;
    private final RecordKind kind;
    private final boolean synthetic;
    private final BiFunction<Query, Integer, List<RawRecord>> behavior;
    final AtomicInteger lastLimit = new AtomicInteger(-1);

    StubAdapter(String name, RecordKind kind, boolean synthetic, BiFunction<Query, Integer, List<RawRecord>> behavior) {
        this.name = name;
        this.kind = kind;
        this.synthetic = synthetic;
        this.behavior = behavior;
    }

    static StubAdapter courses(String name, int count) {
        return new StubAdapter(name, RecordKind.COURSE, false, (query, limit) -> courseRecords(name, query, Math.min(count, limit)));
    }

    static List<RawRecord> courseRecords(String provider, Query query, int count) {
        List<RawRecord> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(Field.TITLE, query.text() + " course " + i + " from " + provider);
            fields.put(Field.DESCRIPTION, "About " + query.text());
            fields.put(Field.RATING, 3.0 + (i % 3) * 0.5);
            fields.put(Field.ENROLLMENTS, 1000L * i);
            fields.put(Field.URL, "https://" + provider + ".example/" + i);
            records.add(new RawRecord(provider, Integer.toString(i), RecordKind.COURSE, fields, false));
        }
        return records;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RecordKind kind() {
        return kind;
    }

    @Override
    public boolean isSynthetic() {
        return synthetic;
    }

    @Override
    public List<RawRecord> search(Query query, int limit) {
        lastLimit.set(limit);
        return behavior.apply(query, limit);
    }
}
