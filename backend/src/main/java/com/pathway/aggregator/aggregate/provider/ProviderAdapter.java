package com.pathway.aggregator.aggregate.provider;

import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RecordKind;

import java.util.List;

public interface ProviderAdapter {
    String name();

    RecordKind kind();

    boolean isSynthetic();

    List<RawRecord> search(Query query, int limit);
}
