package com.pathway.aggregator.aggregate.model;

public enum RecordKind {
    COURSE,
    JOB
}
