package com.pathway.aggregator.aggregate.normalize;

import com.pathway.aggregator.aggregate.model.NormalizedRecord;
import com.pathway.aggregator.aggregate.model.RecordAttributes;
import com.pathway.aggregator.aggregate.model.RecordKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

public class RecordRanker {
    private static final Comparator<NormalizedRecord> TIE_BREAK = Comparator
        .comparing(NormalizedRecord::provider)
        .thenComparing(NormalizedRecord::id);

    public List<NormalizedRecord> rank(Collection<NormalizedRecord> records, String queryText, int limit) {
        List<NormalizedRecord> sorted = new ArrayList<>(records);
        sorted.sort(comparator(queryText));
        if (limit > 0 && sorted.size() > limit) {
            return new ArrayList<>(sorted.subList(0, limit));
        }
        return sorted;
    }

    Comparator<NormalizedRecord> comparator(String queryText) {
        String term = queryText == null ? "" : queryText.toLowerCase(Locale.ROOT).trim();
        Comparator<NormalizedRecord> byKind = Comparator.comparing(NormalizedRecord::kind);
        Comparator<NormalizedRecord> byScore = (a, b) -> {
            if (a.kind() == RecordKind.COURSE && b.kind() == RecordKind.COURSE) {
                return Double.compare(courseScore(b, term), courseScore(a, term));
            }
            if (a.kind() == RecordKind.JOB && b.kind() == RecordKind.JOB) {
                int byPosted = comparePostedDesc(a.attributes().postedAt(), b.attributes().postedAt());
                if (byPosted != 0) {
                    return byPosted;
                }
                return Integer.compare(completeness(b), completeness(a));
            }
            return 0;
        };
        return byKind.thenComparing(byScore).thenComparing(TIE_BREAK);
    }

    public static double courseScore(NormalizedRecord record, String queryText) {
        String term = queryText == null ? "" : queryText.toLowerCase(Locale.ROOT).trim();
        RecordAttributes attributes = record.attributes();
        double score = 0;
        if (!term.isEmpty() && record.title() != null && record.title().toLowerCase(Locale.ROOT).contains(term)) {
            score += 10;
        }
        if (attributes.rating() != null) {
            score += 2 * attributes.rating();
        }
        long enrollments = attributes.enrollments() == null ? 0 : Math.max(0, attributes.enrollments());
        score += 0.5 * Math.log(enrollments + 1);
        if (attributes.price() != null && attributes.price() == 0.0) {
            score += 5;
        }
        return score;
    }

    /**
     * How well a course covers {@code skill}: title 0.8, description 0.6, listed skills 0.9,
     * summed and capped at 1.0.
     */
    public static double relevanceScore(NormalizedRecord course, String skill) {
        String term = skill == null ? "" : skill.toLowerCase(Locale.ROOT).trim();
        if (term.isEmpty()) {
            return 0;
        }
        double score = 0;
        if (course.title() != null && course.title().toLowerCase(Locale.ROOT).contains(term)) {
            score += 0.8;
        }
        if (course.description() != null && course.description().toLowerCase(Locale.ROOT).contains(term)) {
            score += 0.6;
        }
        for (String listed : course.attributes().skills()) {
            if (listed != null && listed.toLowerCase(Locale.ROOT).contains(term)) {
                score += 0.9;
                break;
            }
        }
        return Math.min(1.0, score);
    }

    static int completeness(NormalizedRecord record) {
        RecordAttributes attributes = record.attributes();
        int filled = 0;
        if (record.description() != null && !record.description().isBlank()) {
            filled++;
        }
        if (record.url() != null) {
            filled++;
        }
        if (attributes.location() != null) {
            filled++;
        }
        if (attributes.salaryRange() != null) {
            filled++;
        }
        if (attributes.company() != null) {
            filled++;
        }
        if (attributes.postedAt() != null) {
            filled++;
        }
        if (attributes.remote() != null) {
            filled++;
        }
        if (!attributes.skills().isEmpty()) {
            filled++;
        }
        return filled;
    }

    private static int comparePostedDesc(Instant a, Instant b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        return b.compareTo(a);
    }
}
