package com.pathway.aggregator.aggregate.normalize;

import com.pathway.aggregator.aggregate.model.NormalizedRecord;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RawRecord.Field;
import com.pathway.aggregator.aggregate.model.RecordKind;
import com.pathway.aggregator.aggregate.model.SalaryRange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordNormalizerTest {
    private final RecordNormalizer normalizer = new RecordNormalizer();

    @Test
    void courseFieldsAreCoercedAndHtmlStripped() {
        Map<String, Object> fields = new HashMap<>();
        fields.put(Field.TITLE, "  Intro to <b>Python</b> ");
        fields.put(Field.DESCRIPTION, "<p>Learn   the basics</p>");
        fields.put(Field.RATING, "4.6");
        fields.put(Field.ENROLLMENTS, "12,500");
        fields.put(Field.PRICE, 0);
        fields.put(Field.SKILLS, List.of("python", " ", "python", "scripting"));

        NormalizedRecord record = normalizer.normalize(new RawRecord("Coursera", "abc", RecordKind.COURSE, fields, false));

        assertThat(record.id()).isEqualTo("coursera_abc");
        assertThat(record.provider()).isEqualTo("coursera");
        assertThat(record.title()).isEqualTo("Intro to Python");
        assertThat(record.description()).isEqualTo("Learn the basics");
        assertThat(record.attributes().rating()).isEqualTo(4.6);
        assertThat(record.attributes().enrollments()).isEqualTo(12_500L);
        assertThat(record.attributes().price()).isEqualTo(0.0);
        assertThat(record.attributes().skills()).containsExactly("python", "scripting");
        assertThat(record.attributes().salaryRange()).isNull();
    }

    @Test
    void missingTitleAndDescriptionGetDefaults() {
        NormalizedRecord record = normalizer.normalize(new RawRecord("udemy", "7", RecordKind.COURSE, Map.of(), false));

        assertThat(record.title()).isEqualTo("Untitled");
        assertThat(record.description()).isEmpty();
        assertThat(record.url()).isNull();
        assertThat(record.attributes().rating()).isNull();
        assertThat(record.attributes().skills()).isEmpty();
    }

    @Test
    void alreadyPrefixedIdIsKept() {
        NormalizedRecord record = normalizer.normalize(new RawRecord("edx", "edx_42", RecordKind.COURSE, Map.of(), false));
        assertThat(record.id()).isEqualTo("edx_42");
    }

    @Test
    void jobSalaryRemoteAndSkillsAreDerived() {
        Map<String, Object> fields = new HashMap<>();
        fields.put(Field.TITLE, "Backend Engineer (Remote)");
        fields.put(Field.DESCRIPTION, "We use Java, SQL and Docker. Node.js a plus.");
        fields.put(Field.SALARY_MIN, 50000);
        fields.put(Field.SALARY_PREDICTED, true);
        fields.put(Field.POSTED, "2024-04-20T08:30:00Z");

        NormalizedRecord record = normalizer.normalize(new RawRecord("adzuna", "j1", RecordKind.JOB, fields, false));

        SalaryRange salary = record.attributes().salaryRange();
        assertThat(salary.min()).isEqualTo(50_000.0);
        assertThat(salary.max()).isEqualTo(50_000.0);
        assertThat(salary.currency()).isEqualTo("USD");
        assertThat(salary.type()).isEqualTo("predicted");
        assertThat(record.attributes().remote()).isTrue();
        assertThat(record.attributes().skills()).containsExactly("node", "java", "sql", "docker");
        assertThat(record.attributes().postedAt()).isEqualTo(Instant.parse("2024-04-20T08:30:00Z"));
    }

    @Test
    void skillExtractionMatchesWholeWordsOnly() {
        Map<String, Object> fields = new HashMap<>();
        fields.put(Field.TITLE, "JavaScript developer");
        fields.put(Field.DESCRIPTION, "Maintain our email platform");

        NormalizedRecord record = normalizer.normalize(new RawRecord("github", "g1", RecordKind.JOB, fields, false));

        assertThat(record.attributes().skills()).containsExactly("javascript");
        assertThat(record.attributes().remote()).isFalse();
    }

    @Test
    void duplicatesByProviderAndExternalIdCollapseToFirst() {
        RawRecord first = new RawRecord("udemy", "1", RecordKind.COURSE, Map.of(Field.TITLE, "First"), false);
        RawRecord second = new RawRecord("UDEMY", "1", RecordKind.COURSE, Map.of(Field.TITLE, "Second"), false);
        RawRecord other = new RawRecord("edx", "1", RecordKind.COURSE, Map.of(Field.TITLE, "Other"), false);

        List<NormalizedRecord> records = normalizer.normalize(List.of(first, second, other));

        assertThat(records).extracting(NormalizedRecord::id).containsExactly("udemy_1", "edx_1");
        assertThat(records.get(0).title()).isEqualTo("First");
    }
}
