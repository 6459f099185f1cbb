package com.pathway.aggregator.aggregate.provider;

import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RawRecord.Field;
import com.pathway.aggregator.aggregate.model.RecordKind;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class SyntheticAdapter implements ProviderAdapter {
    public static final String SAMPLE_LABEL = "[Sample data] ";
    static final int MAX_VARIANTS = 3;
    static final int MAX_JOB_LISTINGS = 50;

    private static final String[] COURSE_VARIANT_TITLES = {"%s", "%s: Hands-on Projects", "%s: Exam Preparation"};
    private static final String[] JOB_LOCATIONS = {"San Francisco, CA", "New York, NY", "Remote"};
    private static final String[] JOB_COMPANIES = {"TechCorp Inc.", "DataWorks Ltd.", "CloudNine Labs"};
    private static final String[] JOB_SENIORITY = {"Senior", "Mid-level", "Junior"};

    private final String name;
    private final RecordKind kind;
    private final Clock clock;

    public SyntheticAdapter(String name, RecordKind kind, Clock clock) {
        this.name = name;
        this.kind = kind;
        this.clock = clock;
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
        return true;
    }

    @Override
    public List<RawRecord> search(Query query, int limit) {
        int count = kind == RecordKind.JOB
            ? Math.max(0, Math.min(limit, MAX_JOB_LISTINGS))
            : Math.max(0, Math.min(limit, MAX_VARIANTS));
        List<RawRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(kind == RecordKind.JOB ? job(query, i) : course(query, i));
        }
        return records;
    }

    private RawRecord course(Query query, int variant) {
        String q = query.text();
        CourseTemplate template = CourseTemplate.forProvider(name, q, query.filters().level());
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Field.TITLE, String.format(Locale.ROOT, COURSE_VARIANT_TITLES[variant], template.title()));
        fields.put(Field.DESCRIPTION, SAMPLE_LABEL + template.description());
        fields.put(Field.INSTRUCTOR, template.instructor());
        fields.put(Field.LEVEL, template.level());
        fields.put(Field.RATING, template.rating() == null ? null : round1(template.rating() - 0.1 * variant));
        fields.put(Field.ENROLLMENTS, template.enrollments() == null ? null : template.enrollments() / (variant + 1));
        fields.put(Field.PRICE, template.price());
        fields.put(Field.LANGUAGE, query.filters().language() == null ? "en" : query.filters().language());
        fields.put(Field.SKILLS, List.of(q, template.extraSkill()));
        fields.put(Field.URL, template.url() + (variant == 0 ? "" : "-" + (variant + 1)));
        return new RawRecord(name, slug(q) + "_" + (variant + 1), RecordKind.COURSE, fields, true);
    }

    private RawRecord job(Query query, int index) {
        String q = query.text();
        int variant = index % MAX_VARIANTS;
        long salaryBase = 120_000L - 25_000L * variant;
        String location = query.filters().location() == null || query.filters().location().isBlank()
            ? JOB_LOCATIONS[variant]
            : query.filters().location();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Field.TITLE, JOB_SENIORITY[variant] + " " + q + " Developer");
        fields.put(Field.DESCRIPTION, SAMPLE_LABEL + "We're looking for an experienced " + q + " developer to join "
            + JOB_COMPANIES[variant] + ".");
        fields.put(Field.COMPANY, JOB_COMPANIES[variant]);
        fields.put(Field.LOCATION, location);
        fields.put(Field.REMOTE, variant == 0 || "Remote".equals(location) || Boolean.TRUE.equals(query.filters().remote()));
        fields.put(Field.SALARY_MIN, salaryBase);
        fields.put(Field.SALARY_MAX, salaryBase + 40_000L);
        fields.put(Field.SALARY_CURRENCY, "USD");
        fields.put(Field.SKILLS, List.of(q, "communication skills", "teamwork"));
        fields.put(Field.POSTED, Instant.now(clock).minus(Duration.ofDays(index + 1L)).toString());
        fields.put(Field.URL, "https://example.com/jobs/" + slug(q) + "-developer" + (index == 0 ? "" : "-" + (index + 1)));
        return new RawRecord(name, slug(q) + "_" + (index + 1), RecordKind.JOB, fields, true);
    }

    static String slug(String text) {
        String lower = text.toLowerCase(Locale.ROOT).trim();
        String slug = lower.replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return slug.isEmpty() ? "query" : slug;
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private record CourseTemplate(
        String title,
        String description,
        String instructor,
        String level,
        Double rating,
        Long enrollments,
        Double price,
        String extraSkill,
        String url
    ) {
        static CourseTemplate forProvider(String provider, String q, String requestedLevel) {
            String level = requestedLevel == null || requestedLevel.isBlank() ? "all" : requestedLevel;
            String slug = slug(q);
            return switch (provider.toLowerCase(Locale.ROOT)) {
                case "coursera" -> new CourseTemplate(
                    "Complete " + q + " Course",
                    "Learn " + q + " from industry experts with hands-on projects",
                    "Stanford University", "intermediate", 4.7, 125_000L, 79.0,
                    "problem solving", "https://coursera.org/learn/" + slug);
                case "udemy" -> new CourseTemplate(
                    q + " Masterclass: From Beginner to Advanced",
                    "Master " + q + " with practical examples and real-world projects",
                    "Tech Expert", level, 4.5, 89_000L, 89.99,
                    "hands-on learning", "https://udemy.com/course/" + slug);
                case "edx" -> new CourseTemplate(
                    "Introduction to " + q,
                    "Comprehensive introduction to " + q + " concepts and applications",
                    "MIT", "beginner", 4.6, 67_000L, 0.0,
                    "theoretical foundation", "https://edx.org/course/" + slug);
                case "nptel" -> new CourseTemplate(
                    q + " by NPTEL",
                    "NPTEL course for " + q,
                    "NPTEL Faculty", "all", null, null, 0.0,
                    "lecture series",
                    "https://nptel.ac.in/courses/search?query=" + URLEncoder.encode(q, StandardCharsets.UTF_8) + "&ref=" + slug);
                default -> new CourseTemplate(
                    q + " Essentials",
                    "Self-paced " + q + " course",
                    provider, level, 4.0, 10_000L, 0.0,
                    "self-study", "https://example.com/courses/" + provider + "/" + slug);
            };
        }
    }
}
