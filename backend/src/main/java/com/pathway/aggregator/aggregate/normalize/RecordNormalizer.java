package com.pathway.aggregator.aggregate.normalize;

import com.pathway.aggregator.aggregate.model.NormalizedRecord;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RawRecord.Field;
import com.pathway.aggregator.aggregate.model.RecordAttributes;
import com.pathway.aggregator.aggregate.model.RecordKind;
import com.pathway.aggregator.aggregate.model.SalaryRange;
import com.pathway.aggregator.aggregate.util.SkillExtractor;
import org.jsoup.Jsoup;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public class RecordNormalizer {
    private static final Pattern REMOTE = Pattern.compile("\\bremote\\b", Pattern.CASE_INSENSITIVE);
    private static final String DEFAULT_CURRENCY = "USD";
    private static final String UNTITLED = "Untitled";

    public List<NormalizedRecord> normalize(Collection<RawRecord> rawRecords) {
        Map<String, RawRecord> unique = new LinkedHashMap<>();
        if (rawRecords != null) {
            for (RawRecord raw : rawRecords) {
                if (raw == null || raw.provider() == null || raw.externalId() == null) {
                    continue;
                }
                unique.putIfAbsent(raw.provider().toLowerCase(Locale.ROOT) + "\u0000" + raw.externalId(), raw);
            }
        }
        Map<String, NormalizedRecord> byId = new LinkedHashMap<>();
        for (RawRecord raw : unique.values()) {
            NormalizedRecord record = normalize(raw);
            byId.putIfAbsent(record.id(), record);
        }
        return new ArrayList<>(byId.values());
    }

    public NormalizedRecord normalize(RawRecord raw) {
        String provider = raw.provider().toLowerCase(Locale.ROOT);
        String title = cleanText(raw.field(Field.TITLE));
        String description = cleanText(raw.field(Field.DESCRIPTION));
        RecordAttributes attributes = raw.kind() == RecordKind.JOB
            ? jobAttributes(raw, title, description)
            : courseAttributes(raw);
        return new NormalizedRecord(
            recordId(provider, raw.externalId()),
            raw.kind(),
            title == null ? UNTITLED : title,
            description == null ? "" : description,
            provider,
            attributes,
            asString(raw.field(Field.URL)),
            raw.synthetic()
        );
    }

    static String recordId(String provider, String externalId) {
        String prefix = provider + "_";
        String trimmed = externalId.trim();
        return trimmed.startsWith(prefix) ? trimmed : prefix + trimmed;
    }

    private RecordAttributes courseAttributes(RawRecord raw) {
        return new RecordAttributes(
            asDouble(raw.field(Field.RATING)),
            asLong(raw.field(Field.ENROLLMENTS)),
            asDouble(raw.field(Field.PRICE)),
            null,
            asString(raw.field(Field.LOCATION)),
            asBoolean(raw.field(Field.REMOTE)),
            asStringList(raw.field(Field.SKILLS)),
            asString(raw.field(Field.LEVEL)),
            asString(raw.field(Field.LANGUAGE)),
            asString(raw.field(Field.INSTRUCTOR)),
            null,
            asInstant(raw.field(Field.POSTED))
        );
    }

    private RecordAttributes jobAttributes(RawRecord raw, String title, String description) {
        List<String> skills = asStringList(raw.field(Field.SKILLS));
        if (skills.isEmpty()) {
            skills = SkillExtractor.fromText(joinNonNull(title, description));
        }
        boolean remote = Boolean.TRUE.equals(asBoolean(raw.field(Field.REMOTE)))
            || REMOTE.matcher(joinNonNull(title, description)).find();
        String location = asString(raw.field(Field.LOCATION));
        return new RecordAttributes(
            null,
            null,
            null,
            salaryRange(raw),
            location,
            remote,
            skills,
            asString(raw.field(Field.LEVEL)),
            asString(raw.field(Field.LANGUAGE)),
            null,
            asString(raw.field(Field.COMPANY)),
            asInstant(raw.field(Field.POSTED))
        );
    }

    static SalaryRange salaryRange(RawRecord raw) {
        Double min = positive(asDouble(raw.field(Field.SALARY_MIN)));
        Double max = positive(asDouble(raw.field(Field.SALARY_MAX)));
        if (min == null && max == null) {
            return null;
        }
        String currency = asString(raw.field(Field.SALARY_CURRENCY));
        String type = Boolean.TRUE.equals(asBoolean(raw.field(Field.SALARY_PREDICTED))) ? "predicted" : "stated";
        return new SalaryRange(
            min != null ? min : max,
            max != null ? max : min,
            currency == null ? DEFAULT_CURRENCY : currency.toUpperCase(Locale.ROOT),
            type
        );
    }

    private static Double positive(Double value) {
        return value == null || value <= 0 ? null : value;
    }

    static String cleanText(Object value) {
        String text = asString(value);
        if (text == null) {
            return null;
        }
        if (text.indexOf('<') >= 0) {
            text = Jsoup.parse(text).text();
        }
        text = text.replaceAll("\\s+", " ").trim();
        return text.isEmpty() ? null : text;
    }

    static String asString(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    static Double asDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        String text = asString(value);
        if (text == null) {
            return null;
        }
        try {
            double d = Double.parseDouble(text.replace(",", ""));
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Long asLong(Object value) {
        Double d = asDouble(value);
        return d == null ? null : Math.round(d);
    }

    static Boolean asBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = asString(value);
        if (text == null) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("1") || lower.equals("yes")) {
            return true;
        }
        if (lower.equals("false") || lower.equals("0") || lower.equals("no")) {
            return false;
        }
        return null;
    }

    static Instant asInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        String text = asString(value);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    static List<String> asStringList(Object value) {
        if (!(value instanceof Collection<?> collection)) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (Object item : collection) {
            String text = asString(item);
            if (text != null) {
                out.add(text);
            }
        }
        return new ArrayList<>(out);
    }

    private static String joinNonNull(String a, String b) {
        return (a == null ? "" : a) + " " + (b == null ? "" : b);
    }
}
