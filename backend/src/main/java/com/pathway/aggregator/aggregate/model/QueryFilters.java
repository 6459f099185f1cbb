package com.pathway.aggregator.aggregate.model;

public record QueryFilters(
    String level,
    String location,
    Boolean remote,
    String language
) {
    public static QueryFilters none() {
        return new QueryFilters(null, null, null, null);
    }

    public static QueryFilters forCourses(String level, String language) {
        return new QueryFilters(level, null, null, language);
    }

    public static QueryFilters forJobs(String location, Boolean remote) {
        return new QueryFilters(null, location, remote, null);
    }

    public String canonical() {
        return "level=" + nullToEmpty(level)
            + "|location=" + nullToEmpty(location)
            + "|remote=" + (remote == null ? "" : remote)
            + "|language=" + nullToEmpty(language);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim().toLowerCase(java.util.Locale.ROOT);
    }
}
