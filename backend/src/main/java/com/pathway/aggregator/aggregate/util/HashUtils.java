package com.pathway.aggregator.aggregate.util;

import com.pathway.aggregator.aggregate.model.Query;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Locale;
import java.util.TreeSet;

public final class HashUtils {
    public static final String COURSES_NAMESPACE = "courses";
    public static final String JOBS_NAMESPACE = "jobs";
    public static final String JOB_TRENDS_NAMESPACE = "job-trends";

    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Same text, filters, limit and provider set (in any order) always map to the same key.
     */
    public static String queryKey(String namespace, Query query, Collection<String> providers) {
        TreeSet<String> sortedProviders = new TreeSet<>();
        if (providers != null) {
            for (String provider : providers) {
                if (provider != null && !provider.isBlank()) {
                    sortedProviders.add(provider.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        String canonical = query.kind()
            + "|q=" + query.text().toLowerCase(Locale.ROOT)
            + "|" + query.filters().canonical()
            + "|limit=" + query.limit()
            + "|providers=" + String.join(",", sortedProviders);
        return namespace + ":" + sha256Hex(canonical);
    }
}
