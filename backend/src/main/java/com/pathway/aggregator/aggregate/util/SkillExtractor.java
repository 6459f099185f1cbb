package com.pathway.aggregator.aggregate.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class SkillExtractor {
    private static final List<String> VOCABULARY = List.of(
        "javascript", "python", "react", "node", "java", "sql",
        "aws", "docker", "kubernetes", "ml", "ai", "typescript"
    );
    private static final List<Pattern> PATTERNS = VOCABULARY.stream()
        .map(skill -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(skill) + "(?![a-z0-9])"))
        .toList();

    private SkillExtractor() {
    }

    public static List<String> fromText(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        for (int i = 0; i < VOCABULARY.size(); i++) {
            if (PATTERNS.get(i).matcher(lower).find()) {
                found.add(VOCABULARY.get(i));
            }
        }
        return found;
    }
}
