package com.al.hl7generator.service.resolver;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Whole-word matching on lower-cased field names, so that "id" matches
 * "Patient ID" but not "provider".
 */
public final class SemanticMatcher {

    // compiled once per word, the word lists are fixed
    private static final Map<String, Pattern> WORD_PATTERNS = new ConcurrentHashMap<>();

    private SemanticMatcher() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static boolean hasWord(String text, String word) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return patternFor(word).matcher(text).find();
    }

    static Pattern patternFor(String word) {
        return WORD_PATTERNS.computeIfAbsent(word,
                w -> Pattern.compile("(^|[^a-z0-9])" + Pattern.quote(w) + "($|[^a-z0-9])"));
    }

    public static boolean hasAnyWord(String text, String... words) {
        for (String word : words) {
            if (hasWord(text, word)) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsAny(String text, String... fragments) {
        if (text == null) {
            return false;
        }
        for (String fragment : fragments) {
            if (text.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
