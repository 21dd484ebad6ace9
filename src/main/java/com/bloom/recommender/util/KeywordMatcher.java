package com.bloom.recommender.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword matching over lower-cased text.
 *
 * <p>Keywords of three characters or fewer only match as whole words ("ai" must not hit
 * "maintain", "ui" must not hit "build"); longer keywords match as plain substrings so that
 * "automation" still counts inside "automations".
 */
public final class KeywordMatcher {
    public static final int SHORT_KEYWORD_MAX_LENGTH = 3;

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private KeywordMatcher() {}

    /** Number of occurrences of the keyword in the text. */
    public static int countOccurrences(String text, String keyword) {
        if (text == null || text.isEmpty() || keyword == null || keyword.isEmpty()) return 0;
        Matcher m = patternFor(keyword).matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    /** Total occurrences of all keywords in the text. */
    public static int countAll(String text, Collection<String> keywords) {
        int total = 0;
        for (String k : keywords) total += countOccurrences(text, k);
        return total;
    }

    public static boolean contains(String text, String keyword) {
        if (text == null || text.isEmpty() || keyword == null || keyword.isEmpty()) return false;
        return patternFor(keyword).matcher(text).find();
    }

    /** Keywords present at least once, in vocabulary order. */
    public static List<String> matched(String text, Collection<String> keywords) {
        List<String> hits = new ArrayList<>();
        for (String k : keywords) {
            if (contains(text, k)) hits.add(k);
        }
        return hits;
    }

    /** Number of distinct keywords present at least once. */
    public static int countDistinct(String text, Collection<String> keywords) {
        return matched(text, keywords).size();
    }

    private static Pattern patternFor(String keyword) {
        String k = keyword.toLowerCase(Locale.ROOT);
        return PATTERNS.computeIfAbsent(k, key -> key.length() <= SHORT_KEYWORD_MAX_LENGTH
                ? Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(key) + "(?![\\p{L}\\p{N}])", Pattern.CASE_INSENSITIVE)
                : Pattern.compile(Pattern.quote(key), Pattern.CASE_INSENSITIVE));
    }
}
