package com.bloom.recommender.util;

import java.util.Locale;

/**
 * Canonical identity for content items, used to recognise the same item across sources.
 */
public final class CanonicalIds {
    private CanonicalIds() {}

    /**
     * Lower-cases and trims the URL and strips any trailing slashes.
     * Returns {@code null} when nothing usable is left.
     */
    public static String fromUrl(String url) {
        if (url == null) return null;
        String s = url.trim().toLowerCase(Locale.ROOT);
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') end--;
        s = s.substring(0, end);
        return s.isEmpty() ? null : s;
    }
}
