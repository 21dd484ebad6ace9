package com.bloom.recommender.service.content;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts linked entries from awesome-list style README markdown.
 *
 * <p>Recognised entries are list items of the form {@code - [Name](url) - Description} or
 * {@code - [Name](url): Description} (bullets {@code -} or {@code *}, optional bold around the
 * link). The nearest preceding {@code ##} or {@code ###} header becomes the entry's section.
 */
public final class CuratedListParser {
    private CuratedListParser() {}

    static final String DEFAULT_SECTION = "General";

    private static final Pattern HEADER = Pattern.compile("^#{2,3}\\s+(.+)$");
    private static final Pattern DASH_ENTRY = Pattern.compile(
            "^[\\s\\-*]+\\**\\[([^\\]]+)\\]\\(([^)]+)\\)\\**\\s*[-–—]\\s*(.+)$");
    private static final Pattern COLON_ENTRY = Pattern.compile(
            "^[\\s\\-*]+\\**\\[([^\\]]+)\\]\\(([^)]+)\\)\\**:\\s*(.+)$");

    public static List<Entry> parse(String markdown) {
        List<Entry> out = new ArrayList<>();
        if (markdown == null || markdown.isEmpty()) return out;
        String section = DEFAULT_SECTION;
        for (String line : markdown.split("\\r?\\n")) {
            Matcher h = HEADER.matcher(line);
            if (h.matches()) {
                section = h.group(1).trim();
                continue;
            }
            Matcher m = DASH_ENTRY.matcher(line);
            if (!m.matches()) {
                m = COLON_ENTRY.matcher(line);
                if (!m.matches()) continue;
            }
            out.add(new Entry(m.group(1).trim(), m.group(2).trim(), m.group(3).trim(), section));
        }
        return out;
    }

    /** One linked entry of a curated list. */
    public static final class Entry {
        private final String name;
        private final String url;
        private final String description;
        private final String section;

        public Entry(String name, String url, String description, String section) {
            this.name = name;
            this.url = url;
            this.description = description;
            this.section = section;
        }

        public String getName() { return name; }
        public String getUrl() { return url; }
        public String getDescription() { return description; }
        public String getSection() { return section; }
    }
}
