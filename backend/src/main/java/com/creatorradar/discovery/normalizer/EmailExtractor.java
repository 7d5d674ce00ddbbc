package com.creatorradar.discovery.normalizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Permissive email extraction from free text (biographies) and mailto links. Results are lowercased and
 * deduplicated in order of appearance.
 */
public final class EmailExtractor {

    private static final Pattern EMAIL = Pattern.compile("[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}",
            Pattern.CASE_INSENSITIVE);

    private EmailExtractor() {
    }

    public static List<String> fromText(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        Matcher m = EMAIL.matcher(text);
        while (m.find()) {
            found.add(trimTrailingDots(m.group()).toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(found);
    }

    /**
     * Emails from {@code mailto:} links, query string dropped.
     */
    public static List<String> fromLinks(List<String> links) {
        if (links == null || links.isEmpty()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        for (String link : links) {
            if (link == null) {
                continue;
            }
            String trimmed = link.trim();
            if (trimmed.regionMatches(true, 0, "mailto:", 0, 7)) {
                String address = trimmed.substring(7);
                int q = address.indexOf('?');
                if (q >= 0) {
                    address = address.substring(0, q);
                }
                found.addAll(fromText(address));
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Union of both sources, text first.
     */
    public static List<String> extract(String text, List<String> links) {
        Set<String> all = new LinkedHashSet<>(fromText(text));
        all.addAll(fromLinks(links));
        return new ArrayList<>(all);
    }

    private static String trimTrailingDots(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '.') {
            end--;
        }
        return s.substring(0, end);
    }
}
