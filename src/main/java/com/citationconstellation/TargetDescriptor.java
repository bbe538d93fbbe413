package com.citationconstellation;

import java.util.List;
import java.util.Locale;

/**
 * Identifies the paper whose citations are being searched for.
 *
 * <p>Every field is optional. Authors are kept in publication order with null or blank names
 * dropped; the first one drives the author+year fallback match.
 */
public record TargetDescriptor(String doi, String title, List<String> authors, String year) {

    public TargetDescriptor {
        doi = blankToNull(doi);
        title = blankToNull(title);
        authors = authors == null ? List.of() : authors.stream()
                .filter(a -> a != null && !a.isBlank())
                .map(String::trim)
                .toList();
        year = blankToNull(year);
    }

    public static TargetDescriptor ofDoi(String doi) {
        return new TargetDescriptor(doi, null, List.of(), null);
    }

    public boolean isEmpty() {
        return doi == null && title == null && authors.isEmpty() && year == null;
    }

    /**
     * Surname of the first author, lower-cased: the part before a comma ("Smith, John") or
     * the whole name otherwise. Null when there are no authors.
     */
    public String firstAuthorSurname() {
        if (authors.isEmpty()) return null;
        String first = authors.get(0);
        int comma = first.indexOf(',');
        String surname = (comma >= 0 ? first.substring(0, comma) : first).trim();
        return surname.isEmpty() ? null : surname.toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
