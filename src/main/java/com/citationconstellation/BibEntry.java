package com.citationconstellation;

import java.util.Map;

/**
 * One bibliography record.
 *
 * <p>Entries read from a {@code .bib} file carry their fields; entries read from a {@code .bbl}
 * file only carry the normalized rendered text of the item ({@code fields} is empty).
 */
public record BibEntry(String key, String type, Map<String, String> fields, String freeText) {

    public BibEntry {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static BibEntry ofItem(String key, String normalizedText) {
        return new BibEntry(key, "bibitem", Map.of(), normalizedText);
    }

    public boolean isStructured() {
        return freeText == null;
    }

    /**
     * Returns the field value, or an empty string when the entry has no such field.
     */
    public String field(String name) {
        return fields.getOrDefault(name, "");
    }

    /**
     * Text searched by the matcher: for structured entries title, author, year and doi joined
     * by spaces; for free-text items the normalized item text.
     */
    public String candidateText() {
        if (!isStructured()) {
            return freeText;
        }
        return field("title") + " " + field("author") + " " + field("year") + " " + field("doi");
    }
}
