package com.citationconstellation;

import java.util.ArrayList;
import java.util.List;

/**
 * Heading path in effect where a citation occurs. Each level is null when no such heading was
 * open.
 */
public record CitationContext(String section, String subsection, String subsubsection) {

    public static final String UNKNOWN_SECTION = "Unknown Section";

    public static final String SEPARATOR = " > ";

    /**
     * Non-absent levels joined with {@code " > "}, e.g. "Introduction > Prior work", or
     * {@value #UNKNOWN_SECTION} when no heading was open.
     */
    public String displayPath() {
        List<String> parts = new ArrayList<>(3);
        if (section != null) parts.add(section);
        if (subsection != null) parts.add(subsection);
        if (subsubsection != null) parts.add(subsubsection);
        return parts.isEmpty() ? UNKNOWN_SECTION : String.join(SEPARATOR, parts);
    }

    @Override
    public String toString() {
        return displayPath();
    }
}
