package com.citationconstellation;

/**
 * Innermost heading path seen so far during one traversal.
 *
 * <p>Not a stack: a new heading overwrites its level and clears the levels below it.
 * Blank heading titles are stored as absent.
 */
final class SectionCursor {

    private String section;
    private String subsection;
    private String subsubsection;

    void enterSection(String title) {
        section = normalize(title);
        subsection = null;
        subsubsection = null;
    }

    void enterSubsection(String title) {
        subsection = normalize(title);
        subsubsection = null;
    }

    void enterSubsubsection(String title) {
        subsubsection = normalize(title);
    }

    CitationContext snapshot() {
        return new CitationContext(section, subsection, subsubsection);
    }

    private static String normalize(String title) {
        return (title == null || title.isBlank()) ? null : title;
    }
}
