package com.citationconstellation;

import java.util.List;

/**
 * Outcome of analyzing one citing paper. Either a non-empty list of contexts
 * ({@link Status#CONTEXTS_FOUND}) or a status message explaining why there are none.
 */
public record PaperAnalysis(CitingPaper paper, Status status, String citationKey,
                            List<CitationContext> contexts, String message) {

    public enum Status {
        CONTEXTS_FOUND(null),
        SOURCE_NOT_AVAILABLE("Source not available"),
        KEY_NOT_FOUND("Citation key not found in .bib"),
        NO_IN_TEXT_CITATIONS("No in-text citations found"),
        ERROR("Error");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public PaperAnalysis {
        contexts = contexts == null ? List.of() : List.copyOf(contexts);
    }

    public static PaperAnalysis found(CitingPaper paper, String key, List<CitationContext> contexts) {
        return new PaperAnalysis(paper, Status.CONTEXTS_FOUND, key, contexts, null);
    }

    public static PaperAnalysis status(CitingPaper paper, Status status, String key) {
        return new PaperAnalysis(paper, status, key, List.of(), status.label());
    }

    public static PaperAnalysis error(CitingPaper paper, String key, String detail) {
        return new PaperAnalysis(paper, Status.ERROR, key, List.of(), Status.ERROR.label() + ": " + detail);
    }
}
