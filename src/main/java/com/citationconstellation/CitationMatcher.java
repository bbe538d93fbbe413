package com.citationconstellation;

import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a bibliography record refers to the target paper.
 *
 * <p>Rules are tried in order and the first satisfied one wins:
 * <ol>
 *   <li>DOI: the target DOI occurs in the candidate DOI field or anywhere in its text</li>
 *   <li>Title: the first 50 characters of the target title occur in the candidate title
 *       (braces removed) or anywhere in its text</li>
 *   <li>Author+year: the first author's surname and the year both occur in the text</li>
 * </ol>
 * All comparisons are case-insensitive substring checks.
 */
public final class CitationMatcher {

    static final int TITLE_PREFIX_LENGTH = 50;

    public enum MatchReason {
        DOI,
        TITLE,
        AUTHOR_YEAR
    }

    private final String doi;
    private final String titlePrefix;
    private final String surname;
    private final String year;

    public CitationMatcher(TargetDescriptor target) {
        this.doi = target.doi() == null ? null : target.doi().toLowerCase(Locale.ROOT);
        if (target.title() == null) {
            this.titlePrefix = null;
        } else {
            String lower = target.title().toLowerCase(Locale.ROOT);
            this.titlePrefix = lower.length() > TITLE_PREFIX_LENGTH ? lower.substring(0, TITLE_PREFIX_LENGTH) : lower;
        }
        this.surname = target.firstAuthorSurname();
        this.year = target.year();
    }

    public Optional<MatchReason> match(BibEntry entry) {
        if (entry.isStructured()) {
            return match(entry.candidateText(), entry.field("doi"), entry.field("title"));
        }
        return match(entry.candidateText(), null, null);
    }

    /**
     * @param candidateText  combined text of the candidate record
     * @param candidateDoi   DOI field, or null/empty when the record has none
     * @param candidateTitle title field, or null/empty when the record has none
     */
    public Optional<MatchReason> match(String candidateText, String candidateDoi, String candidateTitle) {
        String text = candidateText == null ? "" : candidateText.toLowerCase(Locale.ROOT);

        if (doi != null) {
            if (candidateDoi != null && !candidateDoi.isEmpty()
                    && candidateDoi.toLowerCase(Locale.ROOT).contains(doi)) {
                return Optional.of(MatchReason.DOI);
            }
            if (text.contains(doi)) {
                return Optional.of(MatchReason.DOI);
            }
        }

        if (titlePrefix != null) {
            if (candidateTitle != null && !candidateTitle.isEmpty()) {
                String cleanTitle = candidateTitle.toLowerCase(Locale.ROOT).replace("{", "").replace("}", "");
                if (cleanTitle.contains(titlePrefix)) {
                    return Optional.of(MatchReason.TITLE);
                }
            }
            if (text.contains(titlePrefix)) {
                return Optional.of(MatchReason.TITLE);
            }
        }

        if (surname != null && year != null && text.contains(surname) && text.contains(year)) {
            return Optional.of(MatchReason.AUTHOR_YEAR);
        }

        return Optional.empty();
    }

    public boolean isMatch(String candidateText, String candidateDoi, String candidateTitle) {
        return match(candidateText, candidateDoi, candidateTitle).isPresent();
    }
}
