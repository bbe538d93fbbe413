package com.citationconstellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finds the citation key a paper's sources use for the target paper.
 *
 * <p>Strategy 1 scans structured {@code .bib} files; strategy 2 scans compiled {@code .bbl}
 * files and only runs when strategy 1 found nothing. Files are visited in name order and the
 * first matching record wins. A file that cannot be read is skipped.
 */
public class BibliographyKeyResolver {

    private static final Logger log = LoggerFactory.getLogger(BibliographyKeyResolver.class);

    /**
     * Key resolved together with the record and rule that produced it.
     */
    public record Resolution(String key, Path file, CitationMatcher.MatchReason reason) {}

    public Optional<String> resolveKey(Path sourceDir, TargetDescriptor target) throws IOException {
        return resolve(sourceDir, target).map(Resolution::key);
    }

    public Optional<Resolution> resolve(Path sourceDir, TargetDescriptor target) throws IOException {
        if (target == null || target.isEmpty()) {
            log.debug("Target descriptor has no identifying fields; nothing can match in {}", sourceDir);
            return Optional.empty();
        }
        CitationMatcher matcher = new CitationMatcher(target);

        for (Path bib : SourceFiles.listBySuffix(sourceDir, ".bib")) {
            Optional<Resolution> found = searchStructured(bib, matcher);
            if (found.isPresent()) return found;
        }

        for (Path bbl : SourceFiles.listBySuffix(sourceDir, ".bbl")) {
            Optional<Resolution> found = searchFreeText(bbl, matcher);
            if (found.isPresent()) return found;
        }

        log.debug("No bibliography record in {} matches the target", sourceDir);
        return Optional.empty();
    }

    private Optional<Resolution> searchStructured(Path bib, CitationMatcher matcher) {
        String content;
        try {
            content = SourceFiles.readLenient(bib);
        } catch (IOException e) {
            log.warn("Skipping unreadable bibliography {}: {}", bib, e.getMessage());
            return Optional.empty();
        }

        BibTeXParser.ParseResult parsed = BibTeXParser.parseEntries(content);
        if (!parsed.errors().isEmpty()) {
            log.debug("{}: {} malformed entries ignored", bib.getFileName(), parsed.errors().size());
        }
        return firstMatch(parsed.entries(), bib, matcher);
    }

    private Optional<Resolution> searchFreeText(Path bbl, CitationMatcher matcher) {
        String content;
        try {
            content = SourceFiles.readLenient(bbl);
        } catch (IOException e) {
            log.warn("Skipping unreadable bibliography {}: {}", bbl, e.getMessage());
            return Optional.empty();
        }
        return firstMatch(BblParser.parseItems(content), bbl, matcher);
    }

    private Optional<Resolution> firstMatch(List<BibEntry> entries, Path file, CitationMatcher matcher) {
        for (BibEntry entry : entries) {
            Optional<CitationMatcher.MatchReason> reason = matcher.match(entry);
            if (reason.isPresent()) {
                log.debug("Matched {} in {} by {}", entry.key(), file.getFileName(), reason.get());
                return Optional.of(new Resolution(entry.key(), file, reason.get()));
            }
        }
        return Optional.empty();
    }
}
