package com.citationconstellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the per-paper analysis: locate the main document, flatten inclusions, resolve the
 * target's citation key, parse, and collect citation contexts.
 *
 * <p>Each call works on fresh state, so separate papers may be analyzed from separate threads.
 */
public class CitationPipeline {

    private static final Logger log = LoggerFactory.getLogger(CitationPipeline.class);

    private final LatexInclusionResolver inclusionResolver;
    private final BibliographyKeyResolver keyResolver;

    public CitationPipeline() {
        this(CitationConstellationConfig.DEFAULTS);
    }

    public CitationPipeline(CitationConstellationConfig config) {
        this(new LatexInclusionResolver(config.maxInclusionDepth()), new BibliographyKeyResolver());
    }

    public CitationPipeline(LatexInclusionResolver inclusionResolver, BibliographyKeyResolver keyResolver) {
        this.inclusionResolver = inclusionResolver;
        this.keyResolver = keyResolver;
    }

    /**
     * Analyzes every paper in order. A paper that fails is reported with an error status and the
     * batch continues.
     */
    public List<PaperAnalysis> analyzeAll(List<CitingPaper> papers, TargetDescriptor target) {
        List<PaperAnalysis> results = new ArrayList<>(papers.size());
        for (int i = 0; i < papers.size(); i++) {
            CitingPaper paper = papers.get(i);
            log.info("[{}/{}] Processing citation from: {}", i + 1, papers.size(), paper.title());
            results.add(analyze(paper, target));
        }
        return results;
    }

    public PaperAnalysis analyze(CitingPaper paper, TargetDescriptor target) {
        if (paper.sourceDir() == null) {
            log.info("  -> No source available, skipping");
            return PaperAnalysis.status(paper, PaperAnalysis.Status.SOURCE_NOT_AVAILABLE, null);
        }

        String key = null;
        try {
            Path sourceDir = paper.sourceDir();
            Path mainTex = MainDocumentLocator.locate(sourceDir);
            String flat = inclusionResolver.flatten(sourceDir, SourceFiles.readLenient(mainTex));

            Optional<String> resolved = keyResolver.resolveKey(sourceDir, target);
            if (resolved.isEmpty()) {
                log.info("  -> Could not identify citation key in bibliography");
                return PaperAnalysis.status(paper, PaperAnalysis.Status.KEY_NOT_FOUND, null);
            }
            key = resolved.get();
            log.info("  -> Found citation key: {}", key);

            List<CitationContext> contexts = CitationFinder.findCitations(LatexParser.parse(flat), List.of(key));
            if (contexts.isEmpty()) {
                log.info("  -> Key found but not cited in the text");
                return PaperAnalysis.status(paper, PaperAnalysis.Status.NO_IN_TEXT_CITATIONS, key);
            }
            return PaperAnalysis.found(paper, key, contexts);
        } catch (IOException | RuntimeException e) {
            String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("  -> Error processing {}: {}", paper.title(), detail);
            return PaperAnalysis.error(paper, key, detail);
        }
    }
}
