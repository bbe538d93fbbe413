package com.citationconstellation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CitationPipelineJUnitTest {

    @TempDir
    Path dir;

    private final CitationPipeline pipeline = new CitationPipeline();

    private static final TargetDescriptor TARGET = TargetDescriptor.ofDoi("10.5555/target");

    private Path paper(String name, String mainTex, String bib) throws IOException {
        Path paperDir = Files.createDirectories(dir.resolve(name));
        Files.writeString(paperDir.resolve("main.tex"), mainTex);
        if (bib != null) {
            Files.writeString(paperDir.resolve("refs.bib"), bib);
        }
        return paperDir;
    }

    @Test
    void analyze_findsContextsAcrossIncludedFiles() throws IOException {
        Path paperDir = paper("p1", """
                \\documentclass{article}
                \\begin{document}
                \\section{Introduction}
                Prior work~\\citep{tgt}.
                \\input{sections/method}
                \\end{document}
                """, "@article{tgt, doi={10.5555/TARGET}}");
        Files.createDirectories(paperDir.resolve("sections"));
        Files.writeString(paperDir.resolve("sections/method.tex"), """
                \\section{Method}
                \\subsection{Setup}
                We follow \\citet{other, tgt}.
                """);

        PaperAnalysis result = pipeline.analyze(CitingPaper.fromSourceDir(paperDir), TARGET);

        assertEquals(PaperAnalysis.Status.CONTEXTS_FOUND, result.status());
        assertEquals("tgt", result.citationKey());
        assertEquals(List.of(
                new CitationContext("Introduction", null, null),
                new CitationContext("Method", "Setup", null)
        ), result.contexts());
    }

    @Test
    void analyze_keyNotFound() throws IOException {
        Path paperDir = paper("p2", "\\cite{x}", "@article{x, doi={10.1/other}}");

        PaperAnalysis result = pipeline.analyze(CitingPaper.fromSourceDir(paperDir), TARGET);

        assertEquals(PaperAnalysis.Status.KEY_NOT_FOUND, result.status());
        assertEquals("Citation key not found in .bib", result.message());
        assertNull(result.citationKey());
    }

    @Test
    void analyze_keyFoundButNeverCited() throws IOException {
        Path paperDir = paper("p3", "\\section{A} nothing here \\cite{x}", "@article{tgt, doi={10.5555/target}}");

        PaperAnalysis result = pipeline.analyze(CitingPaper.fromSourceDir(paperDir), TARGET);

        assertEquals(PaperAnalysis.Status.NO_IN_TEXT_CITATIONS, result.status());
        assertEquals("No in-text citations found", result.message());
        assertEquals("tgt", result.citationKey());
        assertTrue(result.contexts().isEmpty());
    }

    @Test
    void analyze_noSourceDirectory() {
        var paper = new CitingPaper("No source", "2020", List.of(), null, null);

        PaperAnalysis result = pipeline.analyze(paper, TARGET);

        assertEquals(PaperAnalysis.Status.SOURCE_NOT_AVAILABLE, result.status());
        assertEquals("Source not available", result.message());
    }

    @Test
    void analyze_unparseableDocumentIsAnErrorForThatPaper() throws IOException {
        Path paperDir = paper("p4", "{".repeat(LatexParser.MAX_NESTING + 5), "@article{tgt, doi={10.5555/target}}");

        PaperAnalysis result = pipeline.analyze(CitingPaper.fromSourceDir(paperDir), TARGET);

        assertEquals(PaperAnalysis.Status.ERROR, result.status());
        assertEquals("tgt", result.citationKey());
        assertTrue(result.message().startsWith("Error: "), result.message());
    }

    @Test
    void analyzeAll_continuesAfterFailingPaper() throws IOException {
        Path empty = Files.createDirectories(dir.resolve("empty"));
        Path good = paper("good", "\\cite{tgt}", "@article{tgt, doi={10.5555/target}}");

        List<PaperAnalysis> results = pipeline.analyzeAll(
                List.of(CitingPaper.fromSourceDir(empty), CitingPaper.fromSourceDir(good)), TARGET);

        assertEquals(2, results.size());
        assertEquals(PaperAnalysis.Status.ERROR, results.get(0).status());
        assertEquals(PaperAnalysis.Status.CONTEXTS_FOUND, results.get(1).status());
        assertEquals(List.of(new CitationContext(null, null, null)), results.get(1).contexts());
    }
}
