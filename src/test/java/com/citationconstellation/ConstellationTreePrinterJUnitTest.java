package com.citationconstellation;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstellationTreePrinterJUnitTest {

    @Test
    void render_mergesHeadingPathsAndShowsStatuses() {
        var target = new TargetDescriptor("10.1/x", "Target", List.of(), "2020");
        var one = new CitingPaper("Paper One", "2021", List.of("A", "B", "C", "D"), null, Path.of("one"));
        var two = new CitingPaper("Paper Two", null, List.of(), null, Path.of("two"));

        var analyses = List.of(
                PaperAnalysis.found(one, "k", List.of(
                        new CitationContext("Intro", null, null),
                        new CitationContext("Intro", "Details", null),
                        new CitationContext(null, null, null))),
                PaperAnalysis.status(two, PaperAnalysis.Status.KEY_NOT_FOUND, null));

        String expected = """
                Target (2020) [10.1/x]
                ├── Paper One (2021)
                │   ├── Authors: A, B, C...
                │   ├── Section: Intro
                │   │   └── Subsection: Details
                │   └── Cited in: Unknown Section
                └── Paper Two (n.d.)
                    └── Status: Citation key not found in .bib
                """;
        assertEquals(expected, new ConstellationTreePrinter().render(target, analyses));
    }

    @Test
    void render_linkAndSubsubsection() {
        var target = new TargetDescriptor(null, null, List.of(), null);
        var paper = new CitingPaper("P", "2019", List.of("Solo"), "10.2/y", Path.of("p"));
        var analyses = List.of(PaperAnalysis.found(paper, "k", List.of(new CitationContext("S", "T", "U"))));

        String expected = """
                Untitled (n.d.) [No ID]
                └── P (2019)
                    ├── Authors: Solo
                    ├── Link: https://doi.org/10.2/y
                    └── Section: S
                        └── Subsection: T
                            └── Subsubsection: U
                """;
        assertEquals(expected, new ConstellationTreePrinter().render(target, analyses));
    }

    @Test
    void render_unsectionedContextsAreListedOneEach() {
        var target = TargetDescriptor.ofDoi("10.1/x");
        var paper = new CitingPaper("P", "2019", List.of(), null, Path.of("p"));
        var analyses = List.of(PaperAnalysis.found(paper, "k", List.of(
                new CitationContext(null, null, null),
                new CitationContext("S", null, null),
                new CitationContext(null, null, null))));

        String expected = """
                Untitled (n.d.) [10.1/x]
                └── P (2019)
                    ├── Cited in: Unknown Section
                    ├── Section: S
                    └── Cited in: Unknown Section
                """;
        assertEquals(expected, new ConstellationTreePrinter().render(target, analyses));
    }

    @Test
    void render_errorMessage() {
        var target = TargetDescriptor.ofDoi("10.1/x");
        var paper = new CitingPaper("P", "2019", List.of(), null, Path.of("p"));

        String out = new ConstellationTreePrinter(0).render(target,
                List.of(PaperAnalysis.error(paper, null, "boom")));

        assertTrue(out.endsWith("└── Status: Error: boom\n"), out);
    }
}
