package com.citationconstellation;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LatexParserJUnitTest {

    private static LatexNode.Group braced(String text) {
        return new LatexNode.Group('{', List.of(new LatexNode.Text(text)));
    }

    @Test
    void parse_macrosWithArgumentSlots() {
        var r = LatexParser.parse("\\section{Intro}\\citep{foo}");

        assertEquals(LatexParser.Outcome.PARSED, r.outcome());
        assertEquals(List.of(
                new LatexNode.Macro("section", Arrays.asList(null, null, braced("Intro"))),
                new LatexNode.Macro("citep", Arrays.asList(null, null, null, braced("foo")))
        ), r.nodes());
    }

    @Test
    void parse_starAndOptionalArguments() {
        var r = LatexParser.parse("\\section*[Short]{Long title}");
        var section = (LatexNode.Macro) r.nodes().get(0);

        assertEquals(new LatexNode.Text("*"), section.arguments().get(0));
        assertEquals(new LatexNode.Group('[', List.of(new LatexNode.Text("Short"))), section.arguments().get(1));
        assertEquals("Long title", section.lastArgumentText());
    }

    @Test
    void parse_citationWithTwoOptionalArguments() {
        var r = LatexParser.parse("\\citep[see][p.~4]{a, b}");
        var cite = (LatexNode.Macro) r.nodes().get(0);

        assertEquals(4, cite.arguments().size());
        assertNull(cite.arguments().get(0));
        assertEquals("a, b", cite.lastArgumentText());
    }

    @Test
    void parse_unknownCitationLikeMacroTakesArguments() {
        var cite = (LatexNode.Macro) LatexParser.parse("\\mycite{foo}").nodes().get(0);
        assertEquals("foo", cite.lastArgumentText());
    }

    @Test
    void parse_unknownMacroLeavesFollowingGroupAsSibling() {
        var r = LatexParser.parse("\\mymacro{arg}");
        assertEquals(List.of(new LatexNode.Macro("mymacro", List.of()), braced("arg")), r.nodes());
    }

    @Test
    void parse_environments() {
        var r = LatexParser.parse("\\begin{itemize}\\item x\\end{itemize}");

        assertEquals(LatexParser.Outcome.PARSED, r.outcome());
        assertEquals(List.of(new LatexNode.Environment("itemize", List.of(
                new LatexNode.Macro("item", Arrays.asList((LatexNode) null)),
                new LatexNode.Text(" x")
        ))), r.nodes());
    }

    @Test
    void parse_verbatimBodyIsRawText() {
        var r = LatexParser.parse("\\begin{verbatim}\\cite{x} {\\end{verbatim}after");

        assertEquals(LatexParser.Outcome.PARSED, r.outcome());
        assertEquals(List.of(
                new LatexNode.Environment("verbatim", List.of(new LatexNode.Text("\\cite{x} {"))),
                new LatexNode.Text("after")
        ), r.nodes());
    }

    @Test
    void parse_dropsComments() {
        var r = LatexParser.parse("a % \\cite{x}\nb");
        assertEquals(List.of(new LatexNode.Text("a "), new LatexNode.Text("\nb")), r.nodes());
    }

    @Test
    void parse_escapedSpecialsAreText() {
        var r = LatexParser.parse("50\\% of \\{x\\}");
        assertEquals(List.of(new LatexNode.Text("50% of {x}")), r.nodes());
    }

    @Test
    void parse_strayClosingBraceBecomesText() {
        var r = LatexParser.parse("a}b");

        assertEquals(LatexParser.Outcome.RECOVERED, r.outcome());
        assertEquals(List.of(new LatexNode.Text("a}b")), r.nodes());
        assertEquals(1, r.warnings().size());
    }

    @Test
    void parse_unclosedGroupClosedAtEnd() {
        var r = LatexParser.parse("{unclosed");

        assertEquals(LatexParser.Outcome.RECOVERED, r.outcome());
        assertEquals(List.of(braced("unclosed")), r.nodes());
    }

    @Test
    void parse_unmatchedEndIsText() {
        var r = LatexParser.parse("\\begin{a}x\\end{b}");

        assertEquals(LatexParser.Outcome.RECOVERED, r.outcome());
        assertEquals(List.of(new LatexNode.Environment("a", List.of(new LatexNode.Text("x\\end{b}")))), r.nodes());
        assertEquals(2, r.warnings().size());
    }

    @Test
    void parse_environmentEndClosesOpenGroup() {
        var r = LatexParser.parse("\\begin{a}{x\\end{a}y");

        assertEquals(LatexParser.Outcome.RECOVERED, r.outcome());
        assertEquals(List.of(
                new LatexNode.Environment("a", List.of(braced("x"))),
                new LatexNode.Text("y")
        ), r.nodes());
    }

    @Test
    void parse_missingMandatoryArgumentLeavesSlotEmpty() {
        var r = LatexParser.parse("{\\cite}");
        var cite = (LatexNode.Macro) ((LatexNode.Group) r.nodes().get(0)).children().get(0);

        assertEquals(LatexParser.Outcome.RECOVERED, r.outcome());
        assertNull(cite.lastArgumentText());
    }

    @Test
    void parse_nullInputFails() {
        var r = LatexParser.parse(null);

        assertEquals(LatexParser.Outcome.FAILED, r.outcome());
        assertFalse(r.isUsable());
        assertThrows(LatexParseException.class, r::orThrow);
    }

    @Test
    void parse_excessiveNestingFails() {
        var r = LatexParser.parse("{".repeat(LatexParser.MAX_NESTING + 10));

        assertEquals(LatexParser.Outcome.FAILED, r.outcome());
        assertTrue(r.nodes().isEmpty());
        LatexParseException e = assertThrows(LatexParseException.class, r::orThrow);
        assertTrue(e.getMessage().contains("Nesting"));
    }

    @Test
    void plainText_skipsMacros() {
        var section = (LatexNode.Macro) LatexParser.parse("\\section{The \\LaTeX{} way}").nodes().get(0);
        assertEquals("The  way", section.lastArgumentText());
    }
}
