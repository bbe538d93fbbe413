package com.citationconstellation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Walks a {@link LatexNode} tree and records the heading path of every citation of a target key.
 *
 * <p>A citation is any macro whose name contains "cite" ({@code \cite}, {@code \citep},
 * {@code \citeauthor}, project-specific wrappers such as {@code \mycite}). Its keys come from the
 * last supplied argument, split on commas. One {@link CitationContext} is recorded per
 * invocation, however many of its keys are targets.
 *
 * <p>Headings are tracked by a single cursor for the whole walk, so a heading inside a group or
 * environment still applies to everything after it.
 */
public final class CitationFinder {

    private CitationFinder() {
    }

    public static List<CitationContext> findCitations(List<LatexNode> nodes, Collection<String> targetKeys) {
        List<CitationContext> found = new ArrayList<>();
        if (nodes == null || targetKeys == null || targetKeys.isEmpty()) {
            return found;
        }
        Set<String> targets = Set.copyOf(targetKeys);
        SectionCursor cursor = new SectionCursor();
        for (LatexNode node : nodes) {
            walk(node, targets, cursor, found);
        }
        return found;
    }

    public static List<CitationContext> findCitations(LatexParser.ParseResult parsed, Collection<String> targetKeys) {
        return findCitations(parsed.orThrow(), targetKeys);
    }

    /**
     * Keys named by a citation macro, in order, with surrounding whitespace and empty entries removed.
     */
    static List<String> citedKeys(LatexNode.Macro macro) {
        List<String> keys = new ArrayList<>();
        String arg = macro.lastArgumentText();
        if (arg == null) {
            return keys;
        }
        for (String key : arg.split(",")) {
            String trimmed = key.trim();
            if (!trimmed.isEmpty()) keys.add(trimmed);
        }
        return keys;
    }

    private static void walk(LatexNode node, Set<String> targets, SectionCursor cursor, List<CitationContext> found) {
        if (node instanceof LatexNode.Macro) {
            visitMacro((LatexNode.Macro) node, targets, cursor, found);
        }
        for (LatexNode child : node.children()) {
            walk(child, targets, cursor, found);
        }
    }

    private static void visitMacro(LatexNode.Macro macro, Set<String> targets, SectionCursor cursor,
                                   List<CitationContext> found) {
        switch (macro.name()) {
            case "section" -> cursor.enterSection(macro.lastArgumentText());
            case "subsection" -> cursor.enterSubsection(macro.lastArgumentText());
            case "subsubsection" -> cursor.enterSubsubsection(macro.lastArgumentText());
            default -> {
            }
        }

        if (LatexParser.isCitationMacro(macro.name())) {
            for (String key : citedKeys(macro)) {
                if (targets.contains(key)) {
                    found.add(cursor.snapshot());
                    break;
                }
            }
        }
    }
}
