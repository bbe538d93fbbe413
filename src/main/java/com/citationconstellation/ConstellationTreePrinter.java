package com.citationconstellation;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the analysis of all citing papers as a text tree under the target paper.
 *
 * <pre>
 * Target title (2020) [10.1000/xyz]
 * └── Citing paper (2021)
 *     ├── Authors: A, B, C...
 *     └── Section: Introduction
 *         └── Subsection: Prior work
 * </pre>
 *
 * Contexts sharing a heading path are merged into one branch. Each context without a section
 * gets its own {@code Cited in: Unknown Section} line.
 */
public class ConstellationTreePrinter {

    private final int maxAuthorsShown;

    public ConstellationTreePrinter() {
        this(CitationConstellationConfig.DEFAULTS.maxAuthorsShown());
    }

    public ConstellationTreePrinter(int maxAuthorsShown) {
        this.maxAuthorsShown = maxAuthorsShown;
    }

    private static final class TreeNode {
        final String label;
        final List<TreeNode> children = new ArrayList<>();

        TreeNode(String label) {
            this.label = label;
        }

        TreeNode add(String childLabel) {
            TreeNode child = new TreeNode(childLabel);
            children.add(child);
            return child;
        }

        TreeNode getOrAdd(String childLabel) {
            for (TreeNode child : children) {
                if (child.label.equals(childLabel)) return child;
            }
            return add(childLabel);
        }
    }

    public String render(TargetDescriptor target, List<PaperAnalysis> analyses) {
        String id = target.doi() != null ? target.doi() : "No ID";
        TreeNode root = new TreeNode(titleAndYear(target.title(), target.year()) + " [" + id + "]");

        for (PaperAnalysis analysis : analyses) {
            CitingPaper paper = analysis.paper();
            TreeNode paperNode = root.add(titleAndYear(paper.title(), paper.year()));

            if (!paper.authors().isEmpty() && maxAuthorsShown > 0) {
                List<String> shown = paper.authors().subList(0, Math.min(maxAuthorsShown, paper.authors().size()));
                String authors = "Authors: " + String.join(", ", shown);
                if (paper.authors().size() > maxAuthorsShown) authors += "...";
                paperNode.add(authors);
            }
            if (paper.doi() != null) {
                paperNode.add("Link: https://doi.org/" + paper.doi());
            }

            if (analysis.status() != PaperAnalysis.Status.CONTEXTS_FOUND) {
                paperNode.add("Status: " + analysis.message());
                continue;
            }
            for (CitationContext ctx : analysis.contexts()) {
                addContext(paperNode, ctx);
            }
        }

        StringBuilder out = new StringBuilder();
        out.append(root.label).append('\n');
        appendChildren(root, "", out);
        return out.toString();
    }

    private static void addContext(TreeNode paperNode, CitationContext ctx) {
        if (ctx.section() == null) {
            paperNode.add("Cited in: " + CitationContext.UNKNOWN_SECTION);
            return;
        }
        TreeNode current = paperNode.getOrAdd("Section: " + ctx.section());
        if (ctx.subsection() != null) {
            current = current.getOrAdd("Subsection: " + ctx.subsection());
            if (ctx.subsubsection() != null) {
                current.getOrAdd("Subsubsection: " + ctx.subsubsection());
            }
        }
    }

    private static void appendChildren(TreeNode node, String indent, StringBuilder out) {
        for (int i = 0; i < node.children.size(); i++) {
            TreeNode child = node.children.get(i);
            boolean last = i == node.children.size() - 1;
            out.append(indent).append(last ? "└── " : "├── ").append(child.label).append('\n');
            appendChildren(child, indent + (last ? "    " : "│   "), out);
        }
    }

    private static String titleAndYear(String title, String year) {
        return (title == null ? "Untitled" : title) + " (" + (year == null ? "n.d." : year) + ")";
    }
}
