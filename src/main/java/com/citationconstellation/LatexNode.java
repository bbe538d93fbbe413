package com.citationconstellation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of the LaTeX structure tree produced by {@link LatexParser}.
 *
 * <p>Each node owns its children; trees are built once per document and never shared.
 */
public interface LatexNode {

    /**
     * Nodes visited below this one during a traversal, in document order.
     */
    List<LatexNode> children();

    /**
     * A run of literal characters.
     */
    record Text(String text) implements LatexNode {
        public Text {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public List<LatexNode> children() {
            return List.of();
        }
    }

    /**
     * A {@code {...}} group, or a {@code [...]} optional argument when {@code opening} is '['.
     */
    record Group(char opening, List<LatexNode> children) implements LatexNode {
        public Group {
            children = List.copyOf(children);
        }
    }

    /**
     * A macro invocation. Argument slots follow the macro's argument specification; a slot is
     * null when that (optional) argument was not given.
     */
    record Macro(String name, List<LatexNode> arguments) implements LatexNode {
        public Macro {
            Objects.requireNonNull(name, "name");
            // List.copyOf rejects the null slots
            arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        @Override
        public List<LatexNode> children() {
            List<LatexNode> present = new ArrayList<>();
            for (LatexNode arg : arguments) {
                if (arg != null) present.add(arg);
            }
            return present;
        }

        /**
         * Text of the last argument that was supplied, trimmed; null when no argument was given.
         * Scanning from the end prefers the mandatory argument over a star or optional prefix.
         */
        public String lastArgumentText() {
            for (int i = arguments.size() - 1; i >= 0; i--) {
                LatexNode arg = arguments.get(i);
                if (arg != null) {
                    return LatexNode.plainText(arg).trim();
                }
            }
            return null;
        }
    }

    /**
     * A {@code \begin{name} ... \end{name}} block.
     */
    record Environment(String name, List<LatexNode> children) implements LatexNode {
        public Environment {
            Objects.requireNonNull(name, "name");
            children = List.copyOf(children);
        }
    }

    /**
     * Literal text below a node. Macros contribute nothing, so {@code \section{The \LaTeX{} way}}
     * yields "The  way".
     */
    static String plainText(LatexNode node) {
        StringBuilder sb = new StringBuilder();
        appendText(node, sb);
        return sb.toString();
    }

    private static void appendText(LatexNode node, StringBuilder sb) {
        if (node instanceof Text) {
            sb.append(((Text) node).text());
        } else if (node instanceof Group || node instanceof Environment) {
            for (LatexNode child : node.children()) {
                appendText(child, sb);
            }
        }
    }
}
