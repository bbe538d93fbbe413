package com.citationconstellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Best-effort LaTeX reader producing a {@link LatexNode} tree.
 *
 * <p>The grammar is deliberately small: text, {@code {}} groups, macros with arguments taken
 * from a specification table, and {@code \begin}/{@code \end} environments. Comments are
 * dropped. Malformed input is repaired rather than rejected:
 * <ul>
 *   <li>a stray closing brace or an unmatched {@code \end{x}} becomes literal text</li>
 *   <li>a group or environment still open at end of input is closed there</li>
 *   <li>a closer belonging to an outer construct closes the inner ones first</li>
 *   <li>a missing mandatory argument leaves its slot empty</li>
 * </ul>
 * Every repair is recorded as a warning. Only null input and pathological nesting fail.
 */
public final class LatexParser {

    private static final Logger log = LoggerFactory.getLogger(LatexParser.class);

    static final int MAX_NESTING = 512;

    /**
     * How a parse ended. {@code RECOVERED} trees are usable; {@code FAILED} carries no tree.
     */
    public enum Outcome {
        PARSED,
        RECOVERED,
        FAILED
    }

    public record ParseResult(Outcome outcome, List<LatexNode> nodes, List<String> warnings, String failure) {

        public ParseResult {
            nodes = List.copyOf(nodes);
            warnings = List.copyOf(warnings);
        }

        public boolean isUsable() {
            return outcome != Outcome.FAILED;
        }

        /**
         * Returns the top-level nodes, or throws when the document could not be parsed.
         */
        public List<LatexNode> orThrow() {
            if (outcome == Outcome.FAILED) {
                throw new LatexParseException(failure);
            }
            return nodes;
        }
    }

    // Argument specifications: '*' optional star, '[' optional bracket argument, '{' mandatory.
    private static final String SECTIONING_ARGS = "*[{";
    private static final String CITE_ARGS = "*[[{";

    private static final Map<String, String> MACRO_ARGS = new HashMap<>();

    static {
        for (String name : List.of("part", "chapter", "section", "subsection", "subsubsection",
                "paragraph", "subparagraph")) {
            MACRO_ARGS.put(name, SECTIONING_ARGS);
        }
        for (String name : List.of("textbf", "textit", "textsl", "texttt", "textsc", "textrm", "textsf",
                "textup", "textmd", "emph", "underline", "mbox", "label", "ref", "eqref", "pageref",
                "autoref", "cref", "Cref", "url", "date", "thanks", "input", "include", "bibliography",
                "bibliographystyle", "affiliation", "email", "keywords")) {
            MACRO_ARGS.put(name, "{");
        }
        MACRO_ARGS.put("footnote", "[{");
        MACRO_ARGS.put("caption", "*[{");
        MACRO_ARGS.put("title", "[{");
        MACRO_ARGS.put("author", "[{");
        MACRO_ARGS.put("usepackage", "[{");
        MACRO_ARGS.put("documentclass", "[{");
        MACRO_ARGS.put("includegraphics", "*[{");
        MACRO_ARGS.put("href", "{{");
        MACRO_ARGS.put("frac", "{{");
        MACRO_ARGS.put("sqrt", "[{");
        MACRO_ARGS.put("hspace", "*{");
        MACRO_ARGS.put("vspace", "*{");
        MACRO_ARGS.put("item", "[");
        MACRO_ARGS.put("newcommand", "*{[[{");
        MACRO_ARGS.put("renewcommand", "*{[[{");
        MACRO_ARGS.put("\\", "*[");
    }

    private static final Set<Character> ESCAPED_SPECIALS = Set.of('%', '&', '{', '}', '_', '#', '$');

    private static final Set<String> VERBATIM_ENVIRONMENTS = Set.of("verbatim", "verbatim*", "lstlisting",
            "comment", "minted");

    private enum FrameKind { DOCUMENT, BRACE, BRACKET, ENVIRONMENT }

    private record Frame(FrameKind kind, String envName) {}

    /**
     * Unwinds the recursive descent once nesting exceeds {@link #MAX_NESTING}.
     */
    private static final class NestingTooDeep extends RuntimeException {
        NestingTooDeep(int position) {
            super("Nesting deeper than " + MAX_NESTING + " levels at index " + position, null, false, false);
        }
    }

    private final String input;
    private final int n;
    private int pos;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final List<String> warnings = new ArrayList<>();

    private LatexParser(String input) {
        this.input = input;
        this.n = input.length();
    }

    public static ParseResult parse(String input) {
        if (input == null) {
            return new ParseResult(Outcome.FAILED, List.of(), List.of(), "No document text");
        }
        LatexParser parser = new LatexParser(input);
        try {
            List<LatexNode> nodes = parser.parseSequence(new Frame(FrameKind.DOCUMENT, null));
            Outcome outcome = parser.warnings.isEmpty() ? Outcome.PARSED : Outcome.RECOVERED;
            if (outcome == Outcome.RECOVERED) {
                log.debug("Parsed with {} recoveries, first: {}", parser.warnings.size(), parser.warnings.get(0));
            }
            return new ParseResult(outcome, nodes, parser.warnings, null);
        } catch (NestingTooDeep e) {
            log.warn("Giving up on document: {}", e.getMessage());
            return new ParseResult(Outcome.FAILED, List.of(), parser.warnings, e.getMessage());
        }
    }

    static boolean isCitationMacro(String name) {
        return name.contains("cite");
    }

    static String argumentSpec(String macroName) {
        String spec = MACRO_ARGS.get(macroName);
        if (spec != null) return spec;
        return isCitationMacro(macroName) ? CITE_ARGS : "";
    }

    private List<LatexNode> parseSequence(Frame frame) {
        frames.push(frame);
        if (frames.size() > MAX_NESTING) {
            throw new NestingTooDeep(pos);
        }
        try {
            return readUntilClosed(frame);
        } finally {
            frames.pop();
        }
    }

    private List<LatexNode> readUntilClosed(Frame frame) {
        List<LatexNode> nodes = new ArrayList<>();
        StringBuilder text = new StringBuilder();

        while (pos < n) {
            char c = input.charAt(pos);

            if (c == '%') {
                flush(text, nodes);
                while (pos < n && input.charAt(pos) != '\n') pos++;
            } else if (c == '{') {
                flush(text, nodes);
                pos++;
                nodes.add(new LatexNode.Group('{', parseSequence(new Frame(FrameKind.BRACE, null))));
            } else if (c == '}') {
                if (frame.kind() == FrameKind.BRACE) {
                    pos++;
                    flush(text, nodes);
                    return nodes;
                }
                if (closesEnclosing(FrameKind.BRACE, null)) {
                    warn("Unclosed " + describe(frame) + " before '}' at index " + pos);
                    flush(text, nodes);
                    return nodes;
                }
                warn("Unmatched '}' at index " + pos);
                text.append(c);
                pos++;
            } else if (c == ']' && frame.kind() == FrameKind.BRACKET) {
                pos++;
                flush(text, nodes);
                return nodes;
            } else if (c == '\\') {
                int start = pos;
                pos++;
                if (pos >= n) {
                    text.append('\\');
                } else if (isLetter(input.charAt(pos))) {
                    String name = readLetters();
                    if (name.equals("end")) {
                        String envName = readRawBraced();
                        if (envName == null) {
                            warn("\\end without environment name at index " + start);
                            flush(text, nodes);
                            nodes.add(new LatexNode.Macro("end", List.of()));
                        } else if (frame.kind() == FrameKind.ENVIRONMENT && frame.envName().equals(envName)) {
                            flush(text, nodes);
                            return nodes;
                        } else if (closesEnclosing(FrameKind.ENVIRONMENT, envName)) {
                            warn("Unclosed " + describe(frame) + " before \\end{" + envName + "}");
                            pos = start;
                            flush(text, nodes);
                            return nodes;
                        } else {
                            warn("Unmatched \\end{" + envName + "} at index " + start);
                            text.append(input, start, pos);
                        }
                    } else if (name.equals("begin")) {
                        flush(text, nodes);
                        nodes.add(readEnvironment(start));
                    } else {
                        flush(text, nodes);
                        nodes.add(new LatexNode.Macro(name, readArguments(name, argumentSpec(name))));
                    }
                } else {
                    char symbol = input.charAt(pos);
                    pos++;
                    if (ESCAPED_SPECIALS.contains(symbol)) {
                        text.append(symbol);
                    } else {
                        flush(text, nodes);
                        String name = String.valueOf(symbol);
                        nodes.add(new LatexNode.Macro(name, readArguments(name, argumentSpec(name))));
                    }
                }
            } else {
                text.append(c);
                pos++;
            }
        }

        if (frame.kind() != FrameKind.DOCUMENT) {
            warn("Unclosed " + describe(frame) + " at end of input");
        }
        flush(text, nodes);
        return nodes;
    }

    private LatexNode readEnvironment(int start) {
        String name = readRawBraced();
        if (name == null) {
            warn("\\begin without environment name at index " + start);
            return new LatexNode.Macro("begin", List.of());
        }

        if (VERBATIM_ENVIRONMENTS.contains(name)) {
            String terminator = "\\end{" + name + "}";
            int end = input.indexOf(terminator, pos);
            String body;
            if (end < 0) {
                warn("Unclosed " + name + " environment at end of input");
                body = input.substring(pos);
                pos = n;
            } else {
                body = input.substring(pos, end);
                pos = end + terminator.length();
            }
            return new LatexNode.Environment(name, body.isEmpty() ? List.of() : List.of(new LatexNode.Text(body)));
        }

        return new LatexNode.Environment(name, parseSequence(new Frame(FrameKind.ENVIRONMENT, name)));
    }

    private List<LatexNode> readArguments(String macroName, String spec) {
        List<LatexNode> args = new ArrayList<>(spec.length());
        for (int i = 0; i < spec.length(); i++) {
            switch (spec.charAt(i)) {
                case '*' -> {
                    if (pos < n && input.charAt(pos) == '*') {
                        pos++;
                        args.add(new LatexNode.Text("*"));
                    } else {
                        args.add(null);
                    }
                }
                case '[' -> {
                    int save = pos;
                    skipWhitespace();
                    if (pos < n && input.charAt(pos) == '[') {
                        pos++;
                        args.add(new LatexNode.Group('[', parseSequence(new Frame(FrameKind.BRACKET, null))));
                    } else {
                        pos = save;
                        args.add(null);
                    }
                }
                default -> args.add(readMandatoryArgument(macroName));
            }
        }
        return args;
    }

    private LatexNode readMandatoryArgument(String macroName) {
        int save = pos;
        skipWhitespace();
        if (pos >= n || input.charAt(pos) == '}' || input.charAt(pos) == '%') {
            pos = save;
            warn("Missing argument for \\" + macroName + " at index " + save);
            return null;
        }
        char c = input.charAt(pos);
        if (c == '{') {
            pos++;
            return new LatexNode.Group('{', parseSequence(new Frame(FrameKind.BRACE, null)));
        }
        if (c == '\\' && pos + 1 < n) {
            // a single control sequence serves as the argument
            pos++;
            if (isLetter(input.charAt(pos))) {
                return new LatexNode.Macro(readLetters(), List.of());
            }
            char symbol = input.charAt(pos);
            pos++;
            return ESCAPED_SPECIALS.contains(symbol)
                    ? new LatexNode.Text(String.valueOf(symbol))
                    : new LatexNode.Macro(String.valueOf(symbol), List.of());
        }
        pos++;
        return new LatexNode.Text(String.valueOf(c));
    }

    /**
     * Reads {@code {name}} verbatim, for environment names. Returns null (position unchanged)
     * when no braced name follows.
     */
    private String readRawBraced() {
        int save = pos;
        skipWhitespace();
        if (pos >= n || input.charAt(pos) != '{') {
            pos = save;
            return null;
        }
        int close = input.indexOf('}', pos + 1);
        if (close < 0) {
            pos = save;
            return null;
        }
        String name = input.substring(pos + 1, close).trim();
        pos = close + 1;
        return name;
    }

    /**
     * True when a frame below the innermost one is closed by the given closer, in which case the
     * innermost constructs are left open and closed implicitly.
     */
    private boolean closesEnclosing(FrameKind kind, String envName) {
        Iterator<Frame> it = frames.iterator();
        if (it.hasNext()) it.next();
        while (it.hasNext()) {
            Frame f = it.next();
            if (f.kind() == kind && (envName == null || envName.equals(f.envName()))) {
                return true;
            }
        }
        return false;
    }

    private String readLetters() {
        int start = pos;
        while (pos < n && isLetter(input.charAt(pos))) pos++;
        return input.substring(start, pos);
    }

    private void skipWhitespace() {
        while (pos < n && Character.isWhitespace(input.charAt(pos))) pos++;
    }

    private void warn(String message) {
        warnings.add(message);
    }

    private static String describe(Frame frame) {
        return switch (frame.kind()) {
            case BRACE -> "group";
            case BRACKET -> "optional argument";
            case ENVIRONMENT -> frame.envName() + " environment";
            case DOCUMENT -> "document";
        };
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static void flush(StringBuilder text, List<LatexNode> nodes) {
        if (text.length() > 0) {
            nodes.add(new LatexNode.Text(text.toString()));
            text.setLength(0);
        }
    }
}
