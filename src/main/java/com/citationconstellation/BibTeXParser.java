package com.citationconstellation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Small, resilient BibTeX reader used by the structured bibliography strategy.
 *
 * <p>Entries are things starting with '@' followed by an entry type, then a brace-delimited or
 * paren-delimited body. The scanner:
 * <ul>
 *   <li>ignores braces/parens inside quoted values</li>
 *   <li>treats '"' as a delimiter only at the top level of an entry body; inside {...} it is
 *       a literal character (e.g. {A 12" telescope})</li>
 *   <li>handles escaped quotes (\")</li>
 *   <li>handles nested braces in field values</li>
 *   <li>skips @comment/@preamble/@string (not reference entries)</li>
 * </ul>
 *
 * <p>Problems with one entry never stop the scan; they are collected in
 * {@link ParseResult#errors()}.
 */
public final class BibTeXParser {

    private BibTeXParser() {
    }

    public record ParseResult(List<BibEntry> entries, List<String> errors) {}

    public static ParseResult parseEntries(String input) {
        List<BibEntry> entries = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        if (input == null || input.isEmpty()) {
            return new ParseResult(entries, errors);
        }

        int n = input.length();
        int i = 0;

        while (i < n) {
            int at = input.indexOf('@', i);
            if (at < 0) break;

            int typeStart = skipWhitespace(input, at + 1);
            int typeEnd = scanName(input, typeStart);
            if (typeEnd == typeStart) {
                // stray '@', e.g. inside an email address
                i = at + 1;
                continue;
            }
            String type = input.substring(typeStart, typeEnd).toLowerCase(Locale.ROOT);

            int bodyOpen = skipWhitespace(input, typeEnd);
            if (bodyOpen >= n) break;
            char open = input.charAt(bodyOpen);
            if (open != '{' && open != '(') {
                i = bodyOpen + 1;
                continue;
            }
            char close = (open == '{') ? '}' : ')';

            int bodyEnd = findClosing(input, bodyOpen, open, close, true);
            if (bodyEnd < 0) {
                errors.add("Unclosed entry starting at index " + at + " (@" + type + ")");
                // resync on the next '@'; entries swallowed by the broken body are still found
                i = at + 1;
                continue;
            }

            if (!type.equals("comment") && !type.equals("preamble") && !type.equals("string")) {
                String key = readKey(input, bodyOpen + 1, bodyEnd);
                if (key == null) {
                    errors.add("Entry without key at index " + at + " (@" + type + ")");
                } else {
                    String raw = input.substring(at, bodyEnd + 1);
                    entries.add(new BibEntry(key, type, parseFields(raw), null));
                }
            }

            i = bodyEnd + 1;
        }

        return new ParseResult(entries, errors);
    }

    /**
     * Reads every {@code name = value} pair at the top level of a raw entry.
     * Field names are lower-cased; values keep their LaTeX markup but lose the outer delimiters,
     * with runs of whitespace collapsed. The first occurrence of a repeated field wins.
     */
    public static Map<String, String> parseFields(String rawEntry) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (rawEntry == null) return fields;

        int n = rawEntry.length();
        int bodyStart = 0;
        while (bodyStart < n && rawEntry.charAt(bodyStart) != '{' && rawEntry.charAt(bodyStart) != '(') {
            bodyStart++;
        }
        // the key runs up to the first top-level comma
        int p = bodyStart + 1;
        while (p < n && rawEntry.charAt(p) != ',') p++;
        p++;

        while (p < n) {
            p = skipSeparators(rawEntry, p);
            int nameEnd = scanName(rawEntry, p);
            if (nameEnd == p) break;
            String name = rawEntry.substring(p, nameEnd).toLowerCase(Locale.ROOT);

            int eq = skipWhitespace(rawEntry, nameEnd);
            if (eq >= n || rawEntry.charAt(eq) != '=') break;
            int valueStart = skipWhitespace(rawEntry, eq + 1);
            if (valueStart >= n) break;

            int valueEnd = findValueEnd(rawEntry, valueStart);
            if (valueEnd < 0) break;
            String value = unwrap(rawEntry.substring(valueStart, valueEnd));
            fields.putIfAbsent(name, value.replaceAll("\\s+", " ").trim());
            p = valueEnd;
        }
        return Collections.unmodifiableMap(fields);
    }

    private static String readKey(String input, int from, int bodyEnd) {
        int k = from;
        while (k < bodyEnd && input.charAt(k) != ',') k++;
        String key = input.substring(from, k).trim();
        return key.isEmpty() ? null : key;
    }

    /**
     * Returns the index of the delimiter closing the one at {@code openIndex}, or -1.
     * With {@code quotedValues}, a '"' directly inside the body (outside any nested braces)
     * opens or closes a quoted value; elsewhere quotes are plain characters.
     */
    private static int findClosing(String s, int openIndex, char open, char close, boolean quotedValues) {
        int depth = 0;
        int braces = 0; // {...} nesting inside a paren-delimited body
        int quotedBraces = 0;
        boolean inQuotes = false;
        boolean escaped = false;
        for (int p = openIndex; p < s.length(); p++) {
            char c = s.charAt(p);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (inQuotes) {
                if (c == '{') {
                    quotedBraces++;
                } else if (c == '}' && quotedBraces > 0) {
                    quotedBraces--;
                } else if (c == '"' && quotedBraces == 0) {
                    inQuotes = false;
                }
            } else if (c == '"' && quotedValues && depth == 1 && braces == 0) {
                inQuotes = true;
            } else {
                if (c == open) {
                    depth++;
                } else if (c == close) {
                    depth--;
                    if (depth == 0) return p;
                } else if (open != '{' && c == '{') {
                    braces++;
                } else if (open != '{' && c == '}' && braces > 0) {
                    braces--;
                }
            }
        }
        return -1;
    }

    /**
     * End (exclusive) of a field value: a balanced {...}, a "..." string, or a bare token,
     * optionally joined with '#' concatenation.
     */
    private static int findValueEnd(String s, int start) {
        int n = s.length();
        int p = start;
        while (p < n) {
            char c = s.charAt(p);
            if (c == '{') {
                int end = findClosing(s, p, '{', '}', false);
                if (end < 0) return -1;
                p = end + 1;
            } else if (c == '"') {
                int end = findQuoteEnd(s, p);
                if (end < 0) return -1;
                p = end + 1;
            } else if (c == ',' || c == '}' || c == ')') {
                break;
            } else {
                p++;
            }
        }
        int end = p;
        while (end > start && Character.isWhitespace(s.charAt(end - 1))) end--;
        return end;
    }

    /**
     * Closing quote of a quoted value. Quotes inside {...} within the value do not count.
     */
    private static int findQuoteEnd(String s, int openQuote) {
        int braces = 0;
        boolean escaped = false;
        for (int p = openQuote + 1; p < s.length(); p++) {
            char c = s.charAt(p);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '{') {
                braces++;
            } else if (c == '}' && braces > 0) {
                braces--;
            } else if (c == '"' && braces == 0) {
                return p;
            }
        }
        return -1;
    }

    private static String unwrap(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '{' && last == '}') || (first == '"' && last == '"')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static int scanName(String s, int from) {
        int p = from;
        while (p < s.length()) {
            char c = s.charAt(p);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':' || c == '.') {
                p++;
            } else {
                break;
            }
        }
        return p;
    }

    private static int skipWhitespace(String s, int from) {
        int p = from;
        while (p < s.length() && Character.isWhitespace(s.charAt(p))) p++;
        return p;
    }

    private static int skipSeparators(String s, int from) {
        int p = from;
        while (p < s.length() && (Character.isWhitespace(s.charAt(p)) || s.charAt(p) == ',')) p++;
        return p;
    }
}
