package com.citationconstellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inlines {@code \input{...}} and {@code \include{...}} so a multi-file paper becomes one text.
 *
 * <p>Names are resolved against the base directory only. Problems are reported inline as LaTeX
 * comments and never abort the expansion:
 * <ul>
 *   <li>{@code % File not found: name.tex} for a missing file</li>
 *   <li>{@code % Error including name.tex: reason} for an unreadable file</li>
 *   <li>{@code % Max recursion depth reached} once the depth bound is exceeded</li>
 * </ul>
 * There is no cycle detection; a self-including file expands until the depth bound.
 */
public class LatexInclusionResolver {

    private static final Logger log = LoggerFactory.getLogger(LatexInclusionResolver.class);

    public static final int DEFAULT_MAX_DEPTH = 10;

    static final String DEPTH_MARKER = "\n% Max recursion depth reached\n";

    private static final Pattern INCLUDE = Pattern.compile("\\\\(?:input|include)\\{([^}]+)\\}");

    private final int maxDepth;

    public LatexInclusionResolver() {
        this(DEFAULT_MAX_DEPTH);
    }

    public LatexInclusionResolver(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public String flatten(Path baseDir, String text) {
        return expand(baseDir.toAbsolutePath().normalize(), text, 0);
    }

    private String expand(Path baseDir, String text, int depth) {
        if (depth > maxDepth) {
            log.warn("Inclusion depth {} exceeds limit {} under {}", depth, maxDepth, baseDir);
            return text + DEPTH_MARKER;
        }

        Matcher m = INCLUDE.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (m.find()) {
            String replacement = include(baseDir, m.group(1).trim(), depth);
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    private String include(Path baseDir, String name, int depth) {
        String fileName = name.endsWith(".tex") ? name : name + ".tex";

        Path file;
        try {
            file = baseDir.resolve(fileName).normalize();
        } catch (InvalidPathException e) {
            log.warn("Invalid include name '{}': {}", fileName, e.getMessage());
            return "% File not found: " + fileName;
        }
        if (!file.startsWith(baseDir) || !Files.isRegularFile(file)) {
            log.warn("Included file not found: {}", fileName);
            return "% File not found: " + fileName;
        }

        String content;
        try {
            content = SourceFiles.readLenient(file);
        } catch (IOException e) {
            log.warn("Could not read included file {}: {}", fileName, e.getMessage());
            return "% Error including " + fileName + ": " + e.getMessage();
        }
        return expand(baseDir, content, depth + 1);
    }
}
