package com.citationconstellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tunables for the pipeline and the report.
 *
 * <p>Defaults come from {@code citation-constellation.properties} on the classpath; JVM system
 * properties with the same names override them.
 */
public record CitationConstellationConfig(int maxInclusionDepth, int maxAuthorsShown) {

    private static final Logger log = LoggerFactory.getLogger(CitationConstellationConfig.class);

    static final String RESOURCE = "citation-constellation.properties";
    static final String MAX_INCLUSION_DEPTH = "citation.maxInclusionDepth";
    static final String MAX_AUTHORS_SHOWN = "citation.maxAuthorsShown";

    public static final CitationConstellationConfig DEFAULTS =
            new CitationConstellationConfig(LatexInclusionResolver.DEFAULT_MAX_DEPTH, 3);

    public CitationConstellationConfig {
        if (maxInclusionDepth < 0) {
            throw new IllegalArgumentException("maxInclusionDepth must be >= 0, got " + maxInclusionDepth);
        }
        if (maxAuthorsShown < 0) {
            throw new IllegalArgumentException("maxAuthorsShown must be >= 0, got " + maxAuthorsShown);
        }
    }

    public static CitationConstellationConfig load() {
        Properties props = new Properties();
        try (InputStream in = CitationConstellationConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults: {}", RESOURCE, e.getMessage());
        }
        props.putAll(System.getProperties());
        return fromProperties(props);
    }

    static CitationConstellationConfig fromProperties(Properties props) {
        return new CitationConstellationConfig(
                intValue(props, MAX_INCLUSION_DEPTH, DEFAULTS.maxInclusionDepth()),
                intValue(props, MAX_AUTHORS_SHOWN, DEFAULTS.maxAuthorsShown()));
    }

    public CitationConstellationConfig withMaxInclusionDepth(int depth) {
        return new CitationConstellationConfig(depth, maxAuthorsShown);
    }

    private static int intValue(Properties props, String name, int fallback) {
        String raw = props.getProperty(name);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}", name, raw);
            return fallback;
        }
    }
}
