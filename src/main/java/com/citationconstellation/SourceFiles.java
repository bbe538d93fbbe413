package com.citationconstellation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File access shared by the pipeline stages.
 */
final class SourceFiles {

    private SourceFiles() {
    }

    /**
     * Reads a file as UTF-8; malformed byte sequences become U+FFFD instead of failing.
     */
    static String readLenient(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    /**
     * Regular files directly inside {@code dir} whose name ends with {@code suffix}, ordered by name.
     */
    static List<Path> listBySuffix(Path dir, String suffix) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }
}
