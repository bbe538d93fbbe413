package com.citationconstellation;

import java.nio.file.Path;
import java.util.List;

/**
 * A paper citing the target, with the directory its LaTeX sources were unpacked into.
 * {@code sourceDir} is null when no source is available for the paper.
 */
public record CitingPaper(String title, String year, List<String> authors, String doi, Path sourceDir) {

    public CitingPaper {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public static CitingPaper fromSourceDir(Path sourceDir) {
        Path name = sourceDir.getFileName();
        return new CitingPaper(name == null ? sourceDir.toString() : name.toString(), null, List.of(), null, sourceDir);
    }
}
