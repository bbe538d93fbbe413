package com.citationconstellation;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Picks the entry-point {@code .tex} file of an unpacked paper.
 *
 * <p>Conventional names win ({@code main.tex}, {@code ms.tex}, {@code article.tex}); otherwise the
 * first file declaring {@code \documentclass}; otherwise the first {@code .tex} file by name.
 */
public final class MainDocumentLocator {

    private static final List<String> PREFERRED_NAMES = List.of("main.tex", "ms.tex", "article.tex");

    private MainDocumentLocator() {
    }

    public static Path locate(Path sourceDir) throws IOException {
        List<Path> texFiles = SourceFiles.listBySuffix(sourceDir, ".tex");
        if (texFiles.isEmpty()) {
            throw new NoSuchFileException(sourceDir.toString(), null, "no .tex files found");
        }

        for (String preferred : PREFERRED_NAMES) {
            for (Path tex : texFiles) {
                if (tex.getFileName().toString().equals(preferred)) {
                    return tex;
                }
            }
        }

        for (Path tex : texFiles) {
            if (SourceFiles.readLenient(tex).contains("\\documentclass")) {
                return tex;
            }
        }

        return texFiles.get(0);
    }
}
