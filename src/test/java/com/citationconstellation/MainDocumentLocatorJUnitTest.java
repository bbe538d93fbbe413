package com.citationconstellation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainDocumentLocatorJUnitTest {

    @TempDir
    Path dir;

    @Test
    void prefersConventionalNames() throws IOException {
        Files.writeString(dir.resolve("a.tex"), "\\documentclass{article}");
        Files.writeString(dir.resolve("ms.tex"), "body");
        Files.writeString(dir.resolve("main.tex"), "body");

        assertEquals(dir.resolve("main.tex"), MainDocumentLocator.locate(dir));
    }

    @Test
    void otherwiseFileDeclaringDocumentClass() throws IOException {
        Files.writeString(dir.resolve("a_macros.tex"), "\\newcommand{\\x}{y}");
        Files.writeString(dir.resolve("paper.tex"), "\\documentclass[twocolumn]{revtex4}");

        assertEquals(dir.resolve("paper.tex"), MainDocumentLocator.locate(dir));
    }

    @Test
    void otherwiseFirstByName() throws IOException {
        Files.writeString(dir.resolve("z.tex"), "z");
        Files.writeString(dir.resolve("b.tex"), "b");

        assertEquals(dir.resolve("b.tex"), MainDocumentLocator.locate(dir));
    }

    @Test
    void noTexFiles() throws IOException {
        Files.writeString(dir.resolve("refs.bib"), "");

        assertThrows(NoSuchFileException.class, () -> MainDocumentLocator.locate(dir));
    }
}
