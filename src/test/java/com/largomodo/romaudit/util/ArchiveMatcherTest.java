package com.largomodo.romaudit.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveMatcherTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @ValueSource(strings = {"pacman.zip", "PACMAN.ZIP", "Pac Man.Zip"})
    void testZipFilesAreArchives(String filename) throws IOException {
        Path zip = Files.createFile(tempDir.resolve(filename));

        assertTrue(ArchiveMatcher.isArchive(zip));
    }

    @Test
    void testFoldersAreArchives() throws IOException {
        Path folder = Files.createDirectory(tempDir.resolve("kinst"));

        assertTrue(ArchiveMatcher.isArchive(folder));
        assertEquals("kinst", ArchiveMatcher.archiveName(folder));
    }

    @ParameterizedTest
    @ValueSource(strings = {"readme.txt", "pacman.7z", ".hidden.zip"})
    void testOtherFilesAreNotArchives(String filename) throws IOException {
        Path file = Files.createFile(tempDir.resolve(filename));

        assertFalse(ArchiveMatcher.isArchive(file));
    }

    @Test
    void testMissingPathAndNull() {
        assertFalse(ArchiveMatcher.isArchive(tempDir.resolve("absent.zip")),
                "A path that does not exist is not an archive");
        assertFalse(ArchiveMatcher.isArchive(null));
    }

    @Test
    void testArchiveNameStripsZipExtensionOnly() {
        assertEquals("pacman", ArchiveMatcher.archiveName(Path.of("roms", "pacman.ZIP")));
        assertEquals("pacman.7z", ArchiveMatcher.archiveName(Path.of("pacman.7z")));
    }
}
