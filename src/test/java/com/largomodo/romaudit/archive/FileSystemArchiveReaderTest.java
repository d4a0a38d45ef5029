package com.largomodo.romaudit.archive;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.largomodo.romaudit.RomFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FileSystemArchiveReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testListsZipFilesAndFoldersOnce() throws IOException {
        writeZip(tempDir.resolve("pacman.zip"), Map.of("pacman.6e", bytes("6e")));
        Files.createDirectory(tempDir.resolve("pacman"));
        Files.createDirectory(tempDir.resolve("kinst"));
        Files.writeString(tempDir.resolve("notes.txt"), "not an archive");

        FileSystemArchiveReader reader = new FileSystemArchiveReader(tempDir);

        assertEquals(List.of("kinst", "pacman"), reader.listArchives());
        assertTrue(reader.exists("kinst"));
        assertFalse(reader.exists("galaga"));
    }

    @Test
    void testReadsZipEntriesSortedByName() throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("pacman.6k", bytes("6k"));
        entries.put("pacman.6e", bytes("6e"));
        entries.put("sub/", new byte[0]);
        writeZip(tempDir.resolve("pacman.zip"), entries);

        List<ArchiveEntry> read = new FileSystemArchiveReader(tempDir).read("pacman");

        assertEquals(List.of("pacman.6e", "pacman.6k"), read.stream().map(ArchiveEntry::name).toList(),
                "Directory entries are skipped and the rest sorted");
        try (InputStream in = read.get(1).open()) {
            assertArrayEquals(bytes("6k"), in.readAllBytes());
        }
    }

    @Test
    void testCombinesZipAndFolderContent() throws IOException {
        writeZip(tempDir.resolve("kinst.zip"), Map.of("kinst.bin", bytes("kinst")));
        Path folder = Files.createDirectories(tempDir.resolve("kinst"));
        Files.write(folder.resolve("kinst.chd"), bytes("disk"));

        List<ArchiveEntry> read = new FileSystemArchiveReader(tempDir).read("kinst");

        assertEquals(List.of("kinst.bin", "kinst.chd"), read.stream().map(ArchiveEntry::name).toList());
        assertNotEquals(read.get(0).location(), read.get(1).location());
    }

    @Test
    void testNestedFolderEntriesUseSlashes() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("puckman").resolve("pacman"));
        Files.write(nested.resolve("pacman.6k"), bytes("6k"));

        List<ArchiveEntry> read = new FileSystemArchiveReader(tempDir).read("puckman");

        assertEquals("pacman/pacman.6k", read.get(0).name());
    }

    @Test
    void testMissingArchiveIsEmpty() throws IOException {
        assertTrue(new FileSystemArchiveReader(tempDir).read("galaga").isEmpty());
    }

    @Test
    void testCorruptZipFailsToOpen() throws IOException {
        Files.writeString(tempDir.resolve("broken.zip"), "this is not a zip file");

        assertThrows(IOException.class, () -> new FileSystemArchiveReader(tempDir).read("broken"));
    }

    @Test
    void testMissingRootFailsToList() {
        FileSystemArchiveReader reader = new FileSystemArchiveReader(tempDir.resolve("absent"));

        assertThrows(IOException.class, reader::listArchives);
    }
}
