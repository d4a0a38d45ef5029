package com.largomodo.romaudit.archive;

import com.largomodo.romaudit.util.ArchiveMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads a collection folder where each machine is a {@code <machine>.zip} file, a
 * {@code <machine>/} folder, or both (roms zipped, CHDs in the folder).
 * <p>
 * Entry streams are opened lazily; listing an archive never reads entry data.
 */
public class FileSystemArchiveReader implements ArchiveReader {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemArchiveReader.class);

    private final Path root;

    public FileSystemArchiveReader(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public List<String> listArchives() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Collection folder does not exist: " + root);
        }
        try (Stream<Path> stream = Files.list(root)) {
            return stream.filter(ArchiveMatcher::isArchive)
                    .map(ArchiveMatcher::archiveName)
                    .distinct()
                    .sorted()
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    @Override
    public boolean exists(String archive) {
        return Files.isRegularFile(zipPath(archive)) || Files.isDirectory(folderPath(archive));
    }

    @Override
    public List<ArchiveEntry> read(String archive) throws IOException {
        List<ArchiveEntry> entries = new ArrayList<>();
        Path zip = zipPath(archive);
        if (Files.isRegularFile(zip)) {
            readZip(archive, zip, entries);
        }
        Path folder = folderPath(archive);
        if (Files.isDirectory(folder)) {
            readFolder(archive, folder, entries);
        }
        entries.sort(Comparator.comparing(ArchiveEntry::name).thenComparing(ArchiveEntry::location));
        logger.debug("Archive {} holds {} entries", archive, entries.size());
        return entries;
    }

    private void readZip(String archive, Path zip, List<ArchiveEntry> entries) throws IOException {
        try (ZipFile zipFile = new ZipFile(zip.toFile())) {
            Enumeration<? extends ZipEntry> zipEntries = zipFile.entries();
            while (zipEntries.hasMoreElements()) {
                ZipEntry entry = zipEntries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                String name = entry.getName();
                entries.add(new ArchiveEntry(archive, name, zip + "!" + name, () -> openZipEntry(zip, name)));
            }
        }
    }

    private void readFolder(String archive, Path folder, List<ArchiveEntry> entries) throws IOException {
        try (Stream<Path> stream = Files.walk(folder)) {
            stream.filter(Files::isRegularFile).forEach(file -> {
                String name = folder.relativize(file).toString().replace('\\', '/');
                entries.add(new ArchiveEntry(archive, name, file.toString(), () -> Files.newInputStream(file)));
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Opens one entry; the zip file is closed together with the returned stream.
     */
    private static InputStream openZipEntry(Path zip, String name) throws IOException {
        ZipFile zipFile = new ZipFile(zip.toFile());
        try {
            ZipEntry entry = zipFile.getEntry(name);
            if (entry == null) {
                throw new IOException("Entry " + name + " vanished from " + zip);
            }
            return new FilterInputStream(zipFile.getInputStream(entry)) {
                @Override
                public void close() throws IOException {
                    try {
                        super.close();
                    } finally {
                        zipFile.close();
                    }
                }
            };
        } catch (IOException | RuntimeException e) {
            zipFile.close();
            throw e;
        }
    }

    private Path zipPath(String archive) {
        return root.resolve(archive + ".zip");
    }

    private Path folderPath(String archive) {
        return root.resolve(archive);
    }
}
