package com.largomodo.romaudit.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Recognizes archives in a collection folder.
 * <p>
 * A machine's content is stored either as {@code <machine>.zip} or as a folder named after the
 * machine (the usual layout for CHD disk images). Hidden files are never archives.
 */
public class ArchiveMatcher {

    private static final String ZIP_EXTENSION = ".zip";

    private ArchiveMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * Check if path is a zip archive or an archive folder.
     *
     * @param path path to check (can be null)
     * @return true for a regular {@code .zip} file or a directory, false otherwise
     */
    public static boolean isArchive(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        String filename = path.getFileName().toString();
        if (filename.startsWith(".")) {
            return false;
        }
        if (Files.isDirectory(path)) {
            return true;
        }
        return Files.isRegularFile(path) && isZipName(filename);
    }

    public static boolean isZipName(String filename) {
        return filename.toLowerCase(Locale.ROOT).endsWith(ZIP_EXTENSION);
    }

    /**
     * Archive name of a path: the file name without a trailing {@code .zip}.
     */
    public static String archiveName(Path path) {
        String filename = path.getFileName().toString();
        if (isZipName(filename)) {
            return filename.substring(0, filename.length() - ZIP_EXTENSION.length());
        }
        return filename;
    }
}
