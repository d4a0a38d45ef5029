package com.largomodo.romaudit.archive;

import java.io.IOException;
import java.util.List;

/**
 * Enumerates the archives of a collection and the entries they currently hold.
 * <p>
 * Container formats stay behind this interface; callers only see names and byte streams.
 */
public interface ArchiveReader {

    /**
     * Names of all archives present, sorted.
     *
     * @throws IOException if the collection can not be listed
     */
    List<String> listArchives() throws IOException;

    boolean exists(String archive);

    /**
     * Entries of an archive sorted by name; empty when the archive does not exist.
     *
     * @throws IOException if the archive exists but can not be opened
     */
    List<ArchiveEntry> read(String archive) throws IOException;
}
