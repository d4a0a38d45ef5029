package com.largomodo.romaudit.archive;

import com.largomodo.romaudit.core.domain.ContentLocation;

import java.io.IOException;
import java.io.InputStream;

/**
 * A named byte stream inside an archive of the user's collection.
 *
 * @param archive  archive name (the machine name it is stored under)
 * @param name     entry name inside the archive, '/' separated
 * @param location unique physical location, used as the hash memo key
 * @param source   opens a fresh stream over the entry's bytes
 */
public record ArchiveEntry(String archive, String name, String location, Source source) {

    public ArchiveEntry {
        if (archive == null || name == null || location == null || source == null) {
            throw new IllegalArgumentException("archive, name, location and source must not be null");
        }
    }

    public InputStream open() throws IOException {
        return source.open();
    }

    public ContentLocation toLocation() {
        return new ContentLocation(archive, name);
    }

    @Override
    public String toString() {
        return archive + "/" + name;
    }

    /**
     * Opens the bytes of an entry. Each call returns a new stream the caller must close.
     */
    @FunctionalInterface
    public interface Source {
        InputStream open() throws IOException;
    }
}
