package com.largomodo.romaudit.core.domain;

/**
 * A physical entry in the user's collection: archive name plus entry name.
 */
public record ContentLocation(String archive, String entry) implements Comparable<ContentLocation> {

    @Override
    public int compareTo(ContentLocation o) {
        int byArchive = archive.compareTo(o.archive);
        return byArchive != 0 ? byArchive : entry.compareTo(o.entry);
    }

    @Override
    public String toString() {
        return archive + "/" + entry;
    }
}
