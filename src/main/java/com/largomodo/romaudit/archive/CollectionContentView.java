package com.largomodo.romaudit.archive;

import com.largomodo.romaudit.core.domain.Checksum;
import com.largomodo.romaudit.core.domain.ContentLocation;
import com.largomodo.romaudit.hash.HashedContent;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view over the whole user collection, answering content questions from real bytes.
 * <p>
 * Content identity is always computed by hashing; entry names are never trusted.
 */
public interface CollectionContentView {

    /**
     * Every location in the collection currently holding content matching the checksum, sorted.
     */
    List<ContentLocation> locate(Checksum checksum);

    /**
     * Hashed entries of one archive by entry name. Unreadable entries are left out; a missing
     * archive yields an empty map.
     */
    Map<String, HashedContent> contentsOf(String archive);

    /**
     * Entry names of one archive without hashing them.
     */
    Set<String> entryNames(String archive);

    /**
     * A collection with nothing in it.
     */
    static CollectionContentView empty() {
        return new CollectionContentView() {
            @Override
            public List<ContentLocation> locate(Checksum checksum) {
                return List.of();
            }

            @Override
            public Map<String, HashedContent> contentsOf(String archive) {
                return Map.of();
            }

            @Override
            public Set<String> entryNames(String archive) {
                return Set.of();
            }
        };
    }
}
