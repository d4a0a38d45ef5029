package com.largomodo.romaudit.archive;

import com.largomodo.romaudit.core.CatalogIntegrityException;
import com.largomodo.romaudit.core.ChecksumIndex;
import com.largomodo.romaudit.core.ResolutionEngine;
import com.largomodo.romaudit.core.domain.Checksum;
import com.largomodo.romaudit.core.domain.ContentLocation;
import com.largomodo.romaudit.core.domain.ContentRef;
import com.largomodo.romaudit.hash.ContentHasher;
import com.largomodo.romaudit.hash.HashedContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Collection view backed by an {@link ArchiveReader}, hashing entries on demand.
 * <p>
 * {@link #locate(Checksum)} does not scan the whole collection: it asks the checksum index which
 * machines declare the content and inspects their archives and those of their ancestors (where the
 * content sits under split or merged packaging). The candidates depend on the catalog only, never on
 * which archives were listed before, so results do not vary with verification order.
 * Hashes go through the shared {@link ContentHasher}, so no entry is read twice.
 */
public class ArchiveCollection implements CollectionContentView {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveCollection.class);

    private final ArchiveReader reader;
    private final ContentHasher hasher;
    private final ChecksumIndex index;
    private final ResolutionEngine resolution;
    private final ConcurrentMap<String, List<ArchiveEntry>> listings = new ConcurrentHashMap<>();

    public ArchiveCollection(ArchiveReader reader, ContentHasher hasher,
                             ChecksumIndex index, ResolutionEngine resolution) {
        if (reader == null || hasher == null || index == null || resolution == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.reader = reader;
        this.hasher = hasher;
        this.index = index;
        this.resolution = resolution;
    }

    /**
     * Entries of an archive, listed once per run.
     *
     * @throws IOException if the archive exists but can not be opened
     */
    public List<ArchiveEntry> entries(String archive) throws IOException {
        List<ArchiveEntry> cached = listings.get(archive);
        if (cached != null) {
            return cached;
        }
        List<ArchiveEntry> read = List.copyOf(reader.read(archive));
        List<ArchiveEntry> existing = listings.putIfAbsent(archive, read);
        return existing != null ? existing : read;
    }

    @Override
    public List<ContentLocation> locate(Checksum checksum) {
        if (checksum == null) {
            return List.of();
        }
        Set<String> candidates = new TreeSet<>();
        for (ContentRef ref : index.lookup(checksum)) {
            candidates.add(ref.machine());
            try {
                candidates.addAll(resolution.romAncestors(ref.machine()));
                candidates.addAll(resolution.cloneAncestors(ref.machine()));
            } catch (CatalogIntegrityException e) {
                logger.debug("Not following ancestry of {}: {}", ref.machine(), e.getMessage());
            }
        }

        List<ContentLocation> found = new ArrayList<>();
        for (String archive : candidates) {
            if (!listings.containsKey(archive) && !reader.exists(archive)) {
                continue;
            }
            contentsOf(archive).forEach((name, content) -> {
                if (checksum.matches(content.checksum())) {
                    found.add(new ContentLocation(archive, name));
                }
            });
        }
        Collections.sort(found);
        return found;
    }

    @Override
    public Map<String, HashedContent> contentsOf(String archive) {
        Map<String, HashedContent> contents = new TreeMap<>();
        for (ArchiveEntry entry : listingOrEmpty(archive)) {
            try {
                contents.putIfAbsent(entry.name(), hasher.hash(entry));
            } catch (IOException e) {
                logger.debug("Skipping unreadable entry {}: {}", entry, e.getMessage());
            }
        }
        return contents;
    }

    @Override
    public Set<String> entryNames(String archive) {
        Set<String> names = new LinkedHashSet<>();
        for (ArchiveEntry entry : listingOrEmpty(archive)) {
            names.add(entry.name());
        }
        return names;
    }

    private List<ArchiveEntry> listingOrEmpty(String archive) {
        try {
            return entries(archive);
        } catch (IOException e) {
            logger.warn("Cannot open archive {}: {}", archive, e.getMessage());
            listings.putIfAbsent(archive, List.of());
            return List.of();
        }
    }
}
