package com.largomodo.romaudit.core;

import com.largomodo.romaudit.catalog.CatalogStore;
import com.largomodo.romaudit.core.domain.Checksum;
import com.largomodo.romaudit.core.domain.ContentPart;
import com.largomodo.romaudit.core.domain.ContentRef;
import com.largomodo.romaudit.core.domain.Machine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Catalog-wide map from content checksum to every (machine, name) declaring it.
 * <p>
 * Immutable once built. Loading new catalog data means building a new index and swapping the
 * reference; concurrent readers never see a partially built index. No-dump parts are not indexed.
 * <p>
 * Duplicates are preserved: the same content under several names, or in several machines,
 * yields one {@link ContentRef} per declaration. A CRC-only declaration joins the SHA1 group of
 * the content it matches when exactly one such group exists.
 */
public final class ChecksumIndex {

    private static final Logger logger = LoggerFactory.getLogger(ChecksumIndex.class);

    private final Map<String, List<IndexedPart>> bySha1;
    private final Map<String, List<IndexedPart>> byCrc;
    private final Map<String, List<ContentRef>> byIdentity;
    private final Map<String, Checksum> representatives;
    private final int size;

    private ChecksumIndex(Map<String, List<IndexedPart>> bySha1,
                          Map<String, List<IndexedPart>> byCrc,
                          Map<String, List<ContentRef>> byIdentity,
                          Map<String, Checksum> representatives,
                          int size) {
        this.bySha1 = bySha1;
        this.byCrc = byCrc;
        this.byIdentity = byIdentity;
        this.representatives = representatives;
        this.size = size;
    }

    /**
     * Index every dumped part of the store.
     */
    public static ChecksumIndex build(CatalogStore store) {
        Map<String, List<IndexedPart>> bySha1 = new HashMap<>();
        Map<String, List<IndexedPart>> byCrc = new HashMap<>();
        Map<String, List<ContentRef>> byIdentity = new TreeMap<>();
        Map<String, Checksum> representatives = new HashMap<>();
        int size = 0;

        for (Machine machine : store.listMachines()) {
            for (ContentPart part : store.getPartsOf(machine.name())) {
                Checksum checksum = part.checksum();
                if (checksum == null) {
                    continue;
                }
                IndexedPart indexed = new IndexedPart(new ContentRef(machine.name(), part.name()), checksum);
                if (checksum.sha1() != null) {
                    bySha1.computeIfAbsent(checksum.sha1(), k -> new ArrayList<>()).add(indexed);
                }
                if (checksum.crc32() != null) {
                    byCrc.computeIfAbsent(checksum.crc32(), k -> new ArrayList<>()).add(indexed);
                }
                byIdentity.computeIfAbsent(checksum.identity(), k -> new ArrayList<>()).add(indexed.ref());
                representatives.merge(checksum.identity(), checksum,
                        (known, candidate) -> known.crc32() == null && candidate.crc32() != null ? candidate : known);
                size++;
            }
        }
        mergeCrcOnlyGroups(byIdentity, representatives, byCrc);

        Map<String, List<ContentRef>> frozen = new TreeMap<>();
        byIdentity.forEach((identity, refs) -> frozen.put(identity, List.copyOf(new TreeSet<>(refs))));

        logger.debug("Checksum index built: {} declarations, {} distinct checksums", size, frozen.size());
        return new ChecksumIndex(freeze(bySha1), freeze(byCrc),
                Collections.unmodifiableMap(frozen), Map.copyOf(representatives), size);
    }

    /**
     * Every declaration whose checksum matches, sorted by machine then name.
     */
    public List<ContentRef> lookup(Checksum checksum) {
        if (checksum == null) {
            return List.of();
        }
        TreeSet<ContentRef> refs = new TreeSet<>();
        if (checksum.sha1() != null) {
            collect(bySha1.get(checksum.sha1()), checksum, refs);
        }
        if (checksum.crc32() != null) {
            collect(byCrc.get(checksum.crc32()), checksum, refs);
        }
        return List.copyOf(refs);
    }

    public boolean contains(Checksum checksum) {
        return !lookup(checksum).isEmpty();
    }

    /**
     * Declarations grouped by {@link Checksum#identity()}, in identity order.
     */
    public Map<String, List<ContentRef>> groups() {
        return byIdentity;
    }

    /**
     * A checksum carrying the given identity, as first declared in the catalog.
     */
    public Checksum checksumFor(String identity) {
        return representatives.get(identity);
    }

    public int distinctChecksums() {
        return byIdentity.size();
    }

    /**
     * Total indexed declarations.
     */
    public int size() {
        return size;
    }

    private static void collect(List<IndexedPart> candidates, Checksum checksum, TreeSet<ContentRef> into) {
        if (candidates == null) {
            return;
        }
        for (IndexedPart candidate : candidates) {
            if (candidate.checksum().matches(checksum)) {
                into.add(candidate.ref());
            }
        }
    }

    private static void mergeCrcOnlyGroups(Map<String, List<ContentRef>> byIdentity,
                                           Map<String, Checksum> representatives,
                                           Map<String, List<IndexedPart>> byCrc) {
        List<String> crcOnly = byIdentity.keySet().stream().filter(identity -> identity.startsWith("crc:")).toList();
        for (String identity : crcOnly) {
            Checksum checksum = representatives.get(identity);
            Set<String> targets = new TreeSet<>();
            for (IndexedPart candidate : byCrc.getOrDefault(checksum.crc32(), List.of())) {
                if (candidate.checksum().sha1() != null) {
                    targets.add(candidate.checksum().identity());
                }
            }
            if (targets.size() != 1) {
                continue;
            }
            String target = targets.iterator().next();
            byIdentity.get(target).addAll(byIdentity.remove(identity));
            representatives.remove(identity);
            logger.debug("CRC-only {} grouped with {}", identity, target);
        }
    }

    private static Map<String, List<IndexedPart>> freeze(Map<String, List<IndexedPart>> map) {
        Map<String, List<IndexedPart>> copy = new HashMap<>();
        map.forEach((key, list) -> copy.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }

    private record IndexedPart(ContentRef ref, Checksum checksum) {
    }
}
