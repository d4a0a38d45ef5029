package com.largomodo.romaudit.core;

import com.largomodo.romaudit.archive.ArchiveEntry;
import com.largomodo.romaudit.archive.CollectionContentView;
import com.largomodo.romaudit.core.domain.ContentRef;
import com.largomodo.romaudit.core.domain.EffectiveSet;
import com.largomodo.romaudit.core.domain.ExpectedPart;
import com.largomodo.romaudit.core.domain.ExpectedSample;
import com.largomodo.romaudit.core.domain.Issue;
import com.largomodo.romaudit.core.domain.IssueKind;
import com.largomodo.romaudit.core.domain.PartResult;
import com.largomodo.romaudit.core.domain.PartStatus;
import com.largomodo.romaudit.core.domain.SampleResult;
import com.largomodo.romaudit.core.domain.SetStatus;
import com.largomodo.romaudit.core.domain.UnneededFile;
import com.largomodo.romaudit.core.domain.VerificationReport;
import com.largomodo.romaudit.hash.ContentHasher;
import com.largomodo.romaudit.hash.HashedContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Matches the real content of an archive against a machine's effective set.
 * <p>
 * Content identity is always computed from bytes through the {@link ContentHasher}; entry names
 * only decide between OK and MISNAMED. Matching runs in passes over name-sorted entries, so the
 * result does not depend on the order entries are supplied in:
 * <ol>
 *   <li>exact name and content: OK</li>
 *   <li>content under another, unclaimed name: MISNAMED</li>
 *   <li>content only present in an entry already claimed by a sibling part: DUPLICATE_CONTENT_UNRESOLVED</li>
 *   <li>expected entry or the whole archive unreadable: MISSING with the I/O cause</li>
 *   <li>content elsewhere in the collection: FIXABLE with a donor location, otherwise MISSING</li>
 * </ol>
 * No-dump parts are always UNKNOWN. Parts expected in another archive (split and merged
 * inheritance) are checked in that archive through the {@link CollectionContentView}.
 * <p>
 * Stateless apart from its collaborators; safe to call from several worker threads.
 */
public class VerificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(VerificationEngine.class);

    private final ResolutionEngine resolution;
    private final ChecksumIndex index;
    private final ContentHasher hasher;
    private final CollectionContentView collection;
    private final CollectionContentView samples;

    public VerificationEngine(ResolutionEngine resolution, ChecksumIndex index, ContentHasher hasher,
                              CollectionContentView collection, CollectionContentView samples) {
        if (resolution == null || index == null || hasher == null || collection == null || samples == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.resolution = resolution;
        this.index = index;
        this.hasher = hasher;
        this.collection = collection;
        this.samples = samples;
    }

    public VerificationEngine(ResolutionEngine resolution, ChecksumIndex index, ContentHasher hasher,
                              CollectionContentView collection) {
        this(resolution, index, hasher, collection, CollectionContentView.empty());
    }

    public ResolutionEngine getResolution() {
        return resolution;
    }

    /**
     * Verify one machine.
     *
     * @param machine  machine to verify
     * @param supplied entries currently present in the machine's archive under {@code policy}
     * @param policy   packaging policy of the collection
     * @return the report; catalog integrity failures yield an UNVERIFIABLE report instead of throwing
     */
    public VerificationReport verify(String machine, List<ArchiveEntry> supplied, PackagingPolicy policy) {
        return verify(machine, supplied, policy, null);
    }

    /**
     * Report for a machine whose archive could not be opened at all: every part expected in that
     * archive is MISSING with the cause attached, which is also reported as an UNREADABLE issue.
     * Parts expected in other archives are checked as usual.
     */
    public VerificationReport verifyUnreadable(String machine, PackagingPolicy policy, IOException cause) {
        return verify(machine, List.of(), policy, cause.getMessage());
    }

    private VerificationReport verify(String machine, List<ArchiveEntry> supplied, PackagingPolicy policy,
                                      String archiveFailure) {
        Objects.requireNonNull(supplied, "supplied");
        EffectiveSet set;
        try {
            set = resolution.resolve(machine, policy);
        } catch (CatalogIntegrityException e) {
            logger.warn("Skipping {}: {}", machine, e.getMessage());
            return VerificationReport.unverifiable(machine, policy, new Issue(IssueKind.CATALOG_INTEGRITY, e.getMessage()));
        }

        List<Issue> issues = new ArrayList<>();
        if (archiveFailure != null) {
            issues.add(new Issue(IssueKind.UNREADABLE, "Archive " + set.archive() + " can not be opened: " + archiveFailure));
        }
        issues.addAll(set.issues());

        List<Supplied> entries = new ArrayList<>();
        Map<String, String> unreadable = new HashMap<>();
        List<ArchiveEntry> sorted = new ArrayList<>(supplied);
        sorted.sort(Comparator.comparing(ArchiveEntry::name).thenComparing(ArchiveEntry::location));
        for (ArchiveEntry entry : sorted) {
            try {
                entries.add(new Supplied(entry, hasher.hash(entry)));
            } catch (IOException e) {
                logger.warn("Unreadable entry {}: {}", entry, e.getMessage());
                unreadable.putIfAbsent(entry.name(), e.getMessage());
                issues.add(new Issue(IssueKind.UNREADABLE, entry.name() + ": " + e.getMessage()));
            }
        }

        Matching matching = new Matching(set, entries, unreadable, archiveFailure);
        PartResult[] results = new PartResult[set.parts().size()];
        matchLocal(matching, results);
        matchRemote(matching, results);

        List<PartResult> partResults = List.of(results);
        List<UnneededFile> unneeded = unneeded(matching);
        List<SampleResult> sampleResults = checkSamples(set);
        SetStatus status = overallStatus(partResults);

        logger.debug("Verified {}: {} ({} parts, {} unneeded)", machine, status, partResults.size(), unneeded.size());
        return new VerificationReport(machine, policy, set.archive(), status, partResults, unneeded,
                unreadable.keySet().stream().sorted().toList(), sampleResults, issues);
    }

    private void matchLocal(Matching m, PartResult[] results) {
        List<ExpectedPart> parts = m.set.parts();
        String archive = m.set.archive();

        for (int i = 0; i < parts.size(); i++) {
            ExpectedPart part = parts.get(i);
            if (!part.archive().equals(archive)) {
                continue;
            }
            if (part.isNoDump()) {
                results[i] = PartResult.unknown(part);
                m.claimedNames.add(part.entryName());
                continue;
            }
            Supplied exact = m.findUnconsumed(part, true);
            if (exact != null) {
                m.consume(exact);
                results[i] = PartResult.ok(part);
            }
        }

        for (int i = 0; i < parts.size(); i++) {
            ExpectedPart part = parts.get(i);
            if (results[i] != null || !part.archive().equals(archive)) {
                continue;
            }
            Supplied renamed = m.findUnconsumed(part, false);
            if (renamed != null) {
                m.consume(renamed);
                results[i] = PartResult.misnamed(part, renamed.entry().name());
            }
        }

        for (int i = 0; i < parts.size(); i++) {
            ExpectedPart part = parts.get(i);
            if (results[i] != null || !part.archive().equals(archive)) {
                continue;
            }
            Supplied copy = m.findConsumed(part);
            if (copy != null) {
                results[i] = PartResult.duplicate(part, copy.entry().name());
            } else if (m.archiveFailure != null) {
                results[i] = PartResult.missing(part, "unreadable archive: " + m.archiveFailure);
            } else if (m.unreadable.containsKey(part.entryName())) {
                m.claimedNames.add(part.entryName());
                results[i] = PartResult.missing(part, "unreadable: " + m.unreadable.get(part.entryName()));
            } else {
                results[i] = fromCollection(part, archive);
            }
        }
    }

    /**
     * Parts expected in an ancestor archive. A copy under the exact name in the machine's own
     * archive also satisfies them. Entries the ancestor needs under their current name are never
     * proposed for a rename.
     */
    private void matchRemote(Matching m, PartResult[] results) {
        List<ExpectedPart> parts = m.set.parts();
        Map<String, Set<String>> ownedByArchive = new HashMap<>();
        for (int i = 0; i < parts.size(); i++) {
            ExpectedPart part = parts.get(i);
            if (part.archive().equals(m.set.archive())) {
                continue;
            }
            if (part.isNoDump()) {
                results[i] = PartResult.unknown(part);
                continue;
            }
            Map<String, HashedContent> target = collection.contentsOf(part.archive());
            HashedContent atName = target.get(part.entryName());
            if (atName != null && part.acceptsContent(atName.checksum(), atName.size())) {
                results[i] = PartResult.ok(part);
                continue;
            }
            Supplied local = m.findUnconsumed(part, true);
            if (local != null) {
                m.consume(local);
                results[i] = PartResult.ok(part);
                continue;
            }
            Set<String> owned = ownedByArchive.computeIfAbsent(part.archive(),
                    archive -> ownedEntries(archive, m.set.policy()));
            Optional<String> renamed = target.entrySet().stream()
                    .filter(e -> !owned.contains(e.getKey()))
                    .filter(e -> part.acceptsContent(e.getValue().checksum(), e.getValue().size()))
                    .map(Map.Entry::getKey)
                    .findFirst();
            if (renamed.isPresent()) {
                results[i] = PartResult.misnamed(part, renamed.get());
                continue;
            }
            Supplied misplaced = m.findUnconsumed(part, false);
            if (misplaced != null) {
                m.consume(misplaced);
                results[i] = PartResult.fixable(part, misplaced.entry().toLocation());
                continue;
            }
            results[i] = fromCollection(part, part.archive());
        }
    }

    /**
     * Entry names an archive's own machine expects in it under the policy.
     */
    private Set<String> ownedEntries(String archive, PackagingPolicy policy) {
        try {
            if (policy == PackagingPolicy.MERGED) {
                return resolution.familyEntries(archive);
            }
            Set<String> names = new HashSet<>();
            for (ExpectedPart part : resolution.resolve(archive, policy).localParts()) {
                names.add(part.entryName());
            }
            return names;
        } catch (CatalogIntegrityException e) {
            logger.debug("No owned entries for {}: {}", archive, e.getMessage());
            return Set.of();
        }
    }

    private PartResult fromCollection(ExpectedPart part, String excludedArchive) {
        return collection.locate(part.checksum()).stream()
                .filter(location -> !location.archive().equals(excludedArchive))
                .findFirst()
                .map(donor -> PartResult.fixable(part, donor))
                .orElseGet(() -> PartResult.missing(part, null));
    }

    private List<UnneededFile> unneeded(Matching m) {
        Set<String> family = m.set.policy() == PackagingPolicy.MERGED
                ? resolution.familyEntries(m.set.archive())
                : Set.of();
        List<UnneededFile> unneeded = new ArrayList<>();
        for (Supplied supplied : m.entries) {
            String name = supplied.entry().name();
            if (m.consumed.contains(supplied) || m.claimedNames.contains(name) || family.contains(name)) {
                continue;
            }
            List<ContentRef> wantedBy = index.lookup(supplied.content().checksum()).stream()
                    .filter(ref -> !ref.machine().equals(m.set.machine()))
                    .toList();
            unneeded.add(new UnneededFile(name, supplied.content().checksum(), supplied.content().size(), wantedBy));
        }
        return unneeded;
    }

    private List<SampleResult> checkSamples(EffectiveSet set) {
        Map<String, Set<String>> byArchive = new HashMap<>();
        List<SampleResult> results = new ArrayList<>();
        for (ExpectedSample sample : set.samples()) {
            Set<String> names = byArchive.computeIfAbsent(sample.archive(), samples::entryNames);
            boolean present = names.contains(sample.name() + ".wav") || names.contains(sample.name());
            results.add(new SampleResult(sample, present));
        }
        return results;
    }

    /**
     * COMPLETE when every required part is OK, FIXABLE when every other required part can be
     * repaired by a rename or a copy, INCOMPLETE otherwise.
     */
    static SetStatus overallStatus(List<PartResult> results) {
        boolean complete = true;
        for (PartResult result : results) {
            if (!result.part().required() || result.status() == PartStatus.OK) {
                continue;
            }
            complete = false;
            if (!result.status().isRepairable()) {
                return SetStatus.INCOMPLETE;
            }
        }
        return complete ? SetStatus.COMPLETE : SetStatus.FIXABLE;
    }

    private record Supplied(ArchiveEntry entry, HashedContent content) {
    }

    /**
     * Mutable matching state of one verification call.
     */
    private static final class Matching {
        private final EffectiveSet set;
        private final List<Supplied> entries;
        private final Map<String, String> unreadable;
        private final String archiveFailure;
        private final Set<Supplied> consumed = new HashSet<>();
        private final Set<String> claimedNames = new HashSet<>();

        private Matching(EffectiveSet set, List<Supplied> entries, Map<String, String> unreadable,
                         String archiveFailure) {
            this.set = set;
            this.entries = entries;
            this.unreadable = unreadable;
            this.archiveFailure = archiveFailure;
        }

        private Supplied findUnconsumed(ExpectedPart part, boolean exactName) {
            for (Supplied supplied : entries) {
                if (consumed.contains(supplied)) {
                    continue;
                }
                if (exactName && !supplied.entry().name().equals(part.entryName())) {
                    continue;
                }
                if (part.acceptsContent(supplied.content().checksum(), supplied.content().size())) {
                    return supplied;
                }
            }
            return null;
        }

        private Supplied findConsumed(ExpectedPart part) {
            for (Supplied supplied : entries) {
                if (consumed.contains(supplied)
                        && part.acceptsContent(supplied.content().checksum(), supplied.content().size())) {
                    return supplied;
                }
            }
            return null;
        }

        private void consume(Supplied supplied) {
            consumed.add(supplied);
        }
    }
}
