package com.largomodo.romaudit.core;

import com.largomodo.romaudit.catalog.CatalogStore;
import com.largomodo.romaudit.core.domain.CatalogStats;
import com.largomodo.romaudit.core.domain.Checksum;
import com.largomodo.romaudit.core.domain.ContentLocation;
import com.largomodo.romaudit.core.domain.ContentPart;
import com.largomodo.romaudit.core.domain.ContentRef;
import com.largomodo.romaudit.core.domain.Derivation;
import com.largomodo.romaudit.core.domain.EffectiveSet;
import com.largomodo.romaudit.core.domain.ExpectedPart;
import com.largomodo.romaudit.core.domain.Machine;
import com.largomodo.romaudit.core.domain.RomUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Aggregate questions over the catalog, answered from the {@link ChecksumIndex} and the store.
 * Holds no state of its own.
 */
public class QueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final CatalogStore store;
    private final ChecksumIndex index;
    private final ResolutionEngine resolution;

    public QueryEngine(CatalogStore store, ChecksumIndex index, ResolutionEngine resolution) {
        if (store == null || index == null || resolution == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.store = store;
        this.index = index;
        this.resolution = resolution;
    }

    /**
     * Content declared by at least two machines, with the declaring machines in name order.
     */
    public Map<Checksum, List<String>> sharedContent() {
        Map<Checksum, List<String>> shared = new TreeMap<>();
        index.groups().forEach((identity, refs) -> {
            Set<String> machines = new TreeSet<>();
            refs.forEach(ref -> machines.add(ref.machine()));
            if (machines.size() >= 2) {
                shared.put(index.checksumFor(identity), List.copyOf(machines));
            }
        });
        return shared;
    }

    /**
     * Clones whose full (non-merged) content can be built from a {@code cloneof} ancestor's full
     * content plus their own clone-specific parts. One entry per (clone, ancestor) pair, ancestors
     * nearest first. Every merge-tagged part must be covered by the ancestor. Machines related only
     * through {@code romof} (a parent booting from a bios) are not derivations; machines with
     * catalog integrity errors are left out.
     */
    public List<Derivation> derivableSets() {
        List<Derivation> derivations = new ArrayList<>();
        for (Machine machine : store.listMachines()) {
            List<String> ancestors;
            EffectiveSet own;
            try {
                ancestors = resolution.cloneAncestors(machine.name());
                if (ancestors.isEmpty()) {
                    continue;
                }
                own = resolution.resolve(machine.name(), PackagingPolicy.NON_MERGED);
            } catch (CatalogIntegrityException e) {
                logger.debug("Not deriving {}: {}", machine.name(), e.getMessage());
                continue;
            }
            for (String ancestor : ancestors) {
                derive(own, ancestor).ifPresent(derivations::add);
            }
        }
        return derivations;
    }

    private Optional<Derivation> derive(EffectiveSet own, String ancestor) {
        EffectiveSet full;
        try {
            full = resolution.resolve(ancestor, PackagingPolicy.NON_MERGED);
        } catch (CatalogIntegrityException e) {
            return Optional.empty();
        }
        List<String> shared = new ArrayList<>();
        List<String> added = new ArrayList<>();
        for (ExpectedPart part : own.parts()) {
            if (part.isNoDump()) {
                continue;
            }
            boolean inAncestor = full.parts().stream()
                    .anyMatch(p -> p.checksum() != null && p.checksum().matches(part.checksum()));
            if (inAncestor) {
                shared.add(part.name());
            } else if (part.merge() != null) {
                return Optional.empty();
            } else {
                added.add(part.name());
            }
        }
        if (shared.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Derivation(own.machine(), ancestor, shared, added));
    }

    public CatalogStats stats() {
        int noDump = 0;
        int parts = 0;
        int samples = 0;
        int deviceRefs = 0;
        int devices = 0;
        int bios = 0;
        int clones = 0;
        for (Machine machine : store.listMachines()) {
            for (ContentPart part : store.getPartsOf(machine.name())) {
                parts++;
                if (part.isNoDump()) {
                    noDump++;
                }
            }
            samples += store.getSamplesOf(machine.name()).size();
            deviceRefs += machine.deviceRefs().size();
            if (machine.device()) {
                devices++;
            }
            if (machine.bios()) {
                bios++;
            }
            if (machine.isClone()) {
                clones++;
            }
        }
        return new CatalogStats(store.size(), index.distinctChecksums(), noDump, devices,
                parts, samples, deviceRefs, bios, clones);
    }

    /**
     * Where else the content of one part of a machine is used, grouped by the archive it is
     * expected in under the policy.
     *
     * @throws IllegalArgumentException  if the machine declares no such part
     * @throws CatalogIntegrityException if the machine itself can not be resolved
     */
    public RomUsage romUsage(String machine, String partName, PackagingPolicy policy) {
        ContentPart part = store.getPartsOf(machine).stream()
                .filter(p -> p.name().equals(partName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Machine " + machine + " declares no part " + partName));
        String ownArchive = resolution.locate(machine, partName, policy)
                .map(ContentLocation::archive)
                .orElse(machine);

        Map<String, List<String>> usages = new TreeMap<>();
        List<String> unknown = new ArrayList<>();
        if (part.isNoDump()) {
            unknown.add(partName);
        } else {
            collectUsages(machine, part.checksum(), ownArchive, policy, usages);
            if (usages.isEmpty()) {
                unknown.add(partName);
            }
        }
        return new RomUsage(machine, usages, unknown);
    }

    /**
     * Other archives sharing content with the machine's effective set, with the machine's part
     * names found there. Parts used nowhere else are listed as unknown.
     */
    public RomUsage setUsage(String machine, PackagingPolicy policy) {
        EffectiveSet set = resolution.resolve(machine, policy);
        Map<String, Set<String>> byArchive = new TreeMap<>();
        List<String> unknown = new ArrayList<>();

        for (ExpectedPart part : set.parts()) {
            if (part.isNoDump()) {
                unknown.add(part.name());
                continue;
            }
            Map<String, List<String>> usages = new TreeMap<>();
            collectUsages(machine, part.checksum(), part.archive(), policy, usages);
            if (usages.isEmpty()) {
                unknown.add(part.name());
            }
            usages.keySet().forEach(archive -> byArchive.computeIfAbsent(archive, k -> new TreeSet<>()).add(part.name()));
        }

        Map<String, List<String>> usages = new TreeMap<>();
        byArchive.forEach((archive, names) -> usages.put(archive, List.copyOf(names)));
        return new RomUsage(machine, usages, unknown);
    }

    private void collectUsages(String machine, Checksum checksum, String excludedArchive, PackagingPolicy policy,
                               Map<String, List<String>> into) {
        Map<String, Set<String>> found = new TreeMap<>();
        for (ContentRef ref : index.lookup(checksum)) {
            if (ref.machine().equals(machine)) {
                continue;
            }
            ContentLocation location;
            try {
                location = resolution.locate(ref.machine(), ref.name(), policy)
                        .orElse(new ContentLocation(ref.machine(), ref.name()));
            } catch (CatalogIntegrityException e) {
                logger.debug("Placing {} as declared: {}", ref, e.getMessage());
                location = new ContentLocation(ref.machine(), ref.name());
            }
            if (location.archive().equals(excludedArchive)) {
                continue;
            }
            found.computeIfAbsent(location.archive(), k -> new TreeSet<>()).add(location.entry());
        }
        found.forEach((archive, names) -> into.put(archive, List.copyOf(names)));
    }
}
