package com.largomodo.romaudit.core;

import com.largomodo.romaudit.catalog.CatalogStore;
import com.largomodo.romaudit.core.CatalogIntegrityException.IntegrityViolation;
import com.largomodo.romaudit.core.domain.ContentLocation;
import com.largomodo.romaudit.core.domain.ContentPart;
import com.largomodo.romaudit.core.domain.ContentRef;
import com.largomodo.romaudit.core.domain.EffectiveSet;
import com.largomodo.romaudit.core.domain.ExpectedPart;
import com.largomodo.romaudit.core.domain.ExpectedSample;
import com.largomodo.romaudit.core.domain.Issue;
import com.largomodo.romaudit.core.domain.IssueKind;
import com.largomodo.romaudit.core.domain.Machine;
import com.largomodo.romaudit.core.domain.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Computes the effective content set of a machine: which parts it needs and in which archive
 * each part is expected under a given {@link PackagingPolicy}.
 * <p>
 * Relations between machines are followed by name through the {@link CatalogStore}. Every walk is
 * bounded by the catalog size and tracks visited machines, so a malformed catalog with cyclic
 * ancestry fails the affected machine with {@link CatalogIntegrityException} instead of looping.
 * <p>
 * Placement rules:
 * <ul>
 *   <li>NON_MERGED: every declared part lives in the machine's own archive.</li>
 *   <li>SPLIT: a merge-tagged part lives in the archive of its owner, the nearest {@code romof}
 *       ancestor declaring that name without a merge tag.</li>
 *   <li>MERGED: a clone family shares the archive of its clone root. Clone parts colliding with a
 *       different part of the same name are stored as {@code <clone>/<name>}. Parts owned outside
 *       the family (bios) live in the owner's family archive. Each member still resolves to its own
 *       parts only; {@link #familyEntries(String)} lists what the shared archive holds.</li>
 * </ul>
 * Parts of {@code device_ref} targets are never added; devices are packaged separately and only
 * listed by name, see {@link #requiredDevices(String)}.
 * <p>
 * Thread-safe: the store is read-only and merged family layouts are memoized in a concurrent map.
 */
public class ResolutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ResolutionEngine.class);

    private final CatalogStore store;
    private final ConcurrentMap<String, FamilyLayout> layouts = new ConcurrentHashMap<>();

    public ResolutionEngine(CatalogStore store) {
        if (store == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.store = store;
    }

    public CatalogStore getStore() {
        return store;
    }

    /**
     * Resolve the effective content set of a machine.
     *
     * @param machineName machine to resolve
     * @param policy      packaging policy deciding expected physical locations
     * @return own parts and samples in declaration order
     * @throws CatalogIntegrityException if the machine is unknown, its ancestry is cyclic, a merge
     *                                   tag names nothing, a merged checksum disagrees with the
     *                                   ancestor, or two parts share a name with different content
     */
    public EffectiveSet resolve(String machineName, PackagingPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        Context context = context(machineName);
        List<Issue> issues = new ArrayList<>(context.issues());

        String archive = archiveOf(context, policy);
        List<ExpectedPart> parts = new ArrayList<>();
        for (ContentPart part : distinctParts(context.machine())) {
            Placement placement = place(context, part, policy);
            parts.add(expected(part, machineName, placement));
        }

        List<ExpectedSample> samples = resolveSamples(context, policy);
        List<String> devices = requiredDevices(context.machine());
        logger.debug("Resolved {} ({}): {} parts, {} samples, {} devices, archive {}",
                machineName, policy, parts.size(), samples.size(), devices.size(), archive);
        return new EffectiveSet(machineName, policy, archive, parts, samples, devices, issues);
    }

    /**
     * Devices referenced by the machine that declare parts of their own, so their archives are
     * needed next to the machine's. Devices without parts and unknown references are left out.
     *
     * @throws CatalogIntegrityException if the machine is unknown
     */
    public List<String> requiredDevices(String machineName) {
        Machine machine = store.getMachine(machineName)
                .orElseThrow(() -> new CatalogIntegrityException(machineName, IntegrityViolation.UNKNOWN_MACHINE,
                        "Machine not in catalog: " + machineName));
        return requiredDevices(machine);
    }

    private List<String> requiredDevices(Machine machine) {
        return machine.deviceRefs().stream()
                .distinct()
                .filter(device -> !store.getPartsOf(device).isEmpty())
                .toList();
    }

    /**
     * Archive holding the machine's own content under the policy: the clone root for MERGED,
     * the machine itself otherwise.
     */
    public String archiveOf(String machineName, PackagingPolicy policy) {
        return archiveOf(context(machineName), policy);
    }

    /**
     * Physical location (archive and entry name) where one declared part of a machine is expected.
     *
     * @return empty when the machine declares no part with that name
     */
    public Optional<ContentLocation> locate(String machineName, String partName, PackagingPolicy policy) {
        Context context = context(machineName);
        for (ContentPart part : distinctParts(context.machine())) {
            if (part.name().equals(partName)) {
                Placement placement = place(context, part, policy);
                return Optional.of(new ContentLocation(placement.archive(), part.type().entryName(placement.name())));
            }
        }
        return Optional.empty();
    }

    /**
     * Entry names claimed by any member of a merged clone family inside its root archive.
     */
    public Set<String> familyEntries(String root) {
        return layout(root).entries();
    }

    /**
     * Top of the {@code cloneof} chain; the machine itself when it is not a clone.
     */
    public String cloneRoot(String machineName) {
        return cloneRoot(context(machineName));
    }

    /**
     * {@code romof} ancestors, nearest first. Absent ancestors end the list.
     */
    public List<String> romAncestors(String machineName) {
        return context(machineName).romChain().ancestors();
    }

    /**
     * {@code cloneof} ancestors, nearest first.
     */
    public List<String> cloneAncestors(String machineName) {
        return context(machineName).cloneChain().ancestors();
    }

    private Context context(String machineName) {
        Machine machine = store.getMachine(machineName)
                .orElseThrow(() -> new CatalogIntegrityException(machineName, IntegrityViolation.UNKNOWN_MACHINE,
                        "Machine not in catalog: " + machineName));
        Chain romChain = walk(machineName, store::resolveRomParent, "romof");
        Chain cloneChain = walk(machineName, store::resolveCloneParent, "cloneof");
        Chain sampleChain = walk(machineName, store::resolveSampleParent, "sampleof");

        List<Issue> issues = new ArrayList<>();
        addDangling(issues, machineName, "romof", romChain);
        addDangling(issues, machineName, "cloneof", cloneChain);
        addDangling(issues, machineName, "sampleof", sampleChain);
        return new Context(machine, romChain, cloneChain, sampleChain, issues);
    }

    private static void addDangling(List<Issue> issues, String machine, String relation, Chain chain) {
        if (chain.dangling() == null) {
            return;
        }
        String message = relation + " ancestor '" + chain.dangling() + "' of " + machine + " is not in the catalog";
        logger.debug(message);
        issues.add(new Issue(IssueKind.UNRESOLVED_ANCESTOR, message));
    }

    /**
     * Follow one parent relation until it ends, leaves the catalog, or loops.
     */
    private Chain walk(String start, Function<String, Optional<String>> parentOf, String relation) {
        List<String> ancestors = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(start);
        int bound = store.size();
        String current = start;

        while (true) {
            String parent = parentOf.apply(current).orElse(null);
            if (parent == null) {
                return new Chain(List.copyOf(ancestors), null);
            }
            if (!visited.add(parent) || ancestors.size() >= bound) {
                throw new CatalogIntegrityException(start, IntegrityViolation.CYCLIC_ANCESTRY,
                        "Cyclic " + relation + " ancestry of " + start + " through " + parent);
            }
            if (store.getMachine(parent).isEmpty()) {
                return new Chain(List.copyOf(ancestors), parent);
            }
            ancestors.add(parent);
            current = parent;
        }
    }

    private String archiveOf(Context context, PackagingPolicy policy) {
        return policy == PackagingPolicy.MERGED ? cloneRoot(context) : context.machine().name();
    }

    private static String cloneRoot(Context context) {
        List<String> ancestors = context.cloneChain().ancestors();
        return ancestors.isEmpty() ? context.machine().name() : ancestors.get(ancestors.size() - 1);
    }

    private Placement place(Context context, ContentPart part, PackagingPolicy policy) {
        String machineName = context.machine().name();
        Owner owner = part.isMerged() ? ownerOf(context, part) : null;

        return switch (policy) {
            case NON_MERGED -> new Placement(machineName, part.name());
            case SPLIT -> owner == null
                    ? new Placement(machineName, part.name())
                    : new Placement(owner.machine(), owner.part().name());
            case MERGED -> {
                if (owner == null) {
                    String root = cloneRoot(context);
                    String name = part.isMerged()
                            ? part.name()
                            : layout(root).names().getOrDefault(new ContentRef(machineName, part.name()), part.name());
                    yield new Placement(root, name);
                }
                String ownerRoot = cloneRoot(context(owner.machine()));
                String name = layout(ownerRoot).names()
                        .getOrDefault(new ContentRef(owner.machine(), owner.part().name()), owner.part().name());
                yield new Placement(ownerRoot, name);
            }
        };
    }

    /**
     * Find the ancestor part that physically supplies a merge-tagged part.
     *
     * @return the owner, or null when the chain leaves the catalog before an owner is found
     */
    private Owner ownerOf(Context context, ContentPart part) {
        String machineName = context.machine().name();
        String wanted = part.merge();
        ContentPart first = null;

        for (String ancestor : context.romChain().ancestors()) {
            ContentPart declared = findPart(ancestor, wanted, part);
            if (declared == null) {
                continue;
            }
            if (first == null) {
                first = declared;
                if (part.checksum() != null && declared.checksum() != null
                        && !part.checksum().matches(declared.checksum())) {
                    throw new CatalogIntegrityException(machineName, IntegrityViolation.MERGE_CHECKSUM_MISMATCH,
                            "Part " + part.name() + " of " + machineName + " merges " + ancestor + ":"
                                    + declared.name() + " with different content");
                }
            }
            if (!declared.isMerged()) {
                return new Owner(ancestor, declared);
            }
            wanted = declared.merge();
        }

        if (context.romChain().dangling() != null) {
            return null;
        }
        throw new CatalogIntegrityException(machineName, IntegrityViolation.DANGLING_MERGE,
                "Part " + part.name() + " of " + machineName + " merges '" + wanted
                        + "' which no romof ancestor declares");
    }

    private ContentPart findPart(String machine, String name, ContentPart like) {
        for (ContentPart candidate : store.getPartsOf(machine)) {
            if (candidate.name().equals(name) && candidate.type() == like.type()) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Own parts with exact duplicates collapsed; conflicting duplicates are an integrity failure.
     */
    private List<ContentPart> distinctParts(Machine machine) {
        Map<String, ContentPart> byEntry = new LinkedHashMap<>();
        for (ContentPart part : store.getPartsOf(machine.name())) {
            ContentPart existing = byEntry.putIfAbsent(part.entryName(), part);
            if (existing == null) {
                continue;
            }
            if (sameContent(existing, part) && Objects.equals(existing.merge(), part.merge())) {
                logger.debug("Ignoring repeated declaration of {} in {}", part.name(), machine.name());
                continue;
            }
            throw new CatalogIntegrityException(machine.name(), IntegrityViolation.DUPLICATE_PART_NAME,
                    "Machine " + machine.name() + " declares " + part.entryName() + " twice with different content");
        }
        return new ArrayList<>(byEntry.values());
    }

    private FamilyLayout layout(String root) {
        return layouts.computeIfAbsent(root, this::computeLayout);
    }

    /**
     * Entry names of every non-merged part of a clone family inside the root archive.
     * Root parts come first and keep their names; clones follow in name order.
     */
    private FamilyLayout computeLayout(String root) {
        Map<String, ContentPart> occupied = new HashMap<>();
        Map<ContentRef, String> names = new LinkedHashMap<>();

        for (String member : family(root)) {
            for (ContentPart part : store.getPartsOf(member)) {
                if (part.isMerged()) {
                    continue;
                }
                ContentRef ref = new ContentRef(member, part.name());
                if (names.containsKey(ref)) {
                    continue;
                }
                ContentPart existing = occupied.get(part.entryName());
                String name;
                if (existing == null) {
                    name = part.name();
                } else if (sameContent(existing, part)) {
                    names.put(ref, names.getOrDefault(new ContentRef(existing.machine(), existing.name()), part.name()));
                    continue;
                } else {
                    name = member + "/" + part.name();
                }
                occupied.put(part.type().entryName(name), part);
                names.put(ref, name);
            }
        }
        return new FamilyLayout(Collections.unmodifiableMap(names), Set.copyOf(occupied.keySet()));
    }

    /**
     * Root followed by all transitive clones, breadth first, each level in name order.
     */
    private List<String> family(String root) {
        List<String> members = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root);
        visited.add(root);
        while (!queue.isEmpty()) {
            String member = queue.poll();
            members.add(member);
            for (Machine clone : store.getClonesOf(member)) {
                if (visited.add(clone.name())) {
                    queue.add(clone.name());
                }
            }
        }
        return members;
    }

    private List<ExpectedSample> resolveSamples(Context context, PackagingPolicy policy) {
        String machineName = context.machine().name();
        List<String> sampleAncestors = context.sampleChain().ancestors();
        List<ExpectedSample> samples = new ArrayList<>();

        for (Sample sample : store.getSamplesOf(machineName)) {
            String archive = switch (policy) {
                case NON_MERGED -> machineName;
                case SPLIT -> topmostDeclaring(sampleAncestors, sample.name()).orElse(machineName);
                case MERGED -> sampleAncestors.isEmpty()
                        ? machineName
                        : sampleAncestors.get(sampleAncestors.size() - 1);
            };
            samples.add(new ExpectedSample(sample.name(), machineName, archive));
        }
        return samples;
    }

    private Optional<String> topmostDeclaring(List<String> ancestors, String sampleName) {
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            String ancestor = ancestors.get(i);
            boolean declares = store.getSamplesOf(ancestor).stream().anyMatch(s -> s.name().equals(sampleName));
            if (declares) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    private static ExpectedPart expected(ContentPart part, String origin, Placement placement) {
        boolean required = !part.isNoDump() && !part.optional();
        return new ExpectedPart(placement.name(), part.type(), part.checksum(), part.size(),
                required, origin, placement.archive(), part.merge());
    }

    private static boolean sameContent(ContentPart a, ContentPart b) {
        if (a.checksum() == null || b.checksum() == null) {
            return a.checksum() == null && b.checksum() == null;
        }
        return a.checksum().matches(b.checksum());
    }

    private record Chain(List<String> ancestors, String dangling) {
    }

    private record Context(Machine machine, Chain romChain, Chain cloneChain, Chain sampleChain,
                           List<Issue> issues) {
    }

    private record Owner(String machine, ContentPart part) {
    }

    private record Placement(String archive, String name) {
    }

    private record FamilyLayout(Map<ContentRef, String> names, Set<String> entries) {
    }
}
