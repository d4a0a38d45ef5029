package com.largomodo.romaudit.core.domain;

import com.largomodo.romaudit.core.PackagingPolicy;

import java.util.List;

/**
 * Fully resolved content requirement of one machine under one packaging policy.
 *
 * @param machine  machine name
 * @param policy   packaging policy used for resolution
 * @param archive  archive holding the machine's own content under {@code policy}
 * @param parts    expected parts in a stable order
 * @param samples  expected samples in a stable order
 * @param devices  referenced devices whose own archives must be present, in declaration order
 * @param issues   non-fatal problems found while resolving (dangling ancestors)
 */
public record EffectiveSet(
        String machine,
        PackagingPolicy policy,
        String archive,
        List<ExpectedPart> parts,
        List<ExpectedSample> samples,
        List<String> devices,
        List<Issue> issues
) {
    public EffectiveSet {
        parts = List.copyOf(parts);
        samples = List.copyOf(samples);
        devices = List.copyOf(devices);
        issues = List.copyOf(issues);
    }

    /**
     * Parts expected inside {@link #archive()}.
     */
    public List<ExpectedPart> localParts() {
        return parts.stream().filter(p -> p.archive().equals(archive)).toList();
    }

    /**
     * Parts expected in some other archive (an ancestor or a bios).
     */
    public List<ExpectedPart> remoteParts() {
        return parts.stream().filter(p -> !p.archive().equals(archive)).toList();
    }
}
