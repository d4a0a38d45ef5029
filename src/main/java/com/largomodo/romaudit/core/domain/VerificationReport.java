package com.largomodo.romaudit.core.domain;

import com.largomodo.romaudit.core.PackagingPolicy;

import java.util.List;

/**
 * Per-machine diagnostic produced by the verification engine.
 * <p>
 * Reports are independent units: a report never refers to the state of another machine's
 * verification, so partial batches are always valid to emit.
 *
 * @param machine    verified machine
 * @param policy     packaging policy the archive was checked against
 * @param archive    archive whose entries were supplied
 * @param status     overall verdict
 * @param parts      one result per expected part, in effective-set order
 * @param unneeded   supplied entries claimed by no expected part
 * @param unreadable supplied entries that could not be hashed
 * @param samples    sample presence results
 * @param issues     catalog and I/O problems attached to this machine
 */
public record VerificationReport(
        String machine,
        PackagingPolicy policy,
        String archive,
        SetStatus status,
        List<PartResult> parts,
        List<UnneededFile> unneeded,
        List<String> unreadable,
        List<SampleResult> samples,
        List<Issue> issues
) {
    public VerificationReport {
        parts = List.copyOf(parts);
        unneeded = List.copyOf(unneeded);
        unreadable = List.copyOf(unreadable);
        samples = List.copyOf(samples);
        issues = List.copyOf(issues);
    }

    /**
     * Report for a machine excluded from verification because its catalog data is inconsistent.
     */
    public static VerificationReport unverifiable(String machine, PackagingPolicy policy, Issue issue) {
        return new VerificationReport(machine, policy, machine, SetStatus.UNVERIFIABLE,
                List.of(), List.of(), List.of(), List.of(), List.of(issue));
    }

    public List<PartResult> partsWith(PartStatus partStatus) {
        return parts.stream().filter(r -> r.status() == partStatus).toList();
    }

    public long count(PartStatus partStatus) {
        return parts.stream().filter(r -> r.status() == partStatus).count();
    }

    public PartResult resultFor(String partName) {
        return parts.stream()
                .filter(r -> r.name().equals(partName))
                .findFirst()
                .orElse(null);
    }

    public boolean hasIssue(IssueKind kind) {
        return issues.stream().anyMatch(i -> i.kind() == kind);
    }

    public List<SampleResult> missingSamples() {
        return samples.stream().filter(s -> !s.present()).toList();
    }
}
