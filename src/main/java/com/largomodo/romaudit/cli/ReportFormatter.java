package com.largomodo.romaudit.cli;

import com.largomodo.romaudit.catalog.DatHeader;
import com.largomodo.romaudit.core.domain.BatchSummary;
import com.largomodo.romaudit.core.domain.CatalogStats;
import com.largomodo.romaudit.core.domain.Checksum;
import com.largomodo.romaudit.core.domain.Derivation;
import com.largomodo.romaudit.core.domain.EffectiveSet;
import com.largomodo.romaudit.core.domain.ExpectedPart;
import com.largomodo.romaudit.core.domain.ExpectedSample;
import com.largomodo.romaudit.core.domain.Issue;
import com.largomodo.romaudit.core.domain.PartResult;
import com.largomodo.romaudit.core.domain.RomUsage;
import com.largomodo.romaudit.core.domain.SampleResult;
import com.largomodo.romaudit.core.domain.UnneededFile;
import com.largomodo.romaudit.core.domain.VerificationReport;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Plain-text rendering of engine results for the terminal.
 */
final class ReportFormatter {

    private static final String NL = System.lineSeparator();

    private ReportFormatter() {
        // Static utility class - prevent instantiation
    }

    /**
     * One header line per machine, then one line per part that is not OK.
     */
    static String format(VerificationReport report, boolean withSamples) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(report.status()).append("] ").append(report.machine())
                .append(" (").append(report.policy()).append(", archive ").append(report.archive()).append(')')
                .append(NL);

        for (PartResult result : report.parts()) {
            String expected = location(report, result.part());
            switch (result.status()) {
                case OK -> {
                    continue;
                }
                case MISNAMED -> line(sb, "MISNAMED", expected, "rename from " + result.currentName());
                case FIXABLE -> line(sb, "FIXABLE", expected, "copy from " + result.donor());
                case MISSING -> line(sb, "MISSING", expected, result.cause());
                case UNKNOWN -> line(sb, "UNKNOWN", expected, "no dump");
                case DUPLICATE_CONTENT_UNRESOLVED ->
                        line(sb, "DUPLICATE", expected, "same content as " + result.currentName());
            }
        }
        for (UnneededFile file : report.unneeded()) {
            String note = file.isMisplaced()
                    ? "wanted by " + file.wantedBy().stream().map(Object::toString).collect(Collectors.joining(", "))
                    : null;
            line(sb, "UNNEEDED", file.entry(), note);
        }
        for (String entry : report.unreadable()) {
            line(sb, "UNREADABLE", entry, null);
        }
        if (withSamples) {
            for (SampleResult sample : report.missingSamples()) {
                line(sb, "NO SAMPLE", sample.sample().archive() + "/" + sample.sample().name(), null);
            }
        }
        for (Issue issue : report.issues()) {
            line(sb, "ISSUE", issue.toString(), null);
        }
        return sb.toString();
    }

    static String formatSummary(BatchSummary summary) {
        return String.format("Verified %d machines: %d complete, %d fixable, %d incomplete, %d unverifiable, "
                        + "%d failed, %d skipped%n",
                summary.verified(), summary.complete(), summary.fixable(), summary.incomplete(),
                summary.unverifiable(), summary.failed(), summary.skipped());
    }

    static String formatSet(EffectiveSet set) {
        StringBuilder sb = new StringBuilder();
        sb.append(set.machine()).append(" (").append(set.policy()).append(", archive ").append(set.archive())
                .append(')').append(NL);
        for (ExpectedPart part : set.parts()) {
            sb.append("  ").append(part.archive()).append('/').append(part.entryName());
            sb.append("  ").append(part.checksum() == null ? "nodump" : part.checksum().toString());
            if (part.size() != null) {
                sb.append("  size ").append(part.size());
            }
            if (!part.required()) {
                sb.append("  (not required)");
            }
            if (!part.origin().equals(set.machine())) {
                sb.append("  from ").append(part.origin());
            }
            sb.append(NL);
        }
        for (ExpectedSample sample : set.samples()) {
            sb.append("  sample ").append(sample.archive()).append('/').append(sample.name()).append(NL);
        }
        for (String device : set.devices()) {
            sb.append("  device ").append(device).append(NL);
        }
        for (Issue issue : set.issues()) {
            sb.append("  ISSUE ").append(issue).append(NL);
        }
        return sb.toString();
    }

    static String formatUsage(RomUsage usage) {
        StringBuilder sb = new StringBuilder();
        if (usage.usages().isEmpty()) {
            sb.append(usage.machine()).append(": content not used by any other archive").append(NL);
        }
        for (Map.Entry<String, List<String>> entry : usage.usages().entrySet()) {
            sb.append(entry.getKey()).append(": ").append(String.join(", ", entry.getValue())).append(NL);
        }
        if (!usage.unknown().isEmpty()) {
            sb.append("Used nowhere else: ").append(String.join(", ", usage.unknown())).append(NL);
        }
        return sb.toString();
    }

    static String formatShared(Map<Checksum, List<String>> shared) {
        StringBuilder sb = new StringBuilder();
        shared.forEach((checksum, machines) ->
                sb.append(checksum.identity()).append(": ").append(String.join(", ", machines)).append(NL));
        return sb.toString();
    }

    static String formatDerivation(Derivation derivation) {
        return derivation.machine() + " <- " + derivation.ancestor()
                + ": " + derivation.sharedParts().size() + " shared, "
                + derivation.newParts().size() + " new"
                + (derivation.newParts().isEmpty() ? "" : " (" + String.join(", ", derivation.newParts()) + ")")
                + NL;
    }

    static String formatStats(DatHeader header, CatalogStats stats) {
        StringBuilder sb = new StringBuilder();
        String headerText = header.toString();
        if (!headerText.isEmpty()) {
            sb.append(headerText).append(NL);
        }
        sb.append("Machines:           ").append(stats.machines()).append(NL);
        sb.append("  devices:          ").append(stats.deviceMachines()).append(NL);
        sb.append("  bios:             ").append(stats.biosMachines()).append(NL);
        sb.append("  clones:           ").append(stats.clones()).append(NL);
        sb.append("Parts:              ").append(stats.parts()).append(NL);
        sb.append("  no dump:          ").append(stats.noDumpParts()).append(NL);
        sb.append("Distinct checksums: ").append(stats.distinctChecksums()).append(NL);
        sb.append("Samples:            ").append(stats.samples()).append(NL);
        sb.append("Device references:  ").append(stats.deviceRefs()).append(NL);
        return sb.toString();
    }

    private static String location(VerificationReport report, ExpectedPart part) {
        if (part.archive().equals(report.archive())) {
            return part.entryName();
        }
        return part.archive() + "/" + part.entryName();
    }

    private static void line(StringBuilder sb, String label, String subject, String note) {
        sb.append("  ").append(String.format("%-10s ", label)).append(subject);
        if (note != null) {
            sb.append("  (").append(note).append(')');
        }
        sb.append(NL);
    }
}
