package com.largomodo.romaudit.cli;

import com.largomodo.romaudit.archive.ArchiveCollection;
import com.largomodo.romaudit.archive.CollectionContentView;
import com.largomodo.romaudit.archive.FileSystemArchiveReader;
import com.largomodo.romaudit.core.BatchVerifier;
import com.largomodo.romaudit.core.CatalogIntegrityException;
import com.largomodo.romaudit.core.PackagingPolicy;
import com.largomodo.romaudit.core.VerificationEngine;
import com.largomodo.romaudit.core.VerificationObserver;
import com.largomodo.romaudit.core.domain.BatchSummary;
import com.largomodo.romaudit.core.domain.Machine;
import com.largomodo.romaudit.core.domain.VerificationReport;
import com.largomodo.romaudit.hash.ContentHasher;
import com.largomodo.romaudit.hash.Crc32Sha1Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Verifies the archives of a collection folder concurrently.
 * <p>
 * By default only machines whose archive exists are verified; {@code --all} verifies every
 * machine of the catalog, so absent archives show up as incomplete.
 */
@Command(
        name = "verify",
        mixinStandardHelpOptions = true,
        header = "Verifies a collection folder against the catalog.",
        description = {
                "Hashes every entry of every archive (zip file or folder named after the machine) and compares",
                "the content with what each machine requires under the chosen packaging mode."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Every verified machine is complete",
                "1:General execution error",
                "2:Invalid command line arguments",
                "3:Some verified machines are not complete"
        }
)
public class VerifyCommand implements Callable<Integer> {

    static final int EXIT_NOT_COMPLETE = 3;

    private static final Logger log = LoggerFactory.getLogger(VerifyCommand.class);

    @Mixin
    CatalogOptions catalog;

    @Parameters(index = "1", paramLabel = "ROMDIR",
            description = "Collection folder holding <machine>.zip files and <machine>/ folders.")
    Path romDir;

    @Option(names = "--samples", paramLabel = "DIR",
            description = "Folder holding sample archives. Missing samples are reported but never affect the status.")
    Path samplesDir;

    @Option(names = "--all", description = "Verify every machine of the catalog, not only those with an archive.")
    boolean all;

    @Option(names = {"-j", "--threads"}, paramLabel = "N",
            description = {"Worker threads.", "Default: number of processors"})
    int threads = Runtime.getRuntime().availableProcessors();

    @Option(names = "--only", split = ",", paramLabel = "NAME",
            description = "Verify only these machines.")
    List<String> only;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        if (!Files.isDirectory(romDir)) {
            throw new ParameterException(spec.commandLine(),
                    "ROM folder does not exist: " + romDir.toAbsolutePath());
        }
        if (samplesDir != null && !Files.isDirectory(samplesDir)) {
            throw new ParameterException(spec.commandLine(),
                    "Samples folder does not exist: " + samplesDir.toAbsolutePath());
        }
        if (threads < 1) {
            throw new ParameterException(spec.commandLine(), "--threads must be at least 1, got: " + threads);
        }

        CatalogSession session = catalog.load();
        PackagingPolicy policy = catalog.mode;
        PrintWriter out = spec.commandLine().getOut();

        ContentHasher hasher = new ContentHasher(new Crc32Sha1Function());
        FileSystemArchiveReader reader = new FileSystemArchiveReader(romDir);
        ArchiveCollection collection = new ArchiveCollection(reader, hasher, session.index(), session.resolution());
        CollectionContentView samples = samplesDir == null
                ? CollectionContentView.empty()
                : new ArchiveCollection(new FileSystemArchiveReader(samplesDir), hasher,
                session.index(), session.resolution());
        VerificationEngine engine = new VerificationEngine(session.resolution(), session.index(), hasher,
                collection, samples);

        List<String> present = reader.listArchives();
        List<String> machines = selectMachines(session, present, policy);
        for (String archive : present) {
            if (session.store().getMachine(archive).isEmpty()) {
                out.println("Not in catalog: " + archive);
            }
        }
        log.info("Verifying {} machines in {} mode with {} threads", machines.size(), policy, threads);

        BatchVerifier verifier = new BatchVerifier(engine, collection::entries, threads);
        VerificationObserver observer = new VerificationObserver() {
            @Override
            public void onReport(VerificationReport report) {
                String text = ReportFormatter.format(report, samplesDir != null);
                synchronized (out) {
                    out.print(text);
                    out.flush();
                }
            }

            @Override
            public void onFailure(String machine, Exception e) {
                log.error("FAILED: {} - {}", machine, e.getMessage());
            }
        };

        // Shutdown hook for graceful SIGINT handling
        Thread hook = new Thread(verifier::cancel);
        Runtime.getRuntime().addShutdownHook(hook);
        BatchSummary summary;
        try {
            summary = verifier.run(machines, policy, observer);
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, hook stays registered");
            }
        }

        out.print(ReportFormatter.formatSummary(summary));
        out.flush();
        return summary.allComplete() ? 0 : EXIT_NOT_COMPLETE;
    }

    private List<String> selectMachines(CatalogSession session, List<String> present, PackagingPolicy policy) {
        if (only != null && !only.isEmpty()) {
            only.forEach(name -> catalog.requireMachine(session, name));
            return List.copyOf(only);
        }
        Set<String> archives = new HashSet<>(present);
        List<String> selected = new ArrayList<>();
        for (Machine machine : session.store().listMachines()) {
            if (all || archives.contains(archiveOf(session, machine.name(), policy))) {
                selected.add(machine.name());
            }
        }
        return selected;
    }

    private static String archiveOf(CatalogSession session, String machine, PackagingPolicy policy) {
        try {
            return session.resolution().archiveOf(machine, policy);
        } catch (CatalogIntegrityException e) {
            return machine;
        }
    }
}
