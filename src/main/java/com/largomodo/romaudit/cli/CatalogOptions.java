package com.largomodo.romaudit.cli;

import com.largomodo.romaudit.catalog.DatFileParser;
import com.largomodo.romaudit.core.PackagingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Options shared by every sub-command: the catalog file, the packaging mode and verbosity.
 */
public class CatalogOptions {

    @Parameters(index = "0", paramLabel = "DAT",
            description = "Logiqx or MAME XML catalog describing the machines.")
    Path datFile;

    @Option(names = {"-m", "--mode"}, defaultValue = "split", paramLabel = "MODE",
            description = {
                    "Packaging of the collection: split, merged or non-merged.",
                    "Default: ${DEFAULT-VALUE}"
            })
    PackagingPolicy mode;

    @Spec(Spec.Target.MIXEE)
    CommandSpec mixee;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    void setVerbose(boolean verbose) {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }
    }

    /**
     * Parse the catalog and build the engines.
     *
     * @throws ParameterException if the DAT path is not a readable file
     * @throws IOException        if reading the DAT fails
     */
    CatalogSession load() throws IOException {
        if (!Files.isRegularFile(datFile)) {
            throw new ParameterException(mixee.commandLine(),
                    "DAT file does not exist: " + datFile.toAbsolutePath());
        }
        if (!Files.isReadable(datFile)) {
            throw new ParameterException(mixee.commandLine(),
                    "DAT file is not readable (check permissions): " + datFile.toAbsolutePath());
        }
        return CatalogSession.of(new DatFileParser().parse(datFile));
    }

    /**
     * Fail with a usage error unless the catalog knows the machine.
     */
    void requireMachine(CatalogSession session, String machine) {
        if (session.store().getMachine(machine).isEmpty()) {
            throw new ParameterException(mixee.commandLine(), "Unknown machine: " + machine);
        }
    }
}
