package com.largomodo.romaudit.cli;

import com.largomodo.romaudit.core.PackagingPolicy;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI entry point for auditing ROM collections against DAT catalogs.
 * <p>
 * Umbrella command; the work happens in the sub-commands. Every sub-command takes the DAT file
 * as first parameter and accepts {@code --mode} and {@code --verbose}.
 */
@Command(
        name = "romaudit",
        mixinStandardHelpOptions = true,
        resourceBundle = "romaudit.romaudit",
        version = "${bundle:application.version}",
        header = "Audits ROM collections against DAT catalogs.",
        description = {
                "Resolves clone and merge inheritance of Logiqx/MAME DAT catalogs and verifies zip archives" +
                        " or folders of a collection against them, in split, merged or non-merged packaging.",
                "",
                "Reports missing, misnamed and unneeded files and where missing content can be copied from."
        },
        subcommands = {
                VerifyCommand.class,
                ResolveCommand.class,
                UsageCommand.class,
                SharedCommand.class,
                DerivableCommand.class,
                StatsCommand.class
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, malformed DAT, etc.)",
                "2:Invalid command line arguments",
                "3:Verification found machines that are not complete"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class RomAudit implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the converters and parser settings every entry point needs.
     */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new RomAudit());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.registerConverter(PackagingPolicy.class, PackagingPolicy::fromCliArgument);
        return cmd;
    }

    @Override
    public Integer call() {
        // No sub-command given
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
