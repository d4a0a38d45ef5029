package com.largomodo.romaudit.cli;

import com.largomodo.romaudit.core.domain.RomUsage;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Where the content of a machine (or of one of its roms) is used by other archives.
 */
@Command(
        name = "usage",
        mixinStandardHelpOptions = true,
        header = "Shows which other archives use the content of a machine or rom.",
        description = {
                "Without ROM, lists every archive sharing content with the machine: the sets that can be",
                "partially rebuilt from it. With ROM, lists where that single rom is used."
        }
)
public class UsageCommand implements Callable<Integer> {

    @Mixin
    CatalogOptions catalog;

    @Parameters(index = "1", paramLabel = "MACHINE", description = "Machine to inspect.")
    String machine;

    @Parameters(index = "2", arity = "0..1", paramLabel = "ROM", description = "Single rom of the machine.")
    String rom;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        CatalogSession session = catalog.load();
        catalog.requireMachine(session, machine);

        RomUsage usage;
        if (rom == null) {
            usage = session.queries().setUsage(machine, catalog.mode);
        } else {
            boolean declared = session.store().getPartsOf(machine).stream().anyMatch(p -> p.name().equals(rom));
            if (!declared) {
                throw new ParameterException(spec.commandLine(), "Machine " + machine + " declares no rom " + rom);
            }
            usage = session.queries().romUsage(machine, rom, catalog.mode);
        }
        spec.commandLine().getOut().print(ReportFormatter.formatUsage(usage));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
