package com.largomodo.romaudit.cli;

import com.largomodo.romaudit.core.CatalogIntegrityException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Prints effective content sets.
 */
@Command(
        name = "resolve",
        mixinStandardHelpOptions = true,
        header = "Prints what machines require and where each part is expected."
)
public class ResolveCommand implements Callable<Integer> {

    @Mixin
    CatalogOptions catalog;

    @Parameters(index = "1..*", arity = "1..*", paramLabel = "MACHINE", description = "Machines to resolve.")
    List<String> machines;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        CatalogSession session = catalog.load();
        machines.forEach(machine -> catalog.requireMachine(session, machine));
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        int exitCode = 0;
        for (String machine : machines) {
            try {
                out.print(ReportFormatter.formatSet(session.resolution().resolve(machine, catalog.mode)));
            } catch (CatalogIntegrityException e) {
                err.println(machine + ": " + e.getViolation() + " - " + e.getMessage());
                exitCode = 1;
            }
        }
        out.flush();
        err.flush();
        return exitCode;
    }
}
