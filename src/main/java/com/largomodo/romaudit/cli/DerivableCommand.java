package com.largomodo.romaudit.cli;

import com.largomodo.romaudit.core.domain.Derivation;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
        name = "derivable",
        mixinStandardHelpOptions = true,
        header = "Lists machines that can be built from an ancestor plus their own new parts."
)
public class DerivableCommand implements Callable<Integer> {

    @Mixin
    CatalogOptions catalog;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        CatalogSession session = catalog.load();
        PrintWriter out = spec.commandLine().getOut();
        for (Derivation derivation : session.queries().derivableSets()) {
            out.print(ReportFormatter.formatDerivation(derivation));
        }
        out.flush();
        return 0;
    }
}
