package com.largomodo.romaudit.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
        name = "shared",
        mixinStandardHelpOptions = true,
        header = "Lists content declared by more than one machine."
)
public class SharedCommand implements Callable<Integer> {

    @Mixin
    CatalogOptions catalog;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        CatalogSession session = catalog.load();
        spec.commandLine().getOut().print(ReportFormatter.formatShared(session.queries().sharedContent()));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
