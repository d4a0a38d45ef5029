package com.largomodo.romaudit.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
        name = "stats",
        mixinStandardHelpOptions = true,
        header = "Prints catalog counters."
)
public class StatsCommand implements Callable<Integer> {

    @Mixin
    CatalogOptions catalog;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        CatalogSession session = catalog.load();
        spec.commandLine().getOut().print(
                ReportFormatter.formatStats(session.store().getHeader(), session.queries().stats()));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
