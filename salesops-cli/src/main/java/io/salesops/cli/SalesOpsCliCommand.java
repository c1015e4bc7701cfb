package io.salesops.cli;

import picocli.CommandLine.Command;

@Command(name = "salesops", mixinStandardHelpOptions = true, description = "Sales conversation auditor")
public final class SalesOpsCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
