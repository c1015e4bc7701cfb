package io.salesops.cli;

import io.salesops.core.config.ConfigPaths;
import io.salesops.core.config.model.RemoteStorageConfig;
import io.salesops.core.config.model.SalesOpsConfig;
import io.salesops.core.ledger.LedgerStores;
import io.salesops.core.ledger.MemoryLedger;
import java.nio.file.Files;
import java.time.Clock;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and ledger status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SalesOpsConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Mode: " + config.watch().normalizedMode());
            System.out.println("Poll interval: " + config.watch().pollInterval().toSeconds() + "s");
            System.out.println("Backoff interval: " + config.watch().backoff().toSeconds() + "s");
            if (config.watch().remote()) {
                RemoteStorageConfig remote = config.storage().remote();
                System.out.println("Storage backend: " + remote.backend());
                System.out.println("Input bucket: " + remote.inputBucket());
                System.out.println("Output bucket: " + remote.outputBucket());
            } else {
                System.out.println("Input root: " + ConfigPaths.resolve(config.storage().local().inputRoot()));
                System.out.println("Output root: " + ConfigPaths.resolve(config.storage().local().outputRoot()));
            }
            System.out.println("Analyzer: " + config.analyzer().provider() + " / " + config.analyzer().model());
            config.providers().byName().forEach((name, provider) ->
                System.out.println("Provider " + name + " configured: " + provider.configured())
            );
            System.out.println("Ledger backend: " + config.ledger().backend());
            System.out.println("Ledger records: " + ledgerSize(config));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private String ledgerSize(SalesOpsConfig config) {
        try {
            MemoryLedger ledger = new MemoryLedger(
                LedgerStores.create(config.ledger(), config.storage().remote().supabase()),
                Clock.systemUTC()
            );
            int size = ledger.size();
            return size < 0 ? "unavailable" : String.valueOf(size);
        } catch (Exception e) {
            return "unavailable (" + e.getMessage() + ")";
        }
    }
}
