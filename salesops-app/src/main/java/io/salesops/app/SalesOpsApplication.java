package io.salesops.app;

import io.salesops.cli.CliContext;
import io.salesops.cli.OnboardCommand;
import io.salesops.cli.SalesOpsCliCommand;
import io.salesops.cli.StatusCommand;
import io.salesops.cli.WatchCommand;
import io.salesops.core.analysis.Analyzer;
import io.salesops.core.analysis.LlmAnalyzer;
import io.salesops.core.api.HealthServer;
import io.salesops.core.config.ConfigPaths;
import io.salesops.core.config.ConfigService;
import io.salesops.core.config.model.AnalyzerConfig;
import io.salesops.core.config.model.ProviderConfig;
import io.salesops.core.config.model.ProvidersConfig;
import io.salesops.core.config.model.RemoteStorageConfig;
import io.salesops.core.config.model.SalesOpsConfig;
import io.salesops.core.config.model.WatchConfig;
import io.salesops.core.dispatch.CycleReport;
import io.salesops.core.dispatch.Dispatcher;
import io.salesops.core.dispatch.PollLoop;
import io.salesops.core.fingerprint.ContentFingerprinter;
import io.salesops.core.ledger.LedgerStores;
import io.salesops.core.ledger.MemoryLedger;
import io.salesops.core.provider.DisabledProvider;
import io.salesops.core.provider.FallbackLlmProvider;
import io.salesops.core.provider.LlmProvider;
import io.salesops.core.provider.OpenAiCompatProvider;
import io.salesops.core.report.LocalReportSink;
import io.salesops.core.report.ObjectStorageReportSink;
import io.salesops.core.report.ReportSink;
import io.salesops.core.source.LocalFolderWorkSource;
import io.salesops.core.source.ObjectStorageWorkSource;
import io.salesops.core.source.WorkSource;
import io.salesops.core.storage.ObjectStorage;
import io.salesops.core.storage.S3Clients;
import io.salesops.core.storage.S3ObjectStorage;
import io.salesops.core.storage.SupabaseStorageClient;
import io.salesops.core.supabase.SupabaseClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class SalesOpsApplication {
    private static final Logger LOG = LoggerFactory.getLogger(SalesOpsApplication.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(2);

    private SalesOpsApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            (path, mode, once) -> runWatch(configService, path, mode, once)
        );

        CommandLine commandLine = new CommandLine(new SalesOpsCliCommand());
        commandLine.addSubcommand("watch", new WatchCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("onboard", new OnboardCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static int runWatch(ConfigService configService, Path configPath, String modeOverride, boolean once) throws Exception {
        SalesOpsConfig config = configService.load(configPath);
        if (modeOverride != null && !modeOverride.isBlank()) {
            config = config.withWatch(config.watch().withMode(modeOverride));
        }
        WatchConfig watch = config.watch();
        String mode = watch.normalizedMode();
        Clock clock = Clock.systemUTC();

        Dispatcher dispatcher = buildDispatcher(config, clock);
        PollLoop loop = new PollLoop(dispatcher, watch.pollInterval(), watch.backoff(), clock);

        if (once) {
            CycleReport report = loop.runOnce();
            return report.enumerationFailed() ? 1 : 0;
        }

        HealthServer healthServer = null;
        if (watch.remote() && config.server().enabled()) {
            healthServer = new HealthServer(config.server().host(), config.server().port(), mode, loop::lastReport);
            healthServer.start();
        }
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested, finishing the current item");
            loop.stop();
            try {
                if (!loop.awaitTermination(SHUTDOWN_GRACE)) {
                    LOG.warn("Poll loop did not stop within {}s", SHUTDOWN_GRACE.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "salesops-shutdown"));

        try {
            LOG.info("Watching in {} mode", mode);
            loop.run();
        } finally {
            if (healthServer != null) {
                healthServer.close();
            }
        }
        return 0;
    }

    static Dispatcher buildDispatcher(SalesOpsConfig config, Clock clock) throws Exception {
        WatchConfig watch = config.watch();
        RemoteStorageConfig remote = config.storage().remote();

        WorkSource source;
        ReportSink sink;
        if (watch.remote()) {
            ObjectStorage storage = buildObjectStorage(remote);
            source = new ObjectStorageWorkSource(storage, remote.inputBucket(), watch.ownerPrefix(), watch.extension());
            sink = new ObjectStorageReportSink(storage, remote.outputBucket(), clock);
        } else {
            Path inputRoot = ConfigPaths.resolve(config.storage().local().inputRoot());
            Path outputRoot = ConfigPaths.resolve(config.storage().local().outputRoot());
            source = new LocalFolderWorkSource(inputRoot, watch.extension());
            sink = new LocalReportSink(outputRoot, clock);
        }

        MemoryLedger ledger = new MemoryLedger(LedgerStores.create(config.ledger(), remote.supabase()), clock);
        return new Dispatcher(source, buildAnalyzer(config), sink, ledger, new ContentFingerprinter(), clock);
    }

    static ObjectStorage buildObjectStorage(RemoteStorageConfig remote) {
        String backend = remote.backend() == null ? "" : remote.backend().trim().toLowerCase(Locale.ROOT);
        return switch (backend) {
            case "supabase" -> {
                if (!remote.supabase().configured()) {
                    throw new IllegalArgumentException("remote storage needs SUPABASE_URL and SUPABASE_KEY");
                }
                yield new SupabaseStorageClient(new SupabaseClient(remote.supabase().url(), remote.supabase().key()));
            }
            case "s3" -> new S3ObjectStorage(S3Clients.create(remote.s3()));
            default -> throw new IllegalArgumentException(
                "Unknown storage backend: " + remote.backend() + " (expected supabase or s3)"
            );
        };
    }

    static Analyzer buildAnalyzer(SalesOpsConfig config) {
        AnalyzerConfig analyzer = config.analyzer();
        LlmProvider provider = buildProviderChain(analyzer.provider(), config.providers(), analyzer.maxAttempts());
        return new LlmAnalyzer(provider, analyzer.model(), analyzer.temperature(), analyzer.systemPrompt());
    }

    /** The preferred provider first, then every other configured one. */
    static LlmProvider buildProviderChain(String preferred, ProvidersConfig providers, int maxAttempts) {
        Map<String, ProviderConfig> byName = providers.byName();
        String first = preferred == null ? "" : preferred.trim().toLowerCase(Locale.ROOT);
        if (!byName.containsKey(first)) {
            throw new IllegalArgumentException("Unknown analyzer provider: " + preferred);
        }

        List<LlmProvider> chain = new ArrayList<>();
        chain.add(buildProvider(first, byName.get(first), maxAttempts));
        byName.forEach((name, provider) -> {
            if (!name.equals(first) && provider != null && provider.configured()) {
                chain.add(buildProvider(name, provider, maxAttempts));
            }
        });
        if (chain.stream().allMatch(DisabledProvider.class::isInstance)) {
            throw new IllegalArgumentException("No LLM provider has an API key; set DEEPSEEK_API_KEY, OPENAI_API_KEY or OPENROUTER_API_KEY");
        }
        return new FallbackLlmProvider(first, chain);
    }

    private static LlmProvider buildProvider(String name, ProviderConfig providerConfig, int maxAttempts) {
        if (providerConfig != null && providerConfig.configured()) {
            String apiBase = providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
                ? ProvidersConfig.defaultBase(name)
                : providerConfig.apiBase();
            return new OpenAiCompatProvider(name, providerConfig.apiKey(), apiBase, providerConfig.extraHeaders(), maxAttempts);
        }
        return new DisabledProvider(name, "missing API key");
    }
}
