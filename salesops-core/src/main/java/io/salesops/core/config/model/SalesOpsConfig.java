package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SalesOpsConfig(
    WatchConfig watch,
    StorageConfig storage,
    LedgerConfig ledger,
    AnalyzerConfig analyzer,
    ProvidersConfig providers,
    ServerConfig server
) {

    public static SalesOpsConfig defaults() {
        return new SalesOpsConfig(
            WatchConfig.defaults(),
            StorageConfig.defaults(),
            LedgerConfig.defaults(),
            AnalyzerConfig.defaults(),
            ProvidersConfig.defaults(),
            ServerConfig.defaults()
        );
    }

    public SalesOpsConfig withWatch(WatchConfig value) {
        return new SalesOpsConfig(value, storage, ledger, analyzer, providers, server);
    }

    public SalesOpsConfig withStorage(StorageConfig value) {
        return new SalesOpsConfig(watch, value, ledger, analyzer, providers, server);
    }

    public SalesOpsConfig withLedger(LedgerConfig value) {
        return new SalesOpsConfig(watch, storage, value, analyzer, providers, server);
    }

    public SalesOpsConfig withProviders(ProvidersConfig value) {
        return new SalesOpsConfig(watch, storage, ledger, analyzer, value, server);
    }

    public SalesOpsConfig withServer(ServerConfig value) {
        return new SalesOpsConfig(watch, storage, ledger, analyzer, providers, value);
    }
}
