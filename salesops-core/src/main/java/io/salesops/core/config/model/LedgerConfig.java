package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerConfig(String backend, String path, String table) {

    public static LedgerConfig defaults() {
        return new LedgerConfig("sqlite", "~/.salesops/ledger.db", "sales_memory");
    }
}
