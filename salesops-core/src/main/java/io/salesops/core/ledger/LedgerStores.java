package io.salesops.core.ledger;

import io.salesops.core.config.ConfigPaths;
import io.salesops.core.config.model.LedgerConfig;
import io.salesops.core.config.model.SupabaseConfig;
import io.salesops.core.supabase.SupabaseClient;
import java.io.IOException;
import java.util.Locale;

public final class LedgerStores {
    public static final String FILE = "file";
    public static final String SQLITE = "sqlite";
    public static final String SUPABASE = "supabase";

    private LedgerStores() {
    }

    /** Builds the backend named by {@code ledger.backend}; an unknown or incomplete setup fails fast. */
    public static LedgerStore create(LedgerConfig ledger, SupabaseConfig supabase) throws IOException {
        String backend = ledger.backend() == null ? "" : ledger.backend().trim().toLowerCase(Locale.ROOT);
        return switch (backend) {
            case FILE -> new FileLedgerStore(ConfigPaths.resolve(ledger.path()));
            case SQLITE -> new SqliteLedgerStore(ConfigPaths.resolve(ledger.path()), ledger.table());
            case SUPABASE -> {
                if (supabase == null || !supabase.configured()) {
                    throw new IllegalArgumentException("ledger backend supabase needs storage.remote.supabase url and key");
                }
                yield new SupabaseLedgerStore(new SupabaseClient(supabase.url(), supabase.key()), ledger.table());
            }
            default -> throw new IllegalArgumentException(
                "Unknown ledger backend: " + ledger.backend() + " (expected file, sqlite or supabase)"
            );
        };
    }
}
