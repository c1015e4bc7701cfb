package io.salesops.core.supabase;

import java.io.IOException;

public final class SupabaseException extends IOException {
    private final int status;

    public SupabaseException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
