package io.salesops.core.source;

import java.io.IOException;

/** Listing the source failed; the whole cycle is abandoned. */
public final class EnumerationException extends IOException {
    public EnumerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
