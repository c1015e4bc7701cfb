package io.salesops.core.fingerprint;

import io.salesops.core.ledger.MemoryState;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content-derived change detection. The digest depends only on the bytes, never on timestamps,
 * so a file edited back to previously analyzed content is reported as unchanged.
 */
public final class ContentFingerprinter {
    private static final String ALGORITHM = "SHA-256";

    public String fingerprint(byte[] content) {
        Objects.requireNonNull(content, "content must not be null");
        return HexFormat.of().formatHex(digest().digest(content));
    }

    /** True when there is no prior fingerprint or it differs from {@code digest}. Performs no I/O. */
    public boolean hasChanged(MemoryState prior, String digest) {
        if (prior == null || prior.fingerprint() == null || prior.fingerprint().isBlank()) {
            return true;
        }
        return !prior.fingerprint().equals(digest);
    }

    private MessageDigest digest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        }
    }
}
