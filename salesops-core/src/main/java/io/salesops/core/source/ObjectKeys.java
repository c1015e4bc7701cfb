package io.salesops.core.source;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical {@code owner/filename} keys for remote listings. Some listing APIs return bare names,
 * others full keys; both map to the same key here.
 */
public final class ObjectKeys {
    private static final Logger LOG = LoggerFactory.getLogger(ObjectKeys.class);

    private ObjectKeys() {
    }

    /**
     * Returns the canonical key for {@code raw} listed under {@code namespace}, or empty for folders
     * and for names that belong to another owner or sit deeper than one level.
     */
    public static Optional<String> canonical(String namespace, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String name = stripLeadingSlashes(raw.trim());
        if (name.isEmpty() || name.endsWith("/")) {
            return Optional.empty();
        }
        int slash = name.indexOf('/');
        if (slash < 0) {
            return Optional.of(namespace + "/" + name);
        }
        String owner = name.substring(0, slash);
        String rest = name.substring(slash + 1);
        if (!owner.equals(namespace)) {
            LOG.warn("event=listing.rejected namespace={} name={} reason=foreign_owner", namespace, raw);
            return Optional.empty();
        }
        if (rest.isEmpty() || rest.contains("/")) {
            LOG.warn("event=listing.rejected namespace={} name={} reason=nested", namespace, raw);
            return Optional.empty();
        }
        return Optional.of(name);
    }

    /** Folder name of a root-level listing entry, or empty when it is not a single-level folder. */
    public static Optional<String> folder(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String name = stripLeadingSlashes(raw.trim());
        while (name.endsWith("/")) {
            name = name.substring(0, name.length() - 1);
        }
        if (name.isEmpty() || name.contains("/")) {
            return Optional.empty();
        }
        return Optional.of(name);
    }

    public static String owner(String key) {
        int slash = key.indexOf('/');
        return slash < 0 ? "" : key.substring(0, slash);
    }

    public static String filename(String key) {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }

    private static String stripLeadingSlashes(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }
}
