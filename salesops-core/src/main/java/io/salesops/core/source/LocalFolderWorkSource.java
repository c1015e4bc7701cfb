package io.salesops.core.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transcripts on the local filesystem: {@code <root>/<owner>/<name><extension>}. Files are never
 * removed, so repeated cycles rely on content fingerprints.
 */
public final class LocalFolderWorkSource implements WorkSource {
    private static final Logger LOG = LoggerFactory.getLogger(LocalFolderWorkSource.class);

    private final Path root;
    private final String extension;

    public LocalFolderWorkSource(Path root, String extension) {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        this.root = root.toAbsolutePath().normalize();
        this.extension = extension == null ? "" : extension.toLowerCase();
    }

    @Override
    public List<String> namespaces() throws EnumerationException {
        try {
            Files.createDirectories(root);
            List<String> owners = new ArrayList<>();
            try (Stream<Path> children = Files.list(root)) {
                children.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .forEach(owners::add);
            }
            return owners;
        } catch (IOException e) {
            throw new EnumerationException("Failed to list owner folders under " + root, e);
        }
    }

    @Override
    public List<ItemDescriptor> list(String namespace) throws EnumerationException {
        Path folder = root.resolve(namespace);
        if (!Files.isDirectory(folder)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(folder)) {
            List<Path> files = children
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().toLowerCase().endsWith(extension))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .toList();
            List<ItemDescriptor> items = new ArrayList<>();
            for (Path file : files) {
                descriptor(namespace, file).ifPresent(items::add);
            }
            return items;
        } catch (IOException e) {
            throw new EnumerationException("Failed to list " + folder, e);
        }
    }

    /** Empty when the file vanished after the directory was listed. */
    Optional<ItemDescriptor> descriptor(String namespace, Path file) throws IOException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            LOG.debug("event=item.vanished path={}", file);
            return Optional.empty();
        }
        String filename = file.getFileName().toString();
        return Optional.of(new ItemDescriptor(
            namespace + "/" + filename,
            namespace,
            filename,
            attributes.size(),
            attributes.lastModifiedTime().toInstant()
        ));
    }

    @Override
    public byte[] read(String key) throws IOException {
        Path file = root.resolve(key).normalize();
        if (!file.startsWith(root)) {
            throw new IOException("Key escapes the input root: " + key);
        }
        return Files.readAllBytes(file);
    }

    @Override
    public IdempotencyMode idempotency() {
        return IdempotencyMode.CONTENT_HASH;
    }

    @Override
    public String describe() {
        return root.toString();
    }
}
