package io.salesops.core.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalFolderWorkSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCreateMissingRoot() throws Exception {
        Path root = tempDir.resolve("inputs");
        LocalFolderWorkSource source = new LocalFolderWorkSource(root, ".txt");

        assertThat(source.namespaces()).isEmpty();
        assertThat(Files.isDirectory(root)).isTrue();
        assertThat(source.idempotency()).isEqualTo(IdempotencyMode.CONTENT_HASH);
    }

    @Test
    void shouldListOwnersAndFilteredFilesInNameOrder() throws Exception {
        Path root = tempDir.resolve("inputs");
        Files.createDirectories(root.resolve("Vendedor_Bruno"));
        Files.createDirectories(root.resolve("Vendedor_Ana/nested"));
        Files.writeString(root.resolve("Vendedor_Ana/zeta.txt"), "z");
        Files.writeString(root.resolve("Vendedor_Ana/alpha.TXT"), "a");
        Files.writeString(root.resolve("Vendedor_Ana/notes.md"), "ignored");
        Files.writeString(root.resolve("Vendedor_Ana/nested/deep.txt"), "ignored");
        Files.writeString(root.resolve("stray.txt"), "ignored");

        LocalFolderWorkSource source = new LocalFolderWorkSource(root, ".txt");

        assertThat(source.namespaces()).containsExactly("Vendedor_Ana", "Vendedor_Bruno");
        assertThat(source.list("Vendedor_Ana")).extracting(ItemDescriptor::key)
            .containsExactly("Vendedor_Ana/alpha.TXT", "Vendedor_Ana/zeta.txt");
        assertThat(source.list("Vendedor_Bruno")).isEmpty();
        assertThat(source.list("Vendedor_Nobody")).isEmpty();
    }

    @Test
    void shouldReadByKeyAndKeepFilesOnRemove() throws Exception {
        Path root = tempDir.resolve("inputs");
        Files.createDirectories(root.resolve("Vendedor_Ana"));
        Path file = root.resolve("Vendedor_Ana/cliente1.txt");
        Files.writeString(file, "Cliente: hola");
        LocalFolderWorkSource source = new LocalFolderWorkSource(root, ".txt");

        assertThat(new String(source.read("Vendedor_Ana/cliente1.txt"), StandardCharsets.UTF_8)).isEqualTo("Cliente: hola");
        source.remove("Vendedor_Ana/cliente1.txt");
        assertThat(Files.exists(file)).isTrue();
    }

    @Test
    void shouldSkipFileDeletedAfterDirectoryListing() throws Exception {
        Path root = tempDir.resolve("inputs");
        Path folder = Files.createDirectories(root.resolve("Vendedor_Ana"));
        Path kept = folder.resolve("cliente1.txt");
        Files.writeString(kept, "Cliente: hola");
        LocalFolderWorkSource source = new LocalFolderWorkSource(root, ".txt");

        assertThat(source.descriptor("Vendedor_Ana", folder.resolve("gone.txt"))).isEmpty();
        assertThat(source.descriptor("Vendedor_Ana", kept)).get()
            .extracting(ItemDescriptor::key, ItemDescriptor::size)
            .containsExactly("Vendedor_Ana/cliente1.txt", 13L);
    }

    @Test
    void shouldRefuseKeysOutsideRoot() {
        LocalFolderWorkSource source = new LocalFolderWorkSource(tempDir.resolve("inputs"), ".txt");

        assertThatThrownBy(() -> source.read("../secret.txt")).isInstanceOf(IOException.class);
    }
}
