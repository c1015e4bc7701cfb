package io.salesops.core.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.salesops.core.testing.InMemoryObjectStorage;
import org.junit.jupiter.api.Test;

class ObjectStorageWorkSourceTest {

    @Test
    void shouldListOnlyOwnerFolders() throws Exception {
        InMemoryObjectStorage storage = new InMemoryObjectStorage();
        storage.put("sales-logs", "Vendedor_Ana/cliente1.txt", "a");
        storage.put("sales-logs", "Vendedor_Bruno/x.txt", "b");
        storage.put("sales-logs", "tmp/scratch.txt", "ignored");
        storage.put("sales-logs", "root.txt", "ignored");

        ObjectStorageWorkSource source = new ObjectStorageWorkSource(storage, "sales-logs", "Vendedor_", ".txt");

        assertThat(source.namespaces()).containsExactly("Vendedor_Ana", "Vendedor_Bruno");
        assertThat(source.idempotency()).isEqualTo(IdempotencyMode.PRESENCE);
    }

    @Test
    void shouldNormalizeBareAndPrefixedListings() throws Exception {
        InMemoryObjectStorage storage = new InMemoryObjectStorage();
        storage.put("sales-logs", "Vendedor_Ana/cliente1.txt", "a");
        storage.put("sales-logs", "Vendedor_Ana/.emptyFolderPlaceholder", "");
        ObjectStorageWorkSource source = new ObjectStorageWorkSource(storage, "sales-logs", "Vendedor_", ".txt");

        assertThat(source.list("Vendedor_Ana")).extracting(ItemDescriptor::key).containsExactly("Vendedor_Ana/cliente1.txt");

        storage.prefixedNames = true;
        assertThat(source.list("Vendedor_Ana")).singleElement().satisfies(item -> {
            assertThat(item.key()).isEqualTo("Vendedor_Ana/cliente1.txt");
            assertThat(item.owner()).isEqualTo("Vendedor_Ana");
            assertThat(item.filename()).isEqualTo("cliente1.txt");
        });
    }

    @Test
    void shouldDeleteOnRemove() throws Exception {
        InMemoryObjectStorage storage = new InMemoryObjectStorage();
        storage.put("sales-logs", "Vendedor_Ana/cliente1.txt", "a");
        ObjectStorageWorkSource source = new ObjectStorageWorkSource(storage, "sales-logs", "Vendedor_", ".txt");

        source.remove("Vendedor_Ana/cliente1.txt");

        assertThat(storage.bucket("sales-logs")).isEmpty();
    }

    @Test
    void shouldSurfaceListingOutageAsEnumerationFailure() {
        InMemoryObjectStorage storage = new InMemoryObjectStorage();
        storage.failListing = true;
        ObjectStorageWorkSource source = new ObjectStorageWorkSource(storage, "sales-logs", "Vendedor_", ".txt");

        assertThatThrownBy(source::namespaces).isInstanceOf(EnumerationException.class);
        assertThatThrownBy(() -> source.list("Vendedor_Ana")).isInstanceOf(EnumerationException.class);
    }
}
