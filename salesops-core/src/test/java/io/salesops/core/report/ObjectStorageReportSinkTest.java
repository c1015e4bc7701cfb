package io.salesops.core.report;

import static org.assertj.core.api.Assertions.assertThat;

import io.salesops.core.testing.InMemoryObjectStorage;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class ObjectStorageReportSinkTest {

    @Test
    void shouldUploadNamedReportToOutputBucket() throws Exception {
        InMemoryObjectStorage storage = new InMemoryObjectStorage();
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_123L), ZoneOffset.UTC);
        ObjectStorageReportSink sink = new ObjectStorageReportSink(storage, "sales-reports", clock);

        String location = sink.write("Vendedor_Ana", "cliente1.txt", "# Audit");

        assertThat(location).isEqualTo("sales-reports/REPORT_Vendedor_Ana_cliente1.txt_1700000000123.md");
        assertThat(storage.bucket("sales-reports"))
            .containsOnlyKeys("REPORT_Vendedor_Ana_cliente1.txt_1700000000123.md");
        assertThat(new String(
            storage.bucket("sales-reports").get("REPORT_Vendedor_Ana_cliente1.txt_1700000000123.md"),
            StandardCharsets.UTF_8
        )).isEqualTo("# Audit");
    }
}
