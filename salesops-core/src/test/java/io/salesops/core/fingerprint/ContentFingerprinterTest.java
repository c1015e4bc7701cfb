package io.salesops.core.fingerprint;

import static org.assertj.core.api.Assertions.assertThat;

import io.salesops.core.ledger.MemoryState;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ContentFingerprinterTest {

    private final ContentFingerprinter fingerprinter = new ContentFingerprinter();

    @Test
    void shouldProduceSha256Hex() {
        String digest = fingerprinter.fingerprint("abc".getBytes(StandardCharsets.UTF_8));

        assertThat(digest).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void shouldDependOnlyOnContent() {
        String first = fingerprinter.fingerprint("Cliente: hola".getBytes(StandardCharsets.UTF_8));
        String second = fingerprinter.fingerprint("Cliente: hola".getBytes(StandardCharsets.UTF_8));
        String other = fingerprinter.fingerprint("Cliente: hola!".getBytes(StandardCharsets.UTF_8));

        assertThat(first).isEqualTo(second).hasSize(64);
        assertThat(other).isNotEqualTo(first);
    }

    @Test
    void shouldReportChangeAgainstPriorState() {
        String digest = fingerprinter.fingerprint(new byte[] {1, 2, 3});

        assertThat(fingerprinter.hasChanged(MemoryState.empty(), digest)).isTrue();
        assertThat(fingerprinter.hasChanged(null, digest)).isTrue();
        assertThat(fingerprinter.hasChanged(new MemoryState(null, "summary only"), digest)).isTrue();
        assertThat(fingerprinter.hasChanged(new MemoryState("other", "s"), digest)).isTrue();
        assertThat(fingerprinter.hasChanged(new MemoryState(digest, "s"), digest)).isFalse();
    }
}
