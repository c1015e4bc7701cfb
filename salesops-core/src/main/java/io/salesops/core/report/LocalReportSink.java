package io.salesops.core.report;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes {@code <outputRoot>/<owner>/AUDIT_<stem>_<epochMillis>.md}. */
public final class LocalReportSink implements ReportSink {
    private static final Logger LOG = LoggerFactory.getLogger(LocalReportSink.class);
    private static final int MAX_SUFFIX = 1000;

    private final Path outputRoot;
    private final Clock clock;

    public LocalReportSink(Path outputRoot, Clock clock) {
        this.outputRoot = Objects.requireNonNull(outputRoot, "outputRoot must not be null").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String write(String owner, String sourceFilename, String content) throws IOException {
        Path folder = outputRoot.resolve(owner);
        Files.createDirectories(folder);
        String base = "AUDIT_" + stem(sourceFilename) + "_" + clock.millis();
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);

        for (int attempt = 0; attempt < MAX_SUFFIX; attempt++) {
            Path target = folder.resolve(attempt == 0 ? base + ".md" : base + "-" + attempt + ".md");
            try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                out.write(bytes);
                return target.toString();
            } catch (FileAlreadyExistsException e) {
                LOG.debug("Report name {} already taken, trying next suffix", target.getFileName());
            }
        }
        throw new IOException("Could not find a free report name for " + base + " in " + folder);
    }

    static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot <= 0 ? filename : filename.substring(0, dot);
    }
}
