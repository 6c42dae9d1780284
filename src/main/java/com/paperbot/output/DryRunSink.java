package com.paperbot.output;

import com.paperbot.core.CollaboratorException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes units to {@code <dir>/<run timestamp>/message_NNN.txt} instead of posting them.
 */
public final class DryRunSink implements TransportSink {
    private static final DateTimeFormatter DIR_FMT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path runDir;
    private int written;

    public DryRunSink(Path baseDir, Instant runStartedAt) {
        this.runDir = baseDir.resolve(DIR_FMT.format(runStartedAt));
    }

    public Path runDir() {
        return runDir;
    }

    @Override
    public void send(String unit) {
        if (unit == null || unit.isEmpty()) {
            return;
        }
        written++;
        Path file = runDir.resolve(String.format("message_%03d.txt", written));
        try {
            Files.createDirectories(runDir);
            Files.writeString(file, unit, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CollaboratorException("dry-run write failed: " + file, e);
        }
    }
}
