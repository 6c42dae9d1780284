package com.paperbot.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class DryRunSinkTest {

    @Test
    void unitsShouldBeWrittenInOrder(@TempDir Path dir) throws Exception {
        DryRunSink sink = new DryRunSink(dir, Instant.parse("2024-03-04T23:30:05Z"));

        sink.send("first");
        sink.send("");
        sink.send("second ✔︎");

        Path runDir = dir.resolve("20240304_233005");
        assertEquals(runDir, sink.runDir());
        assertEquals("first", Files.readString(runDir.resolve("message_001.txt"), StandardCharsets.UTF_8));
        assertEquals("second ✔︎", Files.readString(runDir.resolve("message_002.txt"), StandardCharsets.UTF_8));
        assertFalse(Files.exists(runDir.resolve("message_003.txt")));
    }
}
