package io.phosflow.pipeline;

import io.phosflow.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Stream;

final class FatalErrorLogTest {

    @Test
    void appendsTimestampedEntries() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-fatal-log-");
        try {
            MutableClock clock = new MutableClock(Instant.parse("2026-03-02T08:15:30Z"));
            FatalErrorLog fatal = new FatalErrorLog(root.resolve("mol1").resolve("FATAL_ERROR.txt"), clock);
            Assertions.assertFalse(fatal.exists());
            Assertions.assertEquals("", fatal.tail(200));

            fatal.append("Abnormal termination in 01_S0_Opt");
            clock.advance(Duration.ofMinutes(1));
            fatal.append("second");

            String text = Files.readString(fatal.file(), StandardCharsets.UTF_8);
            Assertions.assertEquals(
                    "[2026-03-02 08:15:30] FATAL ERROR:\nAbnormal termination in 01_S0_Opt\n"
                            + "[2026-03-02 08:16:30] FATAL ERROR:\nsecond\n",
                    text
            );
            Assertions.assertEquals("second\n", fatal.tail(7));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tailToleratesBytesThatAreNotUtf8() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-fatal-bytes-");
        try {
            FatalErrorLog fatal = new FatalErrorLog(root.resolve("FATAL_ERROR.txt"),
                    new MutableClock(Instant.parse("2026-03-02T08:00:00Z")));
            Files.write(fatal.file(), new byte[]{'e', 'r', 'r', ' ', (byte) 0xE9, (byte) 0xFF, '!'});
            String tail = fatal.tail(200);
            Assertions.assertTrue(tail.startsWith("err "));
            Assertions.assertTrue(tail.endsWith("!"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
