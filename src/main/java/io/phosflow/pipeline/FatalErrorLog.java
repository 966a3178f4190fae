package io.phosflow.pipeline;

import io.phosflow.util.Texts;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Append-only fatal record of one unit. Once the file exists the unit never progresses again;
 * nothing in this code base deletes it.
 */
public final class FatalErrorLog {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;
    private final Clock clock;

    public FatalErrorLog(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return Files.exists(file);
    }

    public void append(String message) {
        String entry = "[" + LocalDateTime.now(clock).format(TIMESTAMP) + "] FATAL ERROR:\n" + message + "\n";
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to append fatal log: " + file, e);
        }
    }

    /**
     * Last {@code maxChars} characters of the log, empty when it does not exist.
     */
    public String tail(int maxChars) {
        if (!exists()) {
            return "";
        }
        try {
            // Job output pasted into the log is not always UTF-8; malformed bytes are replaced.
            return Texts.tail(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), maxChars);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read fatal log: " + file, e);
        }
    }
}
