package io.klinesync.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.function.Function;

/**
 * Appends one JSON object per failure to a JSON-lines file.
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private final Path file;
    private final Function<T, String> describer;

    public FileDeadLetterSink(Path file) throws IOException {
        this(file, String::valueOf);
    }

    public FileDeadLetterSink(Path file, Function<T, String> describer) throws IOException {
        this.file = file;
        this.describer = describer;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(String stage, T item, String errorKind, int attempts, String detail) {
        String json = String.format(
                "{\"ts\":\"%s\",\"stage\":\"%s\",\"item\":\"%s\",\"errorKind\":\"%s\",\"attempts\":%d,\"detail\":\"%s\"}%n",
                Instant.now(), safe(stage), safe(item == null ? "" : describer.apply(item)), safe(errorKind), attempts,
                safe(detail)
        );
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot append to failure ledger " + file, e);
        }
    }

    private static String safe(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\").replace("\"", "'").replace("\n", " ").replace("\r", " ");
    }
}
