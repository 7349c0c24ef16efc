package com.dagrun.core.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Scoped write location for a file target.
 * <p>
 * Work is written to {@code <file>-TMP-<id>}. {@link #commit()} moves it onto the final path
 * atomically; closing without a commit moves whatever was written to {@code <file>-FAILED-<id>}
 * so a half-written output is never mistaken for a finished one.
 * <pre>{@code
 * try (TempPath tmp = target.tempPath()) {
 *     writeParquet(tmp.path());
 *     tmp.commit();
 * }
 * }</pre>
 */
public final class TempPath implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TempPath.class);

    private final Path target;
    private final Path tmp;
    private final String id;
    private boolean committed;

    private TempPath(Path target, String id) {
        this.target = target;
        this.id = id;
        this.tmp = target.resolveSibling(target.getFileName() + "-TMP-" + id);
    }

    static TempPath reserve(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new TempPath(target, UUID.randomUUID().toString());
    }

    /** Where the caller should write. */
    public Path path() {
        return tmp;
    }

    public Path failedPath() {
        return target.resolveSibling(target.getFileName() + "-FAILED-" + id);
    }

    public void commit() throws IOException {
        if (committed) {
            return;
        }
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        committed = true;
    }

    @Override
    public void close() throws IOException {
        if (!committed && Files.exists(tmp)) {
            Path failed = failedPath();
            log.warn("Discarding uncommitted output {} as {}", tmp, failed);
            Files.move(tmp, failed, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
