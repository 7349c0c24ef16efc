package com.dagrun.core.target;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A file on the local filesystem.
 *
 * @param file  path of the file
 * @param force when true the target never reports existing, forcing its task to rerun
 */
public record LocalTarget(String file, boolean force) implements Target {

    public LocalTarget {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("file must not be blank");
        }
    }

    public LocalTarget(String file) {
        this(file, false);
    }

    public Path path() {
        return Paths.get(file);
    }

    @Override
    public boolean exists() {
        return Files.exists(path()) && !force;
    }

    public BufferedReader openReader() throws IOException {
        return Files.newBufferedReader(path(), StandardCharsets.UTF_8);
    }

    /**
     * Opens a writer on a temporary sibling file. The file only appears at {@link #path()}
     * when the returned writer is closed after {@link AtomicWriter#commit()}.
     */
    public AtomicWriter openWriter() throws IOException {
        TempPath tmp = tempPath();
        return new AtomicWriter(tmp, Files.newBufferedWriter(tmp.path(), StandardCharsets.UTF_8));
    }

    /** Reserves a temporary path that is atomically renamed onto this target on commit. */
    public TempPath tempPath() throws IOException {
        return TempPath.reserve(path());
    }

    /**
     * Text writer bound to a {@link TempPath}; closing it closes the file and then commits
     * or discards the temporary path.
     */
    public static final class AtomicWriter extends Writer {
        private final TempPath tmp;
        private final Writer delegate;
        private boolean committed;

        AtomicWriter(TempPath tmp, Writer delegate) {
            this.tmp = tmp;
            this.delegate = delegate;
        }

        public void commit() {
            committed = true;
        }

        @Override
        public void write(char[] cbuf, int off, int len) throws IOException {
            delegate.write(cbuf, off, len);
        }

        @Override
        public void flush() throws IOException {
            delegate.flush();
        }

        @Override
        public void close() throws IOException {
            try {
                delegate.close();
            } finally {
                if (committed) {
                    tmp.commit();
                }
                tmp.close();
            }
        }
    }
}
