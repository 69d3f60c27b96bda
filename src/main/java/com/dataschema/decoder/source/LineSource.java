package com.dataschema.decoder.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Supplies the raw text lines of one data source.
 *
 * Opening and reading files is the job of implementations; the decoder only
 * consumes the stream. Callers must close the returned stream.
 */
public interface LineSource {

    Stream<String> lines() throws IOException;

    /**
     * Whether {@link #lines()} may be called again to read the same lines from the start.
     */
    boolean isRestartable();

    /**
     * In-memory lines. Restartable.
     */
    static LineSource of(List<String> lines) {
        List<String> copy = List.copyOf(lines);
        return new LineSource() {
            @Override
            public Stream<String> lines() {
                return copy.stream();
            }

            @Override
            public boolean isRestartable() {
                return true;
            }
        };
    }

    /**
     * Single pass over a reader. A second call to {@link #lines()} fails.
     */
    static LineSource of(Reader reader) {
        BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        AtomicBoolean consumed = new AtomicBoolean();
        return new LineSource() {
            @Override
            public Stream<String> lines() {
                if (!consumed.compareAndSet(false, true)) {
                    throw new IllegalStateException("Line source is single-pass and was already read");
                }
                return buffered.lines().onClose(() -> {
                    try {
                        buffered.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
            }

            @Override
            public boolean isRestartable() {
                return false;
            }
        };
    }
}
