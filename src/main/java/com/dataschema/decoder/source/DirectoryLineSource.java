package com.dataschema.decoder.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lines of every data file directly under a source directory, read in file
 * name order. A path that points at a single file reads just that file.
 *
 * Names starting with {@code .} or {@code _} are skipped (hidden and marker
 * files such as {@code _SUCCESS}); {@code .gz} files are decompressed.
 * Files are re-opened on every call, so the source is restartable. At most
 * one file is open at a time.
 */
public class DirectoryLineSource implements LineSource {
    private static final Logger log = LoggerFactory.getLogger(DirectoryLineSource.class);

    private final Path path;
    private final Charset charset;

    public DirectoryLineSource(Path path) {
        this(path, StandardCharsets.UTF_8);
    }

    public DirectoryLineSource(Path path, Charset charset) {
        this.path = Objects.requireNonNull(path, "path");
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    @Override
    public Stream<String> lines() throws IOException {
        List<Path> files = discoverDataFiles();
        log.debug("Reading {} data file(s) from {}", files.size(), path);
        ChainedLines lines = new ChainedLines(files.iterator());
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(lines, Spliterator.ORDERED | Spliterator.NONNULL),
                false).onClose(lines::close);
    }

    @Override
    public boolean isRestartable() {
        return true;
    }

    public List<Path> discoverDataFiles() throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        if (!Files.isDirectory(path)) {
            throw new IOException("Data path does not exist or is not a directory: " + path);
        }
        try (Stream<Path> stream = Files.walk(path, 1)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isDataFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isDataFile(Path file) {
        String name = file.getFileName().toString();
        return !name.startsWith(".") && !name.startsWith("_");
    }

    private BufferedReader open(Path file) throws IOException {
        InputStream raw = Files.newInputStream(file);
        InputStream in = raw;
        if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gz")) {
            try {
                in = new GZIPInputStream(raw);
            } catch (IOException e) {
                raw.close();
                throw e;
            }
        }
        log.debug("Opened data file {}", file);
        return new BufferedReader(new InputStreamReader(in, charset));
    }

    /**
     * Lines of each file in turn; a file is opened when the previous one is exhausted.
     */
    private final class ChainedLines implements Iterator<String> {
        private final Iterator<Path> files;
        private Path currentFile;
        private BufferedReader current;
        private String nextLine;

        private ChainedLines(Iterator<Path> files) {
            this.files = files;
        }

        @Override
        public boolean hasNext() {
            try {
                while (nextLine == null) {
                    if (current == null) {
                        if (!files.hasNext()) {
                            return false;
                        }
                        currentFile = files.next();
                        current = open(currentFile);
                    }
                    nextLine = current.readLine();
                    if (nextLine == null) {
                        closeCurrent();
                    }
                }
                return true;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read data file: " + currentFile, e);
            }
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String line = nextLine;
            nextLine = null;
            return line;
        }

        private void close() {
            try {
                closeCurrent();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close data file: " + currentFile, e);
            }
        }

        private void closeCurrent() throws IOException {
            if (current != null) {
                BufferedReader reader = current;
                current = null;
                reader.close();
            }
        }
    }
}
