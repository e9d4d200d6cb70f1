package com.github.errfix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Reads Go sources from streams, files and directory trees.
 * <p>
 * Inputs are read lazily and in the order they were added. Only files ending in
 * {@code .go} are read; a directory is walked recursively, skipping directories whose
 * name is excluded.
 */
public class DefaultSourceReader implements SourceReader {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultSourceReader.class);

    static final String GO_EXTENSION = ".go";

    private final List<Function<DefaultSourceReader, Stream<SourceFile>>> inputs;
    private final Set<String> excludedDirectories;

    private DefaultSourceReader(Builder builder) {
        this.inputs = List.copyOf(builder.inputs);
        this.excludedDirectories = Set.copyOf(builder.excludedDirectories);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Stream<SourceFile> read() throws ErrFixException {
        if (inputs.isEmpty()) {
            throw new ErrFixException("no source to read");
        }
        return inputs.stream().flatMap(input -> input.apply(this));
    }

    private Stream<SourceFile> readPath(Path path) {
        if (!Files.exists(path)) {
            return Stream.of(SourceFile.failed(path.toString(), new NoSuchFileException(path.toString())));
        }
        if (Files.isDirectory(path)) {
            return readDirectory(path);
        }
        if (!isGoFile(path)) {
            LOG.debug("skipping {}, not a Go file", path);
            return Stream.empty();
        }
        return Stream.of(readFile(path));
    }

    private Stream<SourceFile> readDirectory(Path dir) {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                    if (!d.equals(dir) && excludedDirectories.contains(d.getFileName().toString())) {
                        LOG.debug("skipping excluded directory {}", d);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isDirectory() && isGoFile(file)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            // the files found before the failure are still processed
            return Stream.concat(
                    files.stream().map(DefaultSourceReader::readFile),
                    Stream.of(SourceFile.failed(dir.toString(), e)));
        }
        return files.stream().map(DefaultSourceReader::readFile);
    }

    private static boolean isGoFile(Path path) {
        return path.getFileName() != null && path.getFileName().toString().endsWith(GO_EXTENSION);
    }

    private static SourceFile readFile(Path path) {
        try {
            return SourceFile.of(path.toString(), new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
        } catch (IOException e) {
            return SourceFile.failed(path.toString(), e);
        }
    }

    private static SourceFile readStream(String name, InputStream in) {
        try {
            return SourceFile.of(name, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            return SourceFile.failed(name, e);
        }
    }

    public static final class Builder {

        private final List<Function<DefaultSourceReader, Stream<SourceFile>>> inputs = new ArrayList<>();
        private final Set<String> excludedDirectories = new LinkedHashSet<>();
        private int streams;

        private Builder() {
        }

        /**
         * Adds an already opened stream. The second and later streams get a
         * {@code #<index>} suffix so that every file has a distinct name.
         */
        public Builder stream(String name, InputStream in) {
            String unique = streams > 0 ? name + "#" + streams : name;
            streams++;
            inputs.add(reader -> Stream.of(readStream(unique, in)));
            return this;
        }

        /**
         * Adds a file or a directory.
         */
        public Builder path(Path path) {
            inputs.add(reader -> reader.readPath(path));
            return this;
        }

        public Builder paths(Collection<Path> paths) {
            paths.forEach(this::path);
            return this;
        }

        /**
         * Directory names skipped while walking directories, e.g. {@code vendor}.
         */
        public Builder exclude(Collection<String> directoryNames) {
            excludedDirectories.addAll(directoryNames);
            return this;
        }

        public DefaultSourceReader build() {
            return new DefaultSourceReader(this);
        }
    }
}
