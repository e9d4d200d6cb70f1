package com.github.errfix;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrFixTest {

    @Test
    void processesEveryFileAndHandsItToTheWriter() throws ErrFixException {
        List<String> written = Collections.synchronizedList(new ArrayList<>());
        SourceWriter writer = (original, current) -> written.add(current.getContent());

        int processed = new ErrFix(reader(files(5)), upperCase(), writer).process();

        assertThat(processed).isEqualTo(5);
        assertThat(written).containsExactlyInAnyOrder("PACKAGE F0", "PACKAGE F1", "PACKAGE F2", "PACKAGE F3", "PACKAGE F4");
    }

    @Test
    void neverRunsMoreFilesThanTheConcurrency() throws ErrFixException {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        Processor slow = file -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ErrFixException("interrupted", e);
            } finally {
                active.decrementAndGet();
            }
            return file;
        };

        int processed = new ErrFix(reader(files(12)), slow, (original, current) -> { }, 3).process();

        assertThat(processed).isEqualTo(12);
        assertThat(maxActive.get()).isBetween(1, 3);
    }

    @Test
    void readErrorNamesTheSource() {
        SourceReader reader = () -> Stream.of(SourceFile.failed("missing.go", new NoSuchFileException("missing.go")));

        assertThatThrownBy(() -> new ErrFix(reader, upperCase(), (original, current) -> { }).process())
                .isInstanceOf(ErrFixException.class)
                .hasMessage("error while reading from missing.go, missing.go")
                .hasCauseInstanceOf(NoSuchFileException.class);
    }

    @Test
    void firstFailureIsReportedAndStopsScheduling() {
        AtomicInteger started = new AtomicInteger();
        Processor failing = file -> {
            started.incrementAndGet();
            throw new ErrFixException("error parsing ast, " + file.getName());
        };

        assertThatThrownBy(() -> new ErrFix(reader(files(50)), failing, (original, current) -> { }, 1).process())
                .isInstanceOf(ErrFixException.class)
                .hasMessage("error parsing ast, f0.go");
        assertThat(started.get()).isLessThan(50);
    }

    @Test
    void writerFailure() {
        SourceWriter writer = (original, current) -> {
            throw new IOException("disk full");
        };

        assertThatThrownBy(() -> new ErrFix(reader(files(1)), upperCase(), writer).process())
                .isInstanceOf(ErrFixException.class)
                .hasMessage("error while writing f0.go, disk full");
    }

    @Test
    void unexpectedProcessorFailureIsWrapped() {
        Processor broken = file -> {
            throw new IllegalStateException("bug");
        };

        assertThatThrownBy(() -> new ErrFix(reader(files(1)), broken, (original, current) -> { }).process())
                .isInstanceOf(ErrFixException.class)
                .hasMessage("error while processing f0.go, bug")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void errorThrownWhileProcessingFailsTheRun() {
        Processor overflowing = file -> {
            throw new StackOverflowError();
        };

        assertThatThrownBy(() -> new ErrFix(reader(files(3)), overflowing, (original, current) -> { }, 1).process())
                .isInstanceOf(ErrFixException.class)
                .hasMessage("error while processing f0.go, java.lang.StackOverflowError")
                .hasCauseInstanceOf(StackOverflowError.class);
    }

    @Test
    void deeplyNestedSourceFailsTheRun() {
        String nested = "package foo\n\nvar x = " + "(".repeat(50_000) + "1" + ")".repeat(50_000) + "\n";
        SourceReader reader = () -> Stream.of(SourceFile.of("deep.go", nested));
        DiffWriter writer = new DiffWriter(false);

        assertThatThrownBy(() -> new ErrFix(reader, new DefaultProcessor(), writer).process())
                .isInstanceOf(ErrFixException.class)
                .hasMessageStartingWith("error while processing deep.go, ");
        assertThat(writer.getDiff()).isEmpty();
    }

    @Test
    void rewritesStandardInputIntoUnifiedDiff() throws ErrFixException {
        String before = "package foo\n\nfunc foo() error {\n\treturn err\n}\n";
        DefaultSourceReader reader = DefaultSourceReader.builder()
                .stream("<standard input>", new ByteArrayInputStream(before.getBytes(StandardCharsets.UTF_8)))
                .build();
        DiffWriter writer = new DiffWriter(false);

        int processed = new ErrFix(reader, new DefaultProcessor(), writer).process();

        assertThat(processed).isEqualTo(1);
        assertThat(writer.getDiff())
                .startsWith("--- <standard input>#original\n+++ <standard input>#current\n@@ -1,5 +1,9 @@\n")
                .contains("+import (\n", "+\t\"github.com/pkg/errors\"\n", "+)\n")
                .contains("-\treturn err\n+\treturn errors.WithStack(err)\n");
    }

    @Test
    void rewritesFilesOnDiskAndLeavesCleanOnesAlone(@TempDir Path dir) throws Exception {
        Path dirty = dir.resolve("dirty.go");
        Path clean = dir.resolve("clean.go");
        Files.writeString(dirty, "package foo\n\nimport \"errors\"\n\nvar errNope = errors.New(\"nope\")\n");
        Files.writeString(clean, "package foo\n\nfunc bar() {}\n");
        DiffWriter writer = new DiffWriter(true);

        int processed = new ErrFix(DefaultSourceReader.builder().path(dir).build(), new DefaultProcessor(), writer, 2)
                .process();

        assertThat(processed).isEqualTo(2);
        assertThat(dirty).hasContent("package foo\n\nimport \"github.com/pkg/errors\"\n\nvar errNope = errors.New(\"nope\")\n");
        assertThat(clean).hasContent("package foo\n\nfunc bar() {}\n");
        assertThat(writer.getDiff())
                .contains("--- " + dirty + "#original")
                .doesNotContain(clean.toString());
    }

    @Test
    void readerWithoutInputFailsBeforeProcessing() {
        SourceReader empty = () -> {
            throw new ErrFixException("no source to read");
        };

        assertThatThrownBy(() -> new ErrFix(empty, upperCase(), (original, current) -> { }).process())
                .isInstanceOf(ErrFixException.class)
                .hasMessage("no source to read");
    }

    @Test
    void concurrencyMustBePositive() {
        assertThatThrownBy(() -> new ErrFix(reader(files(1)), upperCase(), (original, current) -> { }, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
    }

    private static List<SourceFile> files(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> SourceFile.of("f" + i + ".go", "package f" + i))
                .collect(Collectors.toList());
    }

    private static SourceReader reader(List<SourceFile> files) {
        return files::stream;
    }

    private static Processor upperCase() {
        return file -> SourceFile.of(file.getName(), file.getContent().toUpperCase());
    }
}
