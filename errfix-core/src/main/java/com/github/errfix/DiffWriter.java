package com.github.errfix;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects a unified diff of every changed file and optionally writes the new
 * content back over the original file.
 * <p>
 * Diffs are appended in the order files complete, which is not the input order
 * when files are processed concurrently.
 */
public class DiffWriter implements SourceWriter {

    private static final Logger LOG = LoggerFactory.getLogger(DiffWriter.class);

    static final int CONTEXT_LINES = 3;

    private final boolean writeBack;
    private final StringBuilder buffer = new StringBuilder();

    /**
     * @param writeBack whether to overwrite changed files on disk
     */
    public DiffWriter(boolean writeBack) {
        this.writeBack = writeBack;
    }

    @Override
    public void write(SourceFile original, SourceFile current) throws IOException {
        String diff = diff(original, current);
        synchronized (buffer) {
            buffer.append(diff);
        }
        if (diff.isEmpty() || !writeBack) {
            return;
        }
        Path path;
        try {
            path = Path.of(original.getName());
        } catch (InvalidPathException e) {
            LOG.debug("{} is not a file on disk, not writing it back", original.getName());
            return;
        }
        if (Files.isRegularFile(path)) {
            Files.writeString(path, current.getContent(), StandardCharsets.UTF_8);
            LOG.debug("wrote {}", path);
        }
    }

    /**
     * The diffs collected so far.
     */
    public String getDiff() {
        synchronized (buffer) {
            return buffer.toString();
        }
    }

    static String diff(SourceFile original, SourceFile current) {
        List<String> before = lines(original.getContent());
        List<String> after = lines(current.getContent());
        Patch<String> patch = DiffUtils.diff(before, after);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
                original.getName() + "#original", current.getName() + "#current", before, patch, CONTEXT_LINES);
        return unified.stream().map(line -> line + "\n").collect(Collectors.joining());
    }

    private static List<String> lines(String content) {
        return content.lines().collect(Collectors.toList());
    }
}
