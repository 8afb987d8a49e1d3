package com.extractionplatform.workers.corpus;

import com.extractionplatform.common.exception.WorkerException;
import com.extractionplatform.common.worker.WorkerContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Filesystem helpers shared by the reference workers. A corpus reference is a path to a
 * directory; every locator is the file path relative to that root, optionally with a
 * {@code #L<line>} suffix.
 */
public final class CorpusFiles {

    /** Directories never worth scanning. */
    private static final Set<String> SKIPPED_DIRS = Set.of(
        ".git", ".idea", ".gradle", "node_modules", "target", "build", "dist", "vendor", "__pycache__");

    private static final int MAX_FILES = 20_000;

    private CorpusFiles() {}

    /**
     * @throws WorkerException if the reference is not a readable directory
     */
    public static Path resolveRoot(String workerId, String corpusReference) {
        if (corpusReference == null || corpusReference.isBlank()) {
            throw new WorkerException(workerId, "corpus reference is blank");
        }
        Path root = Paths.get(corpusReference).toAbsolutePath().normalize();
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new WorkerException(workerId, "corpus is not a readable directory: " + root);
        }
        return root;
    }

    /**
     * Regular files under {@code root}, skipping build output and VCS directories.
     * Stops early once the worker is asked to stop.
     *
     * @throws WorkerException if the directory walk fails
     */
    public static List<Path> listFiles(String workerId, Path root, WorkerContext ctx) {
        List<Path> out = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(root)) {
            Iterator<Path> it = walk.iterator();
            while (it.hasNext() && out.size() < MAX_FILES) {
                if (ctx.shouldStop()) break;
                Path p = it.next();
                if (isSkipped(root, p)) continue;
                if (Files.isRegularFile(p)) out.add(p);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new WorkerException(workerId, "failed to walk " + root + ": " + e.getMessage(), e);
        }
        return out;
    }

    public static Optional<String> read(Path file) {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | UncheckedIOException e) {
            return Optional.empty();
        }
    }

    public static String locator(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    public static String locator(Path root, Path file, int line) {
        return locator(root, file) + "#L" + line;
    }

    /**
     * 1-based line of the first occurrence of {@code needle}, or 0 if absent.
     */
    public static int lineOf(String text, String needle) {
        int idx = text.indexOf(needle);
        if (idx < 0) return 0;
        int line = 1;
        for (int i = 0; i < idx; i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }

    private static boolean isSkipped(Path root, Path p) {
        for (Path part : root.relativize(p)) {
            if (SKIPPED_DIRS.contains(part.toString())) return true;
        }
        return false;
    }
}
