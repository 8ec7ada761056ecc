package io.github.drompincen.toolguard.runtime.checkpoint;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;

/**
 * File-level copying between a workspace and its shadow mirror. Both walks check the interrupt
 * flag between files and abort with {@link CancellationException}.
 */
final class WorkspaceMirror {

    private WorkspaceMirror() {}

    /**
     * Makes the working tree of {@code mirror} equal to {@code source}, minus entries matched by
     * {@code excluded}, such as the {@code .git} file of a linked worktree. The mirror's own
     * {@code .git} is left alone.
     */
    static void sync(Path source, Path mirror, Predicate<Path> excluded) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                checkCancelled();
                if (!dir.equals(source) && excluded.test(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(mirror.resolve(source.relativize(dir)));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                checkCancelled();
                if (attrs.isRegularFile() && !excluded.test(file)) {
                    copyIfChanged(file, mirror.resolve(source.relativize(file)));
                }
                return FileVisitResult.CONTINUE;
            }
        });

        Path mirrorGit = mirror.resolve(".git");
        Files.walkFileTree(mirror, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                checkCancelled();
                return dir.equals(mirrorGit) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                checkCancelled();
                if (file.equals(mirrorGit)) {
                    return FileVisitResult.CONTINUE;
                }
                Path original = source.resolve(mirror.relativize(file));
                if (!Files.isRegularFile(original) || excluded.test(original)
                        || isUnderExcluded(source, original, excluded)) {
                    Files.deleteIfExists(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                if (!dir.equals(mirror) && !Files.isDirectory(source.resolve(mirror.relativize(dir)))) {
                    Files.deleteIfExists(dir);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /** Copies the listed relative paths from {@code from} onto {@code to}, overwriting. */
    static void copyFiles(Path from, Path to, List<String> relativePaths) throws IOException {
        for (String relative : relativePaths) {
            checkCancelled();
            Path target = to.resolve(relative).normalize();
            if (!target.startsWith(to)) {
                throw new IOException("Refusing to write outside workspace: " + relative);
            }
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(from.resolve(relative), target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void copyIfChanged(Path from, Path to) throws IOException {
        if (Files.isRegularFile(to) && Files.size(to) == Files.size(from) && Files.mismatch(from, to) == -1L) {
            return;
        }
        Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING);
    }

    private static boolean isUnderExcluded(Path root, Path path, Predicate<Path> excluded) {
        for (Path p = path.getParent(); p != null && !p.equals(root) && p.startsWith(root); p = p.getParent()) {
            if (excluded.test(p)) {
                return true;
            }
        }
        return false;
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Interrupted while copying workspace files");
        }
    }
}
