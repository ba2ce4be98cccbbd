package com.purchasingpower.codegraph.sync;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.SyncProperties;
import com.purchasingpower.codegraph.exception.ProjectAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive walk over a project's Java sources.
 *
 * <p>Deny-listed directories are pruned wherever they occur. Results are sorted
 * by relative path so runs visit files in a stable order.
 */
@Slf4j
@Component
public class ProjectWalker {

    private static final String JAVA_EXTENSION = ".java";
    private static final Set<String> SKIPPED_FILE_NAMES = Set.of("package-info.java", "module-info.java");

    private final SyncProperties syncProperties;

    public ProjectWalker(CodeGraphProperties properties) {
        this.syncProperties = properties.getSync();
    }

    /**
     * @param failures collects unreadable entries; the walk continues past them
     * @throws ProjectAccessException if the root itself cannot be walked
     */
    public List<Path> walk(Path projectRoot, List<FileFailure> failures) {
        Set<String> excluded = new HashSet<>(syncProperties.getExcludedDirectories());
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(projectRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(projectRoot) && excluded.contains(dir.getFileName().toString())) {
                        log.debug("Pruning {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isIndexable(projectRoot.relativize(file))) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    if (file.equals(projectRoot)) {
                        throw new ProjectAccessException(projectRoot, "Cannot read project root", exc);
                    }
                    log.warn("⚠️ Cannot read {}: {}", file, exc.getMessage());
                    failures.add(new FileFailure(relativePath(projectRoot, file), "unreadable: " + exc.getMessage()));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ProjectAccessException(projectRoot, "Cannot walk project", e);
        }
        files.sort(Comparator.comparing(file -> relativePath(projectRoot, file)));
        return files;
    }

    boolean isIndexable(Path relative) {
        String fileName = relative.getFileName().toString();
        if (!fileName.endsWith(JAVA_EXTENSION) || SKIPPED_FILE_NAMES.contains(fileName)) {
            return false;
        }
        return syncProperties.isIncludeTestSources() || !isTestSource(relative);
    }

    /**
     * Project-relative path with {@code /} separators, the File node key.
     */
    public static String relativePath(Path projectRoot, Path file) {
        return projectRoot.relativize(file).toString().replace('\\', '/');
    }

    private static boolean isTestSource(Path relative) {
        String path = relative.toString().replace('\\', '/');
        return path.startsWith("src/test/") || path.contains("/src/test/");
    }
}
