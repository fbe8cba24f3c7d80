package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
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
 * Enumerates the Java files of a project tree in a stable order.
 * Files are sorted by their root-relative path written with forward slashes, so the order does not
 * depend on the file system.
 */
public class SourceScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);
    private static final String DEFAULT_IGNORED_FILE = "ignored_directories.txt";

    private final Set<String> ignoredDirectories;

    public SourceScanner() {
        this(loadIgnoredDirectories());
    }

    public SourceScanner(Set<String> ignoredDirectories) {
        this.ignoredDirectories = Set.copyOf(ignoredDirectories);
    }

    /**
     * Reads every {@code .java} file below the root.
     *
     * @param root The project root directory.
     * @return The files with root-relative paths, sorted.
     * @throws IllegalArgumentException if the root is not a directory.
     * @throws IOException              if the tree itself cannot be walked.
     */
    public List<SourceFile> scan(Path root) throws IOException {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Project root is not a directory: " + root);
        }
        List<Path> javaFiles = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && dir.getFileName() != null
                        && ignoredDirectories.contains(dir.getFileName().toString())) {
                    log.debug("Skipping ignored directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.getFileName().toString().endsWith(".java")) {
                    javaFiles.add(root.relativize(file));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot access {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        javaFiles.sort(Comparator.comparing(SourceScanner::sortKey));

        List<SourceFile> files = new ArrayList<>();
        for (Path relative : javaFiles) {
            try {
                // Decoding through new String(...) replaces malformed input instead of failing
                String text = new String(Files.readAllBytes(root.resolve(relative)), StandardCharsets.UTF_8);
                files.add(new SourceFile(relative, text));
            } catch (IOException e) {
                log.warn("Skipping unreadable file {}: {}", relative, e.getMessage());
            }
        }
        log.info("Found {} Java files under {}", files.size(), root);
        return files;
    }

    static String sortKey(Path relative) {
        return relative.toString().replace('\\', '/');
    }

    /**
     * Loads the directory names to skip from the classpath resource.
     */
    public static Set<String> loadIgnoredDirectories() {
        Set<String> names = new HashSet<>();
        try (InputStream in = SourceScanner.class.getClassLoader().getResourceAsStream(DEFAULT_IGNORED_FILE)) {
            if (in != null) {
                try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                    reader.lines()
                            .map(String::trim)
                            .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                            .forEach(names::add);
                }
            } else {
                log.warn("Ignored directories file not found: {}", DEFAULT_IGNORED_FILE);
            }
        } catch (IOException e) {
            log.error("Error reading ignored directories file: {}", DEFAULT_IGNORED_FILE, e);
        }
        return names;
    }
}
