package com.rcpilot.core.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Sandboxed file access below one root directory (sources, artifacts or output).
 * Every relative path is resolved against the root and rejected if it escapes it.
 */
public class FileSystemManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    private static final long MAX_FILE_SIZE  = 10 * 1024 * 1024;
    private static final int  MAX_WALK_DEPTH = 32;

    private final Path root;

    public FileSystemManager(String rootPath) {
        this.root = Paths.get(rootPath).toAbsolutePath().normalize();
        try {
            if (!Files.exists(root)) {
                Files.createDirectories(root);
                log.info("[FileSystem] Created root: {}", root);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize root directory: " + rootPath, e);
        }
        log.debug("[FileSystem] Root initialized: {}", root);
    }

    public Path getRootPath() {
        return root;
    }

    /** Absolute path for a root-relative path, after the traversal check. */
    public Path resolve(String relativePath) throws FileSystemException {
        return resolveSafePath(relativePath);
    }

    // ================================================================
    // File operations
    // ================================================================

    public String readFile(String relativePath) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        try {
            long fileSize = Files.size(targetPath);
            if (fileSize > MAX_FILE_SIZE)
                throw new FileSystemException("File too large: " + relativePath + " (" + fileSize + " bytes)");
            String content = Files.readString(targetPath, StandardCharsets.UTF_8);
            log.debug("[FileSystem] Read {} chars from {}", content.length(), relativePath);
            return content;
        } catch (IOException e) {
            throw new FileSystemException("Failed to read file: " + relativePath, e);
        }
    }

    public void writeFile(String relativePath, String content) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        try {
            Path parent = targetPath.getParent();
            if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
            Files.writeString(targetPath, content, StandardCharsets.UTF_8);
            log.debug("[FileSystem] Wrote {} chars to {}", content.length(), relativePath);
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + relativePath, e);
        }
    }

    public boolean fileExists(String relativePath) {
        try { return Files.isRegularFile(resolveSafePath(relativePath)); }
        catch (FileSystemException e) { return false; }
    }

    public boolean isDirectory(String relativePath) {
        try { return Files.isDirectory(resolveSafePath(relativePath)); }
        catch (FileSystemException e) { return false; }
    }

    /**
     * Regular files below {@code relativeDir} accepted by the predicate, as
     * '/'-separated paths relative to that directory, sorted.
     */
    public List<String> findFiles(String relativeDir, Predicate<Path> predicate)
            throws FileSystemException {
        Path dir = resolveSafePath(relativeDir);
        if (!Files.isDirectory(dir))
            throw new FileSystemException("Not a directory: " + relativeDir);

        try (Stream<Path> paths = Files.walk(dir, MAX_WALK_DEPTH)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> !isIgnored(dir.relativize(p)))
                    .filter(predicate)
                    .map(p -> dir.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new FileSystemException("Failed to walk directory: " + relativeDir, e);
        }
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private Path resolveSafePath(String relativePath) throws FileSystemException {
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new FileSystemException("Path cannot be empty");
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root))
            throw new FileSystemException("Path traversal attempt detected: " + relativePath);
        return resolved;
    }

    // dot-directories and dotfiles anywhere along the path
    private boolean isIgnored(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) return true;
        }
        return false;
    }

    // ================================================================
    // Inner classes
    // ================================================================

    public static class FileSystemException extends Exception {
        public FileSystemException(String message)                  { super(message); }
        public FileSystemException(String message, Throwable cause) { super(message, cause); }
    }
}
