package com.codeswarm.core.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileSystemManager - sandboxed file access for the workers.
 *
 * Every target directory must live under the sandbox root, and every file a
 * worker touches must live under its target directory. Violations raise the
 * unchecked SandboxViolationException; ordinary I/O problems raise the
 * checked FileSystemException.
 *
 * Writes go to a temp file in the same directory and are then moved over the
 * original, so a reader never observes a half-written file.
 */
@Component
public class FileSystemManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    private static final long MAX_FILE_SIZE  = 10 * 1024 * 1024;
    private static final int  MAX_TREE_DEPTH = 20;

    private final Path sandboxRoot;

    public FileSystemManager(
            @Value("${codeswarm.sandbox.root:./sandbox}") String sandboxPath
    ) {
        this.sandboxRoot = Paths.get(sandboxPath).toAbsolutePath().normalize();
        try {
            if (!Files.exists(sandboxRoot)) {
                Files.createDirectories(sandboxRoot);
                log.info("[FileSystem] Created sandbox: {}", sandboxRoot);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize sandbox: " + sandboxPath, e);
        }
        log.info("[FileSystem] Sandbox initialized: {}", sandboxRoot);
    }

    public Path getSandboxRoot() {
        return sandboxRoot;
    }

    // ================================================================
    // Target resolution
    // ================================================================

    /**
     * Resolve a user-supplied target directory. Relative paths are taken
     * against the sandbox root. The result is not checked for existence.
     */
    public Path resolveTarget(String targetDir) {
        if (targetDir == null || targetDir.isBlank()) {
            throw new IllegalArgumentException("Target directory cannot be empty");
        }
        Path candidate = Paths.get(targetDir);
        Path resolved  = (candidate.isAbsolute() ? candidate : sandboxRoot.resolve(candidate))
                .toAbsolutePath().normalize();
        if (!resolved.startsWith(sandboxRoot)) {
            throw new SandboxViolationException(targetDir,
                    "Target " + resolved + " is outside the sandbox " + sandboxRoot);
        }
        return resolved;
    }

    // ================================================================
    // File operations scoped to a target directory
    // ================================================================

    /** Python files under the target, as '/'-separated paths relative to it, sorted. */
    public List<String> listPythonFiles(Path target) throws FileSystemException {
        Path base = requireInsideSandbox(target);
        if (!Files.isDirectory(base)) {
            throw new FileSystemException("Not a directory: " + base);
        }
        try (Stream<Path> paths = Files.walk(base, MAX_TREE_DEPTH)) {
            List<String> files = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".py"))
                    .filter(p -> !isIgnored(base.relativize(p)))
                    .map(p -> toResourceId(base, p))
                    .sorted()
                    .collect(Collectors.toList());
            log.info("[FileSystem] Found {} Python file(s) in {}", files.size(), base);
            return files;
        } catch (IOException e) {
            throw new FileSystemException("Failed to list Python files in: " + base, e);
        }
    }

    public String readFile(Path target, String relativePath) throws FileSystemException {
        Path targetPath = resolveSafePath(target, relativePath);
        log.debug("[FileSystem] Reading file: {}", relativePath);
        try {
            long fileSize = Files.size(targetPath);
            if (fileSize > MAX_FILE_SIZE)
                throw new FileSystemException("File too large: " + relativePath + " (" + fileSize + " bytes)");
            return Files.readString(targetPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileSystemException("Failed to read file: " + relativePath, e);
        }
    }

    public void writeFileAtomic(Path target, String relativePath, String content) throws FileSystemException {
        Path targetPath = resolveSafePath(target, relativePath);
        log.info("[FileSystem] Writing {} chars to {}", content.length(), relativePath);

        Path parent = targetPath.getParent();
        Path temp   = null;
        try {
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, ".codeswarm-", ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[FileSystem] Atomic move unsupported for {}, falling back to replace", relativePath);
                Files.move(temp, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + relativePath, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    log.warn("[FileSystem] Could not remove temp file {}: {}", temp, cleanup.getMessage());
                }
            }
        }
    }

    public boolean fileExists(Path target, String relativePath) {
        return Files.isRegularFile(resolveSafePath(target, relativePath));
    }

    // ================================================================
    // Path safety
    // ================================================================

    Path resolveSafePath(Path target, String relativePath) {
        Path base = requireInsideSandbox(target);
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new IllegalArgumentException("Path cannot be empty");
        Path resolved = base.resolve(relativePath).normalize();
        if (!resolved.startsWith(base))
            throw new SandboxViolationException(relativePath,
                    "Path traversal attempt detected: " + relativePath + " escapes " + base);
        return resolved;
    }

    private Path requireInsideSandbox(Path target) {
        Path base = target.toAbsolutePath().normalize();
        if (!base.startsWith(sandboxRoot))
            throw new SandboxViolationException(target.toString(),
                    "Directory " + base + " is outside the sandbox " + sandboxRoot);
        return base;
    }

    private static String toResourceId(Path base, Path file) {
        return base.relativize(file).toString().replace('\\', '/');
    }

    private static boolean isIgnored(Path relative) {
        for (Path part : relative) {
            String name = part.toString();
            if (name.startsWith(".") || name.equals("__pycache__") ||
                name.equals("venv") || name.equals("node_modules")) {
                return true;
            }
        }
        return false;
    }

    // ================================================================
    // Exceptions
    // ================================================================

    public static class FileSystemException extends Exception {
        public FileSystemException(String message)                  { super(message); }
        public FileSystemException(String message, Throwable cause) { super(message, cause); }
    }
}
