package com.autoheal.core.filesystem;

import com.autoheal.config.AutoHealProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileSystemManager: every read and write the agents make inside the audited workspace.
 *
 * Writes are confined to the workspace root (path traversal is rejected).
 * Backups live in a directory under the workspace and are named
 * {stem}_{yyyyMMdd_HHmmss_SSS}{suffix}; they are only pruned when maxBackups > 0.
 */
@Component
public class FileSystemManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024;

    private static final DateTimeFormatter BACKUP_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path workspaceRoot;
    private final Path backupDirectory;
    private final int  maxBackups;

    public FileSystemManager(AutoHealProperties properties) {
        String workspacePath = properties.getWorkspacePath();
        this.workspaceRoot   = Paths.get(workspacePath).toAbsolutePath().normalize();
        this.backupDirectory = workspaceRoot.resolve(properties.getRepair().getBackupDirectory()).normalize();
        this.maxBackups      = properties.getRepair().getMaxBackups();
        try {
            if (!Files.exists(workspaceRoot)) {
                Files.createDirectories(workspaceRoot);
                log.info("[FileSystem] Created workspace: {}", workspaceRoot);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize workspace: " + workspacePath, e);
        }
        log.info("[FileSystem] Workspace initialized: {} (backups: {})", workspaceRoot, this.backupDirectory);
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public String getWorkspacePath() {
        return workspaceRoot.toString();
    }

    public Path getBackupDirectory() {
        return backupDirectory;
    }

    /**
     * Resolve a configured location. Absolute paths are kept as-is (log files and the
     * knowledge file may live outside the workspace); relative ones hang off the workspace.
     */
    public Path resolveConfigured(String configuredPath) {
        Path p = Paths.get(configuredPath);
        return p.isAbsolute() ? p.normalize() : workspaceRoot.resolve(p).normalize();
    }

    /** Workspace-relative form with forward slashes, or the absolute path if outside the workspace. */
    public String relativize(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (absolute.startsWith(workspaceRoot)) {
            return workspaceRoot.relativize(absolute).toString().replace('\\', '/');
        }
        return absolute.toString();
    }

    // ================================================================
    // Standard File Operations
    // ================================================================

    public String readFile(String relativePath) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
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

    public void writeFile(String relativePath, String content) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        log.info("[FileSystem] Writing {} chars to {}", content.length(), relativePath);
        try {
            Path parent = targetPath.getParent();
            if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
            Files.writeString(targetPath, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + relativePath, e);
        }
    }

    public boolean fileExists(String relativePath) {
        try { return Files.isRegularFile(resolveSafePath(relativePath)); }
        catch (FileSystemException e) { return false; }
    }

    /**
     * All regular files under the workspace with the given extension, skipping any
     * directory whose name is in excludedDirectories and the backup directory itself.
     * Sorted, workspace-relative.
     */
    public List<String> listFiles(String extension, Collection<String> excludedDirectories)
            throws FileSystemException {

        Set<String> excluded = new HashSet<>(excludedDirectories);
        List<String> files   = new ArrayList<>();

        try {
            Files.walkFileTree(workspaceRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(workspaceRoot)) return FileVisitResult.CONTINUE;
                    if (dir.equals(backupDirectory) || excluded.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && file.getFileName().toString().endsWith(extension)) {
                        files.add(relativize(file));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("[FileSystem] Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new FileSystemException("Failed to walk workspace", e);
        }

        Collections.sort(files);
        log.info("[FileSystem] Found {} {} files", files.size(), extension);
        return files;
    }

    // ================================================================
    // Backup / Restore
    // ================================================================

    /**
     * Copy a workspace file into the backup directory. Returns the backup path.
     */
    public Path backupFile(String relativePath) throws FileSystemException {
        Path source = resolveSafePath(relativePath);
        String fileName = source.getFileName().toString();
        int    dot      = fileName.lastIndexOf('.');
        String stem     = dot > 0 ? fileName.substring(0, dot) : fileName;
        String suffix   = dot > 0 ? fileName.substring(dot) : "";
        String stamp    = LocalDateTime.now().format(BACKUP_STAMP);

        try {
            Files.createDirectories(backupDirectory);

            Path backup = backupDirectory.resolve(stem + "_" + stamp + suffix);
            for (int n = 1; Files.exists(backup); n++) {
                backup = backupDirectory.resolve(stem + "_" + stamp + "-" + n + suffix);
            }

            Files.copy(source, backup, StandardCopyOption.COPY_ATTRIBUTES);
            log.info("[FileSystem] Backed up {} -> {}", relativePath, backup.getFileName());

            pruneBackups(backup);
            return backup;
        } catch (IOException e) {
            throw new FileSystemException("Failed to back up: " + relativePath, e);
        }
    }

    /** Overwrite a workspace file with the bytes of its backup. */
    public void restoreFile(String relativePath, Path backup) throws FileSystemException {
        Path target = resolveSafePath(relativePath);
        if (backup == null || !Files.isRegularFile(backup)) {
            throw new FileSystemException("Backup missing for " + relativePath + ": " + backup);
        }
        try {
            Files.copy(backup, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("[FileSystem] Restored {} from {}", relativePath, backup.getFileName());
        } catch (IOException e) {
            throw new FileSystemException("Failed to restore " + relativePath + " from " + backup, e);
        }
    }

    /**
     * Back up a workspace file, then overwrite it. If the write throws, the file is
     * restored from the backup before the failure is rethrown, so the caller never
     * sees a half-written file. Returns the backup path.
     */
    public Path replaceWithBackup(String relativePath, String content) throws FileSystemException {
        Path backup = backupFile(relativePath);
        try {
            writeFile(relativePath, content);
            return backup;
        } catch (FileSystemException | RuntimeException e) {
            log.error("[FileSystem] Write to {} failed, restoring from {}", relativePath, backup.getFileName());
            FileSystemException failure = new FileSystemException(
                    "Write failed, restored from backup " + backup + ": " + e.getMessage(), e);
            try {
                restoreFile(relativePath, backup);
            } catch (FileSystemException restoreFailure) {
                failure.addSuppressed(restoreFailure);
                log.error("[FileSystem] Restore of {} failed", relativePath, restoreFailure);
            }
            throw failure;
        }
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private void pruneBackups(Path keep) {
        if (maxBackups <= 0) return;

        try (Stream<Path> paths = Files.list(backupDirectory)) {
            // copies keep the source mtime, so the name breaks ties
            List<Path> others = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> !p.equals(keep))
                    .sorted(Comparator.comparing(this::lastModified)
                            .thenComparing(p -> p.getFileName().toString())
                            .reversed())
                    .collect(Collectors.toList());

            for (int i = maxBackups - 1; i < others.size(); i++) {
                Path old = others.get(i);
                Files.deleteIfExists(old);
                log.debug("[FileSystem] Pruned backup {}", old.getFileName());
            }
        } catch (IOException e) {
            log.warn("[FileSystem] Backup pruning failed: {}", e.getMessage());
        }
    }

    private long lastModified(Path p) {
        try { return Files.getLastModifiedTime(p).toMillis(); }
        catch (IOException e) { return 0L; }
    }

    private Path resolveSafePath(String relativePath) throws FileSystemException {
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new FileSystemException("Path cannot be empty");
        Path resolved = workspaceRoot.resolve(relativePath).normalize();
        if (!resolved.startsWith(workspaceRoot))
            throw new FileSystemException("Path traversal attempt detected: " + relativePath);
        return resolved;
    }

    // ================================================================
    // Inner classes
    // ================================================================

    public static class FileSystemException extends Exception {
        public FileSystemException(String message)                  { super(message); }
        public FileSystemException(String message, Throwable cause) { super(message, cause); }
    }
}
