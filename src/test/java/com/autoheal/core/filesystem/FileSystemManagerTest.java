package com.autoheal.core.filesystem;

import com.autoheal.config.AutoHealProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemManagerTest {

    @TempDir
    Path tempDir;

    private FileSystemManager fileSystem;

    @BeforeEach
    void setUp() {
        fileSystem = new FileSystemManager(properties(0));
    }

    private AutoHealProperties properties(int maxBackups) {
        AutoHealProperties properties = new AutoHealProperties();
        properties.setWorkspacePath(tempDir.toString());
        properties.getRepair().setMaxBackups(maxBackups);
        return properties;
    }

    @Test
    void testWriteAndReadFile() throws Exception {
        String content = "def calculate(a, b):\n    return a + b\n";

        fileSystem.writeFile("calculator.py", content);

        assertEquals(content, fileSystem.readFile("calculator.py"));
    }

    @Test
    void testPathTraversalPrevention() {
        assertThrows(
            FileSystemManager.FileSystemException.class,
            () -> fileSystem.readFile("../../etc/passwd")
        );
        assertFalse(fileSystem.fileExists("../outside.txt"));
    }

    @Test
    void testFileCreatedInWorkspace() throws Exception {
        fileSystem.writeFile("pkg/newfile.py", "x = 1\n");

        assertTrue(Files.exists(tempDir.resolve("pkg/newfile.py")));
        assertTrue(fileSystem.fileExists("pkg/newfile.py"));
        assertFalse(fileSystem.fileExists("pkg/missing.py"));
    }

    @Test
    void testListFilesSkipsExcludedAndBackupDirectories() throws Exception {
        fileSystem.writeFile("app.py", "x = 1\n");
        fileSystem.writeFile("pkg/util.py", "y = 2\n");
        fileSystem.writeFile("venv/lib/site.py", "z = 3\n");
        fileSystem.writeFile("agent_backups/app_20260101_000000_000.py", "x = 0\n");
        fileSystem.writeFile("notes.txt", "not python");

        List<String> files = fileSystem.listFiles(".py", List.of("venv"));

        assertEquals(List.of("app.py", "pkg/util.py"), files);
    }

    @Test
    void testBackupNamingAndContent() throws Exception {
        fileSystem.writeFile("app.py", "original\n");

        Path backup = fileSystem.backupFile("app.py");

        assertTrue(backup.startsWith(fileSystem.getBackupDirectory()));
        assertTrue(backup.getFileName().toString().matches("app_\\d{8}_\\d{6}_\\d{3}(-\\d+)?\\.py"));
        assertEquals("original\n", Files.readString(backup));
    }

    @Test
    void testBackupsInSameMillisecondDoNotCollide() throws Exception {
        fileSystem.writeFile("app.py", "original\n");

        Path first  = fileSystem.backupFile("app.py");
        Path second = fileSystem.backupFile("app.py");

        assertNotEquals(first, second);
        assertTrue(Files.exists(first));
        assertTrue(Files.exists(second));
    }

    @Test
    void testSettingsComeFromProperties() throws Exception {
        AutoHealProperties properties = properties(1);
        properties.getRepair().setBackupDirectory("snapshots");
        FileSystemManager configured = new FileSystemManager(properties);
        configured.writeFile("app.py", "v\n");

        configured.backupFile("app.py");
        Path kept = configured.backupFile("app.py");

        assertEquals(tempDir.toAbsolutePath().normalize(), configured.getWorkspaceRoot());
        assertEquals(tempDir.toAbsolutePath().normalize().resolve("snapshots"), configured.getBackupDirectory());
        try (var backups = Files.list(configured.getBackupDirectory())) {
            assertEquals(List.of(kept), backups.collect(Collectors.toList()));
        }
    }

    @Test
    void testPruningKeepsNewestBackups() throws Exception {
        FileSystemManager pruning = new FileSystemManager(properties(2));
        pruning.writeFile("app.py", "v\n");

        for (int i = 0; i < 4; i++) {
            pruning.backupFile("app.py");
        }

        try (var backups = Files.list(pruning.getBackupDirectory())) {
            assertEquals(2, backups.count());
        }
    }

    @Test
    void testReplaceWithBackupWritesNewContent() throws Exception {
        fileSystem.writeFile("app.py", "old\n");

        Path backup = fileSystem.replaceWithBackup("app.py", "new\n");

        assertEquals("new\n", fileSystem.readFile("app.py"));
        assertEquals("old\n", Files.readString(backup));
    }

    @Test
    void testReplaceWithBackupRestoresOnFailedWrite() throws Exception {
        FileSystemManager failing = new FileSystemManager(properties(0)) {
            @Override
            public void writeFile(String relativePath, String content) throws FileSystemException {
                super.writeFile(relativePath, content.substring(0, content.length() / 2));
                throw new FileSystemException("Disk full");
            }
        };
        Files.writeString(tempDir.resolve("app.py"), "original content\n");

        FileSystemManager.FileSystemException e = assertThrows(
                FileSystemManager.FileSystemException.class,
                () -> failing.replaceWithBackup("app.py", "replacement content\n"));

        assertTrue(e.getMessage().contains("restored from backup"));
        assertEquals("original content\n", Files.readString(tempDir.resolve("app.py")));
    }

    @Test
    void testResolveConfiguredAndRelativize() {
        Path absolute = tempDir.resolve("logs/error.log").toAbsolutePath();

        assertEquals(tempDir.toAbsolutePath().normalize().resolve("debug.log"),
                fileSystem.resolveConfigured("debug.log"));
        assertEquals(absolute.normalize(), fileSystem.resolveConfigured(absolute.toString()));
        assertEquals("logs/error.log", fileSystem.relativize(absolute));
    }
}
