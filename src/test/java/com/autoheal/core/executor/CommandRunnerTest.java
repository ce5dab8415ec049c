package com.autoheal.core.executor;

import com.autoheal.config.AutoHealProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandRunnerTest {

    @TempDir
    Path tempDir;

    private CommandRunner runner() {
        AutoHealProperties properties = new AutoHealProperties();
        properties.setWorkspacePath(tempDir.toString());
        properties.getRepair().setCommandTimeoutSeconds(5);
        return new CommandRunner(properties);
    }

    @Test
    void testEmptyCommandIsAnError() {
        CommandRunner runner = runner();

        CommandResult result = runner.run(List.of());

        assertFalse(result.isSuccess());
        assertEquals(-2, result.getExitCode());
        assertEquals("No command configured", result.getOutput());
    }

    @Test
    void testMissingExecutableDoesNotThrow() {
        CommandRunner runner = runner();

        CommandResult result = runner.run(List.of("definitely-not-a-real-tool-4711"));

        assertFalse(result.isSuccess());
        assertFalse(result.isTimedOut());
        assertTrue(result.getOutput().startsWith("Command execution failed"));
    }

    @Test
    void testSuccessRequiresZeroExitAndNoTimeout() {
        assertTrue(new CommandResult(0, "", false, 10).isSuccess());
        assertFalse(new CommandResult(0, "", true, 10).isSuccess());
        assertFalse(new CommandResult(1, "", false, 10).isSuccess());
    }
}
