package com.autoheal.core.executor;

import com.autoheal.config.AutoHealProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools (dependency scanner, outdated-package check) inside the workspace.
 *
 * stderr is merged into stdout so tool output keeps its original order.
 * Never throws: a process that cannot start yields CommandResult.error(...).
 */
@Component
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private final Path workingDirectory;
    private final int  timeoutSeconds;

    public CommandRunner(AutoHealProperties properties) {
        this.workingDirectory = Path.of(properties.getWorkspacePath()).toAbsolutePath().normalize();
        this.timeoutSeconds   = properties.getRepair().getCommandTimeoutSeconds();

        log.info("[CommandRunner] Workspace: {}, timeout: {}s", workingDirectory, timeoutSeconds);
    }

    public CommandResult run(List<String> command) {

        if (command == null || command.isEmpty()) {
            return CommandResult.error("No command configured");
        }

        long startTime = System.currentTimeMillis();
        log.info("[CommandRunner] Executing: {}", String.join(" ", command));

        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(workingDirectory.toFile());
            builder.redirectErrorStream(true);

            Process process = builder.start();

            StringBuffer output = new StringBuffer();

            Thread outThread = new Thread(() -> {
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        output.append(line).append("\n");
                    }
                } catch (Exception e) {
                    log.warn("[CommandRunner] Error reading output: {}", e.getMessage());
                }
            });

            outThread.start();

            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                log.warn("[CommandRunner] {} timed out after {} seconds", command.get(0), timeoutSeconds);
                return new CommandResult(
                        -1,
                        output + "TIMEOUT after " + timeoutSeconds + " seconds",
                        true,
                        System.currentTimeMillis() - startTime
                );
            }

            outThread.join(1000);

            int exitCode = process.exitValue();
            log.info("[CommandRunner] Exit code: {}, output length: {} chars", exitCode, output.length());

            return new CommandResult(exitCode, output.toString(), false, System.currentTimeMillis() - startTime);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[CommandRunner] Interrupted while running {}", command.get(0));
            return CommandResult.error("Interrupted: " + String.join(" ", command));
        } catch (Exception e) {
            log.error("[CommandRunner] Execution failed: {}", e.getMessage());
            return new CommandResult(
                    -2,
                    "Command execution failed: " + e.getMessage(),
                    false,
                    System.currentTimeMillis() - startTime
            );
        }
    }
}
