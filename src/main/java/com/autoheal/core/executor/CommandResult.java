package com.autoheal.core.executor;

/**
 * CommandResult - outcome of one external command run by CommandRunner.
 *
 * Fields:
 *   - exitCode: process exit code, -1 on timeout, -2 when the process could not start
 *   - output: merged stdout/stderr in the order the process wrote it
 *   - timedOut: true when the process was killed at the timeout
 *   - elapsedTimeMs: wall-clock time of the run
 */
public class CommandResult {

    private final int     exitCode;
    private final String  output;
    private final boolean timedOut;
    private final long    elapsedTimeMs;

    public CommandResult(int exitCode, String output, boolean timedOut, long elapsedTimeMs) {
        this.exitCode      = exitCode;
        this.output        = output != null ? output : "";
        this.timedOut      = timedOut;
        this.elapsedTimeMs = elapsedTimeMs;
    }

    public static CommandResult error(String errorMessage) {
        return new CommandResult(-2, errorMessage, false, 0);
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public long getElapsedTimeMs() {
        return elapsedTimeMs;
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }

    @Override
    public String toString() {
        return String.format(
            "CommandResult{exitCode=%d, outputLen=%d, timedOut=%s, elapsedMs=%d}",
            exitCode,
            output.length(),
            timedOut,
            elapsedTimeMs
        );
    }
}
