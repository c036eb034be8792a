package com.rcpilot.core.verifier;

/**
 * VerificationResult — outcome of one verifier run.
 *
 * Fields:
 *   - exitCode:  process exit code; -1 on timeout, -2 when the process could not run
 *   - output:    stdout and stderr merged in the order the process wrote them
 *   - elapsedMs: wall-clock time the run took
 */
public class VerificationResult {

    public static final int EXIT_TIMEOUT = -1;
    public static final int EXIT_ERROR   = -2;

    private final int    exitCode;
    private final String output;
    private final long   elapsedMs;

    public VerificationResult(int exitCode, String output, long elapsedMs) {
        this.exitCode  = exitCode;
        this.output    = output != null ? output : "";
        this.elapsedMs = elapsedMs;
    }

    public int    getExitCode()  { return exitCode; }
    public String getOutput()    { return output; }
    public long   getElapsedMs() { return elapsedMs; }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public boolean isTimedOut() {
        return exitCode == EXIT_TIMEOUT;
    }

    /**
     * Create an error result.
     * Used when the verifier process cannot be started at all.
     */
    public static VerificationResult error(String message, long elapsedMs) {
        return new VerificationResult(EXIT_ERROR, message, elapsedMs);
    }

    @Override
    public String toString() {
        return String.format("VerificationResult{exitCode=%d, outputLen=%d, elapsedMs=%d}",
                exitCode, output.length(), elapsedMs);
    }
}
