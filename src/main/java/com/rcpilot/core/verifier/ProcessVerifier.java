package com.rcpilot.core.verifier;

import com.rcpilot.config.RepairConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured verifier command ("refinedc check" by default) on one
 * file, inside that file's directory.
 *
 * stderr is merged into stdout at the OS level so the classifier sees lines in
 * the order the verifier printed them.
 */
@Component
@Profile("!stub")
public class ProcessVerifier implements Verifier {

    private static final Logger log = LoggerFactory.getLogger(ProcessVerifier.class);

    private static final long READER_JOIN_MS = 1000;

    private final List<String> command;

    public ProcessVerifier(RepairConfig config) {
        this.command = Arrays.asList(config.getVerifierCommand().trim().split("\\s+"));
        log.info("[Verifier] Command: {}", String.join(" ", command));
    }

    @Override
    public VerificationResult verify(Path file, Duration timeout) throws InterruptedException {

        long startTime = System.currentTimeMillis();

        List<String> cmd = new ArrayList<>(command);
        cmd.add(file.getFileName().toString());

        Path workDir = file.toAbsolutePath().getParent();
        log.info("[Verifier] Executing: {} (in {}, timeout {}s)",
                String.join(" ", cmd), workDir, timeout.toSeconds());

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(cmd);
            if (workDir != null) builder.directory(workDir.toFile());
            builder.redirectErrorStream(true);
            process = builder.start();
        } catch (IOException e) {
            log.error("[Verifier] Could not start verifier: {}", e.getMessage());
            return VerificationResult.error("Verifier could not be started: " + e.getMessage(),
                    System.currentTimeMillis() - startTime);
        }

        StringBuilder output = new StringBuilder();

        Thread outThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (output) {
                        output.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                log.warn("[Verifier] Error reading output: {}", e.getMessage());
            }
        }, "verifier-output");
        outThread.setDaemon(true);
        outThread.start();

        try {
            boolean finished = process.waitFor(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);

            if (!finished) {
                process.destroyForcibly();
                log.warn("[Verifier] Process timed out after {} ms", timeout.toMillis());
                return new VerificationResult(
                        VerificationResult.EXIT_TIMEOUT,
                        snapshot(output) + "TIMEOUT after " + timeout.toSeconds() + " seconds",
                        System.currentTimeMillis() - startTime);
            }

            outThread.join(READER_JOIN_MS);

        } catch (InterruptedException e) {
            process.destroyForcibly();
            log.warn("[Verifier] Interrupted, verifier process destroyed");
            throw e;
        }

        String merged   = snapshot(output);
        int    exitCode = process.exitValue();

        log.info("[Verifier] Exit code: {}, Output length: {} chars", exitCode, merged.length());

        return new VerificationResult(exitCode, merged, System.currentTimeMillis() - startTime);
    }

    private static String snapshot(StringBuilder output) {
        synchronized (output) {
            return output.toString();
        }
    }
}
