package com.rcpilot.core.verifier;

import java.nio.file.Path;
import java.time.Duration;

/**
 * External verifier. Exit code 0 is the only success signal; the merged
 * output is the only diagnostic surface.
 */
public interface Verifier {

    /**
     * Verify one file on disk.
     *
     * @param file    absolute path of the artifact to check
     * @param timeout wall-clock limit; the process is destroyed when it runs over
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    VerificationResult verify(Path file, Duration timeout) throws InterruptedException;
}
