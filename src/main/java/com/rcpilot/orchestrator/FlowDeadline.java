package com.rcpilot.orchestrator;

import com.rcpilot.core.error.RepairTimeoutException;

import java.time.Duration;

/**
 * Wall-clock budget of one repair flow. Checked before every external call.
 */
final class FlowDeadline {

    private final long deadlineNanos;

    private FlowDeadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    static FlowDeadline start(Duration flowTimeout) {
        return new FlowDeadline(System.nanoTime() + flowTimeout.toNanos());
    }

    Duration remaining() {
        return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    }

    /** Per-call timeout: the configured iteration timeout, capped by what is left of the flow. */
    Duration iterationTimeout(Duration perIteration) {
        Duration left = remaining();
        return left.compareTo(perIteration) < 0 ? left : perIteration;
    }

    /**
     * @throws RepairTimeoutException if the flow ran out of time or its thread was interrupted
     */
    void checkpoint(String path, String step) {
        if (Thread.currentThread().isInterrupted()) {
            throw new RepairTimeoutException(path, "Flow interrupted before " + step);
        }
        if (remaining().isZero()) {
            throw new RepairTimeoutException(path, "Flow deadline expired before " + step);
        }
    }
}
