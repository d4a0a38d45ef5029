package com.largomodo.romaudit.core;

import com.largomodo.romaudit.core.domain.VerificationReport;

/**
 * Observer interface for batch verification events.
 * <p>
 * Callbacks arrive on worker threads, possibly concurrently. All methods have default no-op
 * implementations, so consumers override only the events they care about.
 *
 * @see BatchVerifier
 */
public interface VerificationObserver {

    /**
     * Called when verification of a machine begins.
     *
     * @param machine the machine being verified
     */
    default void onStart(String machine) {}

    /**
     * Called with the finished report of a machine.
     *
     * @param report independent per-machine report
     */
    default void onReport(VerificationReport report) {}

    /**
     * Called when verifying a machine failed unexpectedly. Other machines are not affected.
     *
     * @param machine the machine that failed
     * @param e       the exception that caused the failure
     */
    default void onFailure(String machine, Exception e) {}
}
