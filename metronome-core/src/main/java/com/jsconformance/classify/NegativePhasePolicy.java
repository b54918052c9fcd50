package com.jsconformance.classify;

/**
 * Capability limits of the target executor when judging negative tests.
 *
 * @param earlyReportedAsParse   the executor has no separate early-error signal, so an
 *                               expected {@code early} failure is matched against {@code parse}
 * @param resolutionUnsupported  the executor cannot resolve modules, so every
 *                               {@code resolution} negative test fails
 */
public record NegativePhasePolicy(boolean earlyReportedAsParse, boolean resolutionUnsupported) {

    public static final NegativePhasePolicy DEFAULT = new NegativePhasePolicy(true, true);
}
