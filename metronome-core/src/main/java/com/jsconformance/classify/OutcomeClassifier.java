package com.jsconformance.classify;

import com.jsconformance.model.NegativeExpectation;
import com.jsconformance.model.TestMetadata;
import com.jsconformance.model.TestOutcome;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Deterministic outcome classification shared by the direct and batched run modes.
 *
 * Classification of test262 results follows INTERPRETING.md:
 * https://github.com/tc39/test262/blob/main/INTERPRETING.md
 */
public class OutcomeClassifier {

    public static final String ASYNC_COMPLETE = "Test262:AsyncTestComplete";
    public static final String ASYNC_FAILURE = "Test262:AsyncTestFailure";

    private final Set<String> unsupportedFeatures;
    private final NegativePhasePolicy policy;

    public OutcomeClassifier(Set<String> unsupportedFeatures, NegativePhasePolicy policy) {
        this.unsupportedFeatures = Set.copyOf(Objects.requireNonNull(unsupportedFeatures, "unsupportedFeatures"));
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Outcomes decided without running the executor.
     *
     * @param metadata the parsed metadata, {@code null} if the file has none
     * @return a terminal outcome, or empty if the test has to be executed
     */
    public Optional<TestOutcome> preflight(TestMetadata metadata) {
        if (metadata == null) {
            return Optional.of(TestOutcome.METADATA_ERROR);
        }
        if (metadata.declaresAnyFeature(unsupportedFeatures)) {
            return Optional.of(TestOutcome.SKIPPED);
        }
        return Optional.empty();
    }

    /**
     * Classifies one executed run.
     *
     * @throws com.jsconformance.model.ConfigurationException if the metadata names a
     *         negative phase this classifier cannot judge
     */
    public TestOutcome classify(TestMetadata metadata, ExecutionResult result) {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(result, "result");

        if (result.harnessError()) {
            return TestOutcome.HARNESS_ERROR;
        }

        if (metadata.isNegative()) {
            return classifyNegative(metadata.negative(), result);
        }

        if (result.hasError()) {
            return TestOutcome.FAILED;
        }

        if (metadata.isAsync()) {
            String output = result.output() == null ? "" : result.output();
            return passedIf(output.contains(ASYNC_COMPLETE) && !output.contains(ASYNC_FAILURE));
        }

        return TestOutcome.PASSED;
    }

    private TestOutcome classifyNegative(NegativeExpectation negative, ExecutionResult result) {
        if (!result.hasError()) {
            return TestOutcome.FAILED;
        }
        switch (negative.phase()) {
            case PARSE:
                return passedIf("parse".equals(result.errorPhase()) && typeMatches(negative, result));
            case EARLY:
                String expectedPhase = policy.earlyReportedAsParse() ? "parse" : "early";
                return passedIf(expectedPhase.equals(result.errorPhase()) && typeMatches(negative, result));
            case RUNTIME:
                return passedIf("runtime".equals(result.errorPhase())
                    && Objects.equals(negative.type(), result.errorType()));
            case RESOLUTION:
                if (policy.resolutionUnsupported()) {
                    return TestOutcome.FAILED;
                }
                return passedIf("resolution".equals(result.errorPhase()) && typeMatches(negative, result));
            default:
                throw new IllegalStateException("Unhandled phase " + negative.phase());
        }
    }

    private static boolean typeMatches(NegativeExpectation negative, ExecutionResult result) {
        return !negative.hasType() || negative.type().equals(result.errorType());
    }

    private static TestOutcome passedIf(boolean condition) {
        return condition ? TestOutcome.PASSED : TestOutcome.FAILED;
    }
}
