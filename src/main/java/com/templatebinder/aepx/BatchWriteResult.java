package com.templatebinder.aepx;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link ExpressionWriter#addMultiple}.
 * <p>
 * {@link #isSuccess()} is true whenever the batch ran to completion, even if every item
 * failed; callers that need "all written" must check {@link #getFailures()}. Only a batch
 * stopped on its first error reports false.
 */
public final class BatchWriteResult {
    private final boolean success;
    private final boolean stoppedEarly;
    private final List<String> successes;
    private final List<BatchFailure> failures;
    private final String message;

    private BatchWriteResult(boolean success, boolean stoppedEarly, List<String> successes,
                             List<BatchFailure> failures, String message) {
        this.success = success;
        this.stoppedEarly = stoppedEarly;
        this.successes = Collections.unmodifiableList(new ArrayList<>(successes));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
        this.message = message;
    }

    static BatchWriteResult completed(List<String> successes, List<BatchFailure> failures) {
        String message = failures.isEmpty()
            ? "All " + successes.size() + " expressions added successfully"
            : successes.size() + " succeeded, " + failures.size() + " failed";
        return new BatchWriteResult(true, false, successes, failures, message);
    }

    static BatchWriteResult stopped(List<String> successes, List<BatchFailure> failures) {
        return new BatchWriteResult(false, true, successes, failures,
            "Stopped after " + successes.size() + " successes, 1 failure");
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isStoppedEarly() {
        return stoppedEarly;
    }

    public boolean isAllSucceeded() {
        return failures.isEmpty();
    }

    public List<String> getSuccesses() {
        return successes;
    }

    public List<BatchFailure> getFailures() {
        return failures;
    }

    public String getMessage() {
        return message;
    }

    public record BatchFailure(String layer, String error) {}
}
