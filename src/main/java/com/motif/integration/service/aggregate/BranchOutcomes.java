package com.motif.integration.service.aggregate;

import com.motif.integration.service.outcome.StageOutcome;

/**
 * Outcomes of two concurrently executed branches, in submission order.
 */
public record BranchOutcomes<A, B>(StageOutcome<A> first, StageOutcome<B> second) {

    public boolean allSucceeded() {
        return first.isSuccess() && second.isSuccess();
    }

    public boolean allFailed() {
        return !first.isSuccess() && !second.isSuccess();
    }
}
