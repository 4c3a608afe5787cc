package com.sailfish.retrydispatch.dispatch;

import java.util.Collections;
import java.util.List;

/**
 * What one dispatch cycle did with each id it received.
 */
public final class DispatchResult {

    private final List<Long> scheduledIds;
    private final List<Long> abandonedIds;
    private final List<Long> skippedIds;
    private final List<Long> overflowIds;
    private final List<String> malformedTokens;
    private final int budgetSnapshot;

    DispatchResult(List<Long> scheduledIds, List<Long> abandonedIds, List<Long> skippedIds,
                   List<Long> overflowIds, List<String> malformedTokens, int budgetSnapshot) {
        this.scheduledIds = Collections.unmodifiableList(scheduledIds);
        this.abandonedIds = Collections.unmodifiableList(abandonedIds);
        this.skippedIds = Collections.unmodifiableList(skippedIds);
        this.overflowIds = Collections.unmodifiableList(overflowIds);
        this.malformedTokens = Collections.unmodifiableList(malformedTokens);
        this.budgetSnapshot = budgetSnapshot;
    }

    /**
     * @return Candidates whose worker was handed to the executor, in order.
     */
    public List<Long> getScheduledIds() { return scheduledIds; }

    /**
     * @return Candidates dropped because their handler could not be resolved or initialized.
     */
    public List<Long> getAbandonedIds() { return abandonedIds; }

    /**
     * @return Ids that did not resolve to a record with retry ids.
     */
    public List<Long> getSkippedIds() { return skippedIds; }

    /**
     * @return Candidates handed to the overflow republisher, in original order.
     */
    public List<Long> getOverflowIds() { return overflowIds; }

    public List<String> getMalformedTokens() { return malformedTokens; }

    /**
     * @return The number of free budget slots observed before the first candidate was dispatched.
     */
    public int getBudgetSnapshot() { return budgetSnapshot; }

    public boolean hasOverflow() {
        return !overflowIds.isEmpty();
    }

    @Override
    public String toString() {
        return "DispatchResult{" +
               "scheduled=" + scheduledIds.size() +
               ", abandoned=" + abandonedIds.size() +
               ", skipped=" + skippedIds.size() +
               ", overflow=" + overflowIds.size() +
               ", malformed=" + malformedTokens.size() +
               ", budgetSnapshot=" + budgetSnapshot +
               '}';
    }
}
