package in.quoteguard.application.port.output;

import in.quoteguard.domain.model.BalanceStatus;

/**
 * Metrics hooks for firm quote validation.
 *
 * Implementations can publish to Prometheus or any other sink. Calls must be cheap and never throw.
 */
public interface ValidatorMetrics {

    /**
     * Outcome of one quote's fillable amount computation.
     */
    enum FillOutcome {
        UNKNOWN_MAKER,
        FULL,
        PARTIAL,
        EMPTY_ORDER,
        INCONSISTENT
    }

    /**
     * Record a batch rejected for mixing maker assets.
     *
     * @param quoteCount number of quotes zeroed out
     */
    void recordBatchRejected(int quoteCount);

    /**
     * Record how a cache row was classified.
     */
    void recordClassification(BalanceStatus status);

    /**
     * Record the fill outcome of a single quote.
     */
    void recordFill(FillOutcome outcome);

    /**
     * Record makers registered for sampling.
     */
    void recordBackfill(int makerCount);

    /**
     * Record a failed backfill write.
     */
    void recordBackfillFailure();

    ValidatorMetrics NOOP = new ValidatorMetrics() {
        @Override
        public void recordBatchRejected(int quoteCount) {}

        @Override
        public void recordClassification(BalanceStatus status) {}

        @Override
        public void recordFill(FillOutcome outcome) {}

        @Override
        public void recordBackfill(int makerCount) {}

        @Override
        public void recordBackfillFailure() {}
    };
}
