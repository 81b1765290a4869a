package in.quoteguard.domain.model;

/**
 * How a cache row was judged when converting it to an effective balance.
 */
public enum BalanceStatus {
    /** Sampled within the threshold, balance used as-is. */
    FRESH,
    /** Registered within the threshold, never sampled. Treated as unconstrained. */
    RECENTLY_REGISTERED,
    /** Registered longer ago than the threshold and still never sampled. */
    UNSAMPLED_STUCK,
    /** Last sample older than the threshold. */
    SAMPLE_STALE,
    /** Sample time present but balance missing or negative. */
    INVALID_BALANCE
}
