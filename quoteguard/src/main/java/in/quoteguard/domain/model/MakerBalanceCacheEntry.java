package in.quoteguard.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Row of the maker balance chain cache.
 *
 * Rows are registered with only timeFirstSeen set. The balance sampler fills in
 * balance and timeOfSample later. A row with timeOfSample but no balance is corrupt.
 */
public record MakerBalanceCacheEntry(
    String tokenAddress,
    String makerAddress,
    BigDecimal balance,
    Instant timeFirstSeen,
    Instant timeOfSample
) {
    public boolean isSampled() {
        return timeOfSample != null;
    }

    /**
     * Row as written by the backfill: registered, never sampled.
     */
    public static MakerBalanceCacheEntry registered(String tokenAddress, String makerAddress, Instant timeFirstSeen) {
        return new MakerBalanceCacheEntry(tokenAddress, makerAddress, null, timeFirstSeen, null);
    }

    /**
     * Row as written by the sampler.
     */
    public static MakerBalanceCacheEntry sampled(String tokenAddress, String makerAddress, BigDecimal balance,
                                                 Instant timeFirstSeen, Instant timeOfSample) {
        return new MakerBalanceCacheEntry(tokenAddress, makerAddress, balance, timeFirstSeen, timeOfSample);
    }
}
