package in.quoteguard.application.service;

import in.quoteguard.application.port.output.ValidatorMetrics;
import in.quoteguard.domain.model.BalanceStatus;
import in.quoteguard.domain.model.EffectiveBalance;
import in.quoteguard.domain.model.MakerBalanceCacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns cache rows into effective balances using the staleness threshold.
 *
 * Rules:
 * - Never sampled, registered within the threshold: unconstrained
 * - Never sampled, registered before the threshold: zero (sampler stuck)
 * - Sampled before the threshold: zero (sampler stuck)
 * - Sampled within the threshold without a balance: zero (corrupt row)
 * - Sampled within the threshold: the sampled balance
 */
public final class BalanceFreshnessClassifier {
    private static final Logger log = LoggerFactory.getLogger(BalanceFreshnessClassifier.class);

    private final Duration stalenessThreshold;
    private final ValidatorMetrics metrics;

    public BalanceFreshnessClassifier(Duration stalenessThreshold, ValidatorMetrics metrics) {
        if (stalenessThreshold == null || stalenessThreshold.isNegative() || stalenessThreshold.isZero()) {
            throw new IllegalArgumentException("Staleness threshold must be positive: " + stalenessThreshold);
        }
        this.stalenessThreshold = stalenessThreshold;
        this.metrics = metrics;
    }

    /**
     * Build the maker lookup table for one validation call.
     *
     * @param entries cache rows of a single token
     * @param now     the call's reference time, shared by every row
     * @return effective balance per maker address; makers without a row are absent
     */
    public Map<String, EffectiveBalance> classifyAll(List<MakerBalanceCacheEntry> entries, Instant now) {
        Map<String, EffectiveBalance> lookup = new HashMap<>();
        for (MakerBalanceCacheEntry entry : entries) {
            lookup.put(entry.makerAddress(), classify(entry, now));
        }
        return lookup;
    }

    public EffectiveBalance classify(MakerBalanceCacheEntry entry, Instant now) {
        EffectiveBalance result = evaluate(entry, now);
        metrics.recordClassification(result.status());
        return result;
    }

    private EffectiveBalance evaluate(MakerBalanceCacheEntry entry, Instant now) {
        if (!entry.isSampled()) {
            // Registered but not yet picked up by the sampler
            Instant firstSeen = entry.timeFirstSeen() != null ? entry.timeFirstSeen() : Instant.EPOCH;
            if (isOlderThanThreshold(firstSeen, now)) {
                log.error("Cache entry for maker {} and token {} was first added at {}, more than {} ago. Assuming sampler is stuck.",
                    entry.makerAddress(), entry.tokenAddress(), firstSeen, stalenessThreshold);
                return EffectiveBalance.denied(BalanceStatus.UNSAMPLED_STUCK);
            }
            log.warn("No sampled balance yet for token {} and maker {}. Entry was added at {}, assuming the entire taker amount is fillable",
                entry.tokenAddress(), entry.makerAddress(), firstSeen);
            return EffectiveBalance.unconstrained(BalanceStatus.RECENTLY_REGISTERED);
        }

        if (isOlderThanThreshold(entry.timeOfSample(), now)) {
            log.error("Cache entry for maker {} and token {} was last refreshed at {}, more than {} ago. Assuming sampler is stuck.",
                entry.makerAddress(), entry.tokenAddress(), entry.timeOfSample(), stalenessThreshold);
            return EffectiveBalance.denied(BalanceStatus.SAMPLE_STALE);
        }

        if (entry.balance() == null) {
            log.error("Cache entry for maker {} and token {} has a sample time but a null balance",
                entry.makerAddress(), entry.tokenAddress());
            return EffectiveBalance.denied(BalanceStatus.INVALID_BALANCE);
        }

        if (entry.balance().signum() < 0) {
            log.error("Cache entry for maker {} and token {} has a negative balance {}",
                entry.makerAddress(), entry.tokenAddress(), entry.balance().toPlainString());
            return EffectiveBalance.denied(BalanceStatus.INVALID_BALANCE);
        }

        return EffectiveBalance.of(entry.balance(), BalanceStatus.FRESH);
    }

    private boolean isOlderThanThreshold(Instant timestamp, Instant now) {
        return Duration.between(timestamp, now).compareTo(stalenessThreshold) > 0;
    }
}
