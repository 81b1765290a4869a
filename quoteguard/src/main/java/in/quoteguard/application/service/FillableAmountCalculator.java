package in.quoteguard.application.service;

import in.quoteguard.application.port.output.ValidatorMetrics;
import in.quoteguard.application.port.output.ValidatorMetrics.FillOutcome;
import in.quoteguard.domain.model.EffectiveBalance;
import in.quoteguard.domain.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Taker fillable amount of a single quote given the maker's effective balance.
 *
 * Partial fills scale the taker amount by balance / makerAssetAmount and round down to
 * a whole base unit, so the result never exceeds what the maker can deliver.
 */
public final class FillableAmountCalculator {
    private static final Logger log = LoggerFactory.getLogger(FillableAmountCalculator.class);

    private final ValidatorMetrics metrics;

    public FillableAmountCalculator(ValidatorMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * @param quote   the quote
     * @param balance maker's effective balance, or null when the maker has no cache row
     */
    public BigDecimal compute(Quote quote, EffectiveBalance balance) {
        if (balance == null) {
            metrics.recordFill(FillOutcome.UNKNOWN_MAKER);
            return quote.takerAssetAmount();
        }

        // Maker holds the full amount
        if (balance.covers(quote.makerAssetAmount())) {
            metrics.recordFill(FillOutcome.FULL);
            return quote.takerAssetAmount();
        }

        if (quote.makerAssetAmount().signum() <= 0) {
            metrics.recordFill(FillOutcome.EMPTY_ORDER);
            return BigDecimal.ZERO;
        }

        if (balance.unconstrained()) {
            log.error("Partial fill requested for maker {} with an unconstrained balance. This should never happen",
                quote.makerAddress());
            metrics.recordFill(FillOutcome.INCONSISTENT);
            return BigDecimal.ZERO;
        }

        BigDecimal partial = balance.amount()
            .multiply(quote.takerAssetAmount())
            .divide(quote.makerAssetAmount(), 0, RoundingMode.DOWN);

        metrics.recordFill(FillOutcome.PARTIAL);
        log.debug("Maker {} holds {} of {}: partial fill {} of {}",
            quote.makerAddress(), balance.amount().toPlainString(), quote.makerAssetAmount().toPlainString(),
            partial.toPlainString(), quote.takerAssetAmount().toPlainString());
        return partial;
    }
}
