package in.quoteguard.application.service;

import in.quoteguard.application.port.input.FirmQuoteValidator;
import in.quoteguard.application.port.output.MakerBalanceCacheRepository;
import in.quoteguard.application.port.output.ValidatorMetrics;
import in.quoteguard.domain.model.EffectiveBalance;
import in.quoteguard.domain.model.MakerBalanceCacheEntry;
import in.quoteguard.domain.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Firm quote validator backed by the maker balance chain cache.
 *
 * Flow per call:
 * 1. Reject batches that mix maker assets (all zeros)
 * 2. Read cache rows for the batch's makers
 * 3. Classify each row against the staleness threshold
 * 4. Compute fillable amounts, collecting makers without a row
 * 5. Register those makers for sampling
 *
 * Holds no per-call state; safe to share between request workers.
 */
public final class BalanceCacheFirmQuoteValidator implements FirmQuoteValidator {
    private static final Logger log = LoggerFactory.getLogger(BalanceCacheFirmQuoteValidator.class);

    private final MakerBalanceCacheRepository cacheRepository;
    private final BalanceFreshnessClassifier classifier;
    private final FillableAmountCalculator calculator;
    private final MakerBackfillService backfillService;
    private final ValidatorMetrics metrics;
    private final Clock clock;

    public BalanceCacheFirmQuoteValidator(MakerBalanceCacheRepository cacheRepository,
                                          BalanceFreshnessClassifier classifier,
                                          FillableAmountCalculator calculator,
                                          MakerBackfillService backfillService,
                                          ValidatorMetrics metrics,
                                          Clock clock) {
        this.cacheRepository = cacheRepository;
        this.classifier = classifier;
        this.calculator = calculator;
        this.backfillService = backfillService;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public List<BigDecimal> computeFillableAmounts(List<Quote> quotes) {
        if (quotes.isEmpty()) {
            return List.of();
        }

        // All quotes in a batch compete for the same listing
        Set<String> makerTokenAddresses = new LinkedHashSet<>();
        for (Quote quote : quotes) {
            makerTokenAddresses.add(quote.makerAssetAddress());
        }
        if (makerTokenAddresses.size() != 1) {
            log.error("Found multiple maker token addresses within one single RFQ batch: {}. Rejecting the batch",
                makerTokenAddresses);
            metrics.recordBatchRejected(quotes.size());
            return Collections.nCopies(quotes.size(), BigDecimal.ZERO);
        }
        String tokenAddress = makerTokenAddresses.iterator().next();

        Set<String> makerAddresses = new LinkedHashSet<>();
        for (Quote quote : quotes) {
            makerAddresses.add(quote.makerAddress());
        }

        List<MakerBalanceCacheEntry> entries = cacheRepository.find(tokenAddress, makerAddresses);
        Instant now = clock.instant();
        Map<String, EffectiveBalance> makerLookup = classifier.classifyAll(entries, now);

        Set<String> unknownMakers = new LinkedHashSet<>();
        List<BigDecimal> fillableAmounts = new ArrayList<>(quotes.size());
        for (Quote quote : quotes) {
            EffectiveBalance balance = makerLookup.get(quote.makerAddress());
            if (balance == null) {
                unknownMakers.add(quote.makerAddress());
            }
            fillableAmounts.add(calculator.compute(quote, balance));
        }

        backfillService.backfill(tokenAddress, unknownMakers);

        log.debug("Validated {} quotes for token {} ({} cache rows, {} unknown makers)",
            quotes.size(), tokenAddress, entries.size(), unknownMakers.size());
        return Collections.unmodifiableList(fillableAmounts);
    }
}
