package in.quoteguard.application.service;

import in.quoteguard.application.port.output.MakerBalanceCacheRepository;
import in.quoteguard.application.port.output.ValidatorMetrics;
import in.quoteguard.domain.model.CacheRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Registers makers that have never been seen so the balance sampler starts tracking them.
 *
 * Best effort: failures are logged and never reach the caller. Several request workers may
 * register the same maker at once; the repository turns duplicates into no-ops.
 */
public final class MakerBackfillService {
    private static final Logger log = LoggerFactory.getLogger(MakerBackfillService.class);

    private final MakerBalanceCacheRepository repository;
    private final Executor executor;
    private final ValidatorMetrics metrics;

    /**
     * @param executor where the insert runs; {@code Runnable::run} writes on the calling thread
     */
    public MakerBackfillService(MakerBalanceCacheRepository repository, Executor executor, ValidatorMetrics metrics) {
        this.repository = repository;
        this.executor = executor;
        this.metrics = metrics;
    }

    public void backfill(String tokenAddress, Collection<String> makerAddresses) {
        if (makerAddresses.isEmpty()) {
            return;
        }

        List<CacheRegistration> registrations = new ArrayList<>(makerAddresses.size());
        for (String makerAddress : makerAddresses) {
            registrations.add(new CacheRegistration(tokenAddress, makerAddress));
        }

        log.info("Adding new addresses to cache for token {}: {}", tokenAddress, makerAddresses);

        try {
            executor.execute(() -> insert(tokenAddress, registrations));
        } catch (RejectedExecutionException e) {
            log.error("Backfill rejected for token {} ({} makers): {}", tokenAddress, registrations.size(), e.getMessage());
            metrics.recordBackfillFailure();
        }
    }

    private void insert(String tokenAddress, List<CacheRegistration> registrations) {
        try {
            repository.insertIgnoreConflict(registrations);
            metrics.recordBackfill(registrations.size());
        } catch (RuntimeException e) {
            log.error("Failed to backfill {} makers for token {}", registrations.size(), tokenAddress, e);
            metrics.recordBackfillFailure();
        }
    }
}
