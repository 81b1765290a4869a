package in.quoteguard.infrastructure.metrics;

import in.quoteguard.application.port.output.ValidatorMetrics;
import in.quoteguard.domain.model.BalanceStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;

/**
 * Prometheus implementation of ValidatorMetrics.
 *
 * Key Metrics:
 * - quote_batches_rejected_total - Batches zeroed for mixing maker assets
 * - quotes_rejected_total - Quotes zeroed by batch rejection
 * - maker_balance_classifications_total{status} - Cache rows by freshness status
 * - quote_fills_total{outcome} - Per-quote fill outcomes
 * - maker_backfill_registrations_total - Makers registered for sampling
 * - maker_backfill_failures_total - Failed backfill writes
 */
public class PrometheusValidatorMetrics implements ValidatorMetrics {

    private final CollectorRegistry registry;

    private final Counter batchRejectedCounter;
    private final Counter quotesRejectedCounter;
    private final Counter classificationCounter;
    private final Counter fillCounter;
    private final Counter backfillCounter;
    private final Counter backfillFailureCounter;

    public PrometheusValidatorMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusValidatorMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.batchRejectedCounter = Counter.build()
            .name("quote_batches_rejected_total")
            .help("Quote batches rejected for mixing maker assets")
            .register(registry);

        this.quotesRejectedCounter = Counter.build()
            .name("quotes_rejected_total")
            .help("Quotes given a zero fillable amount by batch rejection")
            .register(registry);

        this.classificationCounter = Counter.build()
            .name("maker_balance_classifications_total")
            .help("Maker balance cache rows by freshness status")
            .labelNames("status")
            .register(registry);

        this.fillCounter = Counter.build()
            .name("quote_fills_total")
            .help("Fillable amount outcomes per quote")
            .labelNames("outcome")
            .register(registry);

        this.backfillCounter = Counter.build()
            .name("maker_backfill_registrations_total")
            .help("Makers registered in the balance cache for sampling")
            .register(registry);

        this.backfillFailureCounter = Counter.build()
            .name("maker_backfill_failures_total")
            .help("Failed maker backfill writes")
            .register(registry);
    }

    @Override
    public void recordBatchRejected(int quoteCount) {
        batchRejectedCounter.inc();
        quotesRejectedCounter.inc(quoteCount);
    }

    @Override
    public void recordClassification(BalanceStatus status) {
        classificationCounter.labels(status.name()).inc();
    }

    @Override
    public void recordFill(FillOutcome outcome) {
        fillCounter.labels(outcome.name()).inc();
    }

    @Override
    public void recordBackfill(int makerCount) {
        backfillCounter.inc(makerCount);
    }

    @Override
    public void recordBackfillFailure() {
        backfillFailureCounter.inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
