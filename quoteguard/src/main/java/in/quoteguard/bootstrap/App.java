package in.quoteguard.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.quoteguard.application.port.input.FirmQuoteValidator;
import in.quoteguard.application.port.output.CacheStorageException;
import in.quoteguard.application.port.output.MakerBalanceCacheRepository;
import in.quoteguard.application.port.output.ValidatorMetrics;
import in.quoteguard.application.service.BalanceCacheFirmQuoteValidator;
import in.quoteguard.application.service.BalanceFreshnessClassifier;
import in.quoteguard.application.service.FillableAmountCalculator;
import in.quoteguard.application.service.MakerBackfillService;
import in.quoteguard.config.ValidatorConfig;
import in.quoteguard.feed.QuoteJsonMapper;
import in.quoteguard.infrastructure.metrics.PrometheusValidatorMetrics;
import in.quoteguard.infrastructure.persistence.InMemoryMakerBalanceCacheRepository;
import in.quoteguard.infrastructure.persistence.PostgresMakerBalanceCacheRepository;
import in.quoteguard.migration.MakerBalanceCacheMigration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Command-line entry point.
 *
 * Usage: App &lt;quotes.json&gt;
 * Reads a quote batch, validates it against the maker balance cache and prints the
 * fillable amounts as a JSON array on stdout.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int BACKFILL_QUEUE_CAPACITY = 1000;

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: App <quotes.json>");
            System.exit(2);
        }

        ValidatorConfig config = null;
        try {
            config = ValidatorConfig.fromEnv();
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
        }
        log.info("Config: {}", config);

        int exitCode = 0;
        try (Wiring wiring = new Wiring(config)) {
            String json = Files.readString(Path.of(args[0]), StandardCharsets.UTF_8);
            List<BigDecimal> amounts = wiring.validator().computeFillableAmounts(QuoteJsonMapper.readQuotes(json));
            System.out.println(QuoteJsonMapper.writeAmounts(amounts));
        } catch (IOException e) {
            log.error("Failed to read quotes file {}: {}", args[0], e.getMessage());
            exitCode = 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid quotes: {}", e.getMessage());
            exitCode = 1;
        } catch (CacheStorageException e) {
            log.error("Balance cache unavailable: {}", e.getMessage(), e);
            exitCode = 3;
        } catch (RuntimeException e) {
            log.error("❌ Quote validation failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Wired validator plus the resources it borrows. Closing releases the pool and the backfill executor.
     */
    static final class Wiring implements AutoCloseable {
        private final HikariDataSource dataSource;
        private final ExecutorService backfillExecutor;
        private final FirmQuoteValidator validator;

        Wiring(ValidatorConfig config) {
            this(config, App::createDataSource);
        }

        Wiring(ValidatorConfig config, Function<ValidatorConfig, HikariDataSource> dataSourceFactory) {
            Clock clock = Clock.systemUTC();

            MakerBalanceCacheRepository repository;
            if (config.cacheStore() == ValidatorConfig.CacheStore.POSTGRES) {
                this.dataSource = dataSourceFactory.apply(config);
                try {
                    new MakerBalanceCacheMigration(dataSource).migrate();
                } catch (RuntimeException e) {
                    dataSource.close();
                    throw e;
                }
                repository = new PostgresMakerBalanceCacheRepository(dataSource);
            } else {
                this.dataSource = null;
                repository = new InMemoryMakerBalanceCacheRepository(clock);
            }

            ValidatorMetrics metrics = new PrometheusValidatorMetrics();
            MakerBackfillService backfillService;
            if (config.backfillAsync()) {
                this.backfillExecutor = newBackfillExecutor(BACKFILL_QUEUE_CAPACITY);
                backfillService = new MakerBackfillService(repository, backfillExecutor, metrics);
            } else {
                this.backfillExecutor = null;
                backfillService = new MakerBackfillService(repository, Runnable::run, metrics);
            }

            this.validator = new BalanceCacheFirmQuoteValidator(
                repository,
                new BalanceFreshnessClassifier(config.stalenessThreshold(), metrics),
                new FillableAmountCalculator(metrics),
                backfillService,
                metrics,
                clock
            );
            log.info("✓ Firm quote validator ready");
        }

        FirmQuoteValidator validator() {
            return validator;
        }

        @Override
        public void close() {
            if (backfillExecutor != null) {
                backfillExecutor.shutdown();
                try {
                    if (!backfillExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                        log.warn("Backfill executor did not finish in time");
                        backfillExecutor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    backfillExecutor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            if (dataSource != null) {
                dataSource.close();
            }
        }
    }

    /**
     * Single worker with a bounded queue. When the queue is full, execute() throws
     * RejectedExecutionException and the backfill is dropped.
     */
    static ThreadPoolExecutor newBackfillExecutor(int queueCapacity) {
        return new ThreadPoolExecutor(
            1, 1,
            0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            r -> {
                Thread t = new Thread(r, "maker-backfill");
                t.setDaemon(true);
                return t;
            },
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    private static HikariDataSource createDataSource(ValidatorConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(Math.min(2, config.dbPoolSize()));
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("quoteguard-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
