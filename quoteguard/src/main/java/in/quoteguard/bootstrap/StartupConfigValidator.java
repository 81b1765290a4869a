package in.quoteguard.bootstrap;

import in.quoteguard.config.ValidatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Validates configuration before the system initializes.
 * Throws IllegalStateException if configuration is invalid.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(ValidatorConfig config) {
        log.info("Running startup config validation...");

        if (config.stalenessThreshold().isNegative() || config.stalenessThreshold().isZero()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: CACHE_STALENESS_THRESHOLD_SECONDS must be positive, got "
                    + config.stalenessThreshold().toSeconds()
            );
        }
        log.info("✓ Staleness threshold: {}", config.stalenessThreshold());

        if (config.cacheStore() == ValidatorConfig.CacheStore.POSTGRES) {
            if (config.dbUrl() == null || config.dbUrl().isBlank()) {
                throw new IllegalStateException("❌ INVALID CONFIG: DB_URL is required when CACHE_STORE=POSTGRES");
            }
            if (config.dbPoolSize() < 1) {
                throw new IllegalStateException(
                    "❌ INVALID CONFIG: DB_POOL_SIZE must be at least 1, got " + config.dbPoolSize()
                );
            }
            log.info("✓ Cache store: PostgreSQL ({})", config.dbUrl());
        } else {
            log.warn("⚠️  Cache store: in-memory. Balances are not shared with the sampler");
        }

        log.info("✅ Startup config validation passed");
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
