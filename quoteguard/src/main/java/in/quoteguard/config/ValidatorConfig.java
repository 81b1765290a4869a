package in.quoteguard.config;

import in.quoteguard.util.Env;

import java.time.Duration;
import java.util.Locale;

/**
 * Process-wide validator settings, read once at startup.
 */
public record ValidatorConfig(
    Duration stalenessThreshold,
    boolean backfillAsync,
    CacheStore cacheStore,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize
) {
    public static final Duration DEFAULT_STALENESS_THRESHOLD = Duration.ofMinutes(2);

    public enum CacheStore {
        POSTGRES,
        MEMORY
    }

    public static ValidatorConfig fromEnv() {
        String store = Env.get("CACHE_STORE", CacheStore.POSTGRES.name());

        return new ValidatorConfig(
            Env.getSeconds("CACHE_STALENESS_THRESHOLD_SECONDS", DEFAULT_STALENESS_THRESHOLD),
            Env.getBool("BACKFILL_ASYNC", false),
            parseStore(store),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/quoteguard"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10)
        );
    }

    private static CacheStore parseStore(String value) {
        try {
            return CacheStore.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown CACHE_STORE: " + value + " (expected POSTGRES or MEMORY)", e);
        }
    }

    @Override
    public String toString() {
        return "ValidatorConfig[stalenessThreshold=" + stalenessThreshold
            + ", backfillAsync=" + backfillAsync
            + ", cacheStore=" + cacheStore
            + ", dbUrl=" + dbUrl
            + ", dbUser=" + dbUser
            + ", dbPoolSize=" + dbPoolSize + "]";
    }
}
