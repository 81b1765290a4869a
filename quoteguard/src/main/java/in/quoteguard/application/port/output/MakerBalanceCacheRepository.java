package in.quoteguard.application.port.output;

import in.quoteguard.domain.model.CacheRegistration;
import in.quoteguard.domain.model.MakerBalanceCacheEntry;

import java.util.List;
import java.util.Set;

/**
 * Storage of sampled maker balances, keyed by (tokenAddress, makerAddress).
 *
 * Implementations throw {@link CacheStorageException} when the store cannot be reached.
 */
public interface MakerBalanceCacheRepository {

    /**
     * Find cache rows for one token and a set of makers.
     * Makers without a row are simply missing from the result.
     */
    List<MakerBalanceCacheEntry> find(String tokenAddress, Set<String> makerAddresses);

    /**
     * Register maker/token pairs with a store-assigned first-seen time.
     * A pair that already exists is left untouched; concurrent duplicate inserts are no-ops.
     */
    void insertIgnoreConflict(List<CacheRegistration> registrations);
}
