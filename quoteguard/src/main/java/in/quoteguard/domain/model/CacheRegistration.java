package in.quoteguard.domain.model;

/**
 * A maker/token pair to register in the cache so the sampler starts tracking it.
 * The first-seen time is assigned by the store, not the caller.
 */
public record CacheRegistration(String tokenAddress, String makerAddress) {
    public CacheRegistration {
        if (tokenAddress == null || makerAddress == null) {
            throw new IllegalArgumentException("tokenAddress and makerAddress cannot be null");
        }
    }
}
