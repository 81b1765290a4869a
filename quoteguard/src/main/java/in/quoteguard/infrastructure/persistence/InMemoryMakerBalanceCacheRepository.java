package in.quoteguard.infrastructure.persistence;

import in.quoteguard.application.port.output.MakerBalanceCacheRepository;
import in.quoteguard.domain.model.CacheRegistration;
import in.quoteguard.domain.model.MakerBalanceCacheEntry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache store for local runs and tests.
 *
 * Registration is an atomic insert-if-absent: the first writer for a key wins and keeps its first-seen time.
 */
public final class InMemoryMakerBalanceCacheRepository implements MakerBalanceCacheRepository {
    private final ConcurrentHashMap<Key, MakerBalanceCacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMakerBalanceCacheRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<MakerBalanceCacheEntry> find(String tokenAddress, Set<String> makerAddresses) {
        List<MakerBalanceCacheEntry> result = new ArrayList<>();
        for (String makerAddress : makerAddresses) {
            MakerBalanceCacheEntry entry = entries.get(new Key(tokenAddress, makerAddress));
            if (entry != null) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public void insertIgnoreConflict(List<CacheRegistration> registrations) {
        for (CacheRegistration registration : registrations) {
            Key key = new Key(registration.tokenAddress(), registration.makerAddress());
            // First-seen time is read inside the atomic insert, so the surviving row is the earliest one
            entries.computeIfAbsent(key,
                k -> MakerBalanceCacheEntry.registered(k.tokenAddress(), k.makerAddress(), clock.instant()));
        }
    }

    /**
     * Write a row as the balance sampler would. Replaces any existing row for the key.
     */
    public void put(MakerBalanceCacheEntry entry) {
        entries.put(new Key(entry.tokenAddress(), entry.makerAddress()), entry);
    }

    public int size() {
        return entries.size();
    }

    public record Key(String tokenAddress, String makerAddress) {}
}
