package in.quoteguard.infrastructure.persistence;

import in.quoteguard.application.port.output.CacheStorageException;
import in.quoteguard.application.port.output.MakerBalanceCacheRepository;
import in.quoteguard.domain.model.CacheRegistration;
import in.quoteguard.domain.model.MakerBalanceCacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * PostgreSQL implementation of MakerBalanceCacheRepository.
 *
 * Table: maker_balance_chain_cache, primary key (token_address, maker_address).
 */
public final class PostgresMakerBalanceCacheRepository implements MakerBalanceCacheRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresMakerBalanceCacheRepository.class);

    private final DataSource dataSource;

    public PostgresMakerBalanceCacheRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<MakerBalanceCacheEntry> find(String tokenAddress, Set<String> makerAddresses) {
        List<MakerBalanceCacheEntry> result = new ArrayList<>();
        if (makerAddresses == null || makerAddresses.isEmpty()) {
            return result;
        }

        String sql = """
            SELECT token_address, maker_address, balance, time_first_seen, time_of_sample
            FROM maker_balance_chain_cache
            WHERE token_address = ? AND maker_address = ANY(?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            Array makers = conn.createArrayOf("text", makerAddresses.toArray());
            ps.setString(1, tokenAddress);
            ps.setArray(2, makers);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find cache entries for token {}: {}", tokenAddress, e.getMessage());
            throw new CacheStorageException(tokenAddress, "Failed to find maker balance cache entries", e);
        }

        log.debug("Found {} cache entries for token {} and {} makers", result.size(), tokenAddress, makerAddresses.size());
        return result;
    }

    @Override
    public void insertIgnoreConflict(List<CacheRegistration> registrations) {
        if (registrations == null || registrations.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO maker_balance_chain_cache (token_address, maker_address, time_first_seen)
            VALUES (?, ?, NOW())
            ON CONFLICT (token_address, maker_address) DO NOTHING
            """;

        // Same key order in every batch so concurrent batches cannot deadlock each other
        List<CacheRegistration> ordered = new ArrayList<>(registrations);
        ordered.sort(Comparator.comparing(CacheRegistration::tokenAddress)
            .thenComparing(CacheRegistration::makerAddress));
        String tokenAddress = ordered.get(0).tokenAddress();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            conn.setAutoCommit(false);
            try {
                for (CacheRegistration registration : ordered) {
                    ps.setString(1, registration.tokenAddress());
                    ps.setString(2, registration.makerAddress());
                    ps.addBatch();
                }

                int[] counts = ps.executeBatch();
                conn.commit();

                log.debug("Registered {} of {} makers for token {}", inserted(counts), ordered.size(), tokenAddress);
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            }

        } catch (SQLException e) {
            log.error("Failed to register makers for token {}: {}", tokenAddress, e.getMessage());
            throw new CacheStorageException(tokenAddress, "Failed to insert maker balance cache entries", e);
        }
    }

    private static int inserted(int[] counts) {
        int total = 0;
        for (int count : counts) {
            if (count > 0) {
                total += count;
            }
        }
        return total;
    }

    private MakerBalanceCacheEntry mapRow(ResultSet rs) throws SQLException {
        return new MakerBalanceCacheEntry(
            rs.getString("token_address"),
            rs.getString("maker_address"),
            rs.getBigDecimal("balance"),
            toInstant(rs.getTimestamp("time_first_seen")),
            toInstant(rs.getTimestamp("time_of_sample"))
        );
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
