package in.quoteguard.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Maker Balance Cache Migration - Creates the cache table on startup.
 *
 * maker_balance_chain_cache holds one row per (token_address, maker_address).
 * The balance sampler owns balance and time_of_sample; the validator only registers rows.
 */
public final class MakerBalanceCacheMigration {
    private static final Logger log = LoggerFactory.getLogger(MakerBalanceCacheMigration.class);

    static final String TABLE_NAME = "maker_balance_chain_cache";

    private final DataSource dataSource;

    public MakerBalanceCacheMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates the table if it doesn't exist.
     *
     * @return true if the table was created
     */
    public boolean migrate() {
        log.info("[CACHE MIGRATION] Starting maker balance cache migration");

        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, TABLE_NAME)) {
                log.info("[CACHE MIGRATION] {} table already exists", TABLE_NAME);
                return false;
            }

            log.info("[CACHE MIGRATION] Creating {} table...", TABLE_NAME);
            createCacheTable(conn);
            log.info("[CACHE MIGRATION] ✓ {} table created", TABLE_NAME);
            return true;

        } catch (SQLException e) {
            log.error("[CACHE MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Maker balance cache migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createCacheTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE IF NOT EXISTS maker_balance_chain_cache (
                token_address VARCHAR(42) NOT NULL,
                maker_address VARCHAR(42) NOT NULL,
                time_first_seen TIMESTAMPTZ,
                balance NUMERIC,
                time_of_sample TIMESTAMPTZ,
                PRIMARY KEY (token_address, maker_address),
                CONSTRAINT sampled_requires_balance CHECK (time_of_sample IS NULL OR balance IS NOT NULL)
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
