package org.sensorvault.storage.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.sensorvault.storage.AbstractStorageBackend;
import org.sensorvault.storage.api.DeviceAddresses;
import org.sensorvault.storage.api.DeviceStats;
import org.sensorvault.storage.api.FieldStats;
import org.sensorvault.storage.api.HourlyAggregate;
import org.sensorvault.storage.api.Reading;
import org.sensorvault.storage.api.ReadingFilter;
import org.sensorvault.storage.api.ReadingPage;
import org.sensorvault.storage.api.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Indexed storage backend: a single {@code readings} table in an H2 database, accessed through
 * a HikariCP connection pool.
 * <p>
 * Writes are upserts keyed by {@code (device_addr, timestamp, client_id)}, so re-submitting a
 * reading (for example when a migration is repeated) replaces the row instead of duplicating
 * it. H2's MVStore gives readers a consistent snapshot while a writer commits. Device addresses
 * are stored and matched in their canonical form ({@link DeviceAddresses#canonical(String)}).
 * <p>
 * Configuration:
 * <pre>
 * jdbcUrl = "jdbc:h2:file:./data/readings"
 * username = "sa"
 * password = ""
 * maxPoolSize = 10
 * minIdle = 2
 * </pre>
 */
public class H2ReadingStore extends AbstractStorageBackend {

    private static final Logger log = LoggerFactory.getLogger(H2ReadingStore.class);

    private static final String COLUMNS = "device_addr, device_name, timestamp, temperature, temperature_f, "
            + "humidity, battery, rssi, client_id, dew_point, absolute_humidity, steam_pressure";

    private static final String MERGE_SQL = "MERGE INTO readings (" + COLUMNS + ") "
            + "KEY (device_addr, timestamp, client_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_SQL = "SELECT " + COLUMNS + " FROM readings WHERE device_addr = ? ";

    private static final String STATS_SQL = "SELECT COUNT(*), "
            + "MIN(temperature), MAX(temperature), AVG(temperature), "
            + "MIN(temperature_f), MAX(temperature_f), AVG(temperature_f), "
            + "MIN(humidity), MAX(humidity), AVG(humidity), "
            + "MIN(battery), MAX(battery), AVG(CAST(battery AS DOUBLE PRECISION)), "
            + "MIN(rssi), MAX(rssi), AVG(CAST(rssi AS DOUBLE PRECISION)), "
            + "MIN(dew_point), MAX(dew_point), AVG(dew_point), "
            + "MIN(absolute_humidity), MAX(absolute_humidity), AVG(absolute_humidity), "
            + "MIN(steam_pressure), MAX(steam_pressure), AVG(steam_pressure), "
            + "MIN(timestamp), MAX(timestamp) "
            + "FROM readings WHERE device_addr = ?";

    private final HikariDataSource dataSource;
    private final String jdbcUrl;

    public H2ReadingStore(String name, Config options) {
        super(name, options);

        this.jdbcUrl = options.hasPath("jdbcUrl") ? options.getString("jdbcUrl") : "jdbc:h2:file:./data/readings";
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";

        prepareDatabaseDirectory(name, jdbcUrl);

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("H2 store '{}' connection pool started (max={}, minIdle={})",
                    name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";

            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                String errorMsg = String.format(
                        "Cannot open H2 store '%s': database file already in use by another process. File: %s.mv.db",
                        name, jdbcUrl.replace("jdbc:h2:", ""));
                log.error(errorMsg);
                throw new IllegalStateException(errorMsg, e);
            }
            if (causeMsg.contains("Wrong user name or password")) {
                String errorMsg = String.format("Failed to connect to H2 store '%s': wrong username/password. URL=%s, User=%s",
                        name, jdbcUrl, username.isEmpty() ? "(empty)" : username);
                log.error(errorMsg);
                throw new IllegalStateException(errorMsg, e);
            }
            String errorMsg = String.format("Failed to initialize H2 store '%s': %s. Database: %s. Error: %s",
                    name, cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg, e);
        }

        try {
            createSchema();
        } catch (SQLException e) {
            dataSource.close();
            throw new IllegalStateException("Failed to create schema of H2 store '" + name + "': " + e.getMessage(), e);
        }
    }

    private static void prepareDatabaseDirectory(String name, String jdbcUrl) {
        if (!jdbcUrl.startsWith("jdbc:h2:file:")) {
            return;
        }
        String path = jdbcUrl.substring("jdbc:h2:file:".length());
        int params = path.indexOf(';');
        if (params >= 0) {
            path = path.substring(0, params);
        }
        Path parent = Path.of(path).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create database directory of H2 store '" + name + "': " + parent, e);
        }
    }

    private void createSchema() throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS readings ("
                    + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "device_addr VARCHAR(32) NOT NULL, "
                    + "device_name VARCHAR(255) NOT NULL DEFAULT '', "
                    + "timestamp TIMESTAMP(9) WITH TIME ZONE NOT NULL, "
                    + "temperature DOUBLE PRECISION, "
                    + "temperature_f DOUBLE PRECISION, "
                    + "humidity DOUBLE PRECISION, "
                    + "battery INT, "
                    + "rssi INT, "
                    + "client_id VARCHAR(255) NOT NULL DEFAULT '', "
                    + "dew_point DOUBLE PRECISION, "
                    + "absolute_humidity DOUBLE PRECISION, "
                    + "steam_pressure DOUBLE PRECISION)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_readings_device ON readings (device_addr)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_readings_timestamp ON readings (timestamp)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_readings_device_timestamp ON readings (device_addr, timestamp)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_readings_client ON readings (client_id)");
            stmt.execute("CREATE UNIQUE INDEX IF NOT EXISTS uq_readings_identity "
                    + "ON readings (device_addr, timestamp, client_id)");
        }
        log.debug("H2 store '{}' schema ready", name);
    }

    // ========================================================================
    // IStorageBackend
    // ========================================================================

    @Override
    public void write(Reading reading) throws StorageException {
        writeBatch(List.of(DeviceAddresses.canonical(reading)));
    }

    /**
     * Upserts all readings in a single transaction; on failure nothing of the batch is kept.
     */
    @Override
    public void writeBatch(List<Reading> submitted) throws StorageException {
        ensureOpen();
        List<Reading> readings = new ArrayList<>(submitted.size());
        for (Reading reading : submitted) {
            readings.add(DeviceAddresses.canonical(reading));
        }
        if (readings.isEmpty()) {
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(MERGE_SQL)) {
                for (Reading reading : readings) {
                    bind(stmt, reading);
                    stmt.addBatch();
                }
                stmt.executeBatch();
                conn.commit();
                writeOperations.addAndGet(readings.size());
            } catch (SQLException e) {
                rollback(conn);
                throw e;
            }
        } catch (SQLException e) {
            writeErrors.incrementAndGet();
            throw new StorageException("Failed to write " + readings.size() + " reading(s) to H2 store '"
                    + name + "': " + e.getMessage(), e);
        }
    }

    @Override
    public List<Reading> query(String deviceAddr, Instant from, Instant to) throws StorageException {
        ensureOpen();
        checkRange(from, to);
        String addr = DeviceAddresses.canonical(deviceAddr);

        StringBuilder sql = new StringBuilder(SELECT_SQL);
        if (from != null) {
            sql.append("AND timestamp >= ? ");
        }
        if (to != null) {
            sql.append("AND timestamp <= ? ");
        }
        sql.append("ORDER BY timestamp, id");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            int idx = 1;
            stmt.setString(idx++, addr);
            if (from != null) {
                stmt.setObject(idx++, toOffset(from));
            }
            if (to != null) {
                stmt.setObject(idx, toOffset(to));
            }
            List<Reading> readings = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    readings.add(mapRow(rs));
                }
            }
            readOperations.incrementAndGet();
            return readings;
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw new StorageException("Failed to query device " + deviceAddr + " in H2 store '" + name + "'", e);
        }
    }

    @Override
    public DeviceStats stats(String deviceAddr) throws StorageException {
        ensureOpen();
        String addr = DeviceAddresses.canonical(deviceAddr);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(STATS_SQL)) {
            stmt.setString(1, addr);
            try (ResultSet rs = stmt.executeQuery()) {
                readOperations.incrementAndGet();
                if (!rs.next() || rs.getLong(1) == 0) {
                    return DeviceStats.empty(addr);
                }
                return new DeviceStats(addr, rs.getLong(1),
                        fieldStats(rs, 2), fieldStats(rs, 5), fieldStats(rs, 8), fieldStats(rs, 11),
                        fieldStats(rs, 14), fieldStats(rs, 17), fieldStats(rs, 20), fieldStats(rs, 23),
                        rs.getObject(26, OffsetDateTime.class).toInstant(),
                        rs.getObject(27, OffsetDateTime.class).toInstant());
            }
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw new StorageException("Failed to compute stats of device " + deviceAddr + " in H2 store '"
                    + name + "'", e);
        }
    }

    @Override
    public List<String> listDevices() throws StorageException {
        ensureOpen();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT DISTINCT device_addr FROM readings ORDER BY device_addr")) {
            List<String> devices = new ArrayList<>();
            while (rs.next()) {
                devices.add(rs.getString(1));
            }
            readOperations.incrementAndGet();
            return devices;
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw new StorageException("Failed to list devices of H2 store '" + name + "'", e);
        }
    }

    @Override
    public List<HourlyAggregate> hourlyAggregates(String deviceAddr, Instant from, Instant to)
            throws StorageException {
        return HourlyAggregate.of(DeviceAddresses.canonical(deviceAddr), query(deviceAddr, from, to));
    }

    /**
     * Pages through the readings with {@code LIMIT/OFFSET}; the client filter uses the
     * {@code client_id} index.
     */
    @Override
    public ReadingPage readingsPage(ReadingFilter filter, int offset, int limit) throws StorageException {
        ensureOpen();
        checkPage(offset, limit);
        ReadingFilter f = filter == null ? ReadingFilter.ALL : filter;

        List<Object> args = new ArrayList<>();
        String where = whereClause(f, args);
        try (Connection conn = dataSource.getConnection()) {
            long total;
            try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM readings" + where)) {
                bindAll(stmt, args);
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    total = rs.getLong(1);
                }
            }
            List<Reading> readings = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM readings" + where
                    + " ORDER BY timestamp DESC, device_addr, client_id LIMIT ? OFFSET ?")) {
                bindAll(stmt, args);
                stmt.setInt(args.size() + 1, limit);
                stmt.setInt(args.size() + 2, offset);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        readings.add(mapRow(rs));
                    }
                }
            }
            readOperations.incrementAndGet();
            return new ReadingPage(readings, total, offset, limit);
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw new StorageException("Failed to page readings of H2 store '" + name + "'", e);
        }
    }

    @Override
    public long readingCount(String deviceAddr) throws StorageException {
        ensureOpen();
        String sql = "SELECT COUNT(*) FROM readings";
        String addr = null;
        if (deviceAddr != null) {
            addr = DeviceAddresses.canonical(deviceAddr);
            sql += " WHERE device_addr = ?";
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (addr != null) {
                stmt.setString(1, addr);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                readOperations.incrementAndGet();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            readErrors.incrementAndGet();
            throw new StorageException("Failed to count readings in H2 store '" + name + "'", e);
        }
    }

    /**
     * Deletes every row with {@code timestamp < cutoff}.
     *
     * @return number of deleted rows
     */
    @Override
    public long purgeBefore(Instant cutoff) throws StorageException {
        ensureOpen();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM readings WHERE timestamp < ?")) {
                stmt.setObject(1, toOffset(cutoff));
                int deleted = stmt.executeUpdate();
                conn.commit();
                if (deleted > 0) {
                    log.info("Purged {} reading(s) older than {} from H2 store '{}'", deleted, cutoff, name);
                }
                return deleted;
            } catch (SQLException e) {
                rollback(conn);
                throw e;
            }
        } catch (SQLException e) {
            writeErrors.incrementAndGet();
            throw new StorageException("Failed to purge readings before " + cutoff + " from H2 store '" + name + "'", e);
        }
    }

    @Override
    protected void doClose() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        metrics.put("pool_max_size", dataSource.getMaximumPoolSize());
        if (dataSource.getHikariPoolMXBean() != null) {
            metrics.put("pool_active_connections", dataSource.getHikariPoolMXBean().getActiveConnections());
        }
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    // ========================================================================
    // Row mapping
    // ========================================================================

    private static void bind(PreparedStatement stmt, Reading r) throws SQLException {
        stmt.setString(1, r.deviceAddr());
        stmt.setString(2, r.deviceName());
        stmt.setObject(3, toOffset(r.timestamp()));
        setDouble(stmt, 4, r.tempC());
        setDouble(stmt, 5, r.tempF());
        setDouble(stmt, 6, r.humidity());
        stmt.setInt(7, r.battery());
        stmt.setInt(8, r.rssi());
        stmt.setString(9, r.clientId());
        setDouble(stmt, 10, r.dewPointC());
        setDouble(stmt, 11, r.absHumidity());
        setDouble(stmt, 12, r.steamPressure());
    }

    private static Reading mapRow(ResultSet rs) throws SQLException {
        return new Reading(
                rs.getString("device_addr"),
                rs.getString("device_name"),
                rs.getObject("timestamp", OffsetDateTime.class).toInstant(),
                getDouble(rs, "temperature"),
                getDouble(rs, "temperature_f"),
                getDouble(rs, "humidity"),
                rs.getInt("battery"),
                rs.getInt("rssi"),
                rs.getString("client_id"),
                getDouble(rs, "dew_point"),
                getDouble(rs, "absolute_humidity"),
                getDouble(rs, "steam_pressure"));
    }

    // NaN is stored as NULL so that SQL aggregates skip it
    private static void setDouble(PreparedStatement stmt, int idx, double value) throws SQLException {
        if (Double.isNaN(value)) {
            stmt.setNull(idx, Types.DOUBLE);
        } else {
            stmt.setDouble(idx, value);
        }
    }

    private static double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? Double.NaN : value;
    }

    private static FieldStats fieldStats(ResultSet rs, int firstColumn) throws SQLException {
        double min = rs.getDouble(firstColumn);
        if (rs.wasNull()) {
            return FieldStats.EMPTY;
        }
        return new FieldStats(min, rs.getDouble(firstColumn + 1), rs.getDouble(firstColumn + 2));
    }

    private static OffsetDateTime toOffset(Instant t) {
        return OffsetDateTime.ofInstant(t, ZoneOffset.UTC);
    }

    private static String whereClause(ReadingFilter filter, List<Object> args) {
        List<String> conditions = new ArrayList<>();
        if (filter.deviceAddr() != null) {
            conditions.add("device_addr = ?");
            args.add(filter.deviceAddr());
        }
        if (filter.clientId() != null) {
            conditions.add("client_id = ?");
            args.add(filter.clientId());
        }
        if (filter.from() != null) {
            conditions.add("timestamp >= ?");
            args.add(toOffset(filter.from()));
        }
        if (filter.to() != null) {
            conditions.add("timestamp <= ?");
            args.add(toOffset(filter.to()));
        }
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private static void bindAll(PreparedStatement stmt, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            stmt.setObject(i + 1, args.get(i));
        }
    }

    private void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed in H2 store '{}': {}", name, e.getMessage());
        }
    }
}
