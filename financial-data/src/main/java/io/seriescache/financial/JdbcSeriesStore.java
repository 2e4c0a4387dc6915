package io.seriescache.financial;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SeriesStore} over a single JDBC connection, H2 dialect. Table {@code bars} is keyed by
 * {@code (symbol, interval_tag, ts)} with {@code ts} in epoch seconds; writes are {@code MERGE}s.
 */
public class JdbcSeriesStore implements SeriesStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcSeriesStore.class);

    private static final String DDL = "CREATE TABLE IF NOT EXISTS bars ("
            + "symbol VARCHAR(32) NOT NULL, "
            + "interval_tag VARCHAR(16) NOT NULL, "
            + "ts BIGINT NOT NULL, "
            + "open_price DOUBLE PRECISION, "
            + "high_price DOUBLE PRECISION, "
            + "low_price DOUBLE PRECISION, "
            + "close_price DOUBLE PRECISION, "
            + "volume BIGINT, "
            + "PRIMARY KEY (symbol, interval_tag, ts))";
    private static final String MERGE = "MERGE INTO bars "
            + "(symbol, interval_tag, ts, open_price, high_price, low_price, close_price, volume) "
            + "KEY (symbol, interval_tag, ts) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String SELECT = "SELECT ts, open_price, high_price, low_price, close_price, volume "
            + "FROM bars WHERE symbol = ? AND interval_tag = ? AND ts >= ? AND ts < ? ORDER BY ts";

    private final Connection connection;
    private boolean closed;

    public JdbcSeriesStore(Connection connection) throws StoreException {
        this.connection = connection;
        try (Statement st = connection.createStatement()) {
            st.execute(DDL);
        } catch (SQLException e) {
            throw new StoreException("cannot create bars table", e);
        }
    }

    public static JdbcSeriesStore open(String jdbcUrl) throws StoreException {
        try {
            return new JdbcSeriesStore(DriverManager.getConnection(jdbcUrl));
        } catch (SQLException e) {
            throw new StoreException("cannot open " + jdbcUrl, e);
        }
    }

    @Override
    public synchronized Map<SeriesKey, Instant> firstTimestamps() throws StoreException {
        return boundary("MIN");
    }

    @Override
    public synchronized Map<SeriesKey, Instant> lastTimestamps() throws StoreException {
        return boundary("MAX");
    }

    private Map<SeriesKey, Instant> boundary(String fn) throws StoreException {
        String sql = "SELECT symbol, interval_tag, " + fn + "(ts) FROM bars GROUP BY symbol, interval_tag "
                + "ORDER BY symbol, interval_tag";
        Map<SeriesKey, Instant> out = new LinkedHashMap<>();
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                String symbol = rs.getString(1);
                String tag = rs.getString(2);
                try {
                    out.put(SeriesKey.fromTag(symbol, tag), Instant.ofEpochSecond(rs.getLong(3)));
                } catch (IllegalArgumentException e) {
                    log.warn("skipping series {} with unreadable interval tag {}", symbol, tag);
                }
            }
        } catch (SQLException e) {
            throw new StoreException("cannot read " + fn + "(ts) per series", e);
        }
        return out;
    }

    @Override
    public synchronized int write(SeriesBars bars) throws StoreException {
        if (bars.isEmpty()) return 0;
        SeriesKey key = bars.key();
        try {
            boolean auto = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try (PreparedStatement ps = connection.prepareStatement(MERGE)) {
                for (Bar b : bars.bars()) {
                    ps.setString(1, key.symbol());
                    ps.setString(2, key.intervalTag());
                    ps.setLong(3, b.timestamp().getEpochSecond());
                    setDouble(ps, 4, b.open());
                    setDouble(ps, 5, b.high());
                    setDouble(ps, 6, b.low());
                    setDouble(ps, 7, b.close());
                    if (b.volume() == null) ps.setNull(8, Types.BIGINT); else ps.setLong(8, b.volume());
                    ps.addBatch();
                }
                ps.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(auto);
            }
        } catch (SQLException e) {
            throw new StoreException("cannot write " + bars.size() + " bars for " + key, e);
        }
        return bars.size();
    }

    @Override
    public synchronized List<Bar> read(SeriesKey key, Instant from, Instant to) throws StoreException {
        List<Bar> out = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(SELECT)) {
            ps.setString(1, key.symbol());
            ps.setString(2, key.intervalTag());
            ps.setLong(3, from.getEpochSecond());
            ps.setLong(4, to.getEpochSecond());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Bar(Instant.ofEpochSecond(rs.getLong(1)), getDouble(rs, 2), getDouble(rs, 3),
                            getDouble(rs, 4), getDouble(rs, 5), getLong(rs, 6)));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("cannot read bars for " + key, e);
        }
        return out;
    }

    @Override
    public synchronized void close() throws StoreException {
        if (closed) return;
        closed = true;
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StoreException("cannot close connection", e);
        }
    }

    public synchronized boolean isClosed() { return closed; }

    private static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null || v.isNaN()) ps.setNull(idx, Types.DOUBLE); else ps.setDouble(idx, v);
    }

    private static Double getDouble(ResultSet rs, int idx) throws SQLException {
        double v = rs.getDouble(idx);
        return rs.wasNull() ? null : v;
    }

    private static Long getLong(ResultSet rs, int idx) throws SQLException {
        long v = rs.getLong(idx);
        return rs.wasNull() ? null : v;
    }
}
