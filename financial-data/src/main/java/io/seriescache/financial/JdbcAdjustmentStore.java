package io.seriescache.financial;

import java.sql.Connection;
import java.sql.Date;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** {@link AdjustmentStore} over table {@code splits_dividends}. */
public class JdbcAdjustmentStore implements AdjustmentStore {
    private static final String DDL = "CREATE TABLE IF NOT EXISTS splits_dividends ("
            + "event_date DATE NOT NULL, "
            + "symbol VARCHAR(32) NOT NULL, "
            + "adj_type VARCHAR(16) NOT NULL, "
            + "adj_value DOUBLE PRECISION NOT NULL, "
            + "provider VARCHAR(32) NOT NULL)";
    private static final String INSERT = "INSERT INTO splits_dividends "
            + "(event_date, symbol, adj_type, adj_value, provider) VALUES (?, ?, ?, ?, ?)";

    private final Connection connection;

    public JdbcAdjustmentStore(Connection connection) throws StoreException {
        this.connection = connection;
        try (Statement st = connection.createStatement()) {
            st.execute(DDL);
        } catch (SQLException e) {
            throw new StoreException("cannot create splits_dividends table", e);
        }
    }

    public static JdbcAdjustmentStore open(String jdbcUrl) throws StoreException {
        try {
            return new JdbcAdjustmentStore(DriverManager.getConnection(jdbcUrl));
        } catch (SQLException e) {
            throw new StoreException("cannot open " + jdbcUrl, e);
        }
    }

    @Override
    public void add(AdjustmentEvent event) throws StoreException {
        addAll(List.of(event));
    }

    @Override
    public synchronized int addAll(List<AdjustmentEvent> events) throws StoreException {
        if (events.isEmpty()) return 0;
        try (PreparedStatement ps = connection.prepareStatement(INSERT)) {
            for (AdjustmentEvent e : events) {
                ps.setDate(1, Date.valueOf(e.date()));
                ps.setString(2, e.symbol());
                ps.setString(3, e.type().code());
                ps.setDouble(4, e.value());
                ps.setString(5, e.provider());
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw new StoreException("cannot append " + events.size() + " adjustments", e);
        }
        return events.size();
    }

    @Override
    public synchronized List<AdjustmentEvent> query(String symbol, LocalDate from, LocalDate to, AdjustmentType type)
            throws StoreException {
        String sql = "SELECT event_date, symbol, adj_type, adj_value, provider FROM splits_dividends "
                + "WHERE symbol = ? AND event_date >= ? AND event_date <= ?"
                + (type == null ? "" : " AND adj_type = ?")
                + " ORDER BY event_date, adj_type";
        List<AdjustmentEvent> out = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, symbol);
            ps.setDate(2, Date.valueOf(from));
            ps.setDate(3, Date.valueOf(to));
            if (type != null) ps.setString(4, type.code());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AdjustmentEvent(rs.getDate(1).toLocalDate(), rs.getString(2),
                            AdjustmentType.fromCode(rs.getString(3)), rs.getDouble(4), rs.getString(5)));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("cannot query adjustments for " + symbol, e);
        }
        return out;
    }

    @Override
    public synchronized void close() throws StoreException {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StoreException("cannot close connection", e);
        }
    }
}
