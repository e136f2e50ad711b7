package com.hcltech.hierarchy.db;

import com.hcltech.hierarchy.config.DatabaseConfig;
import com.hcltech.hierarchy.config.DestinationConfig;
import com.hcltech.hierarchy.config.IfExists;
import com.hcltech.hierarchy.config.SourceConfig;
import com.hcltech.hierarchy.core.table.Table;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * {@link HierarchyDb} over a JDBC {@link DataSource}.
 * <p>
 * Writes run on one connection with auto-commit off and roll back on failure. Databases that commit DDL
 * implicitly (Oracle) cannot undo a DROP or CREATE that preceded the failure.
 */
public class JdbcHierarchyDb implements HierarchyDb {
    private static final Logger log = LoggerFactory.getLogger(JdbcHierarchyDb.class);

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final boolean ownsDataSource;

    public JdbcHierarchyDb(DataSource dataSource, SqlDialect dialect) {
        this(dataSource, dialect, false);
    }

    private JdbcHierarchyDb(DataSource dataSource, SqlDialect dialect, boolean ownsDataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.ownsDataSource = ownsDataSource;
    }

    /** Opens a HikariCP pool for {@code config}; {@link #close()} shuts it down. */
    public static JdbcHierarchyDb pooled(DatabaseConfig config, SqlDialect dialect) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("hierarchy-" + config.type());
        hikari.setJdbcUrl(config.url());
        if (config.user() != null) hikari.setUsername(config.user());
        if (config.password() != null) hikari.setPassword(config.password());
        if (config.driverClass() != null) hikari.setDriverClassName(config.driverClass());
        hikari.setMaximumPoolSize(config.poolSize());
        hikari.setAutoCommit(true);
        return new JdbcHierarchyDb(new HikariDataSource(hikari), dialect, true);
    }

    public SqlDialect dialect() {
        return dialect;
    }

    static String selectSql(SourceConfig source) {
        String sql = "SELECT " + SqlIdentifiers.requireValid("parent column", source.parent())
                + ", " + SqlIdentifiers.requireValid("child column", source.child())
                + " FROM " + SqlIdentifiers.qualified(source.schema(), source.table());
        String where = source.where();
        return where == null || where.isBlank() ? sql : sql + " WHERE " + where;
    }

    @Override
    public Table readData(SourceConfig source) {
        String sql = selectSql(source);
        List<List<Object>> rows = new ArrayList<>();
        try (Connection con = dataSource.getConnection();
             Statement st = con.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                List<Object> row = new ArrayList<>(2);
                row.add(rs.getObject(1));
                row.add(rs.getObject(2));
                rows.add(row);
            }
        } catch (SQLException e) {
            throw new HierarchyDbException("Failed to read edges with [" + sql + "]: " + e.getMessage(), e);
        }
        log.info("Read {} edge(s) from {}.{}", rows.size(), source.schema(), source.table());
        return new Table(List.of(source.parent(), source.child()), rows);
    }

    @Override
    public void writeData(Table table, DestinationConfig destination, IfExists ifExists) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(ifExists, "ifExists");
        String qualified = SqlIdentifiers.qualified(destination.schema(), destination.table());
        for (String column : table.columns()) SqlIdentifiers.requireValid("column", column);

        try (Connection con = dataSource.getConnection()) {
            boolean autoCommit = con.getAutoCommit();
            con.setAutoCommit(false);
            try {
                write(con, table, destination, qualified, ifExists);
                con.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(con, e);
                throw e;
            } finally {
                con.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new HierarchyDbException("Failed to write " + table.rowCount() + " row(s) to " + qualified
                    + ": " + e.getMessage(), e);
        }
        log.info("Wrote {} row(s) to {} ({})", table.rowCount(), qualified, ifExists);
    }

    private void write(Connection con, Table table, DestinationConfig destination, String qualified, IfExists ifExists)
            throws SQLException {
        boolean exists = dialect.tableExists(con, destination.schema(), destination.table());
        if (exists && ifExists == IfExists.FAIL) {
            throw new HierarchyDbException("Table " + qualified + " already exists");
        }
        if (exists && ifExists == IfExists.REPLACE) {
            execute(con, "DROP TABLE " + qualified);
            exists = false;
        }
        if (!exists) execute(con, createSql(qualified, table));
        insertRows(con, qualified, table);
    }

    String createSql(String qualified, Table table) {
        StringJoiner columns = new StringJoiner(", ", "CREATE TABLE " + qualified + " (", ")");
        for (String column : table.columns()) {
            columns.add(column + " " + ColumnType.infer(table.column(column)).sqlType(dialect));
        }
        return columns.toString();
    }

    private static void insertRows(Connection con, String qualified, Table table) throws SQLException {
        if (table.isEmpty()) return;
        StringJoiner names = new StringJoiner(", ", "INSERT INTO " + qualified + " (", ")");
        StringJoiner marks = new StringJoiner(", ", " VALUES (", ")");
        List<Boolean> integral = new ArrayList<>(table.columnCount());
        for (String column : table.columns()) {
            names.add(column);
            marks.add("?");
            integral.add(ColumnType.infer(table.column(column)).integral());
        }
        try (PreparedStatement ps = con.prepareStatement(names + marks.toString())) {
            for (List<Object> row : table.rows()) {
                for (int i = 0; i < row.size(); i++) bind(ps, i + 1, row.get(i), integral.get(i));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void bind(PreparedStatement ps, int index, Object value, boolean integral) throws SQLException {
        if (value == null) {
            ps.setNull(index, integral ? Types.BIGINT : Types.VARCHAR);
        } else if (integral) {
            if (value instanceof BigInteger big) ps.setBigDecimal(index, new BigDecimal(big));
            else if (value instanceof BigDecimal dec) ps.setBigDecimal(index, dec);
            else ps.setLong(index, ((Number) value).longValue());
        } else {
            ps.setString(index, String.valueOf(value));
        }
    }

    private static void execute(Connection con, String sql) throws SQLException {
        log.debug("Executing {}", sql);
        try (Statement st = con.createStatement()) {
            st.execute(sql);
        }
    }

    private static void rollback(Connection con, Exception cause) {
        try {
            con.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public void close() {
        if (ownsDataSource && dataSource instanceof HikariDataSource hikari) {
            hikari.close();
        }
    }
}
