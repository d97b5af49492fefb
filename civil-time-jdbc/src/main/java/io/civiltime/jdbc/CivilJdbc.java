package io.civiltime.jdbc;

import io.civiltime.core.CivilTimeException;
import io.civiltime.core.Date;
import io.civiltime.core.DateTime;
import io.civiltime.core.ScanInput;
import io.civiltime.core.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;
import java.util.function.Function;

/**
 * Storage adapter between civil values and JDBC.
 *
 * <p>Values are written according to the {@link JdbcBinding}. Reads accept text columns holding
 * the scalar form as well as native temporal columns, so a column can switch representation
 * without touching the reading code. SQL {@code NULL} maps to {@code null} both ways.
 *
 * <p>Instances are immutable and safe to share.
 */
public final class CivilJdbc {
    private static final Logger log = LoggerFactory.getLogger(CivilJdbc.class);

    private final JdbcBinding binding;

    public CivilJdbc() {
        this(JdbcBinding.defaults());
    }

    public CivilJdbc(JdbcBinding binding) {
        this.binding = Objects.requireNonNull(binding, "binding");
    }

    public JdbcBinding binding() {
        return binding;
    }

    // ===== Binding =====

    public void bind(PreparedStatement ps, int index, Date value) throws SQLException {
        if (binding.dateStorage() == JdbcBinding.Storage.TEXT) {
            bindText(ps, index, value == null ? null : value.value());
        } else if (value == null) {
            ps.setNull(index, Types.DATE);
        } else {
            ps.setObject(index, toNative(value, Date::toLocalDate));
        }
    }

    public void bind(PreparedStatement ps, int index, Time value) throws SQLException {
        if (binding.timeStorage() == JdbcBinding.Storage.TEXT) {
            bindText(ps, index, value == null ? null : value.value());
        } else if (value == null) {
            ps.setNull(index, Types.TIME);
        } else {
            ps.setObject(index, toNative(value, Time::toLocalTime));
        }
    }

    public void bind(PreparedStatement ps, int index, DateTime value) throws SQLException {
        if (binding.dateTimeStorage() == JdbcBinding.Storage.TEXT) {
            bindText(ps, index, value == null ? null : value.value());
        } else if (value == null) {
            ps.setNull(index, Types.TIMESTAMP);
        } else {
            ps.setObject(index, toNative(value, DateTime::toLocalDateTime));
        }
    }

    // ===== Reading =====

    public Date readDate(ResultSet rs, String column) throws SQLException {
        return read(column(rs, rs.findColumn(column)), column, "Date", Date::scan);
    }

    public Date readDate(ResultSet rs, int column) throws SQLException {
        return read(column(rs, column), column, "Date", Date::scan);
    }

    public Time readTime(ResultSet rs, String column) throws SQLException {
        return read(column(rs, rs.findColumn(column)), column, "Time", Time::scan);
    }

    public Time readTime(ResultSet rs, int column) throws SQLException {
        return read(column(rs, column), column, "Time", Time::scan);
    }

    public DateTime readDateTime(ResultSet rs, String column) throws SQLException {
        return read(column(rs, rs.findColumn(column)), column, "DateTime", DateTime::scan);
    }

    public DateTime readDateTime(ResultSet rs, int column) throws SQLException {
        return read(column(rs, column), column, "DateTime", DateTime::scan);
    }

    private static void bindText(PreparedStatement ps, int index, String text) throws SQLException {
        if (text == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, text);
        }
    }

    /**
     * Temporal columns are read through their {@code java.time} type so that no precision is lost
     * to the legacy {@code java.sql} classes.
     */
    private static Object column(ResultSet rs, int index) throws SQLException {
        switch (rs.getMetaData().getColumnType(index)) {
            case Types.DATE:
                return rs.getObject(index, LocalDate.class);
            case Types.TIME:
                return rs.getObject(index, LocalTime.class);
            case Types.TIMESTAMP:
                return rs.getObject(index, LocalDateTime.class);
            default:
                return rs.getObject(index);
        }
    }

    private static <T, N> N toNative(T value, Function<T, N> converter) throws SQLException {
        try {
            return converter.apply(value);
        } catch (DateTimeException e) {
            log.debug("Rejected native binding of {}: {}", value, e.getMessage());
            throw new SQLException("Cannot bind invalid value " + value + " as a native temporal parameter", e);
        }
    }

    private static <T> T read(Object raw, Object column, String target,
                              Function<ScanInput, T> scanner) {
        if (raw == null) return null;
        try {
            return scanner.apply(JdbcScanInputs.from(raw, target));
        } catch (CivilTimeException e) {
            log.debug("Cannot read column {} as {}: {}", column, target, e.getMessage());
            throw e;
        }
    }
}
