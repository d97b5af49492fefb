package io.civiltime.jdbc;

import io.civiltime.core.ScanInput;

/**
 * Narrows JDBC column objects to {@link ScanInput}.
 *
 * <p>The legacy {@code java.sql} temporal types are read through their local-time views;
 * everything else is handled by {@link ScanInput#from(Object, String)}.
 */
final class JdbcScanInputs {
    private JdbcScanInputs() {}

    static ScanInput from(Object raw, String target) {
        if (raw instanceof java.sql.Timestamp timestamp) {
            return ScanInput.CalendarInstant.of(timestamp.toLocalDateTime());
        }
        if (raw instanceof java.sql.Date date) {
            return ScanInput.CalendarInstant.of(date.toLocalDate());
        }
        if (raw instanceof java.sql.Time time) {
            return ScanInput.CalendarInstant.of(time.toLocalTime());
        }
        return ScanInput.from(raw, target);
    }
}
