package io.civiltime.core;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A {@link Date} and a {@link Time} read together, still without a zone.
 *
 * <p>Validation and formatting are delegated to the two parts; the text form joins them with a
 * literal {@code T}.
 */
public final class DateTime implements Comparable<DateTime> {

    public static final DateTime ZERO = new DateTime(Date.ZERO, Time.MIDNIGHT);

    public static final TextCodec<DateTime> TEXT = TextCodec.of(DateTime.class, DateTime::toText, DateTime::parse);

    private static final char SEPARATOR = 'T';

    private final Date date;
    private final Time time;

    private DateTime(Date date, Time time) {
        this.date = Objects.requireNonNull(date, "date");
        this.time = Objects.requireNonNull(time, "time");
    }

    public static DateTime of(Date date, Time time) {
        return new DateTime(date, time);
    }

    public static DateTime of(LocalDateTime dateTime) {
        Objects.requireNonNull(dateTime, "dateTime");
        return new DateTime(Date.of(dateTime.toLocalDate()), Time.of(dateTime.toLocalTime()));
    }

    /**
     * Splits at the first {@code T} and parses each side strictly.
     *
     * @throws CivilTimeException.ParseFailure if the separator is missing or either side is rejected
     */
    public static DateTime parse(String text) {
        Objects.requireNonNull(text, "text");
        int sep = text.indexOf(SEPARATOR);
        if (sep < 0) {
            throw new CivilTimeException.ParseFailure("datetime", text, Layouts.DATE_TIME_LAYOUT, null);
        }
        try {
            return new DateTime(Date.parse(text.substring(0, sep)), Time.parse(text.substring(sep + 1)));
        } catch (CivilTimeException.ParseFailure e) {
            throw new CivilTimeException.ParseFailure("datetime", text, Layouts.DATE_TIME_LAYOUT, e);
        }
    }

    public static DateTime scan(ScanInput input) {
        Objects.requireNonNull(input, "input");
        if (input instanceof ScanInput.Text text) {
            return parse(text.value());
        }
        return new DateTime(Date.scan(input), Time.scan(input));
    }

    /**
     * @throws CivilTimeException.UnsupportedScanInput if the source is neither text nor a calendar reading
     */
    public static DateTime scan(Object source) {
        return scan(ScanInput.from(source, "DateTime"));
    }

    public Date date() {
        return date;
    }

    public Time time() {
        return time;
    }

    /**
     * @throws CivilTimeException.OutOfRange if the year is outside [0, 9999]
     */
    public String toText() {
        return date.toText() + SEPARATOR + time.toText();
    }

    public String value() {
        return date.value() + SEPARATOR + time.value();
    }

    public boolean isValid() {
        return date.isValid() && time.isValid();
    }

    public boolean isBefore(DateTime other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(DateTime other) {
        return compareTo(other) > 0;
    }

    /**
     * @throws java.time.DateTimeException if either part is not valid
     */
    public LocalDateTime toLocalDateTime() {
        return LocalDateTime.of(date.toLocalDate(), time.toLocalTime());
    }

    @Override
    public int compareTo(DateTime other) {
        int cmp = date.compareTo(other.date);
        return cmp != 0 ? cmp : time.compareTo(other.time);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof DateTime)) return false;
        DateTime that = (DateTime) other;
        return date.equals(that.date) && time.equals(that.time);
    }

    @Override
    public int hashCode() {
        return date.hashCode() ^ time.hashCode();
    }

    @Override
    public String toString() {
        return value();
    }
}
