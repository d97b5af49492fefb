package io.civiltime.core;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * A time of day without a date or zone: hour, minute, second and nanosecond.
 *
 * <p>Like {@link Date}, construction and {@link #toText()} accept any field values. Only
 * {@link #parse(String)} enforces the clock ranges.
 */
public final class Time implements Comparable<Time> {

    public static final Time MIDNIGHT = new Time(0, 0, 0, 0);

    public static final TextCodec<Time> TEXT = TextCodec.of(Time.class, Time::toText, Time::parse);

    private final int hour;
    private final int minute;
    private final int second;
    private final int nanosecond;

    private Time(int hour, int minute, int second, int nanosecond) {
        this.hour = hour;
        this.minute = minute;
        this.second = second;
        this.nanosecond = nanosecond;
    }

    public static Time of(int hour, int minute, int second, int nanosecond) {
        return new Time(hour, minute, second, nanosecond);
    }

    public static Time of(int hour, int minute, int second) {
        return new Time(hour, minute, second, 0);
    }

    public static Time of(LocalTime time) {
        Objects.requireNonNull(time, "time");
        return new Time(time.getHour(), time.getMinute(), time.getSecond(), time.getNano());
    }

    /**
     * Parses {@code HH:mm:ss} with an optional fraction of one to nine digits.
     *
     * @throws CivilTimeException.ParseFailure if a field is out of range, signed, of the wrong width,
     *                                         or the fraction is longer than nine digits
     */
    public static Time parse(String text) {
        Objects.requireNonNull(text, "text");
        try {
            return of(Layouts.TIME.parse(text, LocalTime::from));
        } catch (DateTimeParseException e) {
            throw new CivilTimeException.ParseFailure("time", text, Layouts.TIME_LAYOUT, e);
        }
    }

    /**
     * Reads a time from a scan source. The date fields of a calendar reading are discarded.
     */
    public static Time scan(ScanInput input) {
        Objects.requireNonNull(input, "input");
        if (input instanceof ScanInput.Text text) {
            return parse(text.value());
        }
        ScanInput.CalendarInstant instant = (ScanInput.CalendarInstant) input;
        return new Time(instant.hour(), instant.minute(), instant.second(), instant.nanosecond());
    }

    /**
     * @throws CivilTimeException.UnsupportedScanInput if the source is neither text nor a calendar reading
     */
    public static Time scan(Object source) {
        return scan(ScanInput.from(source, "Time"));
    }

    public int hour() {
        return hour;
    }

    public int minute() {
        return minute;
    }

    public int second() {
        return second;
    }

    public int nanosecond() {
        return nanosecond;
    }

    /**
     * {@code HH:MM:SS}, followed by a nine digit fraction when the nanosecond is not zero.
     */
    public String toText() {
        return Layouts.formatTime(hour, minute, second, nanosecond);
    }

    public String value() {
        return toText();
    }

    public boolean isValid() {
        return hour >= 0 && hour <= 23
                && minute >= 0 && minute <= 59
                && second >= 0 && second <= 59
                && nanosecond >= 0 && nanosecond <= 999_999_999;
    }

    public boolean isBefore(Time other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(Time other) {
        return compareTo(other) > 0;
    }

    /**
     * @throws java.time.DateTimeException if this time is not valid
     */
    public LocalTime toLocalTime() {
        return LocalTime.of(hour, minute, second, nanosecond);
    }

    @Override
    public int compareTo(Time other) {
        int cmp = Integer.compare(hour, other.hour);
        if (cmp == 0) {
            cmp = Integer.compare(minute, other.minute);
            if (cmp == 0) {
                cmp = Integer.compare(second, other.second);
                if (cmp == 0) {
                    cmp = Integer.compare(nanosecond, other.nanosecond);
                }
            }
        }
        return cmp;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Time)) return false;
        Time that = (Time) other;
        return hour == that.hour && minute == that.minute && second == that.second && nanosecond == that.nanosecond;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hour, minute, second, nanosecond);
    }

    @Override
    public String toString() {
        return toText();
    }
}
