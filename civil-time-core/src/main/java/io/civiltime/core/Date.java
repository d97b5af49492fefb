package io.civiltime.core;

import java.time.LocalDate;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * A calendar date without a time zone: year, month and day of the proleptic Gregorian calendar.
 *
 * <p>Construction does not validate. {@code Date.of(2020, 2, -1)} is a legal value; it is only
 * rejected when it crosses a text boundary. {@link #toText()} checks the year alone and formats
 * month and day as given, while {@link #parse(String)} applies the full calendar rules. Only
 * valid dates survive a round trip.
 */
public final class Date implements Comparable<Date> {

    public static final int MIN_YEAR = 0;
    public static final int MAX_YEAR = 9999;

    /**
     * The zero value {@code 0000-00-00}.
     */
    public static final Date ZERO = new Date(0, 0, 0);

    public static final TextCodec<Date> TEXT = TextCodec.of(Date.class, Date::toText, Date::parse);

    private static final String ZERO_TEXT = "0000-00-00";

    private final int year;
    private final int month;
    private final int day;

    private Date(int year, int month, int day) {
        this.year = year;
        this.month = month;
        this.day = day;
    }

    public static Date of(int year, int month, int day) {
        return new Date(year, month, day);
    }

    public static Date of(LocalDate date) {
        Objects.requireNonNull(date, "date");
        return new Date(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Parses exactly {@code YYYY-MM-DD}.
     *
     * <p>The literal {@code 0000-00-00} yields {@link #ZERO}, mirroring {@link #value()}.
     *
     * @throws CivilTimeException.ParseFailure if the text has another shape, a sign, or names a day
     *                                         that does not exist
     */
    public static Date parse(String text) {
        Objects.requireNonNull(text, "text");
        if (ZERO_TEXT.equals(text)) return ZERO;
        try {
            return of(Layouts.DATE.parse(text, LocalDate::from));
        } catch (DateTimeParseException e) {
            throw new CivilTimeException.ParseFailure("date", text, Layouts.DATE_LAYOUT, e);
        }
    }

    /**
     * Reads a date from a scan source. A calendar reading contributes its year, month and day.
     */
    public static Date scan(ScanInput input) {
        Objects.requireNonNull(input, "input");
        if (input instanceof ScanInput.Text text) {
            return parse(text.value());
        }
        ScanInput.CalendarInstant instant = (ScanInput.CalendarInstant) input;
        return new Date(instant.year(), instant.month(), instant.day());
    }

    /**
     * @throws CivilTimeException.UnsupportedScanInput if the source is neither text nor a calendar reading
     */
    public static Date scan(Object source) {
        return scan(ScanInput.from(source, "Date"));
    }

    public int year() {
        return year;
    }

    public int month() {
        return month;
    }

    public int day() {
        return day;
    }

    /**
     * Formats this date as {@code YYYY-MM-DD}.
     *
     * @throws CivilTimeException.OutOfRange if the year is outside [0, 9999]
     */
    public String toText() {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new CivilTimeException.OutOfRange("year", year, MIN_YEAR, MAX_YEAR);
        }
        return value();
    }

    /**
     * The storage scalar. Never fails, {@code 0000-00-00} included.
     */
    public String value() {
        return Layouts.formatDate(year, month, day);
    }

    public boolean isValid() {
        return year >= MIN_YEAR && year <= MAX_YEAR
                && month >= 1 && month <= 12
                && day >= 1 && day <= lengthOfMonth(year, month);
    }

    /**
     * Adds calendar months. A day past the end of the target month carries into the following
     * month, so {@code 2020-02-29} plus 12 months is {@code 2021-03-01}.
     *
     * @throws java.time.DateTimeException if the year is beyond the range {@link LocalDate} supports
     */
    public Date plusMonths(int months) {
        return normalize((long) year * 12 + month - 1 + months, day - 1L);
    }

    /**
     * Adds calendar years with the same carry rule as {@link #plusMonths(int)}.
     *
     * @throws java.time.DateTimeException if the year is beyond the range {@link LocalDate} supports
     */
    public Date plusYears(int years) {
        return normalize((long) year * 12 + month - 1 + (long) years * 12, day - 1L);
    }

    /**
     * @throws java.time.DateTimeException if the year is beyond the range {@link LocalDate} supports
     */
    public Date plusDays(int days) {
        return normalize((long) year * 12 + month - 1, day - 1L + days);
    }

    /**
     * The number of days from {@code start} to this date, negative when {@code start} is later.
     *
     * @throws java.time.DateTimeException if either year is beyond the range {@link LocalDate} supports
     */
    public long daysSince(Date start) {
        return epochDay() - start.epochDay();
    }

    public boolean isBefore(Date other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(Date other) {
        return compareTo(other) > 0;
    }

    /**
     * @throws java.time.DateTimeException if this date is not valid
     */
    public LocalDate toLocalDate() {
        return LocalDate.of(year, month, day);
    }

    private long epochDay() {
        return normalizedFirst((long) year * 12 + month - 1).plusDays(day - 1L).toEpochDay();
    }

    private static Date normalize(long monthIndex, long dayOffset) {
        return of(normalizedFirst(monthIndex).plusDays(dayOffset));
    }

    private static LocalDate normalizedFirst(long monthIndex) {
        return LocalDate.of(Math.toIntExact(Math.floorDiv(monthIndex, 12L)), (int) Math.floorMod(monthIndex, 12L) + 1, 1);
    }

    static int lengthOfMonth(int year, int month) {
        switch (month) {
            case 2:
                return IsoChronology.INSTANCE.isLeapYear(year) ? 29 : 28;
            case 4:
            case 6:
            case 9:
            case 11:
                return 30;
            default:
                return 31;
        }
    }

    @Override
    public int compareTo(Date other) {
        int cmp = Integer.compare(year, other.year);
        if (cmp == 0) {
            cmp = Integer.compare(month, other.month);
            if (cmp == 0) {
                cmp = Integer.compare(day, other.day);
            }
        }
        return cmp;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Date)) return false;
        Date that = (Date) other;
        return year == that.year && month == that.month && day == that.day;
    }

    @Override
    public int hashCode() {
        return (year & 0xFFFFF800) ^ ((year << 11) + (month << 6) + day);
    }

    @Override
    public String toString() {
        return value();
    }
}
