package io.civiltime.core;

import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.Locale;

import static java.time.temporal.ChronoField.*;

/**
 * Strict parsers for the civil text layouts.
 *
 * <p>Every field has a fixed width and no sign. The resolver is {@link ResolverStyle#STRICT}, so
 * month 13, February 30 or hour 24 are rejected instead of being adjusted.
 */
final class Layouts {

    static final String DATE_LAYOUT = "YYYY-MM-DD";
    static final String TIME_LAYOUT = "HH:mm:ss[.fffffffff]";
    static final String DATE_TIME_LAYOUT = DATE_LAYOUT + "T" + TIME_LAYOUT;

    static final DateTimeFormatter DATE = new DateTimeFormatterBuilder()
            .appendValue(YEAR, 4)
            .appendLiteral('-')
            .appendValue(MONTH_OF_YEAR, 2)
            .appendLiteral('-')
            .appendValue(DAY_OF_MONTH, 2)
            .toFormatter()
            .withChronology(IsoChronology.INSTANCE)
            .withResolverStyle(ResolverStyle.STRICT);

    static final DateTimeFormatter TIME = new DateTimeFormatterBuilder()
            .appendValue(HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(MINUTE_OF_HOUR, 2)
            .appendLiteral(':')
            .appendValue(SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(NANO_OF_SECOND, 1, 9, true)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private Layouts() {}

    static String formatDate(int year, int month, int day) {
        return String.format(Locale.ROOT, "%04d-%02d-%02d", year, month, day);
    }

    static String formatTime(int hour, int minute, int second, int nanosecond) {
        String hms = String.format(Locale.ROOT, "%02d:%02d:%02d", hour, minute, second);
        return nanosecond == 0 ? hms : hms + String.format(Locale.ROOT, ".%09d", nanosecond);
    }
}
