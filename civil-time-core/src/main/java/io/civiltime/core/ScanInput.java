package io.civiltime.core;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Source accepted by the {@code scan} operations of {@link Date}, {@link Time} and {@link DateTime}.
 *
 * <p>A scan source is either the scalar text form or a calendar reading. Storage drivers hand
 * out loosely typed column values; {@link #from(Object, String)} narrows those to one of the two variants.
 */
public sealed interface ScanInput permits ScanInput.Text, ScanInput.CalendarInstant {

    /**
     * The scalar text form, parsed with the strict layout of the target type.
     */
    record Text(String value) implements ScanInput {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * A calendar and clock reading. Each target type projects the fields it owns.
     */
    record CalendarInstant(int year, int month, int day,
                           int hour, int minute, int second, int nanosecond) implements ScanInput {

        public static CalendarInstant of(LocalDateTime dateTime) {
            return new CalendarInstant(dateTime.getYear(), dateTime.getMonthValue(), dateTime.getDayOfMonth(),
                    dateTime.getHour(), dateTime.getMinute(), dateTime.getSecond(), dateTime.getNano());
        }

        public static CalendarInstant of(LocalDate date) {
            return of(date.atStartOfDay());
        }

        /**
         * Time of day on the zero date {@code 0000-00-00}.
         */
        public static CalendarInstant of(LocalTime time) {
            return new CalendarInstant(0, 0, 0, time.getHour(), time.getMinute(), time.getSecond(), time.getNano());
        }
    }

    /**
     * Maps a driver value to a scan source.
     *
     * <p>Zoned and offset values contribute their local fields. An {@link java.time.Instant} is
     * read at UTC.
     *
     * @param source the value to map
     * @param target the name of the type being scanned into, used in the error message
     * @throws CivilTimeException.UnsupportedScanInput if the value is of any other type
     */
    static ScanInput from(Object source, String target) {
        if (source instanceof ScanInput input) return input;
        if (source instanceof CharSequence text) return new Text(text.toString());
        if (source instanceof LocalDateTime dateTime) return CalendarInstant.of(dateTime);
        if (source instanceof LocalDate date) return CalendarInstant.of(date);
        if (source instanceof LocalTime time) return CalendarInstant.of(time);
        if (source instanceof OffsetDateTime dateTime) return CalendarInstant.of(dateTime.toLocalDateTime());
        if (source instanceof ZonedDateTime dateTime) return CalendarInstant.of(dateTime.toLocalDateTime());
        if (source instanceof java.time.Instant instant) {
            return CalendarInstant.of(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
        throw new CivilTimeException.UnsupportedScanInput(source == null ? null : source.getClass(), target);
    }
}
