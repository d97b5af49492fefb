package io.civiltime.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateTimeTest {

    private static final DateTime LEAP_DAY = DateTime.of(Date.of(2020, 2, 29), Time.of(3, 42, 31, 876));

    @Test
    void toTextJoinsPartsWithSeparator() {
        assertThat(LEAP_DAY.toText()).isEqualTo("2020-02-29T03:42:31.000000876");
        assertThat(DateTime.ZERO.toText()).isEqualTo("0000-00-00T00:00:00");
    }

    @Test
    void parseReproducesValue() {
        assertThat(DateTime.parse("2020-02-29T03:42:31.000000876")).isEqualTo(LEAP_DAY);
    }

    @ParameterizedTest
    @CsvSource({
            "0000-00-00T03:42:31.000000876",
            "0000-00-00T00:00:00",
            "2019-12-25T01:02:03.000000004",
            "2345-12-25T12:23:34.000000045",
            "0000-01-01T00:00:00",
            "9999-12-31T23:59:59.999999999"
    })
    void validTextSurvivesRoundTrip(String text) {
        DateTime parsed = DateTime.parse(text);

        assertThat(parsed.toText()).isEqualTo(text);
        assertThat(DateTime.parse(parsed.toText())).isEqualTo(parsed);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "2020-03--4T12:23:34.000000005",
            "2020-13-04T12:23:34.000000005",
            "-2020-03-04T12:23:34.000000005",
            "2020-03-04T24:00:00",
            "2020-03-04T00:-1:00",
            "2020-03-04T01:00:75",
            "2020-03-04T12:23:34.1231231234",
            "0-02-29T03:42:31.000000876",
            "2020-02-29 03:42:31",
            "2020-02-29"
    })
    void parseRejectsInvalidText(String text) {
        assertThatThrownBy(() -> DateTime.parse(text))
                .isInstanceOf(CivilTimeException.ParseFailure.class)
                .hasMessageStartingWith("invalid datetime: cannot parse \"" + text + "\"");
    }

    @Test
    void toTextFailsWhenYearOutOfRange() {
        DateTime badYear = DateTime.of(Date.of(-2020, 3, 4), Time.of(12, 23, 34, 5));

        assertThatThrownBy(badYear::toText).isInstanceOf(CivilTimeException.OutOfRange.class);
        assertThat(badYear.value()).isEqualTo("-2020-03-04T12:23:34.000000005");
    }

    @Test
    void valueMatchesText() {
        assertThat(LEAP_DAY.value()).isEqualTo("2020-02-29T03:42:31.000000876");
        assertThat(LEAP_DAY).hasToString("2020-02-29T03:42:31.000000876");
    }

    @Test
    void scanAcceptsTextAndCalendarReadings() {
        assertThat(DateTime.scan("2020-02-29T03:42:31.000000876")).isEqualTo(LEAP_DAY);
        assertThat(DateTime.scan(LocalDateTime.of(2020, 2, 29, 3, 42, 31, 876))).isEqualTo(LEAP_DAY);
        assertThat(DateTime.scan(OffsetDateTime.of(2020, 2, 29, 3, 42, 31, 876, ZoneOffset.ofHours(9))))
                .isEqualTo(LEAP_DAY);
        assertThat(DateTime.scan(LocalDateTime.of(2020, 2, 29, 3, 42, 31, 876).toInstant(ZoneOffset.UTC)))
                .isEqualTo(LEAP_DAY);
    }

    @Test
    void scanRejectsOtherTypes() {
        assertThatThrownBy(() -> DateTime.scan(Long.valueOf(0)))
                .isInstanceOf(CivilTimeException.UnsupportedScanInput.class)
                .hasMessage("cannot scan java.lang.Long into DateTime");
        assertThatThrownBy(() -> DateTime.scan((Object) null))
                .isInstanceOf(CivilTimeException.UnsupportedScanInput.class)
                .hasMessage("cannot scan null into DateTime");
    }

    @Test
    void isValidRequiresBothParts() {
        assertThat(LEAP_DAY.isValid()).isTrue();
        assertThat(DateTime.of(Date.of(2021, 2, 29), Time.MIDNIGHT).isValid()).isFalse();
        assertThat(DateTime.of(Date.of(2021, 2, 28), Time.of(24, 0, 0)).isValid()).isFalse();
    }

    @Test
    void ordersByDateThenTime() {
        DateTime sameDayLater = DateTime.of(LEAP_DAY.date(), Time.of(3, 42, 32));
        DateTime nextDay = DateTime.of(Date.of(2020, 3, 1), Time.MIDNIGHT);

        assertThat(LEAP_DAY.isBefore(sameDayLater)).isTrue();
        assertThat(nextDay.isAfter(sameDayLater)).isTrue();
    }

    @Test
    void convertsToAndFromLocalDateTime() {
        LocalDateTime local = LocalDateTime.of(2020, 2, 29, 3, 42, 31, 876);

        assertThat(DateTime.of(local)).isEqualTo(LEAP_DAY);
        assertThat(LEAP_DAY.toLocalDateTime()).isEqualTo(local);
    }
}
