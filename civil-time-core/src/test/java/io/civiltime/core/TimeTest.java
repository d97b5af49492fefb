package io.civiltime.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeTest {

    @Test
    void toTextPadsFractionToNineDigits() {
        assertThat(Time.of(3, 42, 31, 876).toText()).isEqualTo("03:42:31.000000876");
        assertThat(Time.of(23, 59, 59, 999_999_999).toText()).isEqualTo("23:59:59.999999999");
        assertThat(Time.of(12, 0, 0, 500_000_000).toText()).isEqualTo("12:00:00.500000000");
    }

    @Test
    void toTextOmitsZeroFraction() {
        assertThat(Time.of(0, 0, 0, 0).toText()).isEqualTo("00:00:00");
        assertThat(Time.MIDNIGHT.value()).isEqualTo("00:00:00");
    }

    @Test
    void toTextDoesNotValidate() {
        assertThat(Time.of(24, 0, 0, 0).toText()).isEqualTo("24:00:00");
        assertThat(Time.of(0, -1, 0, 0).toText()).isEqualTo("00:-1:00");
        assertThat(Time.of(12, 23, 34, 1_231_231_234).toText()).isEqualTo("12:23:34.1231231234");
    }

    @Test
    void parseReadsFractionOfAnyPrecision() {
        assertThat(Time.parse("03:42:31.000000876")).isEqualTo(Time.of(3, 42, 31, 876));
        assertThat(Time.parse("03:42:31.5")).isEqualTo(Time.of(3, 42, 31, 500_000_000));
        assertThat(Time.parse("03:42:31")).isEqualTo(Time.of(3, 42, 31, 0));
    }

    @Test
    void parseRejectsNegativeHourAsUnparseable() {
        assertThatThrownBy(() -> Time.parse("-3:42:31.000000876"))
                .isInstanceOf(CivilTimeException.ParseFailure.class)
                .hasMessageStartingWith("invalid time: cannot parse \"-3:42:31.000000876\" as \"HH:mm:ss[.fffffffff]\"");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "24:00:00", "00:-1:00", "01:00:75", "00:60:00", "12:23:34.1231231234",
            "3:42:31", "03:42", "03:42:31.", "03:42:31Z", "T03:42:31", ""
    })
    void parseRejectsInvalidText(String text) {
        assertThatThrownBy(() -> Time.parse(text))
                .isInstanceOf(CivilTimeException.ParseFailure.class);
    }

    @Test
    void scanAcceptsTextAndCalendarReadings() {
        Time expected = Time.of(3, 42, 31, 876);

        assertThat(Time.scan("03:42:31.000000876")).isEqualTo(expected);
        assertThat(Time.scan(LocalDateTime.of(2020, 2, 29, 3, 42, 31, 876))).isEqualTo(expected);
        assertThat(Time.scan(LocalTime.of(3, 42, 31, 876))).isEqualTo(expected);
    }

    @Test
    void scanRejectsOtherTypes() {
        assertThatThrownBy(() -> Time.scan(new byte[0]))
                .isInstanceOf(CivilTimeException.UnsupportedScanInput.class)
                .hasMessageEndingWith("into Time");
    }

    @Test
    void isValidChecksClockRanges() {
        assertThat(Time.of(23, 59, 59, 999_999_999).isValid()).isTrue();
        assertThat(Time.of(24, 0, 0, 0).isValid()).isFalse();
        assertThat(Time.of(0, 60, 0, 0).isValid()).isFalse();
        assertThat(Time.of(0, 0, 0, 1_000_000_000).isValid()).isFalse();
    }

    @Test
    void ordersByClockReading() {
        assertThat(Time.of(3, 42, 31, 876).isBefore(Time.of(3, 42, 31, 877))).isTrue();
        assertThat(Time.of(4, 0, 0).isAfter(Time.of(3, 59, 59, 999_999_999))).isTrue();
    }

    @Test
    void convertsToAndFromLocalTime() {
        assertThat(Time.of(LocalTime.of(3, 42, 31, 876))).isEqualTo(Time.of(3, 42, 31, 876));
        assertThat(Time.of(3, 42, 31, 876).toLocalTime()).isEqualTo(LocalTime.of(3, 42, 31, 876));
    }
}
