package hle.affinity.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationsTest {

    @Test
    void shouldParseSingleUnits() {
        assertEquals(Duration.ofNanos(15), Durations.parse("15ns"));
        assertEquals(Duration.ofNanos(7_000), Durations.parse("7us"));
        assertEquals(Duration.ofNanos(7_000), Durations.parse("7µs"));
        assertEquals(Duration.ofMillis(300), Durations.parse("300ms"));
        assertEquals(Duration.ofSeconds(10), Durations.parse("10s"));
        assertEquals(Duration.ofMinutes(5), Durations.parse("5m"));
        assertEquals(Duration.ofHours(2), Durations.parse("2h"));
    }

    @Test
    void shouldParseCompoundDurations() {
        Duration expected = Duration.ofHours(1).plusMinutes(2).plusSeconds(3)
                .plusMillis(4).plusNanos(5_006);

        assertEquals(expected, Durations.parse("1h2m3s4ms5us6ns"));
        assertEquals(Duration.ofMinutes(165), Durations.parse("2h45m"));
    }

    @Test
    void shouldParseFractions() {
        assertEquals(Duration.ofMinutes(90), Durations.parse("1.5h"));
        assertEquals(Duration.ofMillis(2500), Durations.parse("2.5s"));
        assertEquals(Duration.ofMillis(500), Durations.parse(".5s"));
    }

    @Test
    void shouldParseSignAndZero() {
        assertEquals(Duration.ZERO, Durations.parse("0"));
        assertEquals(Duration.ZERO, Durations.parse("-0"));
        assertEquals(Duration.ofSeconds(-3), Durations.parse("-3s"));
        assertEquals(Duration.ofSeconds(3), Durations.parse("+3s"));
    }

    @Test
    void shouldRejectInvalidDurations() {
        assertThrows(IllegalArgumentException.class, () -> Durations.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("10"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("s"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("-"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("1.2.3s"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("3000000h"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Durations.parse("5d"));
        assertTrue(e.getMessage().contains("unknown unit \"d\""));
    }

    @Test
    void shouldFormatDurations() {
        assertEquals("0s", Durations.format(Duration.ZERO));
        assertEquals("10s", Durations.format(Duration.ofSeconds(10)));
        assertEquals("250ms", Durations.format(Duration.ofMillis(250)));
        assertEquals("1h2m3s", Durations.format(Duration.ofSeconds(3723)));
        assertEquals("1.5s", Durations.format(Duration.ofMillis(1500)));
        assertEquals("-5m", Durations.format(Duration.ofMinutes(-5)));
    }

    @Test
    void formattedDurationsShouldParseBack() {
        Duration original = Duration.ofHours(3).plusMillis(1).plusNanos(7);

        assertEquals(original, Durations.parse(Durations.format(original)));
    }
}
