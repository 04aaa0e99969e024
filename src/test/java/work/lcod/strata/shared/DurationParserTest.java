package work.lcod.strata.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesCombinedUnits() {
        assertEquals(Duration.ofHours(49).plusMinutes(20), DurationParser.parse("2d1h20m").orElseThrow());
        assertEquals(Duration.ofSeconds(3723), DurationParser.parse("1h2m3s").orElseThrow());
        assertEquals(Duration.ofDays(3), DurationParser.parse("3d").orElseThrow());
        assertEquals(Duration.ofMinutes(65), DurationParser.parse("1 hour 5 minutes").orElseThrow());
    }

    @Test
    void parsesMilliseconds() {
        assertEquals(Duration.ofMillis(250), DurationParser.parse("250ms").orElseThrow());
        assertEquals(Duration.ofSeconds(1).plusMillis(500), DurationParser.parse("1s500ms").orElseThrow());
    }

    @Test
    void parsesClockNotation() {
        assertEquals(Duration.ofHours(1).plusMinutes(30), DurationParser.parse("01:30").orElseThrow());
        assertEquals(Duration.ofHours(100).plusSeconds(5), DurationParser.parse("100:00:05").orElseThrow());
    }

    @Test
    void handlesZero() {
        Optional<Duration> duration = DurationParser.parse("0");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ZERO, duration.get());
    }

    @Test
    void rejectsUnknownText() {
        assertTrue(DurationParser.parse("a").isEmpty());
        assertTrue(DurationParser.parse("").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
        assertTrue(DurationParser.parse("1500").isEmpty());
    }

    @Test
    void formatsInUnitNotation() {
        assertEquals("0s", DurationParser.format(Duration.ZERO));
        assertEquals("49h20m", DurationParser.format(Duration.ofHours(49).plusMinutes(20)));
        assertEquals("1h2m3s", DurationParser.format(Duration.ofSeconds(3723)));
        assertEquals("1s500ms", DurationParser.format(Duration.ofMillis(1500)));
        assertEquals("-2m", DurationParser.format(Duration.ofMinutes(-2)));
    }
}
