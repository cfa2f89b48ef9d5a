package work.lcod.meshdeploy.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
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
    void parsesCompoundDurations() {
        assertEquals(Duration.ofSeconds(90), DurationParser.parse("1m30s").orElseThrow());
        assertEquals(Duration.ofMinutes(150), DurationParser.parse("2h30m").orElseThrow());
    }

    @Test
    void parsesFractionsAndSubSecondUnits() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1.5s").orElseThrow());
        assertEquals(Duration.ofMillis(500), DurationParser.parse("500ms").orElseThrow());
        assertEquals(Duration.ofNanos(250_000), DurationParser.parse("250us").orElseThrow());
    }

    @Test
    void parsesMillisecondsByDefault() {
        Optional<Duration> duration = DurationParser.parse("1500");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofMillis(1500), duration.get());
    }

    @Test
    void handlesZeroAndBlank() {
        assertEquals(Duration.ZERO, DurationParser.parse("0").orElseThrow());
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
    }

    @Test
    void rejectsGarbage() {
        var error = assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("10 parsecs"));
        assertEquals("Invalid duration: 10 parsecs", error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("5s junk"));
    }
}
