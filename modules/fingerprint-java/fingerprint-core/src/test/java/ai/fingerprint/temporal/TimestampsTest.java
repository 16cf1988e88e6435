package ai.fingerprint.temporal;

import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

import static org.hamcrest.MatcherAssert.assertThat;

class TimestampsTest {

    private static final Instant NOON = Instant.parse("2020-03-01T12:00:00Z");

    @Test
    public void testTemporalValues() {
        assertThat("Wrong instant", Timestamps.toInstant(NOON), Matchers.equalTo(NOON));
        assertThat("Wrong instant", Timestamps.toInstant(OffsetDateTime.of(2020, 3, 1, 14, 0, 0, 0, ZoneOffset.ofHours(2))), Matchers.equalTo(NOON));
        assertThat("Local date-times are UTC", Timestamps.toInstant(LocalDateTime.of(2020, 3, 1, 12, 0)), Matchers.equalTo(NOON));
        assertThat("Local dates are UTC midnight", Timestamps.toInstant(LocalDate.of(2020, 3, 1)), Matchers.equalTo(Instant.parse("2020-03-01T00:00:00Z")));
        assertThat("Wrong instant", Timestamps.toInstant(Date.from(NOON)), Matchers.equalTo(NOON));
        assertThat("Numbers are epoch millis", Timestamps.toInstant(NOON.toEpochMilli()), Matchers.equalTo(NOON));
        assertThat("Nil stays nil", Timestamps.toInstant(null), Matchers.nullValue());
    }

    @Test
    public void testStrings() {
        assertThat("Wrong instant", Timestamps.toInstant("2020-03-01T12:00:00Z"), Matchers.equalTo(NOON));
        assertThat("Wrong instant", Timestamps.toInstant("2020-03-01T13:00:00+01:00"), Matchers.equalTo(NOON));
        assertThat("Wrong instant", Timestamps.toInstant("2020-03-01T12:00:00"), Matchers.equalTo(NOON));
        assertThat("Wrong instant", Timestamps.toInstant(" 2020-03-01 "), Matchers.equalTo(Instant.parse("2020-03-01T00:00:00Z")));
    }

    @Test
    public void testInvalidValues() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Timestamps.toInstant("yesterday"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Timestamps.toInstant(true));
    }

    @Test
    public void testEpochMillis() {
        assertThat("Wrong millis", Timestamps.toEpochMillis("2020-03-01T12:00:00Z"), Matchers.equalTo((double) NOON.toEpochMilli()));
        assertThat("Wrong date-time", Timestamps.fromEpochMillis(NOON.toEpochMilli()),
            Matchers.equalTo(ZonedDateTime.of(2020, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC)));
    }
}
