package ai.fingerprint.temporal;

import ai.fingerprint.util.Pair;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Period;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;

class TimeSeriesTest {

    private static double millis(int year, int month, int day) {
        return ZonedDateTime.of(year, month, day, 0, 0, 0, 0, ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    @Test
    public void testMonthlyGapsFilledWithZero() {
        List<Pair<Double, Double>> series = Arrays.asList(
            Pair.of(millis(2020, 1, 1), 10.0),
            Pair.of(millis(2020, 3, 1), 30.0),
            Pair.of(millis(2020, 6, 1), 60.0)
        );

        List<Pair<Double, Double>> filled = TimeSeries.fill(Period.ofMonths(1), series);

        assertThat("Wrong points", filled, Matchers.contains(
            Pair.of(millis(2020, 1, 1), 10.0),
            Pair.of(millis(2020, 2, 1), 0.0),
            Pair.of(millis(2020, 3, 1), 30.0),
            Pair.of(millis(2020, 4, 1), 0.0),
            Pair.of(millis(2020, 5, 1), 0.0),
            Pair.of(millis(2020, 6, 1), 60.0)
        ));
    }

    @Test
    public void testOnePointPerPeriod() {
        double first = millis(2021, 2, 25);
        for (int days : new int[]{0, 1, 6, 7, 8, 30, 365}) {
            List<Pair<Double, Double>> series = Arrays.asList(
                Pair.of(first, 1.0),
                Pair.of(first + Duration.ofDays(days).toMillis(), 2.0)
            );

            List<Pair<Double, Double>> daily = TimeSeries.fill(Period.ofDays(1), series);
            List<Pair<Double, Double>> weekly = TimeSeries.fill(Period.ofWeeks(1), series);

            assertThat("Wrong daily size for " + days, daily.size(), Matchers.equalTo(days + 1));
            assertThat("Wrong weekly size for " + days, weekly.size(), Matchers.equalTo(days / 7 + 1));
            for (int i = 1; i < daily.size(); i++) {
                double gap = daily.get(i).left() - daily.get(i - 1).left();
                assertThat("Points should be one day apart", gap, Matchers.equalTo((double) Duration.ofDays(1).toMillis()));
            }
        }
    }

    @Test
    public void testEmptySeries() {
        assertThat("Empty series stays empty", TimeSeries.fill(Period.ofDays(1), Collections.emptyList()), Matchers.empty());
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> TimeSeries.fill(Period.ZERO, Collections.singletonList(Pair.of(0.0, 1.0))));
    }
}
