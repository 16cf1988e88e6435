package ai.fingerprint.temporal;

import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;

class PeriodicityTest {

    private static ZonedDateTime date(int year, int month, int day) {
        return ZonedDateTime.of(year, month, day, 12, 0, 0, 0, ZoneOffset.UTC);
    }

    @Test
    public void testQuarter() {
        assertThat("Wrong quarter", Periodicity.quarter(date(2020, 1, 1)), Matchers.equalTo(1));
        assertThat("Wrong quarter", Periodicity.quarter(date(2020, 3, 31)), Matchers.equalTo(1));
        assertThat("Wrong quarter", Periodicity.quarter(date(2020, 5, 10)), Matchers.equalTo(2));
        assertThat("Wrong quarter", Periodicity.quarter(date(2020, 12, 31)), Matchers.equalTo(4));
    }

    @Test
    public void testRoundToMonth() {
        assertThat("First half should round down",
            Periodicity.roundToMonth(date(2020, 1, 15)), Matchers.equalTo(ZonedDateTime.of(2020, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)));
        assertThat("Second half should round up",
            Periodicity.roundToMonth(date(2020, 1, 20)), Matchers.equalTo(ZonedDateTime.of(2020, 2, 1, 0, 0, 0, 0, ZoneOffset.UTC)));
        assertThat("December should round up to the next year",
            Periodicity.roundToMonth(date(2020, 12, 20)), Matchers.equalTo(ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)));
    }

    @Test
    public void testMonthFrequencies() {
        Map<Integer, Long> frequencies = Periodicity.monthFrequencies(date(2020, 1, 1), date(2021, 3, 1));

        assertThat("Every month should be seen", frequencies.keySet(), Matchers.contains(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12));
        assertThat("January seen twice", frequencies.get(1), Matchers.equalTo(2L));
        assertThat("March seen twice", frequencies.get(3), Matchers.equalTo(2L));
        assertThat("April seen once", frequencies.get(4), Matchers.equalTo(1L));
    }

    @Test
    public void testQuarterFrequencies() {
        Map<Integer, Long> frequencies = Periodicity.quarterFrequencies(date(2020, 1, 1), date(2020, 9, 1));

        // eight months round to three quarters, counted from the first one inclusive
        assertThat("Wrong frequencies", frequencies.keySet(), Matchers.contains(1, 2, 3, 4));
        assertThat("Wrong frequency", frequencies.get(1), Matchers.equalTo(1L));
        assertThat("Wrong frequency", frequencies.get(4), Matchers.equalTo(1L));
    }

    @Test
    public void testWeigh() {
        Map<Integer, Long> weights = new HashMap<>();
        weights.put(1, 2L);
        weights.put(2, 1L);
        List<List<Object>> rows = Arrays.asList(
            Arrays.<Object>asList(1, 0.5),
            Arrays.<Object>asList(2, 0.25),
            Arrays.<Object>asList(3, 0.25)
        );

        List<List<Object>> weighted = Periodicity.weigh(weights, rows);

        assertThat("Over-represented bucket should shrink", weighted.get(0), Matchers.<Object>contains(1, 0.25));
        assertThat("Baseline bucket should be kept", weighted.get(1), Matchers.<Object>contains(2, 0.25));
        assertThat("Bucket without weight should be kept", weighted.get(2), Matchers.<Object>contains(3, 0.25));
    }
}
