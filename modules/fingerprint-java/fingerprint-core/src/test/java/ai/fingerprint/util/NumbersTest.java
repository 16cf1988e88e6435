package ai.fingerprint.util;

import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;

class NumbersTest {

    @Test
    public void testSafeDivide() {
        assertThat("Division by zero should be missing", Numbers.safeDivide(10.0, 0.0), Matchers.nullValue());
        assertThat("Division by zero should be missing", Numbers.safeDivide(0.0, 0.0), Matchers.nullValue());
        assertThat("Wrong quotient", Numbers.safeDivide(10.0, 4.0), Matchers.equalTo(2.5));
        assertThat("Wrong quotient", Numbers.safeDivide(12.0, 2.0, 3.0), Matchers.equalTo(2.0));
        assertThat("Any zero denominator makes it missing", Numbers.safeDivide(12.0, 2.0, 0.0), Matchers.nullValue());
        assertThat("Missing numerator stays missing", Numbers.safeDivide(null, 2.0), Matchers.nullValue());
        assertThat("Missing denominator makes it missing", Numbers.safeDivide(2.0, (Double) null), Matchers.nullValue());
    }

    @Test
    public void testSafeDivideBoxedDenominator() {
        Double denominator = 4.0;
        Double missing = null;

        assertThat("Wrong quotient", Numbers.safeDivide(2.0, denominator), Matchers.equalTo(0.5));
        assertThat("Wrong quotient", Numbers.safeDivide(-1e12, Double.valueOf(1e12)), Matchers.equalTo(-1.0));
        assertThat("Zero denominator should be missing", Numbers.safeDivide(2.0, Double.valueOf(0)), Matchers.nullValue());
        assertThat("Missing denominator should be missing", Numbers.safeDivide(2.0, missing), Matchers.nullValue());
    }

    @Test
    public void testSafeDivideRequiresDenominator() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Numbers.safeDivide(1.0));
    }

    @Test
    public void testGrowth() {
        assertThat("Wrong growth", Numbers.growth(110.0, 100.0), Matchers.closeTo(0.1, 1e-9));
        assertThat("Wrong growth", Numbers.growth(50.0, 100.0), Matchers.closeTo(-0.5, 1e-9));
        assertThat("Growth from a negative baseline should flip sign", Numbers.growth(-90.0, -100.0), Matchers.closeTo(0.1, 1e-9));
        assertThat("Growth from a negative baseline should flip sign", Numbers.growth(-110.0, -100.0), Matchers.closeTo(-0.1, 1e-9));
        assertThat("Growth from zero should be missing", Numbers.growth(5.0, 0.0), Matchers.nullValue());
        assertThat("Growth from missing should be missing", Numbers.growth(5.0, null), Matchers.nullValue());
        assertThat("Growth to missing should be missing", Numbers.growth(null, 5.0), Matchers.nullValue());
    }

    @Test
    public void testOrderOfMagnitude() {
        assertThat("Wrong magnitude", Numbers.orderOfMagnitude(0), Matchers.equalTo(0L));
        assertThat("Wrong magnitude", Numbers.orderOfMagnitude(0.05), Matchers.equalTo(-2L));
        assertThat("Wrong magnitude", Numbers.orderOfMagnitude(1), Matchers.equalTo(0L));
        assertThat("Wrong magnitude", Numbers.orderOfMagnitude(123), Matchers.equalTo(2L));
        assertThat("Wrong magnitude", Numbers.orderOfMagnitude(-1500), Matchers.equalTo(3L));
    }

    @Test
    public void testRounding() {
        assertThat("Wrong floor", Numbers.floorTo(2.5, 7.0), Matchers.equalTo(5.0));
        assertThat("Wrong ceil", Numbers.ceilTo(2.5, 7.0), Matchers.equalTo(7.5));
        assertThat("Wrong ceil", Numbers.ceilTo(5, 10.0), Matchers.equalTo(10.0));
        assertThat("Wrong rounding", Numbers.roundToDecimals(5, 1 / 3.0), Matchers.equalTo(0.33333));
    }

    @Test
    public void testToDouble() {
        assertThat("Wrong conversion", Numbers.toDouble(3), Matchers.equalTo(3.0));
        assertThat("Wrong conversion", Numbers.toDouble(null), Matchers.nullValue());
        Assertions.assertThrows(ClassCastException.class, () -> Numbers.toDouble("3"));
    }
}
