package dev.drtheo.lux.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {

    @Test
    public void onlyNilAndFalseAreFalsy() {
        assertFalse(Value.isTruthy(null));
        assertFalse(Value.isTruthy(false));
        assertTrue(Value.isTruthy(0.0));
        assertTrue(Value.isTruthy(""));
        assertTrue(Value.isTruthy(new Object()));
    }

    @Test
    public void numbersCompareByIeeeValue() {
        assertTrue(Value.isEqual(1.0, 1.0));
        assertTrue(Value.isEqual(0.0, -0.0));
        assertFalse(Value.isEqual(Double.NaN, Double.NaN));
    }

    @Test
    public void differentKindsAreNeverEqual() {
        assertFalse(Value.isEqual(null, false));
        assertFalse(Value.isEqual(1.0, "1"));
        assertFalse(Value.isEqual(true, 1.0));
    }

    @Test
    public void stringifyDropsIntegralFraction() {
        assertEquals("nil", Value.stringify(null));
        assertEquals("3", Value.stringify(3.0));
        assertEquals("-0.5", Value.stringify(-0.5));
        assertEquals("true", Value.stringify(true));
        assertEquals("text", Value.stringify("text"));
    }
}
