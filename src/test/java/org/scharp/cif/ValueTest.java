///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link Value}. */
public class ValueTest {

    @Test
    void testStringValue() {
        Value value = Value.of("ALA");
        assertEquals(ValueType.STRING, value.type());
        assertEquals("ALA", value.stringValue());
        assertEquals(0, value.intValue());
        assertEquals(0.0, value.floatValue());
        assertEquals("ALA", value.raw());
        assertEquals("ALA", value.toString());

        assertEquals(Optional.of("ALA"), value.asString());
        assertEquals(OptionalLong.empty(), value.asInt());
        assertEquals(OptionalDouble.empty(), value.asFloat());
    }

    @Test
    void testIntValue() {
        Value value = Value.of(-42);
        assertEquals(ValueType.INTEGER, value.type());
        assertEquals("", value.stringValue());
        assertEquals(-42, value.intValue());
        assertEquals(-42.0, value.floatValue());
        assertEquals(-42L, value.raw());
        assertEquals("-42", value.toString());

        assertEquals(Optional.empty(), value.asString());
        assertEquals(OptionalLong.of(-42), value.asInt());
        assertEquals(OptionalDouble.of(-42), value.asFloat());
    }

    @Test
    void testFloatValue() {
        Value value = Value.of(2.75);
        assertEquals(ValueType.FLOAT, value.type());
        assertEquals("", value.stringValue());
        assertEquals(2, value.intValue()); // truncated
        assertEquals(2.75, value.floatValue());
        assertEquals(2.75, value.raw());
        assertEquals("2.75", value.toString());

        assertEquals(Optional.empty(), value.asString());
        assertEquals(OptionalLong.empty(), value.asInt());
        assertEquals(OptionalDouble.of(2.75), value.asFloat());

        assertEquals(-3, Value.of(-3.9).intValue());
    }

    @Test
    void testNullString() {
        Exception exception = assertThrows(NullPointerException.class, () -> Value.of((String) null));
        assertEquals("string must not be null", exception.getMessage());
    }

    @Test
    void testValueOf() {
        assertEquals(Value.of("text"), Value.valueOf("text"));
        assertEquals(Value.of(7), Value.valueOf(7L));
        assertEquals(Value.of(7), Value.valueOf(7));
        assertEquals(Value.of(7), Value.valueOf((short) 7));
        assertEquals(Value.of(7), Value.valueOf((byte) 7));
        assertEquals(Value.of(0.5), Value.valueOf(0.5));
        assertEquals(Value.of(0.5), Value.valueOf(0.5f));

        Exception exception = assertThrows(NullPointerException.class, () -> Value.valueOf(null));
        assertEquals("object must not be null", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Value.valueOf(BigDecimal.ONE));
        assertEquals("Type 'java.math.BigDecimal' cannot be represented as a CIF value.", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Value.valueOf('c'));
        assertEquals("Type 'java.lang.Character' cannot be represented as a CIF value.", exception.getMessage());
    }

    @Test
    void testEquals() {
        assertEquals(Value.of("1"), Value.of("1"));
        assertEquals(Value.of("1").hashCode(), Value.of("1").hashCode());
        assertEquals(Value.of(1), Value.of(1));
        assertEquals(Value.of(1).hashCode(), Value.of(1).hashCode());
        assertEquals(Value.of(1.0), Value.of(1.0));
        assertEquals("-0.0", Value.of(-0.0).toString());

        // Values of different types are never equal.
        assertNotEquals(Value.of(1), Value.of(1.0));
        assertNotEquals(Value.of(1), Value.of("1"));
        assertNotEquals(Value.of(1.0), Value.of("1.0"));

        // Strings are case sensitive.
        assertNotEquals(Value.of("ALA"), Value.of("ala"));

        assertNotEquals(Value.of("x"), "x");
        assertNotEquals(Value.of("x"), null);
    }

    @Test
    void testFormatFloat() {
        assertEquals("1.0", Value.formatFloat(1));
        assertEquals("-0.5", Value.formatFloat(-0.5));
        assertEquals("100.0", Value.formatFloat(1e2));
        assertEquals("0.000001", Value.formatFloat(1e-6));
        assertEquals("12345678901234567000.0", Value.formatFloat(1.2345678901234567e19));
        assertEquals("0.1", Value.formatFloat(0.1));
        assertEquals("0.0", Value.formatFloat(0.0));
        assertEquals("-0.0", Value.formatFloat(-0.0));

        // Non-finite numbers have no CIF syntax.
        assertEquals("NaN", Value.formatFloat(Double.NaN));
        assertEquals("-Infinity", Value.formatFloat(Double.NEGATIVE_INFINITY));
    }

    @Test
    void testFormatInt() {
        assertEquals("0", Value.formatInt(0));
        assertEquals("-9223372036854775808", Value.formatInt(Long.MIN_VALUE));
    }
}
