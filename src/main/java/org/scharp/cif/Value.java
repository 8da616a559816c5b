///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * The value of a single (non-loop) data item.
 * <p>
 * A value is exactly one of a string, a 64-bit integer, or a 64-bit floating point number, as given by
 * {@link #type()}.  The omitted ({@code .}) and missing ({@code ?}) markers are strings.
 * </p>
 * <p>
 * The projection methods {@link #stringValue()}, {@link #intValue()}, and {@link #floatValue()} never fail.  When the
 * value has a different type, they return a default instead: the empty string for a number projected to a string, and
 * zero for a string projected to a number.  If you would rather know about a mismatch, use {@link #asString()},
 * {@link #asInt()}, or {@link #asFloat()}, which return an empty optional.
 * </p>
 * <p>
 * Instances of this class are immutable.  This class supports {@code equals()} and {@code hashCode()} so that its
 * instances are suitable for use in a {@code HashMap}.
 * </p>
 */
public abstract class Value {

    private static final long NEGATIVE_ZERO_BITS = Double.doubleToRawLongBits(-0.0);

    // Only the nested classes can extend this class.
    private Value() {
    }

    /**
     * Creates a string value.
     *
     * @param string
     *     The value's text.
     *
     * @return A value whose type is {@link ValueType#STRING}.
     *
     * @throws NullPointerException
     *     if {@code string} is {@code null}.
     */
    public static Value of(String string) {
        ArgumentUtil.checkNotNull(string, "string");
        return new StringValue(string);
    }

    /**
     * Creates an integer value.
     *
     * @param number
     *     The value's number.
     *
     * @return A value whose type is {@link ValueType#INTEGER}.
     */
    public static Value of(long number) {
        return new IntValue(number);
    }

    /**
     * Creates a floating point value.
     *
     * @param number
     *     The value's number.
     *
     * @return A value whose type is {@link ValueType#FLOAT}.
     */
    public static Value of(double number) {
        return new FloatValue(number);
    }

    /**
     * Creates a value from an object whose type isn't known at compile time.
     * <p>
     * This is intended for building a document that is to be written.
     * </p>
     *
     * @param object
     *     A {@link String}, an integral {@link Number} ({@link Long}, {@link Integer}, {@link Short}, or {@link Byte}),
     *     or a floating point {@link Number} ({@link Double} or {@link Float}).
     *
     * @return A value of the corresponding type.
     *
     * @throws NullPointerException
     *     if {@code object} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code object} is any other type.
     */
    public static Value valueOf(Object object) {
        ArgumentUtil.checkNotNull(object, "object");
        if (object instanceof String) {
            return new StringValue((String) object);
        }
        if (object instanceof Long || object instanceof Integer || object instanceof Short || object instanceof Byte) {
            return new IntValue(((Number) object).longValue());
        }
        if (object instanceof Double || object instanceof Float) {
            return new FloatValue(((Number) object).doubleValue());
        }
        throw new IllegalArgumentException(
            "Type '" + object.getClass().getName() + "' cannot be represented as a CIF value.");
    }

    /**
     * Gets this value's type.
     *
     * @return This value's type.  This is never {@code null}.
     */
    public abstract ValueType type();

    /**
     * Gets this value as a string.
     *
     * @return The string, if this value's type is {@link ValueType#STRING}; the empty string, otherwise.
     */
    public abstract String stringValue();

    /**
     * Gets this value as an integer.
     *
     * @return The integer, if this value's type is {@link ValueType#INTEGER}; the number truncated toward zero, if this
     *     value's type is {@link ValueType#FLOAT}; 0, otherwise.
     */
    public abstract long intValue();

    /**
     * Gets this value as a floating point number.
     *
     * @return The number, if this value is numeric; 0, otherwise.
     */
    public abstract double floatValue();

    /**
     * Gets the underlying object so that it can be dispatched on with {@code instanceof}.
     *
     * @return A {@link String}, {@link Long}, or {@link Double}.  This is never {@code null}.
     */
    public abstract Object raw();

    /**
     * Gets this value as a string, if it is one.
     *
     * @return The string, or an empty optional if this value is not a {@link ValueType#STRING}.
     */
    public Optional<String> asString() {
        return Optional.empty();
    }

    /**
     * Gets this value as an integer, if it is one.
     *
     * @return The integer, or an empty optional if this value is not an {@link ValueType#INTEGER}.
     */
    public OptionalLong asInt() {
        return OptionalLong.empty();
    }

    /**
     * Gets this value as a floating point number, if it can be represented as one without loss.
     *
     * @return The number, or an empty optional if this value is a {@link ValueType#STRING}.
     */
    public OptionalDouble asFloat() {
        return OptionalDouble.empty();
    }

    /**
     * Gets a hash code for this value.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return This value's hash code.
     */
    @Override
    public int hashCode() {
        return Objects.hash(type(), raw());
    }

    /**
     * Determines if this value is equal to another object.
     * <p>
     * Two values are equal if they have the same type and the same underlying object.  An integer is never equal to a
     * floating point number, even if they are numerically equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this value.
     *
     * @return {@code true}, if this value is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Value otherValue)) {
            return false;
        }
        return type() == otherValue.type() && raw().equals(otherValue.raw());
    }

    /**
     * Gets this value as a string for debugging.  For string values, this is the string itself.  For numeric values,
     * this is the number as {@link CifWriter} would write it.
     *
     * @return A string representation of this value.
     */
    @Override
    public String toString() {
        return raw() instanceof String ? (String) raw() : formatNumber(raw());
    }

    static String formatInt(long number) {
        return Long.toString(number);
    }

    /**
     * Formats a floating point number as fixed-point text with the fewest digits that parse back to the same number.
     * The text always contains a decimal point so that it is read back as a float, not an integer.
     *
     * @param number
     *     A finite number.
     *
     * @return The formatted number.
     */
    static String formatFloat(double number) {
        if (!Double.isFinite(number)) {
            // There's no CIF syntax for these.  Callers that write must reject them first.
            return Double.toString(number);
        }
        if (Double.doubleToRawLongBits(number) == NEGATIVE_ZERO_BITS) {
            // BigDecimal has no negative zero.
            return "-0.0";
        }
        String text = BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
        return text.indexOf('.') < 0 ? text + ".0" : text;
    }

    private static String formatNumber(Object number) {
        return number instanceof Long ? formatInt((Long) number) : formatFloat((Double) number);
    }

    private static final class StringValue extends Value {
        private final String string;

        StringValue(String string) {
            this.string = string;
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }

        @Override
        public String stringValue() {
            return string;
        }

        @Override
        public long intValue() {
            return 0;
        }

        @Override
        public double floatValue() {
            return 0;
        }

        @Override
        public Object raw() {
            return string;
        }

        @Override
        public Optional<String> asString() {
            return Optional.of(string);
        }
    }

    private static final class IntValue extends Value {
        private final long number;

        IntValue(long number) {
            this.number = number;
        }

        @Override
        public ValueType type() {
            return ValueType.INTEGER;
        }

        @Override
        public String stringValue() {
            return "";
        }

        @Override
        public long intValue() {
            return number;
        }

        @Override
        public double floatValue() {
            return number;
        }

        @Override
        public Object raw() {
            return number;
        }

        @Override
        public OptionalLong asInt() {
            return OptionalLong.of(number);
        }

        @Override
        public OptionalDouble asFloat() {
            return OptionalDouble.of(number);
        }
    }

    private static final class FloatValue extends Value {
        private final double number;

        FloatValue(double number) {
            this.number = number;
        }

        @Override
        public ValueType type() {
            return ValueType.FLOAT;
        }

        @Override
        public String stringValue() {
            return "";
        }

        @Override
        public long intValue() {
            return (long) number;
        }

        @Override
        public double floatValue() {
            return number;
        }

        @Override
        public Object raw() {
            return number;
        }

        @Override
        public OptionalDouble asFloat() {
            return OptionalDouble.of(number);
        }
    }
}
