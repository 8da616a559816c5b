///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;

/**
 * One column of a loop, holding a value for each row.
 * <p>
 * Every cell in a column has the same type, as given by {@link #type()}.  When a loop is read, its type is inferred
 * from the cells that aren't the omitted ({@code .}) or missing ({@code ?}) markers.  How those markers are
 * represented in a numeric column depends on the {@link NumericPlaceholderMode} of the reader.
 * </p>
 * <p>
 * Instances of this class are immutable.  The arrays returned by the projection methods are copies, so modifying them
 * does not change the column.  This class supports {@code equals()} and {@code hashCode()} so that its instances are
 * suitable for use in a {@code HashMap}.
 * </p>
 */
public abstract class Column {

    private static final long[] NO_INTS = new long[0];
    private static final double[] NO_FLOATS = new double[0];

    /**
     * For each row, the placeholder marker ({@code "."} or {@code "?"}) that the cell had when it was read, or
     * {@code null} if the cell held a real value.  This is {@code null} for columns without any retained markers.
     */
    private final String[] placeholders;

    // Only the nested classes can extend this class.
    private Column(String[] placeholders) {
        this.placeholders = placeholders;
    }

    /**
     * Creates a string column.
     *
     * @param strings
     *     The cells of the column.  This must not contain {@code null}.
     *
     * @return A column whose type is {@link ValueType#STRING}.
     *
     * @throws NullPointerException
     *     if {@code strings} is {@code null} or contains {@code null}.
     * @throws IllegalArgumentException
     *     if {@code strings} is empty.
     */
    public static Column ofStrings(String... strings) {
        ArgumentUtil.checkNotNull(strings, "strings");
        checkNotEmpty(strings.length);
        for (String string : strings) {
            ArgumentUtil.checkNotNull(string, "strings entry");
        }
        return new StringColumn(strings.clone());
    }

    /**
     * Creates an integer column.
     *
     * @param ints
     *     The cells of the column.
     *
     * @return A column whose type is {@link ValueType#INTEGER}.
     *
     * @throws NullPointerException
     *     if {@code ints} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code ints} is empty.
     */
    public static Column ofInts(long... ints) {
        ArgumentUtil.checkNotNull(ints, "ints");
        checkNotEmpty(ints.length);
        return new IntColumn(ints.clone(), null);
    }

    /**
     * Creates a floating point column.
     *
     * @param floats
     *     The cells of the column.
     *
     * @return A column whose type is {@link ValueType#FLOAT}.
     *
     * @throws NullPointerException
     *     if {@code floats} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code floats} is empty.
     */
    public static Column ofFloats(double... floats) {
        ArgumentUtil.checkNotNull(floats, "floats");
        checkNotEmpty(floats.length);
        return new FloatColumn(floats.clone(), null);
    }

    /**
     * Creates a column from an array whose type isn't known at compile time.
     *
     * @param array
     *     A {@code String[]}, {@code long[]}, {@code int[]}, {@code double[]}, or {@code float[]}, or a {@code List}
     *     whose elements are accepted by {@link Value#valueOf(Object)} and all have the same {@link ValueType}.
     *
     * @return A column of the corresponding type.
     *
     * @throws NullPointerException
     *     if {@code array} is {@code null} or contains {@code null}.
     * @throws IllegalArgumentException
     *     if {@code array} is empty, is any other type, or is a list with elements of different types.
     */
    public static Column valueOf(Object array) {
        ArgumentUtil.checkNotNull(array, "array");
        if (array instanceof List) {
            return ofValues((List<?>) array);
        }
        if (array instanceof String[]) {
            return ofStrings((String[]) array);
        }
        if (array instanceof long[]) {
            return ofInts((long[]) array);
        }
        if (array instanceof int[]) {
            return ofInts(Arrays.stream((int[]) array).asLongStream().toArray());
        }
        if (array instanceof double[]) {
            return ofFloats((double[]) array);
        }
        if (array instanceof float[]) {
            float[] floats = (float[]) array;
            double[] doubles = new double[floats.length];
            for (int i = 0; i < floats.length; i++) {
                doubles[i] = floats[i];
            }
            return ofFloats(doubles);
        }
        throw new IllegalArgumentException(
            "Type '" + array.getClass().getTypeName() + "' cannot be represented as a CIF loop column.");
    }

    private static Column ofValues(List<?> list) {
        checkNotEmpty(list.size());

        List<Value> values = new ArrayList<>(list.size());
        for (Object element : list) {
            Value value = Value.valueOf(element);
            if (!values.isEmpty() && values.get(0).type() != value.type()) {
                throw new IllegalArgumentException(
                    "a column cannot mix " + values.get(0).type() + " and " + value.type() + " cells");
            }
            values.add(value);
        }

        switch (values.get(0).type()) {
        case INTEGER:
            return new IntColumn(values.stream().mapToLong(Value::intValue).toArray(), null);
        case FLOAT:
            return new FloatColumn(values.stream().mapToDouble(Value::floatValue).toArray(), null);
        default:
            return new StringColumn(values.stream().map(Value::stringValue).toArray(String[]::new));
        }
    }

    static Column ofParsedStrings(String[] strings) {
        return new StringColumn(strings);
    }

    static Column ofParsedInts(long[] ints, String[] placeholders) {
        return new IntColumn(ints, placeholders);
    }

    static Column ofParsedFloats(double[] floats, String[] placeholders) {
        return new FloatColumn(floats, placeholders);
    }

    private static void checkNotEmpty(int length) {
        if (length == 0) {
            throw new IllegalArgumentException("a column must have at least one row");
        }
    }

    /**
     * Gets the type of every cell in this column.
     *
     * @return This column's type.  This is never {@code null}.
     */
    public abstract ValueType type();

    /**
     * Gets the number of rows in this column.
     *
     * @return The number of rows.  This is always positive.
     */
    public abstract int size();

    /**
     * Gets a single cell of this column.
     *
     * @param row
     *     The zero-based index of the row.
     *
     * @return The cell as a value of this column's type.  A retained placeholder in a numeric column is returned as
     *     its numeric stand-in (zero).
     *
     * @throws IndexOutOfBoundsException
     *     if {@code row} is not a valid index.
     */
    public abstract Value get(int row);

    /**
     * Gets this column's cells as text.
     * <p>
     * For a string column, this returns the strings themselves.  For a numeric column, this returns each number
     * formatted the way {@link CifWriter} would write it, or the retained placeholder marker.
     * </p>
     *
     * @return A new array with one entry for each row.
     */
    public abstract String[] strings();

    /**
     * Gets this column's cells as integers.
     *
     * @return A new array of the integers, if this is an {@link ValueType#INTEGER} column; an empty array, otherwise.
     */
    public long[] ints() {
        return NO_INTS;
    }

    /**
     * Gets this column's cells as floating point numbers.
     *
     * @return A new array of the numbers, if this is a numeric column; an empty array, otherwise.  The cells of an
     *     integer column are widened.
     */
    public double[] floats() {
        return NO_FLOATS;
    }

    /**
     * Determines whether a cell was an omitted or missing marker when the column was read.
     * <p>
     * This is only ever {@code true} for numeric columns read with {@link NumericPlaceholderMode#RETAIN}.  A string
     * column keeps the marker as its text, so {@code "."} and {@code "?"} can be seen directly in {@link #strings()}.
     * </p>
     *
     * @param row
     *     The zero-based index of the row.
     *
     * @return {@code true}, if the cell is a retained placeholder; {@code false}, otherwise.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code row} is not a valid index.
     */
    public boolean isPlaceholder(int row) {
        return placeholder(row) != null;
    }

    /**
     * Gets the marker that a cell had when the column was read.
     *
     * @param row
     *     The zero-based index of the row.
     *
     * @return {@code "."} or {@code "?"}, if the cell is a retained placeholder; {@code null}, otherwise.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code row} is not a valid index.
     */
    public String placeholder(int row) {
        Objects.checkIndex(row, size());
        return placeholders == null ? null : placeholders[row];
    }

    /**
     * Gets a hash code for this column.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return This column's hash code.
     */
    @Override
    public int hashCode() {
        return 31 * (31 * type().hashCode() + cellsHashCode()) + Arrays.hashCode(placeholders);
    }

    /**
     * Determines if this column is equal to another object.  Two columns are equal if they have the same type, the
     * same cells, and the same retained placeholders.
     *
     * @param other
     *     The object with which to compare this column.
     *
     * @return {@code true}, if this column is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Column otherColumn)) {
            return false;
        }
        return type() == otherColumn.type() &&
            cellsEqual(otherColumn) &&
            Arrays.equals(placeholders, otherColumn.placeholders);
    }

    @Override
    public String toString() {
        return type() + Arrays.toString(strings());
    }

    abstract int cellsHashCode();

    abstract boolean cellsEqual(Column other);

    String formatCell(int row, String number) {
        String marker = placeholders == null ? null : placeholders[row];
        return marker == null ? number : marker;
    }

    private static final class StringColumn extends Column {
        private final String[] strings;

        StringColumn(String[] strings) {
            super(null);
            this.strings = strings;
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }

        @Override
        public int size() {
            return strings.length;
        }

        @Override
        public Value get(int row) {
            return Value.of(strings[row]);
        }

        @Override
        public String[] strings() {
            return strings.clone();
        }

        @Override
        int cellsHashCode() {
            return Arrays.hashCode(strings);
        }

        @Override
        boolean cellsEqual(Column other) {
            return Arrays.equals(strings, ((StringColumn) other).strings);
        }
    }

    private static final class IntColumn extends Column {
        private final long[] ints;

        IntColumn(long[] ints, String[] placeholders) {
            super(placeholders);
            this.ints = ints;
        }

        @Override
        public ValueType type() {
            return ValueType.INTEGER;
        }

        @Override
        public int size() {
            return ints.length;
        }

        @Override
        public Value get(int row) {
            return Value.of(ints[row]);
        }

        @Override
        public String[] strings() {
            String[] strings = new String[ints.length];
            for (int i = 0; i < ints.length; i++) {
                strings[i] = formatCell(i, Value.formatInt(ints[i]));
            }
            return strings;
        }

        @Override
        public long[] ints() {
            return ints.clone();
        }

        @Override
        public double[] floats() {
            double[] floats = new double[ints.length];
            for (int i = 0; i < ints.length; i++) {
                floats[i] = ints[i];
            }
            return floats;
        }

        @Override
        int cellsHashCode() {
            return Arrays.hashCode(ints);
        }

        @Override
        boolean cellsEqual(Column other) {
            return Arrays.equals(ints, ((IntColumn) other).ints);
        }
    }

    private static final class FloatColumn extends Column {
        private final double[] floats;

        FloatColumn(double[] floats, String[] placeholders) {
            super(placeholders);
            this.floats = floats;
        }

        @Override
        public ValueType type() {
            return ValueType.FLOAT;
        }

        @Override
        public int size() {
            return floats.length;
        }

        @Override
        public Value get(int row) {
            return Value.of(floats[row]);
        }

        @Override
        public String[] strings() {
            String[] strings = new String[floats.length];
            for (int i = 0; i < floats.length; i++) {
                strings[i] = formatCell(i, Value.formatFloat(floats[i]));
            }
            return strings;
        }

        @Override
        public double[] floats() {
            return floats.clone();
        }

        @Override
        int cellsHashCode() {
            return Arrays.hashCode(floats);
        }

        @Override
        boolean cellsEqual(Column other) {
            return Arrays.equals(floats, ((FloatColumn) other).floats);
        }
    }
}
