package org.scharp.cif;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link Column}. */
public class ColumnTest {

    @Test
    void testStringColumn() {
        Column column = Column.ofStrings("a", ".", "c");
        assertEquals(ValueType.STRING, column.type());
        assertEquals(3, column.size());
        assertArrayEquals(new String[] { "a", ".", "c" }, column.strings());
        assertArrayEquals(new long[0], column.ints());
        assertArrayEquals(new double[0], column.floats());
        assertEquals(Value.of("."), column.get(1));

        // A "." in a string column is just text.
        assertFalse(column.isPlaceholder(1));
        assertNull(column.placeholder(1));

        assertEquals("STRING[a, ., c]", column.toString());
    }

    @Test
    void testIntColumn() {
        Column column = Column.ofInts(10, -20);
        assertEquals(ValueType.INTEGER, column.type());
        assertEquals(2, column.size());
        assertArrayEquals(new long[] { 10, -20 }, column.ints());
        assertArrayEquals(new double[] { 10.0, -20.0 }, column.floats());
        assertArrayEquals(new String[] { "10", "-20" }, column.strings());
        assertEquals(Value.of(-20), column.get(1));
        assertFalse(column.isPlaceholder(0));
    }

    @Test
    void testFloatColumn() {
        Column column = Column.ofFloats(1.5, 3);
        assertEquals(ValueType.FLOAT, column.type());
        assertEquals(2, column.size());
        assertArrayEquals(new double[] { 1.5, 3.0 }, column.floats());
        assertArrayEquals(new long[0], column.ints());
        assertArrayEquals(new String[] { "1.5", "3.0" }, column.strings());
        assertEquals(Value.of(3.0), column.get(1));
    }

    @Test
    void testColumnsAreImmutable() {
        String[] strings = { "a", "b" };
        Column stringColumn = Column.ofStrings(strings);
        strings[0] = "changed";
        stringColumn.strings()[1] = "changed";
        assertArrayEquals(new String[] { "a", "b" }, stringColumn.strings());

        long[] ints = { 1, 2 };
        Column intColumn = Column.ofInts(ints);
        ints[0] = 100;
        intColumn.ints()[1] = 100;
        assertArrayEquals(new long[] { 1, 2 }, intColumn.ints());

        double[] floats = { 1.5, 2.5 };
        Column floatColumn = Column.ofFloats(floats);
        floats[0] = 100;
        floatColumn.floats()[1] = 100;
        assertArrayEquals(new double[] { 1.5, 2.5 }, floatColumn.floats());
    }

    @Test
    void testEmptyColumn() {
        Exception exception = assertThrows(IllegalArgumentException.class, Column::ofStrings);
        assertEquals("a column must have at least one row", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, Column::ofInts);
        assertEquals("a column must have at least one row", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, Column::ofFloats);
        assertEquals("a column must have at least one row", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Column.valueOf(List.of()));
        assertEquals("a column must have at least one row", exception.getMessage());
    }

    @Test
    void testNullStrings() {
        Exception exception = assertThrows(NullPointerException.class, () -> Column.ofStrings((String[]) null));
        assertEquals("strings must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> Column.ofStrings("a", null));
        assertEquals("strings entry must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> Column.ofInts((long[]) null));
        assertEquals("ints must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> Column.ofFloats((double[]) null));
        assertEquals("floats must not be null", exception.getMessage());
    }

    @Test
    void testValueOfArrays() {
        assertEquals(Column.ofStrings("x", "y"), Column.valueOf(new String[] { "x", "y" }));
        assertEquals(Column.ofInts(1, 2), Column.valueOf(new long[] { 1, 2 }));
        assertEquals(Column.ofInts(1, 2), Column.valueOf(new int[] { 1, 2 }));
        assertEquals(Column.ofFloats(0.5, 2), Column.valueOf(new double[] { 0.5, 2 }));
        assertEquals(Column.ofFloats(0.5, 2), Column.valueOf(new float[] { 0.5f, 2f }));

        Exception exception = assertThrows(IllegalArgumentException.class,
            () -> Column.valueOf(new short[] { 1 }));
        assertEquals("Type 'short[]' cannot be represented as a CIF loop column.", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Column.valueOf("not an array"));
        assertEquals("Type 'java.lang.String' cannot be represented as a CIF loop column.", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> Column.valueOf(null));
        assertEquals("array must not be null", exception.getMessage());
    }

    @Test
    void testValueOfList() {
        assertEquals(Column.ofStrings("x", "y"), Column.valueOf(List.of("x", "y")));
        assertEquals(Column.ofInts(1, 2, 3), Column.valueOf(List.of(1, 2L, (short) 3)));
        assertEquals(Column.ofFloats(0.5, 2), Column.valueOf(List.of(0.5, 2f)));

        Exception exception = assertThrows(IllegalArgumentException.class, () -> Column.valueOf(List.of(1, 2.5)));
        assertEquals("a column cannot mix INTEGER and FLOAT cells", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Column.valueOf(List.of("a", 1)));
        assertEquals("a column cannot mix STRING and INTEGER cells", exception.getMessage());

        List<Object> withNull = new ArrayList<>(Arrays.asList("a", null));
        exception = assertThrows(NullPointerException.class, () -> Column.valueOf(withNull));
        assertEquals("object must not be null", exception.getMessage());
    }

    @Test
    void testParsedColumnWithPlaceholders() {
        Column column = Column.ofParsedInts(new long[] { 0, 5, 0 }, new String[] { "?", null, "." });
        assertTrue(column.isPlaceholder(0));
        assertFalse(column.isPlaceholder(1));
        assertEquals("?", column.placeholder(0));
        assertEquals(".", column.placeholder(2));
        assertArrayEquals(new String[] { "?", "5", "." }, column.strings());
        assertArrayEquals(new long[] { 0, 5, 0 }, column.ints());
        assertEquals(Value.of(0), column.get(0));

        // The placeholders are part of the column's identity.
        assertNotEquals(Column.ofInts(0, 5, 0), column);
        assertEquals(Column.ofParsedInts(new long[] { 0, 5, 0 }, new String[] { "?", null, "." }), column);
        assertEquals(
            Column.ofParsedInts(new long[] { 0, 5, 0 }, new String[] { "?", null, "." }).hashCode(),
            column.hashCode());

        Column floatColumn = Column.ofParsedFloats(new double[] { 0, 1.25 }, new String[] { ".", null });
        assertArrayEquals(new String[] { ".", "1.25" }, floatColumn.strings());
    }

    @Test
    void testRowIndexOutOfRange() {
        Column column = Column.ofInts(1, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> column.isPlaceholder(2));
        assertThrows(IndexOutOfBoundsException.class, () -> column.placeholder(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> column.get(2));
    }

    @Test
    void testEquals() {
        assertEquals(Column.ofStrings("a"), Column.ofStrings("a"));
        assertEquals(Column.ofStrings("a").hashCode(), Column.ofStrings("a").hashCode());
        assertEquals(Column.ofFloats(1.5), Column.ofFloats(1.5));

        assertNotEquals(Column.ofInts(1), Column.ofFloats(1));
        assertNotEquals(Column.ofInts(1), Column.ofStrings("1"));
        assertNotEquals(Column.ofInts(1), Column.ofInts(1, 1));
        assertNotEquals(Column.ofStrings("a"), "a");
    }
}
