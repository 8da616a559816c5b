///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A table of data items that share the same rows, introduced with {@code loop_} in a CIF.
 * <p>
 * Each column is identified by its data tag (the name without the leading underscore, in lower case).  All columns
 * have the same number of rows.  Instances of this class are immutable.  They are created with a
 * {@link Loop.Builder}:
 * </p>
 * <pre>
 * Loop loop = Loop.builder().
 *     column("entity_poly_seq.entity_id", Column.ofInts(1, 1, 1)).
 *     column("entity_poly_seq.num", Column.ofInts(1, 2, 3)).
 *     column("entity_poly_seq.mon_id", Column.ofStrings("MET", "ALA", "GLY")).
 *     build();
 * </pre>
 */
public final class Loop {
    private final Map<String, Integer> columns;
    private final List<Column> values;

    /**
     * A builder class for {@link Loop}.
     */
    public final static class Builder {
        private final Map<String, Integer> columns;
        private final List<Column> values;

        /**
         * Creates a {@code Loop} builder with no columns.
         */
        private Builder() {
            columns = new LinkedHashMap<>();
            values = new ArrayList<>();
        }

        /**
         * Adds a column to the loop.  Columns are kept in the order in which they are added.
         *
         * @param tag
         *     The column's data tag, without the leading underscore.  This is converted to lower case.
         * @param column
         *     The column's cells.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code tag} or {@code column} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code tag} is empty or contains a character that is not allowed in a CIF name, if the loop already
         *     has a column with the same tag, or if {@code column} doesn't have the same number of rows as the columns
         *     that were already added.
         */
        public Builder column(String tag, Column column) {
            ArgumentUtil.checkName(tag, "tag");
            ArgumentUtil.checkNotNull(column, "column");

            String lowerCaseTag = tag.toLowerCase(Locale.ROOT);
            if (columns.containsKey(lowerCaseTag)) {
                throw new IllegalArgumentException("loop already has a column with tag \"" + lowerCaseTag + "\"");
            }
            if (!values.isEmpty() && values.get(0).size() != column.size()) {
                throw new IllegalArgumentException(
                    "column \"" + lowerCaseTag + "\" has " + column.size() + " rows but the loop has " +
                        values.get(0).size() + " rows");
            }

            columns.put(lowerCaseTag, values.size());
            values.add(column);
            return this;
        }

        /**
         * Builds the immutable {@code Loop} with the configured columns.
         *
         * @return A {@code Loop}
         *
         * @throws IllegalStateException
         *     if no column has been added.
         */
        public Loop build() {
            if (values.isEmpty()) {
                throw new IllegalStateException("a loop must have at least one column");
            }
            return new Loop(new LinkedHashMap<>(columns), new ArrayList<>(values));
        }
    }

    /**
     * Creates a new Loop builder with no columns.
     * <p>
     * At least one column must be added before invoking {@link Builder#build build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private Loop(Map<String, Integer> columns, List<Column> values) {
        this.columns = columns; // Builder ensures that the library client does not have a reference.
        this.values = values;
    }

    /**
     * Gets the mapping of the loop's data tags to their column index.
     * <p>
     * The returned map is not modifiable.  Its iteration order is the order of the columns.
     * </p>
     *
     * @return The column index of each tag.  This is never {@code null}.
     */
    public Map<String, Integer> columns() {
        return Collections.unmodifiableMap(columns);
    }

    /**
     * Gets the loop's columns.
     * <p>
     * The returned list is not modifiable.
     * </p>
     *
     * @return The columns, in order.  This is never {@code null}.
     */
    public List<Column> values() {
        return Collections.unmodifiableList(values);
    }

    /**
     * Gets the loop's data tags.
     *
     * @return A new list of the tags in column order.
     */
    public List<String> tags() {
        return new ArrayList<>(columns.keySet());
    }

    /**
     * Gets the column for a data tag.
     *
     * @param tag
     *     The data tag, without the leading underscore.  This is matched without regard to case.
     *
     * @return The column, or {@code null} if this loop has no column with the given tag.
     */
    public Column get(String tag) {
        int index = columnIndex(tag);
        return index < 0 ? null : values.get(index);
    }

    /**
     * Gets the index of a data tag's column.
     *
     * @param tag
     *     The data tag, without the leading underscore.  This is matched without regard to case.
     *
     * @return The zero-based column index, or -1 if this loop has no column with the given tag.
     */
    public int columnIndex(String tag) {
        ArgumentUtil.checkNotNull(tag, "tag");
        Integer index = columns.get(tag.toLowerCase(Locale.ROOT));
        return index == null ? -1 : index;
    }

    /**
     * @return The number of rows in each column.
     */
    public int rowCount() {
        return values.get(0).size();
    }

    /**
     * @return The number of columns.
     */
    public int columnCount() {
        return values.size();
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, values);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Loop otherLoop)) {
            return false;
        }
        // LinkedHashMap.equals() ignores order, so compare the tags as lists.
        return tags().equals(otherLoop.tags()) && values.equals(otherLoop.values);
    }

    @Override
    public String toString() {
        return "Loop" + tags();
    }
}
