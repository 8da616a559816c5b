///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

/**
 * How the omitted ({@code .}) and missing ({@code ?}) markers are treated when they appear in a loop column whose
 * other values are all numbers.
 * <p>
 * Such a column is read as an {@link ValueType#INTEGER} or {@link ValueType#FLOAT} column.  A marker doesn't change
 * the column's type, but there is no number that can faithfully represent it.
 * </p>
 */
public enum NumericPlaceholderMode {

    /**
     * Read each marker as the number 0 and forget that it was a marker.
     * <p>
     * This loses the difference between "no data" and "zero".  Writing the document again writes {@code 0}.
     * </p>
     */
    COERCE_TO_ZERO,

    /**
     * Read each marker as the number 0 in {@link Column#ints()} and {@link Column#floats()}, but remember which rows
     * held which marker.  This information is available from {@link Column#placeholder(int)} and is used by
     * {@link CifWriter} to write the marker instead of {@code 0}.
     */
    RETAIN,
}
