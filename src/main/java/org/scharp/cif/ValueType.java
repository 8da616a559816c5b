///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

/**
 * The type of a CIF {@link Value} or {@link Column}.
 */
public enum ValueType {
    /** Text, including the omitted ({@code .}) and missing ({@code ?}) markers when they are not in a numeric column. */
    STRING,

    /** A 64-bit signed integer. */
    INTEGER,

    /** A 64-bit floating point number. */
    FLOAT,
}
