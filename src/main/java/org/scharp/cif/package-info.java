///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library reads and writes Crystallographic Information Files (CIF), version 1.1.
 * </p>
 *
 * <p>
 * Reading a file is a single call:
 * </p>
 * <pre>
 * CifDocument document = CifReader.readDocument(Path.of("1abc.cif"));
 * DataBlock block = document.dataBlock("1abc");
 * String title = block.item("struct.title").stringValue();
 *
 * Loop sequence = block.loop("entity_poly_seq.mon_id");
 * String[] monomers = sequence.get("entity_poly_seq.mon_id").strings();
 * long[] positions = sequence.get("entity_poly_seq.num").ints();
 * </pre>
 *
 * <p>
 * See the documentation for {@link org.scharp.cif.CifDocument} and {@link org.scharp.cif.CifWriter} for sample code on
 * creating and writing a CIF.
 * </p>
 *
 * <h2>A CIF Primer for Java Programmers</h2>
 *
 * <p>
 * A CIF is a text file of name/value pairs, used mostly to describe crystal and macromolecular structures.  The pairs
 * are grouped into "data blocks", each introduced by a heading like {@code data_1ABC}.  A name (a "data tag") starts
 * with an underscore, like {@code _cell.length_a}, and is followed by its value.  Names are not case sensitive, so this
 * library converts all of them to lower case.
 * </p>
 *
 * <p>
 * Tabular data is written as a "loop".  The {@code loop_} keyword is followed by the names of the columns and then by
 * the values, row by row:
 * </p>
 * <pre>
 * loop_
 * _entity_poly_seq.entity_id
 * _entity_poly_seq.num
 * _entity_poly_seq.mon_id
 * 1 1 MET
 * 1 2 ALA
 * </pre>
 *
 * <p>
 * CIF has no type declarations.  A value is a number if it looks like one, so {@code 42} is an integer, {@code 1.5e3}
 * is a float, and {@code '42'} (quoted) is a string.  In a loop, every cell of a column gets the same type, chosen
 * from the cells' values.  The special values {@code .} ("omitted") and {@code ?} ("missing") may appear in any column;
 * see {@link org.scharp.cif.NumericPlaceholderMode} for how they are represented in numeric columns.
 * </p>
 *
 * <p>
 * A string that contains spaces must be quoted with {@code '} or {@code "}.  A string that spans lines is written as a
 * "text field", which starts and ends with a line that begins with {@code ;}.  {@link org.scharp.cif.CifWriter}
 * chooses the quoting automatically.
 * </p>
 *
 * <p>
 * A data block may also contain "save frames", which are named groups of items delimited by {@code save_name} and a
 * bare {@code save_}.  They are mostly used in dictionaries.
 * </p>
 *
 * <p>
 * CIF 1.1 is restricted to printable ASCII.  The reserved words {@code global_} and {@code stop_} are part of the
 * grammar but have no meaning in CIF, so this library rejects them.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * Reading stops at the first problem with a {@link org.scharp.cif.CifParseException} that gives the line number.  There
 * is no attempt to recover and return a partial document.
 * </p>
 * <p>
 * The builders of the document model check their arguments as soon as they are given (fail-fast) and throw
 * {@code IllegalArgumentException} for names that could not be written.  Writing a document throws a
 * {@link org.scharp.cif.CifWriteException} for values that CIF 1.1 cannot express, such as non-ASCII text.
 * </p>
 */
package org.scharp.cif;
