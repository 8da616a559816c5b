package org.scharp.cif;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ArgumentUtilTest {

    /** Tests for {@link ArgumentUtil#checkNotNull(Object, String)} */
    @Test
    void testCheckNotNull() {
        ArgumentUtil.checkNotNull("", "arg");
        ArgumentUtil.checkNotNull(1, "arg");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkNotNull(null, "myArg"));
        assertEquals("myArg must not be null", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkNotEmpty(String, String)} */
    @Test
    void testCheckNotEmpty() {
        ArgumentUtil.checkNotEmpty("x", "arg");
        ArgumentUtil.checkNotEmpty(" ", "arg");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkNotEmpty(null, "arg"));
        assertEquals("arg must not be null", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkNotEmpty("", "name"));
        assertEquals("name must not be empty", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkName(String, String)} */
    @Test
    void testCheckName() {
        // Typical names from mmCIF files.
        ArgumentUtil.checkName("1abc", "name");
        ArgumentUtil.checkName("entity_poly_seq.mon_id", "tag");
        ArgumentUtil.checkName("atom_site.Cartn_x", "tag");

        // Every non-blank character is allowed, including those that can't start an unquoted value.
        ArgumentUtil.checkName("a\"#$'_;[]", "name");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkName(null, "name"));
        assertEquals("name must not be null", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkName("", "tag"));
        assertEquals("tag must not be empty", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkName("a b", "tag"));
        assertEquals("tag \"a b\" contains the character ' ', which is not allowed in a CIF name",
            exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkName("a\nb", "name"));
        assertEquals("name \"a\nb\" contains the character '\\n', which is not allowed in a CIF name",
            exception.getMessage());

        final String sigma = "σ"; // GREEK SMALL LETTER SIGMA
        exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkName(sigma, "name"));
        assertEquals("name \"" + sigma + "\" contains the character '" + sigma + "', which is not allowed in a CIF name",
            exception.getMessage());
    }
}
