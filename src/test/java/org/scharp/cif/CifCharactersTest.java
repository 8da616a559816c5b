package org.scharp.cif;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link CifCharacters}. */
public class CifCharactersTest {

    @Test
    void testCharacterClassesAreNested() {
        for (int c = 0; c < 0x100; c++) {
            if (CifCharacters.isOrdinaryChar(c)) {
                assertTrue(CifCharacters.isNonBlankChar(c), "ordinary but not non-blank: " + c);
            }
            if (CifCharacters.isNonBlankChar(c)) {
                assertTrue(CifCharacters.isPrintChar(c), "non-blank but not printable: " + c);
            }
        }
        assertFalse(CifCharacters.isPrintChar(CifCharacters.EOF));
    }

    @Test
    void testIsOrdinaryChar() {
        assertTrue(CifCharacters.isOrdinaryChar('a'));
        assertTrue(CifCharacters.isOrdinaryChar('Z'));
        assertTrue(CifCharacters.isOrdinaryChar('7'));
        assertTrue(CifCharacters.isOrdinaryChar('.'));
        assertTrue(CifCharacters.isOrdinaryChar('?'));
        assertTrue(CifCharacters.isOrdinaryChar('-'));
        assertTrue(CifCharacters.isOrdinaryChar('~'));

        // These can appear inside an unquoted value, but can't start one.
        assertFalse(CifCharacters.isOrdinaryChar('_'));
        assertFalse(CifCharacters.isOrdinaryChar('#'));
        assertFalse(CifCharacters.isOrdinaryChar('$'));
        assertFalse(CifCharacters.isOrdinaryChar('\''));
        assertFalse(CifCharacters.isOrdinaryChar('"'));
        assertFalse(CifCharacters.isOrdinaryChar(';'));
        assertFalse(CifCharacters.isOrdinaryChar('['));
        assertFalse(CifCharacters.isOrdinaryChar(']'));

        assertFalse(CifCharacters.isOrdinaryChar(' '));
        assertFalse(CifCharacters.isOrdinaryChar(CifCharacters.EOF));
    }

    @Test
    void testIsNonBlankChar() {
        assertTrue(CifCharacters.isNonBlankChar('_'));
        assertTrue(CifCharacters.isNonBlankChar(';'));
        assertTrue(CifCharacters.isNonBlankChar('\''));
        assertFalse(CifCharacters.isNonBlankChar(' '));
        assertFalse(CifCharacters.isNonBlankChar('\t'));
        assertFalse(CifCharacters.isNonBlankChar('\n'));
        assertFalse(CifCharacters.isNonBlankChar(0x7F));
        assertFalse(CifCharacters.isNonBlankChar('é'));
    }

    @Test
    void testIsPrintChar() {
        assertTrue(CifCharacters.isPrintChar(' '));
        assertTrue(CifCharacters.isPrintChar('\t'));
        assertFalse(CifCharacters.isPrintChar('\n'));
        assertFalse(CifCharacters.isPrintChar('\r'));
        assertFalse(CifCharacters.isPrintChar(0));
        assertFalse(CifCharacters.isPrintChar('é'));
    }

    @Test
    void testWhiteSpace() {
        assertTrue(CifCharacters.isWhiteSpace(' '));
        assertTrue(CifCharacters.isWhiteSpace('\t'));
        assertTrue(CifCharacters.isWhiteSpace('\n'));
        assertTrue(CifCharacters.isWhiteSpace('\r'));
        assertFalse(CifCharacters.isWhiteSpace('x'));
        assertFalse(CifCharacters.isWhiteSpace(CifCharacters.EOF));

        assertTrue(CifCharacters.isNewline('\n'));
        assertTrue(CifCharacters.isNewline('\r'));
        assertFalse(CifCharacters.isNewline(' '));
    }

    @Test
    void testDescribe() {
        assertEquals("EOF", CifCharacters.describe(CifCharacters.EOF));
        assertEquals("\\n", CifCharacters.describe('\n'));
        assertEquals("\\r", CifCharacters.describe('\r'));
        assertEquals("\\t", CifCharacters.describe('\t'));
        assertEquals("\\u0000", CifCharacters.describe(0));
        assertEquals("\\u007F", CifCharacters.describe(0x7F));
        assertEquals("x", CifCharacters.describe('x'));
        assertEquals(" ", CifCharacters.describe(' '));
    }
}
