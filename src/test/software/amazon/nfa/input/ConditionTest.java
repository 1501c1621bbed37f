package software.amazon.nfa.input;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ConditionTest {

    @Test
    public void testSymbol() {
        Condition a = Condition.symbol('a');
        assertEquals(ConditionType.NORMAL, a.getType());
        assertTrue(a.matches('a'));
        assertFalse(a.matches('b'));
        assertFalse(a.matches('A'));
        assertEquals("a", a.toString());
        assertEquals(Condition.symbol('a'), a);
        assertEquals(Condition.symbol('a').hashCode(), a.hashCode());
        assertNotEquals(Condition.symbol('b'), a);
    }

    @Test
    public void testSymbolOutsideBasicPlane() {
        int smile = 0x1F600;
        Condition condition = Condition.symbol(smile);
        assertTrue(condition.matches(smile));
        assertEquals(new String(Character.toChars(smile)), condition.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSymbolInvalidCodePoint() {
        Condition.symbol(-5);
    }

    @Test
    public void testRange() {
        Condition range = Condition.range('a', 'z');
        assertEquals(ConditionType.RANGE, range.getType());
        assertTrue(range.matches('a'));
        assertTrue(range.matches('m'));
        assertTrue(range.matches('z'));
        assertFalse(range.matches('A'));
        assertFalse(range.matches('{'));
        assertEquals("a-z", range.toString());
        assertEquals(Condition.range('a', 'z'), range);
        assertNotEquals(Condition.range('a', 'y'), range);
    }

    @Test
    public void testReversedRange() {
        try {
            Condition.range('z', 'a');
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Range start 122 is after range end 97", e.getMessage());
        }
    }

    @Test
    public void testDigits() {
        Condition digit = Condition.special('d');
        Condition nonDigit = Condition.special('D');
        for (char c = '0'; c <= '9'; c++) {
            assertTrue(digit.matches(c));
            assertFalse(nonDigit.matches(c));
        }
        assertFalse(digit.matches('a'));
        assertTrue(nonDigit.matches('a'));
        assertFalse(digit.matches(0x0661)); // Arabic-Indic digit one
    }

    @Test
    public void testWordCharacters() {
        Condition word = Condition.special('w');
        Condition nonWord = Condition.special('W');
        for (int c : "azAZ09_".codePoints().toArray()) {
            assertTrue(word.matches(c));
            assertFalse(nonWord.matches(c));
        }
        for (int c : " -.!é".codePoints().toArray()) {
            assertFalse(word.matches(c));
            assertTrue(nonWord.matches(c));
        }
    }

    @Test
    public void testWhitespace() {
        Condition space = Condition.special('s');
        Condition nonSpace = Condition.special('S');
        for (int c : " \t\n\r\f\u000B".codePoints().toArray()) {
            assertTrue(space.matches(c));
            assertFalse(nonSpace.matches(c));
        }
        assertFalse(space.matches('x'));
        assertTrue(nonSpace.matches('x'));
    }

    @Test
    public void testAnyButLineTerminator() {
        Condition any = Condition.special('.');
        assertTrue(any.matches('a'));
        assertTrue(any.matches(' '));
        assertTrue(any.matches('\t'));
        assertTrue(any.matches(0x1F600));
        assertFalse(any.matches('\n'));
        assertFalse(any.matches('\r'));
        assertEquals("\\.", any.toString());
    }

    @Test
    public void testSpecialsAreInterned() {
        assertSame(Condition.special('d'), Condition.special('d'));
        assertNotEquals(Condition.special('d'), Condition.special('D'));
        assertEquals("\\w", Condition.special('w').toString());
    }

    @Test
    public void testUnknownSpecial() {
        try {
            Condition.special('q');
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Unknown special character class q", e.getMessage());
        }
    }

    @Test
    public void testCharacterClass() {
        Condition identifier = Condition.characterClass(false, Arrays.asList(
                Condition.range('a', 'z'), Condition.symbol('_'), Condition.special('d')));
        assertEquals(ConditionType.CLASS, identifier.getType());
        assertTrue(identifier.matches('q'));
        assertTrue(identifier.matches('_'));
        assertTrue(identifier.matches('7'));
        assertFalse(identifier.matches('Q'));
        assertEquals("[a-z_\\d]", identifier.toString());
    }

    @Test
    public void testNegatedCharacterClass() {
        Condition notQuote = Condition.characterClass(true, Arrays.asList(Condition.symbol('"')));
        assertFalse(notQuote.matches('"'));
        assertTrue(notQuote.matches('a'));
        assertTrue(notQuote.matches('\n'));
        assertEquals("[^\"]", notQuote.toString());
        assertNotEquals(Condition.characterClass(false, Arrays.asList(Condition.symbol('"'))), notQuote);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCharacterClassCannotHoldEpsilon() {
        Condition.characterClass(false, Arrays.asList(Condition.epsilon()));
    }

    @Test
    public void testEpsilon() {
        Condition epsilon = Condition.epsilon();
        assertTrue(epsilon.isEpsilon());
        assertFalse(Condition.symbol('e').isEpsilon());
        assertEquals(ConditionType.EPSILON, epsilon.getType());
        assertEquals("\\e", epsilon.toString());
        try {
            epsilon.matches('a');
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("Epsilon transitions do not consume input", e.getMessage());
        }
    }

    @Test
    public void testRenderingEscapesLineBreaksAndDelimiters() {
        assertEquals("\\n", Condition.symbol('\n').toString());
        assertEquals("\\r", Condition.symbol('\r').toString());
        assertEquals("\\\\", Condition.symbol('\\').toString());
        assertEquals("\\u0000", Condition.symbol(0).toString());
        assertEquals(" ", Condition.symbol(' ').toString());
        assertEquals("\\u0020-~", Condition.range(' ', '~').toString());
        assertEquals("\\--\\^", Condition.range('-', '^').toString());
        assertEquals("[^\\]\\u0020\\t\\s]", Condition.characterClass(true,
                Arrays.asList(Condition.symbol(']'), Condition.symbol(' '), Condition.symbol('\t'),
                        Condition.special('s'))).toString());
    }
}
