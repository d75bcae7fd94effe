package software.amazon.event.automaton.input;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class WildcardParserTest {

    private WildcardParser parser;

    @Before
    public void setup() {
        parser = new WildcardParser();
    }

    @Test
    public void testParseLiteralOnly() {
        assertArrayEquals(toArray(toByte('x'), toByte('y')), parser.parse("xy"));
    }

    @Test
    public void testParseWithLeadingAndTrailingWildcards() {
        assertArrayEquals(toArray(wildcard(), toByte('m'), wildcard()), parser.parse("*m*"));
    }

    @Test
    public void testParseWithSeveralWildcards() {
        assertArrayEquals(toArray(toByte('a'), wildcard(), toByte('b'), wildcard(), toByte('c')),
                parser.parse("a*b*c"));
    }

    @Test
    public void testParseWithEscapedAsterisk() {
        assertArrayEquals(toArray(toByte('*'), toByte('z')), parser.parse("\\*z"));
    }

    @Test
    public void testParseWithEscapedBackslashBeforeWildcard() {
        assertArrayEquals(toArray(toByte('q'), toByte('\\'), wildcard()), parser.parse("q\\\\*"));
    }

    @Test
    public void testParseWithEscapedAsteriskNextToWildcard() {
        assertArrayEquals(toArray(toByte('*'), wildcard()), parser.parse("\\**"));
    }

    @Test
    public void testParseMultiByteCharacterIsKeptAsBytes() {
        assertArrayEquals(toArray(toByte(0xC3), toByte(0xA9), wildcard()), parser.parse("é*"));
    }

    @Test
    public void testParseWithInvalidEscapeCharacter() {
        try {
            parser.parse("ab\\c");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Invalid escape character at pos 2", e.getMessage());
        }
    }

    @Test
    public void testParseWithTrailingBackslash() {
        try {
            parser.parse("abc\\");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Invalid escape character at pos 3", e.getMessage());
        }
    }

    @Test
    public void testParseWithConsecutiveWildcardCharacters() {
        try {
            parser.parse("x**y");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Consecutive wildcard characters at pos 1", e.getMessage());
        }
    }

    static InputCharacter[] toArray(InputCharacter ... chars) {
        return chars;
    }

    static InputByte toByte(int c) {
        return new InputByte(c);
    }

    static InputWildcard wildcard() {
        return InputWildcard.INSTANCE;
    }
}
