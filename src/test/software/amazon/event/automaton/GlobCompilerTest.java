package software.amazon.event.automaton;

import org.junit.Test;
import software.amazon.event.automaton.input.ParseException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static software.amazon.event.automaton.AutomatonFixtures.acceptFor;
import static software.amazon.event.automaton.AutomatonFixtures.matches;
import static software.amazon.event.automaton.AutomatonFixtures.quoted;

public class GlobCompilerTest {

    private final FieldMatcher matcher = new FieldMatcher("glob");

    @Test
    public void testShellStyleLeadingWildcard() {
        ByteState start = shellStyle("*abc");
        assertMatches(start, "abc", "xabc", "abcabc", "ababc", "xyzabc");
        assertNoMatch(start, "abcx", "ab", "bc", "");
    }

    @Test
    public void testShellStyleWildcardAfterFirstCharacter() {
        ByteState start = shellStyle("a*bc");
        assertMatches(start, "abc", "axbc", "axybc", "abcbc", "abbc", "a*bc");
        assertNoMatch(start, "abd", "fooac", "ac", "bc", "abcx", "xabc");
    }

    @Test
    public void testShellStyleWildcardBeforeLastCharacter() {
        ByteState start = shellStyle("ab*c");
        assertMatches(start, "abc", "abxc", "abcc", "abccc");
        assertNoMatch(start, "ab", "abcd", "acbc");
    }

    @Test
    public void testShellStyleTrailingWildcardIsPrefix() {
        ByteState start = shellStyle("abc*");
        assertMatches(start, "abc", "abcd", "abc\"", "abcabc");
        assertNoMatch(start, "ab", "xabc", "abd");
    }

    @Test
    public void testShellStyleWithMultiByteCharacters() {
        ByteState start = shellStyle("é*ü");
        assertMatches(start, "éü", "é中ü", "éüü");
        assertNoMatch(start, "eü", "éu");
    }

    @Test
    public void testShellStyleIsNondeterministic() {
        assertTrue(AutomatonStats.of(shellStyle("a*bc")).isNondeterministic());
    }

    @Test
    public void testShellStyleRejectsSecondWildcard() {
        try {
            shellStyle("a*b*");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Shell-style pattern has a second wildcard at pos 4, only one is allowed", e.getMessage());
        }
    }

    @Test
    public void testWildcardWithSeveralWildcards() {
        ByteState start = wildcard("a*b*c");
        assertMatches(start, "abc", "aXbYc", "abbc", "abcbc", "a-b-c-c");
        assertNoMatch(start, "ab", "bc", "abcd", "acb");
    }

    @Test
    public void testWildcardAlone() {
        ByteState start = wildcard("*");
        assertMatches(start, "", "x", "anything at all", "\"");
        assertFalse(matches(start, "5"));
    }

    @Test
    public void testWildcardTrailingBeforeQuote() {
        ByteState start = wildcard("ab*");
        assertMatches(start, "ab", "abc", "ab\"");
        assertNoMatch(start, "a", "xab");
    }

    @Test
    public void testWildcardEscapes() {
        ByteState start = wildcard("a\\*b\\\\c*");
        assertMatches(start, "a*b\\c", "a*b\\cde");
        assertNoMatch(start, "axb\\c", "a*bc");
    }

    @Test
    public void testWildcardWithoutQuotesSpinsToTheEnd() {
        ByteState start = GlobCompiler.compileWildcard("12*", acceptFor(matcher));
        assertTrue(matches(start, "12"));
        assertTrue(matches(start, "12345"));
        assertFalse(matches(start, "13"));
    }

    @Test
    public void testWildcardRejectsConsecutiveWildcards() {
        try {
            wildcard("a**");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Consecutive wildcard characters at pos 2", e.getMessage());
        }
    }

    @Test
    public void testWildcardRejectsTrailingBackslash() {
        try {
            GlobCompiler.compileWildcard("ab\\", acceptFor(matcher));
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Invalid escape character at pos 2", e.getMessage());
        }
    }

    private ByteState shellStyle(String pattern) {
        return GlobCompiler.compileShellStyle(quoted(pattern), acceptFor(matcher));
    }

    private ByteState wildcard(String pattern) {
        return GlobCompiler.compileWildcard(quoted(pattern), acceptFor(matcher));
    }

    private static void assertMatches(ByteState start, String ... values) {
        for (String value : values) {
            assertTrue("should match " + value, matches(start, quoted(value)));
        }
    }

    private static void assertNoMatch(ByteState start, String ... values) {
        for (String value : values) {
            assertFalse("should not match " + value, matches(start, quoted(value)));
        }
    }
}
