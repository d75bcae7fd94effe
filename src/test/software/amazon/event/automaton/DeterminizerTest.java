package software.amazon.event.automaton;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static software.amazon.event.automaton.AutomatonFixtures.acceptFor;
import static software.amazon.event.automaton.AutomatonFixtures.quoted;
import static software.amazon.event.automaton.AutomatonFixtures.runDfa;
import static software.amazon.event.automaton.AutomatonFixtures.runNfa;

public class DeterminizerTest {

    private static final List<String> SAMPLES = Arrays.asList(
            "", "a", "ab", "abc", "xabc", "abcabc", "aXbYc", "abcd", "ccc", "aaab", "abab", "中abc", "a😀bc");

    private final FieldMatcher matcher = new FieldMatcher("d");
    private final RegexpCompiler regexpCompiler =
            new RegexpCompiler(new RuneRangeCompiler(new RuneRangeShellCache()), 100);

    @Test
    public void WHEN_GlobIsDeterminized_THEN_ResultIsDeterministicAndEquivalent() {
        assertEquivalent(GlobCompiler.compileShellStyle(quoted("*abc"), acceptFor(matcher)));
        assertEquivalent(GlobCompiler.compileWildcard(quoted("a*b*c"), acceptFor(matcher)));
    }

    @Test
    public void WHEN_RegexpIsDeterminized_THEN_ResultIsDeterministicAndEquivalent() {
        assertEquivalent(regexpCompiler.compile("(a|ab)(c|bcd)(d*)", acceptFor(matcher)));
        assertEquivalent(regexpCompiler.compile("(a*)*b", acceptFor(matcher)));
        assertEquivalent(regexpCompiler.compile(".*abc", acceptFor(matcher)));
        assertEquivalent(regexpCompiler.compile("(ab){2,}|c+", acceptFor(matcher)));
    }

    @Test
    public void WHEN_MergedPatternsAreDeterminized_THEN_EveryMatcherIsKept() {
        FieldMatcher other = new FieldMatcher("other");
        ByteState merged = new FaMerger().merge(
                GlobCompiler.compileShellStyle(quoted("a*"), acceptFor(matcher)),
                regexpCompiler.compile("[a-c]+", acceptFor(other)));
        assertEquivalent(merged);
        ByteState dfa = new Determinizer().determinize(merged);
        assertEquals(2, runDfa(dfa, quoted("abc")).size());
    }

    @Test
    public void WHEN_StateLimitIsExceeded_THEN_DeterminizationIsAbandoned() {
        ByteState nfa = regexpCompiler.compile(".*a.{6}", acceptFor(matcher));
        Determinizer determinizer = new Determinizer(8);
        assertNull(determinizer.determinize(nfa));
        assertTrue(determinizer.getStateCount() > 8);
    }

    @Test
    public void WHEN_StateLimitIsAmple_THEN_StateCountIsReported() {
        ByteState nfa = GlobCompiler.compileShellStyle(quoted("*abc"), acceptFor(matcher));
        Determinizer determinizer = new Determinizer(1000);
        ByteState dfa = determinizer.determinize(nfa);
        assertNotNull(dfa);
        int states = determinizer.getStateCount();
        assertTrue(states > 0 && states <= 1000);
        assertEquals(states, AutomatonStats.of(dfa).getStateCount());
    }

    @Test
    public void WHEN_StateHasEpsilonToItself_THEN_ItPersistsAcrossBytes() {
        ByteState loop = new ByteState();
        ByteState sawX = new ByteState();
        loop.addEpsilon(loop);
        loop.putTransition('x', sawX);
        sawX.putTransition(Constants.VALUE_TERMINATOR, acceptFor(matcher));

        ByteState dfa = new Determinizer().determinize(loop);
        for (String value : Arrays.asList("x", "yx", "zzx", "xx")) {
            assertFalse(value, runNfa(loop, value).isEmpty());
            assertFalse(value, runDfa(dfa, value).isEmpty());
        }
        for (String value : Arrays.asList("", "xy", "y")) {
            assertTrue(value, runNfa(loop, value).isEmpty());
            assertTrue(value, runDfa(dfa, value).isEmpty());
        }
    }

    private static void assertEquivalent(ByteState nfa) {
        ByteState dfa = new Determinizer().determinize(nfa);
        assertNotNull(dfa);
        assertFalse(AutomatonStats.of(dfa).isNondeterministic());
        for (String sample : SAMPLES) {
            String value = quoted(sample);
            assertEquals(sample, runNfa(nfa, value), runDfa(dfa, value));
        }
    }
}
