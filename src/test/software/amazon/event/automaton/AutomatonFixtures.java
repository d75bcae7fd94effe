package software.amazon.event.automaton;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;

/**
 * Shared helpers for building and running automata in tests.
 */
final class AutomatonFixtures {

    private AutomatonFixtures() { }

    static ByteState acceptFor(FieldMatcher fieldMatcher) {
        ByteState accept = new ByteState();
        accept.addFieldTransition(fieldMatcher);
        return accept;
    }

    static String quoted(String value) {
        return "\"" + value + "\"";
    }

    static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    static Set<FieldMatcher> runNfa(ByteState start, String value) {
        return Traversals.traverseNfa(start, utf8(value), new EpsilonClosure(), new NfaBuffers());
    }

    static Set<FieldMatcher> runDfa(ByteState dfaStart, String value) {
        return Traversals.traverseDfa(dfaStart, utf8(value));
    }

    static ByteState determinize(ByteState start) {
        ByteState dfaStart = new Determinizer().determinize(start);
        assertNotNull(dfaStart);
        return dfaStart;
    }

    /**
     * Run a value through both the automaton itself and its determinized form, check both agree, and return the
     * result.
     */
    static Set<FieldMatcher> runBoth(ByteState start, String value) {
        Set<FieldMatcher> nfaResult = runNfa(start, value);
        Set<FieldMatcher> dfaResult = runDfa(determinize(start), value);
        assertEquals("engines disagree on " + value, nfaResult, dfaResult);
        return nfaResult;
    }

    static boolean matches(ByteState start, String value) {
        return !runBoth(start, value).isEmpty();
    }
}
