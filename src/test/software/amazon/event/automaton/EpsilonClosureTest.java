package software.amazon.event.automaton;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class EpsilonClosureTest {

    private EpsilonClosure closure;

    @Before
    public void setup() {
        closure = new EpsilonClosure();
    }

    @Test
    public void testStateWithoutEpsilonsIsItsOwnClosure() {
        ByteState state = new ByteState();
        state.putTransition('a', new ByteState());
        assertEquals(Collections.singleton(state), closure.closureOf(state));
        assertEquals(0, closure.size());
    }

    @Test
    public void testPassThroughStatesAreLeftOut() {
        ByteState start = consuming();
        ByteState passThrough = new ByteState();
        ByteState end = consuming();
        start.addEpsilon(passThrough);
        passThrough.addEpsilon(end);

        Set<ByteState> result = closure.closureOf(start);
        assertEquals(new HashSet<>(Arrays.asList(start, end)), result);
        assertFalse(result.contains(passThrough));
    }

    @Test
    public void testAcceptingStateIsKept() {
        ByteState start = new ByteState();
        ByteState accept = AutomatonFixtures.acceptFor(new FieldMatcher("f"));
        start.addEpsilon(accept);
        assertEquals(Collections.singleton(accept), closure.closureOf(start));
    }

    @Test
    public void testSpinoutIsFollowed() {
        ByteState escape = consuming();
        ByteState spinner = consuming();
        escape.setSpinout(spinner);
        assertEquals(new HashSet<>(Arrays.asList(escape, spinner)), closure.closureOf(escape));
    }

    @Test
    public void testEpsilonCycleTerminates() {
        ByteState a = consuming();
        ByteState b = consuming();
        a.addEpsilon(b);
        b.addEpsilon(a);
        assertEquals(new HashSet<>(Arrays.asList(a, b)), closure.closureOf(a));
        assertEquals(new HashSet<>(Arrays.asList(a, b)), closure.closureOf(b));
    }

    @Test
    public void testClosureIsCached() {
        ByteState a = consuming();
        a.addEpsilon(consuming());
        Set<ByteState> first = closure.closureOf(a);
        assertSame(first, closure.closureOf(a));
        assertEquals(1, closure.size());
    }

    @Test
    public void testClosureOfMemberIsContainedInClosure() {
        ByteState a = consuming();
        ByteState b = consuming();
        ByteState c = consuming();
        ByteState d = new ByteState();
        ByteState e = consuming();
        a.addEpsilon(b);
        b.addEpsilon(c);
        b.addEpsilon(d);
        d.addEpsilon(e);
        c.setSpinout(a);

        Set<ByteState> ofA = closure.closureOf(a);
        for (ByteState member : ofA) {
            assertTrue(ofA.containsAll(closure.closureOf(member)));
        }
        assertEquals(new HashSet<>(Arrays.asList(a, b, c, e)), ofA);
    }

    private static ByteState consuming() {
        ByteState state = new ByteState();
        state.putTransition('x', new ByteState());
        return state;
    }
}
