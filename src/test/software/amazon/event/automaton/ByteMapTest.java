package software.amazon.event.automaton;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static software.amazon.event.automaton.Constants.BYTE_CEILING;

public class ByteMapTest {

    private ByteMap map;
    private ByteState trans1;
    private ByteState trans2;

    @Before
    public void setup() {
        map = new ByteMap();
        trans1 = new ByteState();
        trans2 = new ByteState();
    }

    @Test
    public void testNewMapIsEmpty() {
        assertTrue(map.isEmpty());
        assertEquals(1, map.numberOfRanges());
        assertNull(map.getTransition('a'));
        assertNull(map.getTransition(0xF5));
    }

    @Test
    public void testPutTransitionSplitsRanges() {
        map.putTransition('A', trans1);
        assertSame(trans1, map.getTransition('A'));
        assertNull(map.getTransition('A' - 1));
        assertNull(map.getTransition('A' + 1));
        assertArrayEquals(new int[] { 'A', 'A' + 1, BYTE_CEILING }, map.getCeilings());
    }

    @Test
    public void testAdjacentEqualTransitionsShareARange() {
        map.putTransition('A', trans1);
        map.putTransition('B', trans1);
        assertEquals(3, map.numberOfRanges());
        map.putTransition('C', trans2);
        assertEquals(4, map.numberOfRanges());
        assertSame(trans2, map.getTransition('C'));
    }

    @Test
    public void testPutTransitionForRange() {
        map.putTransitionForRange('0', '9' + 1, trans1);
        assertSame(trans1, map.getTransition('0'));
        assertSame(trans1, map.getTransition('5'));
        assertSame(trans1, map.getTransition('9'));
        assertNull(map.getTransition('9' + 1));
        assertEquals(3, map.numberOfRanges());
    }

    @Test
    public void testPutTransitionForAllBytes() {
        map.putTransition('x', trans2);
        map.putTransitionForAllBytes(trans1);
        assertEquals(1, map.numberOfRanges());
        assertSame(trans1, map.getTransition(0));
        assertSame(trans1, map.getTransition('x'));
        assertSame(trans1, map.getTransition(0xF5));
    }

    @Test
    public void testRemovingTransitionRepacks() {
        map.putTransition('q', trans1);
        map.putTransition('q', null);
        assertTrue(map.isEmpty());
        assertEquals(1, map.numberOfRanges());
    }

    @Test
    public void testEqualCompoundTransitionsShareARange() {
        map.putTransition('a', CompoundByteTransition.coalesce(Arrays.asList(trans1, trans2)));
        map.putTransition('b', CompoundByteTransition.coalesce(Arrays.asList(trans2, trans1)));
        assertEquals(3, map.numberOfRanges());
        assertEquals(1, map.getTransitions().size());
    }

    @Test
    public void testGetTransitionOutsideTableThrows() {
        try {
            map.getTransition(BYTE_CEILING);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("Byte 0xf6 is outside the transition table range", e.getMessage());
        }
        try {
            map.getTransition(-1);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("outside the transition table range"));
        }
    }

    @Test
    public void testOfSteps() {
        ByteMap fromSteps = ByteMap.ofSteps(new int[] { '"', 'a', 'b' }, new ByteTransition[] { trans1, trans2, trans2 });
        assertSame(trans1, fromSteps.getTransition('"'));
        assertSame(trans2, fromSteps.getTransition('a'));
        assertSame(trans2, fromSteps.getTransition('b'));
        assertNull(fromSteps.getTransition('c'));
        assertEquals(5, fromSteps.numberOfRanges());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOfStepsRejectsUnorderedBytes() {
        ByteMap.ofSteps(new int[] { 'b', 'a' }, new ByteTransition[] { trans1, trans2 });
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPackRejectsWrongSize() {
        map.pack(new ByteTransition[BYTE_CEILING - 1]);
    }

    @Test
    public void testRepackedMapKeepsFinalCeiling() {
        map.putTransitionForRange(0xF0, BYTE_CEILING, trans1);
        map.putTransition(0xF5, trans2);
        int[] ceilings = map.getCeilings();
        assertEquals(BYTE_CEILING, ceilings[ceilings.length - 1]);
        assertSame(trans2, map.getTransition(0xF5));
        assertSame(trans1, map.getTransition(0xF4));
    }

    @Test(expected = IllegalStateException.class)
    public void testOfRangesRejectsShortTable() {
        ByteMap.ofRanges(new int[] { 'a', 0xF0 }, new ByteTransition[] { null, trans1 });
    }

    @Test
    public void testOfRanges() {
        ByteMap fromRanges = ByteMap.ofRanges(new int[] { 'a', 'z' + 1, BYTE_CEILING },
                new ByteTransition[] { null, trans1, null });
        assertSame(trans1, fromRanges.getTransition('m'));
        assertNull(fromRanges.getTransition('A'));
        assertSame(trans1, fromRanges.transitionAt(1));
        assertEquals('z' + 1, fromRanges.ceilingAt(1));
    }

    @Test
    public void testCopyIsIndependent() {
        map.putTransition('a', trans1);
        ByteMap copy = map.copy();
        copy.putTransition('b', trans2);
        assertNull(map.getTransition('b'));
        assertSame(trans2, copy.getTransition('b'));
        assertSame(trans1, copy.getTransition('a'));
    }

    @Test
    public void testUnpackThenPackRoundTrips() {
        map.putTransitionForRange(0x80, 0xC0, trans1);
        map.putTransition('x', trans2);
        int[] ceilings = map.getCeilings();
        ByteTransition[] unpacked = map.unpack();
        assertEquals(BYTE_CEILING, unpacked.length);
        map.pack(unpacked);
        assertArrayEquals(ceilings, map.getCeilings());
    }

    @Test
    public void testGetTransitionsSkipsEmptyRanges() {
        map.putTransition('a', trans1);
        map.putTransition('c', trans1);
        map.putTransition('e', trans2);
        assertEquals(2, map.getTransitions().size());
        assertTrue(map.getTransitions().contains(trans1));
        assertFalse(map.getTransitions().contains(null));
    }
}
