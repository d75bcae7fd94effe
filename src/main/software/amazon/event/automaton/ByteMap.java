package software.amazon.event.automaton;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static software.amazon.event.automaton.Constants.BYTE_CEILING;

/**
 * Maps byte values to ByteTransitions. Designed to perform well given the constraints that most ByteStates will have a
 * very small number of transitions, and that for support of wildcards and regexes, we need to efficiently represent the
 * condition where wide ranges of byte values (including *all* of them) will transition to a common next ByteState.
 *
 * Maps are only mutated while the automaton holding them is being built. Once a state is reachable from a published
 * automaton its map is never written again. The range structure is checked whenever it is rebuilt, so lookups trust it.
 */
final class ByteMap {

    /*
     * Each entry represents one or more byte values that share a transition. Null means no transition. The ceiling is
     * exclusive; all byte values below it and greater than or equal to the previous entry's ceiling (or zero for the
     * zeroth entry) map to the transition at the same index. The last ceiling is always BYTE_CEILING.
     */
    private int[] ceilings;
    private ByteTransition[] transitions;

    ByteMap() {
        ceilings = new int[] { BYTE_CEILING };
        transitions = new ByteTransition[] { null };
    }

    private ByteMap(int[] ceilings, ByteTransition[] transitions) {
        this.ceilings = ceilings;
        this.transitions = transitions;
    }

    /**
     * Build a map from explicit (byte, transition) pairs. Bytes not listed have no transition.
     *
     * @param utf8bytes Byte values in strictly ascending order.
     * @param steps The transition for each byte value.
     * @return A new map.
     */
    static ByteMap ofSteps(int[] utf8bytes, ByteTransition[] steps) {
        if (utf8bytes.length != steps.length) {
            throw new IllegalArgumentException("Got " + utf8bytes.length + " bytes but " + steps.length + " steps");
        }
        ByteTransition[] unpacked = new ByteTransition[BYTE_CEILING];
        int previous = -1;
        for (int i = 0; i < utf8bytes.length; i++) {
            int utf8byte = utf8bytes[i];
            if (utf8byte <= previous || utf8byte >= BYTE_CEILING) {
                throw new IllegalArgumentException("Byte 0x" + Integer.toHexString(utf8byte) + " out of order at " + i);
            }
            unpacked[utf8byte] = steps[i];
            previous = utf8byte;
        }
        ByteMap map = new ByteMap();
        map.pack(unpacked);
        return map;
    }

    /**
     * Build a map directly from compressed ranges.
     *
     * @param ceilings Strictly increasing exclusive ceilings, ending with BYTE_CEILING.
     * @param transitions The transition for each range.
     * @return A new map.
     */
    static ByteMap ofRanges(int[] ceilings, ByteTransition[] transitions) {
        ByteMap map = new ByteMap(Arrays.copyOf(ceilings, ceilings.length),
                Arrays.copyOf(transitions, transitions.length));
        map.checkStructure();
        return map;
    }

    @Nullable
    ByteTransition getTransition(final int utf8byte) {
        if (utf8byte < 0 || utf8byte >= BYTE_CEILING) {
            throw new IllegalStateException("Byte 0x" + Integer.toHexString(utf8byte) +
                    " is outside the transition table range");
        }
        for (int i = 0; i < ceilings.length; i++) {
            if (utf8byte < ceilings[i]) {
                return transitions[i];
            }
        }
        throw new IllegalStateException("Malformed ByteMap: no range covers byte 0x" + Integer.toHexString(utf8byte));
    }

    void putTransition(final int utf8byte, @Nullable final ByteTransition transition) {
        ByteTransition[] unpacked = unpack();
        unpacked[utf8byte] = transition;
        pack(unpacked);
    }

    /**
     * Point every byte value in [from, to) at the given transition.
     */
    void putTransitionForRange(final int from, final int to, @Nullable final ByteTransition transition) {
        ByteTransition[] unpacked = unpack();
        Arrays.fill(unpacked, from, to, transition);
        pack(unpacked);
    }

    void putTransitionForAllBytes(@Nullable final ByteTransition transition) {
        ceilings = new int[] { BYTE_CEILING };
        transitions = new ByteTransition[] { transition };
    }

    /**
     * Expand the ranges into one slot per byte value.
     *
     * @return A fresh array of length BYTE_CEILING.
     */
    ByteTransition[] unpack() {
        ByteTransition[] unpacked = new ByteTransition[BYTE_CEILING];
        int floor = 0;
        for (int i = 0; i < ceilings.length; i++) {
            Arrays.fill(unpacked, floor, ceilings[i], transitions[i]);
            floor = ceilings[i];
        }
        return unpacked;
    }

    /**
     * Replace the contents of this map with the compressed form of an unpacked array.
     */
    void pack(final ByteTransition[] unpacked) {
        if (unpacked.length != BYTE_CEILING) {
            throw new IllegalArgumentException("Unpacked table must have " + BYTE_CEILING + " slots");
        }
        int ranges = 1;
        for (int i = 1; i < BYTE_CEILING; i++) {
            if (!Objects.equals(unpacked[i], unpacked[i - 1])) {
                ranges++;
            }
        }
        int[] newCeilings = new int[ranges];
        ByteTransition[] newTransitions = new ByteTransition[ranges];
        int range = 0;
        for (int i = 1; i < BYTE_CEILING; i++) {
            if (!Objects.equals(unpacked[i], unpacked[i - 1])) {
                newCeilings[range] = i;
                newTransitions[range] = unpacked[i - 1];
                range++;
            }
        }
        newCeilings[range] = BYTE_CEILING;
        newTransitions[range] = unpacked[BYTE_CEILING - 1];
        ceilings = newCeilings;
        transitions = newTransitions;
        checkStructure();
    }

    ByteMap copy() {
        return new ByteMap(Arrays.copyOf(ceilings, ceilings.length), Arrays.copyOf(transitions, transitions.length));
    }

    boolean isEmpty() {
        for (ByteTransition transition : transitions) {
            if (transition != null) {
                return false;
            }
        }
        return true;
    }

    int numberOfRanges() {
        return ceilings.length;
    }

    int ceilingAt(int index) {
        return ceilings[index];
    }

    @Nullable
    ByteTransition transitionAt(int index) {
        return transitions[index];
    }

    /**
     * Get the ceiling values contained in this map.
     *
     * @return Ceiling values, ascending.
     */
    int[] getCeilings() {
        return Arrays.copyOf(ceilings, ceilings.length);
    }

    /**
     * Get all non-null transitions contained in this map, whether they are single or compound transitions.
     *
     * @return All transitions contained in this map.
     */
    Set<ByteTransition> getTransitions() {
        Set<ByteTransition> result = new LinkedHashSet<>(transitions.length);
        for (ByteTransition transition : transitions) {
            if (transition != null) {
                result.add(transition);
            }
        }
        return result;
    }

    private void checkStructure() {
        if (ceilings.length == 0 || ceilings.length != transitions.length) {
            throw new IllegalStateException("Malformed ByteMap: " + ceilings.length + " ceilings for " +
                    transitions.length + " transitions");
        }
        if (ceilings[ceilings.length - 1] != BYTE_CEILING) {
            throw new IllegalStateException("Malformed ByteMap: last ceiling is 0x" +
                    Integer.toHexString(ceilings[ceilings.length - 1]));
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int floor = 0;
        for (int i = 0; i < ceilings.length; i++) {
            ByteTransition transition = transitions[i];
            if (transition != null) {
                sb.append(Integer.toHexString(floor));
                if (ceilings[i] - floor > 1) {
                    sb.append('-').append(Integer.toHexString(ceilings[i] - 1));
                }
                sb.append("->");
                StringBuilder targets = new StringBuilder();
                for (ByteState state : transition.expand()) {
                    targets.append(state.getSerial()).append(',');
                }
                targets.deleteCharAt(targets.length() - 1);
                sb.append(targets).append(" // ");
            }
            floor = ceilings[i];
        }
        return sb.toString();
    }
}
