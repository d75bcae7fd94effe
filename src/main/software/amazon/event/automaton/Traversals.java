package software.amazon.event.automaton;

import java.util.LinkedHashSet;
import java.util.Set;

import static software.amazon.event.automaton.Constants.BYTE_CEILING;
import static software.amazon.event.automaton.Constants.VALUE_TERMINATOR;

/**
 * Runs a value, followed by the value terminator, through an automaton and collects the field matchers of every state
 * visited. Neither engine modifies the automaton, so both may run on any number of threads at once.
 *
 * A byte at or above 0xF6 cannot occur in valid UTF-8; meeting one ends the traversal as a dead end.
 */
final class Traversals {

    private Traversals() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * Traverse an automaton with at most one active state.
     *
     * @throws IllegalStateException if a byte leads to several states, which a deterministic automaton never does.
     */
    static Set<FieldMatcher> traverseDfa(ByteState start, byte[] value) {
        Set<FieldMatcher> result = new LinkedHashSet<>();
        ByteState state = start;
        for (int i = 0; i <= value.length; i++) {
            result.addAll(state.getFieldTransitions());
            int utf8byte = i < value.length ? value[i] & 0xFF : VALUE_TERMINATOR;
            if (utf8byte >= BYTE_CEILING) {
                return result;
            }
            ByteTransition transition = state.getTransition(utf8byte);
            if (transition == null) {
                return result;
            }
            state = transition.getNextByteState();
            if (state == null) {
                throw new IllegalStateException("Deterministic traversal met a transition to several states: " +
                        transition);
            }
        }
        result.addAll(state.getFieldTransitions());
        return result;
    }

    /**
     * Traverse an automaton with a frontier of active states. At each byte every frontier state is expanded to its
     * epsilon closure; the closure members' field matchers are collected and their transitions form the next
     * frontier. A closure member with an epsilon edge to itself is carried into the next frontier as well.
     */
    static Set<FieldMatcher> traverseNfa(ByteState start, byte[] value, EpsilonClosure closure, NfaBuffers buffers) {
        Set<FieldMatcher> result = new LinkedHashSet<>();
        buffers.reset();
        buffers.getCurrent().add(start);
        for (int i = 0; i <= value.length; i++) {
            int utf8byte = i < value.length ? value[i] & 0xFF : VALUE_TERMINATOR;
            Set<ByteState> next = buffers.getNext();
            for (ByteState state : buffers.getCurrent()) {
                for (ByteState member : closure.closureOf(state)) {
                    result.addAll(member.getFieldTransitions());
                    if (utf8byte >= BYTE_CEILING) {
                        continue;
                    }
                    ByteTransition transition = member.getTransition(utf8byte);
                    if (transition != null) {
                        transition.addStatesTo(next);
                    }
                    if (member.hasSelfEpsilon()) {
                        next.add(member);
                    }
                }
            }
            buffers.swap();
            if (buffers.getCurrent().isEmpty()) {
                return result;
            }
        }
        for (ByteState state : buffers.getCurrent()) {
            for (ByteState member : closure.closureOf(state)) {
                result.addAll(member.getFieldTransitions());
            }
        }
        buffers.reset();
        return result;
    }
}
