package software.amazon.event.automaton;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Scratch frontier sets for nondeterministic traversal, reused from one traversal to the next. A buffer must only be
 * used by one traversal at a time.
 */
final class NfaBuffers {

    private Set<ByteState> current = new LinkedHashSet<>();
    private Set<ByteState> next = new LinkedHashSet<>();

    Set<ByteState> getCurrent() {
        return current;
    }

    Set<ByteState> getNext() {
        return next;
    }

    /**
     * Make the next frontier current, and clear the old current set to collect the one after.
     */
    void swap() {
        Set<ByteState> old = current;
        current = next;
        next = old;
        next.clear();
    }

    void reset() {
        current.clear();
        next.clear();
    }
}
