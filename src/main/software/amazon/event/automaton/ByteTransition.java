package software.amazon.event.automaton;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Set;

/**
 * The destination of a byte in a {@link ByteMap}: either a single {@link ByteState} or, while an automaton is still
 * nondeterministic, a {@link CompoundByteTransition} naming several states that are entered simultaneously.
 */
abstract class ByteTransition {

    /**
     * Get the state this transition leads to when there is exactly one.
     *
     * @return The next state, or null if this transition leads to several states.
     */
    @Nullable
    abstract ByteState getNextByteState();

    /**
     * Get every state this transition leads to.
     *
     * @return A set of one or more states.
     */
    abstract Set<ByteState> expand();

    /**
     * Add every state this transition leads to into the given collection.
     */
    abstract void addStatesTo(Collection<ByteState> states);

    boolean isCompound() {
        return false;
    }
}
