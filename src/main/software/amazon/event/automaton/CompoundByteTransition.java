package software.amazon.event.automaton;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A ByteTransition that represents having taken multiple transitions simultaneously. Only nondeterministic automata
 * contain these; a determinized automaton maps every byte to at most one state.
 */
final class CompoundByteTransition extends ByteTransition {

    /**
     * The states that have all been simultaneously entered.
     */
    private final Set<ByteState> byteStates;

    private CompoundByteTransition(Set<ByteState> byteStates) {
        this.byteStates = Collections.unmodifiableSet(byteStates);
    }

    /**
     * Collapse a collection of states into the smallest transition that represents all of them.
     *
     * @param states The destination states.
     * @return null if there are no states, the state itself if there is one, otherwise a compound transition.
     */
    @Nullable
    static ByteTransition coalesce(Collection<ByteState> states) {
        Iterator<ByteState> iterator = states.iterator();
        if (!iterator.hasNext()) {
            return null;
        }
        ByteState first = iterator.next();
        if (!iterator.hasNext()) {
            return first;
        }
        Set<ByteState> set = new LinkedHashSet<>(states);
        if (set.size() == 1) {
            return first;
        }
        return new CompoundByteTransition(set);
    }

    /**
     * A compound transition has no single next state.
     */
    @Override
    @Nullable
    ByteState getNextByteState() {
        return null;
    }

    @Override
    Set<ByteState> expand() {
        return byteStates;
    }

    @Override
    void addStatesTo(Collection<ByteState> states) {
        states.addAll(byteStates);
    }

    @Override
    boolean isCompound() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        return byteStates.equals(((CompoundByteTransition) o).byteStates);
    }

    @Override
    public int hashCode() {
        return byteStates.hashCode();
    }

    @Override
    public String toString() {
        return "CBT: " + byteStates;
    }
}
