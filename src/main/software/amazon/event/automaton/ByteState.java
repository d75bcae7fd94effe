package software.amazon.event.automaton;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Represents a state in a state machine and maps utf-8 bytes to transitions. A state may also carry epsilon edges to
 * other states, a spinout reference and the field matchers reached when a value ends here.
 *
 * States are written only while the automaton they belong to is being built. After publication they are read by any
 * number of threads and never mutated.
 */
@ThreadSafe
final class ByteState extends ByteTransition {

    private static final AtomicLong SERIALS = new AtomicLong();

    /* Stable identity used for memo tables and state-set keys, so results never depend on hash codes of addresses. */
    private final long serial = SERIALS.incrementAndGet();

    private ByteMap map;

    private List<ByteState> epsilons = Collections.emptyList();

    /* The loop state of a star. Followed like an epsilon edge, but kept apart so merging can treat loops cheaply. */
    private ByteState spinout;

    private Set<FieldMatcher> fieldTransitions = Collections.emptySet();

    ByteState() {
        this(new ByteMap());
    }

    ByteState(@Nonnull ByteMap map) {
        this.map = map;
    }

    long getSerial() {
        return serial;
    }

    @Override
    ByteState getNextByteState() {
        return this;
    }

    @Override
    Set<ByteState> expand() {
        return Collections.singleton(this);
    }

    @Override
    void addStatesTo(Collection<ByteState> states) {
        states.add(this);
    }

    /**
     * Returns the transition to which the given byte value is mapped, or {@code null} if this state contains no
     * transitions for the given byte value.
     *
     * @param utf8byte the byte value, between 0 and 0xF5 inclusive
     * @return the transition, or {@code null}
     */
    @Nullable
    ByteTransition getTransition(int utf8byte) {
        return map.getTransition(utf8byte);
    }

    /**
     * Associates the given transition with the given byte value, replacing any previous transition for it.
     *
     * @param utf8byte   the byte value
     * @param transition the transition, or {@code null} to remove
     */
    void putTransition(int utf8byte, @Nullable ByteTransition transition) {
        map.putTransition(utf8byte, transition);
    }

    void putTransitionForRange(int from, int to, @Nullable ByteTransition transition) {
        map.putTransitionForRange(from, to, transition);
    }

    void putTransitionForAllBytes(@Nullable ByteTransition transition) {
        map.putTransitionForAllBytes(transition);
    }

    ByteMap getMap() {
        return map;
    }

    void setMap(@Nonnull ByteMap map) {
        this.map = map;
    }

    List<ByteState> getEpsilons() {
        return epsilons;
    }

    void addEpsilon(@Nonnull ByteState target) {
        if (epsilons.isEmpty()) {
            epsilons = new ArrayList<>(2);
        }
        epsilons.add(target);
    }

    boolean hasEpsilons() {
        return !epsilons.isEmpty();
    }

    /**
     * A state with an epsilon edge to itself persists across every byte, in both traversal engines.
     */
    boolean hasSelfEpsilon() {
        for (ByteState epsilon : epsilons) {
            if (epsilon == this) {
                return true;
            }
        }
        return false;
    }

    @Nullable
    ByteState getSpinout() {
        return spinout;
    }

    void setSpinout(@Nullable ByteState spinout) {
        this.spinout = spinout;
    }

    /**
     * True when any edge can be followed without consuming a byte.
     */
    boolean hasEpsilonEdges() {
        return spinout != null || !epsilons.isEmpty();
    }

    Set<FieldMatcher> getFieldTransitions() {
        return fieldTransitions;
    }

    void addFieldTransition(@Nonnull FieldMatcher fieldMatcher) {
        addFieldTransitions(Collections.singleton(fieldMatcher));
    }

    void addFieldTransitions(@Nonnull Collection<FieldMatcher> fieldMatchers) {
        if (fieldMatchers.isEmpty()) {
            return;
        }
        if (fieldTransitions.isEmpty()) {
            fieldTransitions = new LinkedHashSet<>(fieldMatchers.size());
        }
        fieldTransitions.addAll(fieldMatchers);
    }

    /**
     * Returns {@code true} if this state can only be left through epsilon edges and accepts nothing itself.
     */
    boolean isEpsilonOnly() {
        return map.isEmpty() && fieldTransitions.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(serial);
    }

    @Override
    public String toString() {
        return "BS" + serial + ": " + map;
    }
}
