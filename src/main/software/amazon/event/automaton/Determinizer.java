package software.amazon.event.automaton;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static software.amazon.event.automaton.Constants.BYTE_CEILING;

/**
 * Converts an NFA into an equivalent DFA by subset construction. Each DFA state stands for an epsilon-closed set of
 * NFA states; sets are interned by the sorted serials of their members, so the same set always yields the same DFA
 * state and construction terminates on cyclic inputs.
 *
 * A state with an epsilon edge to itself stays in the set across every byte, as it does in nondeterministic
 * traversal.
 */
final class Determinizer {

    private static final Logger LOG = LoggerFactory.getLogger(Determinizer.class);

    private final int maxStates;
    private final EpsilonClosure closure = new EpsilonClosure();
    private final Map<StateSetKey, ByteState> interned = new Object2ObjectOpenHashMap<>();
    private final Deque<Pending> pending = new ArrayDeque<>();

    Determinizer() {
        this(Integer.MAX_VALUE);
    }

    Determinizer(int maxStates) {
        this.maxStates = maxStates;
    }

    /**
     * Determinize the automaton starting at the given state.
     *
     * @param nfaStart Start state of the NFA.
     * @return Start state of the DFA, or null if it would need more than the configured number of states.
     */
    @Nullable
    ByteState determinize(ByteState nfaStart) {
        ByteState dfaStart = dfaStateFor(expand(Collections.singleton(nfaStart)));
        while (!pending.isEmpty()) {
            if (interned.size() > maxStates) {
                LOG.debug("Abandoning determinization at {} states, limit is {}", interned.size(), maxStates);
                return null;
            }
            Pending next = pending.pop();
            fill(next.ingredients, next.dfaState);
        }
        LOG.debug("Determinized automaton into {} states", interned.size());
        return dfaStart;
    }

    int getStateCount() {
        return interned.size();
    }

    private Set<ByteState> expand(Collection<ByteState> states) {
        Set<ByteState> expanded = new LinkedHashSet<>();
        for (ByteState state : states) {
            expanded.addAll(closure.closureOf(state));
        }
        return expanded;
    }

    private ByteState dfaStateFor(Set<ByteState> ingredients) {
        StateSetKey key = new StateSetKey(ingredients);
        ByteState dfaState = interned.get(key);
        if (dfaState == null) {
            dfaState = new ByteState();
            interned.put(key, dfaState);
            pending.push(new Pending(ingredients, dfaState));
        }
        return dfaState;
    }

    private void fill(Set<ByteState> ingredients, ByteState dfaState) {
        IntSortedSet allCeilings = new IntRBTreeSet();
        allCeilings.add(BYTE_CEILING);
        List<ByteState> persistent = new ArrayList<>();
        for (ByteState ingredient : ingredients) {
            dfaState.addFieldTransitions(ingredient.getFieldTransitions());
            ByteMap map = ingredient.getMap();
            for (int i = 0; i < map.numberOfRanges(); i++) {
                allCeilings.add(map.ceilingAt(i));
            }
            if (ingredient.hasSelfEpsilon()) {
                persistent.add(ingredient);
            }
        }

        int[] ceilings = allCeilings.toIntArray();
        ByteTransition[] transitions = new ByteTransition[ceilings.length];
        int floor = 0;
        for (int i = 0; i < ceilings.length; i++) {
            Set<ByteState> targets = new LinkedHashSet<>(persistent);
            for (ByteState ingredient : ingredients) {
                ByteTransition transition = ingredient.getTransition(floor);
                if (transition != null) {
                    transition.addStatesTo(targets);
                }
            }
            transitions[i] = targets.isEmpty() ? null : dfaStateFor(expand(targets));
            floor = ceilings[i];
        }
        ByteMap map = ByteMap.ofRanges(ceilings, transitions);
        map.pack(map.unpack());
        dfaState.setMap(map);
    }

    /**
     * Order-independent identity of a set of states, built from their serials.
     */
    private static final class StateSetKey {
        private final long[] serials;
        private final int hash;

        StateSetKey(Set<ByteState> states) {
            serials = new long[states.size()];
            int i = 0;
            for (ByteState state : states) {
                serials[i++] = state.getSerial();
            }
            Arrays.sort(serials);
            hash = Arrays.hashCode(serials);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StateSetKey && Arrays.equals(serials, ((StateSetKey) o).serials);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    private static final class Pending {
        private final Set<ByteState> ingredients;
        private final ByteState dfaState;

        Pending(Set<ByteState> ingredients, ByteState dfaState) {
            this.ingredients = ingredients;
            this.dfaState = dfaState;
        }
    }
}
