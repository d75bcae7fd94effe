package software.amazon.event.automaton;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static software.amazon.event.automaton.Constants.BYTE_CEILING;

/**
 * Builds an automaton accepting the union of two automata's languages by a byte-wise product over pairs of states.
 * Neither input is modified; merged states are new, except where both sides already lead to the same state, which is
 * reused as is.
 *
 * Each pair gets its merged state recorded before its transitions are filled in, so cycles in the inputs end in a
 * memo hit. Filling is driven from a work list rather than by recursion. A merger instance keeps its memo for its
 * lifetime; use a fresh one per merge of independent automata.
 *
 * <ul>
 *   <li>If either state has epsilon edges, the pair becomes a splice: a state with epsilons to both.</li>
 *   <li>Spinouts are merged once per pair of spinouts; a spinout on one side only is adopted directly.</li>
 *   <li>Otherwise, per byte, the destinations are merged pairwise and the table repacked.</li>
 * </ul>
 */
final class FaMerger {

    private final Map<StatePair, ByteState> memo = new Object2ObjectOpenHashMap<>();
    private final Deque<StatePair> pending = new ArrayDeque<>();

    ByteState merge(ByteState stateA, ByteState stateB) {
        ByteState merged = mergedStateFor(stateA, stateB);
        while (!pending.isEmpty()) {
            StatePair pair = pending.pop();
            fill(pair, memo.get(pair));
        }
        return merged;
    }

    int memoSize() {
        return memo.size();
    }

    private ByteState mergedStateFor(ByteState stateA, ByteState stateB) {
        if (stateA == stateB) {
            return stateA;
        }
        StatePair pair = new StatePair(stateA, stateB);
        ByteState merged = memo.get(pair);
        if (merged != null) {
            return merged;
        }
        merged = new ByteState();
        memo.put(pair, merged);
        if (stateA.hasEpsilons() || stateB.hasEpsilons()) {
            merged.addEpsilon(stateA);
            merged.addEpsilon(stateB);
        } else {
            pending.push(pair);
        }
        return merged;
    }

    private void fill(StatePair pair, ByteState merged) {
        ByteState stateA = pair.stateA;
        ByteState stateB = pair.stateB;
        merged.addFieldTransitions(stateA.getFieldTransitions());
        merged.addFieldTransitions(stateB.getFieldTransitions());

        ByteState spinoutA = stateA.getSpinout();
        ByteState spinoutB = stateB.getSpinout();
        if (spinoutA != null && spinoutB != null) {
            merged.setSpinout(mergedStateFor(spinoutA, spinoutB));
        } else {
            merged.setSpinout(spinoutA != null ? spinoutA : spinoutB);
        }

        ByteTransition[] unpackedA = stateA.getMap().unpack();
        ByteTransition[] unpackedB = stateB.getMap().unpack();
        ByteTransition[] combined = new ByteTransition[BYTE_CEILING];
        for (int i = 0; i < BYTE_CEILING; i++) {
            ByteTransition transitionA = unpackedA[i];
            ByteTransition transitionB = unpackedB[i];
            if (transitionA == null) {
                combined[i] = transitionB;
            } else if (transitionB == null || Objects.equals(transitionA, transitionB)) {
                combined[i] = transitionA;
            } else if (i > 0 && transitionA == unpackedA[i - 1] && transitionB == unpackedB[i - 1]) {
                combined[i] = combined[i - 1];
            } else {
                Set<ByteState> targets = new LinkedHashSet<>();
                for (ByteState nextA : transitionA.expand()) {
                    for (ByteState nextB : transitionB.expand()) {
                        targets.add(mergedStateFor(nextA, nextB));
                    }
                }
                combined[i] = CompoundByteTransition.coalesce(targets);
            }
        }
        merged.getMap().pack(combined);
    }

    private static final class StatePair {
        private final ByteState stateA;
        private final ByteState stateB;

        StatePair(ByteState stateA, ByteState stateB) {
            this.stateA = stateA;
            this.stateB = stateB;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof StatePair)) {
                return false;
            }
            StatePair other = (StatePair) o;
            return stateA == other.stateA && stateB == other.stateB;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(stateA.getSerial() * 31 + stateB.getSerial());
        }
    }
}
