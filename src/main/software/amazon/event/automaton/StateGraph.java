package software.amazon.event.automaton;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks and copies automaton graphs. Every edge kind is followed: byte transitions, epsilons and spinouts.
 */
final class StateGraph {

    private StateGraph() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * Get every state reachable from the start state, the start state included.
     *
     * @param start The state to begin at.
     * @return Reachable states in breadth-first order.
     */
    static Set<ByteState> reachableStates(ByteState start) {
        Set<ByteState> seen = new LinkedHashSet<>();
        Deque<ByteState> queue = new ArrayDeque<>();
        seen.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            ByteState state = queue.poll();
            for (ByteTransition transition : state.getMap().getTransitions()) {
                for (ByteState next : transition.expand()) {
                    if (seen.add(next)) {
                        queue.add(next);
                    }
                }
            }
            for (ByteState epsilon : state.getEpsilons()) {
                if (seen.add(epsilon)) {
                    queue.add(epsilon);
                }
            }
            ByteState spinout = state.getSpinout();
            if (spinout != null && seen.add(spinout)) {
                queue.add(spinout);
            }
        }
        return seen;
    }

    /**
     * Copy the graph reachable from a template start state, substituting the replacement state wherever the template
     * leads to the placeholder. The template is only read.
     *
     * @param start The template's start state.
     * @param placeholder The template's exit, which must carry no edges of its own.
     * @param replacement The state the copy exits to.
     * @return The start state of the copy.
     */
    static ByteState copyReplacing(ByteState start, ByteState placeholder, ByteState replacement) {
        if (start == placeholder) {
            return replacement;
        }
        Set<ByteState> originals = reachableStates(start);
        Map<ByteState, ByteState> copies = new HashMap<>(originals.size() * 2);
        for (ByteState original : originals) {
            copies.put(original, original == placeholder ? replacement : new ByteState());
        }

        Map<ByteTransition, ByteTransition> copiedTransitions = new IdentityHashMap<>();
        for (ByteState original : originals) {
            if (original == placeholder) {
                continue;
            }
            ByteState copy = copies.get(original);
            ByteMap map = original.getMap();
            int[] ceilings = new int[map.numberOfRanges()];
            ByteTransition[] transitions = new ByteTransition[map.numberOfRanges()];
            for (int i = 0; i < ceilings.length; i++) {
                ceilings[i] = map.ceilingAt(i);
                ByteTransition transition = map.transitionAt(i);
                if (transition != null) {
                    transitions[i] = copiedTransitions.computeIfAbsent(transition, t -> copyTransition(t, copies));
                }
            }
            copy.setMap(ByteMap.ofRanges(ceilings, transitions));

            List<ByteState> epsilons = original.getEpsilons();
            for (ByteState epsilon : epsilons) {
                copy.addEpsilon(copies.get(epsilon));
            }
            if (original.getSpinout() != null) {
                copy.setSpinout(copies.get(original.getSpinout()));
            }
            copy.addFieldTransitions(original.getFieldTransitions());
        }
        return copies.get(start);
    }

    private static ByteTransition copyTransition(ByteTransition transition, Map<ByteState, ByteState> copies) {
        Set<ByteState> targets = new LinkedHashSet<>();
        for (ByteState state : transition.expand()) {
            targets.add(copies.get(state));
        }
        return CompoundByteTransition.coalesce(targets);
    }
}
