package software.amazon.event.automaton;

import java.util.HashSet;
import java.util.Set;

/**
 * Counts the structure reachable from a start state. Only reads the automaton.
 */
final class AutomatonStats {

    private final int stateCount;
    private final int epsilonCount;
    private final int maxOutDegree;
    private final boolean nondeterministic;

    private AutomatonStats(int stateCount, int epsilonCount, int maxOutDegree, boolean nondeterministic) {
        this.stateCount = stateCount;
        this.epsilonCount = epsilonCount;
        this.maxOutDegree = maxOutDegree;
        this.nondeterministic = nondeterministic;
    }

    static AutomatonStats of(ByteState start) {
        Set<ByteState> states = StateGraph.reachableStates(start);
        int epsilons = 0;
        int maxOutDegree = 0;
        boolean nondeterministic = false;
        for (ByteState state : states) {
            epsilons += state.getEpsilons().size() + (state.getSpinout() != null ? 1 : 0);
            nondeterministic |= state.hasEpsilonEdges();
            Set<ByteState> destinations = new HashSet<>();
            for (ByteTransition transition : state.getMap().getTransitions()) {
                nondeterministic |= transition.isCompound();
                destinations.addAll(transition.expand());
            }
            maxOutDegree = Math.max(maxOutDegree, destinations.size());
        }
        return new AutomatonStats(states.size(), epsilons, maxOutDegree, nondeterministic);
    }

    int getStateCount() {
        return stateCount;
    }

    int getEpsilonCount() {
        return epsilonCount;
    }

    /**
     * The most distinct states any single state's byte table leads to.
     */
    int getMaxOutDegree() {
        return maxOutDegree;
    }

    boolean isNondeterministic() {
        return nondeterministic;
    }

    @Override
    public String toString() {
        return "states=" + stateCount + " epsilons=" + epsilonCount + " maxOutDegree=" + maxOutDegree;
    }
}
