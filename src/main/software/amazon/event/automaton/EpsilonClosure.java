package software.amazon.event.automaton;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Computes and caches the epsilon closure of states: every state reachable by epsilon and spinout edges alone that
 * can consume a byte or accept a value. Pass-through states that only carry epsilon edges are left out.
 *
 * A cache belongs to one automaton. States never change after publication, so entries stay valid for as long as that
 * automaton is in use, and any number of threads may share the cache.
 */
@ThreadSafe
final class EpsilonClosure {

    private final ConcurrentMap<ByteState, Set<ByteState>> cache = new ConcurrentHashMap<>();

    Set<ByteState> closureOf(ByteState state) {
        if (!state.hasEpsilonEdges()) {
            return state.expand();
        }
        Set<ByteState> closure = cache.get(state);
        if (closure != null) {
            return closure;
        }
        closure = compute(state);
        // Two threads may race to compute the same closure; the results are equal, keep the first.
        Set<ByteState> prior = cache.putIfAbsent(state, closure);
        return prior != null ? prior : closure;
    }

    int size() {
        return cache.size();
    }

    private static Set<ByteState> compute(ByteState state) {
        Set<ByteState> closure = new LinkedHashSet<>();
        Set<ByteState> visited = new HashSet<>();
        Deque<ByteState> stack = new ArrayDeque<>();
        stack.push(state);
        while (!stack.isEmpty()) {
            ByteState current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            if (!current.isEpsilonOnly()) {
                closure.add(current);
            }
            for (ByteState epsilon : current.getEpsilons()) {
                if (!visited.contains(epsilon)) {
                    stack.push(epsilon);
                }
            }
            ByteState spinout = current.getSpinout();
            if (spinout != null && !visited.contains(spinout)) {
                stack.push(spinout);
            }
        }
        return Collections.unmodifiableSet(closure);
    }
}
