package software.amazon.event.automaton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Caches the automata of large rune ranges as templates ("shells") that exit to a placeholder state. A caller gets a
 * fresh copy whose exit is its own next state, so a template is never linked into, or mutated by, any automaton.
 *
 * Entries are built at most once per name and never removed. Lookups are safe from any thread.
 */
@ThreadSafe
final class RuneRangeShellCache {

    private static final Logger LOG = LoggerFactory.getLogger(RuneRangeShellCache.class);

    private final ConcurrentMap<String, Shell> shells = new ConcurrentHashMap<>();

    /**
     * Get a copy of the named template that exits to the given state, building the template on first use.
     *
     * @param name Stable name of the range set.
     * @param builder Builds the template given its placeholder exit.
     * @param next The state the copy exits to.
     * @return The start state of the copy.
     */
    ByteState instantiate(String name, Function<ByteState, ByteState> builder, ByteState next) {
        // computeIfAbsent runs the builder at most once per name
        Shell shell = shells.computeIfAbsent(name, key -> {
            ByteState placeholder = new ByteState();
            ByteState start = builder.apply(placeholder);
            LOG.debug("Built rune range shell {} with {} states", key, StateGraph.reachableStates(start).size());
            return new Shell(start, placeholder);
        });
        return StateGraph.copyReplacing(shell.start, shell.placeholder, next);
    }

    boolean contains(String name) {
        return shells.containsKey(name);
    }

    int size() {
        return shells.size();
    }

    private static final class Shell {
        private final ByteState start;
        private final ByteState placeholder;

        Shell(ByteState start, ByteState placeholder) {
            this.start = start;
            this.placeholder = placeholder;
        }
    }
}
