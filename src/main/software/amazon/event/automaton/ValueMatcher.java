package software.amazon.event.automaton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Matches the values of one field against every pattern added for it. Patterns are compiled and unioned into a
 * single automaton; matching a value returns the field matchers of the patterns it satisfies.
 *
 * A matcher holding one exact value compares values against it directly; an automaton is built once a second value
 * or any other kind of pattern is added. When numeric patterns are present, a value that reads as a number is matched
 * by its {@link ComparableNumber} form as well as by its text.
 *
 * Adding patterns is serialized. Each addition builds a complete new automaton off to the side, never touching states
 * reachable from the current one, and publishes it with a single reference swap. Matching reads whichever automaton
 * is published when it starts, without locking, from any number of threads.
 */
@ThreadSafe
public class ValueMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ValueMatcher.class);

    private static final ThreadLocal<NfaBuffers> BUFFERS = ThreadLocal.withInitial(NfaBuffers::new);

    private final Configuration configuration;
    private final ValuePatternCompiler compiler;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    // written only under the writer lock
    private int determinizations;

    public ValueMatcher() {
        this(Configuration.builder().build());
    }

    public ValueMatcher(@Nonnull Configuration configuration) {
        this(configuration, new RuneRangeShellCache());
    }

    ValueMatcher(Configuration configuration, RuneRangeShellCache shellCache) {
        this.configuration = configuration;
        this.compiler = new ValuePatternCompiler(configuration, shellCache);
    }

    /**
     * Add a pattern. Values matching it will yield the given field matcher.
     *
     * @throws CompileException if the pattern is invalid, in which case the matcher is unchanged.
     */
    public synchronized void addPattern(@Nonnull Patterns pattern, @Nonnull FieldMatcher fieldMatcher) {
        Snapshot current = snapshot.get();

        // a lone exact value is compared directly, without an automaton
        if (pattern.type() == MatchType.EXACT && current.start == null) {
            byte[] value = ((ValuePatterns) pattern).utf8Bytes();
            if (current.singletonValue == null || Arrays.equals(current.singletonValue, value)) {
                Set<FieldMatcher> matchers = new LinkedHashSet<>(current.singletonMatchers);
                matchers.add(fieldMatcher);
                snapshot.set(Snapshot.singleton(value, matchers));
                return;
            }
        }

        ByteState accept = new ByteState();
        accept.addFieldTransition(fieldMatcher);
        ByteState fragment = compiler.compile(pattern, accept);

        ByteState existing = current.start;
        if (current.singletonValue != null) {
            ByteState singletonAccept = new ByteState();
            singletonAccept.addFieldTransitions(current.singletonMatchers);
            existing = StringValueCompiler.compileExact(current.singletonValue, singletonAccept);
        }
        boolean nondeterministic = current.nondeterministic || AutomatonStats.of(fragment).isNondeterministic();
        ByteState start = existing == null ? fragment : new FaMerger().merge(existing, fragment);
        boolean hasNumbers = current.hasNumbers || pattern.type() == MatchType.NUMERIC_EQUALS;

        // the automaton only grows, so once it is past the cap it is not determinized again
        boolean dfaCapExceeded = current.dfaCapExceeded;
        ByteState dfaStart = null;
        if (nondeterministic && configuration.isDeterminize() && !dfaCapExceeded) {
            determinizations++;
            Determinizer determinizer = new Determinizer(configuration.getMaxDfaStates());
            dfaStart = determinizer.determinize(start);
            if (dfaStart == null) {
                dfaCapExceeded = true;
                LOG.warn("Automaton needs more than {} DFA states after adding {}, matching it nondeterministically " +
                        "from now on", configuration.getMaxDfaStates(), pattern);
            }
        }
        snapshot.set(new Snapshot(start, nondeterministic, dfaStart, dfaCapExceeded, hasNumbers));
    }

    /**
     * Match a value.
     *
     * @param value UTF-8 bytes of the value; a string value includes its enclosing quotes.
     * @return The field matchers of every pattern the value satisfies, possibly none.
     */
    public Set<FieldMatcher> transitionOn(@Nonnull byte[] value) {
        Snapshot current = snapshot.get();
        if (current.singletonValue != null) {
            return Arrays.equals(current.singletonValue, value) ? current.singletonMatchers
                    : Collections.<FieldMatcher>emptySet();
        }
        if (current.start == null) {
            return Collections.emptySet();
        }
        Set<FieldMatcher> result = traverse(current, value);
        if (current.hasNumbers) {
            byte[] comparable = ComparableNumber.generateOrNull(value);
            if (comparable != null) {
                result.addAll(traverse(current, comparable));
            }
        }
        return result;
    }

    public Set<FieldMatcher> transitionOn(@Nonnull String value) {
        return transitionOn(value.getBytes(StandardCharsets.UTF_8));
    }

    private static Set<FieldMatcher> traverse(Snapshot current, byte[] value) {
        if (!current.nondeterministic) {
            return Traversals.traverseDfa(current.start, value);
        }
        if (current.dfaStart != null) {
            return Traversals.traverseDfa(current.dfaStart, value);
        }
        return Traversals.traverseNfa(current.start, value, current.closure, BUFFERS.get());
    }

    public boolean isEmpty() {
        Snapshot current = snapshot.get();
        return current.start == null && current.singletonValue == null;
    }

    /**
     * True when matching walks a single active state, either because every pattern compiled deterministically or
     * because the automaton was determinized.
     */
    public boolean isDeterministic() {
        Snapshot current = snapshot.get();
        return !current.nondeterministic || current.dfaStart != null;
    }

    boolean isDfaCapExceeded() {
        return snapshot.get().dfaCapExceeded;
    }

    synchronized int getDeterminizationCount() {
        return determinizations;
    }

    @Nullable
    ByteState getStart() {
        return snapshot.get().start;
    }

    @Nullable
    ByteState getDfaStart() {
        return snapshot.get().dfaStart;
    }

    /**
     * One published automaton, or a single exact value. The epsilon closure cache belongs to it, so cached closures are
     * never applied to another automaton.
     */
    @Immutable
    private static final class Snapshot {

        private static final Snapshot EMPTY = new Snapshot(null, false, null, false, false);

        private final ByteState start;
        private final boolean nondeterministic;
        private final ByteState dfaStart;
        private final boolean dfaCapExceeded;
        private final boolean hasNumbers;
        private final byte[] singletonValue;
        private final Set<FieldMatcher> singletonMatchers;
        private final EpsilonClosure closure = new EpsilonClosure();

        Snapshot(ByteState start, boolean nondeterministic, ByteState dfaStart, boolean dfaCapExceeded,
                 boolean hasNumbers) {
            this(start, nondeterministic, dfaStart, dfaCapExceeded, hasNumbers, null,
                    Collections.<FieldMatcher>emptySet());
        }

        private Snapshot(ByteState start, boolean nondeterministic, ByteState dfaStart, boolean dfaCapExceeded,
                         boolean hasNumbers, byte[] singletonValue, Set<FieldMatcher> singletonMatchers) {
            this.start = start;
            this.nondeterministic = nondeterministic;
            this.dfaStart = dfaStart;
            this.dfaCapExceeded = dfaCapExceeded;
            this.hasNumbers = hasNumbers;
            this.singletonValue = singletonValue;
            this.singletonMatchers = singletonMatchers;
        }

        static Snapshot singleton(byte[] value, Set<FieldMatcher> matchers) {
            return new Snapshot(null, false, null, false, false, value, Collections.unmodifiableSet(matchers));
        }
    }

    @Override
    public String toString() {
        Snapshot current = snapshot.get();
        if (current.singletonValue != null) {
            return "ValueMatcher{singleton=" + new String(current.singletonValue, StandardCharsets.UTF_8) + "}";
        }
        return "ValueMatcher{" + (current.start == null ? "empty" : AutomatonStats.of(current.start).toString()) + "}";
    }
}
