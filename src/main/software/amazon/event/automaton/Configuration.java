package software.amazon.event.automaton;

import software.amazon.event.automaton.input.RegexpParser;

import javax.annotation.concurrent.Immutable;

/**
 * Configuration for a ValueMatcher.
 */
@Immutable
public class Configuration {

    /**
     * When true, a nondeterministic automaton is converted to a DFA after each pattern addition, provided the DFA
     * stays within maxDfaStates. Matching then walks a single active state instead of a frontier.
     */
    private final boolean determinize;

    /**
     * The most DFA states a determinization may create before it is abandoned and the NFA is kept.
     */
    private final int maxDfaStates;

    /**
     * The largest bound accepted in a regexp range quantifier such as {@code {2,100}}.
     */
    private final int regexpQuantifierMax;

    private Configuration(boolean determinize, int maxDfaStates, int regexpQuantifierMax) {
        this.determinize = determinize;
        this.maxDfaStates = maxDfaStates;
        this.regexpQuantifierMax = regexpQuantifierMax;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isDeterminize() {
        return determinize;
    }

    public int getMaxDfaStates() {
        return maxDfaStates;
    }

    public int getRegexpQuantifierMax() {
        return regexpQuantifierMax;
    }

    public static class Builder {

        private boolean determinize = true;
        private int maxDfaStates = 10000;
        private int regexpQuantifierMax = RegexpParser.DEFAULT_QUANTIFIER_MAX;

        public Builder withDeterminization(boolean determinize) {
            this.determinize = determinize;
            return this;
        }

        public Builder withMaxDfaStates(int maxDfaStates) {
            if (maxDfaStates < 1) {
                throw new IllegalArgumentException("maxDfaStates must be positive, got " + maxDfaStates);
            }
            this.maxDfaStates = maxDfaStates;
            return this;
        }

        public Builder withRegexpQuantifierMax(int regexpQuantifierMax) {
            if (regexpQuantifierMax < 1) {
                throw new IllegalArgumentException("regexpQuantifierMax must be positive, got " + regexpQuantifierMax);
            }
            this.regexpQuantifierMax = regexpQuantifierMax;
            return this;
        }

        public Configuration build() {
            return new Configuration(determinize, maxDfaStates, regexpQuantifierMax);
        }
    }
}
