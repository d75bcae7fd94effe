package software.amazon.event.automaton;

import java.util.Collections;
import java.util.Set;

/**
 * Represents a denylist: any value matches if it's *not* in the anything-but set. Values are given the way they
 * appear in matched data, so string members keep their quotes.
 */
public class AnythingBut extends Patterns {

    private final Set<String> values;

    AnythingBut(final Set<String> values) {
        super(MatchType.ANYTHING_BUT);
        this.values = Collections.unmodifiableSet(values);
    }

    public Set<String> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        return values.equals(((AnythingBut) o).values);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        return "AB:" + values + " (" + super.toString() + ")";
    }
}
