package software.amazon.event.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Matches a string value consisting of exactly one code point that falls in any of the given ranges.
 */
public class RuneRangePattern extends Patterns {

    private final List<RuneRange> ranges;

    RuneRangePattern(final List<RuneRange> ranges) {
        super(MatchType.RUNE_RANGE);
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
    }

    public List<RuneRange> getRanges() {
        return ranges;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        return ranges.equals(((RuneRangePattern) o).ranges);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + ranges.hashCode();
    }

    @Override
    public String toString() {
        return "RR:" + ranges + " (" + super.toString() + ")";
    }
}
