package software.amazon.event.automaton.input;

import software.amazon.event.automaton.RuneRange;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/**
 * An atom of a regexp with its repetition bounds. The atom is exactly one of: the dot, a set of rune ranges, or a
 * parenthesized subtree.
 */
public final class QuantifiedAtom {

    /**
     * Upper bound of {@code *}, {@code +} and {@code {m,}}.
     */
    public static final int UNBOUNDED = -1;

    private final boolean dot;
    private final List<RuneRange> runes;
    private final RegexpTree subtree;
    private final int min;
    private final int max;

    private QuantifiedAtom(boolean dot, List<RuneRange> runes, RegexpTree subtree, int min, int max) {
        this.dot = dot;
        this.runes = runes;
        this.subtree = subtree;
        this.min = min;
        this.max = max;
    }

    public static QuantifiedAtom dot(int min, int max) {
        return new QuantifiedAtom(true, Collections.emptyList(), null, min, max);
    }

    public static QuantifiedAtom runes(List<RuneRange> runes, int min, int max) {
        return new QuantifiedAtom(false, Collections.unmodifiableList(runes), null, min, max);
    }

    public static QuantifiedAtom subtree(RegexpTree subtree, int min, int max) {
        return new QuantifiedAtom(false, Collections.emptyList(), subtree, min, max);
    }

    QuantifiedAtom withBounds(int newMin, int newMax) {
        return new QuantifiedAtom(dot, runes, subtree, newMin, newMax);
    }

    public boolean isDot() {
        return dot;
    }

    public boolean isSubtree() {
        return subtree != null;
    }

    public List<RuneRange> getRunes() {
        return runes;
    }

    @Nullable
    public RegexpTree getSubtree() {
        return subtree;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public boolean isUnbounded() {
        return max == UNBOUNDED;
    }

    @Override
    public String toString() {
        String atom;
        if (dot) {
            atom = ".";
        } else if (subtree != null) {
            atom = "(" + subtree + ")";
        } else {
            atom = runes.toString();
        }
        if (min == 1 && max == 1) {
            return atom;
        }
        return atom + "{" + min + "," + (max == UNBOUNDED ? "" : String.valueOf(max)) + "}";
    }
}
