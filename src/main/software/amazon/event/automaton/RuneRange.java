package software.amazon.event.automaton;

import javax.annotation.concurrent.Immutable;

/**
 * An inclusive interval of Unicode code points. Bounds are validated when the range is compiled, not here, so that a
 * malformed range surfaces as a {@link CompileException} from pattern addition.
 */
@Immutable
public final class RuneRange implements Comparable<RuneRange> {

    private final int lo;
    private final int hi;

    public RuneRange(int lo, int hi) {
        this.lo = lo;
        this.hi = hi;
    }

    public static RuneRange single(int codePoint) {
        return new RuneRange(codePoint, codePoint);
    }

    public int getLo() {
        return lo;
    }

    public int getHi() {
        return hi;
    }

    public boolean contains(int codePoint) {
        return codePoint >= lo && codePoint <= hi;
    }

    @Override
    public int compareTo(RuneRange other) {
        int byLo = Integer.compare(lo, other.lo);
        return byLo != 0 ? byLo : Integer.compare(hi, other.hi);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        RuneRange other = (RuneRange) o;
        return lo == other.lo && hi == other.hi;
    }

    @Override
    public int hashCode() {
        return 31 * lo + hi;
    }

    @Override
    public String toString() {
        return lo == hi ? "U+" + Integer.toHexString(lo) : "U+" + Integer.toHexString(lo) + "-U+" + Integer.toHexString(hi);
    }
}
