package software.amazon.event.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static software.amazon.event.automaton.Constants.MAX_CODE_POINT;
import static software.amazon.event.automaton.Constants.MAX_SURROGATE;
import static software.amazon.event.automaton.Constants.MIN_SURROGATE;
import static software.amazon.event.automaton.Constants.QUOTE_BYTE;
import static software.amazon.event.automaton.Constants.VALUE_TERMINATOR;

/**
 * Compiles sets of rune ranges into byte tries. Ranges covering many code points are built once as templates in a
 * {@link RuneRangeShellCache} and copied on later use.
 */
final class RuneRangeCompiler {

    /* Range sets with more code points than this are cached. */
    static final int SHELL_CACHE_THRESHOLD = 1000;

    private final RuneRangeShellCache shellCache;

    RuneRangeCompiler(RuneRangeShellCache shellCache) {
        this.shellCache = shellCache;
    }

    /**
     * Compile a pattern matching a quoted string holding exactly one code point from the ranges.
     */
    ByteState compile(List<RuneRange> ranges, ByteState accept) {
        ByteState terminal = new ByteState();
        terminal.putTransition(VALUE_TERMINATOR, accept);
        ByteState closeQuote = new ByteState();
        closeQuote.putTransition(QUOTE_BYTE, terminal);
        ByteState start = new ByteState();
        start.putTransition(QUOTE_BYTE, makeRuneRangeFa(ranges, closeQuote));
        return start;
    }

    /**
     * Build the fragment matching one code point from the ranges, exiting to next.
     *
     * @throws CompileException if a range is malformed.
     */
    ByteState makeRuneRangeFa(List<RuneRange> ranges, ByteState next) {
        List<RuneRange> simplified = simplify(ranges);
        long size = 0;
        for (RuneRange range : simplified) {
            size += (long) range.getHi() - range.getLo() + 1;
        }
        if (size > SHELL_CACHE_THRESHOLD) {
            return shellCache.instantiate(nameOf(simplified), placeholder -> buildTrie(simplified, placeholder), next);
        }
        return buildTrie(simplified, next);
    }

    private static ByteState buildTrie(List<RuneRange> ranges, ByteState next) {
        Utf8PathBuilder builder = new Utf8PathBuilder(new ByteState(), next);
        for (RuneRange range : ranges) {
            for (int codePoint = range.getLo(); codePoint <= range.getHi(); codePoint++) {
                if (codePoint >= MIN_SURROGATE && codePoint <= MAX_SURROGATE) {
                    // surrogates have no UTF-8 encoding
                    codePoint = MAX_SURROGATE;
                    continue;
                }
                builder.addCodePoint(codePoint);
            }
        }
        return builder.build();
    }

    /**
     * Validate, sort and coalesce the ranges.
     */
    static List<RuneRange> simplify(List<RuneRange> ranges) {
        for (RuneRange range : ranges) {
            if (range.getLo() > range.getHi()) {
                throw new CompileException("Invalid rune range " + range + ": low bound above high bound");
            }
            if (range.getLo() < 0 || range.getHi() > MAX_CODE_POINT) {
                throw new CompileException("Invalid rune range " + range + ": outside of Unicode");
            }
        }
        List<RuneRange> sorted = new ArrayList<>(ranges);
        Collections.sort(sorted);
        List<RuneRange> simplified = new ArrayList<>();
        for (RuneRange range : sorted) {
            if (!simplified.isEmpty()) {
                RuneRange last = simplified.get(simplified.size() - 1);
                if (range.getLo() <= last.getHi() + 1) {
                    if (range.getHi() > last.getHi()) {
                        simplified.set(simplified.size() - 1, new RuneRange(last.getLo(), range.getHi()));
                    }
                    continue;
                }
            }
            simplified.add(range);
        }
        return simplified;
    }

    private static String nameOf(List<RuneRange> simplified) {
        StringBuilder sb = new StringBuilder("[");
        for (RuneRange range : simplified) {
            sb.append(Integer.toHexString(range.getLo())).append('-').append(Integer.toHexString(range.getHi()))
                    .append(',');
        }
        return sb.append(']').toString();
    }
}
