package software.amazon.event.automaton;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Typed descriptors of the values a field may match, and the factory to build them.
 *
 * String values are given the way they appear in matched data, which for JSON strings means enclosed in
 * {@code "} characters, like so: {@code "\"foo\""}. Regexps and rune ranges describe only the content of a string and
 * are anchored between the quotes when compiled.
 */
public class Patterns {

    private final MatchType type;

    Patterns(final MatchType type) {
        this.type = type;
    }

    public MatchType type() {
        return type;
    }

    public static ValuePatterns exactMatch(final String value) {
        return new ValuePatterns(MatchType.EXACT, value);
    }

    /**
     * Match a number given as JSON number text, e.g. {@code "35"}. Values spelled differently but equal in value,
     * such as {@code 35.0} or {@code 3.5e1}, match too.
     */
    public static ValuePatterns numericEquals(final String number) {
        return new ValuePatterns(MatchType.NUMERIC_EQUALS, number);
    }

    public static ValuePatterns numericEquals(final double number) {
        return numericEquals(Double.toString(number));
    }

    // The closing quote is dropped when compiled, since any remainder of the value may follow the prefix.
    public static ValuePatterns prefixMatch(final String prefix) {
        return new ValuePatterns(MatchType.PREFIX, prefix);
    }

    public static ValuePatterns shellStyleMatch(final String value) {
        return new ValuePatterns(MatchType.SHELL_STYLE, value);
    }

    public static ValuePatterns wildcardMatch(final String value) {
        return new ValuePatterns(MatchType.WILDCARD, value);
    }

    public static ValuePatterns equalsIgnoreCaseMatch(final String value) {
        return new ValuePatterns(MatchType.EQUALS_IGNORE_CASE, value);
    }

    public static ValuePatterns regexpMatch(final String regexp) {
        return new ValuePatterns(MatchType.REGEXP, regexp);
    }

    public static RuneRangePattern runeRangeMatch(final RuneRange... ranges) {
        return new RuneRangePattern(Arrays.asList(ranges));
    }

    public static RuneRangePattern runeRangeMatch(final List<RuneRange> ranges) {
        return new RuneRangePattern(ranges);
    }

    public static AnythingBut anythingButMatch(final String anythingBut) {
        return new AnythingBut(Collections.singleton(anythingBut));
    }

    public static AnythingBut anythingButMatch(final Set<String> anythingButs) {
        return new AnythingBut(new HashSet<>(anythingButs));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return type == ((Patterns) o).type;
    }

    @Override
    public int hashCode() {
        return type != null ? type.hashCode() : 0;
    }

    @Override
    public String toString() {
        return "T:" + type;
    }
}
