package software.amazon.event.automaton;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A pattern given by one string: an exact value, a number, a prefix, a glob, a case-insensitive value or a regexp.
 * What the string means is up to its {@link MatchType}.
 */
public class ValuePatterns extends Patterns {

    private final String pattern;

    ValuePatterns(final MatchType type, @Nonnull final String pattern) {
        super(type);
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    public String pattern() {
        return pattern;
    }

    /**
     * The pattern string as the bytes a matched value would hold.
     */
    byte[] utf8Bytes() {
        return pattern.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && pattern.equals(((ValuePatterns) o).pattern);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + pattern.hashCode();
    }

    @Override
    public String toString() {
        return type() + "(" + pattern + ")";
    }
}
