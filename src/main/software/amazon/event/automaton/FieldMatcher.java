package software.amazon.event.automaton;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * An opaque continuation attached to the accepting state of a compiled pattern. The automaton never interprets it; it
 * only collects and deduplicates the matchers reached while matching a value. The field-dispatch layer decides what a
 * matcher means, typically the next step of a rule.
 *
 * Matchers use identity equality, so two matchers with the same name are still distinct continuations.
 */
@Immutable
public final class FieldMatcher {

    private final String name;

    public FieldMatcher(@Nonnull String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "FM: " + name;
    }
}
