package software.amazon.event.automaton.input;

import static software.amazon.event.automaton.input.InputCharacterType.WILDCARD;

/**
 * An unescaped {@code *} of a shell-style or wildcard pattern: any run of bytes, including none. Carries no state, so
 * one instance serves every pattern.
 */
public final class InputWildcard extends InputCharacter {

    static final InputWildcard INSTANCE = new InputWildcard();

    private InputWildcard() { }

    @Override
    public InputCharacterType getType() {
        return WILDCARD;
    }

    @Override
    public String toString() {
        return "*";
    }
}
