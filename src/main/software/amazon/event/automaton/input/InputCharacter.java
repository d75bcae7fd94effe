package software.amazon.event.automaton.input;

/**
 * One unit of a parsed pattern value. Literal bytes, case-variant sets and wildcards are compiled differently, so
 * compilers switch on {@link #getType()} and cast.
 */
public abstract class InputCharacter {

    public abstract InputCharacterType getType();
}
