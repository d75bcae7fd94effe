package software.amazon.event.automaton.input;

/**
 * Parses a pattern value into the InputCharacters its automaton is built from.
 */
public interface StringValueParser {

    InputCharacter[] parse(String value);
}
