package software.amazon.event.automaton.input;

import software.amazon.event.automaton.CompileException;

/**
 * Thrown when a pattern value cannot be parsed into InputCharacters or a regexp tree.
 */
public class ParseException extends CompileException {

    public ParseException(String msg) {
        super(msg);
    }
}
