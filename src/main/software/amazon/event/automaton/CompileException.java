package software.amazon.event.automaton;

/**
 * Thrown when a pattern cannot be compiled into an automaton: malformed syntax, an unsupported feature or invalid
 * bounds. The automaton the pattern was being added to is left exactly as it was.
 */
public class CompileException extends RuntimeException {

    public CompileException(String msg) {
        super(msg);
    }
}
