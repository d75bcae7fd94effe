package software.amazon.event.automaton;

import software.amazon.event.automaton.input.DefaultParser;
import software.amazon.event.automaton.input.InputByte;
import software.amazon.event.automaton.input.InputCharacter;

import static software.amazon.event.automaton.Constants.BYTE_CEILING;
import static software.amazon.event.automaton.Constants.QUOTE_BYTE;
import static software.amazon.event.automaton.Constants.VALUE_TERMINATOR;
import static software.amazon.event.automaton.input.InputCharacterType.BYTE;
import static software.amazon.event.automaton.input.InputCharacterType.WILDCARD;

/**
 * Compiles shell-style and wildcard patterns.
 *
 * A wildcard turns the current state into a spinner that loops on every real byte. The byte after the wildcard leaves
 * the spinner for an escape state, whose spinout leads back to the spinner so that the literal tail can fail and the
 * spin resume. The result is nondeterministic.
 */
final class GlobCompiler {

    private GlobCompiler() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * @throws CompileException if the value holds more than one {@code *}.
     */
    static ByteState compileShellStyle(String value, ByteState accept) {
        return compile(DefaultParser.getParser().parse(MatchType.SHELL_STYLE, value), accept, true);
    }

    /**
     * @throws CompileException for adjacent wildcards or a backslash that escapes neither {@code *} nor {@code \}.
     */
    static ByteState compileWildcard(String value, ByteState accept) {
        return compile(DefaultParser.getParser().parse(MatchType.WILDCARD, value), accept, false);
    }

    private static ByteState compile(InputCharacter[] characters, ByteState accept, boolean trailingWildcardAsPrefix) {
        ByteState start = new ByteState();
        ByteState state = start;
        for (int i = 0; i < characters.length; i++) {
            InputCharacter character = characters[i];
            if (character.getType() == BYTE) {
                ByteState next = new ByteState();
                state.putTransition(InputByte.cast(character).getUtf8Byte(), next);
                state = next;
                continue;
            }
            if (character.getType() != WILDCARD) {
                throw new AssertionError(character + " is not a glob character");
            }

            if (trailingWildcardAsPrefix && i == characters.length - 2 && isQuote(characters[i + 1])) {
                // "abc*" is a prefix match: whatever follows, the closing quote included, is accepted
                state.putTransitionForRange(0, BYTE_CEILING, accept);
                return start;
            }
            if (i == characters.length - 1) {
                // a wildcard closing an unquoted value spins until the terminator
                state.putTransitionForRange(0, VALUE_TERMINATOR, state);
                state.putTransition(VALUE_TERMINATOR, accept);
                return start;
            }

            // parsers never yield two wildcards in a row
            int exitByte = InputByte.cast(characters[i + 1]).getUtf8Byte();
            ByteState spinner = state;
            ByteState escape = new ByteState();
            escape.setSpinout(spinner);
            spinner.putTransitionForRange(0, VALUE_TERMINATOR, spinner);
            spinner.putTransition(exitByte, escape);
            state = escape;
            i++;
        }
        state.putTransition(VALUE_TERMINATOR, accept);
        return start;
    }

    private static boolean isQuote(InputCharacter character) {
        return character.getType() == BYTE && InputByte.cast(character).is(QUOTE_BYTE);
    }
}
