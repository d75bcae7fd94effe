package software.amazon.event.automaton;

import java.nio.charset.StandardCharsets;

import static software.amazon.event.automaton.Constants.BYTE_CEILING;
import static software.amazon.event.automaton.Constants.QUOTE_BYTE;
import static software.amazon.event.automaton.Constants.VALUE_TERMINATOR;

/**
 * Compiles exact, numeric and prefix matches into byte chains.
 */
final class StringValueCompiler {

    private StringValueCompiler() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static ByteState compileExact(String value, ByteState accept) {
        return compileExact(value.getBytes(StandardCharsets.UTF_8), accept);
    }

    static ByteState compileExact(byte[] utf8bytes, ByteState accept) {
        ByteState start = new ByteState();
        ByteState last = chain(start, utf8bytes, 0, utf8bytes.length);
        last.putTransition(VALUE_TERMINATOR, accept);
        return start;
    }

    /**
     * A number matches by its {@link ComparableNumber} form, so every spelling of the same value is matched. A number
     * with no exact double form is matched by its text.
     *
     * @throws CompileException if the value is not a number.
     */
    static ByteState compileNumeric(String number, ByteState accept) {
        byte[] comparable = ComparableNumber.generateOrNull(number);
        if (comparable == null) {
            if (!ComparableNumber.isNumber(number)) {
                throw new CompileException("Not a number: " + number);
            }
            return compileExact(number, accept);
        }
        return compileExact(comparable, accept);
    }

    /**
     * A prefix given as a quoted string loses its closing quote, then any byte at all, the value terminator included,
     * leads to acceptance.
     */
    static ByteState compilePrefix(String prefix, ByteState accept) {
        byte[] utf8bytes = prefix.getBytes(StandardCharsets.UTF_8);
        int length = utf8bytes.length;
        if (length >= 2 && utf8bytes[0] == QUOTE_BYTE && utf8bytes[length - 1] == QUOTE_BYTE) {
            length--;
        }
        ByteState start = new ByteState();
        ByteState last = chain(start, utf8bytes, 0, length);
        last.putTransitionForRange(0, BYTE_CEILING, accept);
        return start;
    }

    /**
     * Append one state per byte after the given state.
     *
     * @return The state reached after the last byte.
     */
    static ByteState chain(ByteState from, byte[] utf8bytes, int offset, int length) {
        ByteState state = from;
        for (int i = offset; i < length; i++) {
            ByteState next = new ByteState();
            state.putTransition(utf8bytes[i] & 0xFF, next);
            state = next;
        }
        return state;
    }
}
