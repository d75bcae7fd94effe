package software.amazon.event.automaton.input;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static software.amazon.event.automaton.input.DefaultParser.ASTERISK_BYTE;
import static software.amazon.event.automaton.input.DefaultParser.BACKSLASH_BYTE;

/**
 * A parser for wildcard patterns. Any number of {@code *} wildcards may appear, but not two in a row, and a literal
 * {@code *} or {@code \} is written with a backslash escape.
 */
public class WildcardParser implements StringValueParser {

    WildcardParser() { }

    @Override
    public InputCharacter[] parse(final String value) {
        final byte[] utf8Bytes = value.getBytes(StandardCharsets.UTF_8);
        final List<InputCharacter> result = new ArrayList<>(utf8Bytes.length);
        int escapePos = -1;
        boolean afterWildcard = false;
        for (int i = 0; i < utf8Bytes.length; i++) {
            final byte utf8byte = utf8Bytes[i];
            if (escapePos >= 0) {
                if (utf8byte != ASTERISK_BYTE && utf8byte != BACKSLASH_BYTE) {
                    throw invalidEscape(escapePos);
                }
                result.add(new InputByte(utf8byte));
                escapePos = -1;
                afterWildcard = false;
            } else if (utf8byte == BACKSLASH_BYTE) {
                escapePos = i;
            } else if (utf8byte == ASTERISK_BYTE) {
                if (afterWildcard) {
                    throw new ParseException("Consecutive wildcard characters at pos " + (i - 1));
                }
                result.add(InputWildcard.INSTANCE);
                afterWildcard = true;
            } else {
                result.add(new InputByte(utf8byte));
                afterWildcard = false;
            }
        }
        // a dangling backslash escapes nothing
        if (escapePos >= 0) {
            throw invalidEscape(escapePos);
        }
        return result.toArray(new InputCharacter[0]);
    }

    private static ParseException invalidEscape(int pos) {
        return new ParseException("Invalid escape character at pos " + pos);
    }
}
