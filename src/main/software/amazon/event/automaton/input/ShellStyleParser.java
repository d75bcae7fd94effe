package software.amazon.event.automaton.input;

import java.nio.charset.StandardCharsets;

import static software.amazon.event.automaton.input.DefaultParser.ASTERISK_BYTE;

/**
 * A parser for shell-style patterns: at most one {@code *}, with no escaping. Every other byte is literal.
 */
public class ShellStyleParser implements StringValueParser {

    ShellStyleParser() { }

    @Override
    public InputCharacter[] parse(final String value) {
        final byte[] utf8Bytes = value.getBytes(StandardCharsets.UTF_8);
        final InputCharacter[] result = new InputCharacter[utf8Bytes.length];
        int wildcardPos = -1;
        for (int i = 0; i < utf8Bytes.length; i++) {
            if (utf8Bytes[i] == ASTERISK_BYTE) {
                if (wildcardPos >= 0) {
                    throw new ParseException("Shell-style pattern has a second wildcard at pos " + i +
                            ", only one is allowed");
                }
                wildcardPos = i;
                result[i] = InputWildcard.INSTANCE;
            } else {
                result[i] = new InputByte(utf8Bytes[i]);
            }
        }
        return result;
    }
}
