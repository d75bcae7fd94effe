package software.amazon.event.automaton.input;

import software.amazon.event.automaton.MatchType;

import java.nio.charset.StandardCharsets;

import static software.amazon.event.automaton.MatchType.EQUALS_IGNORE_CASE;
import static software.amazon.event.automaton.MatchType.SHELL_STYLE;
import static software.amazon.event.automaton.MatchType.WILDCARD;

/**
 * Parses the value of a pattern into InputCharacters that are used to build its automaton. Most characters are
 * treated by their byte representation, but wildcards and case-insensitive characters need to be represented
 * differently so the compilers understand their special meaning.
 */
public class DefaultParser {

    static final byte ASTERISK_BYTE = 0x2A;
    static final byte BACKSLASH_BYTE = 0x5C;

    private static final DefaultParser SINGLETON = new DefaultParser();
    private final WildcardParser wildcardParser;
    private final ShellStyleParser shellStyleParser;
    private final EqualsIgnoreCaseParser equalsIgnoreCaseParser;

    DefaultParser() {
        this(new WildcardParser(), new ShellStyleParser(), new EqualsIgnoreCaseParser());
    }

    DefaultParser(WildcardParser wildcardParser, ShellStyleParser shellStyleParser,
                  EqualsIgnoreCaseParser equalsIgnoreCaseParser) {
        this.wildcardParser = wildcardParser;
        this.shellStyleParser = shellStyleParser;
        this.equalsIgnoreCaseParser = equalsIgnoreCaseParser;
    }

    public static DefaultParser getParser() {
        return SINGLETON;
    }

    public InputCharacter[] parse(final MatchType type, final String value) {
        if (type == WILDCARD) {
            return wildcardParser.parse(value);
        } else if (type == SHELL_STYLE) {
            return shellStyleParser.parse(value);
        } else if (type == EQUALS_IGNORE_CASE) {
            return equalsIgnoreCaseParser.parse(value);
        }

        final byte[] utf8bytes = value.getBytes(StandardCharsets.UTF_8);
        final InputCharacter[] result = new InputCharacter[utf8bytes.length];
        for (int i = 0; i < utf8bytes.length; i++) {
            result[i] = new InputByte(utf8bytes[i]);
        }
        return result;
    }
}
