package software.amazon.event.automaton;

import software.amazon.event.automaton.input.DefaultParser;
import software.amazon.event.automaton.input.InputByte;
import software.amazon.event.automaton.input.InputCharacter;
import software.amazon.event.automaton.input.InputMultiByteSet;
import software.amazon.event.automaton.input.MultiByte;

import static software.amazon.event.automaton.Constants.VALUE_TERMINATOR;
import static software.amazon.event.automaton.input.InputCharacterType.BYTE;

/**
 * Compiles equals-ignore-case patterns. Each code point with case variants becomes a small trie whose paths share
 * their common leading bytes and rejoin at one next state; the result stays deterministic.
 */
final class MonocaseCompiler {

    private MonocaseCompiler() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static ByteState compile(String value, ByteState accept) {
        InputCharacter[] characters = DefaultParser.getParser().parse(MatchType.EQUALS_IGNORE_CASE, value);
        ByteState start = new ByteState();
        ByteState state = start;
        for (InputCharacter character : characters) {
            ByteState next = new ByteState();
            if (character.getType() == BYTE) {
                state.putTransition(InputByte.cast(character).getUtf8Byte(), next);
            } else {
                Utf8PathBuilder builder = new Utf8PathBuilder(state, next);
                for (MultiByte variant : InputMultiByteSet.cast(character).getMultiBytes()) {
                    builder.addPath(variant.getBytes());
                }
                builder.build();
            }
            state = next;
        }
        state.putTransition(VALUE_TERMINATOR, accept);
        return start;
    }
}
