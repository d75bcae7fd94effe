package software.amazon.event.automaton.input;

import static software.amazon.event.automaton.input.InputCharacterType.BYTE;

/**
 * A literal byte of a pattern value, held unsigned so it can index a transition table directly.
 */
public class InputByte extends InputCharacter {

    private final int utf8byte;

    InputByte(final int utf8byte) {
        this.utf8byte = utf8byte & 0xFF;
    }

    public static InputByte cast(InputCharacter character) {
        return (InputByte) character;
    }

    /**
     * @return The byte value, between 0 and 0xFF.
     */
    public int getUtf8Byte() {
        return utf8byte;
    }

    public boolean is(final int value) {
        return utf8byte == (value & 0xFF);
    }

    @Override
    public InputCharacterType getType() {
        return BYTE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InputByte && ((InputByte) o).utf8byte == utf8byte;
    }

    @Override
    public int hashCode() {
        return utf8byte;
    }

    @Override
    public String toString() {
        if (utf8byte > 0x20 && utf8byte < 0x7F) {
            return "'" + (char) utf8byte + "'";
        }
        return "0x" + Integer.toHexString(utf8byte);
    }
}
