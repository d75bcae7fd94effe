package software.amazon.event.automaton;

final class Constants {

    private Constants() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * Exclusive upper bound of every transition table. Bytes 0xF6 and above never occur in valid UTF-8.
     */
    static final int BYTE_CEILING = 0xF6;

    /**
     * Synthetic byte appended after every value. It never occurs in valid UTF-8, so reaching a state on it means the
     * whole value has been consumed.
     */
    static final int VALUE_TERMINATOR = 0xF5;

    static final byte QUOTE_BYTE = 0x22;

    static final int MAX_CODE_POINT = 0x10FFFF;
    static final int MIN_SURROGATE = 0xD800;
    static final int MAX_SURROGATE = 0xDFFF;
}
