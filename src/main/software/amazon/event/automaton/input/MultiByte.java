package software.amazon.event.automaton.input;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The UTF-8 encoding of one code point, one to four bytes long.
 */
public class MultiByte {

    private final byte[] bytes;

    MultiByte(byte ... bytes) {
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Must provide at least one byte");
        }
        this.bytes = bytes;
    }

    static MultiByte encode(int codePoint) {
        return new MultiByte(new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8));
    }

    public byte[] getBytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || !(o.getClass() == getClass())) {
            return false;
        }
        return Arrays.equals(((MultiByte) o).bytes, bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return Arrays.toString(bytes);
    }
}
