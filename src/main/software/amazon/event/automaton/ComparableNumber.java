package software.amazon.event.automaton;

import ch.randelshofer.fastdoubleparser.JavaBigDecimalParser;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

/**
 * Represents a number as a byte string that is equal for every spelling of the same value, so {@code 35},
 * {@code 35.0} and {@code 3.5e1} all match one automaton path. The strings also sort in numeric order.
 * <br/>
 * Numbers are parsed as a {@code BigDecimal}, which does not lose digits the way parsing straight to a double can,
 * then converted to a double. A number that has no exact double form has no comparable form either.
 * <br/>
 * The 64 bits of the double are reordered so that unsigned comparison follows numeric order, then written big-endian
 * in base 128: ten bytes, each below 0x80, so the form never collides with the value terminator.
 */
final class ComparableNumber {

    static final int LENGTH_IN_BYTES = 10;
    private static final int BASE_128_BITMASK = 0x7f;

    private ComparableNumber() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * @throws NumberFormatException if the input isn't a number
     * @throws IllegalArgumentException if the input is a number without an exact double form
     */
    static byte[] generate(final String str) {
        final BigDecimal bigDecimal = JavaBigDecimalParser.parseBigDecimal(str);
        final double doubleValue = bigDecimal.doubleValue();
        if (Double.isNaN(doubleValue) || Double.isInfinite(doubleValue) ||
                BigDecimal.valueOf(doubleValue).compareTo(bigDecimal) != 0) {
            throw new IllegalArgumentException("Cannot compare number : " + str);
        }
        return generate(doubleValue);
    }

    static byte[] generate(final double value) {
        // -0.0 and 0.0 are one value
        final long bits = Double.doubleToLongBits(value == 0.0 ? 0.0 : value);

        // positive numbers get the sign bit set, negative numbers are inverted, so larger is always greater
        final long mask = ((bits >>> 63) * 0xFFFFFFFFFFFFFFFFL) | (1L << 63);
        return base128(bits ^ mask);
    }

    /**
     * The comparable form of a number, or null if the text is not a number or has no exact double form.
     */
    @Nullable
    static byte[] generateOrNull(final String str) {
        if (!looksNumeric(str.isEmpty() ? 0 : str.charAt(0))) {
            return null;
        }
        try {
            return generate(str);
        } catch (IllegalArgumentException e) {
            // not a number we can compare; callers fall back to the text
            return null;
        }
    }

    /**
     * The comparable form of a value as matched, or null if it isn't a comparable number. Quoted strings never are.
     */
    @Nullable
    static byte[] generateOrNull(final byte[] utf8bytes) {
        if (utf8bytes.length == 0 || !looksNumeric(utf8bytes[0])) {
            return null;
        }
        return generateOrNull(new String(utf8bytes, StandardCharsets.ISO_8859_1));
    }

    static boolean isNumber(final String str) {
        try {
            JavaBigDecimalParser.parseBigDecimal(str);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    static byte[] base128(long value) {
        final byte[] result = new byte[LENGTH_IN_BYTES];
        for (int i = LENGTH_IN_BYTES - 1; i >= 0; i--) {
            result[i] = (byte) (value & BASE_128_BITMASK);
            value >>>= 7;
        }
        return result;
    }

    // JSON numbers start with a digit or a minus sign
    private static boolean looksNumeric(final int c) {
        return c == '-' || (c >= '0' && c <= '9');
    }
}
