package software.amazon.event.automaton.input;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A parser for equals-ignore-case patterns. Works code point by code point using simple case folding: every code
 * point in the same {@link CaseFolding} orbit is a variant. A code point with no other variant is parsed into
 * InputBytes; otherwise into an InputMultiByteSet holding the encoding of every variant.
 *
 * Variants may differ in encoded length, e.g. ⱥ (3 bytes) and Ⱥ (2 bytes), and supplementary-plane letters such as
 * the Deseret alphabet fold within 4-byte encodings.
 */
public class EqualsIgnoreCaseParser implements StringValueParser {

    EqualsIgnoreCaseParser() { }

    @Override
    public InputCharacter[] parse(final String value) {
        List<InputCharacter> result = new ArrayList<>(value.length());
        int i = 0;
        while (i < value.length()) {
            int codePoint = value.codePointAt(i);
            i += Character.charCount(codePoint);

            int[] orbit = CaseFolding.orbitOf(codePoint);
            if (orbit.length > 1) {
                result.add(InputMultiByteSet.ofCodePoints(orbit));
            } else {
                for (byte b : MultiByte.encode(codePoint).getBytes()) {
                    result.add(new InputByte(b));
                }
            }
        }
        return result.toArray(new InputCharacter[0]);
    }
}
