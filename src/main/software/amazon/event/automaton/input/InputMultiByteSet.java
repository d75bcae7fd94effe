package software.amazon.event.automaton.input;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.StringJoiner;

import static software.amazon.event.automaton.input.InputCharacterType.MULTI_BYTE_SET;

/**
 * One code point of a pattern value that may appear in any of several encodings, e.g. every case variant of a
 * letter. Encodings may differ in length.
 */
public class InputMultiByteSet extends InputCharacter {

    private final Set<MultiByte> multiBytes;

    InputMultiByteSet(Set<MultiByte> multiBytes) {
        if (multiBytes.size() < 2) {
            throw new IllegalArgumentException("A set of encodings needs at least two members, got " + multiBytes);
        }
        this.multiBytes = Collections.unmodifiableSet(multiBytes);
    }

    /**
     * @param codePoints Distinct code points, at least two.
     */
    static InputMultiByteSet ofCodePoints(int ... codePoints) {
        Set<MultiByte> encodings = new LinkedHashSet<>(codePoints.length);
        for (int codePoint : codePoints) {
            encodings.add(MultiByte.encode(codePoint));
        }
        return new InputMultiByteSet(encodings);
    }

    public static InputMultiByteSet cast(InputCharacter character) {
        return (InputMultiByteSet) character;
    }

    public Set<MultiByte> getMultiBytes() {
        return multiBytes;
    }

    @Override
    public InputCharacterType getType() {
        return MULTI_BYTE_SET;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InputMultiByteSet && ((InputMultiByteSet) o).multiBytes.equals(multiBytes);
    }

    @Override
    public int hashCode() {
        return multiBytes.hashCode();
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner("|", "{", "}");
        for (MultiByte multiByte : multiBytes) {
            joiner.add(new String(multiByte.getBytes(), StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }
}
