package software.amazon.event.automaton.input;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Simple Unicode case folding, as in the C and S entries of CaseFolding.txt. Two code points are equal ignoring case
 * when they share a simple folding; the set of all code points sharing one is called an orbit, e.g. {K, k, U+212A
 * KELVIN SIGN} or {S, s, U+017F LATIN SMALL LETTER LONG S}.
 *
 * The folding of a code point is its lower case of its upper case, which agrees with CaseFolding.txt for every
 * C and S entry. The Turkic dotted capital I and dotless small i are excluded: they have only T and F foldings, so
 * each is its own orbit.
 */
final class CaseFolding {

    private static final int LATIN_CAPITAL_I_WITH_DOT = 0x130;
    private static final int LATIN_SMALL_DOTLESS_I = 0x131;

    private CaseFolding() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static int simpleFold(int codePoint) {
        if (codePoint == LATIN_CAPITAL_I_WITH_DOT || codePoint == LATIN_SMALL_DOTLESS_I) {
            return codePoint;
        }
        return Character.toLowerCase(Character.toUpperCase(codePoint));
    }

    /**
     * Every code point that folds like the given one, in ascending order. A code point without case variants is the
     * only member of its orbit.
     */
    static int[] orbitOf(int codePoint) {
        int[] orbit = Orbits.BY_FOLDING.get(simpleFold(codePoint));
        return orbit != null ? orbit : new int[] { codePoint };
    }

    // Built on first use; a full scan of the code space.
    private static final class Orbits {

        private static final Int2ObjectMap<int[]> BY_FOLDING = build();

        private static Int2ObjectMap<int[]> build() {
            Int2ObjectMap<IntSortedSet> members = new Int2ObjectOpenHashMap<>();
            for (int codePoint = 0; codePoint <= Character.MAX_CODE_POINT; codePoint++) {
                if (Character.getType(codePoint) == Character.SURROGATE) {
                    continue;
                }
                int folding = simpleFold(codePoint);
                if (folding == codePoint) {
                    continue;
                }
                IntSortedSet orbit = members.get(folding);
                if (orbit == null) {
                    orbit = new IntRBTreeSet();
                    members.put(folding, orbit);
                    if (simpleFold(folding) == folding) {
                        orbit.add(folding);
                    }
                }
                orbit.add(codePoint);
            }
            Int2ObjectMap<int[]> result = new Int2ObjectOpenHashMap<>(members.size());
            for (Int2ObjectMap.Entry<IntSortedSet> entry : members.int2ObjectEntrySet()) {
                result.put(entry.getIntKey(), new IntArrayList(entry.getValue()).toIntArray());
            }
            return result;
        }
    }
}
