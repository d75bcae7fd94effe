package software.amazon.event.automaton;

/**
 * Builds the automaton for "any one code point": every well-formed UTF-8 sequence of one to four bytes, excluding
 * overlong forms and surrogates.
 */
final class DotFa {

    private DotFa() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static ByteState make(ByteState next) {
        // states named for the number of continuation bytes still to come
        ByteState one = continuation(0x80, 0xC0, next);
        ByteState two = continuation(0x80, 0xC0, one);
        ByteState three = continuation(0x80, 0xC0, two);

        // E0 A0-BF, ED 80-9F, F0 90-BF, F4 80-8F
        ByteState afterE0 = continuation(0xA0, 0xC0, one);
        ByteState afterED = continuation(0x80, 0xA0, one);
        ByteState afterF0 = continuation(0x90, 0xC0, two);
        ByteState afterF4 = continuation(0x80, 0x90, two);

        ByteState start = new ByteState();
        ByteTransition[] steps = start.getMap().unpack();
        fill(steps, 0x00, 0x80, next);
        fill(steps, 0xC2, 0xE0, one);
        steps[0xE0] = afterE0;
        fill(steps, 0xE1, 0xED, two);
        steps[0xED] = afterED;
        fill(steps, 0xEE, 0xF0, two);
        steps[0xF0] = afterF0;
        fill(steps, 0xF1, 0xF4, three);
        steps[0xF4] = afterF4;
        start.getMap().pack(steps);
        return start;
    }

    private static ByteState continuation(int from, int to, ByteState next) {
        ByteState state = new ByteState();
        state.putTransitionForRange(from, to, next);
        return state;
    }

    private static void fill(ByteTransition[] steps, int from, int to, ByteState next) {
        for (int i = from; i < to; i++) {
            steps[i] = next;
        }
    }
}
