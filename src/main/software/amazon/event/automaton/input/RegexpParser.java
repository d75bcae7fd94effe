package software.amazon.event.automaton.input;

import software.amazon.event.automaton.RuneRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the I-Regexp (RFC 9485) subset into a {@link RegexpTree}. Regexps are anchored: they describe a whole value.
 *
 * The escape character is {@code ~} rather than a backslash, so that regexps embedded in JSON patterns do not need
 * doubled escapes. A backslash is an ordinary character.
 *
 * Supported: literal characters, {@code .}, {@code [...]} and {@code [^...]} classes, single-character escapes,
 * groups, {@code |}, and the quantifiers {@code ? * + {m} {m,} {m,n}}. Unicode property escapes ({@code ~p{..}})
 * are recognized and rejected.
 */
public class RegexpParser {

    public static final int ESCAPE = '~';

    public static final int DEFAULT_QUANTIFIER_MAX = 100;

    private static final int RUNE_MAX = 0x10FFFF;

    private final int quantifierMax;

    public RegexpParser() {
        this(DEFAULT_QUANTIFIER_MAX);
    }

    public RegexpParser(int quantifierMax) {
        this.quantifierMax = quantifierMax;
    }

    public RegexpTree parse(final String regexp) {
        Cursor cursor = new Cursor(regexp);
        RegexpTree tree = readBranches(cursor);
        if (!cursor.atEnd()) {
            // readBranches only stops early at a ')' it cannot pair up
            throw new ParseException("Unbalanced ')' at pos " + cursor.position());
        }
        return tree;
    }

    private RegexpTree readBranches(Cursor cursor) {
        List<RegexpBranch> branches = new ArrayList<>();
        while (true) {
            branches.add(readBranch(cursor));
            if (cursor.atEnd() || cursor.peek() != '|') {
                return new RegexpTree(branches);
            }
            cursor.next();
        }
    }

    private RegexpBranch readBranch(Cursor cursor) {
        List<QuantifiedAtom> atoms = new ArrayList<>();
        while (!cursor.atEnd()) {
            int c = cursor.peek();
            if (c == '|' || c == ')') {
                break;
            }
            QuantifiedAtom atom = readAtom(cursor);
            atoms.add(readQuantifier(cursor, atom));
        }
        return new RegexpBranch(atoms);
    }

    private QuantifiedAtom readAtom(Cursor cursor) {
        int pos = cursor.position();
        int c = cursor.next();
        if (isNormalChar(c)) {
            return QuantifiedAtom.runes(Collections.singletonList(RuneRange.single(c)), 1, 1);
        }
        switch (c) {
            case '.':
                return QuantifiedAtom.dot(1, 1);
            case '(':
                RegexpTree subtree = readBranches(cursor);
                if (cursor.atEnd() || cursor.next() != ')') {
                    throw new ParseException("Unbalanced '(' at pos " + pos);
                }
                return QuantifiedAtom.subtree(subtree, 1, 1);
            case '[':
                return QuantifiedAtom.runes(readCharClassExpr(cursor, pos), 1, 1);
            case ESCAPE:
                return QuantifiedAtom.runes(Collections.singletonList(RuneRange.single(readEscape(cursor, pos))), 1, 1);
            case '?':
            case '*':
            case '+':
            case '{':
                throw new ParseException("Quantifier '" + codePointString(c) + "' at pos " + pos +
                        " has nothing to quantify");
            default:
                throw new ParseException("Invalid character '" + codePointString(c) + "' at pos " + pos);
        }
    }

    /**
     * Reads what follows an escape character outside of a class.
     */
    private int readEscape(Cursor cursor, int escapePos) {
        if (cursor.atEnd()) {
            throw new ParseException("'~' at end of regular expression");
        }
        int c = cursor.next();
        int escaped = checkSingleCharEscape(c);
        if (escaped >= 0) {
            return escaped;
        }
        if (c == 'p' || c == 'P') {
            throw new ParseException("Unicode property escape ~" + (char) c + "{...} at pos " + escapePos +
                    " is not supported");
        }
        if ("sSiIcCdDwW".indexOf(c) >= 0) {
            throw new ParseException("Multiple-character escape ~" + (char) c + " at pos " + escapePos +
                    " is not supported");
        }
        throw new ParseException("Invalid character '" + codePointString(c) + "' after '~' at pos " + escapePos);
    }

    private QuantifiedAtom readQuantifier(Cursor cursor, QuantifiedAtom atom) {
        if (cursor.atEnd()) {
            return atom;
        }
        switch (cursor.peek()) {
            case '*':
                cursor.next();
                return atom.withBounds(0, QuantifiedAtom.UNBOUNDED);
            case '+':
                cursor.next();
                return atom.withBounds(1, QuantifiedAtom.UNBOUNDED);
            case '?':
                cursor.next();
                return atom.withBounds(0, 1);
            case '{':
                int pos = cursor.position();
                cursor.next();
                return readRangeQuantifier(cursor, atom, pos);
            default:
                return atom;
        }
    }

    private QuantifiedAtom readRangeQuantifier(Cursor cursor, QuantifiedAtom atom, int openPos) {
        int lo = readDigits(cursor, openPos);
        int c = nextInQuantifier(cursor, openPos);
        if (c == '}') {
            checkQuantifierBound(lo, openPos);
            return atom.withBounds(lo, lo);
        }
        if (c != ',') {
            throw new ParseException("Unexpected character '" + codePointString(c) + "' in range quantifier at pos " +
                    openPos);
        }
        if (nextIs(cursor, '}')) {
            cursor.next();
            checkQuantifierBound(lo, openPos);
            return atom.withBounds(lo, QuantifiedAtom.UNBOUNDED);
        }
        int hi = readDigits(cursor, openPos);
        if (nextInQuantifier(cursor, openPos) != '}') {
            throw new ParseException("Range quantifier at pos " + openPos + " must close with '}'");
        }
        if (hi < lo) {
            throw new ParseException("Invalid range quantifier at pos " + openPos + ", top must not be below bottom");
        }
        checkQuantifierBound(hi, openPos);
        return atom.withBounds(lo, hi);
    }

    private int readDigits(Cursor cursor, int openPos) {
        long value = 0;
        int digits = 0;
        while (!cursor.atEnd() && cursor.peek() >= '0' && cursor.peek() <= '9') {
            value = value * 10 + (cursor.next() - '0');
            digits++;
            if (value > Integer.MAX_VALUE) {
                throw new ParseException("Range quantifier at pos " + openPos + " is too large");
            }
        }
        if (digits == 0) {
            throw new ParseException("Invalid range quantifier at pos " + openPos + ", expecting digits");
        }
        return (int) value;
    }

    private int nextInQuantifier(Cursor cursor, int openPos) {
        if (cursor.atEnd()) {
            throw new ParseException("Incomplete range quantifier at pos " + openPos);
        }
        return cursor.next();
    }

    private void checkQuantifierBound(int bound, int openPos) {
        if (bound > quantifierMax) {
            throw new ParseException("Range quantifier bound " + bound + " at pos " + openPos +
                    " exceeds the maximum of " + quantifierMax);
        }
    }

    /**
     * Reads a class after its opening bracket, through the closing one.
     */
    private List<RuneRange> readCharClassExpr(Cursor cursor, int openPos) {
        boolean negated = false;
        if (nextIs(cursor, '^')) {
            cursor.next();
            negated = true;
        }
        List<RuneRange> ranges = new ArrayList<>();
        boolean first = true;
        while (true) {
            if (cursor.atEnd()) {
                throw new ParseException("Unterminated character class at pos " + openPos);
            }
            int c = cursor.peek();
            if (c == ']') {
                if (first) {
                    throw new ParseException("Empty character class at pos " + openPos);
                }
                cursor.next();
                break;
            }
            readCCE1(cursor, first, ranges);
            first = false;
        }
        List<RuneRange> simplified = simplifyRuneRanges(ranges);
        return negated ? invertRuneRanges(simplified) : simplified;
    }

    /*
     * CCE1 = ( CCchar [ "-" CCchar ] ) / charClassEsc
     */
    private void readCCE1(Cursor cursor, boolean first, List<RuneRange> ranges) {
        int pos = cursor.position();
        int c = cursor.next();
        if (c == '-') {
            // a leading '-' or one right before ']' is literal
            if (first || nextIs(cursor, ']')) {
                ranges.add(RuneRange.single('-'));
                return;
            }
            throw new ParseException("Invalid '-' in character class at pos " + pos);
        }
        int lo = readCCchar(cursor, c, pos);
        if (!nextIs(cursor, '-')) {
            ranges.add(RuneRange.single(lo));
            return;
        }
        cursor.next();
        if (cursor.atEnd()) {
            throw new ParseException("Unterminated character class range at pos " + pos);
        }
        if (cursor.peek() == ']') {
            ranges.add(RuneRange.single(lo));
            ranges.add(RuneRange.single('-'));
            return;
        }
        int hiPos = cursor.position();
        int hi = readCCchar(cursor, cursor.next(), hiPos);
        if (lo > hi) {
            throw new ParseException("Invalid range " + codePointString(lo) + "-" + codePointString(hi) + " at pos " +
                    pos);
        }
        ranges.add(new RuneRange(lo, hi));
    }

    private int readCCchar(Cursor cursor, int c, int pos) {
        if (c == ESCAPE) {
            if (cursor.atEnd()) {
                throw new ParseException("'~' at end of regular expression");
            }
            int e = cursor.next();
            if (e == 'p' || e == 'P') {
                throw new ParseException("Unicode property escape ~" + (char) e + "{...} at pos " + pos +
                        " is not supported");
            }
            int escaped = checkSingleCharEscape(e);
            if (escaped < 0) {
                throw new ParseException("Invalid character '" + codePointString(e) + "' after '~' at pos " + pos);
            }
            return escaped;
        }
        if (!isCCchar(c)) {
            throw new ParseException("Invalid character '" + codePointString(c) + "' in character class at pos " +
                    pos);
        }
        return c;
    }

    /**
     * Sort and coalesce overlapping or adjacent ranges.
     */
    static List<RuneRange> simplifyRuneRanges(List<RuneRange> ranges) {
        if (ranges.isEmpty()) {
            return ranges;
        }
        List<RuneRange> sorted = new ArrayList<>(ranges);
        Collections.sort(sorted);
        List<RuneRange> out = new ArrayList<>();
        int lo = sorted.get(0).getLo();
        int hi = sorted.get(0).getHi();
        for (int i = 1; i < sorted.size(); i++) {
            RuneRange next = sorted.get(i);
            if (next.getLo() > hi + 1) {
                out.add(new RuneRange(lo, hi));
                lo = next.getLo();
                hi = next.getHi();
            } else if (next.getHi() > hi) {
                hi = next.getHi();
            }
        }
        out.add(new RuneRange(lo, hi));
        return out;
    }

    /**
     * Complement sorted, non-overlapping ranges over [0, 0x10FFFF].
     */
    static List<RuneRange> invertRuneRanges(List<RuneRange> ranges) {
        List<RuneRange> inverted = new ArrayList<>();
        int point = 0;
        for (RuneRange range : ranges) {
            if (range.getLo() > point) {
                inverted.add(new RuneRange(point, range.getLo() - 1));
            }
            point = range.getHi() + 1;
        }
        if (point <= RUNE_MAX) {
            inverted.add(new RuneRange(point, RUNE_MAX));
        }
        return inverted;
    }

    /*
     * NormalChar from RFC 9485 with '~' taking the place of '\' as the escape.
     */
    static boolean isNormalChar(int c) {
        if (c <= 0x27 || c == ',' || c == '-' || (c >= 0x2F && c <= 0x3E)) {
            return true;
        }
        if (c >= 0x40 && c <= 0x5A) {
            return true;
        }
        if (c == '\\') {
            return true;
        }
        if (c >= 0x5E && c <= 0x7A) {
            return true;
        }
        if (c >= 0x7F && c <= 0xD7FF) {
            return true;
        }
        return c >= 0xE000 && c <= RUNE_MAX;
    }

    static boolean isCCchar(int c) {
        if (c <= 0x2C || (c >= 0x2E && c <= 0x5A)) {
            return true;
        }
        if (c == '\\') {
            return true;
        }
        if (c >= 0x5E && c <= 0xD7FF) {
            return c != ESCAPE;
        }
        return c >= 0xE000 && c <= RUNE_MAX;
    }

    /**
     * @return The code point a single-character escape stands for, or -1 if {@code c} cannot be escaped.
     */
    static int checkSingleCharEscape(int c) {
        if (c >= 0x28 && c <= 0x2B) {
            return c;
        }
        if (c == '-' || c == '.' || c == '?' || (c >= 0x5B && c <= 0x5E)) {
            return c;
        }
        if (c == 'n') {
            return '\n';
        }
        if (c == 'r') {
            return '\r';
        }
        if (c == 't') {
            return '\t';
        }
        if (c >= 0x7B && c <= 0x7D) {
            return c;
        }
        if (c == ESCAPE) {
            return ESCAPE;
        }
        return -1;
    }

    private static boolean nextIs(Cursor cursor, int c) {
        return !cursor.atEnd() && cursor.peek() == c;
    }

    private static String codePointString(int c) {
        return new String(Character.toChars(c));
    }

    /**
     * Walks a string one code point at a time.
     */
    private static final class Cursor {

        private final String text;
        private int index = 0;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return index >= text.length();
        }

        int peek() {
            return text.codePointAt(index);
        }

        int next() {
            int c = text.codePointAt(index);
            index += Character.charCount(c);
            return c;
        }

        int position() {
            return index;
        }
    }
}
