package software.amazon.event.automaton;

import software.amazon.event.automaton.input.QuantifiedAtom;
import software.amazon.event.automaton.input.RegexpBranch;
import software.amazon.event.automaton.input.RegexpParser;
import software.amazon.event.automaton.input.RegexpTree;

import java.util.List;

import static software.amazon.event.automaton.Constants.QUOTE_BYTE;
import static software.amazon.event.automaton.Constants.VALUE_TERMINATOR;

/**
 * Compiles a parsed regexp into an NFA by Thompson construction. Branches are built right to left, so each atom is
 * compiled knowing the state it exits to.
 *
 * <ul>
 *   <li>{@code ?}: an epsilon splice to the atom and past it.</li>
 *   <li>{@code *}: a loop state with epsilons to the atom, which exits back to the loop, and past it.</li>
 *   <li>{@code +}: the atom exits to a loopback state with epsilons to the next state and to the atom again.</li>
 *   <li>{@code {m,n}}: copies of a shell of the atom, chained, with an epsilon escape after every copy past the
 *   m-th.</li>
 * </ul>
 *
 * Alternatives are unioned with {@link FaMerger}.
 */
final class RegexpCompiler {

    private final RuneRangeCompiler runeRangeCompiler;
    private final int quantifierMax;

    RegexpCompiler(RuneRangeCompiler runeRangeCompiler, int quantifierMax) {
        this.runeRangeCompiler = runeRangeCompiler;
        this.quantifierMax = quantifierMax;
    }

    /**
     * Compile a regexp anchored to a whole quoted string value.
     *
     * @throws CompileException if the regexp is malformed or uses an unsupported feature.
     */
    ByteState compile(String regexp, ByteState accept) {
        return compile(new RegexpParser(quantifierMax).parse(regexp), accept);
    }

    ByteState compile(RegexpTree tree, ByteState accept) {
        ByteState terminal = new ByteState();
        terminal.putTransition(VALUE_TERMINATOR, accept);
        ByteState closeQuote = new ByteState();
        closeQuote.putTransition(QUOTE_BYTE, terminal);
        ByteState start = new ByteState();
        start.putTransition(QUOTE_BYTE, makeTreeFa(tree, closeQuote));
        return start;
    }

    /*
     * The next state of a fragment may still be under construction, e.g. a loop state whose epsilon back into the
     * fragment is added afterwards. Merging must never read such a state's table, so alternatives exit to a state
     * with an epsilon to next, which merging splices instead of reading through.
     */
    private ByteState makeTreeFa(RegexpTree tree, ByteState next) {
        List<RegexpBranch> branches = tree.getBranches();
        if (branches.size() == 1) {
            return makeBranchFa(branches.get(0), next);
        }
        ByteState exit = new ByteState();
        exit.addEpsilon(next);
        ByteState union = null;
        for (RegexpBranch branch : branches) {
            ByteState branchStart = makeBranchFa(branch, exit);
            union = union == null ? branchStart : new FaMerger().merge(union, branchStart);
        }
        return union;
    }

    private ByteState makeBranchFa(RegexpBranch branch, ByteState next) {
        List<QuantifiedAtom> atoms = branch.getAtoms();
        ByteState state = next;
        for (int i = atoms.size() - 1; i >= 0; i--) {
            state = makeQuantifiedFa(atoms.get(i), state);
        }
        return state;
    }

    private ByteState makeQuantifiedFa(QuantifiedAtom atom, ByteState next) {
        int min = atom.getMin();
        int max = atom.getMax();
        checkBounds(atom);

        if (atom.isSubtree() && atom.getSubtree().isEmpty()) {
            if ((min == 1 && max == 1) || max == 0) {
                return next;
            }
            throw new CompileException("Quantifier on the empty group in " + atom + " is a degenerate closure");
        }
        if (max == 0) {
            return next;
        }
        if (min == 1 && max == 1) {
            return makeAtomFa(atom, next);
        }
        if (min == 0 && max == 1) {
            ByteState optional = new ByteState();
            optional.addEpsilon(next);
            optional.addEpsilon(makeAtomFa(atom, next));
            return optional;
        }
        if (min == 0 && atom.isUnbounded()) {
            return makeStarFa(atom, next);
        }
        if (min == 1 && atom.isUnbounded()) {
            ByteState loopback = new ByteState();
            loopback.addEpsilon(next);
            ByteState fragment = makeLoopBody(atom, loopback);
            loopback.addEpsilon(fragment);
            return fragment;
        }

        ByteState placeholder = new ByteState();
        ByteState shell = makeAtomFa(atom, placeholder);
        ByteState state;
        if (atom.isUnbounded()) {
            state = makeStarFa(atom, next);
            for (int i = min; i >= 1; i--) {
                state = StateGraph.copyReplacing(shell, placeholder, state);
            }
        } else {
            state = next;
            for (int i = max; i >= 1; i--) {
                ByteState copy = StateGraph.copyReplacing(shell, placeholder, state);
                if (i > min) {
                    ByteState escape = new ByteState();
                    escape.addEpsilon(copy);
                    escape.addEpsilon(next);
                    state = escape;
                } else {
                    state = copy;
                }
            }
        }
        return state;
    }

    private ByteState makeStarFa(QuantifiedAtom atom, ByteState next) {
        ByteState loop = new ByteState();
        loop.addEpsilon(next);
        loop.addEpsilon(makeLoopBody(atom, loop));
        return loop;
    }

    /*
     * A loop body that consumes nothing would leave the loop state with an epsilon to itself.
     */
    private ByteState makeLoopBody(QuantifiedAtom atom, ByteState loop) {
        ByteState body = makeAtomFa(atom, loop);
        if (body == loop) {
            throw new CompileException("Quantifier on " + atom + ", which matches only the empty string, " +
                    "is a degenerate closure");
        }
        return body;
    }

    private ByteState makeAtomFa(QuantifiedAtom atom, ByteState next) {
        if (atom.isDot()) {
            return DotFa.make(next);
        }
        if (atom.isSubtree()) {
            return makeTreeFa(atom.getSubtree(), next);
        }
        return runeRangeCompiler.makeRuneRangeFa(atom.getRunes(), next);
    }

    private void checkBounds(QuantifiedAtom atom) {
        int min = atom.getMin();
        int max = atom.getMax();
        if (min < 0 || (!atom.isUnbounded() && max < min)) {
            throw new CompileException("Invalid quantifier bounds in " + atom);
        }
        if (min > quantifierMax || max > quantifierMax) {
            throw new CompileException("Quantifier in " + atom + " exceeds the maximum of " + quantifierMax);
        }
    }
}
