package software.amazon.event.automaton.input;

import java.util.Collections;
import java.util.List;

/**
 * One alternative of a regexp: quantified atoms matched in sequence.
 */
public final class RegexpBranch {

    private final List<QuantifiedAtom> atoms;

    public RegexpBranch(List<QuantifiedAtom> atoms) {
        this.atoms = Collections.unmodifiableList(atoms);
    }

    public List<QuantifiedAtom> getAtoms() {
        return atoms;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        atoms.forEach(sb::append);
        return sb.toString();
    }
}
