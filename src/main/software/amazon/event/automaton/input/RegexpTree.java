package software.amazon.event.automaton.input;

import java.util.Collections;
import java.util.List;

/**
 * A parsed regular expression: alternation branches, each a sequence of quantified atoms. An empty branch matches the
 * empty string.
 */
public final class RegexpTree {

    private final List<RegexpBranch> branches;

    public RegexpTree(List<RegexpBranch> branches) {
        this.branches = Collections.unmodifiableList(branches);
    }

    public List<RegexpBranch> getBranches() {
        return branches;
    }

    /**
     * True when no branch can consume anything, e.g. the tree of {@code ()}.
     */
    public boolean isEmpty() {
        for (RegexpBranch branch : branches) {
            if (!branch.getAtoms().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < branches.size(); i++) {
            if (i > 0) {
                sb.append('|');
            }
            sb.append(branches.get(i));
        }
        return sb.toString();
    }
}
