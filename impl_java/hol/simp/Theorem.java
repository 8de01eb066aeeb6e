package hol.simp;

import hol.term.Term;

/**
 * A theorem as handed over by the logic kernel: the formula it proves.
 */
public record Theorem(Term formula) {
    @Override
    public String toString() {
        return "|- " + formula;
    }
}
