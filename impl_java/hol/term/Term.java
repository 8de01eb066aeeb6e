package hol.term;

public sealed interface Term permits Bound, Free, Id, App, Qnt {
    /**
     * Replace every subterm bound in {@code substitution} with its binding.
     */
    Term subst(TermSubstitution substitution);
}
