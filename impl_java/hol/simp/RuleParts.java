package hol.simp;

import hol.term.Binder;
import hol.term.Term;

import java.util.List;
import java.util.Optional;

/**
 * A rewrite rule {@code !x1 .. xn: cond => lhs = rhs} taken apart. The condition is optional.
 */
public record RuleParts(List<Binder> binders, Optional<Term> condition, Term lhs, Term rhs) {
    public RuleParts {
        binders = List.copyOf(binders);
    }

    public boolean isConditional() {
        return condition.isPresent();
    }
}
