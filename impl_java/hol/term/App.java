package hol.term;

public record App(Term fun, Term arg) implements Term {

    @Override
    public Term subst(TermSubstitution substitution) {
        var bound = substitution.find(this);
        if (bound.isPresent()) return bound.get();
        return new App(fun.subst(substitution), arg.subst(substitution));
    }

    @Override
    public String toString() {
        return "(" + fun + " " + arg + ")";
    }
}
