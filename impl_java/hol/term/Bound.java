package hol.term;

import hol.type.Type;

public record Bound(Binder binder) implements Term {

    public Type type() {
        return binder.type();
    }

    @Override
    public Term subst(TermSubstitution substitution) {
        return substitution.find(this).orElse(this);
    }

    @Override
    public String toString() {
        return binder.name();
    }
}
