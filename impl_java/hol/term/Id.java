package hol.term;

import hol.Ident;
import hol.type.Type;

public record Id(Ident ident, Type type) implements Term {

    @Override
    public Term subst(TermSubstitution substitution) {
        return substitution.find(this).orElse(this);
    }

    @Override
    public String toString() {
        return ident.toString();
    }
}
