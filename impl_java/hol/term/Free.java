package hol.term;

import hol.type.Type;

/**
 * An unresolved occurrence of a short name with the type inferred for it.
 */
public record Free(String name, Type type) implements Term {

    @Override
    public Term subst(TermSubstitution substitution) {
        return substitution.find(this).orElse(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
