package hol.type;

import java.util.HashSet;
import java.util.Set;

public record TypeVar(String name) implements Type {

    public static TypeVar fresh(String prefix, int num) {
        return new TypeVar(prefix + num);
    }

    @Override
    public Type applySub(TypeSubstitution substitution) {
        return substitution.lookup(this)
                .map(t -> t.applySub(substitution))
                .orElse(this);
    }

    @Override
    public Set<TypeVar> vars() {
        return new HashSet<>(Set.of(this));
    }

    @Override
    public String toString() {
        return "'" + name;
    }
}
