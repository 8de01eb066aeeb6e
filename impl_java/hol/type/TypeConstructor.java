package hol.type;

import hol.Ident;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record TypeConstructor(Ident ident, List<Type> args) implements Type {
    public TypeConstructor {
        args = List.copyOf(args);
    }

    public String name() {
        return ident.name();
    }

    @Override
    public Type applySub(TypeSubstitution substitution) {
        if (args.isEmpty()) return this;
        List<Type> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new TypeConstructor(ident, newArgs);
    }

    @Override
    public Set<TypeVar> vars() {
        return args.stream()
                .map(Type::vars)
                .reduce(new HashSet<>(), (set1, set2) -> {
                    set1.addAll(set2);
                    return set1;
                });
    }

    @Override
    public String toString() {
        if (Types.isFun(this)) {
            return "(" + args.get(0) + " -> " + args.get(1) + ")";
        }
        if (args.isEmpty()) return ident.toString();
        return "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")" + ident;
    }
}
