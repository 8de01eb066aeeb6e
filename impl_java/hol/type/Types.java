package hol.type;

import hol.Ident;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

public class Types {
    public static final String BASE_THY = "base";
    public static final String NUMS_THY = "nums";

    public static final Ident BOOL_ID = Ident.mkLong(BASE_THY, "bool");
    public static final Ident FUN_ID = Ident.mkLong(BASE_THY, "FUN");
    public static final Ident IND_ID = Ident.mkLong(BASE_THY, "ind");
    public static final Ident NUM_ID = Ident.mkLong(NUMS_THY, "num");

    public static final Type BOOL = new TypeConstructor(BOOL_ID, List.of());
    public static final Type IND = new TypeConstructor(IND_ID, List.of());
    public static final Type NUM = new TypeConstructor(NUM_ID, List.of());

    public static Type var(String name) {
        return new TypeVar(name);
    }

    public static Type constant(Ident ident, Type... args) {
        return new TypeConstructor(ident, List.of(args));
    }

    public static Type fun(Type arg, Type result) {
        return new TypeConstructor(FUN_ID, List.of(arg, result));
    }

    /**
     * {@code funOf(a, b, c)} is {@code a -> (b -> c)}.
     */
    public static Type funOf(Type first, Type... rest) {
        if (rest.length == 0) return first;
        Type result = rest[rest.length - 1];
        for (int i = rest.length - 2; i >= 0; i--) {
            result = fun(rest[i], result);
        }
        return fun(first, result);
    }

    public static boolean isFun(Type type) {
        return type instanceof TypeConstructor c && c.ident().equals(FUN_ID) && c.args().size() == 2;
    }

    /**
     * Rename every variable of a type scheme to a fresh variable, one fresh name per distinct variable.
     */
    public static Type instantiate(Type scheme, Supplier<TypeVar> fresh) {
        var vars = scheme.vars();
        if (vars.isEmpty()) return scheme;
        TypeSubstitution renaming = TypeSubstitution.empty();
        for (TypeVar v : vars) {
            renaming = renaming.bind(v, fresh.get());
        }
        return scheme.applySub(renaming);
    }

    /**
     * Replace short type constructor names with their long form. Names for which
     * {@code findTheory} has no answer are left short.
     */
    public static Type setNames(Type type, Function<String, Optional<String>> findTheory) {
        if (type instanceof TypeConstructor c) {
            Ident ident = c.ident();
            if (ident.isShort()) {
                ident = findTheory.apply(ident.name())
                        .map(thy -> Ident.mkLong(thy, c.name()))
                        .orElse(ident);
            }
            List<Type> args = c.args().stream().map(a -> setNames(a, findTheory)).toList();
            return new TypeConstructor(ident, args);
        }
        return type;
    }
}
