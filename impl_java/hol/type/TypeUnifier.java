package hol.type;

import java.util.Optional;

public class TypeUnifier {
    public static Optional<TypeSubstitution> unify(Type t1, Type t2) {
        return unify(t1, t2, TypeSubstitution.empty());
    }

    public static Optional<TypeSubstitution> unify(Type t1, Type t2, TypeSubstitution theta) {
        t1 = theta.chase(t1);
        t2 = theta.chase(t2);

        if (t1.equals(t2)) {
            return Optional.of(theta);
        } else if (t1 instanceof TypeVar var) {
            return unifyVar(var, t2, theta);
        } else if (t2 instanceof TypeVar var) {
            return unifyVar(var, t1, theta);
        } else if (t1 instanceof TypeConstructor c1 && t2 instanceof TypeConstructor c2) {
            if (!c1.ident().equals(c2.ident()) || c1.args().size() != c2.args().size()) {
                return Optional.empty();
            }
            TypeSubstitution current = theta;
            for (int i = 0; i < c1.args().size(); i++) {
                var res = unify(c1.args().get(i), c2.args().get(i), current);
                if (res.isEmpty()) return Optional.empty();
                current = res.get();
            }
            return Optional.of(current);
        } else {
            return Optional.empty();
        }
    }

    /**
     * True if {@code t1} and {@code t2} can be made equal by instantiating variables of either.
     */
    public static boolean matches(Type t1, Type t2) {
        return unify(t1, t2).isPresent();
    }

    private static Optional<TypeSubstitution> unifyVar(TypeVar var, Type type, TypeSubstitution theta) {
        if (type.equals(var)) {
            return Optional.of(theta);
        } else if (occursCheck(var, type, theta)) {
            return Optional.empty();
        } else {
            return Optional.of(theta.bind(var, type));
        }
    }

    private static boolean occursCheck(TypeVar var, Type type, TypeSubstitution theta) {
        Type chased = theta.chase(type);
        if (chased instanceof TypeVar v) {
            return v.equals(var);
        } else if (chased instanceof TypeConstructor c) {
            for (Type arg : c.args()) {
                if (occursCheck(var, arg, theta)) return true;
            }
        }
        return false;
    }
}
