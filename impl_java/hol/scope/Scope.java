package hol.scope;

import hol.Ident;
import hol.type.Type;
import hol.type.TypeSubstitution;
import hol.type.TypeUnifier;

import java.util.Optional;

/**
 * The theories visible to an operation, with the name and type services they provide.
 * Read-only from the point of view of the resolver.
 */
public interface Scope {
    /**
     * The declared type of {@code ident}, empty if no visible theory declares it.
     */
    Optional<Type> findIdentType(Ident ident);

    /**
     * The theory that declares the type named {@code typeName}.
     */
    Optional<String> findTypeTheory(String typeName);

    default boolean isDeclared(Ident ident) {
        return findIdentType(ident).isPresent();
    }

    default Optional<TypeSubstitution> unify(Type t1, Type t2, TypeSubstitution env) {
        return TypeUnifier.unify(t1, t2, env);
    }

    default boolean matches(Type t1, Type t2) {
        return TypeUnifier.matches(t1, t2);
    }
}
