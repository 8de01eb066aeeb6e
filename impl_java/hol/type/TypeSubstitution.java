package hol.type;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bindings of type variables to types. Binding never mutates, it returns a new substitution.
 */
public final class TypeSubstitution {
    private static final TypeSubstitution EMPTY = new TypeSubstitution(ImmutableMap.of());

    private final ImmutableMap<TypeVar, Type> map;

    private TypeSubstitution(ImmutableMap<TypeVar, Type> map) {
        this.map = map;
    }

    public static TypeSubstitution empty() {
        return EMPTY;
    }

    public Optional<Type> lookup(TypeVar var) {
        return Optional.ofNullable(map.get(var));
    }

    public TypeSubstitution bind(TypeVar var, Type type) {
        Map<TypeVar, Type> newMap = new LinkedHashMap<>(map);
        newMap.put(var, type);
        return new TypeSubstitution(ImmutableMap.copyOf(newMap));
    }

    /**
     * Replace every bound variable in {@code type}, following chains of bindings.
     */
    public Type apply(Type type) {
        return type.applySub(this);
    }

    /**
     * Follow the bindings of a variable until an unbound variable or a constructor is reached.
     */
    public Type chase(Type type) {
        Type current = type;
        while (current instanceof TypeVar var && map.containsKey(var)) {
            current = map.get(var);
        }
        return current;
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public int size() {
        return map.size();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TypeSubstitution other && map.equals(other.map);
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
