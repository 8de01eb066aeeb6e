package hol.scope;

import com.google.common.collect.ImmutableMap;
import hol.Ident;
import hol.type.Type;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A scope backed by fixed tables of declared identifiers and type names.
 */
public final class TheoryScope implements Scope {
    private final ImmutableMap<Ident, Type> identTypes;
    private final ImmutableMap<String, String> typeTheories;

    private TheoryScope(Map<Ident, Type> identTypes, Map<String, String> typeTheories) {
        this.identTypes = ImmutableMap.copyOf(identTypes);
        this.typeTheories = ImmutableMap.copyOf(typeTheories);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TheoryScope empty() {
        return builder().build();
    }

    @Override
    public Optional<Type> findIdentType(Ident ident) {
        return Optional.ofNullable(identTypes.get(ident));
    }

    @Override
    public Optional<String> findTypeTheory(String typeName) {
        return Optional.ofNullable(typeTheories.get(typeName));
    }

    public static final class Builder {
        private final Map<Ident, Type> identTypes = new LinkedHashMap<>();
        private final Map<String, String> typeTheories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder declare(Ident ident, Type type) {
            identTypes.put(ident, type);
            return this;
        }

        public Builder declareType(String thyId, String typeName) {
            typeTheories.put(typeName, thyId);
            return this;
        }

        public TheoryScope build() {
            return new TheoryScope(identTypes, typeTheories);
        }
    }
}
