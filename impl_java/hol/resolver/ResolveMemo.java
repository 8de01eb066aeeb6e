package hol.resolver;

import hol.Ident;
import hol.type.Type;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Memo tables for one resolution run. Entries are never invalidated during the run.
 */
public final class ResolveMemo {
    private final Map<Ident, Type> types = new HashMap<>();
    private final Map<String, Ident> idents = new HashMap<>();
    private final Map<String, Optional<Ident>> symbols = new HashMap<>();
    private final Map<String, Optional<String>> typeNames = new HashMap<>();

    /**
     * Declared type schemes of identifiers.
     */
    public Map<Ident, Type> types() {
        return types;
    }

    /**
     * Successful resolutions of short symbols.
     */
    public Map<String, Ident> idents() {
        return idents;
    }

    /**
     * Resolutions of theory-qualified symbols, including failed ones.
     */
    public Map<String, Optional<Ident>> symbols() {
        return symbols;
    }

    /**
     * Owning theory of each type name.
     */
    public Map<String, Optional<String>> typeNames() {
        return typeNames;
    }

    @Override
    public String toString() {
        return String.format("ResolveMemo[types=%d, idents=%d, symbols=%d, typeNames=%d]",
                types.size(), idents.size(), symbols.size(), typeNames.size());
    }
}
