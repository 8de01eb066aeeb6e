package hol.term;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable bindings of terms to terms. Bound variables are keyed by their binder's identity.
 */
public final class TermSubstitution {
    private static final TermSubstitution EMPTY = new TermSubstitution(ImmutableMap.of());

    private final ImmutableMap<Term, Term> map;

    private TermSubstitution(ImmutableMap<Term, Term> map) {
        this.map = map;
    }

    public static TermSubstitution empty() {
        return EMPTY;
    }

    public Optional<Term> find(Term term) {
        return Optional.ofNullable(map.get(term));
    }

    public boolean member(Term term) {
        return map.containsKey(term);
    }

    public TermSubstitution bind(Term term, Term replacement) {
        Map<Term, Term> newMap = new LinkedHashMap<>(map);
        newMap.put(term, replacement);
        return new TermSubstitution(ImmutableMap.copyOf(newMap));
    }

    public TermSubstitution remove(Term term) {
        if (!map.containsKey(term)) return this;
        Map<Term, Term> newMap = new LinkedHashMap<>(map);
        newMap.remove(term);
        return new TermSubstitution(ImmutableMap.copyOf(newMap));
    }

    public Set<Term> keys() {
        return map.keySet();
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
