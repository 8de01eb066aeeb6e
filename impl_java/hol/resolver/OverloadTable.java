package hol.resolver;

import hol.Ident;
import hol.type.Type;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Identifiers sharing a symbol, kept in search order. New entries go to the front unless a
 * position is given.
 */
public class OverloadTable implements OverloadDb {
    private final Map<String, List<Candidate>> table = new HashMap<>();

    public void add(String symbol, Ident ident, Type type) {
        add(symbol, 0, ident, type);
    }

    /**
     * Insert at {@code position}, counted from the front. Positions past the end append.
     */
    public void add(String symbol, int position, Ident ident, Type type) {
        if (position < 0) throw new IllegalArgumentException("negative overload position: " + position);
        List<Candidate> list = table.computeIfAbsent(symbol, k -> new ArrayList<>());
        list.add(Math.min(position, list.size()), new Candidate(ident, type));
    }

    /**
     * Remove every overloading of {@code symbol} by {@code ident}. The entry goes when its list empties.
     */
    public void remove(String symbol, Ident ident) {
        List<Candidate> list = table.get(symbol);
        if (list == null) return;
        list.removeIf(c -> c.ident().equals(ident));
        if (list.isEmpty()) table.remove(symbol);
    }

    @Override
    public Optional<List<Candidate>> candidates(String symbol) {
        return Optional.ofNullable(table.get(symbol)).map(List::copyOf);
    }

    public boolean contains(String symbol) {
        return table.containsKey(symbol);
    }

    @Override
    public String toString() {
        return table.toString();
    }
}
