package hol.resolver;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Counts the requests made to an overload table, per symbol.
 */
class CountingOverloadDb implements OverloadDb {
    private final OverloadDb delegate;
    private final Map<String, Integer> calls = new HashMap<>();

    CountingOverloadDb(OverloadDb delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<List<Candidate>> candidates(String symbol) {
        calls.merge(symbol, 1, Integer::sum);
        return delegate.candidates(symbol);
    }

    int calls(String symbol) {
        return calls.getOrDefault(symbol, 0);
    }
}
