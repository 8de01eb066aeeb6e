package hol.resolver;

import java.util.List;
import java.util.Optional;

/**
 * A source of overloading candidates, in search order. Empty if the symbol has no entry.
 */
@FunctionalInterface
public interface OverloadDb {
    Optional<List<Candidate>> candidates(String symbol);

    /**
     * Consult {@code fallback} for symbols this table has no entry for.
     */
    default OverloadDb orElse(OverloadDb fallback) {
        return symbol -> {
            var found = candidates(symbol);
            return found.isPresent() ? found : fallback.candidates(symbol);
        };
    }
}
