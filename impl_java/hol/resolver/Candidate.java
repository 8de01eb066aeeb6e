package hol.resolver;

import hol.Ident;
import hol.type.Type;

/**
 * One overloading of a symbol: an identifier with its type scheme.
 */
public record Candidate(Ident ident, Type type) {
    @Override
    public String toString() {
        return ident + ": " + type;
    }
}
