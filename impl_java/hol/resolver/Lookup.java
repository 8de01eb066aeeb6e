package hol.resolver;

import hol.type.Type;

/**
 * Find the identifier a symbol denotes at an occurrence with the given inferred type.
 */
@FunctionalInterface
public interface Lookup {
    LookupResult lookup(String symbol, Type type);
}
