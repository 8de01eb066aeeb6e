package hol.resolver;

import hol.Ident;
import hol.type.Type;

public sealed interface LookupResult permits LookupResult.Found, LookupResult.NotFound {

    static LookupResult found(Ident ident, Type type) {
        return new Found(ident, type);
    }

    static LookupResult found(Candidate candidate) {
        return new Found(candidate.ident(), candidate.type());
    }

    static LookupResult notFound() {
        return NotFound.INSTANCE;
    }

    default boolean isFound() {
        return this instanceof Found;
    }

    record Found(Ident ident, Type type) implements LookupResult {
    }

    final class NotFound implements LookupResult {
        private static final NotFound INSTANCE = new NotFound();

        private NotFound() {
        }

        @Override
        public String toString() {
            return "NotFound";
        }
    }
}
