package hol.resolver;

import hol.Ident;
import hol.scope.Scope;
import hol.term.App;
import hol.term.Binder;
import hol.term.Bound;
import hol.term.Free;
import hol.term.Id;
import hol.term.Qnt;
import hol.term.Quant;
import hol.term.Term;
import hol.term.TermShapeException;
import hol.term.Terms;
import hol.type.Type;
import hol.type.TypeSubstitution;
import hol.type.TypeUnificationException;
import hol.type.TypeVar;
import hol.type.Types;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Overloading resolution.
 * <p>
 * An overloaded symbol is a short name shared by several identifiers, each with its own type.
 * When the symbol occurs in a term a type is inferred for it and the identifiers are searched,
 * in order, for one whose type matches. The first match is used. If nothing matches, the first
 * identifier in the list is chosen.
 */
public class Resolver {
    private static final Logger LOGGER = Logger.getLogger(Resolver.class.getName());
    private static final ResolverSettings SETTINGS = ResolverSettings.load();

    public record Resolution(Term term, TypeSubstitution typeSubst) {
    }

    public record Resolved(Term term, Type type, TypeSubstitution typeSubst) {
    }

    public static Resolution resolveTerm(Scope scope, Lookup lookup, Term term) {
        return resolveTerm(scope, lookup, term, SETTINGS);
    }

    /**
     * Replace each free symbol {@code Free(s, ty)} in {@code term} by the identifier {@code lookup}
     * gives for {@code s} at type {@code ty}. Symbols {@code lookup} cannot find are left as they are.
     *
     * @throws TypeUnificationException if the chosen identifiers do not fit the term
     */
    public static Resolution resolveTerm(Scope scope, Lookup lookup, Term term, ResolverSettings settings) {
        ResolveArgs args = ResolveArgs.create(scope, lookup, settings, term);
        Resolved resolved = resolveAux(args, TypeSubstitution.empty(), args.freshVar(), term);
        Term result = Terms.retype(resolved.typeSubst(), resolved.term());
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Resolved %s to %s, %d fresh type variables, %s",
                    term, result, args.freshCount(), args.memo()));
        }
        return new Resolution(result, resolved.typeSubst());
    }

    /**
     * A lookup function over {@code db}: the first candidate whose type unifies with the
     * occurrence type in {@code scope}, or the first candidate if none does.
     */
    public static Lookup makeLookup(Scope scope, OverloadDb db) {
        return (symbol, type) -> {
            Optional<List<Candidate>> candidates = db.candidates(symbol);
            if (candidates.isEmpty() || candidates.get().isEmpty()) {
                return LookupResult.notFound();
            }
            return LookupResult.found(selectCandidate(scope, symbol, type, candidates.get()));
        };
    }

    /**
     * The candidate chosen for {@code name} at {@code type}, by the same rule as {@link #makeLookup}.
     *
     * @throws TermShapeException if there are no candidates
     */
    public static Candidate findType(Scope scope, String name, Type type, List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            throw new TermShapeException("no candidates for symbol " + name);
        }
        return selectCandidate(scope, name, type, candidates);
    }

    /**
     * The candidate used when no candidate type matches: the first in the list.
     */
    public static Optional<Candidate> defaultCandidate(String name, Type type, List<Candidate> candidates) {
        if (candidates.isEmpty()) return Optional.empty();
        Candidate first = candidates.get(0);
        LOGGER.finer(() -> String.format("No candidate for %s matches %s, defaulting to %s", name, type, first));
        return Optional.of(first);
    }

    private static Candidate selectCandidate(Scope scope, String name, Type type, List<Candidate> candidates) {
        for (Candidate candidate : candidates) {
            if (scope.matches(type, candidate.type())) return candidate;
        }
        return defaultCandidate(name, type, candidates).orElseThrow();
    }

    /**
     * Resolve {@code term} against {@code expected}, returning the new term, its type and the
     * extended type substitution.
     */
    public static Resolved resolveAux(ResolveArgs args, TypeSubstitution env, Type expected, Term term) {
        if (term instanceof Id id) {
            return resolveIdent(args, env, expected, id.ident(), id.type(), id.type());
        } else if (term instanceof Free free) {
            return resolveFree(args, env, expected, free);
        } else if (term instanceof Bound bound) {
            Term replacement = args.qnts().find(bound).orElse(bound);
            Type type = ((Bound) replacement).type();
            return new Resolved(replacement, type, unify(args.scope(), expected, type, env));
        } else if (term instanceof App app) {
            TypeVar argType = args.freshVar();
            Resolved fun = resolveAux(args, env, Types.fun(argType, expected), app.fun());
            Resolved arg = resolveAux(args, fun.typeSubst(), argType, app.arg());
            return new Resolved(new App(fun.term(), arg.term()), expected, arg.typeSubst());
        } else if (term instanceof Qnt qnt) {
            return resolveQnt(args, env, expected, qnt);
        }
        throw new IllegalStateException("unknown term kind: " + term);
    }

    /**
     * Return the value stored in {@code table} for {@code key}, computing and storing it on a miss.
     */
    public static <K, C, V> V memoFind(Map<K, V> table, BiFunction<C, K, V> compute, C context, K key) {
        V value = table.get(key);
        if (value != null) return value;
        value = compute.apply(context, key);
        table.put(key, value);
        return value;
    }

    /**
     * Instantiate the type of {@code ident} and unify it with the type written at the occurrence,
     * then with the context.
     */
    private static Resolved resolveIdent(ResolveArgs args, TypeSubstitution env, Type expected,
                                         Ident ident, Type fallback, Type occurrence) {
        Type scheme = cached(args, args.memo().types(),
                (scope, id) -> scope.findIdentType(id).orElse(fallback), ident);
        Type instance = Types.instantiate(scheme, args::freshVar);
        TypeSubstitution env1 = unify(args.scope(), instance, occurrence, env);
        TypeSubstitution env2 = unify(args.scope(), expected, instance, env1);
        return new Resolved(new Id(ident, instance), instance, env2);
    }

    private static Resolved resolveFree(ResolveArgs args, TypeSubstitution env, Type expected, Free free) {
        String name = free.name();
        Type inferred = Types.setNames(free.type(),
                typeName -> cached(args, args.memo().typeNames(), Scope::findTypeTheory, typeName));

        if (Ident.isQualified(name)) {
            Optional<Ident> ident = cached(args, args.memo().symbols(),
                    (scope, sym) -> Optional.of(Ident.parse(sym)).filter(scope::isDeclared), name);
            if (ident.isPresent()) {
                return resolveIdent(args, env, expected, ident.get(), inferred, inferred);
            }
            return unresolved(args, env, expected, name, inferred);
        }

        Ident cachedIdent = args.settings().memoEnabled() ? args.memo().idents().get(name) : null;
        if (cachedIdent != null) {
            return resolveIdent(args, env, expected, cachedIdent, inferred, inferred);
        }

        Type hint = args.scope().unify(inferred, expected, env).orElse(env).apply(inferred);
        LookupResult result = args.lookup().lookup(name, hint);
        if (result instanceof LookupResult.Found found) {
            if (args.settings().memoEnabled()) {
                args.memo().idents().put(name, found.ident());
                args.memo().types().putIfAbsent(found.ident(), found.type());
            }
            return resolveIdent(args, env, expected, found.ident(), found.type(), inferred);
        }
        return unresolved(args, env, expected, name, inferred);
    }

    private static Resolved unresolved(ResolveArgs args, TypeSubstitution env, Type expected,
                                       String name, Type inferred) {
        LOGGER.finer(() -> "Leaving symbol " + name + " unresolved");
        return new Resolved(new Free(name, inferred), inferred, unify(args.scope(), expected, inferred, env));
    }

    private static Resolved resolveQnt(ResolveArgs args, TypeSubstitution env, Type expected, Qnt qnt) {
        Binder old = qnt.binder();
        Binder binder = old.copy();
        ResolveArgs inner = args.withQnts(args.qnts().bind(new Bound(old), new Bound(binder)));

        TypeSubstitution env1;
        Type bodyType;
        if (old.quant() == Quant.LAMBDA) {
            bodyType = args.freshVar();
            env1 = unify(args.scope(), expected, Types.fun(binder.type(), bodyType), env);
        } else {
            bodyType = Types.BOOL;
            env1 = unify(args.scope(), expected, Types.BOOL, env);
        }
        Resolved body = resolveAux(inner, env1, bodyType, qnt.body());
        return new Resolved(new Qnt(binder, body.term()), expected, body.typeSubst());
    }

    private static TypeSubstitution unify(Scope scope, Type t1, Type t2, TypeSubstitution env) {
        return scope.unify(t1, t2, env)
                .orElseThrow(() -> new TypeUnificationException(env.apply(t1), env.apply(t2)));
    }

    private static <K, V> V cached(ResolveArgs args, Map<K, V> table, BiFunction<Scope, K, V> compute, K key) {
        if (!args.settings().memoEnabled()) {
            return compute.apply(args.scope(), key);
        }
        return memoFind(table, compute, args.scope(), key);
    }
}
