package hol.term;

import hol.Ident;
import hol.type.Type;
import hol.type.TypeSubstitution;
import hol.type.TypeVar;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class Terms {

    public record Binop(Ident ident, Term left, Term right) {
    }

    public record Stripped(List<Binder> binders, Term body) {
        public Stripped {
            binders = List.copyOf(binders);
        }
    }

    /**
     * {@code mkComb(f, a1, a2)} is {@code ((f a1) a2)}.
     */
    public static Term mkComb(Term fun, Term... args) {
        return mkComb(fun, List.of(args));
    }

    public static Term mkComb(Term fun, List<Term> args) {
        Term result = fun;
        for (Term arg : args) {
            result = new App(result, arg);
        }
        return result;
    }

    /**
     * {@code flattenApp(((f a1) a2) a3)} is {@code [f, a1, a2, a3]}.
     */
    public static List<Term> flattenApp(Term term) {
        List<Term> out = new ArrayList<>();
        Term current = term;
        while (current instanceof App app) {
            out.add(0, app.arg());
            current = app.fun();
        }
        out.add(0, current);
        return out;
    }

    /**
     * Destruct {@code ((f l) r)} where {@code f} is an identifier.
     */
    public static Binop destBinop(Term term) {
        List<Term> parts = flattenApp(term);
        if (parts.size() != 3 || !(parts.get(0) instanceof Id id)) {
            throw new TermShapeException("not a binary operator", term);
        }
        return new Binop(id.ident(), parts.get(1), parts.get(2));
    }

    public static boolean isBinop(Ident ident, Term term) {
        List<Term> parts = flattenApp(term);
        return parts.size() == 3 && parts.get(0) instanceof Id id && id.ident().equals(ident);
    }

    /**
     * Remove the outermost quantifiers of kind {@code quant}.
     */
    public static Stripped stripQnt(Quant quant, Term term) {
        List<Binder> binders = new ArrayList<>();
        Term current = term;
        while (current instanceof Qnt qnt && qnt.quant() == quant) {
            binders.add(qnt.binder());
            current = qnt.body();
        }
        return new Stripped(binders, current);
    }

    public static Term rebuildQnt(List<Binder> binders, Term body) {
        Term result = body;
        for (int i = binders.size() - 1; i >= 0; i--) {
            result = new Qnt(binders.get(i), result);
        }
        return result;
    }

    /**
     * Reset the types of identifiers, free symbols and binders using {@code env}. A binder whose
     * type does not change is kept, so an already well-typed term comes back equal to itself.
     */
    /**
     * The type variables occurring in the types of {@code term}, binder types included.
     */
    public static Set<TypeVar> typeVars(Term term) {
        Set<TypeVar> vars = new HashSet<>();
        collectTypeVars(term, vars);
        return vars;
    }

    private static void collectTypeVars(Term term, Set<TypeVar> vars) {
        if (term instanceof Id id) {
            vars.addAll(id.type().vars());
        } else if (term instanceof Free free) {
            vars.addAll(free.type().vars());
        } else if (term instanceof Bound bound) {
            vars.addAll(bound.type().vars());
        } else if (term instanceof App app) {
            collectTypeVars(app.fun(), vars);
            collectTypeVars(app.arg(), vars);
        } else if (term instanceof Qnt qnt) {
            vars.addAll(qnt.binder().type().vars());
            collectTypeVars(qnt.body(), vars);
        }
    }

    public static Term retype(TypeSubstitution env, Term term) {
        if (env.isEmpty()) return term;
        return retype(env, term, new IdentityHashMap<>());
    }

    private static Term retype(TypeSubstitution env, Term term, Map<Binder, Binder> binders) {
        if (term instanceof Id id) {
            return new Id(id.ident(), env.apply(id.type()));
        } else if (term instanceof Free free) {
            return new Free(free.name(), env.apply(free.type()));
        } else if (term instanceof Bound bound) {
            return new Bound(binders.getOrDefault(bound.binder(), bound.binder()));
        } else if (term instanceof App app) {
            return new App(retype(env, app.fun(), binders), retype(env, app.arg(), binders));
        } else if (term instanceof Qnt qnt) {
            Binder old = qnt.binder();
            Type newType = env.apply(old.type());
            Binder binder = newType.equals(old.type()) ? old : old.withType(newType);
            binders.put(old, binder);
            return new Qnt(binder, retype(env, qnt.body(), binders));
        }
        throw new IllegalStateException("unknown term kind: " + term);
    }
}
