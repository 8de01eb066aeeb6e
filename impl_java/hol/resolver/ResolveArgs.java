package hol.resolver;

import hol.scope.Scope;
import hol.term.Term;
import hol.term.TermSubstitution;
import hol.term.Terms;
import hol.type.TypeVar;

/**
 * The context threaded through one resolution run. The counter and memo tables are shared by
 * every copy made with {@link #withQnts}; a new run must start from {@link #create}.
 * <p>
 * Fresh type variables are numbered past any variable of the input term that already has the
 * fresh-variable form, so the two never collide.
 */
public final class ResolveArgs {
    private final Scope scope;
    private final Counter counter;
    private final ResolveMemo memo;
    private final TermSubstitution qnts;
    private final Lookup lookup;
    private final ResolverSettings settings;

    private ResolveArgs(Scope scope, Counter counter, ResolveMemo memo, TermSubstitution qnts,
                        Lookup lookup, ResolverSettings settings) {
        this.scope = scope;
        this.counter = counter;
        this.memo = memo;
        this.qnts = qnts;
        this.lookup = lookup;
        this.settings = settings;
    }

    public static ResolveArgs create(Scope scope, Lookup lookup, ResolverSettings settings) {
        return new ResolveArgs(scope, new Counter(0), new ResolveMemo(), TermSubstitution.empty(), lookup, settings);
    }

    public static ResolveArgs create(Scope scope, Lookup lookup, ResolverSettings settings, Term term) {
        int start = highestFreshNumber(settings.typeVarPrefix(), term);
        return new ResolveArgs(scope, new Counter(start), new ResolveMemo(), TermSubstitution.empty(), lookup, settings);
    }

    private static int highestFreshNumber(String prefix, Term term) {
        int highest = 0;
        for (TypeVar v : Terms.typeVars(term)) {
            String name = v.name();
            if (name.length() > prefix.length() && name.startsWith(prefix)) {
                String digits = name.substring(prefix.length());
                if (digits.chars().allMatch(Character::isDigit) && digits.length() < 10) {
                    highest = Math.max(highest, Integer.parseInt(digits));
                }
            }
        }
        return highest;
    }

    public ResolveArgs withQnts(TermSubstitution newQnts) {
        return new ResolveArgs(scope, counter, memo, newQnts, lookup, settings);
    }

    public TypeVar freshVar() {
        return TypeVar.fresh(settings.typeVarPrefix(), ++counter.value);
    }

    public int freshCount() {
        return counter.value;
    }

    public Scope scope() {
        return scope;
    }

    public ResolveMemo memo() {
        return memo;
    }

    public TermSubstitution qnts() {
        return qnts;
    }

    public Lookup lookup() {
        return lookup;
    }

    public ResolverSettings settings() {
        return settings;
    }

    private static final class Counter {
        private int value;

        private Counter(int value) {
            this.value = value;
        }
    }
}
