package hol.simp;

import hol.Language;
import hol.scope.Scope;
import hol.term.App;
import hol.term.Binder;
import hol.term.Bound;
import hol.term.Qnt;
import hol.term.Quant;
import hol.term.Term;
import hol.term.TermShapeException;
import hol.term.TermSubstitution;
import hol.term.Terms;

import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Utility functions for preparing rewrite rules.
 */
public class SimpUtils {
    private static final Logger LOGGER = Logger.getLogger(SimpUtils.class.getName());

    /**
     * The parts of {@code !x1 .. xn: body}, with {@code body} split into condition and
     * consequent when it is an implication.
     */
    public record QntCond(List<Binder> binders, Optional<Term> condition, Term body) {
        public QntCond {
            binders = List.copyOf(binders);
        }
    }

    /**
     * Test for the variables of a rule: bound variables whose binder is in {@code binders}.
     */
    public static Predicate<Term> isVariable(List<Binder> binders) {
        return t -> t instanceof Bound bound && binders.contains(bound.binder());
    }

    /**
     * Split a rule into its universally quantified variables, its condition and its equation.
     */
    public static QntCond stripQntCond(Term term) {
        Terms.Stripped stripped = Terms.stripQnt(Quant.ALL, term);
        Term body = stripped.body();
        if (Language.isImplies(body)) {
            Terms.Binop binop = Terms.destBinop(body);
            return new QntCond(stripped.binders(), Optional.of(binop.left()), binop.right());
        }
        return new QntCond(stripped.binders(), Optional.empty(), body);
    }

    /**
     * Like {@link #stripQntCond} but also take the equation apart.
     *
     * @throws TermShapeException if the rule does not end in an equation
     */
    public static RuleParts destRule(Term term) {
        QntCond parts = stripQntCond(term);
        Terms.Binop eq = Language.destEquality(parts.body());
        return new RuleParts(parts.binders(), parts.condition(), eq.left(), eq.right());
    }

    /**
     * Terms {@code x} and {@code y} are equal up to the positions where {@code varp} holds on
     * both sides. A rule whose sides are equal in this sense, e.g. {@code (x and y) = (y and x)},
     * can loop when used as a left-to-right rewrite.
     */
    public static boolean equalUptoVars(Predicate<Term> varp, Term x, Term y) {
        if (varp.test(x) && varp.test(y)) return true;
        if (x instanceof App app1 && y instanceof App app2) {
            return equalUptoVars(varp, app1.fun(), app2.fun())
                    && equalUptoVars(varp, app1.arg(), app2.arg());
        }
        if (x instanceof Qnt qnt1 && y instanceof Qnt qnt2) {
            return qnt1.quant() == qnt2.quant() && equalUptoVars(varp, qnt1.body(), qnt2.body());
        }
        return x.equals(y);
    }

    /**
     * Add to {@code vars} every bound variable of {@code term} whose binder satisfies {@code isVar}.
     */
    public static TermSubstitution findVariables(Predicate<Binder> isVar, TermSubstitution vars, Term term) {
        if (term instanceof Bound bound) {
            if (isVar.test(bound.binder()) && !vars.member(term)) {
                return vars.bind(term, term);
            }
            return vars;
        } else if (term instanceof Qnt qnt) {
            return findVariables(isVar, vars, qnt.body());
        } else if (term instanceof App app) {
            return findVariables(isVar, findVariables(isVar, vars, app.fun()), app.arg());
        }
        return vars;
    }

    /**
     * Check that every bound variable of {@code term} whose binder satisfies {@code isVar} is in {@code vars}.
     */
    public static boolean checkVariables(Predicate<Binder> isVar, TermSubstitution vars, Term term) {
        if (term instanceof Bound bound) {
            return !isVar.test(bound.binder()) || vars.member(term);
        } else if (term instanceof Qnt qnt) {
            return checkVariables(isVar, vars, qnt.body());
        } else if (term instanceof App app) {
            return checkVariables(isVar, vars, app.fun()) && checkVariables(isVar, vars, app.arg());
        }
        return true;
    }

    /**
     * Apply {@code f} to each element and repeat on the elements it returns. An element {@code f}
     * throws on is kept as it is. Results are accumulated at the front of the list, so the last
     * element produced comes first.
     */
    public static <T> List<T> applyMergeList(Function<T, List<T>> f, List<T> items) {
        LinkedList<T> result = new LinkedList<>();
        mergeAux(f, items, result);
        return result;
    }

    private static <T> void mergeAux(Function<T, List<T>> f, List<T> items, LinkedList<T> result) {
        for (T x : items) {
            List<T> expanded;
            try {
                expanded = f.apply(x);
            } catch (RuntimeException e) {
                LOGGER.finest(() -> "Keeping " + x + ": " + e.getMessage());
                result.addFirst(x);
                continue;
            }
            mergeAux(f, expanded, result);
        }
    }

    /**
     * Beta-reduce {@code term} if it has the form {@code (%x: F) a}.
     *
     * @throws TermShapeException if {@code term} is not a lambda application
     */
    public static Term simpBetaConv(LogicKernel kernel, Scope scope, Term term) {
        if (term instanceof App app && Language.isLambda(app.fun())) {
            return kernel.betaReduce(scope, term);
        }
        throw new TermShapeException("simpBetaConv", term);
    }

    public static boolean freshThm(LogicKernel kernel, Scope scope, Theorem theorem) {
        return kernel.isFresh(scope, theorem);
    }
}
