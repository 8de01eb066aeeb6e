package hol.simp;

import hol.Language;
import hol.scope.Scope;
import hol.term.App;
import hol.term.Bound;
import hol.term.Id;
import hol.term.Qnt;
import hol.term.Term;
import hol.term.TermShapeException;
import hol.term.TermSubstitution;

/**
 * Kernel operations that need nothing beyond the term structure and the scope.
 */
public class SimpleKernel implements LogicKernel {

    @Override
    public Term betaReduce(Scope scope, Term redex) {
        if (!(redex instanceof App app) || !Language.isLambda(app.fun())) {
            throw new TermShapeException("can't apply beta-reduction", redex);
        }
        Qnt lambda = (Qnt) app.fun();
        var env = TermSubstitution.empty().bind(new Bound(lambda.binder()), app.arg());
        return lambda.body().subst(env);
    }

    @Override
    public boolean isFresh(Scope scope, Theorem theorem) {
        return inScope(scope, theorem.formula());
    }

    private static boolean inScope(Scope scope, Term term) {
        if (term instanceof Id id) {
            return scope.isDeclared(id.ident());
        } else if (term instanceof App app) {
            return inScope(scope, app.fun()) && inScope(scope, app.arg());
        } else if (term instanceof Qnt qnt) {
            return inScope(scope, qnt.body());
        }
        return true;
    }
}
