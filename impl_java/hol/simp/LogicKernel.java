package hol.simp;

import hol.scope.Scope;
import hol.term.Term;

/**
 * The operations of the logic kernel used when preparing rewrite rules.
 */
public interface LogicKernel {
    /**
     * Reduce the redex {@code (%x: F) a} to {@code F[a/x]}. Only defined on lambda applications.
     */
    Term betaReduce(Scope scope, Term redex);

    /**
     * True if every identifier in {@code theorem} is still declared in {@code scope}.
     */
    boolean isFresh(Scope scope, Theorem theorem);
}
