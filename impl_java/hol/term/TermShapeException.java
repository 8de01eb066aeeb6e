package hol.term;

import hol.HolException;

import java.util.List;

/**
 * Raised when a term does not have the shape an operation needs, e.g. destructing a non-application.
 */
public class TermShapeException extends HolException {
    private final List<Term> terms;

    public TermShapeException(String message, Term... terms) {
        super(terms.length == 0 ? message : message + ": " + List.of(terms));
        this.terms = List.of(terms);
    }

    public List<Term> terms() {
        return terms;
    }
}
