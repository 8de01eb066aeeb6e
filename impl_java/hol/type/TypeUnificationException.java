package hol.type;

import hol.HolException;

public class TypeUnificationException extends HolException {
    private final Type left;
    private final Type right;

    public TypeUnificationException(Type left, Type right) {
        super(String.format("types do not unify: %s and %s", left, right));
        this.left = left;
        this.right = right;
    }

    public Type left() {
        return left;
    }

    public Type right() {
        return right;
    }
}
