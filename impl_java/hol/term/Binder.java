package hol.term;

import hol.type.Type;

/**
 * A binding occurrence of a variable. Binders are compared by identity: two binders with the
 * same name and type introduced by different quantifiers are different variables.
 */
public final class Binder {
    private final Quant quant;
    private final String name;
    private final Type type;

    public Binder(Quant quant, String name, Type type) {
        this.quant = quant;
        this.name = name;
        this.type = type;
    }

    public Quant quant() {
        return quant;
    }

    public String name() {
        return name;
    }

    public Type type() {
        return type;
    }

    /**
     * A new binder with the same kind and name but a different type.
     */
    public Binder withType(Type newType) {
        return new Binder(quant, name, newType);
    }

    /**
     * A new binder with the same kind, name and type.
     */
    public Binder copy() {
        return new Binder(quant, name, type);
    }

    @Override
    public String toString() {
        return name;
    }
}
