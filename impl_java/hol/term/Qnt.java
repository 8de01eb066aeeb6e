package hol.term;

public record Qnt(Binder binder, Term body) implements Term {

    public Quant quant() {
        return binder.quant();
    }

    @Override
    public Term subst(TermSubstitution substitution) {
        var bound = substitution.find(this);
        if (bound.isPresent()) return bound.get();
        return new Qnt(binder, body.subst(substitution));
    }

    @Override
    public String toString() {
        return "(" + binder.quant().symbol() + binder.name() + ": " + body + ")";
    }
}
