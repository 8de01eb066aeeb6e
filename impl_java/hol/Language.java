package hol;

import hol.term.App;
import hol.term.Binder;
import hol.term.Id;
import hol.term.Qnt;
import hol.term.Quant;
import hol.term.Term;
import hol.term.TermShapeException;
import hol.term.Terms;
import hol.type.Type;
import hol.type.Types;

/**
 * The logical vocabulary of the base theory.
 */
public class Language {
    public static class Idents {
        public static final Ident TRUE = Ident.mkLong(Types.BASE_THY, "true");
        public static final Ident FALSE = Ident.mkLong(Types.BASE_THY, "false");
        public static final Ident NOT = Ident.mkLong(Types.BASE_THY, "not");
        public static final Ident AND = Ident.mkLong(Types.BASE_THY, "and");
        public static final Ident OR = Ident.mkLong(Types.BASE_THY, "or");
        public static final Ident IMPLIES = Ident.mkLong(Types.BASE_THY, "implies");
        public static final Ident EQUALS = Ident.mkLong(Types.BASE_THY, "equals");
    }

    private static final Type BOOL_BINOP = Types.funOf(Types.BOOL, Types.BOOL, Types.BOOL);

    public static final Term TRUE = new Id(Idents.TRUE, Types.BOOL);
    public static final Term FALSE = new Id(Idents.FALSE, Types.BOOL);

    public static Term mkNot(Term t) {
        return new App(new Id(Idents.NOT, Types.fun(Types.BOOL, Types.BOOL)), t);
    }

    public static Term mkAnd(Term left, Term right) {
        return Terms.mkComb(new Id(Idents.AND, BOOL_BINOP), left, right);
    }

    public static Term mkOr(Term left, Term right) {
        return Terms.mkComb(new Id(Idents.OR, BOOL_BINOP), left, right);
    }

    public static Term mkImplies(Term left, Term right) {
        return Terms.mkComb(new Id(Idents.IMPLIES, BOOL_BINOP), left, right);
    }


    /**
     * Equality at type {@code type}: {@code equals: type -> type -> bool}.
     */
    public static Term mkEquality(Type type, Term left, Term right) {
        return Terms.mkComb(new Id(Idents.EQUALS, Types.funOf(type, type, Types.BOOL)), left, right);
    }

    public static Term mkAll(Binder binder, Term body) {
        return mkQnt(Quant.ALL, binder, body);
    }

    public static Term mkEx(Binder binder, Term body) {
        return mkQnt(Quant.EX, binder, body);
    }

    public static Term mkLam(Binder binder, Term body) {
        return mkQnt(Quant.LAMBDA, binder, body);
    }

    private static Term mkQnt(Quant quant, Binder binder, Term body) {
        if (binder.quant() != quant) {
            throw new TermShapeException("binder " + binder + " is not a " + quant + " binder");
        }
        return new Qnt(binder, body);
    }

    public static boolean isImplies(Term t) {
        return Terms.isBinop(Idents.IMPLIES, t);
    }

    public static boolean isEquality(Term t) {
        return Terms.isBinop(Idents.EQUALS, t);
    }

    public static boolean isConj(Term t) {
        return Terms.isBinop(Idents.AND, t);
    }

    public static boolean isLambda(Term t) {
        return t instanceof Qnt qnt && qnt.quant() == Quant.LAMBDA;
    }

    public static Terms.Binop destEquality(Term t) {
        if (!isEquality(t)) throw new TermShapeException("not an equality", t);
        return Terms.destBinop(t);
    }
}
