package hol.resolver;

import hol.Ident;
import hol.Language;
import hol.scope.Scope;
import hol.scope.TheoryScope;
import hol.term.App;
import hol.term.Binder;
import hol.term.Bound;
import hol.term.Free;
import hol.term.Id;
import hol.term.Qnt;
import hol.term.Quant;
import hol.term.Term;
import hol.term.TermShapeException;
import hol.term.Terms;
import hol.type.Type;
import hol.type.TypeUnificationException;
import hol.type.Types;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class ResolverTest {
    private static final Type SET = Types.constant(Ident.mkLong("sets", "set"));
    private static final Type NUM_BINOP = Types.funOf(Types.NUM, Types.NUM, Types.NUM);
    private static final Type SET_BINOP = Types.funOf(SET, SET, SET);

    private static final Ident PLUS = Ident.mkLong("nums", "plus");
    private static final Ident UNION = Ident.mkLong("sets", "union");
    private static final Ident ZERO = Ident.mkLong("nums", "zero");

    private Scope scope;
    private OverloadTable table;

    @BeforeEach
    void setUp() {
        scope = TheoryScope.builder()
                .declare(PLUS, NUM_BINOP)
                .declare(UNION, SET_BINOP)
                .declare(ZERO, Types.NUM)
                .declare(Language.Idents.EQUALS, Types.funOf(Types.var("a"), Types.var("a"), Types.BOOL))
                .declare(Language.Idents.AND, Types.funOf(Types.BOOL, Types.BOOL, Types.BOOL))
                .declare(Language.Idents.TRUE, Types.BOOL)
                .declare(Language.Idents.FALSE, Types.BOOL)
                .declareType("sets", "set")
                .build();
        table = new OverloadTable();
        table.add("+", UNION, SET_BINOP);
        table.add("+", PLUS, NUM_BINOP);
        table.add("=", Language.Idents.EQUALS, Types.funOf(Types.var("a"), Types.var("a"), Types.BOOL));
    }

    private static Term plus(Type type, Term left, Term right) {
        return Terms.mkComb(new Free("+", type), left, right);
    }

    @Test
    void resolvesOverloadedSymbolByArgumentType() {
        Term t = plus(SET_BINOP, new Free("x", SET), new Free("y", SET));
        var result = Resolver.resolveTerm(scope, Resolver.makeLookup(scope, table), t);

        Term expected = Terms.mkComb(new Id(UNION, SET_BINOP), new Free("x", SET), new Free("y", SET));
        assertEquals(expected, result.term());
    }

    @Test
    void resolutionIsDeterministic() {
        Term t = plus(Types.var("p"), new Free("x", Types.NUM), new Free("zero", Types.var("z")));
        Lookup lookup = Resolver.makeLookup(scope, table);
        var first = Resolver.resolveTerm(scope, lookup, t);
        var second = Resolver.resolveTerm(scope, lookup, t);
        assertEquals(first.term(), second.term());
        assertEquals(first.typeSubst(), second.typeSubst());
    }

    @Test
    void unknownSymbolIsLeftInPlace() {
        Term t = new Free("mystery", Types.NUM);
        var result = Resolver.resolveTerm(scope, Resolver.makeLookup(scope, table), t);
        assertEquals(t, result.term());
    }

    @Test
    void defaultsToFirstCandidateWhenNoTypeMatches() {
        Ident c1 = Ident.mkLong("A", "f");
        Ident c2 = Ident.mkLong("B", "f");
        Ident c3 = Ident.mkLong("C", "f");
        OverloadTable fs = new OverloadTable();
        fs.add("f", c3, Types.IND);
        fs.add("f", c2, Types.fun(Types.NUM, Types.NUM));
        fs.add("f", c1, Types.BOOL);

        Lookup lookup = Resolver.makeLookup(scope, fs);
        assertEquals(LookupResult.found(c1, Types.BOOL), lookup.lookup("f", SET));

        assertThrows(TypeUnificationException.class,
                () -> Resolver.resolveTerm(scope, lookup, new Free("f", SET)));
    }

    @Test
    void resolvedIdentifierTakesTheOccurrenceType() {
        Ident f = Ident.mkLong("A", "f");
        OverloadTable fs = new OverloadTable();
        fs.add("f", f, Types.fun(Types.var("a"), Types.var("a")));
        Type numToNum = Types.fun(Types.NUM, Types.NUM);

        var result = Resolver.resolveTerm(scope, Resolver.makeLookup(scope, fs), new Free("f", numToNum));

        assertEquals(new Id(f, numToNum), result.term());
    }

    @Test
    void polymorphicIdentifiersAreUnchanged() {
        Term t = Language.mkEquality(Types.NUM, new Id(ZERO, Types.NUM), new Free("n", Types.NUM));
        var result = Resolver.resolveTerm(scope, (symbol, type) -> LookupResult.notFound(), t);
        assertEquals(t, result.term());
    }

    @Test
    void inputTypeVariablesDoNotCollideWithFreshOnes() {
        Term t = new Free("mystery", Types.fun(Types.var("_ty1"), Types.NUM));
        var result = Resolver.resolveTerm(scope, (symbol, type) -> LookupResult.notFound(), t);
        assertEquals(t, result.term());
    }

    @Test
    void firstCompatibleCandidateWins() {
        Ident c1 = Ident.mkLong("A", "g");
        Ident c2 = Ident.mkLong("B", "g");
        OverloadTable gs = new OverloadTable();
        gs.add("g", c2, Types.NUM);
        gs.add("g", c1, Types.BOOL);

        var result = Resolver.resolveTerm(scope, Resolver.makeLookup(scope, gs), new Free("g", Types.NUM));
        assertEquals(new Id(c2, Types.NUM), result.term());
    }

    @Test
    void resolvedTermsAreUnchanged() {
        Term t = Language.mkAnd(Language.TRUE, Language.mkAnd(Language.FALSE, Language.TRUE));
        var result = Resolver.resolveTerm(scope, Resolver.makeLookup(scope, table), t);
        assertEquals(t, result.term());
        assertEquals(t, Terms.retype(result.typeSubst(), t));
    }

    @Test
    void eachSymbolIsLookedUpOnce() {
        CountingOverloadDb db = new CountingOverloadDb(table);
        Term t = plus(Types.var("p1"), new Free("x", Types.NUM),
                plus(Types.var("p2"), new Free("y", Types.NUM),
                        plus(Types.var("p3"), new Free("x", Types.NUM), new Free("z", Types.NUM))));

        var result = Resolver.resolveTerm(scope, Resolver.makeLookup(scope, db), t);

        assertEquals(1, db.calls("+"));
        Term expected = Terms.mkComb(new Id(PLUS, NUM_BINOP), new Free("x", Types.NUM),
                Terms.mkComb(new Id(PLUS, NUM_BINOP), new Free("y", Types.NUM),
                        Terms.mkComb(new Id(PLUS, NUM_BINOP), new Free("x", Types.NUM), new Free("z", Types.NUM))));
        assertEquals(expected, result.term());
    }

    @Test
    void disablingTheMemoRepeatsLookups() {
        CountingOverloadDb db = new CountingOverloadDb(table);
        Term t = plus(Types.var("p1"), new Free("x", Types.NUM),
                plus(Types.var("p2"), new Free("y", Types.NUM), new Free("z", Types.NUM)));

        Resolver.resolveTerm(scope, Resolver.makeLookup(scope, db), t, new ResolverSettings("_ty", false));

        assertEquals(2, db.calls("+"));
    }

    @Test
    void qualifiedSymbolBypassesLookup() {
        Lookup lookup = (symbol, type) -> fail("lookup called for " + symbol);
        var result = Resolver.resolveTerm(scope, lookup, new Free("nums.zero", Types.var("z")));
        assertEquals(new Id(ZERO, Types.NUM), result.term());
    }

    @Test
    void shortTypeNamesAreExpanded() {
        Type shortSet = Types.constant(Ident.mkShort("set"));
        var result = Resolver.resolveTerm(scope, (symbol, type) -> LookupResult.notFound(), new Free("s", shortSet));
        assertEquals(new Free("s", SET), result.term());
    }

    @Test
    void polymorphicIdentifierIsInstantiatedUnderBinder() {
        Binder x = new Binder(Quant.ALL, "x", Types.NUM);
        Term t = new Qnt(x, Terms.mkComb(new Free("=", Types.var("q")), new Bound(x), new Bound(x)));

        var result = Resolver.resolveTerm(scope, Resolver.makeLookup(scope, table), t);

        Qnt qnt = assertInstanceOf(Qnt.class, result.term());
        assertNotSame(x, qnt.binder());
        assertEquals("x", qnt.binder().name());
        assertEquals(Types.NUM, qnt.binder().type());
        assertEquals(Language.mkEquality(Types.NUM, new Bound(qnt.binder()), new Bound(qnt.binder())), qnt.body());
    }

    @Test
    void lambdaBodyIsResolved() {
        Binder s = new Binder(Quant.LAMBDA, "s", SET);
        Term t = new Qnt(s, plus(SET_BINOP, new Bound(s), new Bound(s)));

        var result = Resolver.resolveTerm(scope, Resolver.makeLookup(scope, table), t);

        Qnt qnt = (Qnt) result.term();
        App app = (App) ((App) qnt.body()).fun();
        assertEquals(new Id(UNION, SET_BINOP), app.fun());
    }

    @Test
    void typeMismatchIsAHardFailure() {
        Term notZero = new App(new Id(Language.Idents.NOT, Types.fun(Types.BOOL, Types.BOOL)), new Id(ZERO, Types.NUM));
        var e = assertThrows(TypeUnificationException.class,
                () -> Resolver.resolveTerm(scope, Resolver.makeLookup(scope, table), notZero));
        assertTrue(e.getMessage().contains("do not unify"));
    }

    @Test
    void defaultChoiceIsNotRevisited() {
        OverloadTable hs = new OverloadTable();
        hs.add("h", Ident.mkLong("A", "h"), Types.BOOL);
        Term t = Terms.mkComb(new Id(PLUS, NUM_BINOP), new Free("h", Types.NUM), new Id(ZERO, Types.NUM));
        assertThrows(TypeUnificationException.class,
                () -> Resolver.resolveTerm(scope, Resolver.makeLookup(scope, hs), t));
    }

    @Test
    void findTypeSearchesInOrder() {
        List<Candidate> candidates = List.of(
                new Candidate(UNION, SET_BINOP),
                new Candidate(PLUS, NUM_BINOP));
        assertEquals(PLUS, Resolver.findType(scope, "+", NUM_BINOP, candidates).ident());
        assertEquals(UNION, Resolver.findType(scope, "+", Types.BOOL, candidates).ident());
        assertThrows(TermShapeException.class, () -> Resolver.findType(scope, "+", NUM_BINOP, List.of()));
    }

    @Test
    void lookupSignalsNotFound() {
        Lookup lookup = Resolver.makeLookup(scope, table);
        assertFalse(lookup.lookup("missing", Types.NUM).isFound());
        assertTrue(Resolver.defaultCandidate("missing", Types.NUM, List.of()).isEmpty());
    }

    @Test
    void memoFindComputesOnce() {
        Map<String, Integer> memo = new HashMap<>();
        int[] calls = {0};
        for (int i = 0; i < 3; i++) {
            int value = Resolver.memoFind(memo, (Integer base, String key) -> {
                calls[0]++;
                return base + key.length();
            }, 10, "abc");
            assertEquals(13, value);
        }
        assertEquals(1, calls[0]);
    }
}
