package hol.term;

public enum Quant {
    ALL("!"),
    EX("?"),
    LAMBDA("%");

    private final String symbol;

    Quant(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
