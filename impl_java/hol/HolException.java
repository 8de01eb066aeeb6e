package hol;

public class HolException extends RuntimeException {
    public HolException(String message) {
        super(message);
    }
}
