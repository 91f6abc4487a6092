package statml;

/**
 * Shape constraint violated by the caller, e.g. a prediction matrix whose column count
 * differs from the fitted feature count.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(String what, int expected, int actual) {
        super(what + ": expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() { return expected; }
    public int getActual() { return actual; }
}
