package statml;

/** An iterative fit reached its iteration cap without meeting its tolerance. */
public class DidNotConvergeException extends EstimationException {

    private final int iterations;

    public DidNotConvergeException(String message, int iterations) {
        super(message);
        this.iterations = iterations;
    }

    public DidNotConvergeException(String message, int iterations, Throwable cause) {
        super(message, cause);
        this.iterations = iterations;
    }

    public int getIterations() { return iterations; }
}
