package statml;

/** The normal-equation system X'X is not invertible (rank-deficient features). */
public class SingularMatrixException extends EstimationException {

    public SingularMatrixException(String message) {
        super(message);
    }
}
