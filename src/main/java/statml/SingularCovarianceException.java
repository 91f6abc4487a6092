package statml;

/** A selected covariance direction has (near) zero variance and cannot be whitened. */
public class SingularCovarianceException extends EstimationException {

    private final double eigenvalue;

    public SingularCovarianceException(String message, double eigenvalue) {
        super(message);
        this.eigenvalue = eigenvalue;
    }

    /** The offending eigenvalue of the sample covariance. */
    public double getEigenvalue() { return eigenvalue; }
}
