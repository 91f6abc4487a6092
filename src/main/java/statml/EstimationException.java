package statml;

/**
 * Failure of a fit on numerically degenerate input or an exhausted iteration budget.
 * <p>
 * Fitting is all-or-nothing: when one of these is thrown no model exists.
 * Callers may retry with different regularization, features, component count,
 * tolerance or iteration cap; the estimators never retry on their own.
 */
public abstract class EstimationException extends Exception {

    protected EstimationException(String message) {
        super(message);
    }

    protected EstimationException(String message, Throwable cause) {
        super(message, cause);
    }
}
