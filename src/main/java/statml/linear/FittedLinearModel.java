package statml.linear;

import statml.DimensionMismatchException;
import statml.linalg.Matrices;

/**
 * Result of {@link LinearRegression#fit}: coefficients in the caller's feature space,
 * an intercept and the family whose inverse link maps the linear predictor to the mean.
 * Immutable.
 */
public final class FittedLinearModel {

    private final Family family;
    private final double[] coefficients;
    private final double intercept;
    private final int iterations;
    private final double rSquared;

    FittedLinearModel(Family family, double[] coefficients, double intercept, int iterations, double rSquared) {
        this.family = family;
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
        this.iterations = iterations;
        this.rSquared = rSquared;
    }

    public Family getFamily() { return family; }

    /** Coefficient for feature i (0-based). */
    public double getCoefficient(int i) { return coefficients[i]; }

    /** All feature coefficients, without the intercept. */
    public double[] getCoefficients() { return coefficients.clone(); }

    public double getIntercept() { return intercept; }

    public int getNumFeatures() { return coefficients.length; }

    /** Optimizer iterations used; 0 for the closed-form least squares paths. */
    public int getIterations() { return iterations; }

    /** R² of the training fit on the response scale. */
    public double getRSquared() { return rSquared; }

    /** Linear predictor x·β + intercept for one observation. */
    public double linearPredictor(double[] x) {
        if (x == null || x.length != coefficients.length) {
            throw new DimensionMismatchException("number of features", coefficients.length,
                x == null ? 0 : x.length);
        }
        return intercept + Matrices.dot(coefficients, x);
    }

    /** Linear predictor for each row of X. */
    public double[] linearPredictor(double[][] x) {
        Matrices.checkColumns(x, coefficients.length);
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = intercept + Matrices.dot(coefficients, x[i]);
        }
        return out;
    }

    /** Predicted mean response for one observation. */
    public double predict(double[] x) {
        return family.inverseLink(linearPredictor(x));
    }

    /** Predicted mean response for each row of X. */
    public double[] predict(double[][] x) {
        double[] eta = linearPredictor(x);
        for (int i = 0; i < eta.length; i++) eta[i] = family.inverseLink(eta[i]);
        return eta;
    }

    /** R² = 1 - SS_res / SS_tot of the predictions on (X, y). */
    public double score(double[][] x, double[] y) {
        Matrices.checkColumns(x, coefficients.length);
        Matrices.checkTarget(x, y);
        return rSquared(y, predict(x));
    }

    /** Mean unit deviance of the predictions on (X, y). */
    public double meanDeviance(double[][] x, double[] y) {
        Matrices.checkColumns(x, coefficients.length);
        Matrices.checkTarget(x, y);
        double[] mu = predict(x);
        double sum = 0;
        for (int i = 0; i < y.length; i++) sum += family.deviance(y[i], mu[i]);
        return sum / y.length;
    }

    static double rSquared(double[] y, double[] fitted) {
        double meanY = Matrices.mean(y);
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < y.length; i++) {
            ssTot += (y[i] - meanY) * (y[i] - meanY);
            ssRes += (y[i] - fitted[i]) * (y[i] - fitted[i]);
        }
        return (ssTot > 0) ? 1.0 - (ssRes / ssTot) : 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FittedLinearModel{family=").append(family)
            .append(",intercept=").append(String.format("%1$.5f", intercept))
            .append(",coefficients=[");
        for (int i = 0; i < coefficients.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%1$.5f", coefficients[i]));
        }
        return sb.append("],R^2=").append(String.format("%1$.3f", rSquared)).append("}").toString();
    }
}
