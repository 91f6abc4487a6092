package statml.linear;

import org.apache.commons.math3.linear.*;
import statml.DidNotConvergeException;
import statml.EstimationException;
import statml.SingularMatrixException;
import statml.linalg.Matrices;
import statml.optim.ConjugateGradientOptimizer;
import statml.optim.DifferentiableFunction;
import statml.optim.OptimizationResult;
import statml.optim.Optimizer;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Least squares, ridge and generalized linear regression.
 * <p>
 * Model: E[y] = g⁻¹(β₀ + β₁x₁ + ... + βₚxₚ), with g the link of the chosen {@link Family}.
 * <ul>
 *   <li>{@link Family#IDENTITY}, alpha = 0: normal equations (Xc'Xc)β = Xc'yc on centered data.</li>
 *   <li>{@link Family#IDENTITY}, alpha &gt; 0: ridge, (Xc'Xc + αI)β = Xc'yc.</li>
 *   <li>Other families: mean negative log-likelihood + (α/2)||β||² minimized by an {@link Optimizer}
 *       started at zero.</li>
 * </ul>
 * The intercept is never penalized. Instances are immutable; the {@code withX} methods return copies.
 */
public class LinearRegression {

    private static final Logger logger = Logger.getLogger(LinearRegression.class.getName());

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 1e-4;
    /**
     * LU pivot threshold below which X'X is treated as singular. Pivots are taken on X'X
     * scaled to unit diagonal, so the threshold does not depend on feature units.
     */
    public static final double DEFAULT_SINGULARITY_THRESHOLD = 1e-10;

    private final Family family;
    private final double alpha;
    private final boolean fitIntercept;
    private final int maxIterations;
    private final double tolerance;
    private final double singularityThreshold;
    private final Optimizer optimizer;

    public LinearRegression() {
        this(Family.IDENTITY, 0.0, true, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE,
             DEFAULT_SINGULARITY_THRESHOLD, new ConjugateGradientOptimizer());
    }

    private LinearRegression(Family family, double alpha, boolean fitIntercept, int maxIterations,
                             double tolerance, double singularityThreshold, Optimizer optimizer) {
        if (family == null) throw new IllegalArgumentException("family required");
        if (!(alpha >= 0) || Double.isInfinite(alpha)) {
            throw new IllegalArgumentException("alpha must be finite and >= 0: " + alpha);
        }
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1: " + maxIterations);
        if (!(tolerance > 0)) throw new IllegalArgumentException("tolerance must be > 0: " + tolerance);
        if (!(singularityThreshold > 0)) {
            throw new IllegalArgumentException("singularityThreshold must be > 0: " + singularityThreshold);
        }
        if (optimizer == null) throw new IllegalArgumentException("optimizer required");
        this.family = family;
        this.alpha = alpha;
        this.fitIntercept = fitIntercept;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.singularityThreshold = singularityThreshold;
        this.optimizer = optimizer;
    }

    /** Shorthand for {@code new LinearRegression().withFamily(family).withAlpha(alpha).fit(x, y)}. */
    public static FittedLinearModel fit(double[][] x, double[] y, Family family, double alpha)
            throws EstimationException {
        return new LinearRegression().withFamily(family).withAlpha(alpha).fit(x, y);
    }

    public LinearRegression withFamily(Family family) {
        return new LinearRegression(family, alpha, fitIntercept, maxIterations, tolerance, singularityThreshold, optimizer);
    }

    /** L2 penalty strength; 0 disables regularization. */
    public LinearRegression withAlpha(double alpha) {
        return new LinearRegression(family, alpha, fitIntercept, maxIterations, tolerance, singularityThreshold, optimizer);
    }

    public LinearRegression withFitIntercept(boolean fitIntercept) {
        return new LinearRegression(family, alpha, fitIntercept, maxIterations, tolerance, singularityThreshold, optimizer);
    }

    /** Iteration cap of the optimizer (GLM families only). */
    public LinearRegression withMaxIterations(int maxIterations) {
        return new LinearRegression(family, alpha, fitIntercept, maxIterations, tolerance, singularityThreshold, optimizer);
    }

    /** Gradient max-norm at which the optimizer stops (GLM families only). */
    public LinearRegression withTolerance(double tolerance) {
        return new LinearRegression(family, alpha, fitIntercept, maxIterations, tolerance, singularityThreshold, optimizer);
    }

    public LinearRegression withSingularityThreshold(double singularityThreshold) {
        return new LinearRegression(family, alpha, fitIntercept, maxIterations, tolerance, singularityThreshold, optimizer);
    }

    public LinearRegression withOptimizer(Optimizer optimizer) {
        return new LinearRegression(family, alpha, fitIntercept, maxIterations, tolerance, singularityThreshold, optimizer);
    }

    public Family getFamily() { return family; }
    public double getAlpha() { return alpha; }
    public boolean isFitIntercept() { return fitIntercept; }
    public int getMaxIterations() { return maxIterations; }
    public double getTolerance() { return tolerance; }
    public double getSingularityThreshold() { return singularityThreshold; }

    /**
     * Fit the model.
     *
     * @param x design matrix (rows = observations, columns = features; no intercept column)
     * @param y response vector (length = number of observations)
     * @throws SingularMatrixException X'X is not invertible on the unregularized least squares path
     * @throws DidNotConvergeException the optimizer hit its iteration cap
     */
    public FittedLinearModel fit(double[][] x, double[] y) throws EstimationException {
        int p = Matrices.checkMatrix(x);
        Matrices.checkTarget(x, y);
        for (double v : y) family.validateTarget(v);

        // Centering only moves the intercept, so β stays in the caller's feature space.
        double[] xMean = fitIntercept ? Matrices.columnMeans(x) : new double[p];
        double[][] xc = Matrices.center(x, xMean);

        FittedLinearModel model;
        if (family == Family.IDENTITY) {
            model = fitLeastSquares(xc, y, xMean);
        } else {
            model = fitGeneralized(xc, y, xMean);
        }
        if (logger.isLoggable(Level.INFO)) {
            logger.info("Fitted " + model + " on " + x.length + " samples");
        }
        return model;
    }

    private FittedLinearModel fitLeastSquares(double[][] xc, double[] y, double[] xMean)
            throws SingularMatrixException {
        int p = xMean.length;
        double yMean = fitIntercept ? Matrices.mean(y) : 0;
        double[] yc = new double[y.length];
        for (int i = 0; i < y.length; i++) yc[i] = y[i] - yMean;

        RealMatrix xm = MatrixUtils.createRealMatrix(xc);
        RealVector yv = MatrixUtils.createRealVector(yc);

        // β = (X'X + αI)⁻¹ X'y, solved as D⁻¹(D⁻¹X'XD⁻¹ + αD⁻²)⁻¹D⁻¹X'y with D the column norms
        RealMatrix xt = xm.transpose();
        RealMatrix xtx = xt.multiply(xm);
        double[] norms = new double[p];
        for (int j = 0; j < p; j++) {
            norms[j] = Math.sqrt(xtx.getEntry(j, j));
            if (norms[j] == 0) {
                if (alpha == 0) {
                    throw new SingularMatrixException("Feature " + j + " is constant; X'X is singular");
                }
                norms[j] = 1;
            }
        }
        RealMatrix scaled = MatrixUtils.createRealMatrix(p, p);
        for (int i = 0; i < p; i++) {
            for (int j = 0; j < p; j++) {
                double v = xtx.getEntry(i, j) / (norms[i] * norms[j]);
                if (i == j) v += alpha / (norms[i] * norms[i]);
                scaled.setEntry(i, j, v);
            }
        }
        RealVector rhs = xt.operate(yv);
        for (int j = 0; j < p; j++) rhs.setEntry(j, rhs.getEntry(j) / norms[j]);

        // X'X + αI is positive definite for α > 0, so only the unpenalized system gets a pivot floor.
        double threshold = alpha > 0 ? 0 : singularityThreshold;
        DecompositionSolver solver = new LUDecomposition(scaled, threshold).getSolver();
        if (!solver.isNonSingular()) {
            throw new SingularMatrixException("X'X is singular; add regularization or drop collinear columns");
        }
        double[] beta = solver.solve(rhs).toArray();
        for (int j = 0; j < p; j++) beta[j] /= norms[j];
        double intercept = yMean - Matrices.dot(xMean, beta);

        double[] fitted = new double[y.length];
        for (int i = 0; i < y.length; i++) fitted[i] = yMean + Matrices.dot(beta, xc[i]);
        return new FittedLinearModel(family, beta, intercept, 0, FittedLinearModel.rSquared(y, fitted));
    }

    private FittedLinearModel fitGeneralized(double[][] xc, double[] y, double[] xMean)
            throws DidNotConvergeException {
        int p = xMean.length;
        int offset = fitIntercept ? 1 : 0;
        NegativeLogLikelihood objective = new NegativeLogLikelihood(family, xc, y, alpha, fitIntercept);

        OptimizationResult result = optimizer.minimize(objective, new double[p + offset], maxIterations, tolerance);
        double[] theta = result.getPoint();
        if (!result.isConverged()) {
            logger.warning(family + " fit did not converge after " + result.getIterations() + " iterations");
            throw new DidNotConvergeException(family + " regression did not converge within "
                + maxIterations + " iterations", result.getIterations());
        }
        for (double t : theta) {
            if (!Double.isFinite(t)) {
                throw new DidNotConvergeException(family + " regression diverged to a non-finite coefficient",
                    result.getIterations());
            }
        }

        double[] beta = new double[p];
        System.arraycopy(theta, offset, beta, 0, p);
        double b0 = fitIntercept ? theta[0] : 0;
        double intercept = b0 - Matrices.dot(xMean, beta);

        double[] fitted = new double[y.length];
        for (int i = 0; i < y.length; i++) fitted[i] = family.inverseLink(b0 + Matrices.dot(beta, xc[i]));
        return new FittedLinearModel(family, beta, intercept, result.getIterations(),
            FittedLinearModel.rSquared(y, fitted));
    }

    /**
     * f(b₀, β) = (1/n) Σ loss(yᵢ, b₀ + xᵢ·β) + (α/2)||β||² over centered X.
     * Parameter layout is [b₀, β₁..βₚ] with an intercept, [β₁..βₚ] without.
     */
    static final class NegativeLogLikelihood implements DifferentiableFunction {
        private final Family family;
        private final double[][] x;
        private final double[] y;
        private final double alpha;
        private final int offset;

        NegativeLogLikelihood(Family family, double[][] x, double[] y, double alpha, boolean intercept) {
            this.family = family;
            this.x = x;
            this.y = y;
            this.alpha = alpha;
            this.offset = intercept ? 1 : 0;
        }

        private double eta(double[] theta, double[] row) {
            double e = offset == 1 ? theta[0] : 0;
            for (int j = 0; j < row.length; j++) e += theta[j + offset] * row[j];
            return e;
        }

        @Override
        public double value(double[] theta) {
            double sum = 0;
            for (int i = 0; i < x.length; i++) sum += family.loss(y[i], eta(theta, x[i]));
            double penalty = 0;
            for (int j = offset; j < theta.length; j++) penalty += theta[j] * theta[j];
            return sum / x.length + 0.5 * alpha * penalty;
        }

        @Override
        public double[] gradient(double[] theta) {
            double[] g = new double[theta.length];
            int n = x.length;
            for (int i = 0; i < n; i++) {
                double r = family.lossGradient(y[i], eta(theta, x[i])) / n;
                if (offset == 1) g[0] += r;
                for (int j = 0; j < x[i].length; j++) g[j + offset] += r * x[i][j];
            }
            for (int j = offset; j < theta.length; j++) g[j] += alpha * theta[j];
            return g;
        }
    }
}
