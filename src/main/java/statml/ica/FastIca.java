package statml.ica;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import statml.DidNotConvergeException;
import statml.EstimationException;
import statml.SingularCovarianceException;
import statml.linalg.Matrices;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Independent Component Analysis by the FastICA fixed-point algorithm.
 * <p>
 * The data are centered and whitened (top-k principal directions scaled to unit variance).
 * An unmixing matrix W, initialised from seeded Gaussian draws, is then iterated with
 * <pre>
 *   w⁺ = E[z g(w'z)] - E[g'(w'z)] w
 * </pre>
 * followed by symmetric or deflationary orthogonalization, until the largest
 * {@code |1 - |<w_new, w_old>||} over rows falls below the tolerance.
 * <p>
 * Instances are immutable; the {@code withX} methods return copies.
 */
public class FastIca {

    private static final Logger logger = Logger.getLogger(FastIca.class.getName());

    public static final int DEFAULT_MAX_ITERATIONS = 200;
    public static final double DEFAULT_TOLERANCE = 1e-4;
    /** Relative floor on covariance eigenvalues kept by whitening. */
    public static final double DEFAULT_EIGENVALUE_THRESHOLD = 1e-10;

    private final int components; // 0 = as many as features
    private final int maxIterations;
    private final double tolerance;
    private final ContrastFunction contrast;
    private final Orthogonalization orthogonalization;
    private final Long seed;
    private final double eigenvalueThreshold;

    public FastIca() {
        this(0, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE, ContrastFunction.logcosh(),
             Orthogonalization.SYMMETRIC, null, DEFAULT_EIGENVALUE_THRESHOLD);
    }

    private FastIca(int components, int maxIterations, double tolerance, ContrastFunction contrast,
                    Orthogonalization orthogonalization, Long seed, double eigenvalueThreshold) {
        if (components < 0) throw new IllegalArgumentException("components must be >= 1: " + components);
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1: " + maxIterations);
        if (!(tolerance > 0)) throw new IllegalArgumentException("tolerance must be > 0: " + tolerance);
        if (contrast == null) throw new IllegalArgumentException("contrast function required");
        if (orthogonalization == null) throw new IllegalArgumentException("orthogonalization required");
        if (!(eigenvalueThreshold >= 0 && eigenvalueThreshold < 1)) {
            throw new IllegalArgumentException("eigenvalueThreshold must lie in [0, 1): " + eigenvalueThreshold);
        }
        this.components = components;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.contrast = contrast;
        this.orthogonalization = orthogonalization;
        this.seed = seed;
        this.eigenvalueThreshold = eigenvalueThreshold;
    }

    /** Shorthand for {@code new FastIca().withComponents(k).withSeed(seed).fit(x)}. */
    public static FittedIca fit(double[][] x, int k, long seed) throws EstimationException {
        return new FastIca().withComponents(k).withSeed(seed).fit(x);
    }

    /** Number of independent components to estimate, 1 &lt;= k &lt;= number of features. */
    public FastIca withComponents(int components) {
        if (components < 1) throw new IllegalArgumentException("components must be >= 1: " + components);
        return new FastIca(components, maxIterations, tolerance, contrast, orthogonalization, seed, eigenvalueThreshold);
    }

    public FastIca withMaxIterations(int maxIterations) {
        return new FastIca(components, maxIterations, tolerance, contrast, orthogonalization, seed, eigenvalueThreshold);
    }

    public FastIca withTolerance(double tolerance) {
        return new FastIca(components, maxIterations, tolerance, contrast, orthogonalization, seed, eigenvalueThreshold);
    }

    public FastIca withContrast(ContrastFunction contrast) {
        return new FastIca(components, maxIterations, tolerance, contrast, orthogonalization, seed, eigenvalueThreshold);
    }

    public FastIca withOrthogonalization(Orthogonalization orthogonalization) {
        return new FastIca(components, maxIterations, tolerance, contrast, orthogonalization, seed, eigenvalueThreshold);
    }

    /** Seed of the generator drawing the initial unmixing matrix; {@code null} for a fresh unseeded one. */
    public FastIca withSeed(Long seed) {
        return new FastIca(components, maxIterations, tolerance, contrast, orthogonalization, seed, eigenvalueThreshold);
    }

    /**
     * Whitening rejects a kept covariance eigenvalue λ with λ &lt;= threshold * λ_max. The floor is
     * relative, so features on very different scales (about 1e5 apart at the default) should be
     * standardized first.
     */
    public FastIca withEigenvalueThreshold(double eigenvalueThreshold) {
        return new FastIca(components, maxIterations, tolerance, contrast, orthogonalization, seed, eigenvalueThreshold);
    }

    public int getComponents() { return components; }
    public int getMaxIterations() { return maxIterations; }
    public double getTolerance() { return tolerance; }
    public ContrastFunction getContrast() { return contrast; }
    public Orthogonalization getOrthogonalization() { return orthogonalization; }
    public Long getSeed() { return seed; }
    public double getEigenvalueThreshold() { return eigenvalueThreshold; }

    /**
     * Estimate the unmixing model.
     *
     * @param x n x p observations
     * @throws SingularCovarianceException a kept covariance direction is degenerate
     * @throws DidNotConvergeException     the fixed point was not reached within {@code maxIterations}
     */
    public FittedIca fit(double[][] x) throws EstimationException {
        int p = Matrices.checkMatrix(x);
        int k = components == 0 ? p : components;
        if (k > p) {
            throw new IllegalArgumentException("components (" + k + ") must not exceed the number of features (" + p + ")");
        }
        int n = x.length;

        double[] mean = Matrices.columnMeans(x);
        double[][] centered = Matrices.center(x, mean);
        RealMatrix whitening = Whitening.compute(centered, k, eigenvalueThreshold);
        // k x n whitened observations
        RealMatrix z = whitening.multiply(MatrixUtils.createRealMatrix(centered).transpose());

        RandomGenerator rng = seed != null ? new Well19937c(seed) : new Well19937c();
        RealMatrix w0 = MatrixUtils.createRealMatrix(k, k);
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++) w0.setEntry(i, j, rng.nextGaussian());
        }

        Unmixing result = orthogonalization == Orthogonalization.SYMMETRIC
            ? symmetric(z, w0)
            : deflation(z, w0);

        if (logger.isLoggable(Level.INFO)) {
            logger.info("FastICA (" + contrast + ", " + orthogonalization + ") found " + k
                + " components from " + n + " x " + p + " data in " + result.iterations + " iterations");
        }
        return new FittedIca(mean, whitening.getData(), result.w.getData(), result.iterations);
    }

    private Unmixing symmetric(RealMatrix z, RealMatrix w0) throws DidNotConvergeException {
        RealMatrix w = decorrelate(w0);
        for (int iter = 1; iter <= maxIterations; iter++) {
            RealMatrix next = decorrelate(update(w, z));
            double distance = 0;
            for (int i = 0; i < w.getRowDimension(); i++) {
                double d = Math.abs(1.0 - Math.abs(next.getRowVector(i).dotProduct(w.getRowVector(i))));
                distance = Math.max(distance, d);
            }
            w = next;
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("FastICA iteration " + iter + ": distance " + distance);
            }
            if (distance < tolerance) {
                return new Unmixing(w, iter);
            }
        }
        logger.warning("FastICA did not converge after " + maxIterations + " iterations");
        throw new DidNotConvergeException("FastICA did not converge within " + maxIterations
            + " iterations; increase maxIterations or tolerance", maxIterations);
    }

    private Unmixing deflation(RealMatrix z, RealMatrix w0) throws DidNotConvergeException {
        int k = w0.getRowDimension();
        int n = z.getColumnDimension();
        double[][] zt = z.transpose().getData(); // n x k
        double[][] w = new double[k][];
        int maxUsed = 0;

        for (int c = 0; c < k; c++) {
            double[] wc = normalize(w0.getRow(c));
            boolean converged = false;
            int iter = 0;
            while (iter < maxIterations) {
                iter++;
                double[] next = new double[k];
                double gPrimeMean = 0;
                for (int t = 0; t < n; t++) {
                    double u = Matrices.dot(wc, zt[t]);
                    double g = contrast.g(u);
                    gPrimeMean += contrast.gPrime(u);
                    for (int j = 0; j < k; j++) next[j] += zt[t][j] * g;
                }
                gPrimeMean /= n;
                for (int j = 0; j < k; j++) next[j] = next[j] / n - gPrimeMean * wc[j];

                // Gram-Schmidt against the components already extracted
                for (int prev = 0; prev < c; prev++) {
                    double proj = Matrices.dot(next, w[prev]);
                    for (int j = 0; j < k; j++) next[j] -= proj * w[prev][j];
                }
                next = normalize(next);

                double distance = Math.abs(1.0 - Math.abs(Matrices.dot(next, wc)));
                wc = next;
                if (distance < tolerance) {
                    converged = true;
                    break;
                }
            }
            if (!converged) {
                logger.warning("FastICA deflation did not converge for component " + c);
                throw new DidNotConvergeException("FastICA component " + c + " did not converge within "
                    + maxIterations + " iterations; increase maxIterations or tolerance", iter);
            }
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("FastICA component " + c + " converged after " + iter + " iterations");
            }
            w[c] = wc;
            maxUsed = Math.max(maxUsed, iter);
        }
        return new Unmixing(MatrixUtils.createRealMatrix(w), maxUsed);
    }

    /** W⁺ = E[g(WZ) Z'] - diag(E[g'(WZ)]) W. */
    private RealMatrix update(RealMatrix w, RealMatrix z) {
        int k = w.getRowDimension();
        int n = z.getColumnDimension();
        double[][] wz = w.multiply(z).getData();
        double[] gPrimeMean = new double[k];
        for (int i = 0; i < k; i++) {
            for (int t = 0; t < n; t++) {
                double u = wz[i][t];
                wz[i][t] = contrast.g(u);
                gPrimeMean[i] += contrast.gPrime(u);
            }
            gPrimeMean[i] /= n;
        }
        RealMatrix next = MatrixUtils.createRealMatrix(wz).multiply(z.transpose()).scalarMultiply(1.0 / n);
        return next.subtract(MatrixUtils.createRealDiagonalMatrix(gPrimeMean).multiply(w));
    }

    /** Symmetric decorrelation (WW')^(-1/2) W. */
    static RealMatrix decorrelate(RealMatrix w) {
        return Matrices.inverseSqrt(w.multiply(w.transpose())).multiply(w);
    }

    private static double[] normalize(double[] v) {
        double norm = Math.sqrt(Matrices.dot(v, v));
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) out[i] = v[i] / norm;
        return out;
    }

    private static final class Unmixing {
        final RealMatrix w;
        final int iterations;

        Unmixing(RealMatrix w, int iterations) {
            this.w = w;
            this.iterations = iterations;
        }
    }
}
