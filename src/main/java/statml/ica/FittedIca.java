package statml.ica;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import statml.linalg.Matrices;

/**
 * Result of {@link FastIca#fit}: feature means, the k x p whitening matrix and the k x k
 * unmixing matrix applied after whitening. Immutable.
 */
public final class FittedIca {

    private final double[] mean;
    private final double[][] whitening;
    private final double[][] unmixing;
    private final int iterations;

    FittedIca(double[] mean, double[][] whitening, double[][] unmixing, int iterations) {
        this.mean = mean.clone();
        this.whitening = Matrices.copy(whitening);
        this.unmixing = Matrices.copy(unmixing);
        this.iterations = iterations;
    }

    public double[] getMean() { return mean.clone(); }

    /** k x p. */
    public double[][] getWhitening() { return Matrices.copy(whitening); }

    /** k x k, rows orthonormal. */
    public double[][] getUnmixing() { return Matrices.copy(unmixing); }

    public int getIterations() { return iterations; }

    public int getNumComponents() { return unmixing.length; }

    public int getNumFeatures() { return mean.length; }

    /** Combined k x p unmixing applied to centered observations: unmixing · whitening. */
    public double[][] getComponents() {
        return MatrixUtils.createRealMatrix(unmixing)
            .multiply(MatrixUtils.createRealMatrix(whitening))
            .getData();
    }

    /**
     * Estimated sources for new observations: ((X - mean) W_white') W'.
     *
     * @param x n x p observations
     * @return n x k sources
     */
    public double[][] transform(double[][] x) {
        Matrices.checkColumns(x, mean.length);
        RealMatrix xc = MatrixUtils.createRealMatrix(Matrices.center(x, mean));
        RealMatrix components = MatrixUtils.createRealMatrix(getComponents());
        return xc.multiply(components.transpose()).getData();
    }

    @Override
    public String toString() {
        return "FittedIca{features=" + mean.length + ",components=" + unmixing.length
            + ",iterations=" + iterations + "}";
    }
}
