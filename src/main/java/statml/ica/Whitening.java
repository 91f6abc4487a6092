package statml.ica;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import statml.SingularCovarianceException;

import java.util.Arrays;
import java.util.Comparator;

/**
 * PCA whitening of centered data: W_white = D^(-1/2) E' from the top-k eigenpairs of the
 * sample covariance C = Xc'Xc / n, so that W_white Xc' has identity covariance.
 * <p>
 * The eigenvalue floor is relative to the largest eigenvalue, so it depends on feature units:
 * full-rank data whose features differ in scale by about the square root of the inverse
 * threshold is rejected as degenerate. Standardize such features before fitting.
 */
final class Whitening {

    private Whitening() { }

    /**
     * @param centered  n x p zero-mean data
     * @param k         number of directions to keep
     * @param threshold relative eigenvalue floor; directions with λ &lt;= threshold * λ_max are degenerate
     * @return the k x p whitening matrix
     */
    static RealMatrix compute(double[][] centered, int k, double threshold) throws SingularCovarianceException {
        int n = centered.length;
        RealMatrix xc = MatrixUtils.createRealMatrix(centered);
        RealMatrix cov = xc.transpose().multiply(xc).scalarMultiply(1.0 / n);

        EigenDecomposition eig = new EigenDecomposition(cov);
        final double[] values = eig.getRealEigenvalues();
        Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> values[i]).reversed());

        double largest = values[order[0]];
        if (!(largest > 0)) {
            throw new SingularCovarianceException("Covariance is zero; every feature is constant", largest);
        }
        int p = cov.getRowDimension();
        RealMatrix whitening = MatrixUtils.createRealMatrix(k, p);
        for (int c = 0; c < k; c++) {
            double lambda = values[order[c]];
            if (lambda <= threshold * largest) {
                throw new SingularCovarianceException("Covariance eigenvalue " + lambda + " of component " + c
                    + " is below " + threshold + " x " + largest + "; reduce the component count or drop"
                    + " redundant features", lambda);
            }
            double scale = 1.0 / Math.sqrt(lambda);
            double[] v = eig.getEigenvector(order[c]).toArray();
            for (int j = 0; j < p; j++) whitening.setEntry(c, j, v[j] * scale);
        }
        return whitening;
    }
}
