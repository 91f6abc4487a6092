package statml.linalg;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import statml.DimensionMismatchException;

/**
 * Shape checks and small dense-array helpers shared by the estimators.
 * Inputs are never modified; every method that returns an array returns a fresh one.
 */
public final class Matrices {

    private Matrices() { }

    /**
     * Check that X is a non-empty rectangular matrix of finite values.
     *
     * @return the number of columns
     */
    public static int checkMatrix(double[][] x) {
        if (x == null || x.length == 0) {
            throw new IllegalArgumentException("X must be non-null and have at least one row");
        }
        if (x[0] == null || x[0].length == 0) {
            throw new IllegalArgumentException("X must have at least one column");
        }
        int p = x[0].length;
        for (int i = 0; i < x.length; i++) {
            if (x[i] == null || x[i].length != p) {
                throw new DimensionMismatchException("columns in row " + i, p, x[i] == null ? 0 : x[i].length);
            }
            for (int j = 0; j < p; j++) {
                if (!Double.isFinite(x[i][j])) {
                    throw new IllegalArgumentException("X[" + i + "][" + j + "] is not finite: " + x[i][j]);
                }
            }
        }
        return p;
    }

    /** Check X against an expected column count, e.g. the one a model was fitted with. */
    public static void checkColumns(double[][] x, int expected) {
        int p = checkMatrix(x);
        if (p != expected) {
            throw new DimensionMismatchException("number of features", expected, p);
        }
    }

    /** Check y is finite and has one entry per row of X. */
    public static void checkTarget(double[][] x, double[] y) {
        if (y == null) throw new IllegalArgumentException("y must be non-null");
        if (y.length != x.length) {
            throw new DimensionMismatchException("length of y", x.length, y.length);
        }
        for (int i = 0; i < y.length; i++) {
            if (!Double.isFinite(y[i])) {
                throw new IllegalArgumentException("y[" + i + "] is not finite: " + y[i]);
            }
        }
    }

    /** Per-column mean over the rows of X. */
    public static double[] columnMeans(double[][] x) {
        int p = x[0].length;
        double[] mean = new double[p];
        for (double[] row : x) {
            for (int j = 0; j < p; j++) mean[j] += row[j];
        }
        for (int j = 0; j < p; j++) mean[j] /= x.length;
        return mean;
    }

    public static double mean(double[] v) {
        double s = 0;
        for (double d : v) s += d;
        return s / v.length;
    }

    /** Copy of X with {@code shift} subtracted from every row. */
    public static double[][] center(double[][] x, double[] shift) {
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            out[i] = new double[shift.length];
            for (int j = 0; j < shift.length; j++) out[i][j] = x[i][j] - shift[j];
        }
        return out;
    }

    public static double dot(double[] a, double[] b) {
        double s = 0;
        for (int i = 0; i < a.length; i++) s += a[i] * b[i];
        return s;
    }

    /** Symmetric inverse square root A^(-1/2) = E D^(-1/2) E' of a symmetric positive-definite matrix. */
    public static RealMatrix inverseSqrt(RealMatrix symmetric) {
        EigenDecomposition eig = new EigenDecomposition(symmetric);
        double[] d = eig.getRealEigenvalues();
        double[] scale = new double[d.length];
        for (int i = 0; i < d.length; i++) scale[i] = 1.0 / Math.sqrt(d[i]);
        RealMatrix v = eig.getV();
        return v.multiply(MatrixUtils.createRealDiagonalMatrix(scale)).multiply(v.transpose());
    }

    public static double[][] copy(double[][] a) {
        double[][] out = new double[a.length][];
        for (int i = 0; i < a.length; i++) out[i] = a[i].clone();
        return out;
    }
}
