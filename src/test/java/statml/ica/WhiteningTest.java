package statml.ica;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;
import statml.SampleData;
import statml.SingularCovarianceException;
import statml.linalg.Matrices;

import static org.junit.jupiter.api.Assertions.*;

class WhiteningTest {

    @Test
    void whitenedDataHasIdentityCovariance() throws Exception {
        double[][] x = SampleData.mixedSignals(500);
        double[][] centered = Matrices.center(x, Matrices.columnMeans(x));

        RealMatrix whitening = Whitening.compute(centered, 2, 1e-10);
        RealMatrix z = whitening.multiply(MatrixUtils.createRealMatrix(centered).transpose());
        RealMatrix cov = z.multiply(z.transpose()).scalarMultiply(1.0 / x.length);

        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                assertEquals(i == j ? 1.0 : 0.0, cov.getEntry(i, j), 1e-9);
            }
        }
    }

    @Test
    void keepsLargestVarianceDirectionFirst() throws Exception {
        // variance 100 along the second axis, 1 along the first
        double[][] x = new double[400][];
        for (int i = 0; i < x.length; i++) {
            double a = (i % 2 == 0) ? 1 : -1;
            double b = ((i / 2) % 2 == 0) ? 10 : -10;
            x[i] = new double[] {a, b};
        }

        RealMatrix whitening = Whitening.compute(x, 1, 1e-10);

        assertEquals(0.0, whitening.getEntry(0, 0), 1e-9);
        assertEquals(0.1, Math.abs(whitening.getEntry(0, 1)), 1e-9);
    }

    @Test
    void thresholdIsRelativeToLargestEigenvalue() {
        double[][] x = new double[400][];
        for (int i = 0; i < x.length; i++) {
            double a = (i % 2 == 0) ? 1e-4 : -1e-4;
            double b = ((i / 2) % 2 == 0) ? 10 : -10;
            x[i] = new double[] {a, b};
        }
        // eigenvalue ratio 1e-10
        assertThrows(SingularCovarianceException.class, () -> Whitening.compute(x, 2, 1e-9));
        assertDoesNotThrow(() -> Whitening.compute(x, 2, 1e-11));
    }

    @Test
    void standardizedFeaturesPassTheFloor() throws Exception {
        double[][] x = new double[400][];
        for (int i = 0; i < x.length; i++) {
            double a = (i % 2 == 0) ? 1e-5 : -1e-5;
            double b = ((i / 2) % 2 == 0) ? 10 : -10;
            x[i] = new double[] {a, b};
        }
        // full rank, but the feature variances are 1e12 apart
        assertThrows(SingularCovarianceException.class, () -> Whitening.compute(x, 2, 1e-10));

        double[][] standardized = new double[x.length][];
        for (int i = 0; i < x.length; i++) standardized[i] = new double[] {x[i][0] / 1e-5, x[i][1] / 10};
        RealMatrix whitening = Whitening.compute(standardized, 2, 1e-10);

        assertEquals(2, whitening.getRowDimension());
    }
}
