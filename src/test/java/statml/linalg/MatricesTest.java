package statml.linalg;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;
import statml.DimensionMismatchException;

import static org.junit.jupiter.api.Assertions.*;

class MatricesTest {

    @Test
    void checkMatrixReturnsColumnCount() {
        assertEquals(3, Matrices.checkMatrix(new double[][] {{1, 2, 3}, {4, 5, 6}}));
    }

    @Test
    void raggedEmptyAndNonFiniteInputIsRejected() {
        assertThrows(DimensionMismatchException.class, () -> Matrices.checkMatrix(new double[][] {{1, 2}, {3}}));
        assertThrows(IllegalArgumentException.class, () -> Matrices.checkMatrix(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> Matrices.checkMatrix(new double[][] {{}}));
        assertThrows(IllegalArgumentException.class, () -> Matrices.checkMatrix(new double[][] {{1, Double.NaN}}));
        assertThrows(IllegalArgumentException.class,
            () -> Matrices.checkTarget(new double[][] {{1}}, new double[] {Double.POSITIVE_INFINITY}));
    }

    @Test
    void centerLeavesInputUntouched() {
        double[][] x = {{1, 10}, {3, 30}};
        double[] mean = Matrices.columnMeans(x);
        double[][] c = Matrices.center(x, mean);

        assertArrayEquals(new double[] {2, 20}, mean, 0.0);
        assertArrayEquals(new double[] {-1, -10}, c[0], 0.0);
        assertArrayEquals(new double[] {1, 10}, x[0], 0.0);
    }

    @Test
    void inverseSqrtSquaresToInverse() {
        RealMatrix a = MatrixUtils.createRealMatrix(new double[][] {{4, 1}, {1, 3}});
        RealMatrix r = Matrices.inverseSqrt(a);
        RealMatrix product = r.multiply(r).multiply(a);

        assertEquals(1.0, product.getEntry(0, 0), 1e-12);
        assertEquals(0.0, product.getEntry(0, 1), 1e-12);
        assertEquals(1.0, product.getEntry(1, 1), 1e-12);
    }
}
