package statml.ica;

import org.apache.commons.math3.linear.MatrixUtils;
import org.junit.jupiter.api.Test;
import statml.DidNotConvergeException;
import statml.DimensionMismatchException;
import statml.SampleData;
import statml.SingularCovarianceException;

import static org.junit.jupiter.api.Assertions.*;

class FastIcaTest {

    private static final int N = 2000;

    private static double correlation(double[][] a, int ca, double[][] b, int cb) {
        int n = a.length;
        double ma = 0, mb = 0;
        for (int i = 0; i < n; i++) {
            ma += a[i][ca];
            mb += b[i][cb];
        }
        ma /= n;
        mb /= n;
        double sab = 0, saa = 0, sbb = 0;
        for (int i = 0; i < n; i++) {
            double da = a[i][ca] - ma, db = b[i][cb] - mb;
            sab += da * db;
            saa += da * da;
            sbb += db * db;
        }
        return sab / Math.sqrt(saa * sbb);
    }

    /** Each true source must match some estimated component up to sign, scale and order. */
    private static void assertSeparated(FittedIca model) {
        double[][] truth = SampleData.sources(N);
        double[][] estimated = model.transform(SampleData.mixedSignals(N));
        for (int s = 0; s < 2; s++) {
            double best = 0;
            for (int c = 0; c < estimated[0].length; c++) {
                best = Math.max(best, Math.abs(correlation(truth, s, estimated, c)));
            }
            assertTrue(best > 0.95, "source " + s + " best |corr| = " + best);
        }
    }

    private static void assertOrthonormalRows(double[][] w) {
        for (int i = 0; i < w.length; i++) {
            for (int j = 0; j < w.length; j++) {
                double dot = 0;
                for (int c = 0; c < w[i].length; c++) dot += w[i][c] * w[j][c];
                assertEquals(i == j ? 1.0 : 0.0, dot, 1e-6, "row " + i + " . row " + j);
            }
        }
    }

    @Test
    void symmetricSeparatesMixedSources() throws Exception {
        FittedIca model = new FastIca()
            .withOrthogonalization(Orthogonalization.SYMMETRIC)
            .withSeed(42L)
            .fit(SampleData.mixedSignals(N));

        assertEquals(2, model.getNumComponents());
        assertEquals(2, model.getNumFeatures());
        assertSeparated(model);
        assertOrthonormalRows(model.getUnmixing());
    }

    @Test
    void deflationSeparatesMixedSources() throws Exception {
        FittedIca model = new FastIca()
            .withOrthogonalization(Orthogonalization.DEFLATION)
            .withSeed(7L)
            .fit(SampleData.mixedSignals(N));

        assertSeparated(model);
        assertOrthonormalRows(model.getUnmixing());
    }

    @Test
    void cubeContrastSeparatesMixedSources() throws Exception {
        FittedIca model = new FastIca()
            .withContrast(ContrastFunction.cube())
            .withSeed(3L)
            .fit(SampleData.mixedSignals(N));

        assertSeparated(model);
    }

    @Test
    void estimatedSourcesAreWhite() throws Exception {
        double[][] x = SampleData.mixedSignals(N);
        FittedIca model = FastIca.fit(x, 2, 11L);
        double[][] s = model.transform(x);

        for (int a = 0; a < 2; a++) {
            for (int b = 0; b < 2; b++) {
                double cov = 0;
                for (double[] row : s) cov += row[a] * row[b];
                assertEquals(a == b ? 1.0 : 0.0, cov / N, 1e-6);
            }
        }
    }

    @Test
    void sameSeedIsReproducible() throws Exception {
        double[][] x = SampleData.mixedSignals(N);
        FastIca ica = new FastIca().withSeed(1234L);

        FittedIca first = ica.fit(x);
        FittedIca second = ica.fit(x);

        assertEquals(first.getIterations(), second.getIterations());
        for (int i = 0; i < 2; i++) {
            assertArrayEquals(first.getUnmixing()[i], second.getUnmixing()[i], 0.0);
            assertArrayEquals(first.getWhitening()[i], second.getWhitening()[i], 0.0);
        }
        assertArrayEquals(first.transform(x)[10], second.transform(x)[10], 0.0);
    }

    @Test
    void meanIsRetained() throws Exception {
        double[][] x = SampleData.mixedSignals(N);
        double[][] shifted = new double[N][];
        for (int i = 0; i < N; i++) shifted[i] = new double[] {x[i][0] + 5, x[i][1] - 3};

        FittedIca a = FastIca.fit(x, 2, 5L);
        FittedIca b = FastIca.fit(shifted, 2, 5L);

        assertEquals(a.getMean()[0] + 5, b.getMean()[0], 1e-9);
        assertEquals(a.getMean()[1] - 3, b.getMean()[1], 1e-9);
        assertArrayEquals(a.transform(x)[100], b.transform(shifted)[100], 1e-6);
    }

    @Test
    void singleComponentFromThreeFeatures() throws Exception {
        double[][] x2 = SampleData.mixedSignals(N);
        double[][] x = new double[N][];
        for (int i = 0; i < N; i++) x[i] = new double[] {x2[i][0], x2[i][1], x2[i][0] - x2[i][1]};

        FittedIca model = new FastIca().withComponents(1).withSeed(9L).fit(x);

        assertEquals(1, model.getNumComponents());
        assertEquals(3, model.getComponents()[0].length);
        assertEquals(1, model.transform(x)[0].length);
        assertEquals(1.0, Math.abs(model.getUnmixing()[0][0]), 1e-12);
    }

    @Test
    void duplicatedFeatureIsSingularCovariance() {
        double[][] x2 = SampleData.mixedSignals(N);
        double[][] x = new double[N][];
        for (int i = 0; i < N; i++) x[i] = new double[] {x2[i][0], x2[i][1], x2[i][0]};

        assertThrows(SingularCovarianceException.class, () -> new FastIca().withSeed(1L).fit(x));
    }

    @Test
    void degenerateDirectionsOutsideTheKeptOnesAreFine() throws Exception {
        double[][] x2 = SampleData.mixedSignals(N);
        double[][] x = new double[N][];
        for (int i = 0; i < N; i++) x[i] = new double[] {x2[i][0], x2[i][1], x2[i][0]};

        FittedIca model = new FastIca().withComponents(2).withSeed(1L).fit(x);
        assertEquals(2, model.getNumComponents());
    }

    @Test
    void constantDataIsSingularCovariance() {
        double[][] x = new double[20][];
        for (int i = 0; i < 20; i++) x[i] = new double[] {1.0, 2.0};
        assertThrows(SingularCovarianceException.class, () -> FastIca.fit(x, 2, 0L));
    }

    @Test
    void iterationCapIsReported() {
        double[][] x = SampleData.mixedSignals(N);
        for (Orthogonalization o : Orthogonalization.values()) {
            FastIca ica = new FastIca().withOrthogonalization(o).withMaxIterations(1).withTolerance(1e-15).withSeed(2L);
            DidNotConvergeException e = assertThrows(DidNotConvergeException.class, () -> ica.fit(x));
            assertEquals(1, e.getIterations());
        }
    }

    @Test
    void transformRejectsWrongFeatureCount() throws Exception {
        FittedIca model = FastIca.fit(SampleData.mixedSignals(N), 2, 4L);
        assertThrows(DimensionMismatchException.class, () -> model.transform(new double[][] {{1, 2, 3}}));
    }

    @Test
    void tooManyComponentsIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FastIca.fit(SampleData.mixedSignals(100), 3, 0L));
        assertThrows(IllegalArgumentException.class, () -> new FastIca().withComponents(0));
    }

    @Test
    void decorrelateYieldsOrthonormalRows() {
        double[][] w = {{2.0, 1.0, 0.0}, {0.5, 3.0, 1.0}, {1.0, -1.0, 4.0}};
        assertOrthonormalRows(FastIca.decorrelate(MatrixUtils.createRealMatrix(w)).getData());
    }
}
