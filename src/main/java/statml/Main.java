package statml;

import statml.ica.FastIca;
import statml.ica.FittedIca;
import statml.ica.Orthogonalization;
import statml.json.ModelJson;
import statml.linear.Family;
import statml.linear.FittedLinearModel;
import statml.linear.LinearRegression;

/**
 * Demo: least squares, Poisson regression and FastICA on synthetic data.
 */
public class Main {

    public static void main(String[] args) {
        try {
            run();
        } catch (EstimationException e) {
            System.err.println("Fit failed: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void run() throws EstimationException {
        int n = 48;
        double[][] x = SampleData.seasonalDesign(n);

        // --- OLS: y = 2 + 3 trend - 1 season, no noise
        double[] y = new double[n];
        for (int i = 0; i < n; i++) y[i] = 2 + 3 * x[i][0] - x[i][1];
        FittedLinearModel ols = LinearRegression.fit(x, y, Family.IDENTITY, 0.0);
        System.out.println("=== Least squares ===");
        System.out.printf("Intercept β₀ = %.4f%n", ols.getIntercept());
        System.out.printf("β = %s%n", format(ols.getCoefficients(), 2));
        System.out.printf("R² = %.4f%n", ols.getRSquared());
        System.out.println();

        // --- Ridge shrinks the same fit
        FittedLinearModel ridge = LinearRegression.fit(x, y, Family.IDENTITY, 10.0);
        System.out.println("=== Ridge (alpha = 10) ===");
        System.out.printf("β = %s%n", format(ridge.getCoefficients(), 2));
        System.out.println();

        // --- Poisson GLM on exact mean counts
        double[] counts = SampleData.poissonMeans(n);
        FittedLinearModel poisson = new LinearRegression()
            .withFamily(Family.POISSON)
            .withMaxIterations(1000)
            .withTolerance(1e-8)
            .fit(x, counts);
        System.out.println("=== Poisson regression ===");
        System.out.printf("Intercept β₀ = %.4f (true 1.0)%n", poisson.getIntercept());
        System.out.printf("β = %s (true [1.50, 0.40])%n", format(poisson.getCoefficients(), 2));
        System.out.printf("Iterations = %d%n", poisson.getIterations());
        System.out.println("Model JSON: " + ModelJson.toJson(poisson));
        System.out.println();

        // --- FastICA: unmix a sine and a square wave
        double[][] mixed = SampleData.mixedSignals(2000);
        FittedIca ica = new FastIca()
            .withComponents(2)
            .withOrthogonalization(Orthogonalization.SYMMETRIC)
            .withSeed(42L)
            .fit(mixed);
        double[][] sources = ica.transform(mixed);
        double[][] truth = SampleData.sources(2000);
        System.out.println("=== FastICA ===");
        System.out.printf("Iterations = %d%n", ica.getIterations());
        for (int s = 0; s < 2; s++) {
            double best = 0;
            for (int c = 0; c < 2; c++) best = Math.max(best, Math.abs(correlation(truth, s, sources, c)));
            System.out.printf("Source %d best |corr| = %.4f%n", s, best);
        }
    }

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

    private static String format(double[] a, int max) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < Math.min(a.length, max); i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%.2f", a[i]));
        }
        if (a.length > max) sb.append("...");
        sb.append("]");
        return sb.toString();
    }
}
