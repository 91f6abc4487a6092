package statml;

/**
 * Deterministic synthetic data sets for the demo and the web API.
 */
public final class SampleData {

    /** Mixing matrix applied to {@link #sources(int)} by {@link #mixedSignals(int)}. */
    public static final double[][] MIXING = {
        {1.0, 1.0},
        {0.5, 2.0}
    };

    private SampleData() { }

    /** Two independent sources sampled on t in [0, 8): a sine and a square wave. Rows = samples. */
    public static double[][] sources(int n) {
        double[][] s = new double[n][2];
        for (int i = 0; i < n; i++) {
            double t = 8.0 * i / n;
            s[i][0] = Math.sin(2 * t);
            s[i][1] = Math.signum(Math.sin(3 * t));
        }
        return s;
    }

    /** {@link #sources(int)} mixed by {@link #MIXING}: x = A s. */
    public static double[][] mixedSignals(int n) {
        double[][] s = sources(n);
        double[][] x = new double[n][2];
        for (int i = 0; i < n; i++) {
            for (int r = 0; r < 2; r++) {
                x[i][r] = MIXING[r][0] * s[i][0] + MIXING[r][1] * s[i][1];
            }
        }
        return x;
    }

    /** Design matrix with two features: a trend and a seasonal term. */
    public static double[][] seasonalDesign(int n) {
        double[][] x = new double[n][2];
        for (int i = 0; i < n; i++) {
            x[i][0] = i / (double) n;
            x[i][1] = Math.sin(2 * Math.PI * i / 12.0);
        }
        return x;
    }

    /** Mean counts exp(1 + 1.5 trend + 0.4 season) over {@link #seasonalDesign(int)}. */
    public static double[] poissonMeans(int n) {
        double[][] x = seasonalDesign(n);
        double[] y = new double[n];
        for (int i = 0; i < n; i++) y[i] = Math.exp(1.0 + 1.5 * x[i][0] + 0.4 * x[i][1]);
        return y;
    }
}
