package statml.ica;

/**
 * Non-Gaussianity contrast used by FastICA, given as the derivative {@code g} of the contrast
 * G and its own derivative {@code g'}.
 * <ul>
 *   <li>{@link #logcosh(double)}: G(u) = log cosh(αu)/α. General purpose.</li>
 *   <li>{@link #exp()}: G(u) = -e^(-u²/2). Highly super-Gaussian sources, robust to outliers.</li>
 *   <li>{@link #cube()}: G(u) = u⁴/4, kurtosis based. Cheap, sensitive to outliers.</li>
 * </ul>
 */
public abstract class ContrastFunction {

    public static final double DEFAULT_LOGCOSH_ALPHA = 1.0;

    private final String name;

    private ContrastFunction(String name) {
        this.name = name;
    }

    public abstract double g(double u);

    public abstract double gPrime(double u);

    public String getName() { return name; }

    public static ContrastFunction logcosh() {
        return logcosh(DEFAULT_LOGCOSH_ALPHA);
    }

    /** @param alpha scaling, usually in [1, 2] */
    public static ContrastFunction logcosh(final double alpha) {
        if (!(alpha >= 1 && alpha <= 2)) {
            throw new IllegalArgumentException("logcosh alpha must lie in [1, 2]: " + alpha);
        }
        return new ContrastFunction("logcosh") {
            @Override public double g(double u) { return Math.tanh(alpha * u); }
            @Override public double gPrime(double u) {
                double t = Math.tanh(alpha * u);
                return alpha * (1.0 - t * t);
            }
            @Override public String toString() { return "logcosh(" + alpha + ")"; }
        };
    }

    public static ContrastFunction exp() {
        return new ContrastFunction("exp") {
            @Override public double g(double u) { return u * Math.exp(-0.5 * u * u); }
            @Override public double gPrime(double u) { return (1.0 - u * u) * Math.exp(-0.5 * u * u); }
        };
    }

    public static ContrastFunction cube() {
        return new ContrastFunction("cube") {
            @Override public double g(double u) { return u * u * u; }
            @Override public double gPrime(double u) { return 3.0 * u * u; }
        };
    }

    /** Lookup by name: {@code logcosh}, {@code exp} or {@code cube}; alpha applies to logcosh only. */
    public static ContrastFunction parse(String name, double alpha) {
        switch (name.trim().toLowerCase()) {
            case "logcosh":
                return logcosh(alpha);
            case "exp":
                return exp();
            case "cube":
                return cube();
            default:
                throw new IllegalArgumentException("Unknown contrast function: " + name);
        }
    }

    @Override
    public String toString() { return name; }
}
