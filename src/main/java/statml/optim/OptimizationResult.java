package statml.optim;

/** Outcome of {@link Optimizer#minimize}: best point, its objective value and whether the criterion was met. */
public final class OptimizationResult {

    private final double[] point;
    private final double value;
    private final int iterations;
    private final boolean converged;

    public OptimizationResult(double[] point, double value, int iterations, boolean converged) {
        this.point = point.clone();
        this.value = value;
        this.iterations = iterations;
        this.converged = converged;
    }

    public double[] getPoint() { return point.clone(); }
    public double getValue() { return value; }
    public int getIterations() { return iterations; }
    public boolean isConverged() { return converged; }

    @Override
    public String toString() {
        return "OptimizationResult{value=" + String.format("%.6g", value)
            + ", iterations=" + iterations + ", converged=" + converged + "}";
    }
}
