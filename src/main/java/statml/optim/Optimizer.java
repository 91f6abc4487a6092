package statml.optim;

/**
 * Iterative minimizer of a differentiable objective.
 * <p>
 * Implementations stop on their own convergence criterion or at {@code maxIterations}.
 * Hitting the cap is reported through {@link OptimizationResult#isConverged()} together with
 * the best point found; it is not an exception.
 */
public interface Optimizer {

    OptimizationResult minimize(DifferentiableFunction objective, double[] start,
                                int maxIterations, double tolerance);
}
