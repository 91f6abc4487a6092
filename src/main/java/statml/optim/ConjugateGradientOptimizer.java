package statml.optim;

import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polak-Ribiere nonlinear conjugate gradient (Commons Math) behind the {@link Optimizer} seam.
 * <p>
 * Converged when the gradient max-norm drops to {@code tolerance} or the objective stops
 * changing (relative change below {@link #RELATIVE_VALUE_TOLERANCE}).
 */
public class ConjugateGradientOptimizer implements Optimizer {

    private static final Logger logger = Logger.getLogger(ConjugateGradientOptimizer.class.getName());

    public static final double RELATIVE_VALUE_TOLERANCE = 1e-12;

    // line search (Brent) tolerances and first bracketing step
    private static final double LINE_RELATIVE_TOLERANCE = 1e-10;
    private static final double LINE_ABSOLUTE_TOLERANCE = 1e-10;
    private static final double INITIAL_BRACKETING_RANGE = 1e-3;

    private final NonLinearConjugateGradientOptimizer.Formula formula;

    public ConjugateGradientOptimizer() {
        this(NonLinearConjugateGradientOptimizer.Formula.POLAK_RIBIERE);
    }

    public ConjugateGradientOptimizer(NonLinearConjugateGradientOptimizer.Formula formula) {
        this.formula = formula;
    }

    @Override
    public OptimizationResult minimize(DifferentiableFunction objective, double[] start,
                                       int maxIterations, double tolerance) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        if (!(tolerance > 0)) throw new IllegalArgumentException("tolerance must be > 0");

        BestPointTracker tracked = new BestPointTracker(objective);
        NonLinearConjugateGradientOptimizer opt = new NonLinearConjugateGradientOptimizer(
            formula,
            new GradientChecker(objective, tolerance),
            LINE_RELATIVE_TOLERANCE,
            LINE_ABSOLUTE_TOLERANCE,
            INITIAL_BRACKETING_RANGE
        );
        try {
            PointValuePair optimum = opt.optimize(
                new MaxEval(Integer.MAX_VALUE),
                new MaxIter(maxIterations),
                new ObjectiveFunction(tracked::value),
                new ObjectiveFunctionGradient(objective::gradient),
                GoalType.MINIMIZE,
                new InitialGuess(start.clone())
            );
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Conjugate gradient converged after " + opt.getIterations()
                    + " iterations, objective " + optimum.getValue());
            }
            return new OptimizationResult(optimum.getPoint(), optimum.getValue(), opt.getIterations(), true);
        } catch (MaxCountExceededException e) {
            logger.log(Level.FINE, "Conjugate gradient stopped at its limit: " + e.getMessage());
            double[] best = tracked.bestPoint != null ? tracked.bestPoint : start.clone();
            return new OptimizationResult(best, tracked.bestValue, opt.getIterations(), false);
        }
    }

    /** Remembers the lowest objective seen so a capped run can still report its best point. */
    private static final class BestPointTracker {
        private final DifferentiableFunction f;
        private double[] bestPoint;
        private double bestValue = Double.POSITIVE_INFINITY;

        BestPointTracker(DifferentiableFunction f) {
            this.f = f;
        }

        double value(double[] point) {
            double v = f.value(point);
            if (v < bestValue) {
                bestValue = v;
                bestPoint = point.clone();
            }
            return v;
        }
    }

    private static final class GradientChecker implements ConvergenceChecker<PointValuePair> {
        private final DifferentiableFunction f;
        private final double tolerance;

        GradientChecker(DifferentiableFunction f, double tolerance) {
            this.f = f;
            this.tolerance = tolerance;
        }

        @Override
        public boolean converged(int iteration, PointValuePair previous, PointValuePair current) {
            double[] g = f.gradient(current.getPoint());
            double norm = 0;
            for (double d : g) norm = Math.max(norm, Math.abs(d));
            if (norm <= tolerance) return true;
            double p = previous.getValue();
            double c = current.getValue();
            return Math.abs(p - c) <= RELATIVE_VALUE_TOLERANCE * Math.max(Math.abs(p), Math.abs(c));
        }
    }
}
