package statml.optim;

/** A scalar objective together with its gradient. */
public interface DifferentiableFunction {

    double value(double[] point);

    double[] gradient(double[] point);
}
