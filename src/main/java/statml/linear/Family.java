package statml.linear;

/**
 * Response distribution and link of a (generalized) linear model.
 * <p>
 * Each constant carries the pure functions the fitter needs: the inverse link
 * {@code mu = g^-1(eta)}, its derivative, the variance function, and the per-sample
 * negative log-likelihood in terms of the linear predictor {@code eta} (constants that
 * depend only on {@code y} dropped) with its derivative.
 */
public enum Family {

    /** Gaussian response, identity link: ordinary least squares / ridge. */
    IDENTITY {
        @Override public double inverseLink(double eta) { return eta; }
        @Override public double inverseLinkDerivative(double eta) { return 1.0; }
        @Override public double variance(double mu) { return 1.0; }
        @Override public double loss(double y, double eta) { return 0.5 * (y - eta) * (y - eta); }
        @Override public double lossGradient(double y, double eta) { return eta - y; }
        @Override public double deviance(double y, double mu) { return (y - mu) * (y - mu); }
        @Override public void validateTarget(double y) { }
    },

    /** Bernoulli / binomial proportion, logit link (logistic regression). */
    BINOMIAL {
        @Override public double inverseLink(double eta) {
            if (eta >= 0) {
                return 1.0 / (1.0 + Math.exp(-eta));
            }
            double e = Math.exp(eta);
            return e / (1.0 + e);
        }
        @Override public double inverseLinkDerivative(double eta) {
            double mu = inverseLink(eta);
            return mu * (1.0 - mu);
        }
        @Override public double variance(double mu) { return mu * (1.0 - mu); }
        @Override public double loss(double y, double eta) {
            // log(1 + e^eta) without overflow
            double softplus = Math.max(eta, 0) + Math.log1p(Math.exp(-Math.abs(eta)));
            return softplus - y * eta;
        }
        @Override public double lossGradient(double y, double eta) { return inverseLink(eta) - y; }
        @Override public double deviance(double y, double mu) {
            return 2.0 * (xlogy(y, y / mu) + xlogy(1.0 - y, (1.0 - y) / (1.0 - mu)));
        }
        @Override public void validateTarget(double y) {
            if (y < 0 || y > 1) throw new IllegalArgumentException("binomial target must lie in [0, 1]: " + y);
        }
    },

    /** Count data, log link. */
    POISSON {
        @Override public double inverseLink(double eta) { return Math.exp(eta); }
        @Override public double inverseLinkDerivative(double eta) { return Math.exp(eta); }
        @Override public double variance(double mu) { return mu; }
        @Override public double loss(double y, double eta) { return Math.exp(eta) - y * eta; }
        @Override public double lossGradient(double y, double eta) { return Math.exp(eta) - y; }
        @Override public double deviance(double y, double mu) { return 2.0 * (xlogy(y, y / mu) - (y - mu)); }
        @Override public void validateTarget(double y) {
            if (y < 0) throw new IllegalArgumentException("poisson target must be non-negative: " + y);
        }
    },

    /** Positive continuous response with constant coefficient of variation, log link. */
    GAMMA {
        @Override public double inverseLink(double eta) { return Math.exp(eta); }
        @Override public double inverseLinkDerivative(double eta) { return Math.exp(eta); }
        @Override public double variance(double mu) { return mu * mu; }
        @Override public double loss(double y, double eta) { return y * Math.exp(-eta) + eta; }
        @Override public double lossGradient(double y, double eta) { return 1.0 - y * Math.exp(-eta); }
        @Override public double deviance(double y, double mu) { return 2.0 * (-Math.log(y / mu) + (y - mu) / mu); }
        @Override public void validateTarget(double y) {
            if (y <= 0) throw new IllegalArgumentException("gamma target must be positive: " + y);
        }
    };

    /** Mean response for a linear predictor. */
    public abstract double inverseLink(double eta);

    /** d mu / d eta. */
    public abstract double inverseLinkDerivative(double eta);

    /** Variance of the response as a function of its mean, up to the dispersion. */
    public abstract double variance(double mu);

    /** Per-sample negative log-likelihood as a function of the linear predictor. */
    public abstract double loss(double y, double eta);

    /** d loss / d eta. Equals {@code mu - y} for the canonical links. */
    public abstract double lossGradient(double y, double eta);

    /** Unit deviance of one observation. */
    public abstract double deviance(double y, double mu);

    /** Reject a target value outside the distribution's support. */
    public abstract void validateTarget(double y);

    /** Case-insensitive lookup, accepting a few common aliases. */
    public static Family parse(String name) {
        switch (name.trim().toLowerCase()) {
            case "identity":
            case "gaussian":
            case "normal":
                return IDENTITY;
            case "binomial":
            case "logistic":
            case "logit":
                return BINOMIAL;
            case "poisson":
                return POISSON;
            case "gamma":
                return GAMMA;
            default:
                throw new IllegalArgumentException("Unknown family: " + name);
        }
    }

    private static double xlogy(double x, double y) {
        return x == 0 ? 0 : x * Math.log(y);
    }
}
