package statml.web;

import com.google.gson.JsonParser;
import statml.EstimationException;
import statml.ica.ContrastFunction;
import statml.ica.FastIca;
import statml.ica.FittedIca;
import statml.ica.Orthogonalization;
import statml.json.ModelJson;
import statml.linear.Family;
import statml.linear.FittedLinearModel;
import statml.linear.LinearRegression;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns decoded JSON requests into fits. Request values arrive as Gson decodes them
 * into {@code Map<String, Object>}: lists, doubles, strings and booleans.
 */
public class AnalysisService {

    /**
     * Fit a linear model.
     * Request: {@code x} (rows), {@code y}, optional {@code family}, {@code alpha},
     * {@code fitIntercept}, {@code maxIterations}, {@code tolerance}.
     */
    public Map<String, Object> linear(Map<String, Object> req) throws EstimationException {
        double[][] x = getMatrix(req, "x");
        double[] y = getVector(req, "y");

        LinearRegression estimator = new LinearRegression()
            .withFamily(Family.parse(getString(req, "family", "identity")))
            .withAlpha(getDouble(req, "alpha", 0.0))
            .withFitIntercept(getBoolean(req, "fitIntercept", true))
            .withMaxIterations(getInt(req, "maxIterations", LinearRegression.DEFAULT_MAX_ITERATIONS))
            .withTolerance(getDouble(req, "tolerance", LinearRegression.DEFAULT_TOLERANCE));
        FittedLinearModel model = estimator.fit(x, y);

        Map<String, Object> out = new HashMap<>();
        out.put("family", model.getFamily().name());
        out.put("intercept", model.getIntercept());
        out.put("coefficients", toList(model.getCoefficients()));
        out.put("rSquared", model.getRSquared());
        out.put("iterations", model.getIterations());
        out.put("fitted", toList(model.predict(x)));
        out.put("model", JsonParser.parseString(ModelJson.toJson(model)));
        return out;
    }

    /**
     * Run FastICA.
     * Request: {@code x} (rows), optional {@code components}, {@code contrast}, {@code alpha},
     * {@code orthogonalization}, {@code seed}, {@code maxIterations}, {@code tolerance}.
     */
    public Map<String, Object> ica(Map<String, Object> req) throws EstimationException {
        double[][] x = getMatrix(req, "x");

        FastIca estimator = new FastIca()
            .withContrast(ContrastFunction.parse(getString(req, "contrast", "logcosh"),
                getDouble(req, "alpha", ContrastFunction.DEFAULT_LOGCOSH_ALPHA)))
            .withOrthogonalization(Orthogonalization.parse(getString(req, "orthogonalization", "symmetric")))
            .withMaxIterations(getInt(req, "maxIterations", FastIca.DEFAULT_MAX_ITERATIONS))
            .withTolerance(getDouble(req, "tolerance", FastIca.DEFAULT_TOLERANCE));
        if (req.get("components") != null) {
            estimator = estimator.withComponents(getInt(req, "components", 0));
        }
        if (req.get("seed") != null) {
            estimator = estimator.withSeed(getLong(req, "seed", 0L));
        }
        FittedIca model = estimator.fit(x);

        List<List<Double>> sources = new ArrayList<>();
        for (double[] row : model.transform(x)) sources.add(toList(row));
        List<List<Double>> components = new ArrayList<>();
        for (double[] row : model.getComponents()) components.add(toList(row));

        Map<String, Object> out = new HashMap<>();
        out.put("sources", sources);
        out.put("components", components);
        out.put("mean", toList(model.getMean()));
        out.put("iterations", model.getIterations());
        out.put("model", JsonParser.parseString(ModelJson.toJson(model)));
        return out;
    }

    static double[][] getMatrix(Map<String, Object> req, String key) {
        Object obj = req.get(key);
        if (!(obj instanceof List<?>) || ((List<?>) obj).isEmpty()) {
            throw new IllegalArgumentException("Missing or empty '" + key + "' matrix");
        }
        List<?> rows = (List<?>) obj;
        double[][] out = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            if (!(rows.get(i) instanceof List<?>)) {
                throw new IllegalArgumentException("Row " + i + " of '" + key + "' is not an array");
            }
            out[i] = toArray((List<?>) rows.get(i), key + "[" + i + "]");
        }
        return out;
    }

    static double[] getVector(Map<String, Object> req, String key) {
        Object obj = req.get(key);
        if (!(obj instanceof List<?>) || ((List<?>) obj).isEmpty()) {
            throw new IllegalArgumentException("Missing or empty '" + key + "' array");
        }
        return toArray((List<?>) obj, key);
    }

    private static double[] toArray(List<?> list, String what) {
        double[] out = new double[list.size()];
        for (int i = 0; i < out.length; i++) {
            Object o = list.get(i);
            if (!(o instanceof Number)) {
                throw new IllegalArgumentException("All values of '" + what + "' must be numbers");
            }
            out[i] = ((Number) o).doubleValue();
        }
        return out;
    }

    private static String getString(Map<String, Object> m, String key, String def) {
        Object v = m.get(key);
        return v instanceof String ? (String) v : def;
    }

    private static double getDouble(Map<String, Object> m, String key, double def) {
        Object v = m.get(key);
        return v instanceof Number ? ((Number) v).doubleValue() : def;
    }

    private static int getInt(Map<String, Object> m, String key, int def) {
        Object v = m.get(key);
        return v instanceof Number ? ((Number) v).intValue() : def;
    }

    private static long getLong(Map<String, Object> m, String key, long def) {
        Object v = m.get(key);
        return v instanceof Number ? ((Number) v).longValue() : def;
    }

    private static boolean getBoolean(Map<String, Object> m, String key, boolean def) {
        Object v = m.get(key);
        return v instanceof Boolean ? (Boolean) v : def;
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) list.add(v);
        return list;
    }
}
