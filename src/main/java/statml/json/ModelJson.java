package statml.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import statml.ica.FittedIca;
import statml.linear.FittedLinearModel;

/**
 * JSON form of fitted models, so a fit can be stored and applied later.
 * <p>
 * Linear: {@code {"family":"POISSON","coefficients":[..],"intercept":..,"iterations":..,"rSquared":..}}.
 * ICA: {@code {"mean":[..],"whitening":[[..]],"unmixing":[[..]],"iterations":..}}.
 */
public final class ModelJson {

    private static final Gson GSON = new GsonBuilder()
        .serializeSpecialFloatingPointValues()
        .create();

    private ModelJson() { }

    public static String toJson(FittedLinearModel model) {
        return GSON.toJson(model);
    }

    public static String toJson(FittedIca model) {
        return GSON.toJson(model);
    }

    public static FittedLinearModel readLinear(String json) {
        JsonObject obj = requireFields(json, "family", "coefficients");
        requireVector(obj.get("coefficients"), "coefficients");
        FittedLinearModel model = GSON.fromJson(obj, FittedLinearModel.class);
        if (model.getFamily() == null || model.getNumFeatures() == 0) {
            throw new JsonParseException("Not a fitted linear model: " + abbreviate(json));
        }
        return model;
    }

    public static FittedIca readIca(String json) {
        JsonObject obj = requireFields(json, "mean", "whitening", "unmixing");
        requireVector(obj.get("mean"), "mean");
        requireMatrix(obj.get("whitening"), "whitening");
        requireMatrix(obj.get("unmixing"), "unmixing");
        FittedIca model = GSON.fromJson(obj, FittedIca.class);
        double[][] whitening = model.getWhitening();
        double[][] unmixing = model.getUnmixing();
        int p = model.getNumFeatures();
        int k = unmixing.length;
        if (k == 0 || whitening.length != k) {
            throw new JsonParseException("Whitening has " + whitening.length + " rows, unmixing " + k);
        }
        for (double[] row : whitening) {
            if (row.length != p) throw new JsonParseException("Whitening rows must have " + p + " columns");
        }
        for (double[] row : unmixing) {
            if (row.length != k) throw new JsonParseException("Unmixing must be " + k + " x " + k);
        }
        return model;
    }

    private static JsonObject requireFields(String json, String... fields) {
        JsonElement element = JsonParser.parseString(json);
        if (!element.isJsonObject()) {
            throw new JsonParseException("Expected a JSON object: " + abbreviate(json));
        }
        JsonObject obj = element.getAsJsonObject();
        for (String field : fields) {
            if (!obj.has(field) || obj.get(field).isJsonNull()) {
                throw new JsonParseException("Missing '" + field + "' in " + abbreviate(json));
            }
        }
        return obj;
    }

    private static void requireMatrix(JsonElement element, String field) {
        if (!element.isJsonArray() || element.getAsJsonArray().size() == 0) {
            throw new JsonParseException("'" + field + "' must be a non-empty array of rows");
        }
        JsonArray rows = element.getAsJsonArray();
        for (int i = 0; i < rows.size(); i++) {
            requireVector(rows.get(i), field + "[" + i + "]");
        }
    }

    private static void requireVector(JsonElement element, String field) {
        if (!element.isJsonArray()) {
            throw new JsonParseException("'" + field + "' must be an array of numbers");
        }
        for (JsonElement value : element.getAsJsonArray()) {
            if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()
                    || !Double.isFinite(value.getAsDouble())) {
                throw new JsonParseException("'" + field + "' must hold finite numbers, found " + value);
            }
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "null";
        return s.length() > 60 ? s.substring(0, 60) + "..." : s;
    }
}
