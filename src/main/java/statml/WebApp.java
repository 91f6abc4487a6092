package statml;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import io.javalin.Javalin;
import io.javalin.http.Context;
import statml.web.AnalysisService;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON API over the estimators: linear / GLM regression and FastICA.
 * Run with: mvn exec:java -Dexec.mainClass="statml.WebApp"
 * Then POST to http://localhost:7000/api/linear or /api/ica.
 */
public class WebApp {

    private static final Logger logger = Logger.getLogger(WebApp.class.getName());

    private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();
    private static final Type REQUEST_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                logger.warning("Ignoring invalid PORT '" + env + "', using 7000");
            }
        }
        return 7000;
    }

    public static void main(String[] args) {
        int port = getPort();
        AnalysisService service = new AnalysisService();
        Javalin app = Javalin.create().start("0.0.0.0", port);

        app.post("/api/linear", ctx -> handle(ctx, req -> service.linear(req)));
        app.post("/api/ica", ctx -> handle(ctx, req -> service.ica(req)));

        app.get("/api/sample", ctx -> {
            double[][] raw = SampleData.mixedSignals(500);
            List<List<Double>> rows = new ArrayList<>(raw.length);
            for (double[] r : raw) rows.add(List.of(r[0], r[1]));
            Map<String, Object> out = new HashMap<>();
            out.put("x", rows);
            sendJson(ctx, 200, out);
        });

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new HashMap<>();
            h.put("status", "ok");
            h.put("port", port);
            sendJson(ctx, 200, h);
        });

        logger.info("statml web app: http://localhost:" + port);
    }

    interface Analysis {
        Map<String, Object> run(Map<String, Object> request) throws Exception;
    }

    /** Decode the body, run the analysis, and report any failure as {"error": ...}. */
    static void handle(Context ctx, Analysis analysis) {
        Map<String, Object> out;
        try {
            String body = ctx.body();
            if (body == null || body.isBlank()) {
                sendJson(ctx, 200, error("Missing request body"));
                return;
            }
            Map<String, Object> req = GSON.fromJson(body, REQUEST_TYPE);
            if (req == null) {
                sendJson(ctx, 200, error("Invalid JSON"));
                return;
            }
            out = analysis.run(req);
        } catch (Exception e) {
            logger.log(Level.FINE, "Request failed", e);
            String msg = e.getMessage();
            out = error(msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName());
            out.put("kind", e.getClass().getSimpleName());
        }
        sendJson(ctx, 200, out);
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> out = new HashMap<>();
        out.put("error", message);
        return out;
    }

    private static void sendJson(Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(GSON.toJson(body));
    }
}
