package statml.web;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.reflect.TypeToken;
import org.junit.jupiter.api.Test;
import statml.SampleData;
import statml.SingularMatrixException;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisServiceTest {

    private static final Gson GSON = new Gson();
    private static final Type MAP = new TypeToken<Map<String, Object>>() {}.getType();

    private final AnalysisService service = new AnalysisService();

    private static Map<String, Object> request(String json) {
        return GSON.fromJson(json, MAP);
    }

    @Test
    void linearRequestReturnsCoefficientsAndFittedValues() throws Exception {
        Map<String, Object> out = service.linear(request(
            "{\"x\": [[0],[1],[2],[3]], \"y\": [1, 3, 5, 7]}"));

        assertEquals(1.0, (Double) out.get("intercept"), 1e-9);
        List<?> coefficients = (List<?>) out.get("coefficients");
        assertEquals(2.0, (Double) coefficients.get(0), 1e-9);
        List<?> fitted = (List<?>) out.get("fitted");
        assertEquals(7.0, (Double) fitted.get(3), 1e-9);
        assertEquals("IDENTITY", out.get("family"));
        assertTrue(out.get("model") instanceof JsonElement);
    }

    @Test
    void linearRequestHonoursFamily() throws Exception {
        Map<String, Object> out = service.linear(request(
            "{\"x\": [[0],[1],[2],[3],[4]], \"y\": [1, 2, 4, 8, 16], \"family\": \"poisson\","
                + " \"maxIterations\": 2000, \"tolerance\": 1e-9}"));

        List<?> coefficients = (List<?>) out.get("coefficients");
        assertEquals(Math.log(2), (Double) coefficients.get(0), 1e-3);
        assertEquals(0.0, (Double) out.get("intercept"), 1e-3);
    }

    @Test
    void singularLinearRequestFails() {
        assertThrows(SingularMatrixException.class, () -> service.linear(request(
            "{\"x\": [[1, 2],[2, 4],[3, 6]], \"y\": [1, 2, 3]}")));
    }

    @Test
    void malformedRequestsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.linear(request("{\"y\": [1, 2]}")));
        assertThrows(IllegalArgumentException.class,
            () -> service.linear(request("{\"x\": [[1],[\"a\"]], \"y\": [1, 2]}")));
        assertThrows(IllegalArgumentException.class,
            () -> service.linear(request("{\"x\": [[1],[2]], \"y\": [1, 2], \"family\": \"cauchy\"}")));
    }

    @Test
    void icaRequestReturnsSources() throws Exception {
        double[][] x = SampleData.mixedSignals(400);
        Map<String, Object> req = request("{\"seed\": 5, \"orthogonalization\": \"deflation\"}");
        req.put("x", GSON.fromJson(GSON.toJson(x), List.class));

        Map<String, Object> out = service.ica(req);

        List<?> sources = (List<?>) out.get("sources");
        assertEquals(400, sources.size());
        assertEquals(2, ((List<?>) sources.get(0)).size());
        assertEquals(2, ((List<?>) out.get("components")).size());
        assertEquals(2, ((List<?>) out.get("mean")).size());
    }
}
