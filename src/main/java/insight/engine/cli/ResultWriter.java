package insight.engine.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;

import insight.engine.exec.Row;

/**
 * Renders result rows as a JSON array of objects keyed by column name.
 * Integral doubles (e.g. a SUM of 300.0) are written without a fractional part.
 */
public final class ResultWriter {
    // Disable HTML escaping so patterns and titles print as-is
    private static final Gson GSON = new GsonBuilder()
        .disableHtmlEscaping()
        .setPrettyPrinting()
        .registerTypeAdapter(Double.class, (JsonSerializer<Double>) (src, type, ctx) ->
            src == Math.rint(src) && !src.isInfinite() ? new JsonPrimitive(src.longValue()) : new JsonPrimitive(src))
        .create();

    private ResultWriter() {}

    public static String toJson(List<Row> rows) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Row r : rows) out.add(r.toMap());
        return GSON.toJson(out);
    }
}
