package insight.engine.query;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import insight.engine.exec.Row;
import insight.engine.storage.DatasetStore;

/**
 * Processor combining parsing, validation and execution against a {@link DatasetStore}.
 * Validation and execution run under the store's read lock.
 */
public class QueryProcessor {
    private static final TypeAdapter<JsonElement> JSON = new Gson().getAdapter(JsonElement.class);

    private final DatasetStore store;
    private final QueryValidator validator = new QueryValidator();
    private final QueryEngine engine;

    public QueryProcessor(DatasetStore store) {
        this(store, new QueryEngine());
    }

    public QueryProcessor(DatasetStore store, QueryEngine engine) {
        this.store = store;
        this.engine = engine;
    }

    /** Parses JSON text and runs it. Malformed JSON is a validation failure. */
    public List<Row> performQuery(String json) {
        if (json == null) throw new QueryValidationException("Query must not be null");
        return performQuery(parseStrict(json));
    }

    public List<Row> performQuery(JsonElement query) {
        return store.read(() -> engine.execute(validator.validate(query, store.registry()), store));
    }

    // Strict JSON: no unquoted names or strings, no single quotes, nothing after the document.
    static JsonElement parseStrict(String json) {
        try (JsonReader reader = new JsonReader(new StringReader(json))) {
            reader.setLenient(false);
            JsonElement query = JSON.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) throw new QueryValidationException("Query has content after the JSON document");
            return query;
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new QueryValidationException("Query is not valid JSON: " + e.getMessage(), e);
        }
    }
}
