package insight.engine.storage;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import insight.engine.catalog.DatasetKind;
import insight.engine.catalog.FieldSchema;

/**
 * Reads already-normalized dataset files:
 * <pre>{"id": "sections", "kind": "sections", "records": [{"uuid": "1", ...}, ...]}</pre>
 * Records missing a field or carrying a value of the wrong JSON type are skipped.
 */
public class DatasetLoader {
    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    public Dataset load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(JsonParser.parseReader(reader), file.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading dataset file: " + file, e);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed dataset file: " + file, e);
        }
    }

    /** Loads every {@code *.json} file of the directory, in file name order. */
    public List<Dataset> loadDirectory(Path dir) {
        if (!Files.isDirectory(dir)) return List.of();
        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed listing dataset directory: " + dir, e);
        }
        List<Dataset> out = new ArrayList<>(files.size());
        for (Path f : files) out.add(load(f));
        return out;
    }

    Dataset parse(JsonElement root, String source) {
        if (root == null || !root.isJsonObject()) throw new IllegalArgumentException("Dataset file must hold a JSON object: " + source);
        JsonObject obj = root.getAsJsonObject();
        String id = stringMember(obj, "id", source);
        DatasetKind kind = DatasetKind.fromLabel(stringMember(obj, "kind", source));
        JsonElement recs = obj.get("records");
        if (recs == null || !recs.isJsonArray()) throw new IllegalArgumentException("Dataset file has no records array: " + source);
        JsonArray arr = recs.getAsJsonArray();
        List<Record> records = new ArrayList<>(arr.size());
        int skipped = 0;
        for (JsonElement e : arr) {
            Record r = toRecord(kind, e);
            if (r == null) skipped++;
            else records.add(r);
        }
        if (skipped > 0) log.warn("Skipped {} malformed record(s) in {}", skipped, source);
        if (records.isEmpty()) throw new IllegalArgumentException("Dataset file has no valid records: " + source);
        return new Dataset(id, kind, records);
    }

    /** Builds a typed record, or returns null when a field is missing or mistyped (including a fractional integer field). */
    static Record toRecord(DatasetKind kind, JsonElement e) {
        if (e == null || !e.isJsonObject()) return null;
        JsonObject o = e.getAsJsonObject();
        List<Object> values = new ArrayList<>(kind.fields().size());
        for (FieldSchema f : kind.fields()) {
            JsonElement v = o.get(f.name());
            if (v == null || !v.isJsonPrimitive()) return null;
            JsonPrimitive p = v.getAsJsonPrimitive();
            switch (f.type()) {
                case NUMERIC -> {
                    if (!p.isNumber()) return null;
                    values.add(p.getAsDouble());
                }
                case STRING -> {
                    if (!p.isString()) return null;
                    values.add(p.getAsString());
                }
            }
        }
        try {
            return switch (kind) {
                case SECTIONS -> SectionRecord.fromValues(values);
                case ROOMS -> RoomRecord.fromValues(values);
            };
        } catch (IllegalArgumentException ex) {
            // fractional value for an integer field
            return null;
        }
    }

    private static String stringMember(JsonObject obj, String name, String source) {
        JsonElement v = obj.get(name);
        if (v == null || !v.isJsonPrimitive() || !v.getAsJsonPrimitive().isString()) {
            throw new IllegalArgumentException("Dataset file is missing string member '" + name + "': " + source);
        }
        return v.getAsString();
    }
}
