package insight.engine.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import insight.engine.catalog.DatasetKind;
import insight.engine.catalog.SchemaRegistry;
import insight.engine.exec.WildcardPattern;

/**
 * Turns an untrusted query document into a {@link QueryPlan}.
 * <pre>
 * {WHERE: {...}, OPTIONS: {COLUMNS: [...], ORDER?: ...}, TRANSFORMATIONS?: {GROUP: [...], APPLY: [...]}}
 * </pre>
 * Every violation raises {@link QueryValidationException}. Stateless: all per-query state lives
 * in a {@link Binding} created for each call, so one validator may serve concurrent queries.
 */
public class QueryValidator {
    private static final Logger log = LoggerFactory.getLogger(QueryValidator.class);

    static final String SEPARATOR = "_";

    /** Deepest allowed WHERE nesting; the compiled predicate is evaluated recursively. */
    public static final int MAX_FILTER_DEPTH = 500;

    private static final List<String> TOP_KEYS = List.of("WHERE", "OPTIONS");
    private static final List<String> TOP_KEYS_WITH_TRANSFORMATIONS = List.of("WHERE", "OPTIONS", "TRANSFORMATIONS");

    public QueryPlan validate(JsonElement query, SchemaRegistry registry) {
        if (query == null || !query.isJsonObject()) throw fail("Query must be a non-null JSON object");
        JsonObject root = query.getAsJsonObject();
        List<String> keys = new ArrayList<>(root.keySet());
        boolean transformed = keys.equals(TOP_KEYS_WITH_TRANSFORMATIONS);
        if (!transformed && !keys.equals(TOP_KEYS)) {
            throw fail("Query keys must be WHERE, OPTIONS and optionally TRANSFORMATIONS, in that order; got " + keys);
        }

        Binding binding = new Binding(registry);
        FilterTree filter = checkWhere(root.get("WHERE"), binding);

        JsonObject options = object(root.get("OPTIONS"), "OPTIONS");
        List<String> optionKeys = new ArrayList<>(options.keySet());
        if (!optionKeys.equals(List.of("COLUMNS")) && !optionKeys.equals(List.of("COLUMNS", "ORDER"))) {
            throw fail("OPTIONS must contain COLUMNS optionally followed by ORDER; got " + optionKeys);
        }
        Map<String, String> columns = checkColumns(options.get("COLUMNS"), transformed, binding);
        OrderSpec order = options.has("ORDER") ? checkOrder(options.get("ORDER"), columns) : OrderSpec.NONE;

        TransformationSpec transformations = transformed
            ? checkTransformations(root.get("TRANSFORMATIONS"), columns, binding)
            : TransformationSpec.EMPTY;

        if (binding.datasetId == null) throw fail("Query does not reference any dataset");
        log.debug("Validated query on '{}' ({}): filter nodes={} columns={} order={} groups={}",
            binding.datasetId, binding.kind, filter.size(), columns.keySet(), order.keys(), transformations.groupKeys());
        return new QueryPlan(binding.datasetId, binding.kind, filter, new ArrayList<>(columns.keySet()), order, transformations);
    }

    // ---------------------------------------------------------------- WHERE

    /**
     * Builds the filter tree breadth-first. A child's slot index is reserved when its parent is
     * processed, and children are appended in queue order, so each reserved index matches the
     * position the child eventually takes.
     */
    FilterTree checkWhere(JsonElement where, Binding binding) {
        JsonObject body = object(where, "WHERE");
        if (body.size() == 0) return FilterTree.EMPTY;

        List<FilterNode> nodes = new ArrayList<>();
        Deque<JsonElement> queue = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        queue.add(body);
        depths.add(1);
        int nextIndex = 1;
        while (!queue.isEmpty()) {
            JsonObject filter = object(queue.poll(), "filter");
            int depth = depths.poll();
            if (depth > MAX_FILTER_DEPTH) throw fail("WHERE is nested deeper than " + MAX_FILTER_DEPTH + " levels");
            if (filter.size() != 1) throw fail("Filter must have exactly one key; got " + filter.keySet());
            String op = filter.keySet().iterator().next();
            JsonElement value = filter.get(op);
            switch (op) {
                case "AND", "OR" -> {
                    if (!value.isJsonArray() || value.getAsJsonArray().isEmpty()) throw fail(op + " must be a non-empty array");
                    List<Integer> children = new ArrayList<>();
                    for (JsonElement child : value.getAsJsonArray()) {
                        children.add(nextIndex++);
                        queue.add(child);
                        depths.add(depth + 1);
                    }
                    nodes.add(new FilterNode.LogicNode(FilterNode.Logic.valueOf(op), children));
                }
                case "NOT" -> {
                    object(value, "NOT");
                    nodes.add(new FilterNode.NegationNode(nextIndex++));
                    queue.add(value);
                    depths.add(depth + 1);
                }
                case "GT", "LT", "EQ" -> nodes.add(checkComparison(op, value, binding));
                case "IS" -> nodes.add(checkStringMatch(value, binding));
                default -> throw fail("Invalid filter key: " + op);
            }
        }
        return new FilterTree(nodes);
    }

    private FilterNode checkComparison(String op, JsonElement value, Binding binding) {
        Map.Entry<String, JsonElement> entry = singleEntry(value, op);
        String field = binding.bindField(entry.getKey());
        if (!binding.kind.isNumeric(field)) throw fail(op + " requires a numeric field; got " + entry.getKey());
        JsonElement literal = entry.getValue();
        if (!isNumber(literal)) throw fail(op + " value must be a number");
        return new FilterNode.ComparisonNode(FilterNode.Comparison.valueOf(op), field, literal.getAsDouble());
    }

    private FilterNode checkStringMatch(JsonElement value, Binding binding) {
        Map.Entry<String, JsonElement> entry = singleEntry(value, "IS");
        String field = binding.bindField(entry.getKey());
        if (!binding.kind.isString(field)) throw fail("IS requires a string field; got " + entry.getKey());
        JsonElement literal = entry.getValue();
        if (!isString(literal)) throw fail("IS value must be a string");
        try {
            return new FilterNode.StringMatchNode(field, WildcardPattern.parse(literal.getAsString()));
        } catch (IllegalArgumentException e) {
            throw fail("Invalid IS pattern: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------- OPTIONS

    /**
     * Returns column names as written mapped to their unqualified names.
     * Bare names are only allowed when the query has TRANSFORMATIONS.
     */
    Map<String, String> checkColumns(JsonElement value, boolean transformed, Binding binding) {
        if (value == null || !value.isJsonArray() || value.getAsJsonArray().isEmpty()) {
            throw fail("COLUMNS must be a non-empty array");
        }
        Map<String, String> columns = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (JsonElement e : value.getAsJsonArray()) {
            if (!isString(e)) throw fail("COLUMNS entries must be strings");
            String column = e.getAsString();
            String name;
            if (column.contains(SEPARATOR)) {
                name = binding.bindField(column);
            } else {
                if (!transformed) throw fail("Column '" + column + "' is not a qualified field and the query has no TRANSFORMATIONS");
                if (column.isEmpty()) throw fail("Column names must not be empty");
                name = column;
            }
            if (!seen.add(name)) throw fail("Duplicate column: " + column);
            columns.put(column, name);
        }
        return columns;
    }

    OrderSpec checkOrder(JsonElement value, Map<String, String> columns) {
        if (isString(value)) {
            String key = value.getAsString();
            if (!key.contains(SEPARATOR)) throw fail("ORDER must be a qualified field; got " + key);
            if (!columns.containsKey(key)) throw fail("ORDER key must appear in COLUMNS: " + key);
            return new OrderSpec(List.of(key), OrderSpec.Direction.UP);
        }
        if (value == null || !value.isJsonObject()) throw fail("ORDER must be a string or an object");
        JsonObject order = value.getAsJsonObject();
        if (!new ArrayList<>(order.keySet()).equals(List.of("dir", "keys"))) {
            throw fail("ORDER object must contain exactly dir then keys; got " + order.keySet());
        }
        JsonElement dir = order.get("dir");
        if (!isString(dir) || !(dir.getAsString().equals("UP") || dir.getAsString().equals("DOWN"))) {
            throw fail("ORDER dir must be UP or DOWN");
        }
        JsonElement keys = order.get("keys");
        if (!keys.isJsonArray() || keys.getAsJsonArray().isEmpty()) throw fail("ORDER keys must be a non-empty array");
        List<String> sortKeys = new ArrayList<>();
        for (JsonElement k : keys.getAsJsonArray()) {
            if (!isString(k)) throw fail("ORDER keys must be strings");
            if (!columns.containsKey(k.getAsString())) throw fail("ORDER key must appear in COLUMNS: " + k.getAsString());
            sortKeys.add(k.getAsString());
        }
        return new OrderSpec(sortKeys, OrderSpec.Direction.valueOf(dir.getAsString()));
    }

    // ---------------------------------------------------------------- TRANSFORMATIONS

    TransformationSpec checkTransformations(JsonElement value, Map<String, String> columns, Binding binding) {
        JsonObject body = object(value, "TRANSFORMATIONS");
        if (!new ArrayList<>(body.keySet()).equals(List.of("GROUP", "APPLY"))) {
            throw fail("TRANSFORMATIONS must contain exactly GROUP then APPLY; got " + body.keySet());
        }
        JsonElement group = body.get("GROUP");
        if (!group.isJsonArray() || group.getAsJsonArray().isEmpty()) throw fail("GROUP must be a non-empty array");
        List<String> groupKeys = new ArrayList<>();
        for (JsonElement g : group.getAsJsonArray()) {
            if (!isString(g) || !g.getAsString().contains(SEPARATOR)) throw fail("GROUP entries must be qualified fields");
            groupKeys.add(binding.bindField(g.getAsString()));
        }

        JsonElement apply = body.get("APPLY");
        if (!apply.isJsonArray()) throw fail("APPLY must be an array");
        Set<String> names = new HashSet<>(groupKeys);
        List<ApplyRule> rules = new ArrayList<>();
        for (JsonElement r : apply.getAsJsonArray()) {
            ApplyRule rule = checkApplyRule(r, binding);
            if (!names.add(rule.outputName())) throw fail("Duplicate APPLY key: " + rule.outputName());
            rules.add(rule);
        }

        if (!names.equals(new HashSet<>(columns.values()))) {
            throw fail("COLUMNS " + columns.keySet() + " must equal the GROUP and APPLY keys " + names);
        }
        for (Map.Entry<String, String> c : columns.entrySet()) {
            if (c.getKey().contains(SEPARATOR) && !groupKeys.contains(c.getValue())) {
                throw fail("Qualified column '" + c.getKey() + "' is not a GROUP key");
            }
        }
        return new TransformationSpec(groupKeys, rules);
    }

    private ApplyRule checkApplyRule(JsonElement value, Binding binding) {
        Map.Entry<String, JsonElement> rule = singleEntry(value, "APPLY rule");
        String name = rule.getKey();
        if (name.isEmpty() || name.contains(SEPARATOR)) throw fail("Invalid APPLY key: '" + name + "'");
        Map.Entry<String, JsonElement> body = singleEntry(rule.getValue(), "APPLY body of " + name);
        ApplyToken token = ApplyToken.of(body.getKey());
        if (token == null) throw fail("Invalid APPLY token: " + body.getKey());
        if (!isString(body.getValue())) throw fail("APPLY " + token + " target must be a qualified field");
        String source = body.getValue().getAsString();
        String field = binding.bindField(source);
        if (!binding.kind.isNumeric(field) && !token.acceptsStringField()) {
            throw fail(token + " requires a numeric field; got " + source);
        }
        return new ApplyRule(name, token, field);
    }

    // ---------------------------------------------------------------- helpers

    /**
     * Tracks the single dataset a query may reference. The first qualified field binds it;
     * any later reference to another id fails.
     */
    static final class Binding {
        private final SchemaRegistry registry;
        private String datasetId;
        private DatasetKind kind;

        Binding(SchemaRegistry registry) {
            this.registry = registry;
        }

        void bind(String id) {
            DatasetKind k = registry.kindOf(id);
            if (k == null) throw fail("Dataset not found: '" + id + "'");
            if (datasetId == null) {
                datasetId = id;
                kind = k;
            } else if (!datasetId.equals(id)) {
                throw fail("Query references more than one dataset: '" + datasetId + "' and '" + id + "'");
            }
        }

        /** Binds the qualifier of {@code id_field} and returns the declared field name. */
        String bindField(String qualified) {
            String[] parts = qualified.split(SEPARATOR, -1);
            if (parts.length != 2) throw fail("Invalid qualified field: '" + qualified + "'");
            bind(parts[0]);
            if (kind.typeOf(parts[1]) == null) throw fail("Field '" + parts[1] + "' is not declared for " + kind.label());
            return parts[1];
        }
    }

    private static JsonObject object(JsonElement value, String what) {
        if (value == null || !value.isJsonObject()) throw fail(what + " must be a JSON object");
        return value.getAsJsonObject();
    }

    private static Map.Entry<String, JsonElement> singleEntry(JsonElement value, String what) {
        JsonObject obj = object(value, what);
        if (obj.size() != 1) throw fail(what + " must have exactly one key; got " + obj.keySet());
        return obj.entrySet().iterator().next();
    }

    private static boolean isNumber(JsonElement e) {
        return e != null && e.isJsonPrimitive() && ((JsonPrimitive) e).isNumber();
    }

    private static boolean isString(JsonElement e) {
        return e != null && e.isJsonPrimitive() && ((JsonPrimitive) e).isString();
    }

    private static QueryValidationException fail(String message) {
        return new QueryValidationException(message);
    }

    private static QueryValidationException fail(String message, Throwable cause) {
        return new QueryValidationException(message, cause);
    }
}
