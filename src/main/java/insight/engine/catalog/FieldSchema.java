package insight.engine.catalog;

// Immutable data carrier for a dataset field.
public record FieldSchema(String name, FieldType type) {}
