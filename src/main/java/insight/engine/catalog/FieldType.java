package insight.engine.catalog;

/**
 * Value types a dataset field can carry.
 * NUMERIC fields are "mfields" in the query language, STRING fields are "sfields".
 */
public enum FieldType {
    NUMERIC,
    STRING;
}
