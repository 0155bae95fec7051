package insight.engine.query;

import java.util.List;

import insight.engine.catalog.DatasetKind;

/**
 * Validated, executable form of a query document. Built once by {@link QueryValidator}
 * and consumed once by {@link QueryEngine}.
 * columns: output column names in COLUMNS order, either qualified ({@code id_field}) or bare apply/group names.
 */
public record QueryPlan(String datasetId, DatasetKind kind, FilterTree filter, List<String> columns,
                        OrderSpec order, TransformationSpec transformations) {
    public QueryPlan {
        columns = List.copyOf(columns);
    }

    /** Strips the dataset qualifier from a column name; bare names are returned unchanged. */
    public static String unqualified(String column) {
        int sep = column.indexOf('_');
        return sep < 0 ? column : column.substring(sep + 1);
    }
}
