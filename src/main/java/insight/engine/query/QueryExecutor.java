package insight.engine.query;

import java.util.ArrayList;
import java.util.List;

import insight.engine.exec.Operator;
import insight.engine.exec.Row;

/**
 * Drains a planned operator pipeline into a list.
 * The pipeline is closed whether or not it completes, and nothing is returned on failure.
 */
public class QueryExecutor {

    public List<Row> collect(Operator op) {
        List<Row> rows = new ArrayList<>();
        op.open();
        try {
            Row r;
            while ((r = op.next()) != null) rows.add(r);
        } finally {
            op.close();
        }
        return rows;
    }
}
