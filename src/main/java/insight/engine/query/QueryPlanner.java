package insight.engine.query;

import java.util.ArrayList;
import java.util.List;

import insight.engine.exec.FilterOperator;
import insight.engine.exec.GroupOperator;
import insight.engine.exec.Operator;
import insight.engine.exec.Predicate;
import insight.engine.exec.ProjectionOperator;
import insight.engine.exec.RowLimitOperator;
import insight.engine.exec.SeqScanOperator;
import insight.engine.exec.SortOperator;
import insight.engine.storage.Record;

/**
 * Planner: builds the physical pipeline for a QueryPlan.
 *  1. Full scan of the dataset (SeqScanOperator) + FilterOperator unless the filter is empty.
 *  2. GroupOperator when the plan groups, otherwise ProjectionOperator onto the output columns.
 *  3. RowLimitOperator enforcing the result cap.
 *  4. SortOperator if the plan has an ORDER.
 */
public class QueryPlanner {
    private final PredicateCompiler predicateCompiler;

    public QueryPlanner(PredicateCompiler predicateCompiler) {
        this.predicateCompiler = predicateCompiler;
    }

    public Operator plan(QueryPlan plan, List<Record> records, int maxRows) {
        Operator root = new SeqScanOperator(records, plan.kind());
        Predicate pred = predicateCompiler.compile(plan.filter(), root.columns());
        if (pred != null) root = new FilterOperator(root, pred);

        if (plan.transformations().hasGrouping()) {
            root = new GroupOperator(root, plan.transformations().groupKeys(), groupOutputs(plan));
        } else {
            List<String> fields = new ArrayList<>(plan.columns().size());
            for (String c : plan.columns()) fields.add(QueryPlan.unqualified(c));
            root = ProjectionOperator.forColumnNames(root, plan.columns(), fields);
        }

        root = new RowLimitOperator(root, maxRows);
        if (!plan.order().isEmpty()) {
            root = new SortOperator(root, plan.order().keys(), plan.order().descending());
        }
        return root;
    }

    private List<GroupOperator.Output> groupOutputs(QueryPlan plan) {
        TransformationSpec t = plan.transformations();
        List<GroupOperator.Output> outputs = new ArrayList<>(plan.columns().size());
        for (String column : plan.columns()) {
            String name = QueryPlan.unqualified(column);
            if (t.groupKeys().contains(name)) {
                outputs.add(GroupOperator.Output.key(column, name));
                continue;
            }
            ApplyRule rule = t.ruleFor(name);
            if (rule == null) throw new IllegalStateException("Column '" + column + "' is neither a group key nor an apply key");
            outputs.add(GroupOperator.Output.aggregate(column, rule.sourceField(), rule.token()::newAccumulator));
        }
        return outputs;
    }
}
