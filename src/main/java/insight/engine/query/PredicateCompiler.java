package insight.engine.query;

import java.util.ArrayList;
import java.util.List;

import insight.engine.exec.ComparisonPredicate;
import insight.engine.exec.CompoundPredicate;
import insight.engine.exec.Predicate;
import insight.engine.exec.StringMatchPredicate;

/**
 * Compiles a validated {@link FilterTree} into a physical Predicate over rows with the given columns.
 * Returns null for an empty tree (match everything).
 */
public class PredicateCompiler {

    public Predicate compile(FilterTree tree, List<String> columns) {
        if (tree == null) throw new IllegalArgumentException("tree must not be null");
        if (tree.isEmpty()) return null;
        return compileNode(tree, 0, columns);
    }

    private Predicate compileNode(FilterTree tree, int index, List<String> columns) {
        FilterNode node = tree.node(index);
        if (node instanceof FilterNode.LogicNode logic) {
            List<Predicate> children = new ArrayList<>(logic.children().size());
            for (int child : logic.children()) children.add(compileNode(tree, child, columns));
            return logic.op() == FilterNode.Logic.AND ? CompoundPredicate.and(children) : CompoundPredicate.or(children);
        }
        if (node instanceof FilterNode.NegationNode not) {
            return CompoundPredicate.not(compileNode(tree, not.child(), columns));
        }
        if (node instanceof FilterNode.ComparisonNode cmp) {
            return ComparisonPredicate.forColumnName(columns, cmp.field(), mapOp(cmp.op()), cmp.value());
        }
        if (node instanceof FilterNode.StringMatchNode is) {
            return StringMatchPredicate.forColumnName(columns, is.field(), is.pattern());
        }
        throw new IllegalStateException("Unsupported filter node: " + node);
    }

    private ComparisonPredicate.Op mapOp(FilterNode.Comparison op) {
        return switch (op) {
            case GT -> ComparisonPredicate.Op.GT;
            case LT -> ComparisonPredicate.Op.LT;
            case EQ -> ComparisonPredicate.Op.EQ;
        };
    }
}
