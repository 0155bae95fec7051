package insight.engine.query;

import java.util.List;

import insight.engine.exec.WildcardPattern;

/**
 * One node of a {@link FilterTree}. Children are referenced by their index in the tree's node array.
 */
public interface FilterNode {
    enum Logic { AND, OR }

    enum Comparison { GT, LT, EQ }

    record LogicNode(Logic op, List<Integer> children) implements FilterNode {
        public LogicNode {
            if (children == null || children.isEmpty()) throw new IllegalArgumentException(op + " requires at least one child");
            children = List.copyOf(children);
        }
    }

    record NegationNode(int child) implements FilterNode {}

    // Numeric fields only.
    record ComparisonNode(Comparison op, String field, double value) implements FilterNode {}

    // String fields only.
    record StringMatchNode(String field, WildcardPattern pattern) implements FilterNode {}
}
