package insight.engine.query;

import java.util.List;

/**
 * Validated WHERE predicate stored as an array of nodes rooted at index 0.
 * An empty tree matches every record.
 * <p>
 * Nodes are laid out breadth-first: every child index is greater than its parent's
 * index, lies inside the array, and is referenced by exactly one parent.
 */
public final class FilterTree {
    public static final FilterTree EMPTY = new FilterTree(List.of());

    private final List<FilterNode> nodes;

    public FilterTree(List<FilterNode> nodes) {
        this.nodes = List.copyOf(nodes);
        checkShape();
    }

    public boolean isEmpty() { return nodes.isEmpty(); }

    public int size() { return nodes.size(); }

    public FilterNode root() {
        if (nodes.isEmpty()) throw new IllegalStateException("Empty filter tree has no root");
        return nodes.get(0);
    }

    public FilterNode node(int index) { return nodes.get(index); }

    public List<FilterNode> nodes() { return nodes; }

    private void checkShape() {
        boolean[] referenced = new boolean[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            FilterNode n = nodes.get(i);
            if (n instanceof FilterNode.LogicNode logic) {
                for (int child : logic.children()) reference(i, child, referenced);
            } else if (n instanceof FilterNode.NegationNode not) {
                reference(i, not.child(), referenced);
            }
        }
        for (int i = 1; i < referenced.length; i++) {
            if (!referenced[i]) throw new IllegalArgumentException("Filter node " + i + " is unreachable from the root");
        }
    }

    private void reference(int parent, int child, boolean[] referenced) {
        if (child <= parent || child >= nodes.size()) {
            throw new IllegalArgumentException("Filter node " + parent + " references invalid index " + child);
        }
        if (referenced[child]) throw new IllegalArgumentException("Filter node " + child + " has more than one parent");
        referenced[child] = true;
    }

    // For debugging
    @Override
    public String toString() {
        return nodes.isEmpty() ? "<match all>" : render(0);
    }

    private String render(int index) {
        FilterNode n = nodes.get(index);
        if (n instanceof FilterNode.LogicNode logic) {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < logic.children().size(); i++) {
                if (i > 0) sb.append(' ').append(logic.op()).append(' ');
                sb.append(render(logic.children().get(i)));
            }
            return sb.append(')').toString();
        } else if (n instanceof FilterNode.NegationNode not) {
            return "NOT(" + render(not.child()) + ")";
        } else if (n instanceof FilterNode.ComparisonNode cmp) {
            return cmp.field() + " " + cmp.op() + " " + cmp.value();
        } else if (n instanceof FilterNode.StringMatchNode is) {
            return is.field() + " IS '" + is.pattern() + "'";
        }
        throw new IllegalStateException("Unknown filter node: " + n);
    }
}
