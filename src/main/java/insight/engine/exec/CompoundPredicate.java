package insight.engine.exec;

import java.util.Arrays;
import java.util.List;

/**
 * CompoundPredicate composes child predicates with logical AND / OR / NOT.
 * AND / OR take one or more children and short-circuit; NOT takes exactly one.
 */
public final class CompoundPredicate implements Predicate {
    public enum Type { AND, OR, NOT }

    private final Type type;
    private final List<Predicate> children; // for NOT size == 1

    private CompoundPredicate(Type type, List<Predicate> children) {
        if (type == Type.NOT && children.size() != 1) {
            throw new IllegalArgumentException("NOT requires exactly one child predicate");
        }
        if (children.isEmpty()) {
            throw new IllegalArgumentException(type + " requires at least one child predicate");
        }
        this.type = type;
        this.children = List.copyOf(children);
    }

    public static CompoundPredicate and(Predicate... predicates) {
        return new CompoundPredicate(Type.AND, Arrays.asList(predicates));
    }

    public static CompoundPredicate and(List<Predicate> predicates) {
        return new CompoundPredicate(Type.AND, predicates);
    }

    public static CompoundPredicate or(Predicate... predicates) {
        return new CompoundPredicate(Type.OR, Arrays.asList(predicates));
    }

    public static CompoundPredicate or(List<Predicate> predicates) {
        return new CompoundPredicate(Type.OR, predicates);
    }

    public static CompoundPredicate not(Predicate predicate) {
        return new CompoundPredicate(Type.NOT, List.of(predicate));
    }

    @Override
    public boolean test(Row row) {
        return switch (type) {
            case AND -> {
                for (Predicate p : children) if (!p.test(row)) { yield false; }
                yield true;
            }
            case OR -> {
                for (Predicate p : children) if (p.test(row)) { yield true; }
                yield false;
            }
            case NOT -> !children.get(0).test(row);
        };
    }

    // For debugging
    @Override
    public String toString() {
        if (type == Type.NOT) return "NOT(" + children.get(0) + ")";
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(' ').append(type).append(' ');
            sb.append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
