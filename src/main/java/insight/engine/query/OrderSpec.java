package insight.engine.query;

import java.util.List;

/**
 * Sort directive: keys in priority order (later keys break ties) and one shared direction.
 * Keys are column names exactly as they appear in COLUMNS.
 */
public record OrderSpec(List<String> keys, Direction direction) {
    public enum Direction { UP, DOWN }

    public static final OrderSpec NONE = new OrderSpec(List.of(), Direction.UP);

    public OrderSpec {
        keys = List.copyOf(keys);
        if (direction == null) throw new IllegalArgumentException("direction must not be null");
    }

    public boolean isEmpty() { return keys.isEmpty(); }

    public boolean descending() { return direction == Direction.DOWN; }
}
