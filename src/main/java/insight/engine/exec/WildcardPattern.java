package insight.engine.exec;

/**
 * String pattern with an optional leading and/or trailing {@code *}.
 * <ul>
 *   <li>{@code abc}: exact match</li>
 *   <li>{@code abc*}: prefix match</li>
 *   <li>{@code *abc}: suffix match</li>
 *   <li>{@code *abc*}: substring match</li>
 * </ul>
 * A {@code *} anywhere else is rejected when the pattern is parsed.
 */
public record WildcardPattern(String literal, boolean leading, boolean trailing) {
    public static final char WILDCARD = '*';

    public static WildcardPattern parse(String pattern) {
        if (pattern == null) throw new IllegalArgumentException("pattern must not be null");
        String rest = pattern;
        boolean leading = false;
        boolean trailing = false;
        if (!rest.isEmpty() && rest.charAt(0) == WILDCARD) {
            leading = true;
            rest = rest.substring(1);
        }
        if (!rest.isEmpty() && rest.charAt(rest.length() - 1) == WILDCARD) {
            trailing = true;
            rest = rest.substring(0, rest.length() - 1);
        }
        if (rest.indexOf(WILDCARD) >= 0) {
            throw new IllegalArgumentException("Wildcard '*' may only appear at the start or end of a pattern: " + pattern);
        }
        return new WildcardPattern(rest, leading, trailing);
    }

    public boolean matches(String value) {
        if (leading && trailing) return value.contains(literal);
        if (leading) return value.endsWith(literal);
        if (trailing) return value.startsWith(literal);
        return value.equals(literal);
    }

    @Override
    public String toString() {
        return (leading ? "*" : "") + literal + (trailing ? "*" : "");
    }
}
