package insight.engine.query;

import java.util.List;

/**
 * GROUP keys (unqualified field names) and APPLY rules.
 * Empty when the query has no TRANSFORMATIONS block.
 */
public record TransformationSpec(List<String> groupKeys, List<ApplyRule> applyRules) {
    public static final TransformationSpec EMPTY = new TransformationSpec(List.of(), List.of());

    public TransformationSpec {
        groupKeys = List.copyOf(groupKeys);
        applyRules = List.copyOf(applyRules);
    }

    public boolean hasGrouping() { return !groupKeys.isEmpty(); }

    /** The rule producing the given output name, or null. */
    public ApplyRule ruleFor(String outputName) {
        for (ApplyRule r : applyRules) {
            if (r.outputName().equals(outputName)) return r;
        }
        return null;
    }
}
