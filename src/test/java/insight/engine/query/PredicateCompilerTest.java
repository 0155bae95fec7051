package insight.engine.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import insight.engine.catalog.DatasetKind;
import insight.engine.exec.Predicate;
import insight.engine.exec.Row;
import insight.engine.exec.WildcardPattern;
import insight.engine.TestDatasets;

public class PredicateCompilerTest {
    private static final List<String> COLS = DatasetKind.SECTIONS.fieldNames();
    private final PredicateCompiler compiler = new PredicateCompiler();

    private Row row(int i) {
        return Row.of(COLS, TestDatasets.threeSections().get(i).values());
    }

    @Test
    void emptyTreeCompilesToNull() {
        assertNull(compiler.compile(FilterTree.EMPTY, COLS));
    }

    @Test
    void compilesNestedTree() {
        // OR(NOT(dept IS cpsc), avg EQ 71.07)
        FilterTree tree = new FilterTree(List.of(
            new FilterNode.LogicNode(FilterNode.Logic.OR, List.of(1, 2)),
            new FilterNode.NegationNode(3),
            new FilterNode.ComparisonNode(FilterNode.Comparison.EQ, "avg", 71.07),
            new FilterNode.StringMatchNode("dept", WildcardPattern.parse("cpsc"))));
        Predicate p = compiler.compile(tree, COLS);
        assertTrue(p.test(row(0)));
        assertTrue(p.test(row(1)));
        assertTrue(p.test(row(2)));

        FilterTree onlyNot = new FilterTree(List.of(
            new FilterNode.NegationNode(1),
            new FilterNode.StringMatchNode("dept", WildcardPattern.parse("cpsc"))));
        Predicate q = compiler.compile(onlyNot, COLS);
        assertFalse(q.test(row(0)));
        assertTrue(q.test(row(1)));
    }

    @Test
    void unknownFieldFailsToCompile() {
        FilterTree tree = new FilterTree(List.of(new FilterNode.ComparisonNode(FilterNode.Comparison.GT, "seats", 1)));
        assertThrows(IllegalArgumentException.class, () -> compiler.compile(tree, COLS));
    }
}
