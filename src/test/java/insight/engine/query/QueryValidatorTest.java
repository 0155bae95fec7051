package insight.engine.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParser;

import insight.engine.TestDatasets;
import insight.engine.catalog.DatasetKind;
import insight.engine.catalog.SchemaRegistry;

public class QueryValidatorTest {
    private final SchemaRegistry registry = TestDatasets.store().registry();
    private final QueryValidator validator = new QueryValidator();

    // Queries are written with single quotes
    private QueryPlan validate(String query) {
        return validator.validate(JsonParser.parseString(query.replace('\'', '"')), registry);
    }

    private void assertInvalid(String query) {
        assertThrows(QueryValidationException.class, () -> validate(query));
    }

    @Test
    void simpleQueryBindsDataset() {
        QueryPlan plan = validate("{'WHERE': {'GT': {'sections_avg': 97}},"
            + " 'OPTIONS': {'COLUMNS': ['sections_dept', 'sections_avg'], 'ORDER': 'sections_avg'}}");
        assertEquals("sections", plan.datasetId());
        assertEquals(DatasetKind.SECTIONS, plan.kind());
        assertEquals(List.of("sections_dept", "sections_avg"), plan.columns());
        assertEquals(List.of("sections_avg"), plan.order().keys());
        assertFalse(plan.order().descending());
        assertFalse(plan.transformations().hasGrouping());
        assertEquals(new FilterNode.ComparisonNode(FilterNode.Comparison.GT, "avg", 97), plan.filter().root());
    }

    @Test
    void emptyWhereMatchesAll() {
        QueryPlan plan = validate("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['rooms_name']}}");
        assertTrue(plan.filter().isEmpty());
        assertEquals("rooms", plan.datasetId());
    }

    @Test
    void filterTreeIsBreadthFirst() {
        QueryPlan plan = validate("{'WHERE': {'AND': ["
            + "{'OR': [{'GT': {'sections_avg': 90}}, {'LT': {'sections_year': 2000}}]},"
            + "{'NOT': {'IS': {'sections_dept': 'cp*'}}}]},"
            + " 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        List<FilterNode> nodes = plan.filter().nodes();
        assertEquals(6, nodes.size());
        assertEquals(new FilterNode.LogicNode(FilterNode.Logic.AND, List.of(1, 2)), nodes.get(0));
        assertEquals(new FilterNode.LogicNode(FilterNode.Logic.OR, List.of(3, 4)), nodes.get(1));
        assertEquals(new FilterNode.NegationNode(5), nodes.get(2));
        assertEquals(new FilterNode.ComparisonNode(FilterNode.Comparison.GT, "avg", 90), nodes.get(3));
        assertEquals(new FilterNode.ComparisonNode(FilterNode.Comparison.LT, "year", 2000), nodes.get(4));
        assertInstanceOf(FilterNode.StringMatchNode.class, nodes.get(5));
    }

    @Test
    void keyOrderIsEnforced() {
        assertInvalid("{'OPTIONS': {'COLUMNS': ['sections_dept']}, 'WHERE': {}}");
        assertInvalid("{'WHERE': {}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['sections_dept']}, 'EXTRA': 1}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'ORDER': 'sections_dept', 'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['sections_dept'], 'ORDER': {'keys': ['sections_dept'], 'dir': 'UP'}}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['g', 'sections_dept']}, "
            + "'TRANSFORMATIONS': {'APPLY': [], 'GROUP': ['sections_dept']}}");
    }

    @Test
    void filterShapeErrors() {
        assertInvalid("{'WHERE': {'NOT': {}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'AND': []}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'AND': {}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'NOT': {'GT': {'sections_avg': 1}, 'LT': {'sections_avg': 2}}},"
            + " 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'XOR': [{'GT': {'sections_avg': 1}}]}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'GT': {'sections_avg': 1, 'sections_pass': 2}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
    }

    @Test
    void typeMismatches() {
        assertInvalid("{'WHERE': {'GT': {'sections_dept': 1}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'GT': {'sections_avg': '90'}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'IS': {'sections_avg': 'x'}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'IS': {'sections_dept': 1}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'EQ': {'rooms_furniture': 1}}, 'OPTIONS': {'COLUMNS': ['rooms_name']}}");
    }

    @Test
    void wildcardPlacement() {
        validate("{'WHERE': {'IS': {'sections_dept': '*'}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        validate("{'WHERE': {'IS': {'sections_dept': '**'}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        validate("{'WHERE': {'IS': {'sections_instructor': '*ales*'}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'IS': {'sections_dept': '***'}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {'IS': {'sections_instructor': 'g*regor'}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
    }

    @Test
    void datasetReferenceErrors() {
        assertInvalid("{'WHERE': {'GT': {'rooms_seats': 10}}, 'OPTIONS': {'COLUMNS': ['sections_dept']}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['courses_dept']}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['sections_seats']}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['sections_dept_x']}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['dept']}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': []}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['sections_dept', 'sections_dept']}}");
    }

    @Test
    void orderForms() {
        QueryPlan plan = validate("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['rooms_name', 'rooms_seats'],"
            + " 'ORDER': {'dir': 'DOWN', 'keys': ['rooms_seats', 'rooms_name']}}}");
        assertTrue(plan.order().descending());
        assertEquals(List.of("rooms_seats", "rooms_name"), plan.order().keys());

        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['rooms_name'], 'ORDER': 'rooms_seats'}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['rooms_name'], 'ORDER': {'dir': 'SIDEWAYS', 'keys': ['rooms_name']}}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['rooms_name'], 'ORDER': {'dir': 'UP', 'keys': []}}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['rooms_name'], 'ORDER': {'dir': 'UP'}}}");
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['rooms_name'], 'ORDER': 5}}");
    }

    @Test
    void transformationsBuildGroupAndApply() {
        QueryPlan plan = validate("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['rooms_shortname', 'maxSeats', 'kinds'],"
            + " 'ORDER': {'dir': 'DOWN', 'keys': ['maxSeats']}},"
            + " 'TRANSFORMATIONS': {'GROUP': ['rooms_shortname'],"
            + " 'APPLY': [{'maxSeats': {'MAX': 'rooms_seats'}}, {'kinds': {'COUNT': 'rooms_type'}}]}}");
        TransformationSpec t = plan.transformations();
        assertEquals(List.of("shortname"), t.groupKeys());
        assertEquals(List.of(new ApplyRule("maxSeats", ApplyToken.MAX, "seats"), new ApplyRule("kinds", ApplyToken.COUNT, "type")),
            t.applyRules());
        assertEquals(List.of("maxSeats"), plan.order().keys());
    }

    @Test
    void transformationErrors() {
        String head = "{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['rooms_shortname', 'x']}, 'TRANSFORMATIONS': ";
        assertInvalid(head + "{'GROUP': [], 'APPLY': [{'x': {'MAX': 'rooms_seats'}}]}}");
        assertInvalid(head + "{'GROUP': ['rooms_shortname'], 'APPLY': [{'x': {'MAX': 'rooms_type'}}]}}");
        assertInvalid(head + "{'GROUP': ['rooms_shortname'], 'APPLY': [{'x': {'MEDIAN': 'rooms_seats'}}]}}");
        assertInvalid(head + "{'GROUP': ['rooms_shortname'], 'APPLY': [{'x': {'MAX': 'rooms_seats'}}, {'x': {'MIN': 'rooms_seats'}}]}}");
        assertInvalid(head + "{'GROUP': ['rooms_shortname'], 'APPLY': [{'x': {'MAX': 'sections_avg'}}]}}");
        assertInvalid(head + "{'GROUP': ['rooms_shortname'], 'APPLY': [{'x_y': {'MAX': 'rooms_seats'}}]}}");
        assertInvalid(head + "{'GROUP': ['rooms_shortname'], 'APPLY': []}}");
        assertInvalid(head + "{'GROUP': ['rooms_shortname'], 'APPLY': [{'x': {'MAX': 'rooms_seats'}}, {'y': {'MIN': 'rooms_seats'}}]}}");
        // qualified column that is not a group key
        assertInvalid("{'WHERE': {}, 'OPTIONS': {'COLUMNS': ['rooms_name', 'x']}, 'TRANSFORMATIONS': "
            + "{'GROUP': ['rooms_shortname'], 'APPLY': [{'x': {'MAX': 'rooms_seats'}}]}}");
        // COUNT accepts string fields
        validate(head + "{'GROUP': ['rooms_shortname'], 'APPLY': [{'x': {'COUNT': 'rooms_type'}}]}}");
    }

    @Test
    void nonObjectQueryIsRejected() {
        assertThrows(QueryValidationException.class, () -> validator.validate(null, registry));
        assertInvalid("[1, 2]");
    }
}
