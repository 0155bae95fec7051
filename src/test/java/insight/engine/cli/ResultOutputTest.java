package insight.engine.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import insight.engine.exec.Row;

public class ResultOutputTest {
    private static final List<String> COLS = List.of("sections_dept", "total");
    private final List<Row> rows = List.of(
        Row.of(COLS, List.of("cpsc", 300.0)),
        Row.of(COLS, List.of("a&b", 80.06)));

    @Test
    void tablePadsColumnsAndFormatsIntegralDoubles() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        TablePrinter.print(rows, new PrintStream(buf, true, StandardCharsets.UTF_8));
        String[] lines = buf.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals("+---------------+-------+", lines[0]);
        assertEquals("| sections_dept | total |", lines[1]);
        assertEquals("| cpsc          | 300   |", lines[3]);
        assertEquals("| a&b           | 80.06 |", lines[4]);
        assertEquals("(2 row(s))", lines[6]);
    }

    @Test
    void emptyResultPrintsCountOnly() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        TablePrinter.print(List.of(), new PrintStream(buf, true, StandardCharsets.UTF_8));
        assertEquals("(0 row(s))", buf.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void jsonKeepsColumnOrderAndDropsTrailingZero() {
        String json = ResultWriter.toJson(rows);
        assertTrue(json.contains("\"a&b\""));
        assertTrue(json.contains("\"total\": 300\n") || json.contains("\"total\": 300\r\n"));
        JsonArray arr = JsonParser.parseString(json).getAsJsonArray();
        assertEquals(2, arr.size());
        JsonObject second = arr.get(1).getAsJsonObject();
        assertEquals(List.of("sections_dept", "total"), List.copyOf(second.keySet()));
        assertEquals(80.06, second.get("total").getAsDouble());
    }
}
