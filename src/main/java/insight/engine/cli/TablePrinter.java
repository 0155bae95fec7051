package insight.engine.cli;

import java.io.PrintStream;
import java.util.List;

import insight.engine.exec.Row;

/**
 * Simple ASCII table printer for query result rows.
 * Headers are the column names of the first row.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(List<Row> rows) { print(rows, System.out); }

    public static void print(List<Row> rows, PrintStream out) {
        if (rows == null || rows.isEmpty()) {
            out.println("(0 row(s))");
            return;
        }
        List<String> headers = rows.get(0).columns();
        int colCount = headers.size();
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers.get(i).length();
        for (Row r : rows) {
            List<Object> vals = r.values();
            for (int i = 0; i < colCount; i++) {
                String s = format(vals.get(i));
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildLine(headers, widths));
        out.println(divLine);
        for (Row r : rows) {
            out.println(buildLine(r.values(), widths));
        }
        out.println(divLine);
        out.println("(" + rows.size() + " row(s))");
    }

    static String format(Object v) {
        if (v instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) return String.valueOf(d.longValue());
        return String.valueOf(v);
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(List<?> cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(pad(format(cells.get(i)), widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
