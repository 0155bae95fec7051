package insight.engine.cli;

import java.nio.file.Path;
import java.nio.file.Paths;

import insight.engine.query.QueryEngine;

/**
 * Command-line configuration: {@code --data=DIR}, {@code --max-rows=N}, {@code --format=table|json}.
 */
public class EngineConfig {
    public enum Format { TABLE, JSON }

    public final Path dataDir;
    public final int maxRows;
    public final Format format;

    public EngineConfig(Path dataDir, int maxRows, Format format) {
        if (maxRows <= 0) throw new IllegalArgumentException("max rows must be positive: " + maxRows);
        this.dataDir = dataDir;
        this.maxRows = maxRows;
        this.format = format;
    }

    public static EngineConfig fromArgs(String[] args) {
        Path dataDir = Paths.get("data");
        int maxRows = QueryEngine.DEFAULT_MAX_ROWS;
        Format format = Format.TABLE;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--data=")) {
                dataDir = Paths.get(s.substring("--data=".length()));
            } else if (s.startsWith("--max-rows=")) {
                String v = s.substring("--max-rows=".length());
                try { maxRows = Integer.parseInt(v); } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid --max-rows value: " + v, e);
                }
            } else if (s.startsWith("--format=")) {
                String v = s.substring("--format=".length());
                format = switch (v.toLowerCase()) {
                    case "table" -> Format.TABLE;
                    case "json" -> Format.JSON;
                    default -> throw new IllegalArgumentException("Unknown --format value: " + v);
                };
            } else if (!s.isEmpty()) {
                throw new IllegalArgumentException("Unknown argument: " + s);
            }
        }
        return new EngineConfig(dataDir, maxRows, format);
    }

    @Override
    public String toString() {
        return "EngineConfig[data=" + dataDir + ", maxRows=" + maxRows + ", format=" + format + "]";
    }
}
