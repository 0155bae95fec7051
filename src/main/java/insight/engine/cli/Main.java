package insight.engine.cli;

import java.util.List;
import java.util.Scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import insight.engine.exec.Row;
import insight.engine.query.QueryEngine;
import insight.engine.query.QueryException;
import insight.engine.query.QueryProcessor;
import insight.engine.storage.Dataset;
import insight.engine.storage.DatasetInfo;
import insight.engine.storage.DatasetLoader;
import insight.engine.storage.DatasetStore;

/**
 * Interactive query shell. Loads dataset files from the data directory, then reads
 * one JSON query per line. {@code list} shows the loaded datasets, {@code exit} quits.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        EngineConfig cfg = EngineConfig.fromArgs(args);
        log.info("Starting with {}", cfg);

        DatasetStore store = new DatasetStore();
        for (Dataset d : new DatasetLoader().loadDirectory(cfg.dataDir)) {
            store.addDataset(d);
        }
        log.info("Loaded {} dataset(s) from {}", store.listDatasets().size(), cfg.dataDir.toAbsolutePath());

        QueryProcessor qp = new QueryProcessor(store, new QueryEngine(cfg.maxRows));
        System.out.println("Query mode\n");
        try (Scanner scanner = new Scanner(System.in)) {
            while (true) {
                System.out.print("query> ");
                if (!scanner.hasNextLine()) break;
                String line = scanner.nextLine().trim();
                if (line.equalsIgnoreCase("exit")) {
                    System.out.println("Exiting query mode");
                    break;
                }
                if (line.isEmpty()) continue;
                if (line.equalsIgnoreCase("list")) {
                    for (DatasetInfo info : store.listDatasets()) {
                        System.out.println(info.id() + " (" + info.kind().label() + ", " + info.numRows() + " rows)");
                    }
                    continue;
                }
                try {
                    List<Row> rows = qp.performQuery(line);
                    if (cfg.format == EngineConfig.Format.JSON) System.out.println(ResultWriter.toJson(rows));
                    else TablePrinter.print(rows);
                } catch (QueryException ex) {
                    log.warn("Query rejected: {}", ex.getMessage());
                    System.out.println("Error: " + ex.getClass().getSimpleName() + ": " + ex.getMessage());
                }
            }
        }
    }
}

/* -------------------------------------------------------------------------
 * Example queries (dataset "sections" of kind sections):
 *
 * {"WHERE":{"GT":{"sections_avg":97}},"OPTIONS":{"COLUMNS":["sections_dept","sections_avg"],"ORDER":"sections_avg"}}
 * {"WHERE":{"AND":[{"IS":{"sections_dept":"cp*"}},{"NOT":{"LT":{"sections_year":2010}}}]},"OPTIONS":{"COLUMNS":["sections_id","sections_year"]}}
 * {"WHERE":{},"OPTIONS":{"COLUMNS":["sections_dept","overallAvg"],"ORDER":{"dir":"DOWN","keys":["overallAvg"]}},
 *  "TRANSFORMATIONS":{"GROUP":["sections_dept"],"APPLY":[{"overallAvg":{"AVG":"sections_avg"}}]}}
 * ------------------------------------------------------------------------- */
