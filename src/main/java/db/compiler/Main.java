package db.compiler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import db.compiler.catalog.Catalog;
import db.compiler.catalog.Table;
import db.compiler.cli.Shell;
import db.compiler.config.EngineConfig;
import db.compiler.storage.CsvTableLoader;

public class Main {
    public static void main(String[] args) {
        EngineConfig config;
        try {
            config = EngineConfig.fromArgs(args);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("[Main] Invalid configuration: " + e.getMessage());
            System.exit(2);
            return;
        }

        Catalog catalog = loadTables(config);
        System.out.println("Loaded " + catalog.allTables().size() + " table(s). Type .tables to list them, exit to quit.\n");

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        try {
            new Shell(catalog, config, in, out).run();
        } catch (IOException e) {
            System.err.println("[Main] Input error: " + e.getMessage());
        }
    }

    /** Loads every explicitly named file plus each *.csv in the data directory. A bad file is skipped. */
    static Catalog loadTables(EngineConfig config) {
        CsvTableLoader loader = new CsvTableLoader(config.delimiter);
        List<Path> paths = new ArrayList<>(config.files);
        if (Files.isDirectory(config.dataDir)) {
            List<Path> found = new ArrayList<>();
            try (DirectoryStream<Path> dir = Files.newDirectoryStream(config.dataDir, "*.csv")) {
                for (Path p : dir) found.add(p);
            } catch (IOException e) {
                System.err.println("[Main] Could not list data directory " + config.dataDir + ": " + e.getMessage());
            }
            Collections.sort(found);
            paths.addAll(found);
        }

        Catalog catalog = new Catalog();
        for (Path p : paths) {
            try {
                Table table = loader.load(p);
                if (!catalog.registerTable(table)) {
                    System.err.println("[Main] Table '" + table.name() + "' from " + p + " replaced an earlier table of the same name");
                }
            } catch (IOException | IllegalArgumentException e) {
                System.err.println("[Main] Failed to load " + p + ": " + e.getMessage());
            }
        }
        return catalog;
    }
}
