package db.compiler.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Shell settings. Built from defaults, then an optional JSON file ({@code --config=path}),
 * then command-line flags; later sources win.
 */
public class EngineConfig {
    public static final String FORMAT_TABLE = "table";
    public static final String FORMAT_JSON = "json";

    public final char delimiter;
    public final Path dataDir;
    public final int maxDisplayRows;
    public final String outputFormat;
    public final boolean explain;
    public final List<Path> files;

    public EngineConfig(char delimiter,
                        Path dataDir,
                        int maxDisplayRows,
                        String outputFormat,
                        boolean explain,
                        List<Path> files) {
        if (!FORMAT_TABLE.equals(outputFormat) && !FORMAT_JSON.equals(outputFormat)) {
            throw new IllegalArgumentException("outputFormat must be 'table' or 'json': " + outputFormat);
        }
        if (maxDisplayRows <= 0) throw new IllegalArgumentException("maxDisplayRows must be positive");
        this.delimiter = delimiter;
        this.dataDir = dataDir;
        this.maxDisplayRows = maxDisplayRows;
        this.outputFormat = outputFormat;
        this.explain = explain;
        this.files = List.copyOf(files);
    }

    public static EngineConfig defaultConfig() {
        return new EngineConfig(
                ',',            // delimiter
                Paths.get("data"),
                100,            // rows shown per result
                FORMAT_TABLE,
                false,          // explain
                List.of()
        );
    }

    /** Overlays a JSON settings file on top of this config; absent keys keep current values. */
    public EngineConfig withJsonFile(Path file) throws IOException {
        FileSettings s;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            s = new Gson().fromJson(reader, FileSettings.class);
        } catch (JsonParseException e) {
            throw new IOException("Invalid config file " + file + ": " + e.getMessage(), e);
        }
        if (s == null) return this;
        char delim = delimiter;
        if (s.delimiter != null) {
            if (s.delimiter.length() != 1) throw new IOException("delimiter must be a single character: '" + s.delimiter + "'");
            delim = s.delimiter.charAt(0);
        }
        return new EngineConfig(
                delim,
                s.dataDir != null ? Paths.get(s.dataDir) : dataDir,
                s.maxDisplayRows != null ? s.maxDisplayRows : maxDisplayRows,
                s.outputFormat != null ? s.outputFormat : outputFormat,
                s.explain != null ? s.explain : explain,
                files
        );
    }

    public static EngineConfig fromArgs(String[] args) throws IOException {
        EngineConfig cfg = defaultConfig();
        for (String a : args) {
            if (a != null && a.trim().startsWith("--config=")) {
                cfg = cfg.withJsonFile(Paths.get(a.trim().substring("--config=".length())));
            }
        }

        char delimiter = cfg.delimiter;
        Path dataDir = cfg.dataDir;
        int maxRows = cfg.maxDisplayRows;
        String format = cfg.outputFormat;
        boolean explain = cfg.explain;
        List<Path> files = new ArrayList<>(cfg.files);

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--config=")) {
                continue;
            } else if (s.startsWith("--delimiter=")) {
                String d = s.substring("--delimiter=".length());
                if (d.equals("\\t")) d = "\t";
                if (d.length() == 1) delimiter = d.charAt(0);
                else System.err.println("[EngineConfig] Ignoring delimiter that is not one character: '" + d + "'");
            } else if (s.startsWith("--data=")) {
                dataDir = Paths.get(s.substring("--data=".length()));
            } else if (s.startsWith("--max-rows=")) {
                try { maxRows = Integer.parseInt(s.substring("--max-rows=".length())); } catch (NumberFormatException e) {
                    System.err.println("[EngineConfig] Ignoring non-numeric " + s);
                }
            } else if (s.startsWith("--format=")) {
                format = s.substring("--format=".length()).toLowerCase(Locale.ROOT);
            } else if (s.equals("--explain")) {
                explain = true;
            } else if (s.startsWith("--")) {
                System.err.println("[EngineConfig] Unknown option ignored: " + s);
            } else if (!s.isEmpty()) {
                files.add(Paths.get(s));
            }
        }
        return new EngineConfig(delimiter, dataDir, maxRows, format, explain, files);
    }

    // JSON shape of the settings file; every key is optional.
    private static final class FileSettings {
        String delimiter;
        String dataDir;
        Integer maxDisplayRows;
        String outputFormat;
        Boolean explain;
    }

    @Override
    public String toString() {
        return "EngineConfig[delimiter='" + delimiter + "', dataDir=" + dataDir + ", maxDisplayRows=" + maxDisplayRows
                + ", outputFormat=" + outputFormat + ", explain=" + explain + ", files=" + files + "]";
    }
}
