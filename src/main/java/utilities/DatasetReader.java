package utilities;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the text to index and the query patterns from disk. The whole text is materialised in
 * memory, which is what the suffix tree needs anyway.
 */
public class DatasetReader {

    private final Path datasetPath;
    private final boolean fasta;
    private final boolean lineBreakDataset;

    /**
     * @param datasetPath      file holding the text
     * @param fasta            treat the file as FASTA: skip '>' header lines and strip every other line
     * @param lineBreakDataset keep line breaks as symbols (ignored in FASTA mode)
     */
    public DatasetReader(Path datasetPath, boolean fasta, boolean lineBreakDataset) {
        if (datasetPath == null) {
            throw new IllegalArgumentException("datasetPath cannot be null");
        }
        this.datasetPath = datasetPath;
        this.fasta = fasta;
        this.lineBreakDataset = lineBreakDataset;
    }

    public static DatasetReader fasta(Path path) {
        return new DatasetReader(path, true, false);
    }

    public static DatasetReader plain(Path path, boolean keepLineBreaks) {
        return new DatasetReader(path, false, keepLineBreaks);
    }

    public String readText() {
        StringBuilder sb = new StringBuilder();
        try (BufferedReader reader = Files.newBufferedReader(datasetPath, StandardCharsets.UTF_8)) {
            String line;
            boolean first = true;
            while ((line = reader.readLine()) != null) {
                if (fasta) {
                    if (line.startsWith(">")) {
                        continue;
                    }
                    sb.append(line.strip());
                } else {
                    if (lineBreakDataset && !first) {
                        sb.append('\n');
                    }
                    sb.append(line);
                }
                first = false;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset " + datasetPath, e);
        }
        IndexLogger.debug("Loaded " + sb.length() + " symbols from " + datasetPath);
        return sb.toString();
    }

    // One pattern per line; blank lines are kept as empty patterns.
    public static List<String> readQueries(Path queriesPath) {
        try {
            return new ArrayList<>(Files.readAllLines(queriesPath, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read queries " + queriesPath, e);
        }
    }

    public Path path() {
        return datasetPath;
    }
}
