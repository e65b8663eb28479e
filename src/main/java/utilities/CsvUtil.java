package utilities;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

// Minimal CSV writer for benchmark result tables: comma separated, double-quote escaping, UTF-8.
public final class CsvUtil {
    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';

    private CsvUtil() {}

    /**
     * Append rows to a CSV file, writing {@code header} first when the file does not exist yet
     * or is empty.
     */
    public static void appendRows(Path file, List<?> header, List<? extends List<?>> rows) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(rows, "rows");
        boolean fresh = !Files.exists(file) || Files.size(file) == 0;
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            if (fresh && header != null) {
                bw.write(toCsvLine(header));
                bw.newLine();
            }
            for (List<?> row : rows) {
                bw.write(toCsvLine(row));
                bw.newLine();
            }
        }
    }

    public static String toCsvLine(List<?> row) {
        Objects.requireNonNull(row, "row");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.size(); i++) {
            if (i > 0) sb.append(DELIMITER);
            sb.append(quoteIfNeeded(stringify(row.get(i))));
        }
        return sb.toString();
    }

    // null becomes an empty field
    private static String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof Character c) return String.valueOf(c);
        return String.valueOf(value);
    }

    private static String quoteIfNeeded(String field) {
        boolean containsDelimiter = field.indexOf(DELIMITER) >= 0;
        boolean containsQuote = field.indexOf(QUOTE) >= 0;
        boolean containsNewline = field.indexOf('\n') >= 0 || field.indexOf('\r') >= 0;

        if (containsDelimiter || containsQuote || containsNewline) {
            String doubled = field.replace(String.valueOf(QUOTE), String.valueOf(QUOTE) + QUOTE);
            return QUOTE + doubled + QUOTE;
        }
        return field;
    }
}
