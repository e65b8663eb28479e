import datagenerators.Generator;
import index.ISubstringIndex;
import utilities.BenchmarkEnums.IndexType;
import utilities.BenchmarkEnums.TextSource;
import utilities.CsvUtil;
import utilities.DatasetReader;
import utilities.IndexFactory;
import utilities.IndexLogger;
import utilities.MemUtil;
import utilities.MemoryUsageReport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Benchmark driver: builds every selected index over growing prefixes of one text, times
 * construction and containment queries, and optionally measures retained memory with JOL.
 * Results go to stdout and, with --csv, to a CSV file.
 */
public final class Main {

    private static final String DEFAULT_SIZES = "10000,20000,30000,40000,50000,60000,70000,80000,90000,100000";
    private static final int DEFAULT_PATTERN_LENGTH = 20;
    private static final int DEFAULT_RUNS = 3;
    private static final int DEFAULT_SYNTHETIC_LENGTH = 100_000;
    private static final long DEFAULT_SEED = 42L;

    private static final List<String> CSV_HEADER = List.of(
            "index", "text_size", "build_ms", "query_us", "queries", "found", "memory_bytes");

    public static void main(String[] args) throws IOException {
        CliOptions options = CliOptions.parse(args);
        String fullText = loadText(options);
        List<String> explicitQueries = options.queriesFile == null
                ? List.of()
                : DatasetReader.readQueries(options.queriesFile);

        System.out.printf(Locale.ROOT,
                "Source: %s  Length: %d  Pattern length: %d  Runs: %d  Indexes: %s%n",
                options.source.label(), fullText.length(), options.patternLength, options.runs, options.indexes);

        List<List<?>> csvRows = new ArrayList<>();
        for (int size : options.sizes) {
            if (size > fullText.length()) {
                IndexLogger.warning("Skipping size " + size + ": text has only " + fullText.length() + " symbols");
                continue;
            }
            String text = fullText.substring(0, size);
            List<String> queries = explicitQueries.isEmpty()
                    ? List.of(middlePattern(text, options.patternLength))
                    : explicitQueries;

            for (IndexType type : options.indexes) {
                RunStats stats = benchmark(type, text, queries, options);
                System.out.printf(Locale.ROOT,
                        "%-20s size=%-8d build=%10.3f ms  query=%10.3f us  found=%d/%d  memory=%s%n",
                        type.displayName(), size, stats.buildMs, stats.queryUs, stats.found, queries.size(),
                        stats.memoryBytes < 0 ? "n/a" : String.format(Locale.ROOT, "%.3f MiB", stats.memoryBytes / (1024.0 * 1024.0)));
                csvRows.add(List.of(type.csvLabel(), size, stats.buildMs, stats.queryUs, queries.size(), stats.found, stats.memoryBytes));
            }
        }

        if (options.csvFile != null) {
            CsvUtil.appendRows(options.csvFile, CSV_HEADER, csvRows);
            IndexLogger.info("Wrote " + csvRows.size() + " rows to " + options.csvFile);
        }
    }

    private static RunStats benchmark(IndexType type, String text, List<String> queries, CliOptions options) {
        double totalBuildMs = 0;
        double totalQueryUs = 0;
        int found = 0;
        ISubstringIndex index = null;

        for (int run = 0; run < options.runs; run++) {
            long start = System.nanoTime();
            index = IndexFactory.create(type, text, IndexFactory.configurationFor(text, options.checkInvariants));
            totalBuildMs += (System.nanoTime() - start) / 1_000_000.0;

            found = 0;
            start = System.nanoTime();
            for (String q : queries) {
                if (index.contains(q)) {
                    found++;
                }
            }
            totalQueryUs += (System.nanoTime() - start) / 1_000.0 / queries.size();
        }

        long memory = -1L;
        if (options.measureMemory && index != null) {
            MemoryUsageReport report = MemUtil.jolMemoryReportWithTotal(index, IndexLogger.isDebugEnabled());
            IndexLogger.debug(report.report());
            memory = report.totalBytes();
        }
        return new RunStats(totalBuildMs / options.runs, totalQueryUs / options.runs, found, memory);
    }

    private static String loadText(CliOptions options) {
        switch (options.source) {
            case FASTA:
                return DatasetReader.fasta(options.dataFile).readText();
            case FILE:
                return DatasetReader.plain(options.dataFile, true).readText();
            case SYNTHETIC:
            default:
                return Generator.generateUniform(options.syntheticLength, options.alphabet, options.seed);
        }
    }

    // Pattern cut from the middle of the text, so it is always present.
    static String middlePattern(String text, int patternLength) {
        int len = Math.min(patternLength, text.length());
        int start = (text.length() - len) / 2;
        return text.substring(start, start + len);
    }

    private static final class RunStats {
        final double buildMs;
        final double queryUs;
        final int found;
        final long memoryBytes;

        RunStats(double buildMs, double queryUs, int found, long memoryBytes) {
            this.buildMs = buildMs;
            this.queryUs = queryUs;
            this.found = found;
            this.memoryBytes = memoryBytes;
        }
    }

    static final class CliOptions {
        final TextSource source;
        final Path dataFile;
        final Path queriesFile;
        final Path csvFile;
        final int[] sizes;
        final int patternLength;
        final int runs;
        final int syntheticLength;
        final String alphabet;
        final long seed;
        final EnumSet<IndexType> indexes;
        final boolean measureMemory;
        final boolean checkInvariants;

        private CliOptions(TextSource source, Path dataFile, Path queriesFile, Path csvFile, int[] sizes,
                           int patternLength, int runs, int syntheticLength, String alphabet, long seed,
                           EnumSet<IndexType> indexes, boolean measureMemory, boolean checkInvariants) {
            this.source = source;
            this.dataFile = dataFile;
            this.queriesFile = queriesFile;
            this.csvFile = csvFile;
            this.sizes = sizes;
            this.patternLength = patternLength;
            this.runs = runs;
            this.syntheticLength = syntheticLength;
            this.alphabet = alphabet;
            this.seed = seed;
            this.indexes = indexes;
            this.measureMemory = measureMemory;
            this.checkInvariants = checkInvariants;
        }

        static CliOptions parse(String[] args) {
            TextSource source = TextSource.SYNTHETIC;
            Path data = null;
            Path queries = null;
            Path csv = null;
            String sizes = DEFAULT_SIZES;
            int patternLength = DEFAULT_PATTERN_LENGTH;
            int runs = DEFAULT_RUNS;
            int syntheticLength = DEFAULT_SYNTHETIC_LENGTH;
            String alphabet = Generator.DNA;
            long seed = DEFAULT_SEED;
            // --index and --quadratic both add to the selection; Ukkonen alone when no --index is given
            EnumSet<IndexType> selected = EnumSet.noneOf(IndexType.class);
            boolean quadratic = false;
            boolean memory = false;
            boolean checkInvariants = true;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    continue;
                }
                String key = arg.substring(2);
                // flags without a value
                switch (key) {
                    case "quadratic" -> { quadratic = true; continue; }
                    case "memory" -> { memory = true; continue; }
                    case "no-invariants" -> { checkInvariants = false; continue; }
                    default -> { }
                }
                String value;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                switch (key) {
                    case "data" -> { data = Path.of(value); source = TextSource.FILE; }
                    case "fasta" -> { data = Path.of(value); source = TextSource.FASTA; }
                    case "synthetic" -> { syntheticLength = Integer.parseInt(value); source = TextSource.SYNTHETIC; }
                    case "queries" -> queries = Path.of(value);
                    case "csv" -> csv = Path.of(value);
                    case "sizes" -> sizes = value;
                    case "pattern-length" -> patternLength = Integer.parseInt(value);
                    case "runs" -> runs = Integer.parseInt(value);
                    case "alphabet" -> alphabet = value;
                    case "seed" -> seed = Long.parseLong(value);
                    case "index" -> selected.add(IndexType.fromString(value));
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }

            EnumSet<IndexType> indexes = selected.isEmpty() ? EnumSet.of(IndexType.UKKONEN) : selected;
            if (quadratic) {
                indexes.add(IndexType.QUADRATIC);
            }
            if (runs <= 0) {
                throw new IllegalArgumentException("runs must be positive");
            }
            if (patternLength < 0) {
                throw new IllegalArgumentException("pattern-length must be non-negative");
            }
            return new CliOptions(source, data, queries, csv, parseSizes(sizes), patternLength, runs,
                    syntheticLength, alphabet, seed, indexes, memory, checkInvariants);
        }

        private static int[] parseSizes(String value) {
            String[] parts = value.split(",");
            int[] out = new int[parts.length];
            for (int i = 0; i < parts.length; i++) {
                out[i] = Integer.parseInt(parts[i].trim());
                if (out[i] < 0) {
                    throw new IllegalArgumentException("sizes must be non-negative");
                }
            }
            return out;
        }
    }
}
