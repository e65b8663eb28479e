package utilities;

import index.ISubstringIndex;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;

import java.util.Locale;

// JOL based retained-size reports for built indexes.
public final class MemUtil {

    private static final double MIB = 1024.0 * 1024.0;

    private MemUtil() {}

    // Retained size of the whole object graph reachable from the index, text included.
    public static long retainedBytes(ISubstringIndex index) {
        return GraphLayout.parseInstance(index).totalSize();
    }

    public static String jolMemoryReport(ISubstringIndex index, boolean includeVmDetails, boolean includeFootprintTable) {
        return formatReport(index, GraphLayout.parseInstance(index), includeVmDetails, includeFootprintTable);
    }

    // Single graph walk shared by the text report and the returned total.
    public static MemoryUsageReport jolMemoryReportWithTotal(ISubstringIndex index, boolean includeFootprintTable) {
        GraphLayout total = GraphLayout.parseInstance(index);
        String txt = formatReport(index, total, false, includeFootprintTable);
        long totalBytes = total.totalSize();
        return new MemoryUsageReport(txt, totalBytes, totalBytes / MIB);
    }

    private static String formatReport(ISubstringIndex index, GraphLayout total,
                                       boolean includeVmDetails, boolean includeFootprintTable) {
        StringBuilder sb = new StringBuilder(4_096);

        // VM details help to interpret alignment, header sizes and compressed oops
        if (includeVmDetails) {
            sb.append("=== JOL / VM details ===\n");
            sb.append(VM.current().details()).append('\n');
        }

        sb.append("=== ").append(index.name()).append(" over ").append(index.textLength()).append(" symbols ===\n");
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / MIB))
                .append(" MiB\n");

        if (includeFootprintTable) {
            sb.append("\n--- Class footprint ---\n");
            sb.append(total.toFootprint()).append('\n');
        }
        return sb.toString();
    }
}
