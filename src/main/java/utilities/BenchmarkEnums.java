package utilities;

import java.util.EnumSet;

public final class BenchmarkEnums {
    private BenchmarkEnums() {}

    public enum IndexType {
        UKKONEN("Ukkonen", "ukkonen"),
        QUADRATIC("Suffix Tree (naive)", "quadratic");

        private final String displayName;
        private final String csvLabel;

        IndexType(String displayName, String csvLabel) {
            this.displayName = displayName;
            this.csvLabel = csvLabel;
        }

        public String displayName() { return displayName; }
        public String csvLabel() { return csvLabel; }

        public static IndexType fromString(String value) {
            return EnumSet.allOf(IndexType.class).stream()
                    .filter(type -> type.csvLabel.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown index type: " + value));
        }
    }

    public enum TextSource {
        FILE("file"),
        FASTA("fasta"),
        SYNTHETIC("synthetic");

        private final String label;
        TextSource(String label) { this.label = label; }
        public String label() { return label; }
    }
}
