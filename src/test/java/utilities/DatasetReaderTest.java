package utilities;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DatasetReaderTest {

    @TempDir
    Path dir;

    @Test
    void fastaSkipsHeadersAndStripsLines() throws IOException {
        Path file = dir.resolve("genome.fasta");
        Files.writeString(file, ">chr1 test genome\nACGT  \nTTGA\n>second record\n  CCAA\n", StandardCharsets.UTF_8);

        assertEquals("ACGTTTGACCAA", DatasetReader.fasta(file).readText());
    }

    @Test
    void plainTextKeepsOrDropsLineBreaks() throws IOException {
        Path file = dir.resolve("text.txt");
        Files.writeString(file, "call me\nishmael\n", StandardCharsets.UTF_8);

        assertEquals("call me\nishmael", DatasetReader.plain(file, true).readText());
        assertEquals("call meishmael", DatasetReader.plain(file, false).readText());
    }

    @Test
    void bundledFixtureLoads() throws Exception {
        Path fixture = Path.of(getClass().getResource("/sample.fasta").toURI());

        String text = DatasetReader.fasta(fixture).readText();
        assertEquals(120, text.length());
        assertEquals("ACGTACGTTAGC", text.substring(0, 12));
    }

    @Test
    void queriesAreOnePerLine() throws IOException {
        Path file = dir.resolve("queries.txt");
        Files.writeString(file, "ana\nnan\n\nxyz\n", StandardCharsets.UTF_8);

        assertEquals(List.of("ana", "nan", "", "xyz"), DatasetReader.readQueries(file));
    }

    @Test
    void missingFileSurfacesAsUncheckedIo() {
        Path missing = dir.resolve("absent.fasta");

        assertThrows(UncheckedIOException.class, () -> DatasetReader.fasta(missing).readText());
        assertThrows(UncheckedIOException.class, () -> DatasetReader.readQueries(missing));
        assertThrows(IllegalArgumentException.class, () -> DatasetReader.fasta(null));
    }
}
