package utilities;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CsvUtilTest {

    @TempDir
    Path dir;

    @Test
    void quotesOnlyWhenNeeded() {
        assertEquals("ukkonen,100,1.5", CsvUtil.toCsvLine(List.of("ukkonen", 100, 1.5)));
        assertEquals("\"a,b\",\"say \"\"hi\"\"\",", CsvUtil.toCsvLine(Arrays.asList("a,b", "say \"hi\"", null)));
        assertEquals("\"x\ny\",c", CsvUtil.toCsvLine(List.of("x\ny", 'c')));
    }

    @Test
    void headerIsWrittenOnce() throws IOException {
        Path file = dir.resolve("results.csv");
        List<String> header = List.of("index", "text_size");

        CsvUtil.appendRows(file, header, List.of(List.of("ukkonen", 10)));
        CsvUtil.appendRows(file, header, List.of(List.of("quadratic", 10), List.of("ukkonen", 20)));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(List.of("index,text_size", "ukkonen,10", "quadratic,10", "ukkonen,20"), lines);
    }
}
