package datagenerators;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeneratorTest {

    @Test
    void uniformIsSeededAndStaysInAlphabet() {
        String a = Generator.generateUniform(1_000, Generator.DNA, 1L);
        String b = Generator.generateUniform(1_000, Generator.DNA, 1L);

        assertEquals(a, b);
        assertEquals(1_000, a.length());
        assertTrue(a.chars().allMatch(c -> Generator.DNA.indexOf(c) >= 0));
        assertNotEquals(a, Generator.generateUniform(1_000, Generator.DNA, 2L));
    }

    @Test
    void zipfFavoursTheFirstSymbol() {
        String text = Generator.generateZipf(10_000, "abcdefgh", 1.5, 3L);

        long first = text.chars().filter(c -> c == 'a').count();
        long last = text.chars().filter(c -> c == 'h').count();
        assertTrue(first > last);
        assertTrue(text.chars().allMatch(c -> c >= 'a' && c <= 'h'));
    }

    @Test
    void runAndValidation() {
        assertEquals("zzzz", Generator.generateRun(4, 'z'));
        assertEquals("", Generator.generateRun(0, 'z'));
        assertThrows(IllegalArgumentException.class, () -> Generator.generateUniform(-1, "ab", 0L));
        assertThrows(IllegalArgumentException.class, () -> Generator.generateUniform(5, "", 0L));
        assertThrows(IllegalArgumentException.class, () -> Generator.generateZipf(5, "ab", 0.0, 0L));
    }
}
