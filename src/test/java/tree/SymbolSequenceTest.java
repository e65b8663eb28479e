package tree;

import org.junit.jupiter.api.Test;
import utilities.AlphabetMapper;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolSequenceTest {

    @Test
    void equalSymbolsShareACode() {
        SymbolSequence<Character> seq = SymbolSequence.ofString("abca");

        assertEquals(4, seq.length());
        assertEquals(3, seq.alphabetSize());
        assertEquals(seq.symbolAt(0), seq.symbolAt(3));
        assertTrue(seq.symbolAt(0) != seq.symbolAt(1));
    }

    @Test
    void encodingUsesTheTextAlphabetOnly() {
        SymbolSequence<Character> seq = SymbolSequence.ofString("abc");

        assertArrayEquals(new int[]{seq.symbolAt(2), seq.symbolAt(0), AlphabetMapper.UNKNOWN}, seq.encode("caz"));
        assertEquals(3, seq.alphabetSize());
    }

    @Test
    void onlyCharacterSequencesEncodeText() {
        assertTrue(SymbolSequence.ofString("abc").isCharacterSequence());
        assertTrue(SymbolSequence.of(List.of('x', 'y')).isCharacterSequence());
        assertFalse(SymbolSequence.of(List.of(1, 2)).isCharacterSequence());

        SymbolSequence<Integer> ints = SymbolSequence.of(List.of(1, 2));
        assertThrows(InvalidInputException.class, () -> ints.encode("12"));
    }

    @Test
    void emptySequenceIsValid() {
        SymbolSequence<String> seq = SymbolSequence.of(List.of());

        assertTrue(seq.isEmpty());
        assertEquals(0, seq.alphabetSize());
        assertArrayEquals(new int[0], seq.encode(List.of()));
    }

    @Test
    void nullsAreInvalidInput() {
        assertThrows(InvalidInputException.class, () -> SymbolSequence.ofString(null));
        SymbolSequence<String> seq = SymbolSequence.of(List.of("x"));
        assertThrows(InvalidInputException.class, () -> seq.encode((List<String>) null));
        assertThrows(InvalidInputException.class, () -> seq.encode((CharSequence) null));
    }
}
