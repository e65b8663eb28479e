package utilities;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlphabetMapperTest {

    @Test
    void assignsDenseIdsFromOne() {
        AlphabetMapper<String> mapper = new AlphabetMapper<>(4);

        assertEquals(1, mapper.getId("a"));
        assertEquals(2, mapper.getId("b"));
        assertEquals(1, mapper.getId("a"));
        assertEquals(2, mapper.getSize());
    }

    @Test
    void lookupNeverInserts() {
        AlphabetMapper<String> mapper = new AlphabetMapper<>(4);
        mapper.getId("a");

        assertEquals(AlphabetMapper.UNKNOWN, mapper.lookup("z"));
        assertEquals(1, mapper.getSize());
    }

    @Test
    void frozenMapperRejectsNewSymbols() {
        AlphabetMapper<Character> mapper = new AlphabetMapper<>(2);
        mapper.getId('x');
        mapper.freeze();

        assertTrue(mapper.isFrozen());
        assertEquals(1, mapper.getId('x'));
        assertThrows(IllegalStateException.class, () -> mapper.getId('y'));
    }
}
