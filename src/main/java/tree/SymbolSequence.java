package tree;

import utilities.AlphabetMapper;

import java.util.List;

/**
 * Immutable text to be indexed. Symbols of any type with a sane equals/hashCode are mapped once to
 * dense integer codes through an {@link AlphabetMapper}; the mapper is frozen afterwards so that
 * patterns can be encoded against the same alphabet without growing it.
 */
public final class SymbolSequence<T> {

    private final int[] codes;
    private final AlphabetMapper<T> alphabet;
    // true when every symbol is a Character, so character patterns can be encoded
    private final boolean characters;

    private SymbolSequence(int[] codes, AlphabetMapper<T> alphabet, boolean characters) {
        this.codes = codes;
        this.alphabet = alphabet;
        this.characters = characters;
    }

    public static <T> SymbolSequence<T> of(List<T> symbols) {
        if (symbols == null) {
            throw new InvalidInputException("symbol source cannot be null");
        }
        AlphabetMapper<T> mapper = new AlphabetMapper<>(Math.min(symbols.size(), 1 << 16));
        int[] codes = new int[symbols.size()];
        int i = 0;
        boolean characters = true;
        for (T symbol : symbols) {
            codes[i++] = mapper.getId(symbol);
            characters &= symbol instanceof Character;
        }
        mapper.freeze();
        return new SymbolSequence<>(codes, mapper, characters);
    }

    public static SymbolSequence<Character> ofString(CharSequence text) {
        if (text == null) {
            throw new InvalidInputException("text cannot be null");
        }
        AlphabetMapper<Character> mapper = new AlphabetMapper<>(Math.min(text.length(), 256));
        int[] codes = new int[text.length()];
        for (int i = 0; i < codes.length; i++) {
            codes[i] = mapper.getId(text.charAt(i));
        }
        mapper.freeze();
        return new SymbolSequence<>(codes, mapper, true);
    }

    public int length() {
        return codes.length;
    }

    public boolean isEmpty() {
        return codes.length == 0;
    }

    // Integer code of the symbol at position i.
    public int symbolAt(int i) {
        return codes[i];
    }

    public int alphabetSize() {
        return alphabet.getSize();
    }

    public boolean isCharacterSequence() {
        return characters;
    }

    /**
     * Encode a pattern against this text's alphabet. Symbols absent from the text come back as
     * {@link AlphabetMapper#UNKNOWN}.
     */
    public int[] encode(List<T> pattern) {
        if (pattern == null) {
            throw new InvalidInputException("pattern cannot be null");
        }
        int[] out = new int[pattern.size()];
        int i = 0;
        for (T symbol : pattern) {
            out[i++] = alphabet.lookup(symbol);
        }
        return out;
    }

    /**
     * Encode a character pattern.
     *
     * @throws InvalidInputException if the pattern is null or this sequence holds symbols other
     *                               than characters
     */
    public int[] encode(CharSequence pattern) {
        if (pattern == null) {
            throw new InvalidInputException("pattern cannot be null");
        }
        if (!characters) {
            throw new InvalidInputException("character pattern against a sequence of non-character symbols");
        }
        int[] out = new int[pattern.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = alphabet.lookup(pattern.charAt(i));
        }
        return out;
    }
}
