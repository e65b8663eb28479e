package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

// Synthetic texts over an explicit alphabet, seeded for reproducibility.
public final class Generator {

    public static final String DNA = "ACGT";

    private Generator() {
    }

    public static String generateUniform(int length, String alphabet, long seed) {
        validate(length, alphabet);
        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = alphabet.charAt(rng.nextInt(alphabet.length()));
        }
        return new String(chars);
    }

    /**
     * Symbols drawn by Zipf rank: the first alphabet character is the most frequent one.
     */
    public static String generateZipf(int length, String alphabet, double exponent, long seed) {
        validate(length, alphabet);
        if (exponent <= 0) {
            throw new IllegalArgumentException("exponent must be positive");
        }
        RandomGenerator rng = new Well19937c(seed);

        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabet.length(), exponent);

        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = alphabet.charAt(dist.sample() - 1);
        }
        return new String(chars);
    }

    // Single repeated symbol, worst case for the number of implicit suffixes.
    public static String generateRun(int length, char symbol) {
        validate(length, String.valueOf(symbol));
        return String.valueOf(symbol).repeat(length);
    }

    private static void validate(int length, String alphabet) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (alphabet == null || alphabet.isEmpty()) {
            throw new IllegalArgumentException("alphabet cannot be empty");
        }
    }
}
