package index;

// Read-only substring containment over a text fixed at construction.
public interface ISubstringIndex {

    boolean contains(String pattern);

    int textLength();

    String name();
}
