package tree;

// Raised when a text or pattern source is absent. An empty sequence is valid input.
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
