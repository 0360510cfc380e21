package checklist;

// Bad command-line input, detected before any fetch is made.
public class InputValidationException extends ChecklistException {

    public InputValidationException(String message) {
        super(message);
    }

    public InputValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
