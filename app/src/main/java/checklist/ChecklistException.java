package checklist;

// Base for every failure that aborts a checklist run.
public class ChecklistException extends Exception {

    public ChecklistException(String message) {
        super(message);
    }

    public ChecklistException(String message, Throwable cause) {
        super(message, cause);
    }
}
