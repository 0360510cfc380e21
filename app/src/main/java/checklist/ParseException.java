package checklist;

// The body of a listing page could not be read as markup.
public class ParseException extends ChecklistException {

    private final String url;

    public ParseException(String url, Throwable cause) {
        super(url + ": " + cause.getMessage(), cause);
        this.url = url;
    }

    public ParseException(String url, String message) {
        super(url + ": " + message);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
