package checklist;

// A listing page could not be fetched: transport error, timeout or non-200 status.
public class FetchException extends ChecklistException {

    // Status used when no HTTP response was received at all.
    public static final int NO_STATUS = -1;

    private final String url;
    private final int status;

    public FetchException(String url, int status, String message) {
        super(url + ": " + message);
        this.url = url;
        this.status = status;
    }

    public FetchException(String url, Throwable cause) {
        super(url + ": " + cause.getMessage(), cause);
        this.url = url;
        this.status = NO_STATUS;
    }

    public String url() {
        return url;
    }

    public int status() {
        return status;
    }
}
