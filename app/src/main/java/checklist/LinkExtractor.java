package checklist;

import java.util.List;

// Turns one listing URL into the typed links on that page, in document order.
// Must be safe to call concurrently for different URLs; no retries, any failure ends the crawl.
public interface LinkExtractor {

    List<TypedLink> extract(String url, String extension, IgnoreSet ignore) throws FetchException, ParseException;
}
