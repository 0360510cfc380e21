package checklist;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

// Fetches a listing page with Jsoup and classifies every anchor on it.
public class PageFetcher implements LinkExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageFetcher.class);
    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36";

    private final LinkClassifier classifier;
    private final Duration timeout;

    public PageFetcher(LinkClassifier classifier, Duration timeout) {
        this.classifier = classifier;
        this.timeout = timeout;
    }

    @Override
    public List<TypedLink> extract(String url, String extension, IgnoreSet ignore) throws FetchException, ParseException {
        Document doc = parse(url, fetch(url));

        // Pre-order walk keeps links in the order the page lists them.
        List<TypedLink> links = new ArrayList<>();
        doc.traverse((node, depth) -> {
            if (node instanceof Element && "a".equals(((Element) node).normalName())) {
                classifier.classify((Element) node, extension, ignore).ifPresent(links::add);
            }
        });
        LOGGER.debug("{} -> {} links", url, links.size());
        return links;
    }

    private Connection.Response fetch(String url) throws FetchException {
        LOGGER.debug("Fetching {}", url);
        Connection.Response response;
        try {
            response = Jsoup.connect(url)
                    .userAgent(USER_AGENT)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.9")
                    .timeout((int) timeout.toMillis())
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    // Checked below, after the status, so a 404 error page is still a fetch failure.
                    .ignoreContentType(true)
                    // jsoup truncates at 2MB by default and silently drops the rows after the cut.
                    .maxBodySize(0)
                    .execute();
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException(url, e);
        }
        if (response.statusCode() != 200) {
            throw new FetchException(url, response.statusCode(),
                    "HTTP " + response.statusCode() + " " + response.statusMessage());
        }
        return response;
    }

    private Document parse(String url, Connection.Response response) throws ParseException {
        String type = response.contentType();
        if (type != null && !isMarkup(type)) {
            throw new ParseException(url, "unsupported content type " + type);
        }
        try {
            return response.parse();
        } catch (IOException | UncheckedIOException e) {
            throw new ParseException(url, e);
        }
    }

    // Same rule jsoup applies when content types are not ignored.
    private static boolean isMarkup(String contentType) {
        String t = contentType.toLowerCase(Locale.ROOT);
        return t.startsWith("text/") || t.contains("xml");
    }
}
