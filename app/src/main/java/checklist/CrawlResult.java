package checklist;

import java.util.List;

// Every file found by one crawl (no dedup, order not guaranteed) and how many pages were fetched.
public record CrawlResult(List<FileLink> files, int dispatchedFetches) {

    public CrawlResult {
        files = List.copyOf(files);
    }
}
