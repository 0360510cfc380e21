package checklist;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

// LinkExtractor over a fixed url -> links table, counting how often each page is fetched.
class InMemoryTree implements LinkExtractor {

    private final Map<String, List<TypedLink>> pages = new HashMap<>();
    private final Map<String, FetchException> failures = new HashMap<>();
    private final Map<String, AtomicInteger> fetches = new ConcurrentHashMap<>();
    private final AtomicInteger total = new AtomicInteger();

    InMemoryTree page(String url, TypedLink... links) {
        pages.computeIfAbsent(url, k -> new ArrayList<>()).addAll(List.of(links));
        return this;
    }

    InMemoryTree failing(String url, int status) {
        failures.put(url, new FetchException(url, status, "HTTP " + status));
        return this;
    }

    @Override
    public List<TypedLink> extract(String url, String extension, IgnoreSet ignore) throws FetchException {
        total.incrementAndGet();
        fetches.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
        FetchException failure = failures.get(url);
        if (failure != null) throw failure;
        List<TypedLink> links = pages.get(url);
        if (links == null) throw new FetchException(url, 404, "HTTP 404");
        return List.copyOf(links);
    }

    int fetchCount(String url) {
        AtomicInteger n = fetches.get(url);
        return n == null ? 0 : n.get();
    }

    int totalFetches() {
        return total.get();
    }

    static DirectoryLink dir(String name) {
        return new DirectoryLink(name, "mem://" + name);
    }

    static FileLink file(String dirName, String name) {
        return new FileLink(name, "mem://" + dirName + "/" + name + ".md", dir(dirName));
    }
}
