package checklist;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

// Local stand-in for the listing site: serves generated pages by path, 404 for everything else.
class ListingServer implements AutoCloseable {

    private final HttpServer server;
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private boolean closed;
    private final Map<String, String> pages = new ConcurrentHashMap<>();
    private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
    private final Map<String, String> contentTypes = new ConcurrentHashMap<>();
    private final AtomicInteger requests = new AtomicInteger();

    ListingServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.setExecutor(executor);
        server.start();
    }

    String origin() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    SiteProfile site() {
        return new SiteProfile(origin(), SiteProfile.GITHUB_ROW_CLASS);
    }

    ListingServer page(String path, String... rows) {
        pages.put(path, html(rows));
        return this;
    }

    ListingServer status(String path, int status) {
        statuses.put(path, status);
        return this;
    }

    ListingServer contentType(String path, String type) {
        contentTypes.put(path, type);
        return this;
    }

    int requests() {
        return requests.get();
    }

    static String row(String href, String label) {
        return "<tr><td><a class=\"" + SiteProfile.GITHUB_ROW_CLASS + "\" title=\"" + label + "\" href=\"" + href + "\">"
                + label + "</a></td></tr>";
    }

    private static String html(String... rows) {
        StringBuilder sb = new StringBuilder("<!DOCTYPE html><html><head><title>listing</title></head><body>");
        sb.append("<header><a href=\"/\">Home</a><a class=\"btn\" href=\"/owner/repo/tree/main/nav\">nav</a></header>");
        sb.append("<table>");
        for (String r : rows) sb.append(r);
        sb.append("</table></body></html>");
        return sb.toString();
    }

    private void handle(HttpExchange ex) throws IOException {
        requests.incrementAndGet();
        String path = ex.getRequestURI().getPath();
        Integer forced = statuses.get(path);
        String body = pages.get(path);
        int status = forced != null ? forced : body == null ? 404 : 200;
        byte[] bytes = (body == null || status != 200 ? "<html><body>nope</body></html>" : body)
                .getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", contentTypes.getOrDefault(path, "text/html; charset=utf-8"));
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        server.stop(0);
        executor.shutdownNow();
    }
}
