package checklist;

import java.nio.file.Path;
import java.time.Duration;

// Parsed CLI parameters for a checklist run; built once in Main and passed down.
public record CrawlerConfig(
        String rootUrl,
        String extension,
        IgnoreSet ignore,
        Path outputDirectory,
        int threadCount,   // 0 = unbounded, one thread per outstanding directory
        Duration timeout,
        SiteProfile site
) {
    public static final Path DEFAULT_OUTPUT = Path.of("results");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    public static int defaultThreadCount() {
        return Math.max(4, Runtime.getRuntime().availableProcessors());
    }
}
