package checklist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

// CLI entry point: validate input, crawl the repository tree, write the checklist.
public class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    static final int EXIT_USAGE = 1;
    static final int EXIT_CRAWL_FAILED = 2;
    static final int EXIT_IO = 3;

    public static void main(String[] args) {
        System.exit(run(args, SiteProfile.github()));
    }

    // Whole run without touching the process, so it can be driven from tests.
    static int run(String[] args, SiteProfile site) {
        CrawlerConfig config;
        try {
            config = new ArgsParser(site).parse(args);
        } catch (InputValidationException e) {
            System.err.println(e.getMessage());
            System.err.println(ArgsParser.USAGE);
            return EXIT_USAGE;
        }

        PageFetcher fetcher = new PageFetcher(new LinkClassifier(config.site()), config.timeout());
        TreeCrawler crawler = new TreeCrawler(fetcher, config.threadCount());

        CrawlResult result;
        try {
            result = crawler.crawl(config.rootUrl(), config.extension(), config.ignore());
        } catch (FetchException | ParseException e) {
            System.err.println("Crawl failed: " + e.getMessage());
            return EXIT_CRAWL_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Crawl interrupted");
            return EXIT_CRAWL_FAILED;
        }

        Map<DirectoryLink, List<FileLink>> groups = ResultGrouper.group(result.files());
        OutputManager output = new OutputManager(config.outputDirectory(), new ChecklistRenderer());
        Path written;
        try {
            written = output.writeChecklist(config.rootUrl(), groups);
        } catch (IOException e) {
            LOGGER.error("Could not write checklist under {}", config.outputDirectory(), e);
            System.err.println("Could not write checklist: " + e.getMessage());
            return EXIT_IO;
        }

        printSummary(written, result, groups.size());
        return 0;
    }

    // Print a minimal end-of-run summary.
    private static void printSummary(Path written, CrawlResult result, int groups) {
        System.out.println("==== Run summary ====");
        System.out.println("Wrote checklist: " + written);
        System.out.println("Pages fetched : " + result.dispatchedFetches());
        System.out.println("Files found   : " + result.files().size());
        System.out.println("Directories   : " + groups);
    }
}
