package checklist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

// Crawls a directory tree of unknown shape, one fetch per directory.
// Workers only produce link batches; the calling thread drains them, so the pending
// count and the file list are never touched by workers. The crawl ends when pending
// returns to zero. Directories are not de-duplicated and the tree is assumed acyclic.
public class TreeCrawler {

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeCrawler.class);

    private final LinkExtractor extractor;
    // <= 0 means one thread per outstanding directory.
    private final int threadCount;

    public TreeCrawler(LinkExtractor extractor, int threadCount) {
        this.extractor = extractor;
        this.threadCount = threadCount;
    }

    public CrawlResult crawl(String rootUrl, String extension, IgnoreSet ignore)
            throws FetchException, ParseException, InterruptedException {
        ExecutorService pool = newPool();
        ExecutorCompletionService<List<TypedLink>> completion = new ExecutorCompletionService<>(pool);
        List<FileLink> files = new ArrayList<>();
        int dispatched = 0;

        LOGGER.info("Crawling {} for *{} (ignore: {})", rootUrl, extension, ignore.patterns());
        boolean completed = false;
        try {
            submit(completion, rootUrl, extension, ignore);
            dispatched++;

            for (int pending = 1; pending > 0; pending--) {
                List<TypedLink> batch = await(completion.take());
                for (TypedLink link : batch) {
                    if (link instanceof DirectoryLink) {
                        pending++;
                        dispatched++;
                        submit(completion, link.href(), extension, ignore);
                    } else if (link instanceof FileLink) {
                        files.add((FileLink) link);
                    } else {
                        throw new IllegalStateException("Unhandled link kind: " + link);
                    }
                }
            }
            completed = true;
        } finally {
            if (completed) {
                drain(pool);
            } else {
                // Workers blocked in socket reads ignore the interrupt; they are daemons and are not awaited.
                pool.shutdownNow();
            }
        }

        LOGGER.info("Crawl of {} finished: {} pages fetched, {} files found", rootUrl, dispatched, files.size());
        return new CrawlResult(files, dispatched);
    }

    private void submit(ExecutorCompletionService<List<TypedLink>> completion,
                        String url,
                        String extension,
                        IgnoreSet ignore) {
        completion.submit(() -> extractor.extract(url, extension, ignore));
    }

    // Unwrap a finished task, rethrowing its typed failure as-is.
    private static List<TypedLink> await(Future<List<TypedLink>> future)
            throws FetchException, ParseException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            LOGGER.error("Crawl aborted: {}", cause.getMessage());
            if (cause instanceof FetchException) throw (FetchException) cause;
            if (cause instanceof ParseException) throw (ParseException) cause;
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Unexpected fetch failure", cause);
        }
    }

    // Every task has delivered by now, so this only reaps idle threads.
    private static void drain(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                LOGGER.warn("Fetch workers still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ExecutorService newPool() {
        AtomicInteger seq = new AtomicInteger();
        if (threadCount <= 0) {
            return Executors.newCachedThreadPool(r -> daemon(r, seq));
        }
        return Executors.newFixedThreadPool(threadCount, r -> daemon(r, seq));
    }

    private static Thread daemon(Runnable r, AtomicInteger seq) {
        Thread t = new Thread(r, "fetch-" + seq.incrementAndGet());
        t.setDaemon(true);
        return t;
    }
}
