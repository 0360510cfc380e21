package checklist;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public class ArgsParser {

    static final String USAGE = """
            Usage: --url <repository url> --ext <extension> [options]
            Options:
              --ignore "<dir pattern> <dir pattern> ..."   directories to leave out
              --out <directory>                            where the checklist is written (default: results)
              --threads <n>                                fetch workers, 0 = one per directory
              --timeout <seconds>                          per-page fetch timeout (default: 15)
            Example: --ignore "Platform.Setters.Tests" --url https://github.com/linksplatform/Setters/ --ext ".cs"
            """;

    private static final Pattern EXTENSION = Pattern.compile("^\\.\\S*$");
    private static final Set<String> FLAGS = Set.of("--url", "--ext", "--ignore", "--out", "--threads", "--timeout");

    private final SiteProfile site;
    private final Pattern repositoryUrl;

    public ArgsParser(SiteProfile site) {
        this.site = site;
        this.repositoryUrl = Pattern.compile("^" + Pattern.quote(site.origin()) + "/.*$");
    }

    public CrawlerConfig parse(String[] args) throws InputValidationException {
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            String inline = null;
            int eq = flag.indexOf('=');
            if (flag.startsWith("--") && eq > 0) {
                inline = flag.substring(eq + 1);
                flag = flag.substring(0, eq);
            }
            if (!FLAGS.contains(flag)) {
                throw new InputValidationException("Unknown argument: " + args[i]);
            }
            String value;
            if (inline != null) {
                value = inline;
            } else {
                if (i + 1 >= args.length) {
                    throw new InputValidationException("Missing value for " + flag);
                }
                value = args[++i];
            }
            values.put(flag, value);
        }

        String url = require(values, "--url");
        String ext = require(values, "--ext");
        if (!repositoryUrl.matcher(url).matches()) {
            throw new InputValidationException("Invalid repository url: " + url + " (expected " + site.origin() + "/...)");
        }
        if (!EXTENSION.matcher(ext).matches()) {
            throw new InputValidationException("Invalid extension: " + ext + " (expected something like .md)");
        }

        IgnoreSet ignore = IgnoreSet.parse(values.get("--ignore"));
        Path out = values.containsKey("--out") ? Path.of(values.get("--out")) : CrawlerConfig.DEFAULT_OUTPUT;
        int threads = values.containsKey("--threads")
                ? parseInt(values.get("--threads"), "--threads", 0)
                : CrawlerConfig.defaultThreadCount();
        Duration timeout = values.containsKey("--timeout")
                ? Duration.ofSeconds(parseInt(values.get("--timeout"), "--timeout", 1))
                : CrawlerConfig.DEFAULT_TIMEOUT;

        return new CrawlerConfig(url, ext, ignore, out, threads, timeout, site);
    }

    private static String require(Map<String, String> values, String flag) throws InputValidationException {
        String v = values.get(flag);
        if (v == null || v.isBlank()) {
            throw new InputValidationException("Missing required argument " + flag);
        }
        return v.trim();
    }

    // Strict integer parsing with a clean error message.
    private static int parseInt(String s, String name, int min) throws InputValidationException {
        int value;
        try {
            value = Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new InputValidationException("Invalid integer for " + name + ": " + s, e);
        }
        if (value < min) {
            throw new InputValidationException(name + " must be >= " + min);
        }
        return value;
    }
}
