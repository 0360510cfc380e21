package checklist;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

public class OutputManager {

    // Directory checklists are written into, e.g. results/
    private final Path outputDir;
    private final ChecklistRenderer renderer;

    public OutputManager(Path outputDir, ChecklistRenderer renderer) {
        this.outputDir = outputDir;
        this.renderer = renderer;
    }

    // results/<last url segment>.md
    public Path checklistPath(String rootUrl) {
        return outputDir.resolve(UrlUtil.toSafeFilename(UrlUtil.lastSegment(rootUrl), ".md"));
    }

    // Only called after a successful crawl, so a failed run never leaves a file behind.
    public Path writeChecklist(String rootUrl, Map<DirectoryLink, List<FileLink>> groups) throws IOException {
        Files.createDirectories(outputDir);
        Path out = checklistPath(rootUrl);

        // Overwrite file if it exists (same repository crawled again)
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            renderer.render(groups, w);
        }
        return out;
    }
}
