package checklist;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

// Partitions crawled files by parent directory, keeping crawl order inside each group.
public final class ResultGrouper {

    private ResultGrouper() {
    }

    public static Map<DirectoryLink, List<FileLink>> group(List<FileLink> files) {
        Map<DirectoryLink, List<FileLink>> grouped = new TreeMap<>(Comparator.comparing(DirectoryLink::name));
        for (FileLink f : files) {
            grouped.computeIfAbsent(f.parentDirectory(), k -> new ArrayList<>()).add(f);
        }
        return grouped;
    }
}
