package checklist;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

// Markdown checklist: one heading per directory, one unchecked item per file, blank line between groups.
public class ChecklistRenderer {

    static final String ROOT_LABEL = "/";

    public void render(Map<DirectoryLink, List<FileLink>> groups, Writer out) throws IOException {
        for (Map.Entry<DirectoryLink, List<FileLink>> e : groups.entrySet()) {
            out.write(heading(e.getKey()));
            for (FileLink f : e.getValue()) {
                out.write(item(f));
            }
            out.write("\n");
        }
    }

    public String render(Map<DirectoryLink, List<FileLink>> groups) {
        StringWriter sw = new StringWriter();
        try {
            render(groups, sw);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return sw.toString();
    }

    static String heading(DirectoryLink dir) {
        String label = dir.isRoot() ? ROOT_LABEL : dir.name();
        return "* ###[" + label + "](" + dir.href() + ")\n";
    }

    static String item(FileLink file) {
        return "- [ ] [" + file.name() + "](" + file.href() + ")\n";
    }
}
