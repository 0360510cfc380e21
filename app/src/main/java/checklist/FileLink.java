package checklist;

import java.util.Objects;

// A tracked file: basename without extension, absolute href, and the directory it sits in.
public record FileLink(String name, String href, DirectoryLink parentDirectory) implements TypedLink {

    public FileLink {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(href, "href");
        Objects.requireNonNull(parentDirectory, "parentDirectory");
    }
}
