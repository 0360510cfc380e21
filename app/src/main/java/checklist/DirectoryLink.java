package checklist;

import java.util.Objects;

// A directory of the remote tree: next page to fetch and grouping key for files.
// Equality is by name only, so one directory reached through different hrefs groups together.
public record DirectoryLink(String name, String href) implements TypedLink {

    public DirectoryLink {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(href, "href");
    }

    // Repository root has no path segments of its own.
    public boolean isRoot() {
        return name.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectoryLink)) return false;
        return name.equals(((DirectoryLink) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
