package checklist;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.List;
import java.util.Optional;

// Decides what one listing anchor points at.
// Hrefs look like /<owner>/<repo>/<kind>/<ref>/<rest...>: "tree" is a directory named by
// <rest>, "blob" ending in the extension is a file in <rest> minus its name.
// Only anchors whose class is exactly the site's row marker count.
public class LinkClassifier {

    private static final String TREE = "tree";
    private static final String BLOB = "blob";
    // owner, repo, kind, ref
    private static final int KIND_INDEX = 2;
    private static final int REST_INDEX = 4;

    private final SiteProfile site;

    public LinkClassifier(SiteProfile site) {
        this.site = site;
    }

    public Optional<TypedLink> classify(Element anchor, String extension, IgnoreSet ignore) {
        if (!site.anchorClass().equals(anchor.attr("class"))) return Optional.empty();
        if (!anchor.hasAttr("href")) return Optional.empty();
        // no label
        if (anchor.childNodeSize() == 0) return Optional.empty();

        String href = UrlUtil.absolute(site.origin(), anchor.attr("href"));
        // off-site
        if (href == null) return Optional.empty();
        String path = UrlUtil.pathOf(href);
        List<String> parts = UrlUtil.segments(path);
        if (parts.size() <= REST_INDEX) return Optional.empty();

        String kind = parts.get(KIND_INDEX);
        boolean isDir = TREE.equals(kind);
        boolean isFile = BLOB.equals(kind) && path.endsWith(extension);
        if (!isDir && !isFile) return Optional.empty();

        List<String> rest = parts.subList(REST_INDEX, parts.size());
        String dirName = isDir
                ? String.join("/", rest)
                : String.join("/", rest.subList(0, rest.size() - 1));

        if (ignore.matches(dirName)) return Optional.empty();

        if (isDir) {
            return Optional.of(new DirectoryLink(dirName, href));
        }
        String label = label(anchor.childNode(0));
        String fileName = stripExtension(label, rest.get(rest.size() - 1), extension);
        return Optional.of(new FileLink(fileName, href, parentOf(parts, dirName)));
    }

    // Tree URL of the directory holding a blob, derived from the blob's own path.
    private DirectoryLink parentOf(List<String> blobParts, String dirName) {
        StringBuilder sb = new StringBuilder(site.origin());
        sb.append('/').append(blobParts.get(0))
          .append('/').append(blobParts.get(1))
          .append('/').append(TREE)
          .append('/').append(blobParts.get(3));
        if (!dirName.isEmpty()) sb.append('/').append(dirName);
        return new DirectoryLink(dirName, sb.toString());
    }

    private static String label(Node first) {
        if (first instanceof TextNode) return ((TextNode) first).text().trim();
        if (first instanceof Element) return ((Element) first).text().trim();
        return "";
    }

    private static String stripExtension(String label, String lastSegment, String extension) {
        String base = label.endsWith(extension) ? label : lastSegment;
        return base.endsWith(extension) ? base.substring(0, base.length() - extension.length()) : base;
    }
}
