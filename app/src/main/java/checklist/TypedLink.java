package checklist;

// A classified listing anchor: a sub-directory to crawl or a tracked file to report.
public sealed interface TypedLink permits DirectoryLink, FileLink {

    String name();

    String href();
}
