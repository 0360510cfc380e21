package checklist;

import java.util.Objects;

// Markup contract of the listing site: the origin hrefs are relative to, and the exact
// class carried by directory and file row anchors. Follows the site's rendering.
public record SiteProfile(String origin, String anchorClass) {

    public static final String GITHUB_ORIGIN = "https://github.com";
    public static final String GITHUB_ROW_CLASS = "js-navigation-open link-gray-dark";

    public SiteProfile {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(anchorClass, "anchorClass");
        origin = UrlUtil.stripTrailingSlash(origin);
    }

    public static SiteProfile github() {
        return new SiteProfile(GITHUB_ORIGIN, GITHUB_ROW_CLASS);
    }
}
