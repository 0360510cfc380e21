package checklist;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class UrlUtil {

    private UrlUtil() {
    }

    // Glue a site-relative href ("/owner/repo/tree/main/x") onto the origin.
    // Absolute hrefs are kept only when they are on that origin; anything else gives null.
    public static String absolute(String origin, String href) {
        if (href == null) return null;
        String h = href.trim();
        String base = stripTrailingSlash(origin);
        if (isHttpLike(h)) {
            return h.toLowerCase(Locale.ROOT).startsWith(base.toLowerCase(Locale.ROOT) + "/") ? h : null;
        }
        if (!h.startsWith("/")) h = "/" + h;
        return base + h;
    }

    // Path of an href without query or fragment; accepts both absolute and site-relative hrefs.
    public static String pathOf(String href) {
        if (href == null) return "";
        String s = href.trim();
        int cut = indexOfAny(s, '?', '#');
        if (cut >= 0) s = s.substring(0, cut);
        if (isHttpLike(s)) {
            try {
                String p = new URI(s).getRawPath();
                return p == null ? "" : p;
            } catch (URISyntaxException e) {
                // Fall back to slicing after the authority.
                int schemeEnd = s.indexOf("://");
                int slash = s.indexOf('/', schemeEnd + 3);
                return slash < 0 ? "" : s.substring(slash);
            }
        }
        return s;
    }

    // Non-empty path segments, in order.
    public static List<String> segments(String path) {
        List<String> out = new ArrayList<>();
        if (path == null) return out;
        for (String part : path.split("/")) {
            if (!part.isEmpty()) out.add(part);
        }
        return out;
    }

    // Last non-empty path segment, or "" for a bare origin.
    public static String lastSegment(String url) {
        List<String> parts = segments(pathOf(url));
        return parts.isEmpty() ? "" : parts.get(parts.size() - 1);
    }

    // Only accept http/https links.
    public static boolean isHttpLike(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        return u.startsWith("http://") || u.startsWith("https://");
    }

    public static String stripTrailingSlash(String s) {
        String out = s;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    // Create a filesystem-safe name for the checklist file.
    // Prefer a readable base; only add a hash when length requires it.
    public static String toSafeFilename(String name, String suffix) {
        String safe = name.replaceAll("[^a-zA-Z0-9._-]+", "_");
        if (safe.isEmpty() || safe.chars().allMatch(c -> c == '.')) {
            safe = "checklist";
        }
        int maxBase = 160;
        if (safe.length() > maxBase) {
            return safe.substring(0, maxBase) + "__" + shortHash(name) + suffix;
        }
        return safe + suffix;
    }

    // Short hash for filenames to avoid collisions.
    private static String shortHash(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 6; i++) sb.append(String.format("%02x", digest[i]));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }
}
