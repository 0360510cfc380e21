package checklist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

// Directory-name fragments that prune a subtree from the crawl.
// A name is ignored when any pattern is found anywhere in it ("vendor" drops "third_party/vendor/x").
public final class IgnoreSet {

    private static final IgnoreSet NONE = new IgnoreSet(List.of());

    private final List<Pattern> patterns;

    private IgnoreSet(List<Pattern> patterns) {
        this.patterns = patterns;
    }

    public static IgnoreSet none() {
        return NONE;
    }

    // Space-delimited form used on the command line; blank input means no patterns.
    public static IgnoreSet parse(String raw) throws InputValidationException {
        if (raw == null || raw.isBlank()) return NONE;
        List<String> parts = new ArrayList<>();
        for (String part : raw.trim().split("\\s+")) {
            if (!part.isEmpty()) parts.add(part);
        }
        return of(parts);
    }

    public static IgnoreSet of(List<String> fragments) throws InputValidationException {
        List<Pattern> compiled = new ArrayList<>();
        for (String fragment : fragments) {
            if (fragment == null || fragment.isBlank()) continue;
            try {
                compiled.add(Pattern.compile(fragment));
            } catch (PatternSyntaxException e) {
                throw new InputValidationException("Invalid ignore pattern: " + fragment, e);
            }
        }
        return compiled.isEmpty() ? NONE : new IgnoreSet(Collections.unmodifiableList(compiled));
    }

    public boolean matches(String directoryName) {
        if (directoryName == null) return false;
        for (Pattern p : patterns) {
            if (p.matcher(directoryName).find()) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public List<String> patterns() {
        List<String> out = new ArrayList<>(patterns.size());
        for (Pattern p : patterns) out.add(p.pattern());
        return out;
    }

    @Override
    public String toString() {
        return "IgnoreSet" + patterns();
    }
}
