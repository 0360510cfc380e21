package checklist;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IgnoreSetTest {

    @Test
    void blankInputMeansNoPatterns() throws Exception {
        assertTrue(IgnoreSet.parse("").isEmpty());
        assertTrue(IgnoreSet.parse("   ").isEmpty());
        assertTrue(IgnoreSet.parse(null).isEmpty());
        assertFalse(IgnoreSet.parse("").matches(""));
        assertFalse(IgnoreSet.parse("").matches("anything"));
    }

    @Test
    void splitsOnWhitespace() throws Exception {
        IgnoreSet set = IgnoreSet.parse("  vendor   Platform.Setters.Tests ");

        assertEquals(List.of("vendor", "Platform.Setters.Tests"), set.patterns());
    }

    @Test
    void matchesFragmentAnywhereInName() throws Exception {
        IgnoreSet set = IgnoreSet.parse("vendor");

        assertTrue(set.matches("vendor"));
        assertTrue(set.matches("third_party/vendor/lib"));
        assertFalse(set.matches("src/main"));
        assertFalse(set.matches(""));
    }

    @Test
    void patternsAreRegexFragments() throws Exception {
        IgnoreSet set = IgnoreSet.parse("^test");

        assertTrue(set.matches("tests/unit"));
        assertFalse(set.matches("src/test"));
    }

    @Test
    void invalidRegexIsRejected() {
        assertThrows(InputValidationException.class, () -> IgnoreSet.parse("a(b"));
    }
}
