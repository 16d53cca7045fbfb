package de.bsommerfeld.tscache.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SliceKeyTest {

    @Test
    void parse_shouldReadContextAndWindow() {
        SliceKey key = SliceKey.parse("context(channel:google).window(-30d:-1d)");

        assertEquals(QueryMode.WINDOW, key.mode());
        assertEquals(List.of(new ContextDimension("channel", "google")), key.dimensions());
        assertEquals("-30d:-1d", key.modeArgs());
    }

    @Test
    void parse_emptyString_shouldBeUncontextedWindow() {
        SliceKey key = SliceKey.parse("");

        assertTrue(key.isUncontexted());
        assertEquals(QueryMode.WINDOW, key.mode());
        assertEquals("window()", key.toDsl());
    }

    @Test
    void parse_shouldSortContextClauses() {
        SliceKey a = SliceKey.parse("context(region:eu).context(channel:google).cohort(1-Jan-25:31-Jan-25)");
        SliceKey b = SliceKey.parse("cohort(1-Jan-25:31-Jan-25).context(channel:google).context(region:eu)");

        assertEquals(a, b);
        assertEquals("context(channel:google).context(region:eu).cohort(1-Jan-25:31-Jan-25)", a.toDsl());
    }

    @Test
    void parse_shouldNotSplitOnDotsInsideArguments() {
        SliceKey key = SliceKey.parse("context(version:1.2).window(-7d:-1d)");

        assertEquals("1.2", key.dimensions().get(0).value());
    }

    @Test
    void parse_shouldRejectUnknownClause() {
        assertThrows(IllegalArgumentException.class, () -> SliceKey.parse("visited(a).window()"));
    }

    @Test
    void parse_shouldRejectTwoModeClauses() {
        assertThrows(IllegalArgumentException.class, () -> SliceKey.parse("window(-7d:).cohort(-7d:)"));
    }

    @Test
    void parse_shouldRejectContextWithoutValueSeparator() {
        assertThrows(IllegalArgumentException.class, () -> SliceKey.parse("context(channel).window()"));
    }

    @Test
    void family_shouldDropWindowArguments() {
        SliceKey jan = SliceKey.parse("context(channel:google).window(1-Jan-25:31-Jan-25)");
        SliceKey feb = SliceKey.parse("context(channel:google).window(1-Feb-25:28-Feb-25)");

        assertEquals(jan.family(), feb.family());
        assertEquals("context(channel:google).window()", jan.family().canonical());
    }

    @Test
    void family_shouldDifferByMode() {
        SliceFamily window = SliceFamily.parse("context(channel:google).window(-30d:)");
        SliceFamily cohort = SliceFamily.parse("context(channel:google).cohort(-30d:)");

        assertNotEquals(window, cohort);
    }

    @Test
    void toDsl_shouldRoundTripThroughParse() {
        SliceKey key = SliceKey.parse("context(channel:meta).cohort(-14d:-1d)");

        assertEquals(key, SliceKey.parse(key.toDsl()));
    }
}
