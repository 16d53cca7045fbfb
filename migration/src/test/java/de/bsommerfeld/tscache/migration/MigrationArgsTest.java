package de.bsommerfeld.tscache.migration;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MigrationArgsTest {

    @Test
    void parse_defaults_shouldBeDryRunWithConfiguredWindow() {
        MigrationOptions options = MigrationArgs.parse(new String[] {"--subject", "obj-a"}).toOptions(120);

        assertEquals("obj-a", options.subjectId());
        assertFalse(options.commit());
        assertFalse(options.allowDeleteIdentical());
        assertEquals(Duration.ofSeconds(120), options.window());
    }

    @Test
    void parse_shouldAcceptBothValueForms() {
        MigrationArgs args = MigrationArgs.parse(new String[] {
                "--subject-prefix=obj-", "--window-seconds", "300", "--commit", "--allow-delete-identical",
                "--db=/tmp/cache.db"});

        MigrationOptions options = args.toOptions(120);

        assertEquals("obj-", options.subjectPrefix());
        assertEquals(Duration.ofSeconds(300), options.window());
        assertTrue(options.commit());
        assertTrue(options.allowDeleteIdentical());
        assertEquals(Path.of("/tmp/cache.db"), args.db());
    }

    @Test
    void parse_dates_shouldCoverWholeDays() {
        MigrationOptions options = MigrationArgs.parse(new String[] {
                "--subject", "obj-a", "--retrieved-from", "2025-01-10", "--retrieved-to", "2025-01-11"})
                .toOptions(120);

        assertEquals(Instant.parse("2025-01-10T00:00:00Z"), options.retrievedFrom());
        assertEquals(Instant.parse("2025-01-11T23:59:59.999Z"), options.retrievedTo());
    }

    @Test
    void parse_instant_shouldBeTakenAsIs() {
        MigrationOptions options = MigrationArgs.parse(new String[] {
                "--subject", "obj-a", "--retrieved-from", "2025-01-10T06:30:00Z"}).toOptions(120);

        assertEquals(Instant.parse("2025-01-10T06:30:00Z"), options.retrievedFrom());
        assertNull(options.retrievedTo());
    }

    @Test
    void toOptions_withoutScope_shouldFail() {
        MigrationArgs args = MigrationArgs.parse(new String[] {"--commit"});

        assertThrows(IllegalArgumentException.class, () -> args.toOptions(120));
    }

    @Test
    void toOptions_withBothScopes_shouldFail() {
        MigrationArgs args = MigrationArgs.parse(new String[] {"--subject", "a", "--subject-prefix", "b"});

        assertThrows(IllegalArgumentException.class, () -> args.toOptions(120));
    }

    @Test
    void toOptions_windowOutOfRange_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> MigrationArgs.parse(new String[] {"--subject", "a", "--window-seconds", "0"}).toOptions(120));
        assertThrows(IllegalArgumentException.class,
                () -> MigrationArgs.parse(new String[] {"--subject", "a", "--window-seconds", "3601"})
                        .toOptions(120));
        assertThrows(IllegalArgumentException.class,
                () -> MigrationArgs.parse(new String[] {"--subject", "a", "--window-seconds", "two"})
                        .toOptions(120));
    }

    @Test
    void parse_malformedInput_shouldFail() {
        assertThrows(IllegalArgumentException.class, () -> MigrationArgs.parse(new String[] {"--force"}));
        assertThrows(IllegalArgumentException.class, () -> MigrationArgs.parse(new String[] {"--subject"}));
        assertThrows(IllegalArgumentException.class, () -> MigrationArgs.parse(new String[] {"--commit=yes"}));
        assertThrows(IllegalArgumentException.class,
                () -> MigrationArgs.parse(new String[] {"--subject", "a", "--subject", "b"}));
    }
}
