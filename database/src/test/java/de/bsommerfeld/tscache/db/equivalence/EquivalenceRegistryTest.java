package de.bsommerfeld.tscache.db.equivalence;

import de.bsommerfeld.tscache.core.domain.SubjectRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EquivalenceRegistryTest {

    private static final SubjectRef A = SubjectRef.of("param-a", "h1");
    private static final SubjectRef B = SubjectRef.of("param-b", "h2");
    private static final SubjectRef C = SubjectRef.of("param-c", "h3");
    private static final SubjectRef D = SubjectRef.of("param-d", "h4");

    private EquivalenceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EquivalenceRegistry(new InMemoryLinkStore(),
                Clock.fixed(Instant.parse("2025-02-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void resolveClosure_withoutLinks_shouldContainOnlySeed() {
        assertEquals(Set.of(A), registry.resolveClosure(A));
    }

    @Test
    void resolveClosure_shouldFollowLinksInBothDirections() {
        registry.createLink(A, B, "ops", "hash migration");
        registry.createLink(C, B, "ops", "renamed event");

        assertEquals(Set.of(A, B, C), registry.resolveClosure(A));
        assertEquals(Set.of(A, B, C), registry.resolveClosure(C));
    }

    @Test
    void resolveClosure_shouldTerminateOnCycles() {
        registry.createLink(A, B, "ops", null);
        registry.createLink(B, C, "ops", null);
        registry.createLink(C, A, "ops", null);

        assertEquals(Set.of(A, B, C), registry.resolveClosure(B));
    }

    @Test
    void resolveClosure_shouldIgnoreInactiveLinks() {
        registry.createLink(A, B, "ops", null);
        registry.createLink(B, C, "ops", null);

        assertTrue(registry.deactivateLink(B, C, "ops", "wrong target"));

        assertEquals(Set.of(A, B), registry.resolveClosure(A));
        assertEquals(Set.of(C), registry.resolveClosure(C));
    }

    @Test
    void resolveClosure_sameSubjectDifferentHash_shouldBeDistinctMembers() {
        SubjectRef aOtherHash = SubjectRef.of("param-a", "h9");
        registry.createLink(A, aOtherHash, "ops", "signature change");

        assertEquals(Set.of(A, aOtherHash), registry.resolveClosure(aOtherHash));
    }

    @Test
    void createLink_shouldRejectSelfLink() {
        assertThrows(IllegalArgumentException.class, () -> registry.createLink(A, A, "ops", null));
    }

    @Test
    void createLink_shouldRequireAuthor() {
        assertThrows(IllegalArgumentException.class, () -> registry.createLink(A, B, " ", null));
    }

    @Test
    void createLink_twice_shouldReturnSameIdAndReactivate() {
        long first = registry.createLink(A, B, "ops", null);
        registry.deactivateLink(A, B, "ops", "temporary");
        long second = registry.createLink(A, B, "ops", "restored");

        assertEquals(first, second);
        assertEquals(Set.of(A, B), registry.resolveClosure(A));
        assertEquals(1, registry.listLinks(null, true).size());
    }

    @Test
    void deactivateLink_shouldKeepAuditTrail() {
        registry.createLink(A, B, "alice", "same funnel");
        registry.deactivateLink(A, B, "bob", "not the same");

        assertTrue(registry.listLinks(A, false).isEmpty());
        EquivalenceLink link = registry.listLinks(A, true).get(0);
        assertFalse(link.active());
        assertEquals("alice", link.createdBy());
        assertEquals("bob", link.deactivatedBy());
        assertEquals("not the same", link.deactivatedReason());
        assertNotNull(link.deactivatedAt());
    }

    @Test
    void createLink_afterDeactivation_shouldRecordReactivatorAndKeepCreator() {
        registry.createLink(A, B, "alice", "same funnel");
        registry.deactivateLink(A, B, "bob", "not the same");
        registry.createLink(A, B, "carol", "it was the same");

        EquivalenceLink link = registry.listLinks(A, false).get(0);
        assertEquals("alice", link.createdBy());
        assertEquals("same funnel", link.reason());
        assertEquals("bob", link.deactivatedBy());
        assertEquals("carol", link.reactivatedBy());
        assertEquals("it was the same", link.reactivatedReason());
        assertNotNull(link.reactivatedAt());
    }

    @Test
    void deactivateLink_unknownLink_shouldReturnFalse() {
        assertFalse(registry.deactivateLink(A, D, "ops", null));
    }
}
