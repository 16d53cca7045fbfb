package de.bsommerfeld.tscache.migration;

import de.bsommerfeld.tscache.core.domain.SnapshotRow;

import java.time.Instant;
import java.util.List;

/**
 * What canonicalising one subject would do.
 *
 * @param subjectId      subject
 * @param rowsInScope    rows of the subject, across all hashes and slices
 * @param groupsTouched  batches (clusters) with more than one timestamp
 * @param distinctBefore distinct {@code retrieved_at} values now
 * @param distinctAfter  distinct {@code retrieved_at} values afterwards
 * @param deletions      redundant identical copies to drop
 * @param updates        surviving rows to move onto their canonical timestamp
 * @param collisions     every collision group with more than one member
 */
public record SubjectPlan(
        String subjectId,
        int rowsInScope,
        int groupsTouched,
        int distinctBefore,
        int distinctAfter,
        List<SnapshotRow> deletions,
        List<Retime> updates,
        List<CollisionGroup> collisions) {

    public SubjectPlan {
        deletions = List.copyOf(deletions);
        updates = List.copyOf(updates);
        collisions = List.copyOf(collisions);
    }

    public record Retime(SnapshotRow row, Instant canonicalTs) {
    }

    public List<CollisionGroup> ambiguous() {
        return collisions.stream().filter(CollisionGroup::isAmbiguous).toList();
    }

    public boolean isCanonical() {
        return deletions.isEmpty() && updates.isEmpty();
    }
}
