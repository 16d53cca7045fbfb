package de.bsommerfeld.tscache.migration;

import de.bsommerfeld.tscache.core.domain.SnapshotRow;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rows that map onto the same natural key once their batch is canonicalised.
 *
 * @param subjectId   subject
 * @param coreHash    core hash
 * @param sliceKey    slice key in DSL form
 * @param anchorDay   anchor day
 * @param canonicalTs timestamp every member would move to
 * @param members     colliding rows, oldest first
 */
public record CollisionGroup(
        String subjectId,
        String coreHash,
        String sliceKey,
        LocalDate anchorDay,
        Instant canonicalTs,
        List<SnapshotRow> members) {

    public CollisionGroup {
        members = members.stream().sorted(Comparator.comparing(SnapshotRow::retrievedAt)).toList();
    }

    /** Members disagree on content: no member can be chosen without losing data. */
    public boolean isAmbiguous() {
        return members.stream().map(ContentFingerprint::of).distinct().count() > 1;
    }

    /** The member that stays: the one written last. */
    public SnapshotRow survivor() {
        return members.get(members.size() - 1);
    }

    public List<SnapshotRow> redundant() {
        return members.subList(0, members.size() - 1);
    }

    /** Evidence lines: the key, then one line per member with its fingerprint. */
    public List<String> describe() {
        String header = String.format("subject=%s hash=%s slice=%s day=%s canonical=%s", subjectId, coreHash,
                sliceKey, anchorDay, canonicalTs);
        List<String> lines = new ArrayList<>();
        lines.add(header);
        for (SnapshotRow member : members)
            lines.add("    retrieved_at=" + member.retrievedAt() + " fingerprint=" + ContentFingerprint.of(member));
        return lines;
    }
}
