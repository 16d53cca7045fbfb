package de.bsommerfeld.tscache.core.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * A {@code (subject, core hash)} pair: the unit the equivalence registry links
 * and the read path expands. The subject is where rows physically live; the
 * hash says what was asked.
 *
 * @param subjectId the logical object a retrieval is performed for
 * @param coreHash  canonical signature hash
 */
public record SubjectRef(String subjectId, String coreHash) implements Comparable<SubjectRef> {

    private static final Comparator<SubjectRef> ORDER = Comparator
            .comparing(SubjectRef::subjectId)
            .thenComparing(SubjectRef::coreHash);

    public SubjectRef {
        subjectId = requireText(subjectId, "subjectId");
        coreHash = requireText(coreHash, "coreHash");
    }

    public static SubjectRef of(String subjectId, String coreHash) {
        return new SubjectRef(subjectId, coreHash);
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        String trimmed = value.trim();
        if (trimmed.isEmpty())
            throw new IllegalArgumentException(name + " must not be blank");
        return trimmed;
    }

    @Override
    public int compareTo(SubjectRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return subjectId + "#" + coreHash;
    }
}
