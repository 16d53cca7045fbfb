package de.bsommerfeld.tscache.core.domain;

import java.util.Objects;

/**
 * Scope of one retrieval batch: {@code (object, mode, slice family, hash)}.
 * Time-window arguments are deliberately not part of it, so plan items that
 * only differ by their window coalesce onto the same batch timestamp.
 *
 * @param objectId the subject the fetch is performed for
 * @param family   slice family (carries the mode)
 * @param coreHash canonical signature hash
 */
public record SubjectIdentity(String objectId, SliceFamily family, String coreHash) {

    public SubjectIdentity {
        Objects.requireNonNull(objectId, "objectId");
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(coreHash, "coreHash");
    }

    public static SubjectIdentity of(String objectId, SliceKey sliceKey, String coreHash) {
        return new SubjectIdentity(objectId, sliceKey.family(), coreHash);
    }

    public QueryMode mode() {
        return family.mode();
    }

    public SubjectRef subjectRef() {
        return SubjectRef.of(objectId, coreHash);
    }

    @Override
    public String toString() {
        return "p:" + objectId + "::" + family.mode().clause() + "::" + family.canonical() + "::sig:" + coreHash;
    }
}
