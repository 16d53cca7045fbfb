package de.bsommerfeld.tscache.retrieval;

import de.bsommerfeld.tscache.core.domain.SliceKey;
import de.bsommerfeld.tscache.core.domain.SubjectIdentity;
import de.bsommerfeld.tscache.core.domain.SubjectRef;

import java.util.List;
import java.util.Objects;

/**
 * One (subject x slice) operation of a fetch plan.
 *
 * @param itemKey            stable key used in logs, events and the report
 * @param objectId           subject the data is fetched for
 * @param coreHash           core hash of the query signature
 * @param canonicalSignature signature text registered with the rows, may be {@code null}
 * @param sliceKey           slice to fetch, including window arguments
 * @param windows            anchor-day windows, fetched in order
 * @param classification     planner verdict
 * @param note               why the item was classified as it was, may be {@code null}
 */
public record FetchPlanItem(
        String itemKey,
        String objectId,
        String coreHash,
        String canonicalSignature,
        SliceKey sliceKey,
        List<FetchWindow> windows,
        ItemClassification classification,
        String note) {

    public FetchPlanItem {
        Objects.requireNonNull(itemKey, "itemKey");
        Objects.requireNonNull(objectId, "objectId");
        Objects.requireNonNull(coreHash, "coreHash");
        Objects.requireNonNull(sliceKey, "sliceKey");
        Objects.requireNonNull(classification, "classification");
        windows = windows == null ? List.of() : List.copyOf(windows);
    }

    public static FetchPlanItem fetch(String itemKey, String objectId, String coreHash, SliceKey sliceKey,
            List<FetchWindow> windows) {
        return new FetchPlanItem(itemKey, objectId, coreHash, null, sliceKey, windows, ItemClassification.FETCH,
                null);
    }

    public FetchPlanItem withSignature(String signature) {
        return new FetchPlanItem(itemKey, objectId, coreHash, signature, sliceKey, windows, classification, note);
    }

    public FetchPlanItem classifiedAs(ItemClassification newClassification, String newNote) {
        return new FetchPlanItem(itemKey, objectId, coreHash, canonicalSignature, sliceKey, windows,
                newClassification, newNote);
    }

    /** Batch scope of this item: window arguments are not part of it. */
    public SubjectIdentity identity() {
        return SubjectIdentity.of(objectId, sliceKey, coreHash);
    }

    public SubjectRef subjectRef() {
        return SubjectRef.of(objectId, coreHash);
    }
}
