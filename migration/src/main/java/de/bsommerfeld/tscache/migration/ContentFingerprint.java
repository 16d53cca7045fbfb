package de.bsommerfeld.tscache.migration;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import de.bsommerfeld.tscache.core.domain.SnapshotMetrics;
import de.bsommerfeld.tscache.core.domain.SnapshotRow;

import java.nio.charset.StandardCharsets;

/**
 * SHA-256 over every field of a row except {@code retrieved_at}. Two rows
 * with equal fingerprints are interchangeable copies of the same fact.
 */
public final class ContentFingerprint {

    private static final char SEP = '\u001f';

    private ContentFingerprint() {
    }

    public static String of(SnapshotRow row) {
        SnapshotMetrics m = row.metrics();
        Hasher hasher = Hashing.sha256().newHasher();
        put(hasher, row.subjectId());
        put(hasher, row.coreHash());
        put(hasher, row.sliceKey().toDsl());
        put(hasher, row.anchorDay());
        put(hasher, m.anchorEntrants());
        put(hasher, m.denominator());
        put(hasher, m.numerator());
        put(hasher, m.medianLagDays());
        put(hasher, m.meanLagDays());
        put(hasher, m.anchorMedianLagDays());
        put(hasher, m.anchorMeanLagDays());
        put(hasher, m.onsetDeltaDays());
        return hasher.hash().toString();
    }

    // null and "null" must not collide, hence the marker byte
    private static void put(Hasher hasher, Object value) {
        if (value == null) {
            hasher.putByte((byte) 0);
        } else {
            hasher.putByte((byte) 1).putString(value.toString(), StandardCharsets.UTF_8);
        }
        hasher.putChar(SEP);
    }
}
