package de.bsommerfeld.tscache.db;

import java.time.Instant;

/**
 * A row of the signature registry: what a core hash was computed from.
 *
 * @param fullHash untruncated hex SHA-256 of the canonical signature
 */
public record SignatureEntry(
        String subjectId,
        String coreHash,
        String canonicalSignature,
        String fullHash,
        String algorithm,
        Instant createdAt) {
}
