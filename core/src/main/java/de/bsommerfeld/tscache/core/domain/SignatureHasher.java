package de.bsommerfeld.tscache.core.domain;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.config.SignatureConfig;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Computes the core hash that keys every snapshot row.
 *
 * <p>
 * Algorithm ({@value #ALGORITHM}): SHA-256 over the trimmed UTF-8 canonical
 * signature, truncated to the first 16 bytes (128 bits) and encoded as
 * base64url without padding, which yields a 22 character key.
 *
 * <h3>Volatile parameters</h3>
 * Some inputs of a query are derived rather than asked for, e.g. a
 * latency-derived window size. Whether they participate in the hash is a
 * policy ({@code signature.include-volatile-params}). Including them makes the
 * hash change whenever the derived value drifts; excluding them lets series
 * continue across that drift. When included they are appended to the
 * canonical signature in sorted key order so the result is deterministic.
 */
@Singleton
public class SignatureHasher {

    public static final String ALGORITHM = "sig_v1_sha256_trunc128_b64url";

    private static final int TRUNCATED_BYTES = 16;

    private final boolean includeVolatileParams;

    @Inject
    public SignatureHasher(SignatureConfig config) {
        this(config.isIncludeVolatileParams());
    }

    public SignatureHasher(boolean includeVolatileParams) {
        this.includeVolatileParams = includeVolatileParams;
    }

    /**
     * Returns the core hash of a canonical signature.
     *
     * @throws IllegalArgumentException if the signature is blank
     */
    public String coreHash(String canonicalSignature) {
        return coreHash(canonicalSignature, Map.of());
    }

    /**
     * Returns the core hash of a canonical signature, applying the configured
     * volatile-parameter policy.
     */
    public String coreHash(String canonicalSignature, Map<String, String> volatileParams) {
        byte[] digest = sha256(effectiveSignature(canonicalSignature, volatileParams));
        return BaseEncoding.base64Url().omitPadding().encode(Arrays.copyOf(digest, TRUNCATED_BYTES));
    }

    /**
     * Full hex SHA-256 of the trimmed signature, stored next to the signature
     * in the registry. Volatile parameters never take part.
     */
    public static String fullHash(String canonicalSignature) {
        return Hashing.sha256().hashString(requireSignature(canonicalSignature), StandardCharsets.UTF_8).toString();
    }

    public boolean isIncludeVolatileParams() {
        return includeVolatileParams;
    }

    String effectiveSignature(String canonicalSignature, Map<String, String> volatileParams) {
        String sig = requireSignature(canonicalSignature);
        if (!includeVolatileParams || volatileParams == null || volatileParams.isEmpty())
            return sig;

        StringBuilder sb = new StringBuilder(sig);
        new TreeMap<>(volatileParams).forEach((k, v) -> sb.append('|').append(k).append('=').append(v));
        return sb.toString();
    }

    private static String requireSignature(String canonicalSignature) {
        Objects.requireNonNull(canonicalSignature, "canonicalSignature");
        String sig = canonicalSignature.trim();
        if (sig.isEmpty())
            throw new IllegalArgumentException("canonical signature must be non-empty");
        return sig;
    }

    private static byte[] sha256(String text) {
        return Hashing.sha256().hashString(text, StandardCharsets.UTF_8).asBytes();
    }
}
