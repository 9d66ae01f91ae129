package com.cape.label;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Deterministic keys for sets of ids.
 *
 * <p>Ids are de-duplicated and sorted ascending before they are joined with {@code ','} and hashed
 * with SHA-256, so the key depends only on set membership and never on presentation order. The key
 * is computed once at write time and stored on the row, which keeps dedup lookups to a single
 * indexed equality match.
 */
public final class CanonicalSignature {

    /** Length of a key produced by {@link #of(Collection)}. */
    public static final int LENGTH = 64;

    private static final String DELIMITER = ",";

    private CanonicalSignature() {
        // utility class
    }

    /**
     * Returns the ids sorted ascending with duplicates removed.
     *
     * @throws IllegalArgumentException if the collection or any element is null
     */
    public static List<Long> sortedDistinct(Collection<Long> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids must not be null");
        }
        if (ids.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("ids must not contain null");
        }
        return ids.stream().distinct().sorted().toList();
    }

    /** Hex-encoded SHA-256 of the sorted, comma-joined ids. */
    public static String of(Collection<Long> ids) {
        String joined =
                sortedDistinct(ids).stream()
                        .map(String::valueOf)
                        .collect(Collectors.joining(DELIMITER));
        return HexFormat.of().formatHex(sha256().digest(joined.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
