package com.example.reconciliation.service.normalization;

import java.util.Locale;
import java.util.Objects;

/**
 * Canonical form of a product identifier used for matching across ledgers.
 */
public final class KeyNormalizer {

    private KeyNormalizer() {}

    /**
     * Strips surrounding whitespace and upper-cases with {@link Locale#ROOT}, so the result does
     * not depend on the JVM's default locale. Normalizing a normalized key returns it unchanged.
     */
    public static String normalize(String raw) {
        Objects.requireNonNull(raw, "raw key");
        return raw.strip().toUpperCase(Locale.ROOT);
    }
}
