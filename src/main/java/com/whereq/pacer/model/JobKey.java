package com.whereq.pacer.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lookup key of a training plan job, derived from the athlete name.
 *
 * Normalization: strip outer whitespace, collapse inner whitespace runs to a
 * single space, lowercase with {@link Locale#ROOT}. "Jane Doe", " jane   DOE "
 * and "JANE DOE" therefore share the key "jane doe".
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobKey {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern SLUG_SAFE = Pattern.compile("[a-z0-9 ]+");
    private static final int SLUG_HASH_LENGTH = 8;

    String value;

    /**
     * Derive the key for an athlete name
     *
     * @param athleteName display name as submitted by the client
     * @return normalized key
     * @throws IllegalArgumentException if the name is null or blank
     */
    public static JobKey of(String athleteName) {
        if (athleteName == null || athleteName.isBlank()) {
            throw new IllegalArgumentException("Athlete name must not be blank");
        }
        String collapsed = WHITESPACE_RUN.matcher(athleteName.strip()).replaceAll(" ");
        return new JobKey(collapsed.toLowerCase(Locale.ROOT));
    }

    /**
     * Filesystem-safe form of the key. Keys made only of [a-z0-9] and spaces map
     * to themselves with spaces turned into underscores; any other key gets its
     * unsafe characters replaced and a hash suffix, so distinct keys never share
     * a slug.
     */
    public String artifactSlug() {
        if (SLUG_SAFE.matcher(value).matches()) {
            return value.replace(' ', '_');
        }
        String replaced = value.replaceAll("[^a-z0-9]", "_");
        return replaced + "-" + sha256(value).substring(0, SLUG_HASH_LENGTH);
    }

    @Override
    public String toString() {
        return value;
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
