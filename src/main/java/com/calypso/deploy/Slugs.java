package com.calypso.deploy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Subdomain slugs and content hashes for published sites.
 */
public final class Slugs {

    public static final Pattern SLUG_PATTERN = Pattern.compile("^[a-z0-9](?:[a-z0-9-]{1,46}[a-z0-9])?$");
    public static final int MAX_LENGTH = 48;
    public static final String INVALID_FORMAT_MESSAGE =
            "Invalid format. Use 3-48 lowercase letters, numbers, and hyphens.";

    static final String FALLBACK_BASE = "project";
    private static final int[] SUFFIX_LENGTHS = {6, 8, 12, 16, 24, 32};

    private Slugs() {}

    /** Lower-cases, collapses every run of other characters into a hyphen and trims to 48 characters. */
    public static String slugify(String name) {
        if (name == null) {
            return "";
        }
        String slug = name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-|-$", "");
        return trimTo(slug, MAX_LENGTH);
    }

    /** Caller-supplied slug as it is stored: trimmed and lower-cased. */
    public static String normalize(String slug) {
        return slug == null ? "" : slug.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String slug) {
        return slug != null && SLUG_PATTERN.matcher(slug).matches();
    }

    /**
     * First free slug among {@code base}, then {@code base-<hash prefix>} with growing
     * prefixes of the SHA-256 of the project id. The hash keeps the choice stable for a
     * project across retries.
     *
     * @throws SlugConflictException if every candidate is taken
     */
    public static String uniqueSlug(String base, String projectId, Predicate<String> taken) {
        String root = isValid(base) ? base : FALLBACK_BASE;
        if (!taken.test(root)) {
            return root;
        }
        String hash = sha256Hex(projectId);
        for (int length : SUFFIX_LENGTHS) {
            String suffix = hash.substring(0, length);
            String candidate = trimTo(root, MAX_LENGTH - 1 - length) + "-" + suffix;
            if (!taken.test(candidate)) {
                return candidate;
            }
        }
        throw new SlugConflictException(root);
    }

    /**
     * Deterministic hosting project name of a project's published site. Derived from the
     * SHA-256 of the whole id, so ids sharing a prefix still get distinct projects.
     */
    public static String hostingProjectName(String projectId) {
        return "calypso-" + sha256Hex(projectId).substring(0, 16);
    }

    public static String sha1Hex(byte[] content) {
        return HexFormat.of().formatHex(digest("SHA-1", content));
    }

    static String sha256Hex(String value) {
        return HexFormat.of().formatHex(digest("SHA-256", value.getBytes(StandardCharsets.UTF_8)));
    }

    static String prefix(String value, int length) {
        return value.length() <= length ? value : value.substring(0, length);
    }

    private static String trimTo(String slug, int length) {
        String trimmed = prefix(slug, length);
        while (trimmed.endsWith("-")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static byte[] digest(String algorithm, byte[] content) {
        try {
            return MessageDigest.getInstance(algorithm).digest(content);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
