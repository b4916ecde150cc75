package org.netpreserve.sampler.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

public class FileNames {
    private static final int MAX_BASE_LENGTH = 160;
    private static final Pattern SAFE_RUN = Pattern.compile("[^a-zA-Z0-9.-]+");

    private FileNames() {
    }

    /**
     * Turns a URL into a readable, filesystem-safe name. The scheme is dropped so that http and https variants of a
     * site share a name. Whenever sanitizing loses information the name is suffixed with a short hash of the
     * scheme-less URL, and long names are also truncated, so distinct URLs never share a name.
     */
    public static String safeName(String url) {
        String stripped = url.replaceFirst("(?i)^https?://", "");
        String safe = SAFE_RUN.matcher(stripped).replaceAll("_");
        safe = safe.replaceAll("^[._]+|[._]+$", "");
        if (safe.isEmpty()) return "__" + shortHash(stripped);
        // names without underscores are unambiguous; everything else carries the hash
        if (safe.equals(stripped) && safe.indexOf('_') < 0 && safe.length() <= MAX_BASE_LENGTH) return safe;
        if (safe.length() > MAX_BASE_LENGTH) safe = safe.substring(0, MAX_BASE_LENGTH);
        return safe + "__" + shortHash(stripped);
    }

    private static String shortHash(String s) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 6);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
