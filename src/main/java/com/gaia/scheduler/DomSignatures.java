package com.gaia.scheduler;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Computes DOM signatures used to detect page state changes.
 * <p>
 * A signature is the MD5 hex digest of the sorted {@code tag:selector} pairs of
 * the page's interactive elements joined with {@code |}. Element order does not
 * affect the result.
 */
public final class DomSignatures {

    private DomSignatures() {
    }

    /**
     * Compute the signature of analysed DOM data.
     *
     * @param domData Map with an {@code elements} list of maps holding {@code tag} and {@code selector}
     * @return 32-character lowercase hex digest
     */
    public static String compute(Map<String, ?> domData) {
        List<String> parts = new ArrayList<>();
        Object elements = domData != null ? domData.get("elements") : null;
        if (elements instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof Map<?, ?> el) {
                    parts.add(valueOf(el.get("tag")) + ":" + valueOf(el.get("selector")));
                }
            }
        }
        parts.sort(null);
        return md5Hex(String.join("|", parts));
    }

    /**
     * Count the interactive elements in analysed DOM data.
     */
    public static int elementCount(Map<String, ?> domData) {
        Object elements = domData != null ? domData.get("elements") : null;
        return elements instanceof List<?> list ? list.size() : 0;
    }

    private static String valueOf(Object value) {
        return value != null ? value.toString() : "";
    }

    private static String md5Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
