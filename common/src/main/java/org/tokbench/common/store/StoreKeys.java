package org.tokbench.common.store;

import org.tokbench.common.Language;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Key layout of the store. Keys are ASCII strings compared bytewise, offsets are
 * zero-padded so that key order equals offset order.
 */
public final class StoreKeys {

    private StoreKeys() {
    }

    public static final String RECORD_PREFIX = "rec";
    public static final String CHECKPOINT_PREFIX = "ckpt";

    private static final char SEPARATOR = '/';
    private static final String OFFSET_FORMAT = "%019d";
    private static final int OFFSET_WIDTH = 19;
    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");

    public static byte[] record(String namespace, Language language, String tokenizerId, long offset) {
        return bytes(recordPrefix(namespace, language, tokenizerId) + formatOffset(offset));
    }

    public static byte[] checkpoint(String namespace, Language language, String tokenizerId, long shardStart) {
        return bytes(checkpointPrefix(namespace, language, tokenizerId) + formatOffset(shardStart));
    }

    public static String recordPrefix(String namespace, Language language, String tokenizerId) {
        return pairPrefix(RECORD_PREFIX, namespace, language, tokenizerId);
    }

    public static String checkpointPrefix(String namespace, Language language, String tokenizerId) {
        return pairPrefix(CHECKPOINT_PREFIX, namespace, language, tokenizerId);
    }

    public static String namespacePrefix(String kind, String namespace) {
        return kind + SEPARATOR + validSegment(namespace, "namespace") + SEPARATOR;
    }

    /** Trailing offset of a key built by this class. */
    public static long offsetOf(String key) {
        return Long.parseLong(key.substring(key.length() - OFFSET_WIDTH));
    }

    public static String validSegment(String value, String what) {
        if (value == null || !SEGMENT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + " '" + value + "', allowed: " + SEGMENT.pattern());
        }
        return value;
    }

    static byte[] bytes(String key) {
        return key.getBytes(StandardCharsets.US_ASCII);
    }

    static String string(byte[] key) {
        return new String(key, StandardCharsets.US_ASCII);
    }

    private static String pairPrefix(String kind, String namespace, Language language, String tokenizerId) {
        return namespacePrefix(kind, namespace)
                + language.code() + SEPARATOR
                + validSegment(tokenizerId, "tokenizer id") + SEPARATOR;
    }

    private static String formatOffset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be non-negative: " + offset);
        }
        return String.format(OFFSET_FORMAT, offset);
    }
}
