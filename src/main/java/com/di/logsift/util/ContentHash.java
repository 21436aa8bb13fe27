package com.di.logsift.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-derived identifiers.
 *
 * <p>Group ids and raw-log ids are the lowercase hex MD5 of the UTF-8 bytes of their input.
 * Other processes that read or write the same indices depend on this exact encoding, so it
 * must not change.
 */
public final class ContentHash {

    private ContentHash() {
    }

    public static String md5Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available in this JVM", e);
        }
    }

    /** Id of a raw log line: {@code md5(fileName + "_" + lineNumber + "_" + strippedLine)}. */
    public static String rawLogId(String fileName, long lineNumber, String strippedLine) {
        return md5Hex(fileName + "_" + lineNumber + "_" + strippedLine);
    }
}
