package com.csv2bufr.pipeline;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content key of an encoded message: lowercase hex MD5 of its bytes.
 */
public final class ContentHash {

    private static final String ALGORITHM = "MD5";

    private ContentHash() {
        // Utility class
    }

    public static String of(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance(ALGORITHM).digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " digest not available", e);
        }
    }
}
