package com.ziprenamer.util;

import java.nio.charset.StandardCharsets;

/**
 * UTF-8 measurements over Java strings.
 */
public final class Utf8 {

    private Utf8() {
    }

    public static int byteLength(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * False when the string cannot survive a UTF-8 encode/decode, which for a Java
     * string means it carries an unpaired surrogate.
     */
    public static boolean roundTrips(String s) {
        byte[] encoded = s.getBytes(StandardCharsets.UTF_8);
        return new String(encoded, StandardCharsets.UTF_8).equals(s);
    }
}
