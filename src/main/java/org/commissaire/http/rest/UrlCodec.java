package org.commissaire.http.rest;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

final class UrlCodec {

    private UrlCodec() {}

    /**
     * Form decoding for query strings: UTF-8 percent escapes, and {@code +} as a
     * space. Text with a broken escape is returned as received.
     */
    static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    /**
     * Decoding for path segments, where {@code +} is a literal plus sign and only
     * percent escapes are decoded.
     */
    static String decodePathSegment(String raw) {
        return decode(raw.replace("+", "%2B"));
    }
}
