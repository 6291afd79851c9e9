package me.bechberger.plumbr.util;

/**
 * UTF-8 size helpers that avoid encoding the text just to measure it.
 */
public final class Utf8 {

    private Utf8() {
        // Utility class
    }

    /**
     * Number of bytes {@code text.getBytes(StandardCharsets.UTF_8)} would produce.
     * Unpaired surrogates count as one byte, the JDK encoder replaces them with '?'.
     */
    public static long encodedLength(CharSequence text) {
        long bytes = 0;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isSurrogate(c)) {
                if (Character.isHighSurrogate(c) && i + 1 < length
                        && Character.isLowSurrogate(text.charAt(i + 1))) {
                    bytes += 4;
                    i++;
                } else {
                    bytes += 1;
                }
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }
}
