package com.bko.controltower.payload;

/**
 * Transmit-ready JPEG produced by {@link ImagePayloadPreparer}.
 */
public record PreparedImage(
        byte[] bytes,
        String mimeType,
        int width,
        int height,
        int quality,
        int originalSize,
        boolean withinBudget
) {
    public int size() {
        return bytes.length;
    }
}
