package io.github.jakubt4.skychart.render;

/**
 * Raster formats a frame can be encoded in.
 */
public enum ImageFormat {

    PNG("image/png"),
    JPEG("image/jpeg");

    private final String mediaType;

    ImageFormat(final String mediaType) {
        this.mediaType = mediaType;
    }

    public String mediaType() {
        return mediaType;
    }
}
