package com.flowmable.palette;

/**
 * Thrown when no palette can be formed, e.g. the image has no opaque pixels.
 */
public class PaletteUnavailableException extends Exception {

    public PaletteUnavailableException(String message) {
        super(message);
    }
}
