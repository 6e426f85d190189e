package com.flowmable.palette;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Converts decoded images into the interleaved RGBA buffers the quantizer reads.
 */
public final class PixelBuffers {

    private PixelBuffers() {}

    /**
     * Downsample so the longer side is at most {@code targetSize}, then flatten to RGBA.
     */
    public static byte[] toRgba(BufferedImage image, int targetSize) {
        return toRgba(downsample(image, targetSize));
    }

    /**
     * Flatten an image to R,G,B,A bytes in row-major order.
     * Images without an alpha channel read as fully opaque.
     */
    public static byte[] toRgba(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        byte[] rgba = new byte[argb.length * KMeansQuantizer.CHANNELS];
        for (int i = 0; i < argb.length; i++) {
            int px = argb[i];
            int o = i * KMeansQuantizer.CHANNELS;
            rgba[o] = (byte) ((px >> 16) & 0xFF);
            rgba[o + 1] = (byte) ((px >> 8) & 0xFF);
            rgba[o + 2] = (byte) (px & 0xFF);
            rgba[o + 3] = (byte) ((px >> 24) & 0xFF);
        }
        return rgba;
    }

    /**
     * Bilinear downsample preserving aspect ratio. Images already within
     * {@code targetSize} are returned unchanged.
     */
    public static BufferedImage downsample(BufferedImage src, int targetSize) {
        if (targetSize < 1) {
            throw new IllegalArgumentException("targetSize must be >= 1, got: " + targetSize);
        }
        int w = src.getWidth();
        int h = src.getHeight();
        double scale = Math.min((double) targetSize / w, (double) targetSize / h);
        if (scale >= 1.0) {
            return src;
        }
        int nw = Math.max(1, (int) Math.round(w * scale));
        int nh = Math.max(1, (int) Math.round(h * scale));
        BufferedImage dst = new BufferedImage(nw, nh, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2 = dst.createGraphics();
        g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g2.drawImage(src, 0, 0, nw, nh, null);
        g2.dispose();
        return dst;
    }
}
