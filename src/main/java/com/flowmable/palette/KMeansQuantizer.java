package com.flowmable.palette;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Bounded k-means color quantization over an interleaved RGBA buffer.
 * <p>
 * Runs a fixed number of refinement passes with no convergence check.
 * Empty clusters keep their centroid and are never reseeded, so a cluster
 * stranded in an early pass stays empty and is dropped from the output.
 * <p>
 * Deterministic given the sampled centroids. Assignment ties resolve to the
 * lowest centroid index; output ties keep centroid index order.
 */
public class KMeansQuantizer {

    private static final Logger logger = LoggerFactory.getLogger(KMeansQuantizer.class);

    static final int CHANNELS = 4;

    private final QuantizerSettings settings;
    private final PixelSampler sampler;

    public KMeansQuantizer() {
        this(QuantizerSettings.DEFAULT, PixelSampler.uniform(new Random()));
    }

    public KMeansQuantizer(QuantizerSettings settings, PixelSampler sampler) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
    }

    public List<PaletteColor> quantize(byte[] pixels) {
        return quantize(pixels, settings.clusterCount());
    }

    /**
     * Quantize an RGBA buffer into at most {@code k} colors.
     *
     * @param pixels Interleaved R,G,B,A bytes; length must be a multiple of 4
     * @param k      Number of clusters; {@code k <= 0} yields an empty list
     * @return Non-empty clusters sorted by population descending; empty when no pixel is opaque
     */
    public List<PaletteColor> quantize(byte[] pixels, int k) {
        Objects.requireNonNull(pixels, "pixels");
        if (pixels.length % CHANNELS != 0) {
            throw new IllegalArgumentException(
                    "RGBA buffer length must be a multiple of 4, got: " + pixels.length);
        }
        int pixelCount = pixels.length / CHANNELS;
        if (k <= 0 || pixelCount == 0) {
            return List.of();
        }

        // 1. Seed centroids from randomly sampled pixels (alpha ignored)
        Rgb[] centroids = new Rgb[k];
        for (int c = 0; c < k; c++) {
            int idx = sampler.nextIndex(pixelCount);
            if (idx < 0 || idx >= pixelCount) {
                throw new IllegalStateException(
                        "Sampler returned index " + idx + " outside [0, " + pixelCount + ")");
            }
            centroids[c] = pixelAt(pixels, idx * CHANNELS);
        }

        // 2. Fixed-iteration refinement
        double[] sums = new double[k * 3];
        int[] counts = new int[k];
        for (int iter = 0; iter < settings.iterations(); iter++) {
            Arrays.fill(sums, 0.0);
            Arrays.fill(counts, 0);
            assign(pixels, centroids, sums, counts);
            for (int c = 0; c < k; c++) {
                if (counts[c] > 0) {
                    centroids[c] = new Rgb(
                            sums[c * 3] / counts[c],
                            sums[c * 3 + 1] / counts[c],
                            sums[c * 3 + 2] / counts[c]);
                }
            }
        }

        // 3. Materialize non-empty clusters
        List<PaletteColor> result = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) continue;
            result.add(PaletteColor.of(centroids[c], counts[c]));
        }

        // List.sort is stable: equal populations keep centroid order
        result.sort(Comparator.comparingInt(PaletteColor::population).reversed());

        if (logger.isDebugEnabled()) {
            int opaque = Arrays.stream(counts).sum();
            logger.debug("Quantized {} opaque of {} pixels into {} clusters ({} empty, k={})",
                    opaque, pixelCount, result.size(), k - result.size(), k);
        }
        return result;
    }

    private void assign(byte[] pixels, Rgb[] centroids, double[] sums, int[] counts) {
        int alphaThreshold = settings.alphaThreshold();
        for (int p = 0; p < pixels.length; p += CHANNELS) {
            if ((pixels[p + 3] & 0xFF) < alphaThreshold) continue;

            int r = pixels[p] & 0xFF;
            int g = pixels[p + 1] & 0xFF;
            int b = pixels[p + 2] & 0xFF;

            double minDist = Double.POSITIVE_INFINITY;
            int nearest = 0;
            for (int c = 0; c < centroids.length; c++) {
                Rgb centroid = centroids[c];
                double dr = r - centroid.r();
                double dg = g - centroid.g();
                double db = b - centroid.b();
                double dist = dr * dr + dg * dg + db * db;
                if (dist < minDist) {
                    minDist = dist;
                    nearest = c;
                }
            }

            sums[nearest * 3] += r;
            sums[nearest * 3 + 1] += g;
            sums[nearest * 3 + 2] += b;
            counts[nearest]++;
        }
    }

    private static Rgb pixelAt(byte[] pixels, int offset) {
        return new Rgb(pixels[offset] & 0xFF, pixels[offset + 1] & 0xFF, pixels[offset + 2] & 0xFF);
    }
}
