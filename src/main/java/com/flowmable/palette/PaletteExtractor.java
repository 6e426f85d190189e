package com.flowmable.palette;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Top-level entry point for the palette extraction pipeline.
 * <p>
 * Decode → downsample to {@link #TARGET_SIZE} → k-means quantize → classify roles.
 * Holds no per-image state; concurrent callers should each use their own
 * extractor when the sampler is not thread-safe.
 */
public class PaletteExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PaletteExtractor.class);

    /** Longer side of the image after downsampling. */
    public static final int TARGET_SIZE = 128;

    private final KMeansQuantizer quantizer;
    private final PaletteClassifier classifier;

    public PaletteExtractor() {
        this(QuantizerSettings.DEFAULT, ClassificationThresholds.DEFAULT, PixelSampler.uniform(new Random()));
    }

    public PaletteExtractor(QuantizerSettings settings, ClassificationThresholds thresholds, PixelSampler sampler) {
        this(new KMeansQuantizer(settings, sampler), new PaletteClassifier(thresholds));
    }

    public PaletteExtractor(KMeansQuantizer quantizer, PaletteClassifier classifier) {
        this.quantizer = quantizer;
        this.classifier = classifier;
    }

    public ExtractionResult extract(Path imageFile) throws IOException, PaletteUnavailableException {
        BufferedImage image = ImageIO.read(imageFile.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + imageFile);
        }
        return extract(image);
    }

    public ExtractionResult extract(BufferedImage image) throws PaletteUnavailableException {
        long t0 = System.nanoTime();
        byte[] rgba = PixelBuffers.toRgba(image, TARGET_SIZE);
        return extract(rgba, t0);
    }

    /**
     * Extract a palette from an already decoded and downsampled RGBA buffer.
     */
    public ExtractionResult extract(byte[] rgba) throws PaletteUnavailableException {
        return extract(rgba, System.nanoTime());
    }

    private ExtractionResult extract(byte[] rgba, long startNanos) throws PaletteUnavailableException {
        List<PaletteColor> colors = quantizer.quantize(rgba);
        Palette palette;
        try {
            palette = classifier.classify(colors);
        } catch (PaletteUnavailableException e) {
            logger.warn("No palette for {} pixels: {}", rgba.length / KMeansQuantizer.CHANNELS, e.getMessage());
            throw e;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        logger.debug("Extracted {} colors (dominant {}) in {} ms",
                palette.allColors().size(), palette.dominant().hex(), elapsed.toMillis());
        return new ExtractionResult(palette, rgba.length / KMeansQuantizer.CHANNELS, elapsed);
    }
}
