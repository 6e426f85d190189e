package com.flowmable.palette;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * CLI driver that extracts a palette from each image given on the command line.
 * <p>
 * Arguments may be image files or directories (scanned one level deep).
 * Prints role swatches and the population share of every color.
 */
public class PaletteDriver {

    private static final Logger logger = LoggerFactory.getLogger(PaletteDriver.class);

    private static final List<String> IMAGE_EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".gif", ".bmp");
    private static final int BAR_WIDTH = 40;

    public static void main(String[] args) throws IOException {
        if (args.length == 0) {
            System.out.println("Usage: PaletteDriver <image-or-directory>...");
            return;
        }

        List<Path> imageFiles = findImageFiles(args);
        if (imageFiles.isEmpty()) {
            System.out.println("No images found.");
            return;
        }

        PaletteExtractor extractor = new PaletteExtractor();
        int failures = 0;
        for (Path file : imageFiles) {
            try {
                ExtractionResult result = extractor.extract(file);
                System.out.println(formatReport(file, result));
            } catch (IOException | PaletteUnavailableException e) {
                failures++;
                logger.error("Failed to extract palette from {}", file, e);
                System.err.println("✗ " + file.getFileName() + ": " + e.getMessage());
            }
        }

        if (failures > 0) {
            System.exit(1);
        }
    }

    static String formatReport(Path file, ExtractionResult result) {
        Palette palette = result.palette();
        StringBuilder sb = new StringBuilder();
        sb.append("═══════════════════════════════════════════════════════════\n");
        sb.append("  ").append(file.getFileName()).append('\n');
        sb.append("═══════════════════════════════════════════════════════════\n");
        sb.append(String.format(Locale.ROOT, "Pixels: %d  Colors: %d  Time: %d ms%n",
                result.pixelCount(), palette.allColors().size(), result.elapsed().toMillis()));

        sb.append("\n=== Roles ===\n");
        for (Map.Entry<PaletteRole, PaletteColor> role : palette.roles().entrySet()) {
            PaletteColor c = role.getValue();
            sb.append(String.format(Locale.ROOT, "  %-13s %s  H=%5.1f S=%.2f L=%.2f%n",
                    role.getKey(), c.hex(), c.hsl().h(), c.hsl().s(), c.hsl().l()));
        }

        sb.append("\n=== Spectrum ===\n");
        for (PaletteColor c : palette.allColors()) {
            double share = palette.populationShare(c);
            int bar = (int) Math.round(share * BAR_WIDTH);
            sb.append(String.format(Locale.ROOT, "  %s %5.1f%% %s%n",
                    c.hex(), share * 100, "█".repeat(bar)));
        }
        return sb.toString();
    }

    private static List<Path> findImageFiles(String[] args) throws IOException {
        List<Path> files = new ArrayList<>();
        for (String arg : args) {
            Path path = Path.of(arg);
            if (Files.isRegularFile(path)) {
                files.add(path);
            } else if (Files.isDirectory(path)) {
                try (Stream<Path> stream = Files.list(path)) {
                    stream.filter(Files::isRegularFile)
                            .filter(PaletteDriver::isImage)
                            .sorted()
                            .forEach(files::add);
                }
            } else {
                logger.warn("Skipping {}: not a file or directory", path);
            }
        }
        return files;
    }

    private static boolean isImage(Path p) {
        String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(n::endsWith);
    }
}
