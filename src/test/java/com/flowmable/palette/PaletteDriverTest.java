package com.flowmable.palette;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaletteDriverTest {

    @Test
    void report_listsRolesAndSpectrum() throws Exception {
        PaletteColor blue = PaletteColor.of(new Rgb(0, 0, 255), 75);
        PaletteColor gray = PaletteColor.of(new Rgb(128, 128, 128), 25);
        Palette palette = new PaletteClassifier().classify(List.of(blue, gray));

        String report = PaletteDriver.formatReport(Path.of("sample.png"),
                new ExtractionResult(palette, 100, Duration.ofMillis(12)));

        assertTrue(report.contains("sample.png"));
        assertTrue(report.contains("DOMINANT"));
        assertTrue(report.contains("MUTED"));
        assertTrue(report.contains("#0000ff  75.0%"));
        assertTrue(report.contains("#808080  25.0%"));
        assertTrue(report.contains("Time: 12 ms"));
    }
}
