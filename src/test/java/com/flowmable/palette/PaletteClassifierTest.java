package com.flowmable.palette;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for role assignment and fallbacks.
 */
class PaletteClassifierTest {

    private final PaletteClassifier classifier = new PaletteClassifier();

    private static PaletteColor color(int r, int g, int b, int population) {
        return PaletteColor.of(new Rgb(r, g, b), population);
    }

    @Test
    void emptyInput_paletteUnavailable() {
        assertThrows(PaletteUnavailableException.class, () -> classifier.classify(List.of()));
    }

    @Test
    void solidRed_accentRolesStayNull() throws Exception {
        PaletteColor red = color(255, 0, 0, 100);
        Palette palette = classifier.classify(List.of(red));

        assertEquals("#ff0000", palette.dominant().hex());
        assertSame(red, palette.dominant());
        assertSame(red, palette.vibrant());
        assertNull(palette.muted());
        assertNull(palette.darkVibrant());
        assertNull(palette.lightVibrant());
        assertEquals(List.of(red), palette.allColors());
    }

    @Test
    void solidGray_vibrantFallsBackToDominant() throws Exception {
        PaletteColor gray = color(128, 128, 128, 50);
        Palette palette = classifier.classify(List.of(gray));

        assertSame(gray, palette.vibrant());
        assertSame(gray, palette.muted());
    }

    @Test
    void noVibrantCandidate_fallsBackToSecondColor() throws Exception {
        PaletteColor gray = color(128, 128, 128, 50);
        PaletteColor black = color(0, 0, 0, 10);
        Palette palette = classifier.classify(List.of(gray, black));

        assertSame(black, palette.vibrant());
    }

    @Test
    void vibrantDominantWithoutCandidate_fallsBackToDominant() throws Exception {
        ClassificationThresholds strict = new ClassificationThresholds(
                0.95, 0.3, 0.8, 0.5, 0.2, 0.4, 0.7, 0.3, 0.2, 0.8);
        PaletteColor brick = color(200, 50, 50, 80);
        PaletteColor gray = color(128, 128, 128, 20);
        assertTrue(brick.vibrant());

        Palette palette = new PaletteClassifier(strict).classify(List.of(brick, gray));
        assertSame(brick, palette.vibrant());
    }

    @Test
    void blueAndNearWhite_lightVibrantIsNearWhite() throws Exception {
        PaletteColor blue = color(0, 0, 255, 70);
        PaletteColor nearWhite = color(240, 240, 250, 30);
        assertTrue(nearWhite.hsl().s() > 0.2);

        Palette palette = classifier.classify(List.of(blue, nearWhite));

        assertSame(blue, palette.dominant());
        assertSame(blue, palette.vibrant());
        assertSame(nearWhite, palette.lightVibrant());
        assertNull(palette.darkVibrant());
        assertNull(palette.muted());
    }

    @Test
    void blueAndPureWhite_noLightVibrant() throws Exception {
        PaletteColor blue = color(0, 0, 255, 70);
        PaletteColor white = color(255, 255, 255, 30);

        Palette palette = classifier.classify(List.of(blue, white));
        assertNull(palette.lightVibrant());
    }

    @Test
    void vibrantScore_saturationCanOutweighPopulation() throws Exception {
        PaletteColor brick = color(200, 50, 50, 100);   // s = 0.6, score 0.9
        PaletteColor red = color(255, 0, 0, 10);        // s = 1.0, score 1.05
        Palette palette = classifier.classify(List.of(brick, red));

        assertSame(red, palette.vibrant());
    }

    @Test
    void vibrantScore_populationCanOutweighSaturation() throws Exception {
        PaletteColor brick = color(200, 50, 50, 100);   // s = 0.6, score 0.9
        PaletteColor rose = color(230, 26, 100, 1);     // s = 0.8, score ~0.80
        Palette palette = classifier.classify(List.of(brick, rose));

        assertSame(brick, palette.vibrant());
    }

    @Test
    void darkVibrant_tieKeepsFirstSeen() throws Exception {
        PaletteColor darkRed = color(100, 0, 0, 10);
        PaletteColor darkBlue = color(0, 0, 100, 10);
        Palette palette = classifier.classify(List.of(darkRed, darkBlue));

        assertSame(darkRed, palette.darkVibrant());
    }

    @Test
    void darkVibrant_prefersLargerPopulation() throws Exception {
        PaletteColor gray = color(128, 128, 128, 60);
        PaletteColor darkRed = color(100, 0, 0, 10);
        PaletteColor darkGreen = color(0, 90, 0, 30);
        Palette palette = classifier.classify(List.of(gray, darkGreen, darkRed));

        assertSame(darkGreen, palette.darkVibrant());
        assertSame(gray, palette.muted());
    }

    @Test
    void muted_excludesNearBlack() throws Exception {
        PaletteColor nearBlack = color(20, 20, 20, 40);
        Palette palette = classifier.classify(List.of(nearBlack));

        assertNull(palette.muted());
    }

    @Test
    void sameInput_sameRoles() throws Exception {
        List<PaletteColor> colors = List.of(
                color(30, 60, 200, 40),
                color(240, 200, 210, 25),
                color(120, 110, 100, 20),
                color(60, 10, 20, 15));

        Palette first = classifier.classify(colors);
        Palette second = classifier.classify(colors);

        assertEquals(first, second);
        assertSame(first.vibrant(), second.vibrant());
        assertSame(first.muted(), second.muted());
        assertSame(first.darkVibrant(), second.darkVibrant());
        assertSame(first.lightVibrant(), second.lightVibrant());
    }

    @Test
    void roles_aliasAllColorsEntries() throws Exception {
        List<PaletteColor> colors = List.of(
                color(30, 60, 200, 40),
                color(240, 200, 210, 25),
                color(120, 110, 100, 20),
                color(60, 10, 20, 15));
        Palette palette = classifier.classify(colors);

        for (PaletteColor role : palette.roles().values()) {
            assertTrue(palette.allColors().stream().anyMatch(c -> c == role));
        }
        Map<PaletteRole, PaletteColor> roles = palette.roles();
        assertEquals(PaletteRole.DOMINANT, roles.keySet().iterator().next());
        assertEquals(40 / 100.0, palette.populationShare(palette.dominant()), 1e-9);
    }
}
